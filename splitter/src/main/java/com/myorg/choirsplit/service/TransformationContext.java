package com.myorg.choirsplit.service;

import com.myorg.choirsplit.config.SplitterProperties;
import com.myorg.choirsplit.exception.ScoreStructureException;
import com.myorg.choirsplit.model.PartType;
import com.myorg.choirsplit.model.PipelineWarning;
import com.myorg.choirsplit.service.processing.DurationResolver;
import com.myorg.choirsplit.service.processing.LyricTable;
import com.myorg.choirsplit.service.processing.TreeWalker;
import com.myorg.choirsplit.service.processing.XmlNodes;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Everything one split run knows about its document: the staff mapping produced by
 * splitting, reversed-voice flags, collected lyrics, inferred part types, repair
 * outcome and warnings. Created per document, never shared between runs.
 */
@Slf4j
@Getter
public class TransformationContext {

    private final Document document;
    private final Element score;
    private final SplitterProperties properties;
    private final DurationResolver durations;
    private final TreeWalker walker;
    private final int stavesBefore;

    // split staff id -> duplicate id, ascending
    private final Map<Integer, Integer> staffMapping = new LinkedHashMap<>();
    // original staff id -> measure indexes whose voices are stem-reversed
    private final Map<Integer, Set<Integer>> reversedMeasures = new TreeMap<>();
    private final LyricTable lyricTable = new LyricTable();
    private final Map<Integer, PartType> partTypes = new LinkedHashMap<>();
    private final Set<Integer> repairedMeasures = new TreeSet<>();
    private final Set<Integer> unfixableMeasures = new TreeSet<>();
    private final List<PipelineWarning> warnings = new ArrayList<>();

    @Setter
    private boolean lyricsCorrected;

    private TransformationContext(Document document, Element score, SplitterProperties properties) {
        this.document = document;
        this.score = score;
        this.properties = properties;
        this.durations = DurationResolver.forDocument(document, properties.getDefaultResolution());
        this.walker = new TreeWalker(durations);
        this.stavesBefore = contentStaves().size();
    }

    /**
     * Checks the nodes every pass relies on and wraps the document.
     *
     * @throws ScoreStructureException naming the first missing node
     */
    public static TransformationContext create(Document document, SplitterProperties properties) {
        Element root = document.getDocumentElement();
        if (root == null) {
            throw new ScoreStructureException("museScore", "Document is empty");
        }
        Element score = "Score".equals(root.getTagName()) ? root : XmlNodes.child(root, "Score");
        if (score == null) {
            throw new ScoreStructureException("museScore/Score", "Document has no score");
        }
        if (XmlNodes.children(score, "Part").isEmpty()) {
            throw new ScoreStructureException("museScore/Score/Part", "Score declares no parts");
        }
        boolean hasMeasures = XmlNodes.children(score, "Staff").stream()
                .anyMatch(s -> XmlNodes.hasChild(s, "Measure"));
        if (!hasMeasures) {
            throw new ScoreStructureException("museScore/Score/Staff/Measure", "Score has no staff content");
        }
        return new TransformationContext(document, score, properties);
    }

    /** Staves that hold measures, as opposed to the stubs nested in parts. */
    public List<Element> contentStaves() {
        List<Element> out = new ArrayList<>();
        for (Element staff : XmlNodes.children(score, "Staff")) {
            if (XmlNodes.hasChild(staff, "Measure")) out.add(staff);
        }
        return out;
    }

    public Element contentStaff(int staffId) {
        for (Element staff : contentStaves()) {
            if (XmlNodes.staffId(staff) == staffId) return staff;
        }
        return null;
    }

    public List<Element> parts() {
        return XmlNodes.children(score, "Part");
    }

    public boolean isDuplicate(int staffId) {
        return staffMapping.containsValue(staffId);
    }

    /** The split staff a duplicate was copied from; any other id maps to itself. */
    public int originalStaffId(int staffId) {
        for (Map.Entry<Integer, Integer> e : staffMapping.entrySet()) {
            if (e.getValue() == staffId) return e.getKey();
        }
        return staffId;
    }

    public void markReversed(int originalStaffId, int measureIndex) {
        reversedMeasures.computeIfAbsent(originalStaffId, k -> new TreeSet<>()).add(measureIndex);
    }

    public boolean isReversed(int originalStaffId, int measureIndex) {
        Set<Integer> measures = reversedMeasures.get(originalStaffId);
        return measures != null && measures.contains(measureIndex);
    }

    public void warn(String stage, Integer staffId, Integer measureIndex, String message) {
        log.warn("[{}] staff={} measure={}: {}", stage, staffId, measureIndex, message);
        warnings.add(PipelineWarning.builder()
                .stage(stage)
                .staffId(staffId)
                .measureIndex(measureIndex)
                .message(message)
                .build());
    }
}
