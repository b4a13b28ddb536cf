package com.myorg.choirsplit.service.implementation;

import com.myorg.choirsplit.model.PartType;
import com.myorg.choirsplit.service.ScorePass;
import com.myorg.choirsplit.service.TransformationContext;
import com.myorg.choirsplit.service.processing.XmlNodes;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Names each staff Soprano, Alto, Tenor or Bass from its clef and pitch range, numbers
 * consecutive staves of the same voice type (S1, S2, A1, ...) and writes the result into
 * the parts and clefs.
 */
@Slf4j
public class PartTypeInferencer implements ScorePass {

    @Override
    public String name() {
        return "part-types";
    }

    @Override
    public void apply(TransformationContext context) {
        List<PartType> types = infer(context.contentStaves());
        Map<Integer, PartType> byStaff = context.getPartTypes();
        types.forEach(t -> byStaff.put(t.getStaffId(), t));
        for (PartType type : types) applyToScore(context, type);
        log.info("Part types: {}", types.stream().map(t -> t.getStaffId() + "=" + t.label()).collect(Collectors.toList()));
    }

    /** Classifies the staves, in ascending id order. */
    public List<PartType> infer(List<Element> staves) {
        List<Element> ordered = new ArrayList<>(staves);
        ordered.sort(Comparator.comparingInt(XmlNodes::staffId));

        List<PartType> classified = new ArrayList<>();
        String runName = null;
        int runIndex = 0;
        boolean sopranoSeen = false;
        for (Element staff : ordered) {
            PartType type = classify(staff, sopranoSeen);
            if ("Soprano".equals(type.getPartName())) sopranoSeen = true;
            if (type.getPartName().equals(runName)) {
                runIndex++;
            } else {
                runName = type.getPartName();
                runIndex = 1;
            }
            classified.add(type.toBuilder().partIndex(runIndex).build());
        }
        return classified;
    }

    private PartType classify(Element staff, boolean sopranoSeen) {
        Element clef = XmlNodes.firstDescendant(staff, "Clef");
        String clefType = clef == null ? null : XmlNodes.childText(clef, "concertClefType");
        if (clefType == null || clefType.isEmpty()) clefType = "G";

        int highest = Integer.MIN_VALUE;
        int lowest = Integer.MAX_VALUE;
        for (Element note : XmlNodes.descendants(staff, "Note")) {
            Integer pitch = XmlNodes.childInt(note, "pitch");
            if (pitch == null) continue;
            highest = Math.max(highest, pitch);
            lowest = Math.min(lowest, pitch);
        }
        PartType.PartTypeBuilder type = PartType.builder()
                .staffId(XmlNodes.staffId(staff))
                .clefType(clefType)
                .highestPitch(highest)
                .lowestPitch(lowest);
        if (highest == Integer.MIN_VALUE) return type.build();

        if ("F".equals(clefType)) {
            if (lowest < 50) {
                type.partName("Bass");
            } else if (highest > 65) {
                type.partName("Tenor");
            }
        } else if ("G".equals(clefType)) {
            if (lowest < 55) {
                type.partName("Tenor").clefType("G8vb");
            }
            if (highest > 72) {
                type.partName("Soprano").clefType("G");
            } else if (highest > 68 && sopranoSeen) {
                type.partName("Alto").clefType("G");
            }
        }
        PartType built = type.build();
        return built.toBuilder().partSlug(built.getPartName().isEmpty() ? "" : built.getPartName().substring(0, 1)).build();
    }

    private void applyToScore(TransformationContext context, PartType type) {
        if (!type.isClassified()) return;
        Element part = partOf(context, type.getStaffId());
        if (part != null) {
            XmlNodes.setChildText(part, "trackName", type.label());
            Element instrument = XmlNodes.child(part, "Instrument");
            if (instrument != null) {
                XmlNodes.setChildText(instrument, "longName", type.getPartName() + " " + type.getPartIndex());
                XmlNodes.setChildText(instrument, "shortName", type.label());
            }
        }
        Element staff = context.contentStaff(type.getStaffId());
        Element clef = XmlNodes.firstDescendant(staff, "Clef");
        if (clef != null) {
            XmlNodes.setChildText(clef, "concertClefType", type.getClefType());
            XmlNodes.setChildText(clef, "transposingClefType", type.getClefType());
        }
    }

    static Element partOf(TransformationContext context, int staffId) {
        for (Element part : context.parts()) {
            Element stub = XmlNodes.child(part, "Staff");
            if (stub != null && XmlNodes.staffId(stub) == staffId) return part;
        }
        return null;
    }
}
