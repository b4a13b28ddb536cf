package com.myorg.choirsplit.service.implementation;

import com.myorg.choirsplit.model.Lyric;
import com.myorg.choirsplit.service.TransformationContext;
import com.myorg.choirsplit.service.processing.LyricEligibility;
import com.myorg.choirsplit.service.processing.SyllableCodec;
import com.myorg.choirsplit.service.processing.XmlNodes;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-based lyric text, one block per measure:
 * <pre>
 * # Measure 1
 * 1 [5]: tä-mä tes-ti lau-
 * 2 [3]: _ on! _
 * </pre>
 * Each staff line lists the verse-1 syllables of the staff's lyric-eligible chords, joined
 * into words. The bracketed count is the number of chords the line covers.
 */
@Slf4j
public class LyricTextCodec {

    private static final String STAGE = "lyric-import";
    private static final Pattern MEASURE_HEADER = Pattern.compile("#\\s*Measure\\s+(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern STAFF_LABEL = Pattern.compile("^(\\d+)(?:\\s*\\[(\\d+)])?$");

    private final EmptyMeasureFiller filler = new EmptyMeasureFiller();

    public String export(TransformationContext context) {
        List<Element> staves = new ArrayList<>(context.contentStaves());
        staves.sort(Comparator.comparingInt(XmlNodes::staffId));

        Map<Integer, LyricEligibility.Slots> slots = new LinkedHashMap<>();
        int measureCount = 0;
        for (Element staff : staves) {
            slots.put(XmlNodes.staffId(staff), LyricEligibility.of(staff));
            measureCount = Math.max(measureCount, XmlNodes.children(staff, "Measure").size());
        }

        List<String> lines = new ArrayList<>();
        for (int mi = 0; mi < measureCount; mi++) {
            lines.add("# Measure " + (mi + 1));
            for (Map.Entry<Integer, LyricEligibility.Slots> e : slots.entrySet()) {
                List<String> tokens = new ArrayList<>();
                for (Element chord : e.getValue().eligibleIn(mi)) {
                    tokens.add(SyllableCodec.token(LyricElements.firstVerse(chord)));
                }
                lines.add(e.getKey() + " [" + tokens.size() + "]: " + SyllableCodec.merge(tokens));
            }
        }
        return String.join("\n", lines);
    }

    /** 1-based measure number -> staff id -> line. Lines outside a measure block or without a staff label are dropped. */
    public Map<Integer, Map<Integer, TokenLine>> parse(String text) {
        Map<Integer, Map<Integer, TokenLine>> byMeasure = new TreeMap<>();
        Integer measure = null;
        for (String raw : text.split("\\R")) {
            String line = raw.trim();
            if (line.isEmpty()) continue;
            if (line.startsWith("#")) {
                Matcher m = MEASURE_HEADER.matcher(line);
                if (m.lookingAt()) measure = Integer.parseInt(m.group(1));
                continue;
            }
            int colon = line.indexOf(':');
            if (colon < 0 || measure == null) {
                log.debug("Skipping lyric line outside a measure block: {}", line);
                continue;
            }
            Matcher label = STAFF_LABEL.matcher(line.substring(0, colon).trim());
            if (!label.matches()) {
                log.debug("Skipping lyric line without staff label: {}", line);
                continue;
            }
            int staffId = Integer.parseInt(label.group(1));
            Integer declared = label.group(2) == null ? null : Integer.parseInt(label.group(2));
            List<String> tokens = SyllableCodec.tokenize(line.substring(colon + 1));
            byMeasure.computeIfAbsent(measure, k -> new TreeMap<>()).put(staffId, new TokenLine(tokens, declared));
        }
        return byMeasure;
    }

    public void importText(TransformationContext context, String text) {
        apply(context, parse(text));
    }

    /**
     * Writes the given lines into the score. Measures or staves without a line keep their
     * lyrics; ineligible chords lose verse 1; verses 2 and up are removed everywhere.
     */
    public void apply(TransformationContext context, Map<Integer, Map<Integer, TokenLine>> byMeasure) {
        filler.fill(context);
        int written = 0;
        for (Element staff : context.contentStaves()) {
            int staffId = XmlNodes.staffId(staff);
            LyricEligibility.Slots slots = LyricEligibility.of(staff);
            int measureCount = XmlNodes.children(staff, "Measure").size();
            for (int mi = 0; mi < measureCount; mi++) {
                int measureNo = mi + 1;
                TokenLine line = lineOf(byMeasure, measureNo, staffId);
                if (line == null) continue;
                TokenLine previous = lineOf(byMeasure, measureNo - 1, staffId);
                boolean continuation = previous != null && SyllableCodec.endsInsideWord(previous.getTokens());
                List<SyllableCodec.Syllable> syllables = SyllableCodec.toSyllables(line.getTokens(), continuation);
                List<Element> chords = slots.eligibleIn(mi);

                if (line.getDeclaredCount() != null && line.getDeclaredCount() != syllables.size()) {
                    context.warn(STAGE, staffId, mi, "line declares " + line.getDeclaredCount()
                            + " syllables but holds " + syllables.size() + ", skipped");
                    continue;
                }
                if (syllables.size() > chords.size()) {
                    context.warn(STAGE, staffId, mi, syllables.size() + " syllables for "
                            + chords.size() + " chords, skipped");
                    continue;
                }
                for (int i = 0; i < chords.size(); i++) {
                    Element chord = chords.get(i);
                    SyllableCodec.Syllable s = i < syllables.size() ? syllables.get(i) : null;
                    if (s == null || s.isPlaceholder()) {
                        LyricElements.removeFirstVerse(chord);
                    } else {
                        LyricElements.setFirstVerse(chord, s.toLyric());
                        written++;
                    }
                }
            }
            slots.getIneligible().forEach(LyricElements::removeFirstVerse);
        }
        removeLaterVerses(context);
        log.info("Imported {} syllables", written);
    }

    private static TokenLine lineOf(Map<Integer, Map<Integer, TokenLine>> byMeasure, int measureNo, int staffId) {
        Map<Integer, TokenLine> lines = byMeasure.get(measureNo);
        return lines == null ? null : lines.get(staffId);
    }

    private void removeLaterVerses(TransformationContext context) {
        for (Element lyrics : XmlNodes.descendants(context.getScore(), "Lyrics")) {
            Lyric lyric = LyricElements.read(lyrics);
            if (!lyric.isFirstVerse()) XmlNodes.remove(lyrics);
        }
    }

    /** Tokens of one staff in one measure, with the syllable count the line declared, if any. */
    @Getter
    @AllArgsConstructor
    public static class TokenLine {
        private final List<String> tokens;
        private final Integer declaredCount;
    }
}
