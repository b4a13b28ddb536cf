package com.myorg.choirsplit.service.implementation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.choirsplit.model.LyricLineRecord;
import com.myorg.choirsplit.service.TransformationContext;
import com.myorg.choirsplit.service.processing.LyricEligibility;
import com.myorg.choirsplit.service.processing.SyllableCodec;
import com.myorg.choirsplit.service.processing.XmlNodes;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Lyric array format: one record per sung line, giving the measure the line starts in
 * and the line's text per part.
 * <pre>
 * [ { "measure_start": 1, "S1": "Tä-mä tes-ti lau-lu on!", "A1": "..." },
 *   { "measure_start": 3, "S1": "O-ma-ni!", "A1": "..." } ]
 * </pre>
 * Each line's syllables are spread over the lyric-eligible chords of the measures from its
 * start up to the next line's start, then imported like the text format.
 */
@Slf4j
public class LyricArrayCodec {

    private static final String STAGE = "lyric-import";
    private static final String MEASURE_START = "measure_start";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final LyricTextCodec textCodec = new LyricTextCodec();

    /** Parses the records; anything but an array whose first record has a measure_start yields none. */
    public List<LyricLineRecord> parse(String json, TransformationContext context) {
        try {
            List<LyricLineRecord> records = MAPPER.readValue(json, new TypeReference<List<LyricLineRecord>>() {});
            if (records == null || records.isEmpty() || records.get(0).getMeasureStart() == null) {
                context.warn(STAGE, null, null, "lyric array has no records with " + MEASURE_START);
                return List.of();
            }
            return records;
        } catch (JsonProcessingException e) {
            context.warn(STAGE, null, null, "unreadable lyric array: " + e.getOriginalMessage());
            return List.of();
        }
    }

    /**
     * @param split staff ids whose lines are sung by two staves after splitting; the id at
     *              position i goes to staves id+i and id+i+1
     */
    public void importArray(TransformationContext context, String json, List<Integer> split) {
        List<LyricLineRecord> records = parse(json, context);
        if (records.isEmpty()) return;

        Map<Integer, Map<Integer, LyricTextCodec.TokenLine>> byMeasure = distribute(context, records);
        if (split != null && !split.isEmpty()) byMeasure = applySplit(byMeasure, split);
        textCodec.apply(context, byMeasure);
    }

    Map<Integer, Map<Integer, LyricTextCodec.TokenLine>> distribute(TransformationContext context,
                                                                    List<LyricLineRecord> records) {
        Map<Integer, LyricEligibility.Slots> slotsByStaff = new LinkedHashMap<>();
        for (Element staff : context.contentStaves()) {
            slotsByStaff.put(XmlNodes.staffId(staff), LyricEligibility.of(staff));
        }

        Map<Integer, Map<Integer, LyricTextCodec.TokenLine>> byMeasure = new TreeMap<>();
        for (String partKey : records.get(0).getParts().keySet()) {
            Integer staffId = resolvePart(context, partKey);
            if (staffId == null || !slotsByStaff.containsKey(staffId)) {
                context.warn(STAGE, null, null, "part '" + partKey + "' matches no staff, skipped");
                continue;
            }
            LyricEligibility.Slots slots = slotsByStaff.get(staffId);

            List<LyricLineRecord> lines = new ArrayList<>();
            for (LyricLineRecord r : records) {
                if (r.getMeasureStart() != null) lines.add(r);
            }
            lines.sort(Comparator.comparingInt(LyricLineRecord::getMeasureStart));

            boolean continuation = false;
            for (int li = 0; li < lines.size(); li++) {
                LyricLineRecord line = lines.get(li);
                int start = line.getMeasureStart();
                int end = li + 1 < lines.size() ? lines.get(li + 1).getMeasureStart() : slots.measureCount() + 1;
                List<String> tokens = SyllableCodec.tokenize(line.getParts().getOrDefault(partKey, ""));
                List<SyllableCodec.Syllable> syllables = SyllableCodec.toSyllables(tokens, continuation);
                continuation = SyllableCodec.endsInsideWord(tokens);

                int offset = 0;
                for (int measureNo = start; measureNo < end && offset < syllables.size(); measureNo++) {
                    int free = slots.count(measureNo - 1);
                    if (free <= 0) continue;
                    List<SyllableCodec.Syllable> chunk =
                            syllables.subList(offset, Math.min(syllables.size(), offset + free));
                    offset += chunk.size();
                    byMeasure.computeIfAbsent(measureNo, k -> new TreeMap<>())
                            .put(staffId, new LyricTextCodec.TokenLine(SyllableCodec.toTokens(chunk), null));
                }
                if (offset < syllables.size()) {
                    context.warn(STAGE, staffId, start - 1, (syllables.size() - offset)
                            + " syllables of the line starting in measure " + start + " did not fit, dropped");
                }
            }
        }
        return byMeasure;
    }

    /** Numeric keys are staff ids; labels are looked up in the score's part names, then in the configured table. */
    Integer resolvePart(TransformationContext context, String key) {
        if (key.chars().allMatch(Character::isDigit) && !key.isEmpty()) {
            return Integer.parseInt(key);
        }
        for (Element part : context.parts()) {
            Element stub = XmlNodes.child(part, "Staff");
            if (stub == null) continue;
            Element instrument = XmlNodes.child(part, "Instrument");
            if (key.equals(XmlNodes.childText(part, "trackName"))
                    || key.equals(XmlNodes.childText(instrument, "shortName"))) {
                return XmlNodes.staffId(stub);
            }
        }
        return context.getProperties().getPartLabels().get(key);
    }

    static Map<Integer, Map<Integer, LyricTextCodec.TokenLine>> applySplit(
            Map<Integer, Map<Integer, LyricTextCodec.TokenLine>> byMeasure, List<Integer> split) {
        Map<Integer, Map<Integer, LyricTextCodec.TokenLine>> out = new TreeMap<>();
        byMeasure.forEach((measure, lines) -> {
            Map<Integer, LyricTextCodec.TokenLine> expanded = new TreeMap<>();
            lines.forEach((staffId, line) -> {
                int i = split.indexOf(staffId);
                if (i < 0) {
                    expanded.put(staffId, line);
                } else {
                    expanded.put(staffId + i, line);
                    expanded.put(staffId + i + 1, line);
                }
            });
            out.put(measure, expanded);
        });
        return out;
    }
}
