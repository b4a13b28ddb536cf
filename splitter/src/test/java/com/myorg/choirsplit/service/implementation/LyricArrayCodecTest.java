package com.myorg.choirsplit.service.implementation;

import com.myorg.choirsplit.model.Lyric;
import com.myorg.choirsplit.model.Syllabic;
import com.myorg.choirsplit.service.TransformationContext;
import com.myorg.choirsplit.service.processing.XmlNodes;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static com.myorg.choirsplit.ScoreXml.chord;
import static com.myorg.choirsplit.ScoreXml.context;
import static com.myorg.choirsplit.ScoreXml.measure;
import static com.myorg.choirsplit.ScoreXml.part;
import static com.myorg.choirsplit.ScoreXml.score;
import static com.myorg.choirsplit.ScoreXml.staff;
import static com.myorg.choirsplit.ScoreXml.voice;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LyricArrayCodecTest {

    private final LyricArrayCodec codec = new LyricArrayCodec();

    @Test
    void lineSpreadsOverConsecutiveMeasures() {
        TransformationContext context = fourQuartersTwice("Sopraano", "Altto");

        codec.importArray(context, "[{\"measure_start\": 1, \"S1\": \"Tä-mä tes-ti lau-lu on nyt\"}]", null);

        List<Element> second = chords(context, 1, 1);
        Lyric lau = LyricElements.firstVerse(second.get(0));
        assertEquals("lau", lau.getText());
        assertEquals(Syllabic.BEGIN, lau.getSyllabic());
        assertEquals("nyt", LyricElements.firstVerse(second.get(3)).getText());
        assertTrue(context.getWarnings().isEmpty());
    }

    @Test
    void partLabelsResolveThroughTheScoreFirst() {
        TransformationContext context = fourQuartersTwice("Alto", "S1");

        codec.importArray(context, "[{\"measure_start\": 2, \"S1\": \"a b c d\"}]", null);

        assertEquals("a", LyricElements.firstVerse(chords(context, 2, 1).get(0)).getText());
        assertNull(LyricElements.firstVerse(chords(context, 1, 1).get(0)));
    }

    @Test
    void numericKeysAreStaffIds() {
        TransformationContext context = fourQuartersTwice("x", "y");

        assertEquals(2, codec.resolvePart(context, "2"));
        assertEquals(3, codec.resolvePart(context, "A1"));
        assertNull(codec.resolvePart(context, "Z9"));
    }

    @Test
    void overflowIsDroppedWithAWarning() {
        TransformationContext context = fourQuartersTwice("x", "y");

        codec.importArray(context, "[{\"measure_start\": 1, \"1\": \"a b c d e\"},"
                + " {\"measure_start\": 2, \"1\": \"f g\"}]", null);

        assertEquals("d", LyricElements.firstVerse(chords(context, 1, 0).get(3)).getText());
        assertEquals("f", LyricElements.firstVerse(chords(context, 1, 1).get(0)).getText());
        assertEquals(1, context.getWarnings().size());
    }

    @Test
    void malformedJsonImportsNothing() {
        TransformationContext context = fourQuartersTwice("x", "y");

        codec.importArray(context, "{ not json", null);

        assertEquals(1, context.getWarnings().size());
        assertTrue(XmlNodes.descendants(context.getScore(), "Lyrics").isEmpty());
    }

    @Test
    void splitDuplicatesLinesOntoConsecutiveStaves() {
        LyricTextCodec.TokenLine s = new LyricTextCodec.TokenLine(List.of("la"), null);
        LyricTextCodec.TokenLine a = new LyricTextCodec.TokenLine(List.of("lo"), null);
        Map<Integer, Map<Integer, LyricTextCodec.TokenLine>> byMeasure = new TreeMap<>();
        byMeasure.put(1, new TreeMap<>(Map.of(1, s, 2, a)));

        Map<Integer, LyricTextCodec.TokenLine> expanded = LyricArrayCodec.applySplit(byMeasure, List.of(1, 2)).get(1);

        assertEquals(List.of(1, 2, 3, 4), List.copyOf(expanded.keySet()));
        assertSame(s, expanded.get(1));
        assertSame(s, expanded.get(2));
        assertSame(a, expanded.get(3));
        assertSame(a, expanded.get(4));
    }

    /** Staves 1 and 2, two measures of four quarter chords each. */
    private static TransformationContext fourQuartersTwice(String firstPart, String secondPart) {
        String quarters = voice(chord("quarter", 60), chord("quarter", 62), chord("quarter", 64), chord("quarter", 65));
        return context(score(List.of(part(1, firstPart), part(2, secondPart)),
                List.of(staff(1, measure(quarters), measure(quarters)),
                        staff(2, measure(quarters), measure(quarters)))));
    }

    private static List<Element> chords(TransformationContext context, int staffId, int measureIndex) {
        Element measure = XmlNodes.children(context.contentStaff(staffId), "Measure").get(measureIndex);
        return XmlNodes.children(XmlNodes.child(measure, "voice"), "Chord");
    }
}
