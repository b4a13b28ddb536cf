package com.myorg.choirsplit.service.implementation;

import com.myorg.choirsplit.model.PartType;
import com.myorg.choirsplit.service.TransformationContext;
import com.myorg.choirsplit.service.processing.XmlNodes;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

import java.util.List;
import java.util.stream.Collectors;

import static com.myorg.choirsplit.ScoreXml.chord;
import static com.myorg.choirsplit.ScoreXml.clef;
import static com.myorg.choirsplit.ScoreXml.context;
import static com.myorg.choirsplit.ScoreXml.measure;
import static com.myorg.choirsplit.ScoreXml.part;
import static com.myorg.choirsplit.ScoreXml.score;
import static com.myorg.choirsplit.ScoreXml.staff;
import static com.myorg.choirsplit.ScoreXml.voice;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class PartTypeInferencerTest {

    private final PartTypeInferencer inferencer = new PartTypeInferencer();

    @Test
    void indexRestartsWhenTheVoiceTypeChanges() {
        TransformationContext context = context(score(
                List.of(part(1, "a"), part(2, "b"), part(3, "c"), part(4, "d")),
                List.of(range(1, "G", 50, 60),
                        range(2, "G", 52, 62),
                        range(3, "F", 40, 55),
                        range(4, "G", 50, 58))));

        List<PartType> types = inferencer.infer(context.contentStaves());

        assertEquals(List.of("T1", "T2", "B1", "T1"), labels(types));
        assertEquals("G8vb", types.get(0).getClefType());
        assertEquals("F", types.get(2).getClefType());
    }

    @Test
    void altoNeedsASopranoAbove() {
        TransformationContext context = context(score(
                List.of(part(1, "a"), part(2, "b"), part(3, "c")),
                List.of(range(1, "G", 60, 70),
                        range(2, "G", 65, 76),
                        range(3, "G", 60, 70))));

        List<PartType> types = inferencer.infer(context.contentStaves());

        assertFalse(types.get(0).isClassified());
        assertEquals("S1", types.get(1).label());
        assertEquals("A1", types.get(2).label());
    }

    @Test
    void highFClefIsTenor() {
        TransformationContext context = context(score(List.of(part(1, "a")), List.of(range(1, "F", 55, 67))));

        assertEquals("Tenor", inferencer.infer(context.contentStaves()).get(0).getPartName());
    }

    @Test
    void onlyPlainClefsAreClassified() {
        TransformationContext context = context(score(
                List.of(part(1, "a"), part(2, "b")),
                List.of(range(1, "G8vb", 48, 62), range(2, "F8vb", 36, 50))));

        List<PartType> types = inferencer.infer(context.contentStaves());

        assertFalse(types.get(0).isClassified());
        assertEquals("G8vb", types.get(0).getClefType());
        assertFalse(types.get(1).isClassified());
    }

    @Test
    void applyRenamesPartsAndClefs() {
        TransformationContext context = context(score(
                List.of(part(1, "a"), part(2, "b")),
                List.of(range(1, "G", 65, 76), range(2, "G", 48, 62))));

        inferencer.apply(context);

        Element soprano = context.parts().get(0);
        assertEquals("S1", XmlNodes.childText(soprano, "trackName"));
        assertEquals("Soprano 1", XmlNodes.childText(XmlNodes.child(soprano, "Instrument"), "longName"));
        Element tenorClef = XmlNodes.firstDescendant(context.contentStaff(2), "Clef");
        assertEquals("G8vb", XmlNodes.childText(tenorClef, "concertClefType"));
        assertEquals("G8vb", XmlNodes.childText(tenorClef, "transposingClefType"));
        assertEquals("T1", context.getPartTypes().get(2).label());
    }

    private static String range(int staffId, String clefType, int low, int high) {
        return staff(staffId, measure(voice(clef(clefType), chord("half", low), chord("half", high))));
    }

    private static List<String> labels(List<PartType> types) {
        return types.stream().map(PartType::label).collect(Collectors.toList());
    }
}
