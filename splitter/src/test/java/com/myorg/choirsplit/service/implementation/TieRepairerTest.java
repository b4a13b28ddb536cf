package com.myorg.choirsplit.service.implementation;

import com.myorg.choirsplit.service.TransformationContext;
import com.myorg.choirsplit.service.processing.Spanners;
import com.myorg.choirsplit.service.processing.XmlNodes;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

import java.util.List;

import static com.myorg.choirsplit.ScoreXml.chord;
import static com.myorg.choirsplit.ScoreXml.context;
import static com.myorg.choirsplit.ScoreXml.measure;
import static com.myorg.choirsplit.ScoreXml.part;
import static com.myorg.choirsplit.ScoreXml.rest;
import static com.myorg.choirsplit.ScoreXml.score;
import static com.myorg.choirsplit.ScoreXml.staff;
import static com.myorg.choirsplit.ScoreXml.tiedChord;
import static com.myorg.choirsplit.ScoreXml.voice;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TieRepairerTest {

    private final TieRepairer repairer = new TieRepairer();

    @Test
    void untiedPairOfSameDurationsGetsTheTie() {
        TransformationContext context = twoStaves(
                voice(tiedChord("quarter", 67, "next"), tiedChord("quarter", 67, "prev"), rest("half")),
                voice(chord("quarter", 60), chord("quarter", 60), rest("half")));

        repairer.apply(context);

        List<Element> chords = chordsOf(context.contentStaff(2));
        assertTrue(Spanners.starts(chords.get(0), Spanners.TIE));
        assertTrue(Spanners.ends(chords.get(1), Spanners.TIE));
        assertEquals("60", XmlNodes.childText(XmlNodes.child(chords.get(0), "Note"), "pitch"));
        assertTrue(context.getWarnings().isEmpty());
    }

    @Test
    void differentDurationsAreRefused() {
        TransformationContext context = twoStaves(
                voice(tiedChord("quarter", 67, "next"), tiedChord("quarter", 67, "prev"), rest("half")),
                voice(chord("half", 60), chord("half", 60)));

        repairer.apply(context);

        List<Element> chords = chordsOf(context.contentStaff(2));
        assertFalse(Spanners.has(chords.get(0), Spanners.TIE));
        assertFalse(Spanners.has(chords.get(1), Spanners.TIE));
        assertEquals(1, context.getWarnings().size());
        assertEquals("tie-repair", context.getWarnings().get(0).getStage());
    }

    @Test
    void pitchChangeIsNotTied() {
        TransformationContext context = twoStaves(
                voice(tiedChord("quarter", 67, "next"), tiedChord("quarter", 67, "prev"), rest("half")),
                voice(chord("quarter", 60), chord("quarter", 62), rest("half")));

        repairer.apply(context);

        assertFalse(Spanners.has(chordsOf(context.contentStaff(2)).get(0), Spanners.TIE));
    }

    @Test
    void nothingHappensWithoutTies() {
        TransformationContext context = twoStaves(
                voice(chord("half", 67), chord("half", 67)),
                voice(chord("half", 60), chord("half", 60)));

        repairer.apply(context);

        assertTrue(XmlNodes.descendants(context.getScore(), "Spanner").isEmpty());
        assertTrue(context.getWarnings().isEmpty());
    }

    private static TransformationContext twoStaves(String upperVoice, String lowerVoice) {
        return context(score(List.of(part(1, "S1"), part(2, "S2")),
                List.of(staff(1, measure(upperVoice)), staff(2, measure(lowerVoice)))));
    }

    private static List<Element> chordsOf(Element staff) {
        return XmlNodes.children(XmlNodes.child(XmlNodes.child(staff, "Measure"), "voice"), "Chord");
    }
}
