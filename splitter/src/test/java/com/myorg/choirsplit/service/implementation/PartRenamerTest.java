package com.myorg.choirsplit.service.implementation;

import com.myorg.choirsplit.exception.ValidationException;
import com.myorg.choirsplit.service.TransformationContext;
import com.myorg.choirsplit.service.processing.XmlNodes;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

import java.util.List;
import java.util.stream.Collectors;

import static com.myorg.choirsplit.ScoreXml.chord;
import static com.myorg.choirsplit.ScoreXml.context;
import static com.myorg.choirsplit.ScoreXml.measure;
import static com.myorg.choirsplit.ScoreXml.part;
import static com.myorg.choirsplit.ScoreXml.rest;
import static com.myorg.choirsplit.ScoreXml.score;
import static com.myorg.choirsplit.ScoreXml.staff;
import static com.myorg.choirsplit.ScoreXml.timeSig;
import static com.myorg.choirsplit.ScoreXml.voice;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PartRenamerTest {

    private final PartRenamer renamer = new PartRenamer();

    @Test
    void shortRunsAreNumberedPlainly() {
        assertEquals(List.of("S1", "S2", "A1", "A2"), shortNames("SSAA"));
        assertEquals("Soprano 2", renamer.names("ssaa").get(1).getFullName());
        assertEquals(List.of("T1", "B1", "M1", "W1"), shortNames("TBMW"));
    }

    @Test
    void longRunsAreNumberedInPairs() {
        assertEquals(List.of("S1-1", "S1-2", "S2-1", "S2-2", "A1", "A2"), shortNames("SSSSAA"));
        assertEquals(List.of("T1-1", "T1-2", "T2"), shortNames("TTT"));
        assertEquals("Tenor 1-2", renamer.names("TTT").get(1).getFullName());
    }

    @Test
    void badPartStringsAreRejected() {
        assertThrows(ValidationException.class, () -> renamer.names(""));
        assertThrows(ValidationException.class, () -> renamer.names("SXA"));
        assertThrows(ValidationException.class, () -> renamer.names(null));
    }

    @Test
    void moreNamesThanPartsIsRejected() {
        TransformationContext context = twoPartsInThreeFour();
        assertThrows(ValidationException.class, () -> renamer.rename(context, "SSA"));
    }

    @Test
    void partsAreRenamedAndClickStaffAppended() {
        TransformationContext context = twoPartsInThreeFour();

        renamer.rename(context, "SA");

        List<Element> parts = context.parts();
        assertEquals(3, parts.size());
        assertEquals("Soprano 1", XmlNodes.childText(parts.get(0), "trackName"));
        Element altoInstrument = XmlNodes.child(parts.get(1), "Instrument");
        assertEquals("Alto 1", XmlNodes.childText(altoInstrument, "longName"));
        assertEquals("A1", XmlNodes.childText(altoInstrument, "shortName"));

        Element click = parts.get(2);
        assertEquals("Click", XmlNodes.childText(click, "trackName"));
        Element stub = XmlNodes.child(click, "Staff");
        assertEquals(3, XmlNodes.staffId(stub));
        assertEquals("50", XmlNodes.childText(stub, "distOffset"));

        Element clickStaff = context.contentStaff(3);
        assertNotNull(clickStaff);
        List<Element> measures = XmlNodes.children(clickStaff, "Measure");
        assertEquals(2, measures.size());
        Element first = XmlNodes.child(measures.get(0), "voice");
        assertEquals(6, XmlNodes.children(first, "Rest").size());
        assertNotNull(XmlNodes.child(first, "TimeSig"));
        assertNull(XmlNodes.child(XmlNodes.child(measures.get(1), "voice"), "TimeSig"));
    }

    @Test
    void existingClickStaffIsRefilled() {
        TransformationContext context = twoPartsInThreeFour();
        renamer.rename(context, "S");
        renamer.rename(context, "S");

        assertEquals(2, context.parts().size());
        Element clickStaff = context.contentStaff(2);
        assertEquals(2, XmlNodes.children(clickStaff, "Measure").size());
        assertEquals(6, XmlNodes.children(XmlNodes.firstDescendant(clickStaff, "voice"), "Rest").size());
        assertEquals("50", XmlNodes.childText(XmlNodes.child(context.parts().get(1), "Staff"), "distOffset"));
    }

    private List<String> shortNames(String partString) {
        return renamer.names(partString).stream()
                .map(PartRenamer.PartName::getShortName)
                .collect(Collectors.toList());
    }

    private static TransformationContext twoPartsInThreeFour() {
        return context(score(List.of(part(1, "Upper"), part(2, "Lower")),
                List.of(staff(1, measure(voice(timeSig(3, 4), chord("half", 72), rest("quarter"))),
                                measure(voice(chord("half", 72), rest("quarter")))),
                        staff(2, measure(voice(timeSig(3, 4), chord("half", 60), rest("quarter"))),
                                measure(voice(chord("half", 60), rest("quarter")))))));
    }
}
