package com.myorg.choirsplit.service.implementation;

import com.myorg.choirsplit.config.SplitterProperties;
import com.myorg.choirsplit.service.TransformationContext;
import com.myorg.choirsplit.service.processing.XmlNodes;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

import java.util.List;
import java.util.stream.Collectors;

import static com.myorg.choirsplit.ScoreXml.chord;
import static com.myorg.choirsplit.ScoreXml.context;
import static com.myorg.choirsplit.ScoreXml.lyric;
import static com.myorg.choirsplit.ScoreXml.measure;
import static com.myorg.choirsplit.ScoreXml.part;
import static com.myorg.choirsplit.ScoreXml.score;
import static com.myorg.choirsplit.ScoreXml.staff;
import static com.myorg.choirsplit.ScoreXml.stem;
import static com.myorg.choirsplit.ScoreXml.timeSig;
import static com.myorg.choirsplit.ScoreXml.voice;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class LyricRedistributorTest {

    private final ScoreSplitPipeline pipeline = new ScoreSplitPipeline(new SplitterProperties(), null);

    @Test
    void eachSplitCopyKeepsOnlyTheLyricsOfItsOwnLine() throws Exception {
        String upper = voice(timeSig(4, 4),
                chord("quarter", 72, stem("up"), lyric("a")),
                chord("quarter", 72, stem("up"), lyric("b")),
                chord("quarter", 72, stem("up"), lyric("c")),
                chord("quarter", 72, stem("up"), lyric("d")));
        String lower = voice(
                chord("half", 60, stem("down")),
                chord("quarter", 60, stem("down"), lyric("x")),
                chord("quarter", 60, stem("down")));
        TransformationContext context = context(score(List.of(part(1, "Choir")),
                List.of(staff(1, measure(upper, lower)))));

        pipeline.transform(context, null, null);

        List<Element> staves = context.contentStaves();
        assertEquals(List.of("a", "b", "c", "d"), texts(staves.get(0)));
        List<Element> lowerChords = XmlNodes.descendants(staves.get(1), "Chord");
        assertNull(text(lowerChords.get(0)));
        assertEquals("x", text(lowerChords.get(1)));
        assertNull(text(lowerChords.get(2)));
    }

    @Test
    void neighbourLyricIsNotRepeatedNextToItsOwnChord() throws Exception {
        String upper = voice(timeSig(4, 4),
                chord("quarter", 72, stem("up"), lyric("a")),
                chord("quarter", 72, stem("up")),
                chord("half", 72, stem("up"), lyric("b")));
        String lower = voice(chord("whole", 60, stem("down")));
        TransformationContext context = context(score(List.of(part(1, "Choir")),
                List.of(staff(1, measure(upper, lower)))));

        pipeline.transform(context, null, null);

        List<Element> chords = XmlNodes.descendants(context.contentStaves().get(0), "Chord");
        assertEquals("a", text(chords.get(0)));
        assertNull(text(chords.get(1)));
        assertEquals("b", text(chords.get(2)));
    }

    @Test
    void neighbourLyricDoesNotReachIntoOtherMeasures() throws Exception {
        TransformationContext context = context(score(List.of(part(1, "Soprano")), List.of(staff(1,
                measure(voice(timeSig(4, 4), chord("whole", 72, lyric("la")))),
                measure(voice(chord("half", 72), chord("half", 74))),
                measure(voice(chord("whole", 72)))))));

        pipeline.transform(context, null, null);

        List<Element> measures = XmlNodes.children(context.contentStaves().get(0), "Measure");
        assertEquals(1, XmlNodes.descendants(measures.get(0), "Lyrics").size());
        assertEquals(0, XmlNodes.descendants(measures.get(1), "Lyrics").size());
        assertEquals(0, XmlNodes.descendants(measures.get(2), "Lyrics").size());
    }

    @Test
    void neighbourInTheSameMeasureFillsChordsWithoutLyric() throws Exception {
        // the second chord may not repeat "ka" next to it, so it takes the following "lu"
        TransformationContext context = context(score(List.of(part(1, "Soprano")), List.of(staff(1,
                measure(voice(timeSig(4, 4),
                        chord("quarter", 72, lyric("ka")),
                        chord("quarter", 72),
                        chord("quarter", 74),
                        chord("quarter", 76, lyric("lu"))))))));

        pipeline.transform(context, null, null);

        List<String> texts = XmlNodes.descendants(context.contentStaves().get(0), "Chord").stream()
                .map(LyricRedistributorTest::text)
                .collect(Collectors.toList());
        assertEquals(List.of("ka", "lu", "ka", "lu"), texts);
    }

    @Test
    void chordsInsideATieLoseTheirLyrics() {
        String tieStart = "<Chord><durationType>half</durationType>" + lyric("long")
                + "<Note><Spanner type=\"Tie\"><Tie/><next><location><fractions>1/2</fractions></location></next></Spanner>"
                + "<pitch>67</pitch></Note></Chord>";
        String tieEnd = "<Chord><durationType>half</durationType>" + lyric("stray")
                + "<Note><Spanner type=\"Tie\"><prev><location><fractions>-1/2</fractions></location></prev></Spanner>"
                + "<pitch>67</pitch></Note></Chord>";
        TransformationContext context = context(score(List.of(part(1, "Choir")),
                List.of(staff(1, measure(voice(timeSig(4, 4), tieStart, tieEnd))))));
        Element staff = context.contentStaves().get(0);

        new LyricRedistributor().clearSpanInteriors(context, staff);

        assertEquals(List.of("long"), texts(staff));
    }

    private static String text(Element chord) {
        Element lyrics = XmlNodes.child(chord, "Lyrics");
        return lyrics == null ? null : XmlNodes.childText(lyrics, "text");
    }

    private static List<String> texts(Element staff) {
        return XmlNodes.descendants(staff, "Lyrics").stream()
                .map(l -> XmlNodes.childText(l, "text"))
                .collect(Collectors.toList());
    }
}
