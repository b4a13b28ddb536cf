package com.myorg.choirsplit;

import com.myorg.choirsplit.config.SplitterProperties;
import com.myorg.choirsplit.service.TransformationContext;
import com.myorg.choirsplit.service.implementation.MscxDocumentIO;
import org.w3c.dom.Document;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds small .mscx documents for tests. Scores carry no Division, so durations resolve at
 * the default 128 ticks per whole note (quarter = 32).
 */
public final class ScoreXml {

    private ScoreXml() {}

    public static String score(List<String> parts, List<String> staves) {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
                + "<museScore version=\"3.02\"><Score>"
                + String.join("", parts)
                + String.join("", staves)
                + "</Score></museScore>";
    }

    public static String part(int staffId, String trackName) {
        return "<Part><Staff id=\"" + staffId + "\"><StaffType group=\"pitched\"><name>stdNormal</name></StaffType>"
                + "<bracket type=\"1\" span=\"2\" col=\"0\"/><barLineSpan>2</barLineSpan></Staff>"
                + "<trackName>" + trackName + "</trackName>"
                + "<Instrument><longName>" + trackName + "</longName><shortName>" + trackName + "</shortName>"
                + "<trackName>" + trackName + "</trackName></Instrument></Part>";
    }

    public static String staff(int id, String... measures) {
        return "<Staff id=\"" + id + "\">" + join(measures) + "</Staff>";
    }

    public static String measure(String... voices) {
        return "<Measure>" + join(voices) + "</Measure>";
    }

    public static String measureWithLen(String len, String... voices) {
        return "<Measure len=\"" + len + "\">" + join(voices) + "</Measure>";
    }

    public static String voice(String... events) {
        return "<voice>" + join(events) + "</voice>";
    }

    public static String timeSig(int n, int d) {
        return "<TimeSig><sigN>" + n + "</sigN><sigD>" + d + "</sigD></TimeSig>";
    }

    public static String clef(String type) {
        return "<Clef><concertClefType>" + type + "</concertClefType><transposingClefType>" + type
                + "</transposingClefType></Clef>";
    }

    /** A chord with one note; {@code extras} (stem, lyrics, dots) go before the note. */
    public static String chord(String durationType, int pitch, String... extras) {
        return "<Chord>" + join(extras) + "<durationType>" + durationType + "</durationType>"
                + note(pitch) + "</Chord>";
    }

    public static String chordOfNotes(String durationType, int... pitches) {
        String notes = Arrays.stream(pitches).mapToObj(ScoreXml::note).collect(Collectors.joining());
        return "<Chord><durationType>" + durationType + "</durationType>" + notes + "</Chord>";
    }

    /** A chord whose note carries a Tie end: {@code marker} is "next" (starts) or "prev" (ends). */
    public static String tiedChord(String durationType, int pitch, String marker) {
        return "<Chord><durationType>" + durationType + "</durationType><Note>"
                + "<Spanner type=\"Tie\"><Tie/><" + marker + "><location><fractions>1/4</fractions></location></"
                + marker + "></Spanner><pitch>" + pitch + "</pitch></Note></Chord>";
    }

    public static String rest(String durationType) {
        return "<Rest><durationType>" + durationType + "</durationType></Rest>";
    }

    public static String stem(String direction) {
        return "<StemDirection>" + direction + "</StemDirection>";
    }

    public static String lyric(String text) {
        return "<Lyrics><text>" + text + "</text></Lyrics>";
    }

    public static String lyric(String text, String syllabic, String verse) {
        return "<Lyrics>" + (verse == null ? "" : "<no>" + verse + "</no>")
                + (syllabic == null ? "" : "<syllabic>" + syllabic + "</syllabic>")
                + "<text>" + text + "</text></Lyrics>";
    }

    private static String note(int pitch) {
        return "<Note><pitch>" + pitch + "</pitch></Note>";
    }

    public static Document parse(String xml) {
        try {
            return new MscxDocumentIO().load(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), "test.mscx");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static TransformationContext context(String xml) {
        return TransformationContext.create(parse(xml), new SplitterProperties());
    }

    private static String join(String... parts) {
        return String.join("", parts);
    }
}
