package com.myorg.choirsplit.service.implementation;

import com.myorg.choirsplit.config.SplitterProperties;
import com.myorg.choirsplit.exception.ValidationException;
import com.myorg.choirsplit.service.processing.XmlNodes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Element;

import java.io.FileNotFoundException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScoreSplitRunnerTest {

    @TempDir
    Path tmp;

    private final ScoreSplitRunner runner = new ScoreSplitRunner(new SplitterProperties());
    private final MscxDocumentIO io = new MscxDocumentIO();
    private Path score;

    @BeforeEach
    void copyFixture() throws Exception {
        score = tmp.resolve("two_voices.mscx");
        try (InputStream in = getClass().getResourceAsStream("/scores/two_voices.mscx")) {
            Files.copy(in, score);
        }
    }

    @Test
    void splitWritesTheSplitScoreNextToTheInput() throws Exception {
        runner.split(score, null, null);

        Path output = tmp.resolve("two_voices_split.mscx");
        assertTrue(Files.exists(output));
        Element scoreElement = XmlNodes.child(io.load(output).getDocumentElement(), "Score");
        List<Element> staves = XmlNodes.children(scoreElement, "Staff");
        assertEquals(2, staves.size());
        assertEquals(List.of("Hal", "le", "lu", "ja"), texts(staves.get(0)));
        assertTrue(texts(staves.get(1)).isEmpty());
        String json = Files.readString(tmp.resolve("two_voices_split_report.json"));
        assertTrue(json.contains("\"resolution\" : 1920"));
    }

    @Test
    void exportedLyricsListTheUpperLineByMeasure() throws Exception {
        Path out = tmp.resolve("lyrics.txt");

        runner.exportLyrics(score, out);

        List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
        assertEquals("# Measure 1", lines.get(0));
        assertTrue(lines.get(1).startsWith("1 [3]: Hal-le-lu"));
        assertEquals("# Measure 2", lines.get(2));
    }

    @Test
    void importedTextReplacesTheLyrics() throws Exception {
        Path lyrics = tmp.resolve("words.txt");
        Files.writeString(lyrics, "# Measure 1\n1 [3]: A-men _\n# Measure 2\n1 [1]: Oi\n", StandardCharsets.UTF_8);
        Path out = tmp.resolve("imported.mscx");

        runner.importLyrics(lyrics, score, out, List.of());

        Element staff = XmlNodes.child(XmlNodes.child(io.load(out).getDocumentElement(), "Score"), "Staff");
        assertEquals(List.of("A", "men", "Oi"), texts(staff));
    }

    @Test
    void missingLyricFileIsReported() {
        assertThrows(FileNotFoundException.class,
                () -> runner.importLyrics(tmp.resolve("none.txt"), score, tmp.resolve("x.mscx"), List.of()));
    }

    @Test
    void renamePartsWritesInPlaceByDefault() throws Exception {
        runner.renameParts(score, "S", score);

        Element scoreElement = XmlNodes.child(io.load(score).getDocumentElement(), "Score");
        Element first = XmlNodes.children(scoreElement, "Part").get(0);
        assertEquals("Soprano 1", XmlNodes.childText(first, "trackName"));
        assertEquals("S1", XmlNodes.childText(XmlNodes.child(first, "Instrument"), "shortName"));
    }

    @Test
    void staffIdsAcceptCommasAndSeparateArguments() {
        assertEquals(List.of(1, 3, 5), ScoreSplitRunner.parseStaffIds(List.of("1,3", "5")));
        assertTrue(ScoreSplitRunner.parseStaffIds(List.of()).isEmpty());
        assertThrows(ValidationException.class, () -> ScoreSplitRunner.parseStaffIds(List.of("1,x")));
    }

    private static List<String> texts(Element staff) {
        return XmlNodes.descendants(staff, "Lyrics").stream()
                .map(l -> XmlNodes.childText(l, "text"))
                .collect(Collectors.toList());
    }
}
