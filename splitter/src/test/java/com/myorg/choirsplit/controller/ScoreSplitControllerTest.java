package com.myorg.choirsplit.controller;

import com.myorg.choirsplit.config.SplitterProperties;
import com.myorg.choirsplit.config.StorageProperties;
import com.myorg.choirsplit.exception.ValidationException;
import com.myorg.choirsplit.model.SplitReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.myorg.choirsplit.ScoreXml.chord;
import static com.myorg.choirsplit.ScoreXml.lyric;
import static com.myorg.choirsplit.ScoreXml.measure;
import static com.myorg.choirsplit.ScoreXml.part;
import static com.myorg.choirsplit.ScoreXml.rest;
import static com.myorg.choirsplit.ScoreXml.score;
import static com.myorg.choirsplit.ScoreXml.staff;
import static com.myorg.choirsplit.ScoreXml.stem;
import static com.myorg.choirsplit.ScoreXml.timeSig;
import static com.myorg.choirsplit.ScoreXml.voice;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScoreSplitControllerTest {

    @TempDir
    Path tmp;

    private ScoreSplitController controller;

    @BeforeEach
    void setUp() {
        StorageProperties storage = new StorageProperties();
        storage.setBasePath(tmp.toString());
        controller = new ScoreSplitController(storage, new SplitterProperties());
    }

    @Test
    void splitStoresTheUploadAndReturnsTheReport() throws Exception {
        ResponseEntity<SplitReport> response = controller.split(upload("song.mscx", twoVoiceScore()), null);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        SplitReport report = response.getBody();
        assertNotNull(report);
        assertEquals(2, report.getStavesAfter());
        assertTrue(Files.exists(tmp.resolve("song.mscx")));
        assertTrue(Files.exists(tmp.resolve("song_split.mscx")));
    }

    @Test
    void splitResultCanBeDownloaded() throws Exception {
        controller.split(upload("song.mscx", twoVoiceScore()), null);

        ResponseEntity<FileSystemResource> response = controller.result("song_split.mscx");

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertTrue(response.getBody().exists());
        assertEquals(HttpStatus.NOT_FOUND, controller.result("other_split.mscx").getStatusCode());
    }

    @Test
    void uploadedLyricTableIsUsedAsCorrection() throws Exception {
        MockMultipartFile fixed = new MockMultipartFile("lyrics", "fixed.tsv", "text/tab-separated-values",
                "staff_id\tmeasure_index\tvoice_index\ttime_pos\ttext\tsyllabic\tno\n1\t0\t0\t0\tlo\tsingle\t\n"
                        .getBytes(StandardCharsets.UTF_8));

        SplitReport report = controller.split(upload("song.mscx", twoVoiceScore()), fixed).getBody();

        assertTrue(report.getLyricsCorrected());
        assertTrue(Files.exists(tmp.resolve("song_lyrics_fixed.tsv")));
    }

    @Test
    void onlyMscxUploadsAreAccepted() {
        assertThrows(ValidationException.class, () -> controller.split(upload("song.mscz", twoVoiceScore()), null));
        assertThrows(ValidationException.class, () -> controller.split(upload("song.mscx", ""), null));
    }

    @Test
    void resultNamesCannotLeaveTheStorageDirectory() {
        assertThrows(ValidationException.class, () -> controller.result("../x"));
        assertThrows(ValidationException.class, () -> controller.result(".hidden"));
    }

    @Test
    void exportReturnsLyricText() throws Exception {
        String text = controller.exportLyrics(upload("song.mscx", oneVoiceScore())).getBody();

        assertNotNull(text);
        assertTrue(text.startsWith("# Measure 1"));
    }

    @Test
    void importReturnsTheUpdatedScore() throws Exception {
        MockMultipartFile lyrics = new MockMultipartFile("lyrics", "words.txt", "text/plain",
                "# Measure 1\n1 [4]: Hal-le-lu-ja".getBytes(StandardCharsets.UTF_8));

        ResponseEntity<byte[]> response = controller.importLyrics(upload("song.mscx", oneVoiceScore()), lyrics, null);

        String xml = new String(response.getBody(), StandardCharsets.UTF_8);
        assertTrue(xml.contains("<text>Hal</text>"));
        assertTrue(xml.contains("<text>ja</text>"));
        assertEquals("0", response.getHeaders().getFirst("X-Lyric-Warnings"));
    }

    @Test
    void importRejectsUnknownLyricFormats() {
        MockMultipartFile lyrics = new MockMultipartFile("lyrics", "words.doc", "application/msword",
                "x".getBytes(StandardCharsets.UTF_8));

        assertThrows(ValidationException.class,
                () -> controller.importLyrics(upload("song.mscx", oneVoiceScore()), lyrics, null));
    }

    private static MockMultipartFile upload(String name, String xml) {
        return new MockMultipartFile("file", name, "application/xml", xml.getBytes(StandardCharsets.UTF_8));
    }

    private static String oneVoiceScore() {
        String v = voice(timeSig(4, 4),
                chord("quarter", 67), chord("quarter", 67), chord("quarter", 69), chord("quarter", 71));
        return score(List.of(part(1, "Soprano")), List.of(staff(1, measure(v))));
    }

    private static String twoVoiceScore() {
        String upper = voice(timeSig(4, 4),
                chord("quarter", 72, stem("up"), lyric("la")),
                chord("quarter", 72, stem("up")),
                chord("quarter", 72, stem("up")),
                chord("quarter", 72, stem("up")));
        String lower = voice(rest("quarter"),
                chord("quarter", 60, stem("down")),
                chord("quarter", 60, stem("down")),
                chord("quarter", 60, stem("down")));
        return score(List.of(part(1, "Women")), List.of(staff(1, measure(upper, lower))));
    }
}
