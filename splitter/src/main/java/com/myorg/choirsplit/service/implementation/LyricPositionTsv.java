package com.myorg.choirsplit.service.implementation;

import com.myorg.choirsplit.model.Lyric;
import com.myorg.choirsplit.model.LyricOccurrence;
import com.myorg.choirsplit.model.Syllabic;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Tab-separated dump of the lyric table, one lyric per row:
 * {@code staff_id measure_index voice_index time_pos text syllabic no}.
 * Written before external correction, read back from the corrected copy.
 */
@Slf4j
public class LyricPositionTsv {

    static final String HEADER = String.join("\t",
            "staff_id", "measure_index", "voice_index", "time_pos", "text", "syllabic", "no");

    public void write(File outputFile, List<LyricOccurrence> occurrences) throws IOException {
        File parent = outputFile.getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            log.warn("Could not create parent directories: {}", parent.getAbsolutePath());
        }
        try (BufferedWriter writer = new BufferedWriter(
                new OutputStreamWriter(new FileOutputStream(outputFile), StandardCharsets.UTF_8))) {
            writer.write(HEADER);
            writer.write('\n');
            for (LyricOccurrence o : occurrences) {
                Lyric l = o.getLyric();
                writer.write(String.join("\t",
                        String.valueOf(o.getStaffId()),
                        String.valueOf(o.getMeasureIndex()),
                        String.valueOf(o.getLine()),
                        String.valueOf(o.getTimePos()),
                        clean(l.getText()),
                        l.getSyllabic().xmlName(),
                        clean(l.getVerse())));
                writer.write('\n');
            }
        }
        log.info("Lyric positions written: {} rows -> {}", occurrences.size(), outputFile.getAbsolutePath());
    }

    /** Reads a dump; rows that do not parse are logged and skipped. */
    public List<LyricOccurrence> read(File inputFile) throws IOException {
        if (!inputFile.exists()) {
            throw new FileNotFoundException("Lyric table not found: " + inputFile.getAbsolutePath());
        }
        List<LyricOccurrence> out = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(new FileInputStream(inputFile), StandardCharsets.UTF_8))) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (lineNo == 1 && line.startsWith("staff_id")) continue;
                if (line.isBlank()) continue;
                String[] cols = line.split("\t", -1);
                if (cols.length < 6) {
                    log.warn("{}:{} has {} columns, skipped", inputFile.getName(), lineNo, cols.length);
                    continue;
                }
                try {
                    out.add(LyricOccurrence.builder()
                            .staffId(Integer.parseInt(cols[0].trim()))
                            .measureIndex(Integer.parseInt(cols[1].trim()))
                            .line(Integer.parseInt(cols[2].trim()))
                            .timePos(Integer.parseInt(cols[3].trim()))
                            .lyric(Lyric.builder()
                                    .text(cols[4])
                                    .syllabic(Syllabic.fromXml(cols[5]))
                                    .verse(cols.length > 6 ? cols[6].trim() : "")
                                    .build())
                            .build());
                } catch (NumberFormatException e) {
                    log.warn("{}:{} is not a lyric row ({}), skipped", inputFile.getName(), lineNo, e.getMessage());
                }
            }
        }
        log.info("Lyric positions read: {} rows <- {}", out.size(), inputFile.getAbsolutePath());
        return out;
    }

    private static String clean(String s) {
        return s == null ? "" : s.replace('\t', ' ').replace('\n', ' ');
    }
}
