package com.myorg.choirsplit.service.implementation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.myorg.choirsplit.service.JsonlWriter;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * One JSON object per line; used for the warnings of a run.
 */
@Slf4j
public class JacksonJsonlWriter<T> implements JsonlWriter<T> {

    private static final ObjectWriter OBJECT_WRITER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .writer();

    @Override
    public void write(File outputFile, List<T> data) throws IOException {
        if (outputFile == null) {
            throw new IllegalArgumentException("outputFile must not be null");
        }
        File parent = outputFile.getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            log.warn("Could not create parent directories: {}", parent.getAbsolutePath());
        }

        // written even when empty
        List<T> rows = data == null ? List.of() : data;
        try (BufferedWriter writer = new BufferedWriter(
                new OutputStreamWriter(new FileOutputStream(outputFile), StandardCharsets.UTF_8))) {
            for (T row : rows) {
                writer.write(OBJECT_WRITER.writeValueAsString(row));
                writer.write('\n');
            }
        }
        log.info("JSONL written: {} entries -> {}", rows.size(), outputFile.getAbsolutePath());
    }
}
