package com.myorg.choirsplit.controller;

import com.myorg.choirsplit.config.SplitterProperties;
import com.myorg.choirsplit.config.StorageProperties;
import com.myorg.choirsplit.exception.ValidationException;
import com.myorg.choirsplit.model.SplitReport;
import com.myorg.choirsplit.service.TransformationContext;
import com.myorg.choirsplit.service.implementation.LyricArrayCodec;
import com.myorg.choirsplit.service.implementation.LyricTextCodec;
import com.myorg.choirsplit.service.implementation.MscxDocumentIO;
import com.myorg.choirsplit.service.implementation.ScoreSplitPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/score")
public class ScoreSplitController {

    private static final Logger PerfLogger = LoggerFactory.getLogger("performance");

    private final StorageProperties storageProperties;
    private final SplitterProperties splitterProperties;
    private final MscxDocumentIO io = new MscxDocumentIO();

    /**
     * Stores the upload under the storage base path and splits it there. An optional
     * {@code lyrics} TSV is stored as the corrected lyric table of the run.
     */
    @PostMapping("/split")
    public ResponseEntity<SplitReport> split(@RequestParam("file") MultipartFile file,
                                             @RequestParam(value = "lyrics", required = false) MultipartFile lyrics)
            throws IOException {
        String name = requireScore(file);
        long jobStart = System.nanoTime();

        Path outDir = outDir();
        Files.createDirectories(outDir);
        Path input = outDir.resolve(name);
        try (InputStream in = file.getInputStream()) {
            Files.copy(in, input, StandardCopyOption.REPLACE_EXISTING);
        }
        if (lyrics != null && !lyrics.isEmpty()) {
            Path fixed = outDir.resolve(stem(name) + splitterProperties.getLyricsFixedSuffix());
            try (InputStream in = lyrics.getInputStream()) {
                Files.copy(in, fixed, StandardCopyOption.REPLACE_EXISTING);
            }
        }

        SplitReport report = new ScoreSplitPipeline(splitterProperties, null).run(input, null);
        PerfLogger.info("Split request complete: {} in {} ms", name, msSince(jobStart));
        return ResponseEntity.ok(report);
    }

    @GetMapping("/results/{name}")
    public ResponseEntity<FileSystemResource> result(@PathVariable("name") String name) {
        String safe = Path.of(name).getFileName().toString();
        if (!safe.equals(name) || name.startsWith(".")) {
            throw new ValidationException("Invalid result name: " + name);
        }
        File f = outDir().resolve(safe).toFile();
        if (!f.exists()) return ResponseEntity.notFound().build();

        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + safe + "\"")
                .body(new FileSystemResource(f));
    }

    @PostMapping(value = "/lyrics/export", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> exportLyrics(@RequestParam("file") MultipartFile file) throws IOException {
        TransformationContext context = open(file);
        return ResponseEntity.ok()
                .contentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8))
                .body(new LyricTextCodec().export(context));
    }

    /**
     * Imports a lyric text ({@code .txt}) or lyric array ({@code .json}) file into the score
     * and returns the updated score. {@code split} only applies to the array format.
     */
    @PostMapping("/lyrics/import")
    public ResponseEntity<byte[]> importLyrics(@RequestParam("file") MultipartFile file,
                                               @RequestParam("lyrics") MultipartFile lyrics,
                                               @RequestParam(value = "split", required = false) List<Integer> split)
            throws IOException {
        if (lyrics == null || lyrics.isEmpty()) {
            throw new ValidationException("Please upload a non-empty lyrics file.");
        }
        String lyricsName = lyrics.getOriginalFilename() == null ? "" : lyrics.getOriginalFilename().toLowerCase(Locale.ROOT);
        boolean array = lyricsName.endsWith(".json");
        if (!array && !lyricsName.endsWith(".txt")) {
            throw new ValidationException("Lyrics must be a .txt or .json file.");
        }

        TransformationContext context = open(file);
        String content = new String(lyrics.getBytes(), StandardCharsets.UTF_8);
        if (array) {
            new LyricArrayCodec().importArray(context, content, split);
        } else {
            new LyricTextCodec().importText(context, content);
        }

        String name = file.getOriginalFilename();
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_XML)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + name + "\"")
                .header("X-Lyric-Warnings", String.valueOf(context.getWarnings().size()))
                .body(io.toBytes(context.getDocument()));
    }

    // ===== Helpers =====

    private TransformationContext open(MultipartFile file) throws IOException {
        String name = requireScore(file);
        try (InputStream in = file.getInputStream()) {
            return TransformationContext.create(io.load(in, name), splitterProperties);
        }
    }

    private String requireScore(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new ValidationException("Please upload a non-empty .mscx score.");
        }
        String originalName = file.getOriginalFilename();
        if (originalName == null || originalName.isBlank()) {
            throw new ValidationException("Uploaded file has no filename.");
        }
        String name = Path.of(originalName).getFileName().toString();
        if (!name.toLowerCase(Locale.ROOT).endsWith(".mscx")) {
            throw new ValidationException("Only uncompressed .mscx scores are accepted.");
        }
        return name;
    }

    private Path outDir() {
        return Path.of(storageProperties.getBasePath()).toAbsolutePath().normalize();
    }

    private static String stem(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static long msSince(long nano) {
        return Duration.ofNanos(System.nanoTime() - nano).toMillis();
    }
}
