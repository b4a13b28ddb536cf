package com.myorg.choirsplit.service.implementation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.myorg.choirsplit.config.SplitterProperties;
import com.myorg.choirsplit.metrics.PerfProbe;
import com.myorg.choirsplit.model.PartType;
import com.myorg.choirsplit.model.PipelineWarning;
import com.myorg.choirsplit.model.SplitReport;
import com.myorg.choirsplit.service.JsonlWriter;
import com.myorg.choirsplit.service.LyricCorrector;
import com.myorg.choirsplit.service.ScorePass;
import com.myorg.choirsplit.service.TransformationContext;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One split run: repair, split, detect, collect, filter, tie, classify, exchange lyric
 * positions, redistribute, then write the score and its report.
 */
@Slf4j
public class ScoreSplitPipeline {

    private static final String EXCHANGE_STAGE = "lyric-exchange";
    private static final ObjectMapper REPORT_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final SplitterProperties properties;
    private final LyricCorrector corrector;
    private final MscxDocumentIO io = new MscxDocumentIO();
    private final LyricPositionTsv positions = new LyricPositionTsv();

    private final List<ScorePass> passes = List.of(
            new CorruptedMeasureRepairer(),
            new PartStaffSplitter(),
            new ReversedVoiceDetector(),
            new LyricCollector(),
            new StaffContentFilter(),
            new TieRepairer(),
            new PartTypeInferencer());
    private final ScorePass redistributor = new LyricRedistributor();

    /**
     * @param corrector external lyric correction, or {@code null} to skip it
     */
    public ScoreSplitPipeline(SplitterProperties properties, LyricCorrector corrector) {
        this.properties = properties;
        this.corrector = corrector;
    }

    public SplitReport run(Path input, Path output) throws IOException {
        return run(input, output, null);
    }

    /**
     * Splits {@code input} into {@code output} (defaults to {@code <name>_split.mscx} next to
     * the input) and writes the report files next to the output.
     *
     * @param reference optional document handed to the lyric corrector
     */
    public SplitReport run(Path input, Path output, Path reference) throws IOException {
        if (!Files.exists(input)) {
            throw new FileNotFoundException("Score not found: " + input.toAbsolutePath());
        }
        Path target = output != null ? output : sibling(input, properties.getOutputSuffix() + ".mscx");
        log.info("Splitting {} -> {}", input.toAbsolutePath(), target.toAbsolutePath());

        Document doc = io.load(input);
        TransformationContext context = TransformationContext.create(doc, properties);
        transform(context, input, reference);
        io.save(doc, target);

        SplitReport report = report(context, input, target);
        writeReport(report, target);
        log.info("Completed: staves {} -> {}, lyrics={}, repaired={}, unfixable={}, warnings={} -> {}",
                report.getStavesBefore(), report.getStavesAfter(), report.getLyricCount(),
                report.getRepairedMeasures().size(), report.getUnfixableMeasures().size(),
                report.getWarnings().size(), target);
        return report;
    }

    /**
     * Runs every pass on the context. The lyric position exchange happens only when
     * {@code input} is given, as its files are named after it.
     */
    public void transform(TransformationContext context, Path input, Path reference) throws IOException {
        PerfProbe probe = new PerfProbe(input == null ? "split" : input.getFileName().toString());
        for (ScorePass pass : passes) {
            pass.apply(context);
            probe.mark(pass.name(), context.contentStaves().size());
        }
        if (input != null) {
            exchangeLyricPositions(context, input, reference);
            probe.mark("lyric-exchange", context.getLyricTable().size());
        }
        redistributor.apply(context);
        probe.mark(redistributor.name(), context.contentStaves().size());
        probe.done("split");
    }

    private void exchangeLyricPositions(TransformationContext context, Path input, Path reference) throws IOException {
        Path fixed = sibling(input, properties.getLyricsFixedSuffix());
        if (Files.exists(fixed)) {
            loadCorrected(context, fixed);
            return;
        }
        Path dump = sibling(input, properties.getLyricsDumpSuffix());
        positions.write(dump.toFile(), context.getLyricTable().all());
        if (corrector == null) return;
        try {
            Optional<Path> corrected = corrector.correct(dump, reference);
            if (corrected.isPresent()) {
                loadCorrected(context, corrected.get());
            } else {
                log.info("Lyric corrector returned nothing for {}", dump);
            }
        } catch (IOException | RuntimeException e) {
            context.warn(EXCHANGE_STAGE, null, null, "lyric correction failed, keeping collected lyrics: " + e.getMessage());
        }
    }

    private void loadCorrected(TransformationContext context, Path file) throws IOException {
        context.getLyricTable().replaceWith(positions.read(file.toFile()));
        context.setLyricsCorrected(true);
        log.info("Using corrected lyric positions from {}", file);
    }

    SplitReport report(TransformationContext context, Path input, Path output) {
        Map<Integer, List<Integer>> reversed = new LinkedHashMap<>();
        context.getReversedMeasures().forEach((staff, measures) -> reversed.put(staff, new ArrayList<>(measures)));
        Map<Integer, String> labels = new LinkedHashMap<>();
        for (PartType type : context.getPartTypes().values()) {
            if (type.isClassified()) labels.put(type.getStaffId(), type.label());
        }
        return SplitReport.builder()
                .source(input == null ? null : input.toString())
                .output(output == null ? null : output.toString())
                .stavesBefore(context.getStavesBefore())
                .stavesAfter(context.contentStaves().size())
                .resolution(context.getDurations().getTicksPerWhole())
                .lyricCount(context.getLyricTable().size())
                .lyricsCorrected(context.isLyricsCorrected())
                .staffMapping(new LinkedHashMap<>(context.getStaffMapping()))
                .reversedMeasures(reversed)
                .repairedMeasures(new ArrayList<>(context.getRepairedMeasures()))
                .unfixableMeasures(new ArrayList<>(context.getUnfixableMeasures()))
                .partLabels(labels)
                .warnings(new ArrayList<>(context.getWarnings()))
                .build();
    }

    private void writeReport(SplitReport report, Path output) throws IOException {
        String base = properties.getReportSuffix();
        File json = sibling(output, base + ".json").toFile();
        REPORT_MAPPER.writeValue(json, report);
        log.info("Report written -> {}", json.getAbsolutePath());

        if (properties.isExcelReport()) {
            new ExcelSplitReporter(sibling(output, base + ".xlsx").toFile()).write(report);
        }
        JsonlWriter<PipelineWarning> warnings = new JacksonJsonlWriter<>();
        warnings.write(sibling(output, properties.getWarningsSuffix()).toFile(), report.getWarnings());
    }

    /** {@code dir/name.mscx} + suffix -> {@code dir/name<suffix>}. */
    static Path sibling(Path file, String suffix) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return file.resolveSibling(stem + suffix);
    }
}
