package com.myorg.choirsplit.service.implementation;

import com.myorg.choirsplit.config.SplitterProperties;
import com.myorg.choirsplit.exception.ScoreStructureException;
import com.myorg.choirsplit.exception.ValidationException;
import com.myorg.choirsplit.service.TransformationContext;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Command-line entry point.
 * <pre>
 * split         &lt;input.mscx&gt; [output.mscx] [reference]
 * export-lyrics &lt;score.mscx&gt; &lt;out.txt&gt;
 * import-lyrics &lt;lyrics.txt|lyrics.json&gt; &lt;in.mscx&gt; &lt;out.mscx&gt; [split staff ids...]
 * rename-parts  &lt;score.mscx&gt; &lt;PARTS&gt; [output.mscx]
 * </pre>
 */
@Slf4j
public class ScoreSplitRunner {

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage: ScoreSplitRunner <command> ...",
            "  split <input.mscx> [output.mscx] [reference]",
            "  export-lyrics <score.mscx> <out.txt>",
            "  import-lyrics <lyrics.txt|lyrics.json> <in.mscx> <out.mscx> [split staff ids...]",
            "  rename-parts <score.mscx> <PARTS> [output.mscx]");

    private final SplitterProperties properties;
    private final MscxDocumentIO io = new MscxDocumentIO();

    public ScoreSplitRunner(SplitterProperties properties) {
        this.properties = properties;
    }

    public void split(Path input, Path output, Path reference) throws IOException {
        new ScoreSplitPipeline(properties, null).run(input, output, reference);
    }

    public void exportLyrics(Path score, Path output) throws IOException {
        TransformationContext context = open(score);
        String text = new LyricTextCodec().export(context);
        Files.writeString(output, text + "\n", StandardCharsets.UTF_8);
        log.info("Lyrics exported: {} -> {}", score, output);
    }

    public void importLyrics(Path lyrics, Path input, Path output, List<Integer> split) throws IOException {
        if (!Files.exists(lyrics)) {
            throw new FileNotFoundException("Lyrics not found: " + lyrics.toAbsolutePath());
        }
        TransformationContext context = open(input);
        String content = Files.readString(lyrics, StandardCharsets.UTF_8);
        String name = lyrics.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".json")) {
            new LyricArrayCodec().importArray(context, content, split);
        } else {
            if (split != null && !split.isEmpty()) {
                log.warn("Split staff ids only apply to the array format, ignoring {}", split);
            }
            new LyricTextCodec().importText(context, content);
        }
        io.save(context.getDocument(), output);
        log.info("Lyrics imported: {} + {} -> {} ({} warnings)", lyrics, input, output, context.getWarnings().size());
    }

    public void renameParts(Path score, String parts, Path output) throws IOException {
        TransformationContext context = open(score);
        new PartRenamer().rename(context, parts);
        io.save(context.getDocument(), output);
    }

    private TransformationContext open(Path score) throws IOException {
        Document doc = io.load(score);
        return TransformationContext.create(doc, properties);
    }

    static List<Integer> parseStaffIds(List<String> args) {
        List<Integer> ids = new ArrayList<>();
        for (String a : args) {
            for (String part : a.split(",")) {
                if (part.isBlank()) continue;
                try {
                    ids.add(Integer.parseInt(part.trim()));
                } catch (NumberFormatException e) {
                    throw new ValidationException("Not a staff id: " + part, e);
                }
            }
        }
        return ids;
    }

    public static void main(String[] args) throws IOException {
        if (args.length < 2) {
            log.error(USAGE);
            System.exit(2);
        }
        ScoreSplitRunner runner = new ScoreSplitRunner(new SplitterProperties());
        List<String> rest = Arrays.asList(args).subList(1, args.length);
        try {
            switch (args[0]) {
                case "split":
                    runner.split(Path.of(rest.get(0)),
                            rest.size() > 1 ? Path.of(rest.get(1)) : null,
                            rest.size() > 2 ? Path.of(rest.get(2)) : null);
                    break;
                case "export-lyrics":
                    requireArgs(rest, 2);
                    runner.exportLyrics(Path.of(rest.get(0)), Path.of(rest.get(1)));
                    break;
                case "import-lyrics":
                    requireArgs(rest, 3);
                    runner.importLyrics(Path.of(rest.get(0)), Path.of(rest.get(1)), Path.of(rest.get(2)),
                            parseStaffIds(rest.subList(3, rest.size())));
                    break;
                case "rename-parts":
                    requireArgs(rest, 2);
                    Path score = Path.of(rest.get(0));
                    runner.renameParts(score, rest.get(1), rest.size() > 2 ? Path.of(rest.get(2)) : score);
                    break;
                default:
                    throw new ValidationException("Unknown command: " + args[0]);
            }
        } catch (ValidationException e) {
            log.error("{}{}{}", e.getMessage(), System.lineSeparator(), USAGE);
            System.exit(2);
        } catch (ScoreStructureException e) {
            log.error("Not a usable score: {}", e.getMessage());
            System.exit(1);
        }
    }

    private static void requireArgs(List<String> args, int n) {
        if (args.size() < n) throw new ValidationException("Expected at least " + n + " arguments, got " + args.size());
    }
}
