package com.myorg.choirsplit.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tunables of a split run. The command-line runner uses the defaults below,
 * the web application binds {@code splitter.*} from application.yml.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "splitter")
public class SplitterProperties {

    /** Ticks per whole note when the score carries no Division element. */
    private int defaultResolution = 128;

    /** Value written into the timeStretch child of every Fermata. */
    private String fermataTimeStretch = "3";

    private String outputSuffix = "_split";
    private String lyricsDumpSuffix = "_lyrics.tsv";
    private String lyricsFixedSuffix = "_lyrics_fixed.tsv";
    private String reportSuffix = "_report";
    private String warningsSuffix = "_warnings.jsonl";

    private boolean excelReport = true;

    /** Part labels of the lyric array format that the score itself cannot resolve. */
    private Map<String, Integer> partLabels = new LinkedHashMap<>(Map.of(
            "S1", 1,
            "S2", 2,
            "A1", 3,
            "A2", 4));
}
