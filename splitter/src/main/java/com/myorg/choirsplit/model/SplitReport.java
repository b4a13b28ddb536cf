package com.myorg.choirsplit.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.List;
import java.util.Map;

/**
 * Summary of one split run. Serialized as JSON and rendered into the Excel report.
 */
@Getter
@Builder
@ToString
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SplitReport {

    @JsonProperty("source")
    private String source;

    @JsonProperty("output")
    private String output;

    // --- counts ---
    @JsonProperty("staves_before")
    private Integer stavesBefore;

    @JsonProperty("staves_after")
    private Integer stavesAfter;

    @JsonProperty("resolution")
    private Integer resolution;

    @JsonProperty("lyric_count")
    private Integer lyricCount;

    @JsonProperty("lyrics_corrected")
    private Boolean lyricsCorrected;

    // --- detail ---
    // split staff id -> duplicate id
    @JsonProperty("staff_mapping")
    private Map<Integer, Integer> staffMapping;

    // original staff id -> measure indexes
    @JsonProperty("reversed_measures")
    private Map<Integer, List<Integer>> reversedMeasures;

    @JsonProperty("repaired_measures")
    private List<Integer> repairedMeasures;

    @JsonProperty("unfixable_measures")
    private List<Integer> unfixableMeasures;

    // staff id -> label, e.g. 3 -> "A1"
    @JsonProperty("part_labels")
    private Map<Integer, String> partLabels;

    @JsonProperty("warnings")
    private List<PipelineWarning> warnings;

    public Map<Integer, Integer> getStaffMapping() {
        return staffMapping == null ? Map.of() : Map.copyOf(staffMapping);
    }

    public Map<Integer, List<Integer>> getReversedMeasures() {
        return reversedMeasures == null ? Map.of() : Map.copyOf(reversedMeasures);
    }

    public List<Integer> getRepairedMeasures() {
        return repairedMeasures == null ? List.of() : List.copyOf(repairedMeasures);
    }

    public List<Integer> getUnfixableMeasures() {
        return unfixableMeasures == null ? List.of() : List.copyOf(unfixableMeasures);
    }

    public Map<Integer, String> getPartLabels() {
        return partLabels == null ? Map.of() : Map.copyOf(partLabels);
    }

    public List<PipelineWarning> getWarnings() {
        return warnings == null ? List.of() : List.copyOf(warnings);
    }
}
