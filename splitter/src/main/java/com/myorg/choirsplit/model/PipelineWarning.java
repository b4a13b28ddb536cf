package com.myorg.choirsplit.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A non-fatal condition met during a run: an unfixable measure, a refused tie candidate,
 * a skipped lyric line.
 */
@Getter
@Builder
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PipelineWarning {

    @JsonProperty("stage")
    private final String stage;

    @JsonProperty("staff_id")
    private final Integer staffId;

    @JsonProperty("measure_index")
    private final Integer measureIndex;

    @JsonProperty("message")
    private final String message;
}
