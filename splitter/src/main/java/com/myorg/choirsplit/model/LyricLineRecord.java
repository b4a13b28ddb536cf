package com.myorg.choirsplit.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One line of the lyric array format: the 1-based measure where the line starts and
 * the line's text per part, keyed by staff id or part label.
 * <pre>{ "measure_start": 5, "S1": "Tä-mä on", "A1": "Tä-mä on" }</pre>
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
public class LyricLineRecord {

    @JsonProperty("measure_start")
    private Integer measureStart;

    private final Map<String, String> parts = new LinkedHashMap<>();

    @JsonAnySetter
    public void putPart(String key, Object value) {
        parts.put(key, value == null ? "" : String.valueOf(value));
    }

    @JsonAnyGetter
    public Map<String, String> getParts() {
        return parts;
    }
}
