package com.myorg.choirsplit.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A lyric as it was found before splitting. {@code line} is the voice index with
 * reversed measures already swapped back, so 0 always means the upper line.
 */
@Getter
@Builder(toBuilder = true)
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class LyricOccurrence {
    private final int staffId;
    private final int measureIndex;
    private final int line;
    private final int timePos;
    private final Lyric lyric;

    public MeasurePosition position() {
        return MeasurePosition.of(measureIndex, timePos);
    }
}
