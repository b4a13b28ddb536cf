package com.myorg.choirsplit.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Comparator;

/**
 * (measure index, time position) key, ordered by measure then time.
 */
@Getter
@EqualsAndHashCode
@AllArgsConstructor(staticName = "of")
public class MeasurePosition implements Comparable<MeasurePosition> {

    private static final Comparator<MeasurePosition> ORDER = Comparator
            .comparingInt(MeasurePosition::getMeasureIndex)
            .thenComparingInt(MeasurePosition::getTimePos);

    private final int measureIndex;
    private final int timePos;

    @Override
    public int compareTo(MeasurePosition other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return measureIndex + "-" + timePos;
    }
}
