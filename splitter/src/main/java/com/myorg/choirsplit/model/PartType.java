package com.myorg.choirsplit.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Vocal classification of one staff. An empty {@code partName} means no rule matched.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class PartType {
    private final int staffId;
    private final String clefType;
    private final int highestPitch;
    private final int lowestPitch;
    @Builder.Default
    private final String partName = "";
    @Builder.Default
    private final String partSlug = "";
    private final int partIndex;

    public boolean isClassified() {
        return partName != null && !partName.isEmpty();
    }

    /** Short label such as "T1". */
    public String label() {
        return partSlug + partIndex;
    }
}
