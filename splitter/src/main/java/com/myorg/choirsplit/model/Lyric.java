package com.myorg.choirsplit.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One sung syllable. An empty {@code verse} is verse 1; "1" is verse 2 and so on.
 */
@Getter
@Builder(toBuilder = true)
@ToString
@EqualsAndHashCode
public class Lyric {
    @Builder.Default
    private final Syllabic syllabic = Syllabic.SINGLE;
    @Builder.Default
    private final String text = "";
    @Builder.Default
    private final String verse = "";

    public boolean isFirstVerse() {
        return verse == null || verse.isBlank();
    }
}
