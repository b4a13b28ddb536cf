package com.myorg.choirsplit.model;

import java.util.Locale;

/**
 * Role of a syllable within its word, as written in the {@code syllabic} child of a Lyrics element.
 */
public enum Syllabic {
    SINGLE,
    BEGIN,
    MIDDLE,
    END;

    public String xmlName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** True when the word goes on after this syllable, i.e. the exported token gets a trailing hyphen. */
    public boolean continuesWord() {
        return this == BEGIN || this == MIDDLE;
    }

    /** A missing or unknown value reads as {@link #SINGLE}. */
    public static Syllabic fromXml(String raw) {
        if (raw == null || raw.isBlank()) return SINGLE;
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ignored) {
            return SINGLE;
        }
    }
}
