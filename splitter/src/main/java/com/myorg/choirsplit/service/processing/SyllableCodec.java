package com.myorg.choirsplit.service.processing;

import com.myorg.choirsplit.model.Lyric;
import com.myorg.choirsplit.model.Syllabic;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversions between syllables and the tokens of the lyric interchange formats.
 * <p>
 * A token is one word as written by a person: syllables joined by hyphens ("tä-mä"), with a
 * trailing hyphen when the word goes on in the next measure ("lau-"). "_" is a chord that
 * stays without lyric.
 */
public final class SyllableCodec {

    public static final String PLACEHOLDER = "_";

    private SyllableCodec() {}

    /** Export token of one chord: its text, plus "-" when the word continues. */
    public static String token(Lyric lyric) {
        if (lyric == null) return PLACEHOLDER;
        String text = lyric.getText() == null ? "" : lyric.getText().trim();
        return lyric.getSyllabic().continuesWord() ? text + "-" : text;
    }

    /** Joins per-chord tokens into words: a token ending in "-" absorbs the next one. */
    public static String merge(List<String> tokens) {
        if (tokens.isEmpty()) return "";
        List<String> words = new ArrayList<>();
        String current = tokens.get(0);
        for (int i = 1; i < tokens.size(); i++) {
            String next = tokens.get(i);
            if (current.endsWith("-")) {
                current = stripTrailingHyphens(current) + "-" + stripLeadingHyphens(next).trim();
            } else if (next.startsWith("-")) {
                current = current.trim() + "-" + stripLeadingHyphens(next).trim();
            } else {
                words.add(current);
                current = next;
            }
        }
        words.add(current);
        return String.join(" ", words);
    }

    /** Splits a written line into tokens; a part following one that ends in "-" is joined to it. */
    public static List<String> tokenize(String line) {
        List<String> tokens = new ArrayList<>();
        if (line == null) return tokens;
        for (String part : line.trim().split("\\s+")) {
            if (part.isEmpty()) continue;
            if (PLACEHOLDER.equals(part)) {
                tokens.add(PLACEHOLDER);
            } else if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).endsWith("-")) {
                int last = tokens.size() - 1;
                tokens.set(last, stripTrailingHyphens(tokens.get(last)) + "-" + part);
            } else {
                tokens.add(part);
            }
        }
        return tokens;
    }

    /**
     * Expands tokens into one syllable per chord. With {@code continuation} set, the
     * previous measure ended inside a word and the first syllable becomes its end.
     */
    public static List<Syllable> toSyllables(List<String> tokens, boolean continuation) {
        List<Syllable> out = new ArrayList<>();
        for (int idx = 0; idx < tokens.size(); idx++) {
            String token = tokens.get(idx).trim();
            if (PLACEHOLDER.equals(token)) {
                out.add(Syllable.placeholder());
                continue;
            }
            boolean trailingHyphen = token.endsWith("-");
            String[] parts = stripTrailingHyphens(token).split("-");
            boolean forceEnd = continuation && idx == 0;
            if (parts.length == 1) {
                String text = parts[0].trim();
                if (forceEnd) {
                    out.add(Syllable.of(Syllabic.END, text));
                } else if (trailingHyphen) {
                    out.add(Syllable.of(Syllabic.BEGIN, text));
                } else {
                    out.add(Syllable.of(Syllabic.SINGLE, text));
                }
                continue;
            }
            for (int i = 0; i < parts.length; i++) {
                String text = parts[i].trim();
                if (text.isEmpty()) continue;
                if (i == 0) {
                    out.add(Syllable.of(forceEnd ? Syllabic.END : Syllabic.BEGIN, text));
                } else if (i == parts.length - 1) {
                    out.add(Syllable.of(trailingHyphen ? Syllabic.BEGIN : Syllabic.END, text));
                } else {
                    out.add(Syllable.of(Syllabic.MIDDLE, text));
                }
            }
        }
        return out;
    }

    /** Inverse of {@link #toSyllables}: begin, middle... end becomes "a-b-c", an unfinished word "a-b-". */
    public static List<String> toTokens(List<Syllable> syllables) {
        List<String> tokens = new ArrayList<>();
        int i = 0;
        while (i < syllables.size()) {
            Syllable s = syllables.get(i);
            if (s.isPlaceholder()) {
                tokens.add(PLACEHOLDER);
                i++;
            } else if (s.getRole() == Syllabic.BEGIN) {
                List<String> parts = new ArrayList<>();
                parts.add(s.getText());
                i++;
                boolean closed = false;
                while (i < syllables.size() && !closed) {
                    Syllable next = syllables.get(i);
                    if (next.getRole() == Syllabic.MIDDLE) {
                        parts.add(next.getText());
                        i++;
                    } else if (next.getRole() == Syllabic.END) {
                        parts.add(next.getText());
                        i++;
                        closed = true;
                    } else {
                        break;
                    }
                }
                tokens.add(String.join("-", parts) + (closed ? "" : "-"));
            } else {
                tokens.add(s.getText());
                i++;
            }
        }
        return tokens;
    }

    public static boolean endsInsideWord(List<String> tokens) {
        if (tokens == null || tokens.isEmpty()) return false;
        String last = tokens.get(tokens.size() - 1).trim();
        return !PLACEHOLDER.equals(last) && last.endsWith("-");
    }

    private static String stripTrailingHyphens(String s) {
        int end = s.length();
        while (end > 0 && s.charAt(end - 1) == '-') end--;
        return s.substring(0, end);
    }

    private static String stripLeadingHyphens(String s) {
        int start = 0;
        while (start < s.length() && s.charAt(start) == '-') start++;
        return s.substring(start);
    }

    /** One chord's worth of lyric; a placeholder has no role and clears the chord. */
    @Getter
    @ToString
    @EqualsAndHashCode
    @AllArgsConstructor(access = AccessLevel.PRIVATE)
    public static class Syllable {
        private final Syllabic role;
        private final String text;

        public static Syllable of(Syllabic role, String text) {
            return new Syllable(role, text);
        }

        public static Syllable placeholder() {
            return new Syllable(null, "");
        }

        public boolean isPlaceholder() {
            return role == null;
        }

        public Lyric toLyric() {
            return Lyric.builder().syllabic(role).text(text).build();
        }
    }
}
