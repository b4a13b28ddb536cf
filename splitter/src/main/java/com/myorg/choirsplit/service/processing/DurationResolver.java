package com.myorg.choirsplit.service.processing;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns MuseScore duration tokens ("quarter", "16th", "3/8") plus a dot count into
 * integer ticks, and ticks back into a (durationType, dots) pair.
 */
@Getter
public class DurationResolver {

    private static final Map<String, Integer> DENOMINATORS = new LinkedHashMap<>();

    static {
        DENOMINATORS.put("whole", 1);
        DENOMINATORS.put("half", 2);
        DENOMINATORS.put("quarter", 4);
        DENOMINATORS.put("eighth", 8);
        DENOMINATORS.put("16th", 16);
        DENOMINATORS.put("32nd", 32);
        DENOMINATORS.put("64th", 64);
        DENOMINATORS.put("128th", 128);
    }

    // encodable rest shapes, longest base first
    private static final String[] ENCODABLE = {"whole", "half", "quarter", "eighth", "16th", "32nd", "64th"};

    private final int ticksPerWhole;

    public DurationResolver(int ticksPerWhole) {
        if (ticksPerWhole <= 0) {
            throw new IllegalArgumentException("ticksPerWhole must be positive: " + ticksPerWhole);
        }
        this.ticksPerWhole = ticksPerWhole;
    }

    /**
     * Resolution of a document: four times its Division (ticks per quarter) when present,
     * else the given default.
     */
    public static DurationResolver forDocument(Document document, int defaultTicksPerWhole) {
        Element division = XmlNodes.firstDescendant(document.getDocumentElement(), "Division");
        if (division != null) {
            try {
                int perQuarter = Integer.parseInt(division.getTextContent().trim());
                if (perQuarter > 0) return new DurationResolver(perQuarter * 4);
            } catch (NumberFormatException ignored) {
                // fall through to the default
            }
        }
        return new DurationResolver(defaultTicksPerWhole);
    }

    public int resolve(String token, int dots) {
        if (token == null) return 0;
        String t = token.trim().toLowerCase(Locale.ROOT);
        if (t.contains("/")) {
            return resolveFraction(t);
        }
        Integer denominator = DENOMINATORS.get(t);
        if (denominator == null) return 0;
        int base = ticksPerWhole / denominator;
        int ticks = base;
        if (dots >= 1) ticks += base / 2;
        if (dots >= 2) ticks += base / 4;
        if (dots >= 3) ticks += base / 8;
        return ticks;
    }

    /** "N/D" at this resolution; 0 for anything unparsable. */
    public int resolveFraction(String fraction) {
        if (fraction == null) return 0;
        String[] parts = fraction.trim().split("/");
        if (parts.length != 2) return 0;
        try {
            long n = Long.parseLong(parts[0].trim());
            long d = Long.parseLong(parts[1].trim());
            if (d == 0) return 0;
            return (int) (ticksPerWhole * n / d);
        } catch (NumberFormatException ignored) {
            return 0;
        }
    }

    /**
     * Duration of a Chord or Rest element. A full-measure rest ("measure") takes its
     * length from the {@code duration} child.
     */
    public int resolve(Element chordOrRest) {
        String type = XmlNodes.childText(chordOrRest, "durationType");
        if ("measure".equalsIgnoreCase(type)) {
            return resolveFraction(XmlNodes.childText(chordOrRest, "duration"));
        }
        Integer dots = XmlNodes.childInt(chordOrRest, "dots");
        return resolve(type, dots == null ? 0 : dots);
    }

    public int measureTicks(int sigN, int sigD) {
        if (sigD <= 0) return 0;
        return ticksPerWhole * sigN / sigD;
    }

    /** First table entry (whole..64th, 0..3 dots) whose length is exactly {@code ticks}. */
    public Optional<Encoding> encode(int ticks) {
        if (ticks <= 0) return Optional.empty();
        for (String type : ENCODABLE) {
            for (int dots = 0; dots <= 3; dots++) {
                if (resolve(type, dots) == ticks) {
                    return Optional.of(new Encoding(type, dots));
                }
            }
        }
        return Optional.empty();
    }

    @Getter
    @ToString
    @AllArgsConstructor
    public static class Encoding {
        private final String durationType;
        private final int dots;
    }
}
