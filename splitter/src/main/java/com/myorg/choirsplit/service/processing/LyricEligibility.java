package com.myorg.choirsplit.service.processing;

import lombok.Getter;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Which chords of a staff get a syllable in the lyric interchange formats: chords of
 * voice 0 that do not sit inside or at the end of a slur or tie. Open slurs and ties
 * carry over bar lines.
 */
public final class LyricEligibility {

    private LyricEligibility() {}

    public static Slots of(Element staff) {
        Slots slots = new Slots();
        boolean slurOpen = false;
        boolean tieOpen = false;
        List<Element> measures = XmlNodes.children(staff, "Measure");
        for (int mi = 0; mi < measures.size(); mi++) {
            List<Element> eligible = slots.eligible.computeIfAbsent(mi, k -> new ArrayList<>());
            Element voice = XmlNodes.child(measures.get(mi), "voice");
            if (voice == null) continue;
            for (Element chord : XmlNodes.children(voice, "Chord")) {
                boolean slurStart = Spanners.starts(chord, Spanners.SLUR);
                boolean tieStart = Spanners.starts(chord, Spanners.TIE);
                boolean slurEnd = Spanners.ends(chord, Spanners.SLUR);
                boolean tieEnd = Spanners.ends(chord, Spanners.TIE);

                if (slurEnd || tieEnd) {
                    if (slurEnd) slurOpen = slurStart;
                    if (tieEnd) tieOpen = tieStart;
                    slots.ineligible.add(chord);
                    continue;
                }
                if ((slurOpen && !slurStart) || (tieOpen && !tieStart)) {
                    slots.ineligible.add(chord);
                    continue;
                }
                eligible.add(chord);
                if (slurStart) slurOpen = true;
                if (tieStart) tieOpen = true;
            }
        }
        return slots;
    }

    @Getter
    public static class Slots {
        // measure index (0-based) -> eligible chords in order
        private final Map<Integer, List<Element>> eligible = new TreeMap<>();
        private final List<Element> ineligible = new ArrayList<>();

        public List<Element> eligibleIn(int measureIndex) {
            return eligible.getOrDefault(measureIndex, List.of());
        }

        public int count(int measureIndex) {
            return eligibleIn(measureIndex).size();
        }

        public int measureCount() {
            return eligible.size();
        }
    }
}
