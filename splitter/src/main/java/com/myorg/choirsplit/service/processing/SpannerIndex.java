package com.myorg.choirsplit.service.processing;

import com.myorg.choirsplit.model.MeasurePosition;
import com.myorg.choirsplit.model.StaffEvent;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Tie layout of the whole score, built once: which chords start a tie, keyed by
 * (measure, time position), paired with the chord that follows each of them on the
 * same voice line. The line continues across bar lines.
 */
public class SpannerIndex {

    private final Map<MeasurePosition, TiePair> tieStarts = new LinkedHashMap<>();
    private final Map<Element, Element> following = new HashMap<>();

    private SpannerIndex() {}

    public static SpannerIndex build(List<Element> staves, TreeWalker walker) {
        SpannerIndex index = new SpannerIndex();
        for (Element staff : staves) {
            Map<Integer, List<StaffEvent>> lines = new TreeMap<>();
            walker.walk(staff)
                    .filter(StaffEvent::isChord)
                    .forEach(ev -> lines.computeIfAbsent(ev.getVoiceIndex(), k -> new ArrayList<>()).add(ev));
            for (List<StaffEvent> line : lines.values()) {
                for (int i = 0; i < line.size(); i++) {
                    StaffEvent ev = line.get(i);
                    if (i + 1 < line.size()) index.following.put(ev.getElement(), line.get(i + 1).getElement());
                }
            }
        }
        // starters in document order, so the first one claims a shared position
        for (Element staff : staves) {
            walker.walk(staff)
                    .filter(StaffEvent::isChord)
                    .filter(ev -> Spanners.starts(ev.getElement(), Spanners.TIE))
                    .forEach(ev -> index.tieStarts.putIfAbsent(ev.position(),
                            new TiePair(ev.getElement(), index.following.get(ev.getElement()))));
        }
        return index;
    }

    public TiePair tieStartingAt(MeasurePosition position) {
        return tieStarts.get(position);
    }

    /** Next chord on the same staff and voice line, or null at the end of the line. */
    public Element following(Element chord) {
        return following.get(chord);
    }

    public int tieCount() {
        return tieStarts.size();
    }

    @Getter
    @AllArgsConstructor
    public static class TiePair {
        private final Element starter;
        // null when the tie starts on the last chord of its line
        private final Element successor;
    }
}
