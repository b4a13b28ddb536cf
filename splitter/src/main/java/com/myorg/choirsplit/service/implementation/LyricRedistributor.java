package com.myorg.choirsplit.service.implementation;

import com.myorg.choirsplit.model.Lyric;
import com.myorg.choirsplit.model.MeasurePosition;
import com.myorg.choirsplit.model.StaffEvent;
import com.myorg.choirsplit.service.ScorePass;
import com.myorg.choirsplit.service.TransformationContext;
import com.myorg.choirsplit.service.processing.LyricTable;
import com.myorg.choirsplit.service.processing.Spanners;
import com.myorg.choirsplit.service.processing.XmlNodes;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Gives every chord of the resulting staves its lyric back from the table collected
 * before splitting. Chords with nothing recorded at their own position borrow from the
 * nearest recorded neighbour in the same measure, unless that would repeat the neighbouring
 * chord's lyric. On a split staff each copy only takes the lyrics of its own line. Afterwards chords inside a tie or slur lose their lyrics again.
 */
@Slf4j
public class LyricRedistributor implements ScorePass {

    private static final String STAGE = "lyrics";

    @Override
    public String name() {
        return STAGE;
    }

    @Override
    public void apply(TransformationContext context) {
        LyricTable table = context.getLyricTable();
        if (table.isEmpty()) {
            log.info("No lyrics collected, leaving staves as they are");
            return;
        }
        for (Element staff : context.contentStaves()) {
            redistribute(context, staff);
            clearSpanInteriors(context, staff);
        }
    }

    void redistribute(TransformationContext context, Element staff) {
        LyricTable table = context.getLyricTable();
        int staffId = XmlNodes.staffId(staff);
        int originalId = context.originalStaffId(staffId);
        List<StaffEvent> chords = context.getWalker().walk(staff)
                .filter(StaffEvent::isChord)
                .collect(Collectors.toList());

        boolean splitCopy = context.getStaffMapping().containsKey(staffId) || context.isDuplicate(staffId);
        List<LyricMatchStrategy> strategies = splitCopy ? LyricMatchStrategy.SPLIT_DIRECT : LyricMatchStrategy.DIRECT;

        Map<Element, Lyric> direct = new HashMap<>();
        for (StaffEvent ev : chords) {
            int line = lineOf(context, staffId, ev);
            Optional<Lyric> found = LyricMatchStrategy.firstMatch(
                    strategies, table.at(ev.position()), originalId, line);
            found.ifPresent(lyric -> {
                replace(ev.getElement(), lyric);
                direct.put(ev.getElement(), lyric);
            });
        }

        int unmatched = 0;
        for (int i = 0; i < chords.size(); i++) {
            StaffEvent ev = chords.get(i);
            if (direct.containsKey(ev.getElement())) continue;
            if (Spanners.ends(ev.getElement(), Spanners.TIE)) continue;
            int line = lineOf(context, staffId, ev);
            MeasurePosition here = ev.position();
            Lyric before = neighbour(table, sameMeasure(table.before(here), here), originalId, line);
            Lyric after = neighbour(table, sameMeasure(table.after(here), here), originalId, line);
            Lyric previousChord = i > 0 ? direct.get(chords.get(i - 1).getElement()) : null;
            Lyric nextChord = i + 1 < chords.size() ? direct.get(chords.get(i + 1).getElement()) : null;

            if (before != null && !sameText(before, previousChord)) {
                replace(ev.getElement(), before);
            } else if (after != null && !sameText(after, nextChord)) {
                replace(ev.getElement(), after);
            } else {
                unmatched++;
            }
        }
        if (unmatched > 0) {
            log.debug("Staff {}: {} chords without a lyric at any level", staffId, unmatched);
        }
    }

    /** Upper copy and voice 0 sing line 0, the lower copy line 1; unsplit staves keep their voice index. */
    private static int lineOf(TransformationContext context, int staffId, StaffEvent ev) {
        if (context.getStaffMapping().containsKey(staffId)) return 0;
        if (context.isDuplicate(staffId)) return 1;
        return ev.getVoiceIndex();
    }

    private static MeasurePosition sameMeasure(MeasurePosition candidate, MeasurePosition here) {
        return candidate != null && candidate.getMeasureIndex() == here.getMeasureIndex() ? candidate : null;
    }

    private static Lyric neighbour(LyricTable table, MeasurePosition position, int originalId, int line) {
        if (position == null) return null;
        return LyricMatchStrategy.firstMatch(LyricMatchStrategy.NEIGHBOUR, table.at(position), originalId, line)
                .orElse(null);
    }

    private static boolean sameText(Lyric candidate, Lyric adjacent) {
        return adjacent != null && adjacent.getText().equals(candidate.getText());
    }

    private static void replace(Element chord, Lyric lyric) {
        LyricElements.removeAll(chord);
        LyricElements.append(chord, lyric);
    }

    /**
     * Removes lyrics from the chords a tie or slur runs into: everything after the chord
     * that opens it, up to and including the chord carrying its {@code prev} end.
     */
    void clearSpanInteriors(TransformationContext context, Element staff) {
        Map<Integer, List<Element>> lines = new TreeMap<>();
        context.getWalker().walk(staff)
                .filter(StaffEvent::isChord)
                .forEach(ev -> lines.computeIfAbsent(ev.getVoiceIndex(), k -> new ArrayList<>()).add(ev.getElement()));
        for (List<Element> line : lines.values()) {
            String open = null;
            for (Element chord : line) {
                if (open != null) {
                    LyricElements.removeAll(chord);
                    if (Spanners.ends(chord, open) && !Spanners.starts(chord, open)) open = null;
                    continue;
                }
                if (Spanners.starts(chord, Spanners.TIE)) {
                    open = Spanners.TIE;
                } else if (Spanners.starts(chord, Spanners.SLUR)) {
                    open = Spanners.SLUR;
                }
            }
        }
    }
}
