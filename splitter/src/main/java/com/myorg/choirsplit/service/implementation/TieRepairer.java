package com.myorg.choirsplit.service.implementation;

import com.myorg.choirsplit.model.StaffEvent;
import com.myorg.choirsplit.service.ScorePass;
import com.myorg.choirsplit.service.TransformationContext;
import com.myorg.choirsplit.service.processing.DurationResolver;
import com.myorg.choirsplit.service.processing.SpannerIndex;
import com.myorg.choirsplit.service.processing.Spanners;
import com.myorg.choirsplit.service.processing.XmlNodes;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Element;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Restores ties lost when a shared chord was split between two staves. A chord pair
 * without ties that sits where another staff has a tied pair of the same durations
 * gets copies of that pair's Tie spanners.
 */
@Slf4j
public class TieRepairer implements ScorePass {

    private static final String STAGE = "tie-repair";

    @Override
    public String name() {
        return STAGE;
    }

    @Override
    public void apply(TransformationContext context) {
        List<Element> staves = context.contentStaves();
        SpannerIndex index = SpannerIndex.build(staves, context.getWalker());
        if (index.tieCount() == 0) return;

        DurationResolver durations = context.getDurations();
        Set<Element> handled = new HashSet<>();
        int repaired = 0;
        for (Element staff : staves) {
            List<StaffEvent> chords = context.getWalker().walk(staff)
                    .filter(StaffEvent::isChord)
                    .collect(Collectors.toList());
            for (StaffEvent ev : chords) {
                Element candidate = ev.getElement();
                if (handled.contains(candidate) || Spanners.has(candidate, Spanners.TIE)) continue;
                SpannerIndex.TiePair pair = index.tieStartingAt(ev.position());
                if (pair == null || pair.getSuccessor() == null) continue;
                Element next = index.following(candidate);
                if (next == null || Spanners.has(next, Spanners.TIE)) continue;

                if (durations.resolve(candidate) != durations.resolve(pair.getStarter())
                        || durations.resolve(next) != durations.resolve(pair.getSuccessor())) {
                    context.warn(STAGE, ev.getStaffId(), ev.getMeasureIndex(),
                            "untied pair at tick " + ev.getTimePos() + " differs in duration from the tied pair");
                    continue;
                }
                if (ReversedVoiceDetector.pitch(candidate) != ReversedVoiceDetector.pitch(next)) {
                    context.warn(STAGE, ev.getStaffId(), ev.getMeasureIndex(),
                            "untied pair at tick " + ev.getTimePos() + " changes pitch, not tying it");
                    continue;
                }
                copyTie(pair.getStarter(), candidate, "next");
                copyTie(pair.getSuccessor(), next, "prev");
                handled.add(candidate);
                handled.add(next);
                repaired++;
            }
        }
        log.info("Restored {} ties", repaired);
    }

    /** Clones the source chord's Tie spanner carrying {@code marker} onto the target's first note. */
    private void copyTie(Element source, Element target, String marker) {
        Element note = XmlNodes.child(target, "Note");
        if (note == null) return;
        for (Element tie : Spanners.nested(source, Spanners.TIE)) {
            if (!XmlNodes.hasChild(tie, marker)) continue;
            Element copy = XmlNodes.deepCopy(tie);
            note.insertBefore(copy, note.getFirstChild());
            return;
        }
    }
}
