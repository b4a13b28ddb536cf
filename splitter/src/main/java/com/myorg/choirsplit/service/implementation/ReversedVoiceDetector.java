package com.myorg.choirsplit.service.implementation;

import com.myorg.choirsplit.model.MeasurePosition;
import com.myorg.choirsplit.model.StaffEvent;
import com.myorg.choirsplit.service.ScorePass;
import com.myorg.choirsplit.service.TransformationContext;
import com.myorg.choirsplit.service.processing.XmlNodes;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Finds measures where voice 0 carries the lower line and voice 1 the upper one.
 * <p>
 * Explicit stem directions win. In measures without any, chords sounding together are
 * compared: the highest gets "up", the others "down". Inferred directions stay in memory.
 * A chord whose direction does not match its voice (up belongs to voice 0) marks the
 * measure as reversed.
 */
@Slf4j
public class ReversedVoiceDetector implements ScorePass {

    public static final String UP = "up";
    public static final String DOWN = "down";

    @Override
    public String name() {
        return "reversed-voices";
    }

    @Override
    public void apply(TransformationContext context) {
        for (Integer staffId : context.getStaffMapping().keySet()) {
            Element staff = context.contentStaff(staffId);
            if (staff != null) detect(context, staff);
        }
        log.info("Reversed measures per staff: {}", context.getReversedMeasures());
    }

    public void detect(TransformationContext context, Element staff) {
        int staffId = XmlNodes.staffId(staff);
        List<StaffEvent> chords = context.getWalker().walk(staff)
                .filter(StaffEvent::isChord)
                .collect(Collectors.toList());

        Set<Integer> explicitMeasures = new HashSet<>();
        for (StaffEvent ev : chords) {
            if (XmlNodes.hasChild(ev.getElement(), "StemDirection")) explicitMeasures.add(ev.getMeasureIndex());
        }

        Map<Element, String> inferred = inferDirections(chords, explicitMeasures);

        for (StaffEvent ev : chords) {
            String direction = XmlNodes.childText(ev.getElement(), "StemDirection");
            if (direction == null) direction = inferred.get(ev.getElement());
            if (direction == null) continue;
            int expectedVoice = UP.equals(direction) ? 0 : 1;
            if (expectedVoice != ev.getVoiceIndex()) {
                context.markReversed(staffId, ev.getMeasureIndex());
            }
        }
    }

    /** Directions for chords sharing a (measure, time) slot in measures without explicit stems. */
    Map<Element, String> inferDirections(List<StaffEvent> chords, Set<Integer> explicitMeasures) {
        Map<MeasurePosition, List<StaffEvent>> groups = new LinkedHashMap<>();
        for (StaffEvent ev : chords) {
            if (explicitMeasures.contains(ev.getMeasureIndex())) continue;
            groups.computeIfAbsent(ev.position(), k -> new ArrayList<>()).add(ev);
        }
        Map<Element, String> out = new HashMap<>();
        for (List<StaffEvent> group : groups.values()) {
            if (group.size() < 2) continue;
            StaffEvent highest = null;
            int highestPitch = Integer.MIN_VALUE;
            for (StaffEvent ev : group) {
                int pitch = pitch(ev.getElement());
                // strictly greater: equal pitches keep the earlier chord
                if (highest == null || pitch > highestPitch) {
                    highest = ev;
                    highestPitch = pitch;
                }
            }
            for (StaffEvent ev : group) {
                out.put(ev.getElement(), ev == highest ? UP : DOWN);
            }
        }
        return out;
    }

    /** Pitch of the first note, or -1 when the chord has none. */
    static int pitch(Element chord) {
        Element note = XmlNodes.child(chord, "Note");
        Integer p = note == null ? null : XmlNodes.childInt(note, "pitch");
        return p == null ? -1 : p;
    }
}
