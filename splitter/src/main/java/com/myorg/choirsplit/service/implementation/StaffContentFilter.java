package com.myorg.choirsplit.service.implementation;

import com.myorg.choirsplit.service.ScorePass;
import com.myorg.choirsplit.service.TransformationContext;
import com.myorg.choirsplit.service.processing.XmlNodes;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Reduces each split staff to one line: the original staff keeps the upper voice, its
 * duplicate the lower one. Every staff is then stripped of presentation-only markup.
 */
@Slf4j
public class StaffContentFilter implements ScorePass {

    private static final List<String> SIGNATURES = List.of("Clef", "KeySig", "TimeSig");
    private static final List<String> STRIPPED = List.of(
            "offset", "Dynamic", "LayoutBreak", "Articulation", "Tempo", "Harmony");
    private static final List<String> STRIPPED_DOCUMENT_WIDE = List.of("bracket", "barLineSpan");

    public enum Direction { UP, DOWN }

    @Override
    public String name() {
        return "filter-staves";
    }

    @Override
    public void apply(TransformationContext context) {
        Map<Integer, Integer> mapping = context.getStaffMapping();
        for (Element staff : context.contentStaves()) {
            int staffId = XmlNodes.staffId(staff);
            if (mapping.containsKey(staffId)) {
                filter(context, staff, Direction.UP);
            } else if (mapping.containsValue(staffId)) {
                filter(context, staff, Direction.DOWN);
            } else {
                filter(context, staff, null);
            }
        }
        for (String tag : STRIPPED_DOCUMENT_WIDE) {
            XmlNodes.removeAll(XmlNodes.descendants(context.getScore(), tag));
        }
    }

    /**
     * @param direction line to keep, or null to only clean up a staff that was not split
     */
    public void filter(TransformationContext context, Element staff, Direction direction) {
        int staffId = XmlNodes.staffId(staff);
        int originalId = context.originalStaffId(staffId);
        if (direction != null) {
            List<Element> measures = XmlNodes.children(staff, "Measure");
            for (int mi = 0; mi < measures.size(); mi++) {
                boolean reversed = context.isReversed(originalId, mi);
                keepOneLine(measures.get(mi), mi, direction, reversed);
            }
        }
        normalize(context, staff);
    }

    /** Voice index deleted from a two-voice measure. */
    static int voiceToRemove(Direction direction, boolean reversed) {
        int removeForUp = reversed ? 0 : 1;
        return direction == Direction.UP ? removeForUp : 1 - removeForUp;
    }

    private void keepOneLine(Element measure, int measureIndex, Direction direction, boolean reversed) {
        List<Element> voices = XmlNodes.children(measure, "voice");
        if (voices.isEmpty()) return;

        // signatures of this measure, from whichever voice holds them
        Element clef = firstOf(voices, "Clef");
        Element keySig = firstOf(voices, "KeySig");
        Element timeSig = firstOf(voices, "TimeSig");

        List<Element> kept = new ArrayList<>();
        if (voices.size() == 1) {
            kept.add(voices.get(0));
            dropExtremeNotes(voices.get(0), direction);
        } else {
            int remove = voiceToRemove(direction, reversed);
            for (int vi = 0; vi < voices.size(); vi++) {
                if (vi != remove) kept.add(voices.get(vi));
            }
        }

        if (measureIndex == 0) {
            if (keySig == null) keySig = defaultKeySig(measure.getOwnerDocument());
            if (timeSig == null) timeSig = defaultTimeSig(measure.getOwnerDocument());
        }
        reseed(kept.get(0), voices, clef, keySig, timeSig);

        for (Element voice : voices) {
            if (!kept.contains(voice)) XmlNodes.remove(voice);
        }
    }

    private void reseed(Element retained, List<Element> voices, Element clef, Element keySig, Element timeSig) {
        List<Element> seeds = new ArrayList<>();
        for (Element sig : new Element[]{clef, keySig, timeSig}) {
            if (sig != null) seeds.add(XmlNodes.deepCopy(sig));
        }
        for (Element voice : voices) {
            for (String tag : SIGNATURES) XmlNodes.removeAll(XmlNodes.children(voice, tag));
        }
        for (int i = seeds.size() - 1; i >= 0; i--) {
            retained.insertBefore(seeds.get(i), retained.getFirstChild());
        }
    }

    /**
     * In a one-voice measure chords keep the note of their own line: the upper staff drops
     * the lowest note, the lower staff the highest.
     */
    private void dropExtremeNotes(Element voice, Direction direction) {
        for (Element chord : XmlNodes.children(voice, "Chord")) {
            List<Element> notes = XmlNodes.children(chord, "Note");
            if (notes.size() < 2) continue;
            Comparator<Element> byPitch = Comparator.comparingInt(StaffContentFilter::notePitch);
            Element victim = direction == Direction.DOWN
                    ? notes.stream().max(byPitch).orElseThrow()
                    : notes.stream().min(byPitch).orElseThrow();
            XmlNodes.remove(victim);
        }
    }

    private void normalize(TransformationContext context, Element staff) {
        for (Element stem : XmlNodes.descendants(staff, "StemDirection")) {
            stem.setTextContent(ReversedVoiceDetector.UP);
        }
        for (String tag : STRIPPED) {
            XmlNodes.removeAll(XmlNodes.descendants(staff, tag));
        }
        for (Element spanner : XmlNodes.descendants(staff, "Spanner")) {
            if ("HairPin".equals(spanner.getAttribute("type"))) XmlNodes.remove(spanner);
        }
        String stretch = context.getProperties().getFermataTimeStretch();
        for (Element fermata : XmlNodes.descendants(staff, "Fermata")) {
            XmlNodes.setChildText(fermata, "timeStretch", stretch);
        }
    }

    private static Element firstOf(List<Element> voices, String tag) {
        for (Element voice : voices) {
            Element e = XmlNodes.child(voice, tag);
            if (e != null) return e;
        }
        return null;
    }

    private static int notePitch(Element note) {
        Integer p = XmlNodes.childInt(note, "pitch");
        return p == null ? -1 : p;
    }

    private static Element defaultKeySig(Document doc) {
        Element e = doc.createElement("KeySig");
        XmlNodes.appendTextElement(e, "accidental", "0");
        return e;
    }

    private static Element defaultTimeSig(Document doc) {
        Element e = doc.createElement("TimeSig");
        XmlNodes.appendTextElement(e, "sigN", "4");
        XmlNodes.appendTextElement(e, "sigD", "4");
        return e;
    }
}
