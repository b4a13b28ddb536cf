package com.myorg.choirsplit.service.processing;

import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads Tie and Slur spanners attached to a chord. Ties sit inside a Note, slurs either
 * inside the Chord or, in newer files, as Spanner siblings right before it in the voice.
 * Each spanner end carries a {@code next} (start) or {@code prev} (end) marker.
 */
public final class Spanners {

    public static final String TIE = "Tie";
    public static final String SLUR = "Slur";

    private Spanners() {}

    public static List<Element> of(Element chord, String type) {
        List<Element> out = new ArrayList<>();
        for (Node n = chord.getPreviousSibling(); n != null; n = n.getPreviousSibling()) {
            if (!(n instanceof Element e)) continue;
            if (!"Spanner".equals(e.getTagName())) break;
            if (type.equals(e.getAttribute("type"))) out.add(0, e);
        }
        for (Element e : XmlNodes.descendants(chord, "Spanner")) {
            if (type.equals(e.getAttribute("type"))) out.add(e);
        }
        return out;
    }

    /** Spanners of {@code type} nested inside the chord only, not the voice-level ones. */
    public static List<Element> nested(Element chord, String type) {
        List<Element> out = new ArrayList<>();
        for (Element e : XmlNodes.descendants(chord, "Spanner")) {
            if (type.equals(e.getAttribute("type"))) out.add(e);
        }
        return out;
    }

    public static boolean starts(Element chord, String type) {
        return of(chord, type).stream().anyMatch(s -> XmlNodes.hasChild(s, "next"));
    }

    public static boolean ends(Element chord, String type) {
        return of(chord, type).stream().anyMatch(s -> XmlNodes.hasChild(s, "prev"));
    }

    public static boolean has(Element chord, String type) {
        return !of(chord, type).isEmpty();
    }

    /** Chord sits at the far end of a tie or slur. */
    public static boolean isContinuation(Element chord) {
        return ends(chord, TIE) || ends(chord, SLUR);
    }
}
