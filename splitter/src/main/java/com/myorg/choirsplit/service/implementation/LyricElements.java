package com.myorg.choirsplit.service.implementation;

import com.myorg.choirsplit.model.Lyric;
import com.myorg.choirsplit.model.Syllabic;
import com.myorg.choirsplit.service.processing.XmlNodes;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes the Lyrics children of a chord.
 */
final class LyricElements {

    private LyricElements() {}

    static Lyric read(Element lyrics) {
        String verse = XmlNodes.childText(lyrics, "no");
        String text = XmlNodes.childText(lyrics, "text");
        return Lyric.builder()
                .syllabic(Syllabic.fromXml(XmlNodes.childText(lyrics, "syllabic")))
                .text(text == null ? "" : text)
                .verse(verse == null ? "" : verse)
                .build();
    }

    static List<Lyric> readAll(Element chord) {
        List<Lyric> out = new ArrayList<>();
        for (Element lyrics : XmlNodes.children(chord, "Lyrics")) out.add(read(lyrics));
        return out;
    }

    /** The verse-1 lyric of a chord, or null. */
    static Lyric firstVerse(Element chord) {
        for (Element lyrics : XmlNodes.children(chord, "Lyrics")) {
            Lyric l = read(lyrics);
            if (l.isFirstVerse()) return l;
        }
        return null;
    }

    static Element create(Element chord, Lyric lyric) {
        Element lyrics = chord.getOwnerDocument().createElement("Lyrics");
        if (!lyric.isFirstVerse()) XmlNodes.appendTextElement(lyrics, "no", lyric.getVerse());
        if (lyric.getSyllabic() != Syllabic.SINGLE) {
            XmlNodes.appendTextElement(lyrics, "syllabic", lyric.getSyllabic().xmlName());
        }
        XmlNodes.appendTextElement(lyrics, "text", lyric.getText());
        return lyrics;
    }

    /** Puts the Lyrics element before the first Note, where notation programs write it. */
    static void append(Element chord, Lyric lyric) {
        Element lyrics = create(chord, lyric);
        Element note = XmlNodes.child(chord, "Note");
        if (note != null) {
            chord.insertBefore(lyrics, note);
        } else {
            chord.appendChild(lyrics);
        }
    }

    static void removeAll(Element chord) {
        XmlNodes.removeAll(XmlNodes.children(chord, "Lyrics"));
    }

    static void removeFirstVerse(Element chord) {
        for (Element lyrics : XmlNodes.children(chord, "Lyrics")) {
            if (read(lyrics).isFirstVerse()) XmlNodes.remove(lyrics);
        }
    }

    /** Replaces the verse-1 lyric, leaving other verses alone. */
    static void setFirstVerse(Element chord, Lyric lyric) {
        removeFirstVerse(chord);
        append(chord, lyric.toBuilder().verse("").build());
    }
}
