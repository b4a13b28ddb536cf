package com.myorg.choirsplit.service.processing;

import com.myorg.choirsplit.model.StaffEvent;
import org.w3c.dom.Element;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Streams the events of a staff in document order: measures, then voices, then
 * the elements of each voice. Each event carries the time position at which it
 * starts; Chord and Rest advance the clock by their duration, {@code location}
 * by its {@code fractions} offset, everything else by nothing.
 * <p>
 * Streams are lazy. A voice's children are snapshot when the walk enters that
 * voice, so removing the current element is safe, inserting new siblings is not seen.
 */
public class TreeWalker {

    private final DurationResolver durations;

    public TreeWalker(DurationResolver durations) {
        this.durations = durations;
    }

    public Stream<StaffEvent> walk(Element staff) {
        int staffId = XmlNodes.staffId(staff);
        List<Element> measures = XmlNodes.children(staff, "Measure");
        return IntStream.range(0, measures.size())
                .boxed()
                .flatMap(mi -> walkMeasure(staffId, mi, measures.get(mi)));
    }

    public Stream<StaffEvent> walkMeasure(int staffId, int measureIndex, Element measure) {
        List<Element> voices = XmlNodes.children(measure, "voice");
        return IntStream.range(0, voices.size())
                .boxed()
                .flatMap(vi -> walkVoice(staffId, measureIndex, vi, voices.get(vi)));
    }

    public Stream<StaffEvent> walkVoice(int staffId, int measureIndex, int voiceIndex, Element voice) {
        Iterator<StaffEvent> it = new Iterator<>() {
            private List<Element> elements;
            private int next;
            private int time;

            @Override
            public boolean hasNext() {
                if (elements == null) elements = XmlNodes.childElements(voice);
                return next < elements.size();
            }

            @Override
            public StaffEvent next() {
                if (!hasNext()) throw new NoSuchElementException();
                Element e = elements.get(next++);
                StaffEvent event = new StaffEvent(staffId, measureIndex, voiceIndex, time, e);
                time += advance(e);
                return event;
            }
        };
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(it, Spliterator.ORDERED), false);
    }

    /** Ticks the clock moves on after {@code e}. */
    public int advance(Element e) {
        switch (e.getTagName()) {
            case "Chord":
            case "Rest":
                return durations.resolve(e);
            case "location":
                return durations.resolveFraction(XmlNodes.childText(e, "fractions"));
            default:
                return 0;
        }
    }

    /** Resolved length of one voice. */
    public int voiceLength(Element voice) {
        int total = 0;
        for (Element e : XmlNodes.childElements(voice)) total += advance(e);
        return total;
    }

    public DurationResolver getDurations() {
        return durations;
    }
}
