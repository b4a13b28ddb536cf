package com.myorg.choirsplit.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import org.w3c.dom.Element;

/**
 * One element of a voice together with where it sits: staff, measure, voice and
 * the time position at which it starts.
 */
@Getter
@ToString(exclude = "element")
@AllArgsConstructor
public class StaffEvent {
    private final int staffId;
    private final int measureIndex;
    private final int voiceIndex;
    private final int timePos;
    private final Element element;

    public String getTag() {
        return element.getTagName();
    }

    public boolean isChord() {
        return "Chord".equals(element.getTagName());
    }

    public boolean isRest() {
        return "Rest".equals(element.getTagName());
    }

    public MeasurePosition position() {
        return MeasurePosition.of(measureIndex, timePos);
    }
}
