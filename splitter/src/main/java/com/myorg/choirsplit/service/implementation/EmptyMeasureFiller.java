package com.myorg.choirsplit.service.implementation;

import com.myorg.choirsplit.service.TransformationContext;
import com.myorg.choirsplit.service.processing.XmlNodes;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Element;

import java.util.List;

/**
 * Puts a full-measure rest into every voice that holds neither chord nor rest, and a
 * voice into every measure that has none. The rest is a measure rest sized by the time
 * signature in force: {@code <durationType>measure</durationType><duration>3/4</duration>}.
 */
@Slf4j
public class EmptyMeasureFiller {

    public int fill(TransformationContext context) {
        int added = 0;
        for (Element staff : context.contentStaves()) {
            int sigN = 4;
            int sigD = 4;
            for (Element measure : XmlNodes.children(staff, "Measure")) {
                Element timeSig = XmlNodes.firstDescendant(measure, "TimeSig");
                if (timeSig != null) {
                    Integer n = XmlNodes.childInt(timeSig, "sigN");
                    Integer d = XmlNodes.childInt(timeSig, "sigD");
                    if (n != null && d != null && d > 0) {
                        sigN = n;
                        sigD = d;
                    }
                }
                String length = sigN + "/" + sigD;
                List<Element> voices = XmlNodes.children(measure, "voice");
                if (voices.isEmpty()) {
                    Element voice = measure.getOwnerDocument().createElement("voice");
                    measure.appendChild(voice);
                    voices = List.of(voice);
                }
                for (Element voice : voices) {
                    if (XmlNodes.hasChild(voice, "Chord") || XmlNodes.hasChild(voice, "Rest")) continue;
                    Element rest = voice.getOwnerDocument().createElement("Rest");
                    XmlNodes.appendTextElement(rest, "durationType", "measure");
                    XmlNodes.appendTextElement(rest, "duration", length);
                    voice.appendChild(rest);
                    added++;
                }
            }
        }
        if (added > 0) log.info("Filled {} empty voices with rests", added);
        return added;
    }
}
