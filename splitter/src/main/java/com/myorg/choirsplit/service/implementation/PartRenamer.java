package com.myorg.choirsplit.service.implementation;

import com.myorg.choirsplit.exception.ValidationException;
import com.myorg.choirsplit.service.TransformationContext;
import com.myorg.choirsplit.service.processing.XmlNodes;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renames parts from a part string such as "SSAA" (S1, S2, A1, A2) or "SSSSAA"
 * (S1-1, S1-2, S2-1, S2-2, A1, A2), then makes sure a "Click" staff of eighth rests
 * follows the named parts.
 */
@Slf4j
public class PartRenamer {

    static final String CLICK = "Click";

    private static final Map<Character, String> FULL_NAMES = new LinkedHashMap<>();

    static {
        FULL_NAMES.put('S', "Soprano");
        FULL_NAMES.put('A', "Alto");
        FULL_NAMES.put('T', "Tenor");
        FULL_NAMES.put('B', "Bass");
        FULL_NAMES.put('M', "Men");
        FULL_NAMES.put('W', "Women");
    }

    public void rename(TransformationContext context, String partString) {
        List<PartName> names = names(partString);
        List<Element> parts = context.parts();
        if (parts.size() < names.size()) {
            throw new ValidationException("Part string names " + names.size() + " parts but the score has only "
                    + parts.size());
        }
        for (int i = 0; i < names.size(); i++) {
            PartName name = names.get(i);
            Element part = parts.get(i);
            if (XmlNodes.hasChild(part, "trackName")) XmlNodes.setChildText(part, "trackName", name.getFullName());
            Element instrument = XmlNodes.child(part, "Instrument");
            if (instrument == null) continue;
            XmlNodes.setChildText(instrument, "longName", name.getFullName());
            XmlNodes.setChildText(instrument, "shortName", name.getShortName());
            XmlNodes.setChildText(instrument, "trackName", name.getFullName());
        }
        log.info("Renamed {} parts: {}", names.size(), names);
        ensureClickStaff(context, names.size());
    }

    /** One name per letter; runs of three or more of the same letter are numbered in pairs. */
    public List<PartName> names(String partString) {
        String letters = partString == null ? "" : partString.trim().toUpperCase(Locale.ROOT);
        if (letters.isEmpty()) throw new ValidationException("Part string must not be empty");
        for (char c : letters.toCharArray()) {
            if (!FULL_NAMES.containsKey(c)) {
                throw new ValidationException("Invalid part letter '" + c + "'. Allowed: S, A, T, B, M, W");
            }
        }
        List<PartName> out = new ArrayList<>();
        int i = 0;
        while (i < letters.length()) {
            char letter = letters.charAt(i);
            int run = 0;
            while (i + run < letters.length() && letters.charAt(i + run) == letter) run++;
            String full = FULL_NAMES.get(letter);
            for (int k = 0; k < run; k++) {
                String suffix;
                if (run < 3) {
                    suffix = String.valueOf(k + 1);
                } else {
                    int group = k / 2 + 1;
                    if (k % 2 == 1) {
                        suffix = group + "-2";
                    } else if (k + 1 < run) {
                        suffix = group + "-1";
                    } else {
                        suffix = String.valueOf(group);
                    }
                }
                out.add(new PartName(letter + suffix, full + " " + suffix));
            }
            i += run;
        }
        return out;
    }

    private void ensureClickStaff(TransformationContext context, int namedParts) {
        List<int[]> signatures = timeSignatures(context);
        if (signatures.isEmpty()) return;
        int clickId = namedParts + 1;
        Element score = context.getScore();
        Document doc = context.getDocument();
        List<Element> parts = context.parts();

        if (parts.size() <= namedParts) {
            Element part = clickPart(doc, clickId);
            Element firstStaff = XmlNodes.child(score, "Staff");
            if (firstStaff != null) {
                score.insertBefore(part, firstStaff);
            } else {
                score.appendChild(part);
            }
        } else {
            Element stub = XmlNodes.child(parts.get(namedParts), "Staff");
            if (stub != null) layoutAsClick(stub);
        }

        Element content = context.contentStaff(clickId);
        if (content == null) {
            content = doc.createElement("Staff");
            content.setAttribute("id", String.valueOf(clickId));
            score.appendChild(content);
        }
        XmlNodes.removeAll(XmlNodes.children(content, "Measure"));
        for (int i = 0; i < signatures.size(); i++) {
            int[] sig = signatures.get(i);
            boolean changed = i == 0 || sig[0] != signatures.get(i - 1)[0] || sig[1] != signatures.get(i - 1)[1];
            Element measure = doc.createElement("Measure");
            measure.appendChild(eighthRests(doc, sig[0], sig[1], changed));
            content.appendChild(measure);
        }
        log.info("Click staff {} holds {} measures of eighth rests", clickId, signatures.size());
    }

    /** (sigN, sigD) per measure of the first staff with content. */
    private List<int[]> timeSignatures(TransformationContext context) {
        List<int[]> out = new ArrayList<>();
        List<Element> staves = context.contentStaves();
        if (staves.isEmpty()) return out;
        int[] current = {4, 4};
        for (Element measure : XmlNodes.children(staves.get(0), "Measure")) {
            Element timeSig = XmlNodes.child(XmlNodes.child(measure, "voice"), "TimeSig");
            if (timeSig != null) {
                Integer n = XmlNodes.childInt(timeSig, "sigN");
                Integer d = XmlNodes.childInt(timeSig, "sigD");
                if (n != null && d != null && d > 0) current = new int[]{n, d};
            }
            out.add(current);
        }
        return out;
    }

    private Element eighthRests(Document doc, int sigN, int sigD, boolean withTimeSig) {
        Element voice = doc.createElement("voice");
        if (withTimeSig) {
            Element ts = doc.createElement("TimeSig");
            XmlNodes.appendTextElement(ts, "sigN", String.valueOf(sigN));
            XmlNodes.appendTextElement(ts, "sigD", String.valueOf(sigD));
            voice.appendChild(ts);
        }
        for (int i = 0; i < sigN * 8 / sigD; i++) {
            Element rest = doc.createElement("Rest");
            XmlNodes.appendTextElement(rest, "durationType", "eighth");
            voice.appendChild(rest);
        }
        return voice;
    }

    private Element clickPart(Document doc, int staffId) {
        Element part = doc.createElement("Part");
        Element stub = doc.createElement("Staff");
        stub.setAttribute("id", String.valueOf(staffId));
        Element staffType = doc.createElement("StaffType");
        staffType.setAttribute("group", "pitched");
        XmlNodes.appendTextElement(staffType, "name", "stdNormal");
        stub.appendChild(staffType);
        part.appendChild(stub);
        layoutAsClick(stub);
        XmlNodes.appendTextElement(part, "trackName", CLICK);

        Element instrument = doc.createElement("Instrument");
        instrument.setAttribute("id", "piano");
        XmlNodes.appendTextElement(instrument, "longName", CLICK);
        XmlNodes.appendTextElement(instrument, "shortName", CLICK);
        XmlNodes.appendTextElement(instrument, "trackName", CLICK);
        XmlNodes.appendTextElement(instrument, "instrumentId", "keyboard.piano");
        XmlNodes.appendTextElement(instrument, "minPitchP", "21");
        XmlNodes.appendTextElement(instrument, "maxPitchP", "108");
        XmlNodes.appendTextElement(instrument, "minPitchA", "21");
        XmlNodes.appendTextElement(instrument, "maxPitchA", "108");
        Element channel = doc.createElement("Channel");
        Element program = doc.createElement("program");
        program.setAttribute("value", "0");
        channel.appendChild(program);
        XmlNodes.appendTextElement(channel, "synti", "Fluid");
        instrument.appendChild(channel);
        part.appendChild(instrument);
        return part;
    }

    /** Own bracket, no bar line span, pushed 50 spaces away from the staves above. */
    private void layoutAsClick(Element stub) {
        Element bracket = XmlNodes.child(stub, "bracket");
        if (bracket == null) {
            bracket = stub.getOwnerDocument().createElement("bracket");
            stub.appendChild(bracket);
        }
        bracket.setAttribute("type", "-1");
        bracket.setAttribute("span", "1");
        bracket.setAttribute("col", "0");
        if (!XmlNodes.hasChild(stub, "barLineSpan")) XmlNodes.appendTextElement(stub, "barLineSpan", "1");
        XmlNodes.setChildText(stub, "distOffset", "50");
    }

    @Getter
    @ToString
    @AllArgsConstructor
    public static class PartName {
        private final String shortName;
        private final String fullName;
    }
}
