package com.myorg.choirsplit.service.implementation;

import com.myorg.choirsplit.service.ScorePass;
import com.myorg.choirsplit.service.TransformationContext;
import com.myorg.choirsplit.service.processing.DurationResolver;
import com.myorg.choirsplit.service.processing.TreeWalker;
import com.myorg.choirsplit.service.processing.XmlNodes;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Trims measures whose declared {@code len} disagrees with the time signature in force.
 * <p>
 * Measures are flagged per staff, then handled per measure index across all staves:
 * either every voice of every flagged staff can be cut back to the time signature by
 * deleting or shortening trailing rests, or nothing in that measure index is touched.
 */
@Slf4j
public class CorruptedMeasureRepairer implements ScorePass {

    private static final String STAGE = "measure-repair";

    @Override
    public String name() {
        return STAGE;
    }

    @Override
    public void apply(TransformationContext context) {
        DurationResolver durations = context.getDurations();
        Map<Integer, List<FlaggedMeasure>> byIndex = new TreeMap<>();

        for (Element staff : context.contentStaves()) {
            int staffId = XmlNodes.staffId(staff);
            int sigN = 4;
            int sigD = 4;
            List<Element> measures = XmlNodes.children(staff, "Measure");
            for (int mi = 0; mi < measures.size(); mi++) {
                Element measure = measures.get(mi);
                Element timeSig = XmlNodes.firstDescendant(measure, "TimeSig");
                if (timeSig != null) {
                    Integer n = XmlNodes.childInt(timeSig, "sigN");
                    Integer d = XmlNodes.childInt(timeSig, "sigD");
                    if (n != null && d != null && d > 0) {
                        sigN = n;
                        sigD = d;
                    }
                }
                String len = measure.getAttribute("len");
                if (len == null || !len.contains("/")) continue;
                int expected = durations.measureTicks(sigN, sigD);
                if (durations.resolveFraction(len) == expected) continue;
                byIndex.computeIfAbsent(mi, k -> new ArrayList<>())
                        .add(new FlaggedMeasure(staffId, measure, expected));
            }
        }

        for (Map.Entry<Integer, List<FlaggedMeasure>> entry : byIndex.entrySet()) {
            repairMeasureIndex(context, entry.getKey(), entry.getValue());
        }
    }

    private void repairMeasureIndex(TransformationContext context, int measureIndex, List<FlaggedMeasure> flagged) {
        TreeWalker walker = context.getWalker();
        List<VoicePlan> plans = new ArrayList<>();
        for (FlaggedMeasure fm : flagged) {
            List<Element> voices = XmlNodes.children(fm.measure, "voice");
            int longest = 0;
            for (Element voice : voices) longest = Math.max(longest, walker.voiceLength(voice));
            for (Element voice : voices) {
                VoicePlan plan = planVoice(walker, voice, fm.expected, longest);
                if (plan.unfixableReason != null) {
                    context.getUnfixableMeasures().add(measureIndex);
                    context.warn(STAGE, fm.staffId, measureIndex,
                            "measure left unchanged: " + plan.unfixableReason);
                    return;
                }
                plans.add(plan);
            }
        }

        boolean changed = plans.stream().anyMatch(VoicePlan::hasEdits);
        if (!changed) {
            log.debug("Measure {} declares another length but needs no trimming", measureIndex);
            return;
        }
        for (VoicePlan plan : plans) plan.apply();
        for (FlaggedMeasure fm : flagged) fm.measure.removeAttribute("len");
        context.getRepairedMeasures().add(measureIndex);
        log.info("Repaired measure {} on {} staves", measureIndex + 1, flagged.size());
    }

    /**
     * Works out the edits that cut one voice back to {@code expected} ticks.
     * {@code longest} is the longest voice of the measure: a voice reaching it must end in a rest.
     */
    VoicePlan planVoice(TreeWalker walker, Element voice, int expected, int longest) {
        VoicePlan plan = new VoicePlan();
        List<Element> timed = new ArrayList<>();
        Map<Element, Integer> starts = new LinkedHashMap<>();
        int time = 0;
        for (Element e : XmlNodes.childElements(voice)) {
            starts.put(e, time);
            int step = walker.advance(e);
            if (isTimed(e)) timed.add(e);
            time += step;
        }
        int end = time;

        if (end == longest && end > expected && !timed.isEmpty()) {
            Element last = timed.get(timed.size() - 1);
            if (!"Rest".equals(last.getTagName())) {
                return plan.unfixable("voice ends with " + last.getTagName() + " instead of a rest");
            }
        }

        List<Element> all = XmlNodes.childElements(voice);
        boolean cutting = false;
        Element previous = null;
        for (Element e : all) {
            int start = starts.get(e);
            if (cutting) {
                if ("Chord".equals(e.getTagName())) return plan.unfixable("chord beyond the time signature");
                plan.removals.add(e);
                continue;
            }
            if (!isTimed(e)) continue;
            if (start == expected) {
                if ("Chord".equals(e.getTagName())) return plan.unfixable("chord starts on the bar line");
                plan.removals.add(e);
                cutting = true;
            } else if (start > expected) {
                String reason = shortenPrevious(walker.getDurations(), plan, previous, starts, expected);
                if (reason != null) return plan.unfixable(reason);
                if ("Chord".equals(e.getTagName())) return plan.unfixable("chord beyond the time signature");
                plan.removals.add(e);
                cutting = true;
            }
            previous = e;
        }
        // the last event itself runs past the bar line
        if (!cutting && end > expected && previous != null && starts.get(previous) < expected) {
            String reason = shortenPrevious(walker.getDurations(), plan, previous, starts, expected);
            if (reason != null) return plan.unfixable(reason);
        }
        return plan;
    }

    private String shortenPrevious(DurationResolver durations, VoicePlan plan, Element previous,
                                   Map<Element, Integer> starts, int expected) {
        if (previous == null) return "nothing before the overshoot to shorten";
        if (!"Rest".equals(previous.getTagName())) return previous.getTagName() + " crosses the bar line";
        int remaining = expected - starts.get(previous);
        if (remaining <= 0) {
            plan.removals.add(previous);
            return null;
        }
        var encoding = durations.encode(remaining);
        if (encoding.isEmpty()) return "no rest value fits " + remaining + " ticks";
        plan.shortenings.put(previous, encoding.get());
        return null;
    }

    private static boolean isTimed(Element e) {
        String tag = e.getTagName();
        return "Chord".equals(tag) || "Rest".equals(tag) || "location".equals(tag);
    }

    static void shortenRest(Element rest, DurationResolver.Encoding encoding) {
        XmlNodes.setChildText(rest, "durationType", encoding.getDurationType());
        if (encoding.getDots() == 0) {
            XmlNodes.remove(XmlNodes.child(rest, "dots"));
        } else {
            XmlNodes.setChildText(rest, "dots", String.valueOf(encoding.getDots()));
        }
        XmlNodes.remove(XmlNodes.child(rest, "duration"));
    }

    private static class FlaggedMeasure {
        final int staffId;
        final Element measure;
        final int expected;

        FlaggedMeasure(int staffId, Element measure, int expected) {
            this.staffId = staffId;
            this.measure = measure;
            this.expected = expected;
        }
    }

    static class VoicePlan {
        final List<Element> removals = new ArrayList<>();
        final Map<Element, DurationResolver.Encoding> shortenings = new LinkedHashMap<>();
        String unfixableReason;

        VoicePlan unfixable(String reason) {
            this.unfixableReason = reason;
            return this;
        }

        boolean hasEdits() {
            return !removals.isEmpty() || !shortenings.isEmpty();
        }

        void apply() {
            shortenings.forEach(CorruptedMeasureRepairer::shortenRest);
            XmlNodes.removeAll(removals);
        }
    }
}
