package com.myorg.choirsplit.service.implementation;

import com.myorg.choirsplit.exception.ScoreStructureException;
import com.myorg.choirsplit.service.ScorePass;
import com.myorg.choirsplit.service.TransformationContext;
import com.myorg.choirsplit.service.processing.XmlNodes;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Element;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Gives every two-voice staff a second staff and a second part.
 * <p>
 * Staff ids are renumbered first so that each split staff leaves a free id right after
 * itself; the duplicate takes that id. The resulting mapping (split id to duplicate id)
 * is stored in the context and drives every later pass.
 */
@Slf4j
public class PartStaffSplitter implements ScorePass {

    @Override
    public String name() {
        return "split-staves";
    }

    @Override
    public void apply(TransformationContext context) {
        Set<Integer> toSplit = stavesNeedingSplit(context);
        if (toSplit.isEmpty()) {
            log.info("No staff carries a second voice, nothing to split");
            return;
        }
        renumber(context, toSplit);
        separateMultiStaffParts(context);
        duplicateParts(context);
        duplicateStaves(context);
        log.info("Split {} staves: {}", context.getStaffMapping().size(), context.getStaffMapping());
    }

    /** Ids of content staves where at least one measure holds more than one voice. */
    Set<Integer> stavesNeedingSplit(TransformationContext context) {
        Set<Integer> out = new HashSet<>();
        for (Element staff : context.contentStaves()) {
            boolean twoVoices = XmlNodes.children(staff, "Measure").stream()
                    .anyMatch(m -> XmlNodes.children(m, "voice").size() > 1);
            if (twoVoices) out.add(XmlNodes.staffId(staff));
        }
        return out;
    }

    /**
     * Part stubs and content staves are numbered in two runs, each starting again at the
     * element whose original id is 1. A split staff takes two numbers.
     */
    private void renumber(TransformationContext context, Set<Integer> toSplit) {
        Map<Integer, Integer> mapping = context.getStaffMapping();
        List<Element> staves = XmlNodes.descendants(context.getScore(), "Staff");
        int next = 1;
        for (Element staff : staves) {
            int original = XmlNodes.staffId(staff);
            if (original == 1) next = 1;
            staff.setAttribute("id", String.valueOf(next));
            if (toSplit.contains(original)) {
                mapping.put(next, next + 1);
                next += 2;
            } else {
                next += 1;
            }
        }
    }

    /** A part holding several staff stubs becomes one part per stub. */
    private void separateMultiStaffParts(TransformationContext context) {
        for (Element part : context.parts()) {
            List<Element> stubs = XmlNodes.children(part, "Staff");
            if (stubs.size() < 2) continue;
            Element anchor = part;
            for (int i = 1; i < stubs.size(); i++) {
                Element copy = XmlNodes.deepCopy(part);
                List<Element> copyStubs = XmlNodes.children(copy, "Staff");
                for (int j = 0; j < copyStubs.size(); j++) {
                    if (j != i) XmlNodes.remove(copyStubs.get(j));
                }
                XmlNodes.insertAfter(copy, anchor);
                anchor = copy;
            }
            for (int i = 1; i < stubs.size(); i++) XmlNodes.remove(stubs.get(i));
            log.debug("Separated part with {} staves", stubs.size());
        }
    }

    private void duplicateParts(TransformationContext context) {
        Map<Integer, Integer> mapping = context.getStaffMapping();
        for (Element part : context.parts()) {
            Element stub = XmlNodes.child(part, "Staff");
            if (stub == null) {
                throw new ScoreStructureException("museScore/Score/Part/Staff", "Part has no staff");
            }
            Integer duplicateId = mapping.get(XmlNodes.staffId(stub));
            if (duplicateId == null) continue;
            Element copy = XmlNodes.deepCopy(part);
            XmlNodes.child(copy, "Staff").setAttribute("id", String.valueOf(duplicateId));
            XmlNodes.insertAfter(copy, part);
        }
    }

    private void duplicateStaves(TransformationContext context) {
        for (Map.Entry<Integer, Integer> e : context.getStaffMapping().entrySet()) {
            Element staff = context.contentStaff(e.getKey());
            if (staff == null) {
                throw new ScoreStructureException("museScore/Score/Staff/Measure",
                        "No content for staff " + e.getKey());
            }
            Element copy = XmlNodes.deepCopy(staff);
            copy.setAttribute("id", String.valueOf(e.getValue()));
            XmlNodes.insertAfter(copy, staff);
        }
    }
}
