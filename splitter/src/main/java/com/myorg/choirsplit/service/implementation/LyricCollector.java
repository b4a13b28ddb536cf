package com.myorg.choirsplit.service.implementation;

import com.myorg.choirsplit.model.Lyric;
import com.myorg.choirsplit.model.LyricOccurrence;
import com.myorg.choirsplit.model.StaffEvent;
import com.myorg.choirsplit.service.ScorePass;
import com.myorg.choirsplit.service.TransformationContext;
import com.myorg.choirsplit.service.processing.LyricTable;
import com.myorg.choirsplit.service.processing.XmlNodes;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Element;

/**
 * Fills the context's lyric table from every staff before filtering throws voices away.
 * Duplicates are skipped, their content is identical to the staff they were copied from.
 */
@Slf4j
public class LyricCollector implements ScorePass {

    @Override
    public String name() {
        return "collect-lyrics";
    }

    @Override
    public void apply(TransformationContext context) {
        LyricTable table = context.getLyricTable();
        for (Element staff : context.contentStaves()) {
            int staffId = XmlNodes.staffId(staff);
            if (context.isDuplicate(staffId)) continue;
            context.getWalker().walk(staff)
                    .filter(StaffEvent::isChord)
                    .forEach(ev -> collect(context, table, staffId, ev));
        }
        log.info("Collected {} lyrics", table.size());
    }

    private void collect(TransformationContext context, LyricTable table, int staffId, StaffEvent ev) {
        int line = ev.getVoiceIndex();
        if (context.isReversed(staffId, ev.getMeasureIndex()) && line < 2) {
            line = 1 - line;
        }
        for (Lyric lyric : LyricElements.readAll(ev.getElement())) {
            table.add(LyricOccurrence.builder()
                    .staffId(staffId)
                    .measureIndex(ev.getMeasureIndex())
                    .line(line)
                    .timePos(ev.getTimePos())
                    .lyric(lyric)
                    .build());
        }
    }
}
