package com.myorg.choirsplit.service.implementation;

import com.myorg.choirsplit.model.PipelineWarning;
import com.myorg.choirsplit.model.SplitReport;
import com.myorg.choirsplit.service.SplitReporter;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Workbook view of a {@link SplitReport}: a summary sheet plus one sheet each for the
 * staff mapping, measure outcomes, part labels and warnings.
 */
@Slf4j
public class ExcelSplitReporter implements SplitReporter {
    static final String SUMMARY_SHEET = "Summary";
    static final String MAPPING_SHEET = "Staff Mapping";
    static final String MEASURES_SHEET = "Measures";
    static final String LABELS_SHEET = "Part Labels";
    static final String WARNINGS_SHEET = "Warnings";

    // autoSizeColumn gets slow on big sheets
    private static final int AUTO_SIZE_LIMIT = 2000;

    private final File outputFile;

    public ExcelSplitReporter(File outputFile) {
        this.outputFile = outputFile;
    }

    @Override
    public void write(SplitReport report) throws IOException {
        File parent = outputFile.getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            log.warn("Could not create parent directories for: {}", parent.getAbsolutePath());
        }

        try (Workbook workbook = new XSSFWorkbook()) {
            CellStyle header = workbook.createCellStyle();
            Font bold = workbook.createFont();
            bold.setBold(true);
            header.setFont(bold);

            Sheet summary = workbook.createSheet(SUMMARY_SHEET);
            addRow(summary, 0, header, "Metric", "Value");
            addRow(summary, 1, null, "Source", report.getSource());
            addRow(summary, 2, null, "Output", report.getOutput());
            addRow(summary, 3, null, "Staves before", report.getStavesBefore());
            addRow(summary, 4, null, "Staves after", report.getStavesAfter());
            addRow(summary, 5, null, "Resolution (ticks per whole)", report.getResolution());
            addRow(summary, 6, null, "Lyrics collected", report.getLyricCount());
            addRow(summary, 7, null, "Lyrics corrected externally", report.getLyricsCorrected());
            addRow(summary, 8, null, "Repaired measures", report.getRepairedMeasures().size());
            addRow(summary, 9, null, "Unfixable measures", report.getUnfixableMeasures().size());
            addRow(summary, 10, null, "Warnings", report.getWarnings().size());

            Sheet mapping = workbook.createSheet(MAPPING_SHEET);
            addRow(mapping, 0, header, "Split staff", "Duplicate staff");
            int r = 1;
            for (Map.Entry<Integer, Integer> e : report.getStaffMapping().entrySet()) {
                addRow(mapping, r++, null, e.getKey(), e.getValue());
            }

            Sheet measures = workbook.createSheet(MEASURES_SHEET);
            addRow(measures, 0, header, "Staff", "Measure", "Outcome");
            r = 1;
            for (Integer m : report.getRepairedMeasures()) addRow(measures, r++, null, "", m + 1, "repaired");
            for (Integer m : report.getUnfixableMeasures()) addRow(measures, r++, null, "", m + 1, "unfixable");
            for (Map.Entry<Integer, List<Integer>> e : report.getReversedMeasures().entrySet()) {
                for (Integer m : e.getValue()) addRow(measures, r++, null, e.getKey(), m + 1, "voices reversed");
            }

            Sheet labels = workbook.createSheet(LABELS_SHEET);
            addRow(labels, 0, header, "Staff", "Label");
            r = 1;
            for (Map.Entry<Integer, String> e : report.getPartLabels().entrySet()) {
                addRow(labels, r++, null, e.getKey(), e.getValue());
            }

            Sheet warnings = workbook.createSheet(WARNINGS_SHEET);
            addRow(warnings, 0, header, "Stage", "Staff", "Measure", "Message");
            List<PipelineWarning> all = report.getWarnings();
            for (int i = 0; i < all.size(); i++) {
                PipelineWarning w = all.get(i);
                addRow(warnings, i + 1, null, w.getStage(), w.getStaffId(),
                        w.getMeasureIndex() == null ? null : w.getMeasureIndex() + 1, w.getMessage());
            }

            autoSize(summary, 2);
            autoSize(mapping, 2);
            autoSize(measures, 3);
            autoSize(labels, 2);
            if (all.size() < AUTO_SIZE_LIMIT) {
                autoSize(warnings, 4);
            } else {
                warnings.setColumnWidth(0, 5000);
                warnings.setColumnWidth(3, 20000);
            }

            try (FileOutputStream fos = new FileOutputStream(outputFile)) {
                workbook.write(fos);
            }
        }
        log.info("✅ Split report written to {}", outputFile.getAbsolutePath());
    }

    private void addRow(Sheet sheet, int rowIndex, CellStyle style, Object... values) {
        Row row = sheet.createRow(rowIndex);
        for (int c = 0; c < values.length; c++) {
            if (values[c] == null) continue;
            var cell = row.createCell(c);
            if (values[c] instanceof Number) {
                cell.setCellValue(((Number) values[c]).doubleValue());
            } else {
                cell.setCellValue(String.valueOf(values[c]));
            }
            if (style != null) cell.setCellStyle(style);
        }
    }

    private void autoSize(Sheet sheet, int cols) {
        for (int c = 0; c < cols; c++) sheet.autoSizeColumn(c);
    }
}
