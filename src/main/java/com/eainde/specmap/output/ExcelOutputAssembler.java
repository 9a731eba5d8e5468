package com.eainde.specmap.output;

import com.eainde.specmap.exception.SpecMapException;
import com.eainde.specmap.model.AnalysisResult;
import com.eainde.specmap.model.CanonicalSpec;
import com.eainde.specmap.model.CellCoordinate;
import com.eainde.specmap.model.FragmentIssue;
import com.eainde.specmap.model.MappingResult;
import com.eainde.specmap.model.ReferenceRecord;
import com.eainde.specmap.model.RunSummary;
import com.eainde.specmap.model.TemplateSlot;
import com.eainde.specmap.terminology.TermNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.ClientAnchor;
import org.apache.poi.ss.usermodel.Comment;
import org.apache.poi.ss.usermodel.CreationHelper;
import org.apache.poi.ss.usermodel.Drawing;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFColor;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the result workbook.
 *
 * <ul>
 *   <li><b>Spec Summary</b>: the template with values at mapped slots, a comment with the
 *       reference excerpt and a fill by {@link ConfidenceBand}</li>
 *   <li><b>Reference</b>: every reference record</li>
 *   <li><b>Unmatched</b>: specs without an accepted slot</li>
 *   <li><b>Run Summary</b>: counts and fragment issues</li>
 * </ul>
 *
 * The template file itself is never modified.
 */
@Slf4j
public class ExcelOutputAssembler {

    public static final String SUMMARY_SHEET = "Spec Summary";
    public static final String REFERENCE_SHEET = "Reference";
    public static final String UNMATCHED_SHEET = "Unmatched";
    public static final String RUN_SUMMARY_SHEET = "Run Summary";

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final String AUTHOR = "RFQ Spec Mapper";

    static final List<String> REFERENCE_HEADERS = List.of(
            "Standard Name", "Raw Spec Name", "Value", "Unit", "Condition", "Source File", "Location",
            "Original Text", "Translated Text", "Confidence", "Mapping Status", "Translation Status", "Flag");

    static final List<String> UNMATCHED_HEADERS = List.of(
            "Standard Name", "Value", "Unit", "Confidence", "Best Slot Score", "Sources", "Non-standard", "Unit Conflict");

    public static String outputFileName(LocalDateTime timestamp) {
        return "RFQ_Spec_Result_" + FILE_STAMP.format(timestamp) + ".xlsx";
    }

    /**
     * @return the written file
     */
    public Path write(Path templateFile, Path outputFile, AnalysisResult result) {
        try (InputStream in = Files.newInputStream(templateFile);
             XSSFWorkbook workbook = new XSSFWorkbook(in)) {

            Styles styles = new Styles(workbook);
            workbook.setSheetName(0, SUMMARY_SHEET);
            writeMapped(workbook, workbook.getSheetAt(0), result, styles);
            writeReference(freshSheet(workbook, REFERENCE_SHEET), result.references(), styles);
            writeUnmatched(freshSheet(workbook, UNMATCHED_SHEET), result.unmatched(), styles);
            writeRunSummary(freshSheet(workbook, RUN_SUMMARY_SHEET), result.summary(), result.issues(), styles);

            if (outputFile.getParent() != null) {
                Files.createDirectories(outputFile.getParent());
            }
            try (OutputStream out = Files.newOutputStream(outputFile)) {
                workbook.write(out);
            }
            log.info("Wrote {} ({} mapped, {} references, {} unmatched)",
                    outputFile, result.mapped().size(), result.references().size(), result.unmatched().size());
            return outputFile;
        } catch (IOException e) {
            throw new SpecMapException("Failed to write result workbook " + outputFile, e);
        }
    }

    // =========================================================================
    //  Spec Summary
    // =========================================================================

    private void writeMapped(XSSFWorkbook workbook, Sheet sheet, AnalysisResult result, Styles styles) {
        CreationHelper helper = workbook.getCreationHelper();
        Drawing<?> drawing = sheet.createDrawingPatriarch();

        for (MappingResult mapping : result.mapped()) {
            CanonicalSpec spec = mapping.canonicalSpec();
            TemplateSlot slot = mapping.slot();
            CellCoordinate at = slot.cellCoordinate();

            Row row = sheet.getRow(at.row()) != null ? sheet.getRow(at.row()) : sheet.createRow(at.row());
            Cell cell = row.getCell(at.column()) != null ? row.getCell(at.column()) : row.createCell(at.column());

            if (isBareNumber(spec, slot)) {
                cell.setCellValue(spec.resolvedValue());
            } else {
                cell.setCellValue(formatValue(spec.resolvedValue()) + " " + spec.resolvedUnit());
            }
            cell.setCellStyle(styles.band(ConfidenceBand.of(spec.resolvedConfidence())));

            cell.removeCellComment();
            ClientAnchor anchor = helper.createClientAnchor();
            anchor.setCol1(at.column() + 1);
            anchor.setCol2(at.column() + 5);
            anchor.setRow1(at.row());
            anchor.setRow2(at.row() + 6);
            Comment comment = drawing.createCellComment(anchor);
            comment.setString(helper.createRichTextString(commentText(spec, result.referencesOf(spec))));
            comment.setAuthor(AUTHOR);
            cell.setCellComment(comment);
        }
    }

    /**
     * A bare number only when the slot's unit is the resolved unit, or there is no unit at all.
     * "700 µm" in a "[mm]" slot keeps its unit text.
     */
    static boolean isBareNumber(CanonicalSpec spec, TemplateSlot slot) {
        String unit = unitKey(spec.resolvedUnit());
        if (unit.isEmpty()) {
            return true;
        }
        return slot.hasExpectedUnit() && unit.equals(unitKey(slot.expectedUnit()));
    }

    private static String unitKey(String unit) {
        return TermNormalizer.normalize(unit).replace(" ", "");
    }

    static String commentText(CanonicalSpec spec, List<ReferenceRecord> references) {
        StringBuilder sb = new StringBuilder();
        ReferenceRecord primary = references.stream()
                .filter(r -> r.instance().value() == spec.resolvedValue() && r.instance().unit().equals(spec.resolvedUnit())
                        && r.confidence() == spec.resolvedConfidence())
                .findFirst()
                .orElse(references.isEmpty() ? null : references.get(0));
        if (primary != null) {
            sb.append("Source: ").append(primary.sourceFile()).append(" / ").append(primary.locator().label()).append('\n');
            sb.append("Original: ").append(primary.originalText()).append('\n');
            if (!primary.translatedText().equals(primary.originalText())) {
                sb.append("Translated: ").append(primary.translatedText()).append('\n');
            }
        }
        ConfidenceBand band = ConfidenceBand.of(spec.resolvedConfidence());
        sb.append(String.format("Confidence: %.2f (%s)", spec.resolvedConfidence(), band));
        if (references.size() > 1) {
            sb.append("\nSources: ").append(references.size());
        }
        if (spec.unitConflict()) {
            sb.append("\nUnit conflict between sources");
        }
        if (references.stream().anyMatch(ReferenceRecord::isFlagged)) {
            sb.append("\nTranslation failed for a source, check manually");
        }
        return sb.toString();
    }

    // =========================================================================
    //  Reference / Unmatched / Run Summary
    // =========================================================================

    private void writeReference(Sheet sheet, List<ReferenceRecord> references, Styles styles) {
        header(sheet, REFERENCE_HEADERS, styles);
        int r = 1;
        for (ReferenceRecord ref : references) {
            Row row = sheet.createRow(r++);
            int c = 0;
            row.createCell(c++).setCellValue(ref.standardName());
            row.createCell(c++).setCellValue(ref.instance().rawSpecName());
            row.createCell(c++).setCellValue(ref.instance().value());
            row.createCell(c++).setCellValue(ref.instance().unit());
            row.createCell(c++).setCellValue(ref.instance().condition() == null ? "" : ref.instance().condition());
            row.createCell(c++).setCellValue(ref.sourceFile());
            row.createCell(c++).setCellValue(ref.locator().label());
            row.createCell(c++).setCellValue(ref.originalText());
            row.createCell(c++).setCellValue(ref.translatedText());
            Cell confidence = row.createCell(c++);
            confidence.setCellValue(ref.confidence());
            confidence.setCellStyle(styles.band(ConfidenceBand.of(ref.confidence())));
            row.createCell(c++).setCellValue(ref.mappingStatus().name());
            row.createCell(c++).setCellValue(ref.translationStatus().name());
            row.createCell(c).setCellValue(ref.isFlagged() ? "REVIEW: translation failed" : "");
        }
        widths(sheet, 24, 24, 10, 10, 16, 28, 16, 50, 50, 12, 14, 18, 28);
    }

    private void writeUnmatched(Sheet sheet, List<MappingResult> unmatched, Styles styles) {
        header(sheet, UNMATCHED_HEADERS, styles);
        int r = 1;
        for (MappingResult mapping : unmatched) {
            CanonicalSpec spec = mapping.canonicalSpec();
            Row row = sheet.createRow(r++);
            row.createCell(0).setCellValue(spec.standardName());
            row.createCell(1).setCellValue(spec.resolvedValue());
            row.createCell(2).setCellValue(spec.resolvedUnit());
            Cell confidence = row.createCell(3);
            confidence.setCellValue(spec.resolvedConfidence());
            confidence.setCellStyle(styles.band(ConfidenceBand.of(spec.resolvedConfidence())));
            row.createCell(4).setCellValue(mapping.similarityScore());
            row.createCell(5).setCellValue(spec.contributingInstances().size());
            row.createCell(6).setCellValue(spec.isNonStandard() ? "yes" : "no");
            row.createCell(7).setCellValue(spec.unitConflict() ? "yes" : "no");
        }
        widths(sheet, 28, 10, 10, 12, 16, 10, 14, 14);
    }

    private void writeRunSummary(Sheet sheet, RunSummary summary, List<FragmentIssue> issues, Styles styles) {
        Object[][] counts = {
                {"Documents", summary.documents()},
                {"Fragments", summary.fragments()},
                {"Translated fragments", summary.translatedFragments()},
                {"Translation failures", summary.failedTranslations()},
                {"Extraction failures", summary.failedExtractions()},
                {"Extracted instances", summary.extractedInstances()},
                {"Canonical specs", summary.canonicalSpecs()},
                {"Mapped specs", summary.mappedSpecs()},
                {"Unmatched specs", summary.unmatchedSpecs()},
                {"Issues", summary.issues()}
        };
        header(sheet, List.of("Metric", "Count"), styles);
        int r = 1;
        for (Object[] line : counts) {
            Row row = sheet.createRow(r++);
            row.createCell(0).setCellValue((String) line[0]);
            row.createCell(1).setCellValue((Integer) line[1]);
        }

        r++;
        Row issueHeader = sheet.createRow(r++);
        List<String> issueColumns = List.of("Issue", "Location", "Message");
        for (int c = 0; c < issueColumns.size(); c++) {
            Cell cell = issueHeader.createCell(c);
            cell.setCellValue(issueColumns.get(c));
            cell.setCellStyle(styles.header);
        }
        for (FragmentIssue issue : issues) {
            Row row = sheet.createRow(r++);
            row.createCell(0).setCellValue(issue.kind().name());
            row.createCell(1).setCellValue(issue.location());
            row.createCell(2).setCellValue(issue.message() == null ? "" : issue.message());
        }
        widths(sheet, 26, 40, 80);
    }

    // =========================================================================
    //  Helpers
    // =========================================================================

    private static Sheet freshSheet(XSSFWorkbook workbook, String name) {
        int existing = workbook.getSheetIndex(name);
        if (existing >= 0) {
            workbook.removeSheetAt(existing);
        }
        return workbook.createSheet(name);
    }

    private static void header(Sheet sheet, List<String> headers, Styles styles) {
        Row row = sheet.createRow(0);
        for (int c = 0; c < headers.size(); c++) {
            Cell cell = row.createCell(c);
            cell.setCellValue(headers.get(c));
            cell.setCellStyle(styles.header);
        }
        sheet.createFreezePane(0, 1);
    }

    private static void widths(Sheet sheet, int... chars) {
        for (int c = 0; c < chars.length; c++) {
            sheet.setColumnWidth(c, chars[c] * 256);
        }
    }

    static String formatValue(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }

    /** One style per band, shared by all cells of the workbook. */
    private static final class Styles {
        final CellStyle header;
        final Map<ConfidenceBand, CellStyle> bands = new EnumMap<>(ConfidenceBand.class);

        Styles(XSSFWorkbook workbook) {
            header = workbook.createCellStyle();
            Font bold = workbook.createFont();
            bold.setBold(true);
            header.setFont(bold);

            for (ConfidenceBand band : ConfidenceBand.values()) {
                XSSFCellStyle style = workbook.createCellStyle();
                style.setFillForegroundColor(new XSSFColor(band.rgb(), null));
                style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
                bands.put(band, style);
            }
        }

        CellStyle band(ConfidenceBand band) {
            return bands.get(band);
        }
    }
}
