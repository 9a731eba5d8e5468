package com.eainde.specmap.output;

import com.eainde.specmap.model.AnalysisResult;
import com.eainde.specmap.model.CanonicalResolution;
import com.eainde.specmap.model.CanonicalSpec;
import com.eainde.specmap.model.CellCoordinate;
import com.eainde.specmap.model.DocumentFragment;
import com.eainde.specmap.model.ExtractedSpecInstance;
import com.eainde.specmap.model.FragmentIssue;
import com.eainde.specmap.model.FragmentLocator;
import com.eainde.specmap.model.MappingResult;
import com.eainde.specmap.model.MappingStatus;
import com.eainde.specmap.model.ReferenceRecord;
import com.eainde.specmap.model.RunSummary;
import com.eainde.specmap.model.TemplateSlot;
import com.eainde.specmap.model.TranslationStatus;
import com.eainde.specmap.model.UnitFamily;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExcelOutputAssemblerTest {

    @TempDir
    Path dir;

    private Path template;
    private final ExcelOutputAssembler assembler = new ExcelOutputAssembler();

    private final DocumentFragment fragment = new DocumentFragment("vendorA.pdf", FragmentLocator.page(3),
            "Leuchtdichte: 1000 cd/m²", "de");

    @BeforeEach
    void createTemplate() throws IOException {
        template = dir.resolve("template.xlsx");
        try (XSSFWorkbook wb = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(template)) {
            Sheet sheet = wb.createSheet("Comparison");
            sheet.createRow(0).createCell(0).setCellValue("Specification type");
            sheet.createRow(1).createCell(0).setCellValue("Luminance [cd/m²]");
            sheet.createRow(2).createCell(0).setCellValue("Coating");
            sheet.createRow(3).createCell(0).setCellValue("Glass Thickness [mm]");
            wb.write(out);
        }
    }

    private ExtractedSpecInstance instance(String name, double value, String unit, double confidence) {
        return new ExtractedSpecInstance(fragment.key(), name, value, unit, null, confidence, "");
    }

    private CanonicalSpec spec(String name, ExtractedSpecInstance instance, CanonicalResolution resolution) {
        return new CanonicalSpec(name, UnitFamily.classify(instance.unit()), List.of(instance), instance.value(),
                instance.unit(), instance.confidence(), resolution, false);
    }

    private ReferenceRecord reference(CanonicalSpec spec, MappingStatus status, TranslationStatus translation) {
        ExtractedSpecInstance inst = spec.contributingInstances().get(0);
        return new ReferenceRecord(spec.standardName(), inst, fragment.sourceFile(), fragment.locator(),
                fragment.rawText(), "Luminance: 1000 cd/m²", inst.confidence(), status, translation);
    }

    private AnalysisResult result() {
        CanonicalSpec luminance = spec("Luminance", instance("Leuchtdichte", 1000, "cd/m²", 0.92), CanonicalResolution.TABLE);
        CanonicalSpec coating = spec("Coating", instance("Coating", 3, "H", 0.6), CanonicalResolution.SINGLETON);
        CanonicalSpec flicker = spec("Flicker", instance("Flicker", 2, "%", 0.3), CanonicalResolution.SINGLETON);

        TemplateSlot luminanceSlot = new TemplateSlot("Luminance [cd/m²]", new CellCoordinate("Comparison", 1, 1), "cd/m²");
        TemplateSlot coatingSlot = new TemplateSlot("Coating", new CellCoordinate("Comparison", 2, 1), null);

        List<MappingResult> mappings = List.of(
                MappingResult.mapped(luminance, luminanceSlot, 1.0),
                MappingResult.mapped(coating, coatingSlot, 1.0),
                MappingResult.unmatched(flicker, 0.2));
        List<ReferenceRecord> references = List.of(
                reference(luminance, MappingStatus.MAPPED, TranslationStatus.TRANSLATED),
                reference(coating, MappingStatus.MAPPED, TranslationStatus.TRANSLATED),
                reference(flicker, MappingStatus.UNMATCHED, TranslationStatus.FAILED));
        List<FragmentIssue> issues = List.of(FragmentIssue.document(FragmentIssue.Kind.PARSE_FAILURE, "broken.pdf", "bad xref"));
        RunSummary summary = new RunSummary(2, 1, 1, 0, 0, 3, 3, 2, 1, 1);
        return new AnalysisResult(List.of(luminance, coating, flicker), mappings, references, issues, summary);
    }

    private XSSFWorkbook writeAndOpen() throws IOException {
        Path out = assembler.write(template, dir.resolve("out").resolve("result.xlsx"), result());
        try (InputStream in = Files.newInputStream(out)) {
            return new XSSFWorkbook(in);
        }
    }

    @Test
    @DisplayName("output file name carries the run timestamp")
    void fileName() {
        assertThat(ExcelOutputAssembler.outputFileName(LocalDateTime.of(2024, 3, 7, 9, 5, 1)))
                .isEqualTo("RFQ_Spec_Result_20240307_090501.xlsx");
    }

    @Test
    @DisplayName("whole numbers are formatted without a fraction")
    void formatsValues() {
        assertThat(ExcelOutputAssembler.formatValue(3.0)).isEqualTo("3");
        assertThat(ExcelOutputAssembler.formatValue(0.7)).isEqualTo("0.7");
    }

    @Nested
    @DisplayName("value cells")
    class ValueCells {

        private final TemplateSlot thicknessSlot =
                new TemplateSlot("Glass Thickness [mm]", new CellCoordinate("Comparison", 3, 1), "mm");

        @Test
        @DisplayName("are numeric when the resolved unit is the slot unit or there is no unit")
        void bareNumber() {
            assertThat(ExcelOutputAssembler.isBareNumber(
                    spec("Glass Thickness", instance("Glasdicke", 1.1, "mm", 0.9), CanonicalResolution.TABLE),
                    thicknessSlot)).isTrue();
            assertThat(ExcelOutputAssembler.isBareNumber(
                    spec("Luminance", instance("Luminance", 1000, "cd/m2", 0.9), CanonicalResolution.TABLE),
                    new TemplateSlot("Luminance [cd/m²]", new CellCoordinate("Comparison", 1, 1), "cd/m²"))).isTrue();
            assertThat(ExcelOutputAssembler.isBareNumber(
                    spec("Haze", instance("Haze", 2, "", 0.9), CanonicalResolution.SINGLETON),
                    thicknessSlot)).isTrue();
        }

        @Test
        @DisplayName("keep the unit text when it differs from the slot unit within the same family")
        void differentUnitSameFamily() throws IOException {
            CanonicalSpec thickness = spec("Glass Thickness", instance("Glass Thickness", 700, "µm", 0.9),
                    CanonicalResolution.TABLE);
            assertThat(ExcelOutputAssembler.isBareNumber(thickness, thicknessSlot)).isFalse();

            AnalysisResult result = new AnalysisResult(List.of(thickness),
                    List.of(MappingResult.mapped(thickness, thicknessSlot, 1.0)),
                    List.of(reference(thickness, MappingStatus.MAPPED, TranslationStatus.NATIVE)),
                    List.of(), new RunSummary(1, 1, 0, 0, 0, 1, 1, 1, 0, 0));
            Path out = assembler.write(template, dir.resolve("thickness.xlsx"), result);

            try (InputStream in = Files.newInputStream(out); XSSFWorkbook wb = new XSSFWorkbook(in)) {
                Cell cell = wb.getSheetAt(0).getRow(3).getCell(1);
                assertThat(cell.getCellType()).isEqualTo(CellType.STRING);
                assertThat(cell.getStringCellValue()).isEqualTo("700 µm");
            }
        }
    }

    @Nested
    @DisplayName("written workbook")
    class Workbook {

        @Test
        @DisplayName("contains the four result sheets and leaves the template untouched")
        void sheets() throws IOException {
            byte[] before = Files.readAllBytes(template);
            try (XSSFWorkbook wb = writeAndOpen()) {
                assertThat(wb.getNumberOfSheets()).isEqualTo(4);
                assertThat(wb.getSheetName(0)).isEqualTo(ExcelOutputAssembler.SUMMARY_SHEET);
                assertThat(wb.getSheet(ExcelOutputAssembler.REFERENCE_SHEET)).isNotNull();
                assertThat(wb.getSheet(ExcelOutputAssembler.UNMATCHED_SHEET)).isNotNull();
                assertThat(wb.getSheet(ExcelOutputAssembler.RUN_SUMMARY_SHEET)).isNotNull();
            }
            assertThat(Files.readAllBytes(template)).isEqualTo(before);
        }

        @Test
        @DisplayName("writes values with a source comment and a confidence fill at mapped slots")
        void mappedValues() throws IOException {
            try (XSSFWorkbook wb = writeAndOpen()) {
                Sheet summary = wb.getSheetAt(0);
                Cell luminance = summary.getRow(1).getCell(1);
                assertThat(luminance.getNumericCellValue()).isEqualTo(1000.0);
                assertThat(luminance.getCellComment()).isNotNull();
                String comment = luminance.getCellComment().getString().getString();
                assertThat(comment).contains("vendorA.pdf / Page 3").contains("Leuchtdichte: 1000 cd/m²")
                        .contains("(HIGH)");
                XSSFCellStyle style = (XSSFCellStyle) luminance.getCellStyle();
                assertThat(style.getFillForegroundXSSFColor().getRGB()).isEqualTo(ConfidenceBand.HIGH.rgb());

                Cell coating = summary.getRow(2).getCell(1);
                assertThat(coating.getStringCellValue()).isEqualTo("3 H");
            }
        }

        @Test
        @DisplayName("lists references with flags and unmatched specs")
        void referenceAndUnmatched() throws IOException {
            try (XSSFWorkbook wb = writeAndOpen()) {
                Sheet reference = wb.getSheet(ExcelOutputAssembler.REFERENCE_SHEET);
                assertThat(reference.getRow(0).getCell(0).getStringCellValue()).isEqualTo("Standard Name");
                assertThat(reference.getLastRowNum()).isEqualTo(3);
                int flag = ExcelOutputAssembler.REFERENCE_HEADERS.indexOf("Flag");
                assertThat(reference.getRow(1).getCell(flag).getStringCellValue()).isEmpty();
                assertThat(reference.getRow(3).getCell(flag).getStringCellValue()).isEqualTo("REVIEW: translation failed");

                Sheet unmatched = wb.getSheet(ExcelOutputAssembler.UNMATCHED_SHEET);
                assertThat(unmatched.getLastRowNum()).isEqualTo(1);
                assertThat(unmatched.getRow(1).getCell(0).getStringCellValue()).isEqualTo("Flicker");
                assertThat(unmatched.getRow(1).getCell(6).getStringCellValue()).isEqualTo("yes");
            }
        }

        @Test
        @DisplayName("run summary lists counts and issues")
        void runSummary() throws IOException {
            try (XSSFWorkbook wb = writeAndOpen()) {
                Sheet sheet = wb.getSheet(ExcelOutputAssembler.RUN_SUMMARY_SHEET);
                assertThat(sheet.getRow(1).getCell(0).getStringCellValue()).isEqualTo("Documents");
                assertThat(sheet.getRow(1).getCell(1).getNumericCellValue()).isEqualTo(2.0);
                assertThat(sheet.getRow(13).getCell(0).getStringCellValue()).isEqualTo("PARSE_FAILURE");
                assertThat(sheet.getRow(13).getCell(1).getStringCellValue()).isEqualTo("broken.pdf");
            }
        }
    }
}
