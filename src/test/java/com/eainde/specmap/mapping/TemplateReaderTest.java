package com.eainde.specmap.mapping;

import com.eainde.specmap.exception.ConfigurationException;
import com.eainde.specmap.model.CellCoordinate;
import com.eainde.specmap.model.TemplateSlot;
import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TemplateReaderTest {

    @TempDir
    Path dir;

    private final TemplateReader reader = new TemplateReader();

    private Path template(String... labels) throws IOException {
        Path file = dir.resolve("template.xlsx");
        try (XSSFWorkbook wb = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(file)) {
            Sheet sheet = wb.createSheet("Comparison");
            for (int i = 0; i < labels.length; i++) {
                if (labels[i] != null) {
                    sheet.createRow(i).createCell(0).setCellValue(labels[i]);
                }
            }
            wb.write(out);
        }
        return file;
    }

    @Test
    @DisplayName("reads labels from column A, skipping the header, with value cells in column B")
    void readsSlots() throws IOException {
        Path file = template("Specification type", "Luminance [cd/m²]", null, "Contrast Ratio");

        List<TemplateSlot> slots = reader.read(file);

        assertThat(slots).containsExactly(
                new TemplateSlot("Luminance [cd/m²]", new CellCoordinate("Comparison", 1, 1), "cd/m²"),
                new TemplateSlot("Contrast Ratio", new CellCoordinate("Comparison", 3, 1), null));
    }

    @Test
    @DisplayName("a missing template is fatal")
    void missing() {
        assertThatThrownBy(() -> reader.read(dir.resolve("nope.xlsx")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("a file that is not a workbook is fatal")
    void notAWorkbook() throws IOException {
        Path file = dir.resolve("template.xlsx");
        Files.writeString(file, "plain text");

        assertThatThrownBy(() -> reader.read(file)).isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("a template without labels is fatal")
    void empty() throws IOException {
        Path file = template("Item");

        assertThatThrownBy(() -> reader.read(file))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("no labels");
    }

    @Test
    @DisplayName("a legacy .xls template is fatal since results are written as .xlsx")
    void legacyWorkbook() throws IOException {
        Path file = dir.resolve("template.xls");
        try (HSSFWorkbook wb = new HSSFWorkbook(); OutputStream out = Files.newOutputStream(file)) {
            wb.createSheet("Comparison").createRow(1).createCell(0).setCellValue("Luminance [cd/m²]");
            wb.write(out);
        }

        assertThatThrownBy(() -> reader.read(file))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining(".xlsx");
    }
}
