package com.eainde.specmap.mapping;

import com.eainde.specmap.exception.ConfigurationException;
import com.eainde.specmap.model.CellCoordinate;
import com.eainde.specmap.model.TemplateSlot;
import com.eainde.specmap.terminology.TermNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reads template slots from the first sheet of an {@code .xlsx} template. Legacy {@code .xls}
 * workbooks are rejected here since the result workbook is written as XSSF.
 * Column A holds the label, the value goes into column B of the same row.
 * Template problems are fatal for the run.
 */
@Slf4j
public class TemplateReader {

    static final int LABEL_COLUMN = 0;
    static final int VALUE_COLUMN = 1;

    private static final Set<String> HEADER_LABELS = Set.of("specification type", "spec type", "item", "specification");

    private final DataFormatter formatter = new DataFormatter();

    public List<TemplateSlot> read(Path templateFile) {
        if (templateFile == null || !Files.isRegularFile(templateFile)) {
            throw new ConfigurationException("Template file not found: " + templateFile);
        }
        try (InputStream in = Files.newInputStream(templateFile);
             Workbook workbook = WorkbookFactory.create(in)) {
            if (!(workbook instanceof XSSFWorkbook)) {
                throw new ConfigurationException("Template must be an .xlsx workbook: " + templateFile);
            }
            if (workbook.getNumberOfSheets() == 0) {
                throw new ConfigurationException("Template has no sheets: " + templateFile);
            }
            List<TemplateSlot> slots = readSlots(workbook.getSheetAt(0));
            if (slots.isEmpty()) {
                throw new ConfigurationException("Template has no labels in column A: " + templateFile);
            }
            log.info("Template {} defines {} slot(s)", templateFile.getFileName(), slots.size());
            return slots;
        } catch (ConfigurationException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new ConfigurationException("Template is not a readable workbook: " + templateFile, e);
        }
    }

    List<TemplateSlot> readSlots(Sheet sheet) {
        List<TemplateSlot> slots = new ArrayList<>();
        for (Row row : sheet) {
            Cell cell = row.getCell(LABEL_COLUMN);
            if (cell == null) {
                continue;
            }
            String label = formatter.formatCellValue(cell).strip();
            if (label.isEmpty() || HEADER_LABELS.contains(TermNormalizer.normalize(label))) {
                continue;
            }
            slots.add(new TemplateSlot(
                    label,
                    new CellCoordinate(sheet.getSheetName(), row.getRowNum(), VALUE_COLUMN),
                    TermNormalizer.unitSuffix(label)));
        }
        return slots;
    }
}
