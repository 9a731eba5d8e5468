package com.eainde.specmap.source;

import com.eainde.specmap.exception.DocumentParseException;
import com.eainde.specmap.model.DocumentFragment;
import com.eainde.specmap.model.FragmentLocator;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * One fragment per non-empty row, cells joined with {@code " | "} and prefixed by the sheet name
 * so the model sees which table the row belongs to. Row numbers are 1-based as shown in Excel.
 */
public class XlsxFragmentSource implements FragmentSource {

    private static final Logger log = LoggerFactory.getLogger(XlsxFragmentSource.class);

    private final DataFormatter formatter = new DataFormatter();

    @Override
    public List<String> extensions() {
        return List.of("xlsx", "xls");
    }

    @Override
    public List<DocumentFragment> read(Path file) {
        String name = file.getFileName().toString();
        try (InputStream in = Files.newInputStream(file);
             Workbook workbook = WorkbookFactory.create(in)) {
            List<DocumentFragment> fragments = new ArrayList<>();
            for (Sheet sheet : workbook) {
                for (Row row : sheet) {
                    String line = rowText(row);
                    if (!line.isEmpty()) {
                        fragments.add(DocumentFragment.of(name,
                                FragmentLocator.row(sheet.getSheetName(), row.getRowNum() + 1),
                                "[" + sheet.getSheetName() + "] " + line));
                    }
                }
            }
            log.debug("{}: {} non-empty row(s)", name, fragments.size());
            return fragments;
        } catch (IOException | RuntimeException e) {
            throw new DocumentParseException("Cannot read workbook " + name + ": " + e.getMessage(), e);
        }
    }

    private String rowText(Row row) {
        List<String> cells = new ArrayList<>();
        for (Cell cell : row) {
            String value = formatter.formatCellValue(cell).strip();
            if (!value.isEmpty()) {
                cells.add(value);
            }
        }
        return String.join(" | ", cells);
    }
}
