package com.eainde.specmap.source;

import com.eainde.specmap.exception.DocumentParseException;
import com.eainde.specmap.model.DocumentFragment;
import com.eainde.specmap.model.FragmentLocator;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFGroupShape;
import org.apache.poi.xslf.usermodel.XSLFShape;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFTable;
import org.apache.poi.xslf.usermodel.XSLFTableCell;
import org.apache.poi.xslf.usermodel.XSLFTableRow;
import org.apache.poi.xslf.usermodel.XSLFTextShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One fragment per slide: text boxes top to bottom, table rows as {@code a | b | c}.
 */
public class PptxFragmentSource implements FragmentSource {

    private static final Logger log = LoggerFactory.getLogger(PptxFragmentSource.class);

    @Override
    public List<String> extensions() {
        return List.of("pptx");
    }

    @Override
    public List<DocumentFragment> read(Path file) {
        String name = file.getFileName().toString();
        try (InputStream in = Files.newInputStream(file);
             XMLSlideShow show = new XMLSlideShow(in)) {
            List<DocumentFragment> fragments = new ArrayList<>();
            List<XSLFSlide> slides = show.getSlides();
            for (int i = 0; i < slides.size(); i++) {
                StringBuilder text = new StringBuilder();
                for (XSLFShape shape : slides.get(i).getShapes()) {
                    appendShape(shape, text);
                }
                if (!text.toString().isBlank()) {
                    fragments.add(DocumentFragment.of(name, FragmentLocator.slide(i + 1), text.toString().strip()));
                }
            }
            log.debug("{}: {} slide(s), {} with text", name, slides.size(), fragments.size());
            return fragments;
        } catch (IOException | RuntimeException e) {
            throw new DocumentParseException("Cannot read PPTX " + name + ": " + e.getMessage(), e);
        }
    }

    private static void appendShape(XSLFShape shape, StringBuilder out) {
        if (shape instanceof XSLFTextShape textShape) {
            String text = textShape.getText();
            if (text != null && !text.isBlank()) {
                out.append(text.strip()).append('\n');
            }
        } else if (shape instanceof XSLFTable table) {
            for (XSLFTableRow row : table.getRows()) {
                String line = row.getCells().stream()
                        .map(XSLFTableCell::getText)
                        .map(t -> t == null ? "" : t.strip())
                        .collect(Collectors.joining(" | "));
                if (!line.replace("|", "").isBlank()) {
                    out.append(line).append('\n');
                }
            }
        } else if (shape instanceof XSLFGroupShape group) {
            for (XSLFShape child : group.getShapes()) {
                appendShape(child, out);
            }
        }
    }
}
