package com.eainde.specmap.source;

import com.eainde.specmap.exception.DocumentParseException;
import com.eainde.specmap.model.DocumentFragment;
import com.eainde.specmap.model.FragmentLocator;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * One fragment per PDF page (1-based page numbers).
 */
public class PdfFragmentSource implements FragmentSource {

    private static final Logger log = LoggerFactory.getLogger(PdfFragmentSource.class);

    @Override
    public List<String> extensions() {
        return List.of("pdf");
    }

    @Override
    public List<DocumentFragment> read(Path file) {
        String name = file.getFileName().toString();
        try (PDDocument doc = PDDocument.load(file.toFile())) {
            int pages = doc.getNumberOfPages();
            PDFTextStripper stripper = new PDFTextStripper();
            List<DocumentFragment> fragments = new ArrayList<>(pages);
            for (int p = 1; p <= pages; p++) {
                stripper.setStartPage(p);
                stripper.setEndPage(p);
                String text = stripper.getText(doc);
                if (!text.isBlank()) {
                    fragments.add(DocumentFragment.of(name, FragmentLocator.page(p), text.strip()));
                }
            }
            log.debug("{}: {} page(s), {} with text", name, pages, fragments.size());
            return fragments;
        } catch (IOException e) {
            throw new DocumentParseException("Cannot read PDF " + name + ": " + e.getMessage(), e);
        }
    }
}
