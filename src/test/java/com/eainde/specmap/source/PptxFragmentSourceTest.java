package com.eainde.specmap.source;

import com.eainde.specmap.model.DocumentFragment;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFTable;
import org.apache.poi.xslf.usermodel.XSLFTableRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PptxFragmentSourceTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("one fragment per slide with text boxes and table rows; empty slides are skipped")
    void slidesBecomeFragments() throws IOException {
        Path file = dir.resolve("vendorB.pptx");
        try (XMLSlideShow show = new XMLSlideShow(); OutputStream out = Files.newOutputStream(file)) {
            show.createSlide();
            XSLFSlide slide = show.createSlide();
            slide.createTextBox().setText("Display module overview");
            XSLFTable table = slide.createTable();
            XSLFTableRow row = table.addRow();
            row.addCell().setText("Contrast Ratio");
            row.addCell().setText("1500:1");
            show.write(out);
        }

        List<DocumentFragment> fragments = new PptxFragmentSource().read(file);

        assertThat(fragments).hasSize(1);
        DocumentFragment fragment = fragments.get(0);
        assertThat(fragment.locator().label()).isEqualTo("Slide 2");
        assertThat(fragment.rawText()).contains("Display module overview").contains("Contrast Ratio | 1500:1");
    }
}
