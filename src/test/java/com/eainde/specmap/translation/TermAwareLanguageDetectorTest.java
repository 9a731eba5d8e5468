package com.eainde.specmap.translation;

import com.eainde.specmap.terminology.AliasLanguageIndex;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TermAwareLanguageDetectorTest {

    private static final AliasLanguageIndex TERMS =
            AliasLanguageIndex.fromClasspath("terminology/canonical-terms.json", new ObjectMapper());

    @Mock private LanguageDetector delegate;

    private TermAwareLanguageDetector detector;

    @BeforeEach
    void setUp() {
        detector = new TermAwareLanguageDetector(delegate, TERMS, "en");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "Leuchtdichte: 1000 cd/m² min.",
            "Glasdicke: 1,1 mm ± 0,1 mm",
            "Druckspannung: ≥ 700 MPa"})
    @DisplayName("short German table rows misread as English are corrected by their spec term")
    void germanTableRows(String row) {
        when(delegate.detect(row)).thenReturn("en");

        assertThat(detector.detect(row)).isEqualTo("de");
    }

    @Test
    @DisplayName("English rows stay English")
    void englishRow() {
        when(delegate.detect(anyString())).thenReturn("en");

        assertThat(detector.detect("Luminance: 1000 cd/m² min.")).isEqualTo("en");
        assertThat(detector.detect("1,1 mm ± 0,1 mm")).isEqualTo("en");
    }

    @Test
    @DisplayName("a foreign verdict from the delegate is kept")
    void foreignVerdictKept() {
        when(delegate.detect("Glasdicke: 1,1 mm")).thenReturn("fr");

        assertThat(detector.detect("Glasdicke: 1,1 mm")).isEqualTo("fr");
    }

    @Test
    @DisplayName("display names come from the delegate")
    void displayName() {
        when(delegate.displayName("de")).thenReturn("German");

        assertThat(detector.displayName("de")).isEqualTo("German");
    }
}
