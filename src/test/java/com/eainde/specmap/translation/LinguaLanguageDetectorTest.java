package com.eainde.specmap.translation;

import com.eainde.specmap.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LinguaLanguageDetectorTest {

    private static final LinguaLanguageDetector DETECTOR =
            new LinguaLanguageDetector("en", List.of("en", "de", "fr", "ja"));

    @Test
    @DisplayName("detects running text in each candidate language")
    void sentences() {
        assertThat(DETECTOR.detect("The luminance of the module is at least 1000 cd/m² at room temperature."))
                .isEqualTo("en");
        assertThat(DETECTOR.detect("Die Leuchtdichte des Moduls beträgt mindestens 1000 cd/m² bei Raumtemperatur."))
                .isEqualTo("de");
        assertThat(DETECTOR.detect("La luminance du module est d'au moins 1000 cd/m² à température ambiante."))
                .isEqualTo("fr");
        assertThat(DETECTOR.detect("モジュールの輝度は室温で1000 cd/m²以上です。")).isEqualTo("ja");
    }

    @Test
    @DisplayName("value-only text falls back to the working language")
    void valuesOnly() {
        assertThat(DETECTOR.detect("1000 cd/m²")).isEqualTo("en");
        assertThat(DETECTOR.detect("")).isEqualTo("en");
        assertThat(DETECTOR.detect(null)).isEqualTo("en");
    }

    @Test
    @DisplayName("display names are English language names")
    void displayNames() {
        assertThat(DETECTOR.displayName("de")).isEqualTo("German");
        assertThat(DETECTOR.displayName("ja")).isEqualTo("Japanese");
    }

    @Test
    @DisplayName("rejects unknown codes and single-language setups")
    void configuration() {
        assertThatThrownBy(() -> new LinguaLanguageDetector("en", List.of("en", "xx")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("xx");
        assertThatThrownBy(() -> new LinguaLanguageDetector("en", List.of("en")))
                .isInstanceOf(ConfigurationException.class);
    }
}
