package com.eainde.specmap.extraction;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExtractionResponseParserTest {

    private final ExtractionResponseParser parser = new ExtractionResponseParser(new ObjectMapper());

    @Nested
    @DisplayName("accepted responses")
    class Accepted {

        @Test
        @DisplayName("parses every field of a well-formed record")
        void fullRecord() {
            ParsedResponse parsed = parser.parse("""
                    [{"spec_name": "Luminance", "value": 1000, "unit": "cd/m²", "condition": "25°C",
                      "confidence": 0.95, "source_text": "Luminance: ≥ 1000 cd/m² (at 25°C)"}]
                    """);

            assertThat(parsed.isAccepted()).isTrue();
            assertThat(parsed.records()).containsExactly(new ExtractedRecord(
                    "Luminance", 1000.0, "cd/m²", "25°C", 0.95, "Luminance: ≥ 1000 cd/m² (at 25°C)"));
        }

        @Test
        @DisplayName("tolerates a markdown fence, a numeric string value and a missing condition")
        void lenientParts() {
            ParsedResponse parsed = parser.parse("""
                    ```json
                    [{"spec_name": "Glass Thickness", "value": "0.7", "unit": "mm", "confidence": 0.8}]
                    ```""");

            assertThat(parsed.isAccepted()).isTrue();
            ExtractedRecord record = parsed.records().get(0);
            assertThat(record.value()).isEqualTo(0.7);
            assertThat(record.condition()).isNull();
            assertThat(record.sourceText()).isNull();
        }

        @Test
        @DisplayName("an empty array means no specifications")
        void emptyArray() {
            ParsedResponse parsed = parser.parse("[]");

            assertThat(parsed.isAccepted()).isTrue();
            assertThat(parsed.records()).isEmpty();
        }

        @Test
        @DisplayName("an empty unit is allowed for dimensionless values")
        void emptyUnit() {
            ParsedResponse parsed = parser.parse("[{\"spec_name\": \"Gloss\", \"value\": 85, \"unit\": \"\", \"confidence\": 0.7}]");

            assertThat(parsed.isAccepted()).isTrue();
            assertThat(parsed.records().get(0).unit()).isEmpty();
        }
    }

    @Nested
    @DisplayName("rejected responses")
    class Rejected {

        @Test
        @DisplayName("non-JSON text")
        void notJson() {
            ParsedResponse parsed = parser.parse("Here are the specifications: Luminance 1000");

            assertThat(parsed.isAccepted()).isFalse();
            assertThat(parsed.violations()).singleElement().asString().contains("not valid JSON");
        }

        @Test
        @DisplayName("a JSON object instead of an array")
        void notArray() {
            ParsedResponse parsed = parser.parse("{\"spec_name\": \"Luminance\"}");

            assertThat(parsed.violations()).containsExactly("response must be a JSON array of records");
        }

        @Test
        @DisplayName("a non-numeric value rejects the whole response")
        void nonNumericValue() {
            ParsedResponse parsed = parser.parse("""
                    [{"spec_name": "Luminance", "value": 1000, "unit": "cd/m²", "confidence": 0.9},
                     {"spec_name": "Surface Hardness", "value": "9H", "unit": "", "confidence": 0.9}]
                    """);

            assertThat(parsed.isAccepted()).isFalse();
            assertThat(parsed.records()).isEmpty();
            assertThat(parsed.violations()).containsExactly("record 1: value is missing or not numeric");
        }

        @Test
        @DisplayName("missing fields and out-of-range confidence are all reported")
        void multipleViolations() {
            ParsedResponse parsed = parser.parse("[{\"spec_name\": \" \", \"value\": 5, \"confidence\": 1.4}]");

            assertThat(parsed.violations()).containsExactly(
                    "record 0: spec_name is missing or blank",
                    "record 0: unit is missing or not a string",
                    "record 0: confidence 1.4 is outside [0,1]");
        }

        @Test
        @DisplayName("blank response")
        void blank() {
            assertThat(parser.parse("  ").violations()).containsExactly("response is empty");
        }
    }
}
