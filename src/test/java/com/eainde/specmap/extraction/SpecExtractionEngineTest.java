package com.eainde.specmap.extraction;

import com.eainde.specmap.exception.RateLimitExhaustedException;
import com.eainde.specmap.llm.LlmGateway;
import com.eainde.specmap.llm.PromptLoader;
import com.eainde.specmap.llm.RetryPolicy;
import com.eainde.specmap.model.DocumentFragment;
import com.eainde.specmap.model.ExtractedSpecInstance;
import com.eainde.specmap.model.FragmentKey;
import com.eainde.specmap.model.FragmentLocator;
import com.eainde.specmap.model.TranslatedFragment;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SpecExtractionEngineTest {

    private static final String LUMINANCE_JSON = """
            [{"spec_name": "Luminance", "value": 1000, "unit": "cd/m²", "condition": "25°C",
              "confidence": 0.95, "source_text": "Luminance: ≥ 1000 cd/m² (at 25°C)"}]
            """;

    @Mock private LlmGateway gateway;

    private SpecExtractionEngine engine;

    @BeforeEach
    void setUp() {
        engine = engine(2, 12_000);
    }

    private SpecExtractionEngine engine(int corrective, int maxChars) {
        RetryPolicy retry = RetryPolicy.builder()
                .maxAttempts(2)
                .initialDelay(Duration.ZERO)
                .maxDelay(Duration.ZERO)
                .sleeper(d -> { })
                .build();
        return new SpecExtractionEngine(gateway, new ExtractionResponseParser(new ObjectMapper()),
                new PromptLoader(), retry, corrective, maxChars);
    }

    private static TranslatedFragment fragment(String text) {
        DocumentFragment f = DocumentFragment.of("vendor_a.pdf", FragmentLocator.page(2), text);
        return TranslatedFragment.nativeText(f.withDetectedLanguage("en"));
    }

    @Nested
    @DisplayName("valid responses")
    class Valid {

        @Test
        @DisplayName("become instances bound to the fragment")
        void bindsToFragment() {
            when(gateway.completeJson(anyList())).thenReturn(LUMINANCE_JSON);

            ExtractionOutcome outcome = engine.extract(fragment("Luminance: ≥ 1000 cd/m² (at 25°C)"));

            assertThat(outcome.isSuccess()).isTrue();
            ExtractedSpecInstance instance = outcome.instances().get(0);
            assertThat(instance.fragmentKey()).isEqualTo(new FragmentKey("vendor_a.pdf", FragmentLocator.page(2)));
            assertThat(instance.rawSpecName()).isEqualTo("Luminance");
            assertThat(instance.value()).isEqualTo(1000.0);
            assertThat(instance.unit()).isEqualTo("cd/m²");
            assertThat(instance.condition()).isEqualTo("25°C");
            assertThat(instance.confidence()).isEqualTo(0.95);
        }

        @Test
        @DisplayName("the request carries instructions, target vocabulary and the fragment text")
        void requestContent() {
            when(gateway.completeJson(anyList())).thenReturn("[]");

            engine.extract(fragment("Contrast 1500:1"), List.of("Contrast Ratio", "Luminance"));

            @SuppressWarnings("unchecked")
            ArgumentCaptor<List<ChatMessage>> captor = ArgumentCaptor.forClass(List.class);
            verify(gateway).completeJson(captor.capture());
            List<ChatMessage> messages = captor.getValue();
            assertThat(((SystemMessage) messages.get(0)).text())
                    .contains("Return ONLY a JSON array")
                    .contains("- Contrast Ratio\n- Luminance");
            assertThat(((UserMessage) messages.get(1)).singleText())
                    .contains("Document: vendor_a.pdf")
                    .contains("Location: Page 2")
                    .contains("Contrast 1500:1");
        }

        @Test
        @DisplayName("duplicates within a fragment collapse to the most confident one")
        void deduplicates() {
            when(gateway.completeJson(anyList())).thenReturn("""
                    [{"spec_name": "Luminance", "value": 1000, "unit": "cd/m²", "confidence": 0.7},
                     {"spec_name": "luminance:", "value": 1000, "unit": "cd/m²", "confidence": 0.9},
                     {"spec_name": "Luminance", "value": 800, "unit": "cd/m²", "confidence": 0.6}]
                    """);

            ExtractionOutcome outcome = engine.extract(fragment("Luminance 1000 / 800"));

            assertThat(outcome.instances()).hasSize(2);
            assertThat(outcome.instances())
                    .filteredOn(i -> i.value() == 1000.0)
                    .singleElement()
                    .satisfies(i -> assertThat(i.confidence()).isEqualTo(0.9));
        }
    }

    @Nested
    @DisplayName("malformed responses")
    class Malformed {

        @Test
        @DisplayName("are retried with a corrective message listing the problems")
        void correctiveRetry() {
            when(gateway.completeJson(anyList()))
                    .thenReturn("[{\"spec_name\": \"Luminance\", \"value\": \"high\", \"unit\": \"\", \"confidence\": 0.9}]")
                    .thenReturn(LUMINANCE_JSON);

            ExtractionOutcome outcome = engine.extract(fragment("Luminance: ≥ 1000 cd/m² (at 25°C)"));

            assertThat(outcome.isSuccess()).isTrue();
            assertThat(outcome.instances()).hasSize(1);

            @SuppressWarnings("unchecked")
            ArgumentCaptor<List<ChatMessage>> captor = ArgumentCaptor.forClass(List.class);
            verify(gateway, times(2)).completeJson(captor.capture());
            List<ChatMessage> second = captor.getAllValues().get(1);
            assertThat(second).hasSize(4);
            assertThat(second.get(2)).isInstanceOf(AiMessage.class);
            assertThat(((UserMessage) second.get(3)).singleText())
                    .contains("could not be accepted")
                    .contains("record 0: value is missing or not numeric");
        }

        @Test
        @DisplayName("fail the fragment once the corrective budget is spent")
        void budgetExhausted() {
            when(gateway.completeJson(anyList())).thenReturn("not json at all");

            ExtractionOutcome outcome = engine.extract(fragment("Luminance: high"));

            assertThat(outcome.isSuccess()).isFalse();
            assertThat(outcome.instances()).isEmpty();
            assertThat(outcome.failureReason()).contains("not valid JSON");
            verify(gateway, times(3)).completeJson(anyList());
        }
    }

    @Nested
    @DisplayName("call failures")
    class CallFailures {

        @Test
        @DisplayName("rate-limit exhaustion fails the fragment without using the corrective budget")
        void rateLimitExhausted() {
            when(gateway.completeJson(anyList())).thenThrow(new RateLimitExhaustedException(6, null));

            ExtractionOutcome outcome = engine.extract(fragment("Luminance 1000 cd/m²"));

            assertThat(outcome.isSuccess()).isFalse();
            verify(gateway, times(1)).completeJson(anyList());
        }
    }

    @Nested
    @DisplayName("long fragments")
    class Segmenting {

        @Test
        @DisplayName("are split on line boundaries and results merged")
        void splits() {
            when(gateway.completeJson(anyList()))
                    .thenReturn(LUMINANCE_JSON)
                    .thenReturn(LUMINANCE_JSON);
            SpecExtractionEngine small = engine(0, 40);

            ExtractionOutcome outcome = small.extract(fragment(
                    "Luminance: ≥ 1000 cd/m² (at 25°C)\nLuminance: ≥ 1000 cd/m² (at 25°C)"));

            verify(gateway, times(2)).completeJson(anyList());
            assertThat(outcome.instances()).hasSize(1);
        }

        @Test
        @DisplayName("segment() keeps lines whole and cuts over-long lines")
        void segmentRules() {
            assertThat(SpecExtractionEngine.segment("aaa\nbbb\nccc", 7)).containsExactly("aaa\nbbb", "ccc");
            assertThat(SpecExtractionEngine.segment("abcdefghij", 4)).containsExactly("abcd", "efgh", "ij");
            assertThat(SpecExtractionEngine.segment("short", 100)).containsExactly("short");
        }
    }
}
