package com.eainde.specmap.filter;

import com.eainde.specmap.exception.LlmCallException;
import com.eainde.specmap.llm.LlmGateway;
import com.eainde.specmap.llm.PromptLoader;
import com.eainde.specmap.model.DocumentFragment;
import com.eainde.specmap.model.FragmentLocator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DocumentRelevanceFilterTest {

    private static final List<String> KEYWORDS = List.of("Luminance", "cd/m²", "Leuchtdichte");

    @Mock private LlmGateway gateway;

    private DocumentRelevanceFilter filter(boolean enabled) {
        return new DocumentRelevanceFilter(gateway, new PromptLoader(), new ObjectMapper(), KEYWORDS, enabled);
    }

    private static List<DocumentFragment> fragments(String... texts) {
        DocumentFragment[] out = new DocumentFragment[texts.length];
        for (int i = 0; i < texts.length; i++) {
            out[i] = DocumentFragment.of("doc.pdf", FragmentLocator.page(i + 1), texts[i]);
        }
        return List.of(out);
    }

    @Test
    @DisplayName("keeps everything without a model call when disabled")
    void disabled() {
        RelevanceVerdict verdict = filter(false).assess("doc.pdf", fragments("Company history"));

        assertThat(verdict.relevant()).isTrue();
        verify(gateway, never()).completeJson(anyList());
    }

    @Test
    @DisplayName("rejects documents without any specification keyword")
    void noKeyword() {
        RelevanceVerdict verdict = filter(true).assess("brochure.pdf", fragments("Our company was founded in 1990"));

        assertThat(verdict.relevant()).isFalse();
        verify(gateway, never()).completeJson(anyList());
    }

    @Test
    @DisplayName("follows the model verdict when a keyword matched")
    void modelVerdict() {
        when(gateway.completeJson(anyList()))
                .thenReturn("```json\n{\"is_relevant\": false, \"reason\": \"test certificate\", \"confidence\": 0.8}\n```");

        RelevanceVerdict verdict = filter(true).assess("cert.pdf", fragments("Certificate", "LEUCHTDICHTE geprüft"));

        assertThat(verdict.relevant()).isFalse();
        assertThat(verdict.reason()).isEqualTo("test certificate");
        assertThat(verdict.confidence()).isEqualTo(0.8);
    }

    @Test
    @DisplayName("keeps the document when the model call fails")
    void modelFailure() {
        when(gateway.completeJson(anyList())).thenThrow(new LlmCallException("timeout", null));

        RelevanceVerdict verdict = filter(true).assess("spec.pdf", fragments("Luminance 1000 cd/m²"));

        assertThat(verdict.relevant()).isTrue();
        assertThat(verdict.reason()).contains("luminance");
    }

    @Test
    @DisplayName("keeps the document when the answer has no verdict")
    void unusableAnswer() {
        when(gateway.completeJson(anyList())).thenReturn("{\"reason\": \"unsure\"}");

        assertThat(filter(true).assess("spec.pdf", fragments("Luminance 1000")).relevant()).isTrue();
    }
}
