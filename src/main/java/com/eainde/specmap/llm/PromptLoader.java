package com.eainde.specmap.llm;

import com.eainde.specmap.exception.ConfigurationException;
import dev.langchain4j.model.input.PromptTemplate;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads prompt templates from {@code classpath:prompts/} and renders them with
 * {@link PromptTemplate} ({@code {{variable}}} placeholders).
 */
public class PromptLoader {

    private static final String BASE = "prompts/";

    private final Map<String, PromptTemplate> cache = new ConcurrentHashMap<>();

    public String render(String name, Map<String, Object> variables) {
        return template(name).apply(variables).text();
    }

    private PromptTemplate template(String name) {
        return cache.computeIfAbsent(name, n -> PromptTemplate.from(read(BASE + n)));
    }

    private static String read(String path) {
        try (InputStream in = PromptLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new ConfigurationException("Prompt resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read prompt resource: " + path, e);
        }
    }
}
