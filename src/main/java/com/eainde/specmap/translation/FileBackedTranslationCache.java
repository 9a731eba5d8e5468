package com.eainde.specmap.translation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Translation cache persisted across runs, one JSON file per key:
 * <pre>
 * { "original_text": "first 200 chars…", "translated_text": "…" }
 * </pre>
 *
 * <p>Sits in front of an in-memory cache so repeated lookups within a run never touch disk.
 * Writes go to a temp file that is atomically moved into place, so concurrent readers never
 * observe a partially written entry. Unreadable files count as misses.</p>
 */
public class FileBackedTranslationCache implements TranslationCache {

    private static final Logger log = LoggerFactory.getLogger(FileBackedTranslationCache.class);

    private static final int ORIGINAL_PREVIEW_CHARS = 200;

    private final Path folder;
    private final ObjectMapper objectMapper;
    private final InMemoryTranslationCache memory = new InMemoryTranslationCache();

    public FileBackedTranslationCache(Path folder, ObjectMapper objectMapper) {
        this.folder = folder;
        this.objectMapper = objectMapper;
        try {
            Files.createDirectories(folder);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create translation cache folder " + folder, e);
        }
    }

    @Override
    public Optional<String> get(String key) {
        Optional<String> hit = memory.get(key);
        if (hit.isPresent()) {
            return hit;
        }
        Path file = fileFor(key);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(file.toFile());
            JsonNode translated = node.get("translated_text");
            if (translated == null || !translated.isTextual()) {
                return Optional.empty();
            }
            memory.put(key, null, translated.asText());
            return Optional.of(translated.asText());
        } catch (IOException e) {
            log.warn("Ignoring unreadable translation cache entry {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, String originalText, String translatedText) {
        memory.put(key, originalText, translatedText);

        ObjectNode node = objectMapper.createObjectNode();
        String preview = originalText == null ? "" : originalText;
        node.put("original_text", preview.length() > ORIGINAL_PREVIEW_CHARS
                ? preview.substring(0, ORIGINAL_PREVIEW_CHARS) : preview);
        node.put("translated_text", translatedText);

        Path target = fileFor(key);
        try {
            Path tmp = Files.createTempFile(folder, key, ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), node);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            // the in-memory entry still serves this run
            log.warn("Failed to persist translation cache entry {}: {}", target, e.getMessage());
        }
    }

    @Override
    public int size() {
        return memory.size();
    }

    private Path fileFor(String key) {
        return folder.resolve(key + ".json");
    }
}
