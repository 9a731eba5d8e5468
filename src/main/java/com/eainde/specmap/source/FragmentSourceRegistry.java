package com.eainde.specmap.source;

import com.eainde.specmap.exception.ConfigurationException;
import com.eainde.specmap.exception.DocumentParseException;
import com.eainde.specmap.model.DocumentFragment;
import com.eainde.specmap.model.FragmentIssue;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Picks a {@link FragmentSource} by file extension and scans input folders.
 * Unreadable files become {@link FragmentIssue.Kind#PARSE_FAILURE} issues; the scan goes on.
 */
@Slf4j
public class FragmentSourceRegistry {

    private final Map<String, FragmentSource> byExtension = new HashMap<>();

    public FragmentSourceRegistry(List<FragmentSource> sources) {
        for (FragmentSource source : sources) {
            source.extensions().forEach(ext -> byExtension.put(ext.toLowerCase(Locale.ROOT), source));
        }
    }

    public Optional<FragmentSource> sourceFor(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return Optional.empty();
        }
        return Optional.ofNullable(byExtension.get(name.substring(dot + 1).toLowerCase(Locale.ROOT)));
    }

    /**
     * Reads every supported file directly inside {@code folder}, skipping {@code exclude}
     * (usually the template) and Office lock files ({@code ~$...}).
     */
    public SourceScan scan(Path folder, Path exclude) {
        if (folder == null || !Files.isDirectory(folder)) {
            throw new ConfigurationException("Input folder not found: " + folder);
        }
        List<Path> files;
        try (Stream<Path> listing = Files.list(folder)) {
            files = listing.filter(Files::isRegularFile)
                    .filter(p -> !p.getFileName().toString().startsWith("~$"))
                    .filter(p -> exclude == null || !isSameFile(p, exclude))
                    .filter(p -> sourceFor(p).isPresent())
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ConfigurationException("Cannot list input folder " + folder, e);
        }

        Map<String, List<DocumentFragment>> documents = new LinkedHashMap<>();
        List<FragmentIssue> issues = new ArrayList<>();
        for (Path file : files) {
            String name = file.getFileName().toString();
            try {
                List<DocumentFragment> fragments = sourceFor(file).orElseThrow().read(file);
                if (fragments.isEmpty()) {
                    log.warn("{} contains no text, skipped", name);
                    issues.add(FragmentIssue.document(FragmentIssue.Kind.PARSE_FAILURE, name, "No extractable text"));
                    continue;
                }
                documents.put(name, fragments);
                log.info("Read {} fragment(s) from {}", fragments.size(), name);
            } catch (DocumentParseException e) {
                log.error("Skipping {}: {}", name, e.getMessage());
                issues.add(FragmentIssue.document(FragmentIssue.Kind.PARSE_FAILURE, name, e.getMessage()));
            }
        }
        log.info("Scanned {}: {} document(s) read, {} skipped", folder, documents.size(), issues.size());
        return new SourceScan(documents, issues);
    }

    private static boolean isSameFile(Path a, Path b) {
        try {
            return Files.exists(b) && Files.isSameFile(a, b);
        } catch (IOException e) {
            return a.toAbsolutePath().normalize().equals(b.toAbsolutePath().normalize());
        }
    }
}
