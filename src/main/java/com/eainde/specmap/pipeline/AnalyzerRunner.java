package com.eainde.specmap.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Command-line entry. Paths come from {@code specmap.paths.*}, overridable as
 * {@code --specmap.paths.input-folder=...} on the command line.
 */
@Slf4j
@Component
public class AnalyzerRunner implements CommandLineRunner {

    private final SpecMapperJob job;

    @Value("${specmap.paths.input-folder:input}")
    private String inputFolder;

    @Value("${specmap.paths.template-file:template/template.xlsx}")
    private String templateFile;

    @Value("${specmap.paths.output-folder:output}")
    private String outputFolder;

    public AnalyzerRunner(SpecMapperJob job) {
        this.job = job;
    }

    @Override
    public void run(String... args) {
        log.info("Starting RFQ spec analysis: input={}, template={}, output={}", inputFolder, templateFile, outputFolder);
        Path result = job.run(Path.of(inputFolder), Path.of(templateFile), Path.of(outputFolder));
        log.info("Result written to {}", result.toAbsolutePath());
    }
}
