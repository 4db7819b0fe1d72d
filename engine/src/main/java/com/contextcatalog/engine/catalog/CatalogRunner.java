package com.contextcatalog.engine.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Builds the catalog of {@code catalog.run.base-dir} at start-up and prints it
 * as JSON on stdout.
 *
 * To run:
 *   mvn -pl engine spring-boot:run -Dspring-boot.run.arguments=--catalog.run.base-dir=/path/to/repo
 */
@Component
@ConditionalOnProperty(prefix = "catalog.run", name = "base-dir")
public class CatalogRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(CatalogRunner.class);

    private final CatalogService catalogService;
    private final ObjectMapper objectMapper;
    private final String baseDir;
    private final int maxDepth;

    public CatalogRunner(
            CatalogService catalogService,
            ObjectMapper objectMapper,
            @Value("${catalog.run.base-dir}") String baseDir,
            @Value("${catalog.run.max-depth:-1}") int maxDepth) {
        this.catalogService = catalogService;
        this.objectMapper   = objectMapper;
        this.baseDir        = baseDir;
        this.maxDepth       = maxDepth;
    }

    @Override
    public void run(String... args) throws Exception {
        if (baseDir.isBlank()) {
            log.debug("catalog.run.base-dir is blank, nothing to do");
            return;
        }
        ContextCatalog catalog = catalogService.build(Path.of(baseDir), maxDepth < 0 ? null : maxDepth);
        System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(catalog));
    }
}
