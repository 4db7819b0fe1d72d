package com.contextcatalog.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point. Without {@code catalog.run.base-dir} the application starts,
 * wires the engine and exits; see {@code CatalogRunner}.
 *
 * To run:
 *   mvn -pl engine spring-boot:run \
 *     -Dspring-boot.run.arguments="--catalog.run.base-dir=/path/to/repo --catalog.provider.command='claude -p'"
 */
@SpringBootApplication
public class ContextCatalogApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContextCatalogApplication.class, args);
    }
}
