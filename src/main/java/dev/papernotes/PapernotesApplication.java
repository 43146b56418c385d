package dev.papernotes;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Papernotes application: scanned-note ingestion and query-by-image retrieval
 * over a REST API on port 8080.
 */
@SpringBootApplication
public class PapernotesApplication {
    public static void main(String[] args) {
        SpringApplication.run(PapernotesApplication.class, args);
    }
}
