package com.ledgerindexer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Checkpoint indexer. Command line: --first-checkpoint=N --last-checkpoint=N --local-path=DIR --remote-url=URL.
 */
@SpringBootApplication
public class LedgerIndexerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LedgerIndexerApplication.class, args);
    }
}
