package com.vidnyan.codegraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * CodeGraph - code knowledge graph with incremental sync
 *
 * Ingests a source tree into a graph of files, symbols, calls, inheritance,
 * communities and execution flows, and keeps it in sync through signed snapshots.
 */
@SpringBootApplication
public class CodeGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(CodeGraphApplication.class, args);
    }
}
