package com.vidnyan.tabula;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Tabula - CNV classification tables.
 *
 * Loads the configured CNV tables and classifies raw codes against them.
 */
@SpringBootApplication
public class TabulaApplication {

    public static void main(String[] args) {
        SpringApplication.run(TabulaApplication.class, args);
    }
}
