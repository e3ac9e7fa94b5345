package com.anonymizer.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Desktop shell entry point.
 */
@SpringBootApplication
public class AnonymizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnonymizerApplication.class, args);
    }
}
