package com.strata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Strata query gateway.
 *
 * The gateway sits between product code and the analytical backend:
 * - Resolves public field names to dataset columns
 * - Translates catalog ids to the values stored in the backend and back
 * - Scopes every query to one organization and its retention window
 * - Executes batches concurrently behind a shared result cache
 */
@SpringBootApplication
public class StrataApplication {

    public static void main(String[] args) {
        SpringApplication.run(StrataApplication.class, args);
    }
}
