package com.contentforge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Content pipeline application entry point.
 * <p>
 * Sits in the top-level package so component scanning reaches every module.
 * </p>
 *
 * @author contentforge
 * @since 2025-03-02
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

}
