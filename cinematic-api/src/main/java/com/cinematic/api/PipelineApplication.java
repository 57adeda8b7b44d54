package com.cinematic.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application entry point for the cinematic pipeline.
 */
@SpringBootApplication(scanBasePackages = {
    "com.cinematic.api",
    "com.cinematic.engine",
    "com.cinematic.recovery"
})
public class PipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(PipelineApplication.class, args);
    }
}
