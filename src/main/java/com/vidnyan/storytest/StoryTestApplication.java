package com.vidnyan.storytest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Story Test - completeness validation for compiled assemblies.
 *
 * Hosts load assemblies and call {@link com.vidnyan.storytest.application.port.in.ValidateAssembliesUseCase}.
 */
@SpringBootApplication
public class StoryTestApplication {

    public static void main(String[] args) {
        SpringApplication.run(StoryTestApplication.class, args);
    }
}
