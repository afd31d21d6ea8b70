package com.vidnyan.storytest;

import com.vidnyan.storytest.application.benchmark.BenchmarkOptions;
import com.vidnyan.storytest.application.service.ValidationConfiguration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the validation engine.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "storytest")
public class StoryTestProperties {

    private Validation validation = new Validation();

    private Benchmark benchmark = new Benchmark();

    @Data
    public static class Validation {

        /**
         * Substrings an assembly name must contain to be analyzed.
         * Default: empty, analyze everything that isn't a platform assembly
         */
        private List<String> assemblyFilters = new ArrayList<>();

        private List<String> excludedAssemblyFilters = new ArrayList<>();

        /**
         * Analyze Unity* assemblies too.
         */
        private boolean includeHostFrameworkAssemblies = false;

        /**
         * Fully qualified type names that are analyzed even when their assembly is filtered out.
         */
        private List<String> customTypeAllowList = new ArrayList<>();

        /**
         * Per-phase enable flags, keyed by phase name.
         */
        private Map<String, Boolean> phases = new LinkedHashMap<>();

        private boolean stopOnFirstViolation = false;

        private int progressInterval = ValidationConfiguration.DEFAULT_PROGRESS_INTERVAL;

        public ValidationConfiguration toConfiguration() {
            return ValidationConfiguration.builder()
                    .assemblyFilters(assemblyFilters)
                    .excludedAssemblyFilters(excludedAssemblyFilters)
                    .includeHostFrameworkAssemblies(includeHostFrameworkAssemblies)
                    .customTypeAllowList(customTypeAllowList)
                    .phases(phases)
                    .stopOnFirstViolation(stopOnFirstViolation)
                    .progressInterval(progressInterval)
                    .build();
        }
    }

    @Data
    public static class Benchmark {

        private int actorsPerBatch = BenchmarkOptions.DEFAULT_ACTORS_PER_BATCH;

        private int batches = BenchmarkOptions.DEFAULT_BATCHES;

        private int iterationsPerActor = BenchmarkOptions.DEFAULT_ITERATIONS_PER_ACTOR;

        private boolean warmup = true;

        private Duration timeout = Duration.ofMinutes(2);

        public BenchmarkOptions toOptions() {
            return new BenchmarkOptions(actorsPerBatch, batches, iterationsPerActor, warmup, timeout);
        }
    }
}
