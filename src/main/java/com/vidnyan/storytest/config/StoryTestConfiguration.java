package com.vidnyan.storytest.config;

import com.vidnyan.storytest.StoryTestProperties;
import com.vidnyan.storytest.adapter.out.evaluator.StandardRules;
import com.vidnyan.storytest.application.benchmark.ConcurrencyBenchmarkHarness;
import com.vidnyan.storytest.application.service.MetadataWalker;
import com.vidnyan.storytest.application.service.ValidationOrchestrator;
import com.vidnyan.storytest.domain.body.BodyPatternAnalyzer;
import com.vidnyan.storytest.domain.filter.ArtifactFilter;
import com.vidnyan.storytest.domain.rule.RuleRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for the validation engine.
 * The engine classes are plain Java; they are wired here explicitly.
 */
@Slf4j
@Configuration
public class StoryTestConfiguration {

    @Bean
    public BodyPatternAnalyzer bodyPatternAnalyzer() {
        return new BodyPatternAnalyzer();
    }

    @Bean
    public ArtifactFilter artifactFilter() {
        return new ArtifactFilter();
    }

    /**
     * The built-in catalog; registered rules are logged on startup.
     */
    @Bean
    public RuleRegistry ruleRegistry(BodyPatternAnalyzer analyzer) {
        RuleRegistry registry = StandardRules.registry(analyzer);
        log.info("Registered {} rules in {} phases:", registry.size(), registry.phases().size());
        registry.phases().forEach(phase -> {
            log.info("  {}", phase.name());
            phase.rules().forEach(rule -> log.info("    - {} {}", rule.id(), rule.name()));
        });
        return registry;
    }

    @Bean
    public MetadataWalker metadataWalker(ArtifactFilter artifactFilter) {
        return new MetadataWalker(artifactFilter);
    }

    @Bean
    public ValidationOrchestrator validationOrchestrator(StoryTestProperties properties, RuleRegistry registry,
                                                         MetadataWalker walker, BodyPatternAnalyzer analyzer) {
        return new ValidationOrchestrator(properties.getValidation().toConfiguration(), registry, walker, analyzer);
    }

    @Bean
    public ConcurrencyBenchmarkHarness concurrencyBenchmarkHarness(StoryTestProperties properties) {
        return new ConcurrencyBenchmarkHarness(properties.getBenchmark().toOptions());
    }
}
