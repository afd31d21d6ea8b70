package com.vidnyan.storytest.application.service;

import com.vidnyan.storytest.application.port.in.ValidateAssembliesUseCase;
import com.vidnyan.storytest.domain.body.BodyPatternAnalyzer;
import com.vidnyan.storytest.domain.report.PhaseResult;
import com.vidnyan.storytest.domain.report.PhaseState;
import com.vidnyan.storytest.domain.report.ValidationReport;
import com.vidnyan.storytest.domain.rule.AnalysisContext;
import com.vidnyan.storytest.domain.rule.Candidate;
import com.vidnyan.storytest.domain.rule.Rule;
import com.vidnyan.storytest.domain.rule.RuleOutcome;
import com.vidnyan.storytest.domain.rule.RuleRegistry;
import com.vidnyan.storytest.domain.rule.UsageIndex;
import com.vidnyan.storytest.domain.rule.ValidationPhase;
import com.vidnyan.storytest.domain.rule.Violation;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the rule catalog phase by phase over the walker's candidates.
 * Phases run sequentially. Each call to {@link #validate} owns its own report state,
 * so one instance can serve concurrent callers.
 */
@Slf4j
public class ValidationOrchestrator implements ValidateAssembliesUseCase {

    static final String CLEAN_NOTE = "No violations detected";

    private final ValidationConfiguration configuration;
    private final RuleRegistry registry;
    private final MetadataWalker walker;
    private final BodyPatternAnalyzer analyzer;

    /**
     * @throws InvalidConfigurationException if the configuration is inconsistent with itself
     *         or names phases the registry doesn't have
     */
    public ValidationOrchestrator(ValidationConfiguration configuration, RuleRegistry registry,
                                  MetadataWalker walker, BodyPatternAnalyzer analyzer) {
        configuration.validate(registry.phaseNames());
        this.configuration = configuration;
        this.registry = registry;
        this.walker = walker;
        this.analyzer = analyzer;
    }

    public ValidationConfiguration configuration() {
        return configuration;
    }

    @Override
    public ValidationReport validate(ValidationRequest request) {
        Instant startedAt = Instant.now();
        log.info("Starting validation of {} assemblies", request.assemblies().size());

        // Step 1: Walk metadata
        log.info("Step 1: Walking metadata...");
        WalkResult walk = walker.walk(request.assemblies(), configuration, request.control());

        // Step 2: Index references
        log.info("Step 2: Indexing references across {} members...", walk.referenceScope().size());
        AnalysisContext context = AnalysisContext.of(UsageIndex.build(walk.referenceScope(), analyzer));

        // Step 3: Evaluate phases
        log.info("Step 3: Evaluating {} phases...", registry.phases().size());
        ValidationReport report = evaluate(walk, context, request, startedAt);

        log.info("Validation complete: {} violations, score {} in {}ms",
                report.violationCount(), report.readinessScore(), report.duration().toMillis());
        return report;
    }

    private ValidationReport evaluate(WalkResult walk, AnalysisContext context,
                                      ValidationRequest request, Instant startedAt) {
        Map<String, PhaseResult> results = new LinkedHashMap<>();
        List<String> notes = new ArrayList<>(walk.notes());
        boolean stopped = false;
        boolean cancelled = walk.cancelled();

        for (ValidationPhase phase : registry.phases()) {
            if (cancelled) {
                break;
            }
            if (!configuration.isPhaseEnabled(phase.name())) {
                log.info("  Phase {} disabled", phase.name());
                results.put(phase.name(), PhaseResult.disabled(phase.name()));
                continue;
            }
            PhaseResult result = runPhase(phase, walk.candidates(), context, request);
            results.put(phase.name(), result);
            request.listener().phaseCompleted(result);

            if (result.state() == PhaseState.STOPPED) {
                stopped = true;
                notes.add("Stopped on first violation in phase " + phase.name());
                break;
            }
            if (result.state() == PhaseState.CANCELLED) {
                cancelled = true;
            }
        }
        if (cancelled) {
            notes.add("Run cancelled before all phases completed");
        }
        return new ValidationReport(startedAt, Instant.now(), results, notes, walk.statistics(),
                stopped, cancelled);
    }

    private PhaseResult runPhase(ValidationPhase phase, List<Candidate> candidates,
                                 AnalysisContext context, ValidationRequest request) {
        Instant start = Instant.now();
        log.info("  Processing phase: {} ({} rules)", phase.name(), phase.rules().size());
        request.listener().phaseStarted(phase.name(), candidates.size());

        List<Violation> violations = new ArrayList<>();
        List<String> notes = new ArrayList<>();
        PhaseState state = PhaseState.COMPLETED;
        int evaluated = 0;
        int faults = 0;
        int interval = configuration.progressInterval();

        candidateLoop:
        for (Candidate candidate : candidates) {
            if (request.control().isCancelled()) {
                state = PhaseState.CANCELLED;
                notes.add("Cancelled after " + evaluated + " of " + candidates.size() + " candidates");
                break;
            }
            for (Rule rule : phase.rules()) {
                RuleOutcome outcome;
                try {
                    outcome = rule.evaluate(candidate, context);
                } catch (RuntimeException | StackOverflowError e) {
                    faults++;
                    log.warn("Rule {} failed on {}: {}", rule.id(), candidate.symbol(), e.toString());
                    notes.add("Rule " + rule.id() + " failed on " + candidate.symbol() + ": " + e);
                    continue;
                }
                if (outcome.violated()) {
                    violations.add(toViolation(rule, candidate, outcome));
                    if (configuration.stopOnFirstViolation()) {
                        evaluated++;
                        state = PhaseState.STOPPED;
                        notes.add("Stopped after first violation (" + rule.id() + " on " + candidate.symbol() + ")");
                        break candidateLoop;
                    }
                }
            }
            evaluated++;
            if (interval > 0 && evaluated % interval == 0) {
                request.listener().progress(phase.name(), evaluated, candidates.size());
            }
        }

        if (state == PhaseState.COMPLETED && (faults > 0 || evaluated == 0)) {
            state = PhaseState.INCONCLUSIVE;
            notes.add(faults > 0
                    ? "Inconclusive: " + faults + " rule evaluation(s) failed"
                    : "Inconclusive: no candidates to evaluate");
        }
        if (state == PhaseState.COMPLETED && violations.isEmpty()) {
            notes.add(CLEAN_NOTE);
        }

        Duration duration = Duration.between(start, Instant.now());
        log.info("  {} finished {}: {} violations over {} candidates in {}ms",
                phase.name(), state, violations.size(), evaluated, duration.toMillis());
        return new PhaseResult(phase.name(), state, violations, notes, evaluated, faults);
    }

    private static Violation toViolation(Rule rule, Candidate candidate, RuleOutcome outcome) {
        return Violation.builder()
                .ruleId(rule.id())
                .ruleName(rule.name())
                .category(rule.category())
                .typeName(candidate.type().fullName())
                .memberName(candidate.isMember() ? candidate.member().name() : null)
                .message(outcome.message())
                .build();
    }
}
