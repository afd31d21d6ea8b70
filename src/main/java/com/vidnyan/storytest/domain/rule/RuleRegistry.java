package com.vidnyan.storytest.domain.rule;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed catalog of phases and their rules, assembled explicitly at startup.
 * Phase order is the order of registration.
 */
public final class RuleRegistry {

    private final List<ValidationPhase> phases;

    private RuleRegistry(List<ValidationPhase> phases) {
        this.phases = List.copyOf(phases);
    }

    public List<ValidationPhase> phases() {
        return phases;
    }

    public List<String> phaseNames() {
        return phases.stream().map(ValidationPhase::name).toList();
    }

    public Optional<ValidationPhase> phase(String name) {
        return phases.stream().filter(p -> p.name().equalsIgnoreCase(name)).findFirst();
    }

    public List<Rule> allRules() {
        return phases.stream().flatMap(p -> p.rules().stream()).toList();
    }

    public Optional<Rule> rule(String id) {
        return allRules().stream().filter(r -> r.id().equals(id)).findFirst();
    }

    public int size() {
        return allRules().size();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<ValidationPhase> phases = new ArrayList<>();
        private final Set<String> phaseNames = new HashSet<>();
        private final Set<String> ruleIds = new HashSet<>();

        public Builder phase(String name, Rule... rules) {
            return phase(name, List.of(rules));
        }

        public Builder phase(String name, List<Rule> rules) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Phase name must not be blank");
            }
            if (!phaseNames.add(name.toLowerCase(Locale.ROOT))) {
                throw new IllegalArgumentException("Duplicate phase: " + name);
            }
            for (Rule rule : rules) {
                if (!ruleIds.add(rule.id())) {
                    throw new IllegalArgumentException("Duplicate rule id: " + rule.id());
                }
            }
            phases.add(new ValidationPhase(name, rules));
            return this;
        }

        public RuleRegistry build() {
            return new RuleRegistry(phases);
        }
    }
}
