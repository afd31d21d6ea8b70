package com.vidnyan.storytest.application.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable settings for one orchestrator. Passed in at construction; nothing is read globally.
 *
 * @param assemblyFilters           substrings an assembly name must contain (any); empty allows all
 * @param excludedAssemblyFilters   substrings that exclude an assembly
 * @param includeHostFrameworkAssemblies whether Unity* assemblies are analyzed
 * @param customTypeAllowList       fully qualified type names analyzed even if their assembly is filtered out
 * @param phaseFlags                per-phase enable flags; phases not listed are enabled
 * @param stopOnFirstViolation      end the run right after the first violation
 * @param progressInterval          candidates between progress callbacks; 0 disables them
 */
public record ValidationConfiguration(
    List<String> assemblyFilters,
    List<String> excludedAssemblyFilters,
    boolean includeHostFrameworkAssemblies,
    List<String> customTypeAllowList,
    Map<String, Boolean> phaseFlags,
    boolean stopOnFirstViolation,
    int progressInterval
) {

    public static final int DEFAULT_PROGRESS_INTERVAL = 100;

    public ValidationConfiguration {
        assemblyFilters = assemblyFilters == null ? List.of() : List.copyOf(assemblyFilters);
        excludedAssemblyFilters = excludedAssemblyFilters == null ? List.of() : List.copyOf(excludedAssemblyFilters);
        customTypeAllowList = customTypeAllowList == null ? List.of() : List.copyOf(customTypeAllowList);
        phaseFlags = phaseFlags == null ? Map.of() : Map.copyOf(phaseFlags);
    }

    public static ValidationConfiguration defaults() {
        return builder().build();
    }

    public boolean isPhaseEnabled(String phase) {
        return phaseFlags.entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(phase))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(Boolean.TRUE);
    }

    /**
     * Check the configuration against the phases that actually exist.
     *
     * @throws InvalidConfigurationException listing every problem found
     */
    public void validate(Collection<String> knownPhases) {
        List<String> problems = new ArrayList<>();
        requireNonBlank(assemblyFilters, "assembly filter", problems);
        requireNonBlank(excludedAssemblyFilters, "excluded assembly filter", problems);
        requireNonBlank(customTypeAllowList, "custom type allow-list entry", problems);

        for (String filter : assemblyFilters) {
            boolean conflicting = filter != null && excludedAssemblyFilters.stream()
                    .anyMatch(excluded -> excluded != null && excluded.equalsIgnoreCase(filter));
            if (conflicting) {
                problems.add("'" + filter + "' is both included and excluded");
            }
        }
        for (String phase : phaseFlags.keySet()) {
            boolean known = knownPhases.stream().anyMatch(p -> p.equalsIgnoreCase(phase));
            if (!known) {
                problems.add("Unknown phase '" + phase + "'; known phases are " + knownPhases);
            }
        }
        if (progressInterval < 0) {
            problems.add("progressInterval must not be negative, was " + progressInterval);
        }
        if (!problems.isEmpty()) {
            throw new InvalidConfigurationException(problems);
        }
    }

    private static void requireNonBlank(List<String> values, String label, List<String> problems) {
        for (String value : values) {
            if (value == null || value.isBlank()) {
                problems.add("Blank " + label);
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private List<String> assemblyFilters = List.of();
        private List<String> excludedAssemblyFilters = List.of();
        private boolean includeHostFrameworkAssemblies;
        private List<String> customTypeAllowList = List.of();
        private final Map<String, Boolean> phaseFlags = new LinkedHashMap<>();
        private boolean stopOnFirstViolation;
        private int progressInterval = DEFAULT_PROGRESS_INTERVAL;

        public Builder assemblyFilters(String... filters) { this.assemblyFilters = List.of(filters); return this; }
        public Builder assemblyFilters(List<String> filters) { this.assemblyFilters = filters; return this; }
        public Builder excludedAssemblyFilters(String... filters) { this.excludedAssemblyFilters = List.of(filters); return this; }
        public Builder excludedAssemblyFilters(List<String> filters) { this.excludedAssemblyFilters = filters; return this; }
        public Builder includeHostFrameworkAssemblies(boolean include) { this.includeHostFrameworkAssemblies = include; return this; }
        public Builder customTypeAllowList(String... types) { this.customTypeAllowList = List.of(types); return this; }
        public Builder customTypeAllowList(List<String> types) { this.customTypeAllowList = types; return this; }
        public Builder phase(String name, boolean enabled) { this.phaseFlags.put(name, enabled); return this; }
        public Builder phases(Map<String, Boolean> flags) { this.phaseFlags.putAll(flags); return this; }
        public Builder stopOnFirstViolation(boolean stop) { this.stopOnFirstViolation = stop; return this; }
        public Builder progressInterval(int interval) { this.progressInterval = interval; return this; }

        public ValidationConfiguration build() {
            return new ValidationConfiguration(assemblyFilters, excludedAssemblyFilters,
                    includeHostFrameworkAssemblies, customTypeAllowList, phaseFlags,
                    stopOnFirstViolation, progressInterval);
        }
    }
}
