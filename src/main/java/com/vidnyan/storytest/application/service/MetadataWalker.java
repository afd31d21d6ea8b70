package com.vidnyan.storytest.application.service;

import com.vidnyan.storytest.domain.filter.ArtifactFilter;
import com.vidnyan.storytest.domain.model.AssemblyHandle;
import com.vidnyan.storytest.domain.model.AttributeRef;
import com.vidnyan.storytest.domain.model.MemberDescriptor;
import com.vidnyan.storytest.domain.model.TypeDescriptor;
import com.vidnyan.storytest.domain.model.TypeLoadException;
import com.vidnyan.storytest.domain.report.WalkStatistics;
import com.vidnyan.storytest.domain.rule.Candidate;
import com.vidnyan.storytest.domain.rule.ExemptionMarker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Enumerates candidate types and members from a set of assemblies.
 * Nested types are reached with an explicit stack and visited directly after their
 * enclosing type, in declaration order. Stateless and safe to share between threads.
 */
@Slf4j
@RequiredArgsConstructor
public class MetadataWalker {

    static final List<String> PLATFORM_PREFIXES = List.of(
            "system", "microsoft", "mscorlib", "netstandard", "mono.", "nunit", "newtonsoft");

    static final List<String> HOST_FRAMEWORK_PREFIXES = List.of("unity");

    private final ArtifactFilter filter;

    /**
     * Why an assembly was or wasn't selected by name.
     */
    enum Selection {
        INCLUDED,
        PLATFORM,
        HOST_FRAMEWORK,
        TEST_ASSEMBLY,
        DENIED,
        NOT_ALLOWED
    }

    public WalkResult walk(List<AssemblyHandle> assemblies, ValidationConfiguration config, RunControl control) {
        Walk walk = new Walk(config, control);
        for (AssemblyHandle assembly : assemblies) {
            if (control.isCancelled()) {
                walk.cancelled = true;
                break;
            }
            if (assembly == null) {
                continue;
            }
            walk.assembly(assembly);
        }
        if (walk.cancelled) {
            walk.notes.add("Walk cancelled; results are partial");
        }
        log.info("Walked {} assemblies: {} candidates, {} types skipped, {} members skipped",
                walk.assembliesScanned, walk.candidates.size(), walk.typesSkipped, walk.membersSkipped);
        return new WalkResult(walk.candidates, walk.referenceScope, walk.notes, walk.statistics(), walk.cancelled);
    }

    static Selection select(String assemblyName, ValidationConfiguration config) {
        String name = assemblyName == null ? "" : assemblyName.toLowerCase(Locale.ROOT);
        if (PLATFORM_PREFIXES.stream().anyMatch(name::startsWith)) {
            return Selection.PLATFORM;
        }
        if (!config.includeHostFrameworkAssemblies() && HOST_FRAMEWORK_PREFIXES.stream().anyMatch(name::startsWith)) {
            return Selection.HOST_FRAMEWORK;
        }
        if (name.endsWith(".tests") || name.endsWith(".test")) {
            return Selection.TEST_ASSEMBLY;
        }
        if (containsAny(name, config.excludedAssemblyFilters())) {
            return Selection.DENIED;
        }
        if (!config.assemblyFilters().isEmpty() && !containsAny(name, config.assemblyFilters())) {
            return Selection.NOT_ALLOWED;
        }
        return Selection.INCLUDED;
    }

    private static boolean containsAny(String name, List<String> filters) {
        return filters.stream().anyMatch(f -> name.contains(f.toLowerCase(Locale.ROOT)));
    }

    /**
     * Stack entry. Hidden types are traversed only to collect references and allow-listed nested types.
     */
    private record Entry(TypeDescriptor type, boolean hidden) {
    }

    /**
     * Mutable state of a single walk.
     */
    private final class Walk {
        private final ValidationConfiguration config;
        private final RunControl control;
        private final Set<String> customTypes;
        private final List<Candidate> candidates = new ArrayList<>();
        private final List<MemberDescriptor> referenceScope = new ArrayList<>();
        private final List<String> notes = new ArrayList<>();
        private boolean cancelled;
        private int assembliesScanned;
        private int assembliesSkipped;
        private int typesVisited;
        private int typesSkipped;
        private int membersYielded;
        private int membersSkipped;
        private int exemptSymbols;

        Walk(ValidationConfiguration config, RunControl control) {
            this.config = config;
            this.control = control;
            this.customTypes = new HashSet<>(config.customTypeAllowList());
        }

        void assembly(AssemblyHandle assembly) {
            Selection selection = select(assembly.name(), config);
            boolean customOnly = selection != Selection.INCLUDED;
            if (customOnly && customTypes.isEmpty()) {
                assembliesSkipped++;
                log.debug("Skipping assembly {} ({})", assembly.name(), selection);
                if (selection == Selection.TEST_ASSEMBLY) {
                    notes.add("Skipped test assembly " + assembly.name());
                }
                return;
            }
            assembliesScanned++;
            log.debug("Scanning assembly {}{}", assembly.name(), customOnly ? " (allow-listed types only)" : "");

            Deque<Entry> stack = new ArrayDeque<>();
            pushAll(stack, load(assembly), false);
            while (!stack.isEmpty()) {
                if (control.isCancelled()) {
                    cancelled = true;
                    return;
                }
                Entry entry = stack.pop();
                boolean hidden = visit(entry, customOnly);
                pushAll(stack, entry.type().nestedTypes(), hidden);
            }
        }

        private List<TypeDescriptor> load(AssemblyHandle assembly) {
            try {
                return assembly.loadTypes();
            } catch (TypeLoadException e) {
                log.warn("Partial load of {}: {} type(s) failed", assembly.name(), e.getFailures().size());
                notes.add("Partial load of " + assembly.name() + ": continuing with "
                        + e.getLoadedTypes().size() + " type(s); failures: " + String.join("; ", e.getFailures()));
                return e.getLoadedTypes();
            }
        }

        private void pushAll(Deque<Entry> stack, List<TypeDescriptor> types, boolean hidden) {
            for (int i = types.size() - 1; i >= 0; i--) {
                TypeDescriptor type = types.get(i);
                if (type != null) {
                    stack.push(new Entry(type, hidden));
                }
            }
        }

        /**
         * Visit one type and yield its candidates unless it is hidden.
         *
         * @return whether nested types should be treated as hidden
         */
        private boolean visit(Entry entry, boolean customOnly) {
            TypeDescriptor type = entry.type();
            referenceScope.addAll(type.members().stream().filter(MemberDescriptor::hasBody).toList());

            if (entry.hidden()) {
                return true;
            }
            if (customOnly && !customTypes.contains(type.fullName())) {
                return false;
            }
            typesVisited++;
            if (filter.shouldSkipType(type)) {
                typesSkipped++;
                return true;
            }
            if (isExempt(type::attributes, type.fullName())) {
                exemptSymbols++;
                return true;
            }

            candidates.add(Candidate.ofType(type));
            for (MemberDescriptor member : type.members()) {
                if (control.isCancelled()) {
                    cancelled = true;
                    return true;
                }
                if (filter.shouldSkipMember(member)) {
                    membersSkipped++;
                    continue;
                }
                if (isExempt(member::attributes, member.qualifiedName())) {
                    exemptSymbols++;
                    continue;
                }
                candidates.add(Candidate.ofMember(member));
                membersYielded++;
            }
            return false;
        }

        private boolean isExempt(Supplier<List<AttributeRef>> attributes, String symbol) {
            ExemptionMarker.Status status;
            try {
                status = ExemptionMarker.inspect(attributes.get());
            } catch (RuntimeException e) {
                notes.add("Attributes of " + symbol + " could not be read: " + e.getMessage());
                return false;
            }
            if (status == ExemptionMarker.Status.MISSING_REASON) {
                notes.add(ExemptionMarker.ATTRIBUTE_NAME + " on " + symbol
                        + " has no reason and was ignored");
            }
            return status == ExemptionMarker.Status.VALID;
        }

        WalkStatistics statistics() {
            return new WalkStatistics(assembliesScanned, assembliesSkipped, typesVisited, typesSkipped,
                    membersYielded, membersSkipped, exemptSymbols);
        }
    }
}
