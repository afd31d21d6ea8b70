package com.vidnyan.storytest.domain.rule;

import com.vidnyan.storytest.domain.body.BodyPatternAnalyzer;
import com.vidnyan.storytest.domain.model.MemberDescriptor;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Reverse reference index: which members call a method or load a field, keyed by metadata token.
 */
public final class UsageIndex {

    private static final UsageIndex EMPTY = new UsageIndex(Map.of(), Map.of());

    private final Map<Integer, Set<Integer>> callers;
    private final Map<Integer, Set<Integer>> fieldReaders;

    private UsageIndex(Map<Integer, Set<Integer>> callers, Map<Integer, Set<Integer>> fieldReaders) {
        this.callers = callers;
        this.fieldReaders = fieldReaders;
    }

    public static UsageIndex empty() {
        return EMPTY;
    }

    public static UsageIndex build(Collection<MemberDescriptor> members, BodyPatternAnalyzer analyzer) {
        Map<Integer, Set<Integer>> callers = new HashMap<>();
        Map<Integer, Set<Integer>> fieldReaders = new HashMap<>();
        for (MemberDescriptor member : members) {
            byte[] body = member.body().orElse(null);
            if (body == null) {
                continue;
            }
            int referrer = member.metadataToken();
            for (Integer token : analyzer.referencedTokens(body, BodyPatternAnalyzer.CALL_REFERENCES)) {
                callers.computeIfAbsent(token, t -> new HashSet<>()).add(referrer);
            }
            for (Integer token : analyzer.referencedTokens(body, BodyPatternAnalyzer.FIELD_LOADS)) {
                fieldReaders.computeIfAbsent(token, t -> new HashSet<>()).add(referrer);
            }
        }
        return new UsageIndex(callers, fieldReaders);
    }

    public boolean isCalled(int token) {
        return callers.containsKey(token);
    }

    /**
     * Called by at least one member whose token is not in {@code excluded}.
     */
    public boolean isCalledOutside(int token, Set<Integer> excluded) {
        Set<Integer> referrers = callers.get(token);
        return referrers != null && referrers.stream().anyMatch(r -> !excluded.contains(r));
    }

    public boolean isFieldRead(int token) {
        return fieldReaders.containsKey(token);
    }
}
