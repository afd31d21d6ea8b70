package com.vidnyan.storytest.adapter.out.evaluator;

import com.vidnyan.storytest.domain.model.MemberDescriptor;
import com.vidnyan.storytest.domain.model.MemberKind;
import com.vidnyan.storytest.domain.model.MemberModifier;
import com.vidnyan.storytest.domain.rule.AnalysisContext;
import com.vidnyan.storytest.domain.rule.Candidate;
import com.vidnyan.storytest.domain.rule.Rule;
import com.vidnyan.storytest.domain.rule.RuleOutcome;
import com.vidnyan.storytest.domain.rule.ViolationCategory;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Flags debug, test or temporary members left in production code without being marked obsolete.
 */
public class DebugOnlyRule implements Rule {

    public static final String ID = "DEBUG-ONLY-001";

    private static final Set<String> LEADING_MARKERS = Set.of("debug", "test");
    private static final Set<String> ANYWHERE_MARKERS = Set.of("temp", "temporary", "tmp");
    private static final List<String> DEPRECATION_MARKERS = List.of("Obsolete", "Deprecated");

    @Override
    public String id() { return ID; }

    @Override
    public String name() { return "Debug or temporary member"; }

    @Override
    public ViolationCategory category() { return ViolationCategory.DEBUGGING_CODE; }

    @Override
    public RuleOutcome evaluate(Candidate candidate, AnalysisContext context) {
        if (candidate.isTypeLevel()) {
            return RuleOutcome.pass();
        }
        MemberDescriptor member = candidate.member();
        if (member.kind() != MemberKind.METHOD && member.kind() != MemberKind.PROPERTY) {
            return RuleOutcome.pass();
        }
        if (member.is(MemberModifier.SPECIAL_NAME) || !isDebugName(member.name())) {
            return RuleOutcome.pass();
        }
        if (DEPRECATION_MARKERS.stream().anyMatch(member::hasAttribute)) {
            return RuleOutcome.pass();
        }
        return RuleOutcome.violation(
                "Member '%s' looks like debug/temporary code; remove it or mark it [Obsolete]", member.name());
    }

    static boolean isDebugName(String name) {
        List<String> tokens = RuleSupport.nameTokens(name);
        if (tokens.isEmpty()) {
            return false;
        }
        if (LEADING_MARKERS.contains(tokens.get(0).toLowerCase(Locale.ROOT))) {
            return true;
        }
        return tokens.stream().anyMatch(t -> ANYWHERE_MARKERS.contains(t.toLowerCase(Locale.ROOT)));
    }
}
