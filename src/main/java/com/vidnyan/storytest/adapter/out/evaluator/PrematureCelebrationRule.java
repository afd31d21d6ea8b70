package com.vidnyan.storytest.adapter.out.evaluator;

import com.vidnyan.storytest.domain.body.BodyPatternAnalyzer;
import com.vidnyan.storytest.domain.model.AttributeRef;
import com.vidnyan.storytest.domain.model.MemberDescriptor;
import com.vidnyan.storytest.domain.rule.AnalysisContext;
import com.vidnyan.storytest.domain.rule.Candidate;
import com.vidnyan.storytest.domain.rule.Rule;
import com.vidnyan.storytest.domain.rule.RuleOutcome;
import com.vidnyan.storytest.domain.rule.ViolationCategory;
import lombok.RequiredArgsConstructor;

import java.util.Optional;
import java.util.Set;

/**
 * Flags members marked as complete whose body is still a stub.
 */
@RequiredArgsConstructor
public class PrematureCelebrationRule implements Rule {

    public static final String ID = "PREMATURE-CELEBRATION-001";

    /** Matched as whole name tokens, so [Incomplete] or [Abandoned] make no claim. */
    private static final Set<String> COMPLETION_WORDS = Set.of("Complete", "Completed", "Finished", "Done");

    private final BodyPatternAnalyzer analyzer;

    @Override
    public String id() { return ID; }

    @Override
    public String name() { return "Claims completion but is a stub"; }

    @Override
    public ViolationCategory category() { return ViolationCategory.PREMATURE_CELEBRATION; }

    @Override
    public RuleOutcome evaluate(Candidate candidate, AnalysisContext context) {
        if (candidate.isTypeLevel() || !candidate.member().isMethod()) {
            return RuleOutcome.pass();
        }
        MemberDescriptor method = candidate.member();
        Optional<AttributeRef> claim = method.attributes().stream()
                .filter(PrematureCelebrationRule::claimsCompletion)
                .findFirst();
        if (claim.isEmpty() || !analyzer.isStub(method)) {
            return RuleOutcome.pass();
        }
        return RuleOutcome.violation("Method '%s' is marked [%s] but still throws as a stub",
                method.name(), claim.get().shortName());
    }

    static boolean claimsCompletion(AttributeRef attribute) {
        return RuleSupport.nameTokens(attribute.shortName()).stream().anyMatch(COMPLETION_WORDS::contains);
    }
}
