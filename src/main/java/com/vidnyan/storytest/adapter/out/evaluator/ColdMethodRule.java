package com.vidnyan.storytest.adapter.out.evaluator;

import com.vidnyan.storytest.domain.body.BodyPatternAnalyzer;
import com.vidnyan.storytest.domain.model.MemberDescriptor;
import com.vidnyan.storytest.domain.model.MemberModifier;
import com.vidnyan.storytest.domain.rule.AnalysisContext;
import com.vidnyan.storytest.domain.rule.Candidate;
import com.vidnyan.storytest.domain.rule.Rule;
import com.vidnyan.storytest.domain.rule.RuleOutcome;
import com.vidnyan.storytest.domain.rule.ViolationCategory;
import lombok.RequiredArgsConstructor;

/**
 * Flags methods whose whole body is a bare return.
 */
@RequiredArgsConstructor
public class ColdMethodRule implements Rule {

    public static final String ID = "COLD-METHOD-001";

    private final BodyPatternAnalyzer analyzer;

    @Override
    public String id() { return ID; }

    @Override
    public String name() { return "Empty (cold) method"; }

    @Override
    public ViolationCategory category() { return ViolationCategory.PLACEHOLDER_CODE; }

    @Override
    public RuleOutcome evaluate(Candidate candidate, AnalysisContext context) {
        if (candidate.isTypeLevel() || !candidate.member().isMethod()) {
            return RuleOutcome.pass();
        }
        MemberDescriptor method = candidate.member();
        if (method.is(MemberModifier.ABSTRACT) || method.is(MemberModifier.VIRTUAL)
                || method.is(MemberModifier.SPECIAL_NAME)) {
            return RuleOutcome.pass();
        }
        boolean empty = method.body().map(analyzer::isEmptyBody).orElse(false);
        return empty
                ? RuleOutcome.violation("Method '%s' has an empty body", method.name())
                : RuleOutcome.pass();
    }
}
