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
 * Flags tiny method bodies that do nothing meaningful: no argument loads, calls or branches.
 * Empty bodies are left to {@link ColdMethodRule} and default returns to {@link StubBodyRule}.
 */
@RequiredArgsConstructor
public class MinimalBodyRule implements Rule {

    public static final String ID = "MINIMAL-BODY-001";

    private final BodyPatternAnalyzer analyzer;

    @Override
    public String id() { return ID; }

    @Override
    public String name() { return "Minimal placeholder body"; }

    @Override
    public ViolationCategory category() { return ViolationCategory.PLACEHOLDER_CODE; }

    @Override
    public RuleOutcome evaluate(Candidate candidate, AnalysisContext context) {
        if (candidate.isTypeLevel() || !candidate.member().isMethod()) {
            return RuleOutcome.pass();
        }
        MemberDescriptor method = candidate.member();
        if (method.is(MemberModifier.SPECIAL_NAME) || RuleSupport.isEventHandler(method)) {
            return RuleOutcome.pass();
        }
        byte[] body = method.body().orElse(null);
        if (body == null || body.length == 0 || analyzer.isEmptyBody(body) || analyzer.returnsDefaultOnly(method)) {
            return RuleOutcome.pass();
        }
        if (analyzer.meaningfulWeight(body) > 0) {
            return RuleOutcome.pass();
        }
        double score = analyzer.incompletenessScore(method);
        if (score >= BodyPatternAnalyzer.SUSPICIOUS_SCORE) {
            return RuleOutcome.violation(
                    "Method '%s' has a %d-byte body with no meaningful operations (incompleteness %.2f)",
                    method.name(), body.length, score);
        }
        return RuleOutcome.pass();
    }
}
