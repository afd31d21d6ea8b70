package com.vidnyan.storytest.adapter.out.evaluator;

import com.vidnyan.storytest.domain.body.BodyPatternAnalyzer;
import com.vidnyan.storytest.domain.model.MemberDescriptor;
import com.vidnyan.storytest.domain.rule.AnalysisContext;
import com.vidnyan.storytest.domain.rule.Candidate;
import com.vidnyan.storytest.domain.rule.Rule;
import com.vidnyan.storytest.domain.rule.RuleOutcome;
import com.vidnyan.storytest.domain.rule.ViolationCategory;
import lombok.RequiredArgsConstructor;

/**
 * Flags methods that throw a freshly constructed exception with no real logic before it,
 * and short methods that only return null, 0 or 1.
 */
@RequiredArgsConstructor
public class StubBodyRule implements Rule {

    public static final String ID = "STUB-BODY-001";

    private final BodyPatternAnalyzer analyzer;

    @Override
    public String id() { return ID; }

    @Override
    public String name() { return "Stub or placeholder body"; }

    @Override
    public ViolationCategory category() { return ViolationCategory.INCOMPLETE_IMPLEMENTATION; }

    @Override
    public RuleOutcome evaluate(Candidate candidate, AnalysisContext context) {
        if (candidate.isTypeLevel() || !candidate.member().isMethod()) {
            return RuleOutcome.pass();
        }
        MemberDescriptor method = candidate.member();
        if (analyzer.isStub(method)) {
            return RuleOutcome.violation(
                    "Method '%s' only throws; it looks like an unimplemented stub", method.name());
        }
        if (analyzer.returnsDefaultOnly(method)) {
            return RuleOutcome.violation(
                    "Method '%s' only returns a hard-coded default value", method.name());
        }
        return RuleOutcome.pass();
    }
}
