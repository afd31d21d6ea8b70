package com.vidnyan.storytest.adapter.out.evaluator;

import com.vidnyan.storytest.domain.rule.AnalysisContext;
import com.vidnyan.storytest.domain.rule.Candidate;
import com.vidnyan.storytest.domain.rule.Rule;
import com.vidnyan.storytest.domain.rule.RuleOutcome;
import com.vidnyan.storytest.domain.rule.ViolationCategory;

public class EmptyInterfaceRule implements Rule {

    public static final String ID = "EMPTY-INTERFACE-001";

    @Override
    public String id() { return ID; }

    @Override
    public String name() { return "Empty interface"; }

    @Override
    public ViolationCategory category() { return ViolationCategory.OTHER; }

    @Override
    public RuleOutcome evaluate(Candidate candidate, AnalysisContext context) {
        if (!candidate.isTypeLevel() || !candidate.type().isInterface()) {
            return RuleOutcome.pass();
        }
        if (candidate.type().members().isEmpty()) {
            return RuleOutcome.violation("Interface '%s' declares no members", candidate.type().name());
        }
        return RuleOutcome.pass();
    }
}
