package com.vidnyan.storytest.adapter.out.evaluator;

import com.vidnyan.storytest.domain.model.MemberDescriptor;
import com.vidnyan.storytest.domain.model.MemberModifier;
import com.vidnyan.storytest.domain.model.TypeDescriptor;
import com.vidnyan.storytest.domain.rule.AnalysisContext;
import com.vidnyan.storytest.domain.rule.Candidate;
import com.vidnyan.storytest.domain.rule.Rule;
import com.vidnyan.storytest.domain.rule.RuleOutcome;
import com.vidnyan.storytest.domain.rule.ViolationCategory;

public class UnsealedAbstractRule implements Rule {

    public static final String ID = "UNSEALED-ABSTRACT-001";

    @Override
    public String id() { return ID; }

    @Override
    public String name() { return "Abstract member on a non-abstract type"; }

    @Override
    public ViolationCategory category() { return ViolationCategory.INCOMPLETE_IMPLEMENTATION; }

    @Override
    public RuleOutcome evaluate(Candidate candidate, AnalysisContext context) {
        if (candidate.isTypeLevel()) {
            return RuleOutcome.pass();
        }
        MemberDescriptor member = candidate.member();
        TypeDescriptor owner = member.declaringType();
        if (member.is(MemberModifier.ABSTRACT) && !owner.isAbstract() && !owner.isInterface()) {
            return RuleOutcome.violation("Abstract member '%s' is declared on '%s', which is not abstract",
                    member.name(), owner.name());
        }
        return RuleOutcome.pass();
    }
}
