package com.vidnyan.storytest.adapter.out.evaluator;

import com.vidnyan.storytest.domain.model.MemberDescriptor;
import com.vidnyan.storytest.domain.model.MemberKind;
import com.vidnyan.storytest.domain.model.MemberModifier;
import com.vidnyan.storytest.domain.model.TypeDescriptor;
import com.vidnyan.storytest.domain.model.TypeFlag;
import com.vidnyan.storytest.domain.rule.AnalysisContext;
import com.vidnyan.storytest.domain.rule.Candidate;
import com.vidnyan.storytest.domain.rule.Rule;
import com.vidnyan.storytest.domain.rule.RuleOutcome;
import com.vidnyan.storytest.domain.rule.ViolationCategory;

/**
 * Flags value types that expose no public instance field or property.
 */
public class HollowStructRule implements Rule {

    public static final String ID = "HOLLOW-STRUCT-001";

    @Override
    public String id() { return ID; }

    @Override
    public String name() { return "Hollow value type"; }

    @Override
    public ViolationCategory category() { return ViolationCategory.PLACEHOLDER_CODE; }

    @Override
    public RuleOutcome evaluate(Candidate candidate, AnalysisContext context) {
        if (!candidate.isTypeLevel()) {
            return RuleOutcome.pass();
        }
        TypeDescriptor type = candidate.type();
        if (!type.hasFlag(TypeFlag.VALUE_TYPE) || type.isEnum()) {
            return RuleOutcome.pass();
        }
        if (type.members().stream().anyMatch(HollowStructRule::isPublicState)) {
            return RuleOutcome.pass();
        }
        return RuleOutcome.violation("Value type '%s' has no public fields or properties", type.name());
    }

    private static boolean isPublicState(MemberDescriptor member) {
        return (member.kind() == MemberKind.FIELD || member.kind() == MemberKind.PROPERTY)
                && member.is(MemberModifier.PUBLIC)
                && !member.is(MemberModifier.STATIC);
    }
}
