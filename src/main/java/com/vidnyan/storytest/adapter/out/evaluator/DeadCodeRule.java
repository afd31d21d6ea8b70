package com.vidnyan.storytest.adapter.out.evaluator;

import com.vidnyan.storytest.domain.model.MemberDescriptor;
import com.vidnyan.storytest.domain.model.MemberKind;
import com.vidnyan.storytest.domain.model.MemberModifier;
import com.vidnyan.storytest.domain.rule.AnalysisContext;
import com.vidnyan.storytest.domain.rule.Candidate;
import com.vidnyan.storytest.domain.rule.Rule;
import com.vidnyan.storytest.domain.rule.RuleOutcome;
import com.vidnyan.storytest.domain.rule.ViolationCategory;

/**
 * Flags private fields that are never read and private methods that are never called.
 * Members without a metadata token cannot be resolved and are ignored.
 */
public class DeadCodeRule implements Rule {

    public static final String ID = "DEAD-CODE-001";

    @Override
    public String id() { return ID; }

    @Override
    public String name() { return "Dead private code"; }

    @Override
    public ViolationCategory category() { return ViolationCategory.UNUSED_CODE; }

    @Override
    public RuleOutcome evaluate(Candidate candidate, AnalysisContext context) {
        if (candidate.isTypeLevel()) {
            return RuleOutcome.pass();
        }
        MemberDescriptor member = candidate.member();
        if (!member.is(MemberModifier.PRIVATE) || member.metadataToken() == 0) {
            return RuleOutcome.pass();
        }
        if (member.kind() == MemberKind.FIELD) {
            return evaluateField(member, context);
        }
        if (member.kind() == MemberKind.METHOD) {
            return evaluateMethod(member, context);
        }
        return RuleOutcome.pass();
    }

    private RuleOutcome evaluateField(MemberDescriptor field, AnalysisContext context) {
        if (field.is(MemberModifier.LITERAL) || field.is(MemberModifier.INIT_ONLY)) {
            return RuleOutcome.pass();
        }
        if (context.usages().isFieldRead(field.metadataToken())) {
            return RuleOutcome.pass();
        }
        return RuleOutcome.violation("Private field '%s' is never read", field.name());
    }

    private RuleOutcome evaluateMethod(MemberDescriptor method, AnalysisContext context) {
        if (method.is(MemberModifier.VIRTUAL) || method.is(MemberModifier.ABSTRACT)
                || method.is(MemberModifier.SPECIAL_NAME)
                || RuleSupport.ENTRY_POINTS.contains(method.name())
                || RuleSupport.isEventHandler(method)) {
            return RuleOutcome.pass();
        }
        if (context.usages().isCalled(method.metadataToken())) {
            return RuleOutcome.pass();
        }
        return RuleOutcome.violation("Private method '%s' is never called", method.name());
    }
}
