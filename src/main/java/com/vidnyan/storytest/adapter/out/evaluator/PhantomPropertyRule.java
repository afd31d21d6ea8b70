package com.vidnyan.storytest.adapter.out.evaluator;

import com.vidnyan.storytest.domain.model.MemberDescriptor;
import com.vidnyan.storytest.domain.model.MemberKind;
import com.vidnyan.storytest.domain.model.MemberModifier;
import com.vidnyan.storytest.domain.rule.AnalysisContext;
import com.vidnyan.storytest.domain.rule.Candidate;
import com.vidnyan.storytest.domain.rule.Rule;
import com.vidnyan.storytest.domain.rule.RuleOutcome;
import com.vidnyan.storytest.domain.rule.ViolationCategory;

import java.util.HashSet;
import java.util.Set;

/**
 * Flags auto-properties whose accessors are never invoked except by each other.
 */
public class PhantomPropertyRule implements Rule {

    public static final String ID = "PHANTOM-PROPERTY-001";

    @Override
    public String id() { return ID; }

    @Override
    public String name() { return "Auto-property never used"; }

    @Override
    public ViolationCategory category() { return ViolationCategory.UNUSED_CODE; }

    @Override
    public RuleOutcome evaluate(Candidate candidate, AnalysisContext context) {
        if (candidate.isTypeLevel()) {
            return RuleOutcome.pass();
        }
        MemberDescriptor property = candidate.member();
        if (property.kind() != MemberKind.PROPERTY || !property.is(MemberModifier.AUTO_PROPERTY)) {
            return RuleOutcome.pass();
        }
        Set<Integer> accessors = new HashSet<>(property.accessorTokens());
        accessors.remove(0);
        if (accessors.isEmpty()) {
            return RuleOutcome.pass();
        }
        boolean used = accessors.stream()
                .anyMatch(token -> context.usages().isCalledOutside(token, accessors));
        if (used) {
            return RuleOutcome.pass();
        }
        return RuleOutcome.violation("Auto-property '%s' is never read or written", property.name());
    }
}
