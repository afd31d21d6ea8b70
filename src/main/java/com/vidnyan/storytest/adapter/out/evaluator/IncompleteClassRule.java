package com.vidnyan.storytest.adapter.out.evaluator;

import com.vidnyan.storytest.domain.model.TypeDescriptor;
import com.vidnyan.storytest.domain.rule.AnalysisContext;
import com.vidnyan.storytest.domain.rule.Candidate;
import com.vidnyan.storytest.domain.rule.Rule;
import com.vidnyan.storytest.domain.rule.RuleOutcome;
import com.vidnyan.storytest.domain.rule.ViolationCategory;

import java.util.List;

/**
 * Flags concrete classes that leave inherited abstract members unimplemented.
 * Abstract members declared on the class itself are reported by {@link UnsealedAbstractRule}.
 */
public class IncompleteClassRule implements Rule {

    public static final String ID = "INCOMPLETE-CLASS-001";

    @Override
    public String id() { return ID; }

    @Override
    public String name() { return "Concrete class with unimplemented abstract members"; }

    @Override
    public ViolationCategory category() { return ViolationCategory.INCOMPLETE_IMPLEMENTATION; }

    @Override
    public RuleOutcome evaluate(Candidate candidate, AnalysisContext context) {
        if (!candidate.isTypeLevel()) {
            return RuleOutcome.pass();
        }
        TypeDescriptor type = candidate.type();
        if (!type.isClass() || type.isAbstract()) {
            return RuleOutcome.pass();
        }
        List<String> missing = type.unimplementedAbstractMembers();
        if (missing.isEmpty()) {
            return RuleOutcome.pass();
        }
        return RuleOutcome.violation("Class '%s' is not abstract but leaves %s unimplemented",
                type.name(), String.join(", ", missing));
    }
}
