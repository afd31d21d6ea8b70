package com.vidnyan.storytest.adapter.out.evaluator;

import com.vidnyan.storytest.domain.body.BodyPatternAnalyzer;
import com.vidnyan.storytest.domain.model.MemberDescriptor;
import com.vidnyan.storytest.domain.model.MemberModifier;
import com.vidnyan.storytest.domain.model.ParameterDescriptor;
import com.vidnyan.storytest.domain.rule.AnalysisContext;
import com.vidnyan.storytest.domain.rule.Candidate;
import com.vidnyan.storytest.domain.rule.Rule;
import com.vidnyan.storytest.domain.rule.RuleOutcome;
import com.vidnyan.storytest.domain.rule.ViolationCategory;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Flags methods with parameters the body never loads or stores.
 * Overridable methods and event handlers are skipped since their signature is imposed.
 */
@RequiredArgsConstructor
public class UnusedParameterRule implements Rule {

    public static final String ID = "UNUSED-PARAMETER-001";

    private final BodyPatternAnalyzer analyzer;

    @Override
    public String id() { return ID; }

    @Override
    public String name() { return "Unused parameter"; }

    @Override
    public ViolationCategory category() { return ViolationCategory.UNUSED_CODE; }

    @Override
    public RuleOutcome evaluate(Candidate candidate, AnalysisContext context) {
        if (candidate.isTypeLevel() || !candidate.member().isMethod()) {
            return RuleOutcome.pass();
        }
        MemberDescriptor method = candidate.member();
        if (method.parameters().isEmpty() || !method.hasBody()
                || method.is(MemberModifier.ABSTRACT) || method.is(MemberModifier.VIRTUAL)
                || method.is(MemberModifier.SPECIAL_NAME) || RuleSupport.isEventHandler(method)) {
            return RuleOutcome.pass();
        }
        Set<Integer> used = analyzer.referencedArguments(method.body().orElseThrow());
        int firstSlot = method.is(MemberModifier.STATIC) ? 0 : 1;
        List<String> unused = new ArrayList<>();
        List<ParameterDescriptor> parameters = method.parameters();
        for (int i = 0; i < parameters.size(); i++) {
            if (!used.contains(firstSlot + i)) {
                unused.add(parameters.get(i).name());
            }
        }
        if (unused.isEmpty()) {
            return RuleOutcome.pass();
        }
        return RuleOutcome.violation("Method '%s' never uses parameter(s): %s",
                method.name(), String.join(", ", unused));
    }
}
