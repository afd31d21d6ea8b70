package com.vidnyan.storytest.adapter.out.evaluator;

import com.vidnyan.storytest.domain.body.BodyPatternAnalyzer;
import com.vidnyan.storytest.domain.model.MemberDescriptor;
import com.vidnyan.storytest.domain.model.MemberModifier;
import com.vidnyan.storytest.domain.model.ParameterDescriptor;
import com.vidnyan.storytest.domain.rule.AnalysisContext;
import com.vidnyan.storytest.domain.rule.Candidate;
import com.vidnyan.storytest.domain.rule.RuleOutcome;
import org.junit.jupiter.api.Test;

import static com.vidnyan.storytest.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class UnusedParameterRuleTest {

    private final UnusedParameterRule rule = new UnusedParameterRule(new BodyPatternAnalyzer());

    @Test
    void unreferencedParameter_IsNamed() {
        // instance method: slot 0 is this, amount is slot 1
        RuleOutcome outcome = evaluate(MemberDescriptor.method("Heal")
                .parameters(ParameterDescriptor.of("amount", "int"))
                .body(concat(new int[]{LDARG_0}, calling(0x06000001))));

        assertTrue(outcome.violated());
        assertTrue(outcome.message().contains("amount"));
    }

    @Test
    void referencedParameter_Passes() {
        RuleOutcome outcome = evaluate(MemberDescriptor.method("Heal")
                .parameters(ParameterDescriptor.of("amount", "int"))
                .body(concat(new int[]{LDARG_0, LDARG_1}, calling(0x06000001))));

        assertFalse(outcome.violated());
    }

    @Test
    void staticMethod_StartsAtSlotZero() {
        RuleOutcome used = evaluate(MemberDescriptor.method("Clamp")
                .modifiers(MemberModifier.STATIC)
                .parameters(ParameterDescriptor.of("value", "int"), ParameterDescriptor.of("max", "int"))
                .body(LDARG_0, LDARG_1, RET));
        RuleOutcome unused = evaluate(MemberDescriptor.method("Clamp")
                .modifiers(MemberModifier.STATIC)
                .parameters(ParameterDescriptor.of("value", "int"), ParameterDescriptor.of("max", "int"))
                .body(LDARG_0, RET));

        assertFalse(used.violated());
        assertTrue(unused.violated());
        assertTrue(unused.message().endsWith("max"));
    }

    @Test
    void severalUnusedParameters_GiveOneViolation() {
        RuleOutcome outcome = evaluate(MemberDescriptor.method("Spawn")
                .parameters(ParameterDescriptor.of("x", "float"), ParameterDescriptor.of("y", "float"))
                .body(RET));

        assertTrue(outcome.violated());
        assertTrue(outcome.message().contains("x, y"));
    }

    @Test
    void imposedSignatures_AreSkipped() {
        assertFalse(evaluate(MemberDescriptor.method("Spawn").modifiers(MemberModifier.VIRTUAL)
                .parameters(ParameterDescriptor.of("x", "float")).body(RET)).violated());
        assertFalse(evaluate(MemberDescriptor.method("OnClicked")
                .parameters(ParameterDescriptor.of("sender", "object"), ParameterDescriptor.of("e", "System.EventArgs"))
                .body(RET)).violated());
        assertFalse(evaluate(MemberDescriptor.method("Spawn")
                .parameters(ParameterDescriptor.of("x", "float"))).violated());
    }

    private RuleOutcome evaluate(MemberDescriptor.Builder builder) {
        return rule.evaluate(Candidate.ofMember(member(builder)), AnalysisContext.empty());
    }
}
