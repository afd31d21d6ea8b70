package com.vidnyan.storytest.adapter.out.evaluator;

import com.vidnyan.storytest.domain.model.MemberDescriptor;
import com.vidnyan.storytest.domain.model.MemberModifier;
import com.vidnyan.storytest.domain.model.TypeDescriptor;
import com.vidnyan.storytest.domain.model.TypeFlag;
import com.vidnyan.storytest.domain.rule.AnalysisContext;
import com.vidnyan.storytest.domain.rule.Candidate;
import com.vidnyan.storytest.domain.rule.RuleOutcome;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HollowStructRuleTest {

    private final HollowStructRule rule = new HollowStructRule();

    @Test
    void structWithoutPublicState_IsViolation() {
        TypeDescriptor hollow = struct("DamageInfo")
                .member(MemberDescriptor.field("amount").modifiers(MemberModifier.PRIVATE))
                .member(MemberDescriptor.field("Zero").modifiers(MemberModifier.PUBLIC, MemberModifier.STATIC))
                .build();

        RuleOutcome outcome = evaluate(hollow);

        assertTrue(outcome.violated());
        assertTrue(outcome.message().contains("DamageInfo"));
    }

    @Test
    void structWithPublicFieldOrProperty_Passes() {
        TypeDescriptor withField = struct("GridPos")
                .member(MemberDescriptor.field("X").modifiers(MemberModifier.PUBLIC))
                .build();
        TypeDescriptor withProperty = struct("Health")
                .member(MemberDescriptor.property("Current").modifiers(MemberModifier.PUBLIC))
                .build();

        assertFalse(evaluate(withField).violated());
        assertFalse(evaluate(withProperty).violated());
    }

    @Test
    void enumsClassesAndMembers_AreIgnored() {
        TypeDescriptor enumType = TypeDescriptor.builder("Mode").flags(TypeFlag.ENUM, TypeFlag.VALUE_TYPE).build();
        TypeDescriptor emptyClass = TypeDescriptor.builder("Marker").build();
        TypeDescriptor hollow = struct("Token")
                .member(MemberDescriptor.method("Reset").modifiers(MemberModifier.PUBLIC))
                .build();

        assertFalse(evaluate(enumType).violated());
        assertFalse(evaluate(emptyClass).violated());
        assertFalse(rule.evaluate(Candidate.ofMember(hollow.members().get(0)), AnalysisContext.empty()).violated());
        assertTrue(evaluate(hollow).violated());
    }

    private RuleOutcome evaluate(TypeDescriptor type) {
        return rule.evaluate(Candidate.ofType(type), AnalysisContext.empty());
    }

    private static TypeDescriptor.Builder struct(String name) {
        return TypeDescriptor.builder(name).namespace("Game").flags(TypeFlag.VALUE_TYPE, TypeFlag.SEALED);
    }
}
