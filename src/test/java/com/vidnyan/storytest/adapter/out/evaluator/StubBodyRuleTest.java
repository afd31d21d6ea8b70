package com.vidnyan.storytest.adapter.out.evaluator;

import com.vidnyan.storytest.domain.body.BodyPatternAnalyzer;
import com.vidnyan.storytest.domain.model.AttributeRef;
import com.vidnyan.storytest.domain.model.MemberDescriptor;
import com.vidnyan.storytest.domain.rule.AnalysisContext;
import com.vidnyan.storytest.domain.rule.Candidate;
import com.vidnyan.storytest.domain.rule.RuleOutcome;
import org.junit.jupiter.api.Test;

import static com.vidnyan.storytest.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class StubBodyRuleTest {

    private final BodyPatternAnalyzer analyzer = new BodyPatternAnalyzer();
    private final StubBodyRule rule = new StubBodyRule(analyzer);

    @Test
    void constructAndThrow_IsViolation() {
        RuleOutcome outcome = evaluate(MemberDescriptor.method("Attack").body(STUB));

        assertTrue(outcome.violated());
        assertTrue(outcome.message().contains("Attack"));
    }

    @Test
    void borderlineGuardOfWeightThree_IsViolation() {
        assertTrue(evaluate(MemberDescriptor.method("SetSpeed").body(GUARD_WEIGHT_3)).violated());
    }

    @Test
    void guardOfWeightFour_IsArgumentValidation() {
        assertFalse(evaluate(MemberDescriptor.method("SetSpeed").body(GUARD_WEIGHT_4)).violated());
    }

    @Test
    void defaultReturn_IsViolation() {
        RuleOutcome outcome = evaluate(MemberDescriptor.method("FindTarget").returnType("Enemy").body(LDNULL, RET));

        assertTrue(outcome.violated());
        assertTrue(outcome.message().contains("default"));
    }

    @Test
    void typeLevelCandidate_Passes() {
        MemberDescriptor method = member(MemberDescriptor.method("Attack").body(STUB));

        assertFalse(rule.evaluate(Candidate.ofType(method.declaringType()), AnalysisContext.empty()).violated());
    }

    @Test
    void prematureCelebration_NeedsBothClaimAndStub() {
        PrematureCelebrationRule celebration = new PrematureCelebrationRule(analyzer);
        MemberDescriptor claimed = member(MemberDescriptor.method("Save")
                .attributes(AttributeRef.of("FeatureCompleteAttribute")).body(STUB));
        MemberDescriptor honest = member(MemberDescriptor.method("Save").body(STUB));
        MemberDescriptor finished = member(MemberDescriptor.method("Save")
                .attributes(AttributeRef.of("Done")).body(concat(new int[]{LDARG_0}, calling(0x06000001))));

        assertTrue(celebration.evaluate(Candidate.ofMember(claimed), AnalysisContext.empty()).violated());
        assertFalse(celebration.evaluate(Candidate.ofMember(honest), AnalysisContext.empty()).violated());
        assertFalse(celebration.evaluate(Candidate.ofMember(finished), AnalysisContext.empty()).violated());
    }

    @Test
    void prematureCelebration_IgnoresWordsThatOnlyContainACompletionWord() {
        PrematureCelebrationRule celebration = new PrematureCelebrationRule(analyzer);
        MemberDescriptor incomplete = member(MemberDescriptor.method("Save")
                .attributes(AttributeRef.of("IncompleteAttribute")).body(STUB));
        MemberDescriptor abandoned = member(MemberDescriptor.method("Save")
                .attributes(AttributeRef.of("AbandonedAttribute")).body(STUB));
        MemberDescriptor completed = member(MemberDescriptor.method("Save")
                .attributes(AttributeRef.of("CompletedAttribute")).body(STUB));

        assertFalse(celebration.evaluate(Candidate.ofMember(incomplete), AnalysisContext.empty()).violated());
        assertFalse(celebration.evaluate(Candidate.ofMember(abandoned), AnalysisContext.empty()).violated());
        assertTrue(celebration.evaluate(Candidate.ofMember(completed), AnalysisContext.empty()).violated());
    }

    private RuleOutcome evaluate(MemberDescriptor.Builder builder) {
        return rule.evaluate(Candidate.ofMember(member(builder)), AnalysisContext.empty());
    }
}
