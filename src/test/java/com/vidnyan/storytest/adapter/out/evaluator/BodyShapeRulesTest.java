package com.vidnyan.storytest.adapter.out.evaluator;

import com.vidnyan.storytest.domain.body.BodyPatternAnalyzer;
import com.vidnyan.storytest.domain.model.AttributeRef;
import com.vidnyan.storytest.domain.model.MemberDescriptor;
import com.vidnyan.storytest.domain.model.MemberModifier;
import com.vidnyan.storytest.domain.rule.AnalysisContext;
import com.vidnyan.storytest.domain.rule.Candidate;
import com.vidnyan.storytest.domain.rule.Rule;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.storytest.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class BodyShapeRulesTest {

    private final BodyPatternAnalyzer analyzer = new BodyPatternAnalyzer();

    @Test
    void coldMethod_FlagsBareReturn() {
        Rule rule = new ColdMethodRule(analyzer);

        assertTrue(violates(rule, MemberDescriptor.method("OnlyReturns").body(RET)));
        assertTrue(violates(rule, MemberDescriptor.method("OnlyReturns").body(NOP, RET)));
        assertFalse(violates(rule, MemberDescriptor.method("Hook").modifiers(MemberModifier.VIRTUAL).body(RET)));
        assertFalse(violates(rule, MemberDescriptor.method(".ctor").modifiers(MemberModifier.SPECIAL_NAME).body(RET)));
        assertFalse(violates(rule, MemberDescriptor.method("Run").body(concat(new int[]{LDARG_0}, calling(0x06000001)))));
    }

    @Test
    void minimalBody_FlagsConstantReturnWithoutLogic() {
        Rule rule = new MinimalBodyRule(analyzer);

        assertTrue(violates(rule, MemberDescriptor.method("MaxPlayers").returnType("int").body(LDC_I4_5, RET)));
        assertFalse(violates(rule, MemberDescriptor.method("Empty").body(RET)));
        assertFalse(violates(rule, MemberDescriptor.method("FindTarget").returnType("Enemy").body(LDNULL, RET)));
        assertFalse(violates(rule, MemberDescriptor.method("Id").returnType("int").body(readingField(0x04000001))));
        assertFalse(violates(rule, MemberDescriptor.method("get_Max").returnType("int")
                .modifiers(MemberModifier.SPECIAL_NAME).body(LDC_I4_5, RET)));
    }

    @Test
    void debugOnly_FlagsDebugAndTemporaryNames() {
        Rule rule = new DebugOnlyRule();

        assertTrue(violates(rule, MemberDescriptor.method("DebugDrawPaths").body(RET)));
        assertTrue(violates(rule, MemberDescriptor.method("TestSpawn").body(RET)));
        assertTrue(violates(rule, MemberDescriptor.method("LoadTempSave").body(RET)));
        assertTrue(violates(rule, MemberDescriptor.property("tmp_score")));
        assertFalse(violates(rule, MemberDescriptor.method("ApplyTemplate").body(RET)));
        assertFalse(violates(rule, MemberDescriptor.method("LatestScore").body(RET)));
        assertFalse(violates(rule, MemberDescriptor.method("DebugDrawPaths")
                .attributes(AttributeRef.of("ObsoleteAttribute")).body(RET)));
        assertFalse(violates(rule, MemberDescriptor.field("debugLevel")));
    }

    @Test
    void nameTokens_SplitsCamelCaseAndUnderscores() {
        assertEquals(List.of("Debug", "Draw", "Gizmo"), RuleSupport.nameTokens("DebugDrawGizmo"));
        assertEquals(List.of("HTTP", "Temp", "value"), RuleSupport.nameTokens("HTTPTemp_value"));
    }

    private static boolean violates(Rule rule, MemberDescriptor.Builder builder) {
        return rule.evaluate(Candidate.ofMember(member(builder)), AnalysisContext.empty()).violated();
    }
}
