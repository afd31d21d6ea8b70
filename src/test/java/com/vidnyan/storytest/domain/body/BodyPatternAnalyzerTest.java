package com.vidnyan.storytest.domain.body;

import com.vidnyan.storytest.domain.model.MemberDescriptor;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static com.vidnyan.storytest.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class BodyPatternAnalyzerTest {

    private final BodyPatternAnalyzer analyzer = new BodyPatternAnalyzer();

    @Test
    void classifyThrow_BareConstructAndThrow_IsStub() {
        assertEquals(StubClassification.STUB, analyzer.classifyThrow(bytes(STUB)));
    }

    @Test
    void classifyThrow_WeightThreeBeforeThrow_IsStillStub() {
        byte[] body = bytes(GUARD_WEIGHT_3);

        assertEquals(3, analyzer.weightBefore(body, analyzer.findConstructThrow(body)));
        assertEquals(StubClassification.STUB, analyzer.classifyThrow(body));
    }

    @Test
    void classifyThrow_WeightFourBeforeThrow_IsArgumentValidation() {
        byte[] body = bytes(GUARD_WEIGHT_4);

        assertEquals(4, analyzer.weightBefore(body, analyzer.findConstructThrow(body)));
        assertEquals(StubClassification.ARGUMENT_VALIDATION, analyzer.classifyThrow(body));
    }

    @Test
    void classifyThrow_NoThrow_IsNone() {
        assertEquals(StubClassification.NONE, analyzer.classifyThrow(bytes(LDARG_1, RET)));
        assertEquals(StubClassification.NONE, analyzer.classifyThrow(new byte[0]));
        assertEquals(StubClassification.NONE, analyzer.classifyThrow(null));
    }

    @Test
    void returnsDefaultOnly_ShortNonVoidBody() {
        MemberDescriptor nullReturn = member(MemberDescriptor.method("Find").returnType("Item").body(LDNULL, RET));
        MemberDescriptor falseReturn = member(MemberDescriptor.method("IsReady").returnType("bool").body(NOP, LDC_I4_0, RET));
        MemberDescriptor voidMethod = member(MemberDescriptor.method("Reset").body(LDNULL, RET));

        assertTrue(analyzer.returnsDefaultOnly(nullReturn));
        assertTrue(analyzer.returnsDefaultOnly(falseReturn));
        assertFalse(analyzer.returnsDefaultOnly(voidMethod));
    }

    @Test
    void returnsDefaultOnly_BodyLongerThanEightBytes_IsIgnored() {
        MemberDescriptor method = member(MemberDescriptor.method("Compute").returnType("int")
                .body(concat(calling(0x06000001), new int[]{NOP, NOP, LDC_I4_0, RET})));

        assertFalse(analyzer.returnsDefaultOnly(method));
    }

    @Test
    void isEmptyBody_OnlyNopsBeforeReturn() {
        assertTrue(analyzer.isEmptyBody(bytes(RET)));
        assertTrue(analyzer.isEmptyBody(bytes(NOP, NOP, RET)));
        assertFalse(analyzer.isEmptyBody(bytes(LDARG_0, RET)));
        assertFalse(analyzer.isEmptyBody(new byte[0]));
    }

    @Test
    void incompletenessScore_ConstantReturnScoresHigh() {
        MemberDescriptor constant = member(MemberDescriptor.method("MaxPlayers").returnType("int").body(LDC_I4_5, RET));
        MemberDescriptor real = member(MemberDescriptor.method("Tick").body(concat(new int[]{LDARG_0}, calling(0x06000002))));

        assertEquals(0.75, analyzer.incompletenessScore(constant), 1e-9);
        assertTrue(analyzer.incompletenessScore(real) < BodyPatternAnalyzer.SUSPICIOUS_SCORE);
    }

    @Test
    void referencedTokens_ReadsCallAndFieldOperands() {
        byte[] body = bytes(concat(calling(0x06000010), readingField(0x04000003)));

        assertEquals(Set.of(0x06000010), analyzer.referencedTokens(body, BodyPatternAnalyzer.CALL_REFERENCES));
        assertEquals(Set.of(0x04000003), analyzer.referencedTokens(body, BodyPatternAnalyzer.FIELD_LOADS));
    }

    @Test
    void referencedArguments_CoversShortAndLongForms() {
        byte[] body = bytes(LDARG_0, LDARG_2, 0x0E, 0x05, 0xFE, 0x09, 0x07, 0x00, RET);

        assertEquals(Set.of(0, 2, 5, 7), analyzer.referencedArguments(body));
    }
}
