package com.vidnyan.storytest.domain.body;

import com.vidnyan.storytest.domain.model.MemberDescriptor;

import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Pattern detectors over raw method bodies.
 * Stateless; a single instance is shared by every rule.
 */
public class BodyPatternAnalyzer {

    /**
     * Highest meaningful-operation weight before a throw that still counts as a stub.
     * Tuned empirically; recalibrate against real corpora before changing.
     */
    public static final int STUB_WEIGHT_THRESHOLD = 3;

    /** Bodies longer than this are never considered default-returning. */
    public static final int DEFAULT_RETURN_MAX_LENGTH = 8;

    /** Incompleteness score at or above which a short body is suspicious. */
    public static final double SUSPICIOUS_SCORE = 0.6;

    public static final Set<Opcode> CALL_REFERENCES = EnumSet.of(
            Opcode.CALL, Opcode.CALLVIRT, Opcode.NEWOBJ, Opcode.LDFTN, Opcode.LDVIRTFTN);

    public static final Set<Opcode> FIELD_LOADS = EnumSet.of(
            Opcode.LDFLD, Opcode.LDFLDA, Opcode.LDSFLD, Opcode.LDSFLDA);

    private static final int NEWOBJ_THROW_SPAN = 5;

    /**
     * Stub-throw detector. Finds the first construct-object + throw pair, then sums the
     * weights of the instructions preceding the throw.
     */
    public StubClassification classifyThrow(byte[] body) {
        int throwOffset = findConstructThrow(body);
        if (throwOffset < 0) {
            return StubClassification.NONE;
        }
        int weight = weightBefore(body, throwOffset);
        return weight <= STUB_WEIGHT_THRESHOLD
                ? StubClassification.STUB
                : StubClassification.ARGUMENT_VALIDATION;
    }

    public boolean isStub(MemberDescriptor member) {
        return member.isMethod() && member.body().map(b -> classifyThrow(b).isStub()).orElse(false);
    }

    /**
     * Offset of the throw in the first construct-object + 4 operand bytes + throw sequence,
     * or -1 if there is none.
     */
    public int findConstructThrow(byte[] body) {
        if (body == null) {
            return -1;
        }
        for (int i = 0; i + NEWOBJ_THROW_SPAN < body.length; i++) {
            if ((body[i] & 0xFF) == Opcode.NEWOBJ.value()
                    && (body[i + NEWOBJ_THROW_SPAN] & 0xFF) == Opcode.THROW.value()) {
                return i + NEWOBJ_THROW_SPAN;
            }
        }
        return -1;
    }

    /**
     * Sum of instruction weights strictly before the given offset.
     */
    public int weightBefore(byte[] body, int offset) {
        int weight = 0;
        for (Instruction instruction : MethodBodyReader.decode(body)) {
            if (instruction.offset() >= offset) {
                break;
            }
            weight += instruction.weight();
        }
        return weight;
    }

    public int meaningfulWeight(byte[] body) {
        return MethodBodyReader.decode(body).stream().mapToInt(Instruction::weight).sum();
    }

    /**
     * Default-return detector: a short non-void body that loads null, 0 or 1 and returns it.
     */
    public boolean returnsDefaultOnly(MemberDescriptor member) {
        if (!member.isMethod() || member.returnsVoid()) {
            return false;
        }
        return member.body().map(this::isDefaultReturnBody).orElse(false);
    }

    private boolean isDefaultReturnBody(byte[] body) {
        if (body.length > DEFAULT_RETURN_MAX_LENGTH) {
            return false;
        }
        List<Instruction> instructions = MethodBodyReader.decode(body);
        for (int i = 0; i + 1 < instructions.size(); i++) {
            Instruction current = instructions.get(i);
            boolean loadsDefault = current.is(Opcode.LDNULL) || current.is(Opcode.LDC_I4_0)
                    || current.is(Opcode.LDC_I4_1);
            if (loadsDefault && instructions.get(i + 1).is(Opcode.RET)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True when the body is only {@code ret}, optionally preceded by {@code nop}s.
     */
    public boolean isEmptyBody(byte[] body) {
        List<Instruction> instructions = MethodBodyReader.decode(body);
        if (instructions.isEmpty() || !instructions.get(instructions.size() - 1).is(Opcode.RET)) {
            return false;
        }
        return instructions.subList(0, instructions.size() - 1).stream()
                .allMatch(i -> i.is(Opcode.NOP));
    }

    /**
     * No calls and no long-form branches.
     */
    public boolean hasNoLogic(byte[] body) {
        return MethodBodyReader.decode(body).stream().noneMatch(i -> i.is(Opcode.CALLI)
                || i.opcode().map(op -> op.family() == Opcode.Family.CALL
                        || op.family() == Opcode.Family.BRANCH).orElse(false));
    }

    /**
     * Loads a small integer constant (0..8) and immediately returns it.
     */
    public boolean returnsConstant(byte[] body) {
        List<Instruction> instructions = MethodBodyReader.decode(body);
        for (int i = 0; i + 1 < instructions.size(); i++) {
            int code = instructions.get(i).code();
            if (code >= Opcode.LDC_I4_0.value() && code <= 0x1E
                    && instructions.get(i + 1).is(Opcode.RET)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Heuristic in [0, 1] of how unfinished a method body looks.
     */
    public double incompletenessScore(MemberDescriptor member) {
        byte[] body = member.body().orElse(null);
        if (body == null) {
            return 0.0;
        }
        double score = 0.0;
        if (body.length <= 2) {
            score += 0.4;
        } else if (body.length <= 5) {
            score += 0.2;
        }
        if (returnsDefaultOnly(member)) {
            score += 0.3;
        }
        if (hasNoLogic(body)) {
            score += 0.2;
        }
        if (returnsConstant(body)) {
            score += 0.15;
        }
        return Math.min(score, 1.0);
    }

    /**
     * Metadata tokens used as operands by any of the given instructions, in body order.
     */
    public Set<Integer> referencedTokens(byte[] body, Set<Opcode> opcodes) {
        Set<Integer> tokens = new LinkedHashSet<>();
        for (Instruction instruction : MethodBodyReader.decode(body)) {
            instruction.opcode()
                    .filter(opcodes::contains)
                    .ifPresent(op -> tokens.add((int) instruction.operand()));
        }
        return tokens;
    }

    /**
     * Argument slots loaded, addressed or stored by the body.
     * Slot 0 is {@code this} on instance methods.
     */
    public Set<Integer> referencedArguments(byte[] body) {
        Set<Integer> slots = new LinkedHashSet<>();
        for (Instruction instruction : MethodBodyReader.decode(body)) {
            int code = instruction.code();
            if (code >= Opcode.LDARG_0.value() && code <= Opcode.LDARG_3.value()) {
                slots.add(code - Opcode.LDARG_0.value());
            } else if (instruction.is(Opcode.LDARG_S) || instruction.is(Opcode.LDARGA_S)
                    || instruction.is(Opcode.STARG_S) || instruction.is(Opcode.LDARG)
                    || instruction.is(Opcode.LDARGA) || instruction.is(Opcode.STARG)) {
                slots.add((int) instruction.operand());
            }
        }
        return slots;
    }
}
