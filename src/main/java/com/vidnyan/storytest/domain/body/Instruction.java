package com.vidnyan.storytest.domain.body;

import java.util.Optional;

/**
 * One decoded instruction.
 *
 * @param offset  byte offset of the first opcode byte
 * @param code    raw opcode value (0xFExx for two-byte opcodes)
 * @param operand operand as an unsigned little-endian value, 0 when absent
 * @param length  total encoded length including operand
 */
public record Instruction(
    int offset,
    int code,
    long operand,
    int length
) {

    public Optional<Opcode> opcode() {
        return Opcode.fromValue(code);
    }

    public boolean is(Opcode opcode) {
        return code == opcode.value();
    }

    /**
     * Weight this instruction contributes to the meaningful-operation counter.
     */
    public int weight() {
        return opcode().map(op -> op.family().weight()).orElse(0);
    }
}
