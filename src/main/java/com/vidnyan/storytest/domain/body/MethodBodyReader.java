package com.vidnyan.storytest.domain.body;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes a raw method body into instructions using the standard CIL operand widths,
 * so operand bytes are never read as opcodes.
 * A truncated trailing instruction ends decoding.
 */
public final class MethodBodyReader {

    private static final int[] SINGLE_BYTE_OPERAND = new int[256];
    private static final int[] TWO_BYTE_OPERAND = new int[256];

    static {
        // ldarg.s .. stloc.s, ldc.i4.s, short branches, leave.s
        fill(SINGLE_BYTE_OPERAND, 0x0E, 0x13, 1);
        SINGLE_BYTE_OPERAND[0x1F] = 1;
        fill(SINGLE_BYTE_OPERAND, 0x2B, 0x37, 1);
        SINGLE_BYTE_OPERAND[0xDE] = 1;

        SINGLE_BYTE_OPERAND[0x20] = 4; // ldc.i4
        SINGLE_BYTE_OPERAND[0x21] = 8; // ldc.i8
        SINGLE_BYTE_OPERAND[0x22] = 4; // ldc.r4
        SINGLE_BYTE_OPERAND[0x23] = 8; // ldc.r8
        fill(SINGLE_BYTE_OPERAND, 0x27, 0x29, 4); // jmp, call, calli
        fill(SINGLE_BYTE_OPERAND, 0x38, 0x44, 4); // long branches
        fill(SINGLE_BYTE_OPERAND, 0x6F, 0x75, 4); // callvirt .. isinst
        SINGLE_BYTE_OPERAND[0x79] = 4; // unbox
        fill(SINGLE_BYTE_OPERAND, 0x7B, 0x81, 4); // field access, stobj
        SINGLE_BYTE_OPERAND[0x8C] = 4; // box
        SINGLE_BYTE_OPERAND[0x8D] = 4; // newarr
        SINGLE_BYTE_OPERAND[0x8F] = 4; // ldelema
        SINGLE_BYTE_OPERAND[0xA3] = 4; // ldelem
        SINGLE_BYTE_OPERAND[0xA4] = 4; // stelem
        SINGLE_BYTE_OPERAND[0xA5] = 4; // unbox.any
        SINGLE_BYTE_OPERAND[0xC2] = 4; // refanyval
        SINGLE_BYTE_OPERAND[0xC6] = 4; // mkrefany
        SINGLE_BYTE_OPERAND[0xD0] = 4; // ldtoken
        SINGLE_BYTE_OPERAND[0xDD] = 4; // leave

        TWO_BYTE_OPERAND[0x06] = 4; // ldftn
        TWO_BYTE_OPERAND[0x07] = 4; // ldvirtftn
        fill(TWO_BYTE_OPERAND, 0x09, 0x0E, 2); // ldarg .. stloc
        TWO_BYTE_OPERAND[0x12] = 1; // unaligned.
        TWO_BYTE_OPERAND[0x15] = 4; // initobj
        TWO_BYTE_OPERAND[0x16] = 4; // constrained.
        TWO_BYTE_OPERAND[0x19] = 1; // no.
        TWO_BYTE_OPERAND[0x1C] = 4; // sizeof
    }

    private MethodBodyReader() {
    }

    private static void fill(int[] table, int from, int to, int width) {
        for (int i = from; i <= to; i++) {
            table[i] = width;
        }
    }

    public static List<Instruction> decode(byte[] body) {
        List<Instruction> instructions = new ArrayList<>();
        if (body == null) {
            return instructions;
        }
        int pos = 0;
        while (pos < body.length) {
            int start = pos;
            int code = body[pos++] & 0xFF;
            int operandSize;
            if (code == Opcode.TWO_BYTE_PREFIX) {
                if (pos >= body.length) {
                    break;
                }
                int second = body[pos++] & 0xFF;
                code = (Opcode.TWO_BYTE_PREFIX << 8) | second;
                operandSize = TWO_BYTE_OPERAND[second];
            } else if (code == Opcode.SWITCH.value()) {
                if (pos + 4 > body.length) {
                    break;
                }
                long targets = readOperand(body, pos, 4);
                if (targets < 0 || targets > (body.length - pos - 4) / 4) {
                    break;
                }
                operandSize = 4 + (int) targets * 4;
            } else {
                operandSize = SINGLE_BYTE_OPERAND[code];
            }
            if (pos + operandSize > body.length) {
                break;
            }
            long operand = code == Opcode.SWITCH.value()
                    ? readOperand(body, pos, 4)
                    : readOperand(body, pos, Math.min(operandSize, 8));
            pos += operandSize;
            instructions.add(new Instruction(start, code, operand, pos - start));
        }
        return instructions;
    }

    private static long readOperand(byte[] body, int pos, int size) {
        long value = 0;
        for (int i = 0; i < size; i++) {
            value |= (long) (body[pos + i] & 0xFF) << (8 * i);
        }
        return value;
    }
}
