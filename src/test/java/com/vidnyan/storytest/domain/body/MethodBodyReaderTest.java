package com.vidnyan.storytest.domain.body;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.storytest.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class MethodBodyReaderTest {

    @Test
    void decode_OperandBytesAreNotOpcodes() {
        // ldc.i4 0x7A7A7A2A; ret
        List<Instruction> instructions = MethodBodyReader.decode(bytes(0x20, 0x2A, 0x7A, 0x7A, 0x7A, RET));

        assertEquals(2, instructions.size());
        assertEquals(0x20, instructions.get(0).code());
        assertEquals(0x7A7A7A2AL, instructions.get(0).operand());
        assertTrue(instructions.get(1).is(Opcode.RET));
        assertEquals(5, instructions.get(1).offset());
    }

    @Test
    void decode_TwoByteOpcode() {
        List<Instruction> instructions = MethodBodyReader.decode(bytes(0xFE, 0x06, 0x01, 0x00, 0x00, 0x06, RET));

        assertEquals(2, instructions.size());
        assertTrue(instructions.get(0).is(Opcode.LDFTN));
        assertEquals(0x06000001L, instructions.get(0).operand());
    }

    @Test
    void decode_SwitchConsumesItsJumpTable() {
        List<Instruction> instructions = MethodBodyReader.decode(bytes(
                0x45, 0x02, 0x00, 0x00, 0x00,
                0x00, 0x00, 0x00, 0x00,
                0x00, 0x00, 0x00, 0x00,
                RET));

        assertEquals(2, instructions.size());
        assertEquals(13, instructions.get(0).length());
        assertEquals(2, instructions.get(0).weight());
    }

    @Test
    void decode_TruncatedOperandEndsDecoding() {
        List<Instruction> instructions = MethodBodyReader.decode(bytes(LDARG_0, CALL, 0x01, 0x00));

        assertEquals(1, instructions.size());
        assertTrue(instructions.get(0).is(Opcode.LDARG_0));
    }

    @Test
    void weight_FollowsOpcodeFamily() {
        List<Instruction> instructions = MethodBodyReader.decode(bytes(
                concat(new int[]{LDARG_1, BRTRUE}, le(0), calling(0x06000001))));

        assertEquals(List.of(1, 2, 1, 0), instructions.stream().map(Instruction::weight).toList());
    }
}
