package com.vidnyan.storytest.domain.body;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The instructions the body analyzer recognizes, with their encoded byte values.
 * Two-byte instructions carry the 0xFE prefix in {@link #value()}'s high byte.
 */
public enum Opcode {
    NOP(0x00, 0, Family.OTHER),
    LDARG_0(0x02, 0, Family.LOAD_ARGUMENT),
    LDARG_1(0x03, 0, Family.LOAD_ARGUMENT),
    LDARG_2(0x04, 0, Family.LOAD_ARGUMENT),
    LDARG_3(0x05, 0, Family.LOAD_ARGUMENT),
    LDLOC_0(0x06, 0, Family.LOAD_ARGUMENT),
    LDLOC_1(0x07, 0, Family.LOAD_ARGUMENT),
    LDLOC_2(0x08, 0, Family.LOAD_ARGUMENT),
    LDLOC_3(0x09, 0, Family.LOAD_ARGUMENT),
    LDARG_S(0x0E, 1, Family.LOAD_ARGUMENT),
    LDARGA_S(0x0F, 1, Family.OTHER),
    STARG_S(0x10, 1, Family.OTHER),
    LDNULL(0x14, 0, Family.OTHER),
    LDC_I4_0(0x16, 0, Family.OTHER),
    LDC_I4_1(0x17, 0, Family.OTHER),
    CALL(0x28, 4, Family.CALL),
    CALLI(0x29, 4, Family.OTHER),
    RET(0x2A, 0, Family.OTHER),
    BR(0x38, 4, Family.BRANCH),
    BRFALSE(0x39, 4, Family.BRANCH),
    BRTRUE(0x3A, 4, Family.BRANCH),
    BEQ(0x3B, 4, Family.BRANCH),
    BGE(0x3C, 4, Family.BRANCH),
    BGT(0x3D, 4, Family.BRANCH),
    BLE(0x3E, 4, Family.BRANCH),
    BLT(0x3F, 4, Family.BRANCH),
    BNE_UN(0x40, 4, Family.BRANCH),
    BGE_UN(0x41, 4, Family.BRANCH),
    BGT_UN(0x42, 4, Family.BRANCH),
    BLE_UN(0x43, 4, Family.BRANCH),
    BLT_UN(0x44, 4, Family.BRANCH),
    SWITCH(0x45, 4, Family.BRANCH),
    CALLVIRT(0x6F, 4, Family.CALL),
    NEWOBJ(0x73, 4, Family.OTHER),
    THROW(0x7A, 0, Family.OTHER),
    LDFLD(0x7B, 4, Family.OTHER),
    LDFLDA(0x7C, 4, Family.OTHER),
    STFLD(0x7D, 4, Family.OTHER),
    LDSFLD(0x7E, 4, Family.OTHER),
    LDSFLDA(0x7F, 4, Family.OTHER),
    STSFLD(0x80, 4, Family.OTHER),
    LDFTN(0xFE06, 4, Family.OTHER),
    LDVIRTFTN(0xFE07, 4, Family.OTHER),
    LDARG(0xFE09, 2, Family.OTHER),
    LDARGA(0xFE0A, 2, Family.OTHER),
    STARG(0xFE0B, 2, Family.OTHER);

    /**
     * Weight classes used by the stub disambiguation walk.
     */
    public enum Family {
        LOAD_ARGUMENT(1),
        BRANCH(2),
        CALL(1),
        OTHER(0);

        private final int weight;

        Family(int weight) {
            this.weight = weight;
        }

        public int weight() {
            return weight;
        }
    }

    public static final int TWO_BYTE_PREFIX = 0xFE;

    private static final Map<Integer, Opcode> BY_VALUE = new HashMap<>();

    static {
        for (Opcode opcode : values()) {
            BY_VALUE.put(opcode.value, opcode);
        }
    }

    private final int value;
    private final int operandSize;
    private final Family family;

    Opcode(int value, int operandSize, Family family) {
        this.value = value;
        this.operandSize = operandSize;
        this.family = family;
    }

    public int value() { return value; }
    public int operandSize() { return operandSize; }
    public Family family() { return family; }

    public static Optional<Opcode> fromValue(int value) {
        return Optional.ofNullable(BY_VALUE.get(value));
    }
}
