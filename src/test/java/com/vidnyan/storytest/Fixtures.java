package com.vidnyan.storytest;

import com.vidnyan.storytest.domain.model.MemberDescriptor;
import com.vidnyan.storytest.domain.model.TypeDescriptor;

/**
 * Method bodies and descriptor shortcuts shared by tests.
 */
public final class Fixtures {

    public static final int RET = 0x2A;
    public static final int NOP = 0x00;
    public static final int LDARG_0 = 0x02;
    public static final int LDARG_1 = 0x03;
    public static final int LDARG_2 = 0x04;
    public static final int LDNULL = 0x14;
    public static final int LDC_I4_0 = 0x16;
    public static final int LDC_I4_5 = 0x1B;
    public static final int BRTRUE = 0x3A;
    public static final int NEWOBJ = 0x73;
    public static final int THROW = 0x7A;
    public static final int CALL = 0x28;
    public static final int LDFLD = 0x7B;
    public static final int STFLD = 0x7D;

    /** newobj NotImplementedException::.ctor; throw */
    public static final int[] STUB = {NEWOBJ, 0x01, 0x00, 0x00, 0x0A, THROW};

    /** ldarg.1; brtrue +0; newobj; throw; ldarg.1; ret (weight 3 before the throw) */
    public static final int[] GUARD_WEIGHT_3 = {
            LDARG_1, BRTRUE, 0x00, 0x00, 0x00, 0x00,
            NEWOBJ, 0x01, 0x00, 0x00, 0x0A, THROW,
            LDARG_1, RET};

    /** ldarg.1; ldarg.2; brtrue +0; newobj; throw; ldarg.1; ret (weight 4 before the throw) */
    public static final int[] GUARD_WEIGHT_4 = {
            LDARG_1, LDARG_2, BRTRUE, 0x00, 0x00, 0x00, 0x00,
            NEWOBJ, 0x01, 0x00, 0x00, 0x0A, THROW,
            LDARG_1, RET};

    private Fixtures() {
    }

    /** call &lt;token&gt;; ret */
    public static int[] calling(int token) {
        return concat(new int[]{CALL}, le(token), new int[]{RET});
    }

    /** ldarg.0; ldfld &lt;token&gt;; ret */
    public static int[] readingField(int token) {
        return concat(new int[]{LDARG_0, LDFLD}, le(token), new int[]{RET});
    }

    public static int[] le(int value) {
        return new int[]{value & 0xFF, (value >>> 8) & 0xFF, (value >>> 16) & 0xFF, (value >>> 24) & 0xFF};
    }

    public static int[] concat(int[]... parts) {
        int length = 0;
        for (int[] part : parts) {
            length += part.length;
        }
        int[] result = new int[length];
        int pos = 0;
        for (int[] part : parts) {
            System.arraycopy(part, 0, result, pos, part.length);
            pos += part.length;
        }
        return result;
    }

    public static byte[] bytes(int... values) {
        byte[] result = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = (byte) values[i];
        }
        return result;
    }

    /**
     * Build the member inside a plain class named Game.Player and return it.
     */
    public static MemberDescriptor member(MemberDescriptor.Builder builder) {
        return TypeDescriptor.builder("Player").namespace("Game").member(builder).build().members().get(0);
    }
}
