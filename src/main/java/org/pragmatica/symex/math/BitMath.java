package org.pragmatica.symex.math;

/**
 * Bit-vector helpers over {@code long} values of 1 to 64 bits.
 */
public final class BitMath {
    public static final int MAX_BITS = 64;

    private BitMath() {}

    /**
     * All-ones mask of the given width.
     */
    public static long mask(int bits) {
        return bits >= MAX_BITS
               ? -1L
               : (1L << bits) - 1;
    }

    public static boolean isValidWidth(long bits) {
        return bits >= 1 && bits <= MAX_BITS;
    }

    public static long zeroExtend(long value, int bits) {
        return value & mask(bits);
    }

    public static long signExtend(long value, int bits) {
        if (bits >= MAX_BITS) {
            return value;
        }
        var shift = MAX_BITS - bits;
        return (value << shift) >> shift;
    }

    public static long signBit(int bits) {
        return 1L << (bits - 1);
    }

    /**
     * Re-encode a value stored at {@code fromBits} into {@code toBits}, extending with the
     * sign bit or with zeros.
     */
    public static long resize(long value, int fromBits, int toBits, boolean signExtend) {
        var extended = signExtend
                       ? signExtend(value, fromBits)
                       : zeroExtend(value, fromBits);
        return zeroExtend(extended, toBits);
    }
}
