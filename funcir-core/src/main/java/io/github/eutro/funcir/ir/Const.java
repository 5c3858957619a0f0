package io.github.eutro.funcir.ir;

import org.jetbrains.annotations.NotNull;

import java.math.BigInteger;

/**
 * A bit-vector literal of a fixed width.
 */
public final class Const {
    private final int width;
    private final BigInteger bits;

    private Const(int width, BigInteger bits) {
        this.width = width;
        this.bits = bits;
    }

    /**
     * A literal with the low {@code width} bits of {@code value}.
     *
     * @param width The width, positive.
     * @param value The value, truncated to {@code width} bits.
     * @return The literal.
     */
    public static Const of(int width, long value) {
        return of(width, BigInteger.valueOf(value));
    }

    /**
     * A literal with the low {@code width} bits of {@code value}, in two's complement.
     *
     * @param width The width, positive.
     * @param value The value, truncated to {@code width} bits.
     * @return The literal.
     */
    public static Const of(int width, @NotNull BigInteger value) {
        if (width <= 0) throw new IllegalArgumentException("literal width must be positive, got " + width);
        BigInteger mask = BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE);
        return new Const(width, value.and(mask));
    }

    /**
     * Parse a literal from its bits, most significant first, e.g. {@code "0101"}.
     *
     * @param bits The bits, only {@code 0} and {@code 1}.
     * @return The literal, as wide as the string is long.
     */
    public static Const fromBits(String bits) {
        if (bits.isEmpty()) throw new IllegalArgumentException("empty literal");
        for (int i = 0; i < bits.length(); i++) {
            char c = bits.charAt(i);
            if (c != '0' && c != '1') {
                throw new IllegalArgumentException("illegal bit '" + c + "' in literal " + bits);
            }
        }
        return new Const(bits.length(), new BigInteger(bits, 2));
    }

    public int width() {
        return width;
    }

    /**
     * Get the value as an unsigned integer.
     *
     * @return The value.
     */
    public BigInteger value() {
        return bits;
    }

    /**
     * Get the value of bit {@code i}, where bit 0 is the least significant.
     *
     * @param i The bit index.
     * @return The bit.
     */
    public boolean bit(int i) {
        if (i < 0 || i >= width) throw new IndexOutOfBoundsException("bit " + i + " of " + width + "-bit literal");
        return bits.testBit(i);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Const)) return false;
        Const that = (Const) o;
        return width == that.width && bits.equals(that.bits);
    }

    @Override
    public int hashCode() {
        return 31 * width + bits.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(width).append("'b");
        for (int i = width - 1; i >= 0; i--) {
            sb.append(bits.testBit(i) ? '1' : '0');
        }
        return sb.toString();
    }
}
