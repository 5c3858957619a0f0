package io.github.eutro.funcir.ir;

/**
 * The operations of the functional IR.
 * <p>
 * Each operation is documented with a pseudo-signature. {@code bit[N]} is an N-bit vector;
 * where it is marked signed or unsigned, that is how the operation interprets it, otherwise
 * the result is the same under either interpretation. {@code memory[A, D]} is a memory with
 * A address bits and D data bits.
 */
public enum Fn {
    /**
     * Sentinel for a node that should not exist. Never produced by the factory.
     */
    INVALID("invalid", 0, Payload.NONE),
    /**
     * {@code buf(a: any): any = a}
     * <p>
     * Identity. Placeholders are argument-less {@code buf} nodes until they are backfilled.
     */
    BUF("buf", 1, Payload.NONE),
    /**
     * {@code slice(a: bit[N], offset: int, out_width: int): bit[out_width] = a[offset +: out_width]}
     */
    SLICE("slice", 1, Payload.INT),
    /**
     * {@code zero_extend(a: unsigned bit[N], out_width: int): unsigned bit[out_width]}, with {@code out_width > N}
     */
    ZERO_EXTEND("zero_extend", 1, Payload.NONE),
    /**
     * {@code sign_extend(a: signed bit[N], out_width: int): signed bit[out_width]}, with {@code out_width > N}
     */
    SIGN_EXTEND("sign_extend", 1, Payload.NONE),
    /**
     * {@code concat(a: bit[N], b: bit[M]): bit[N+M] = {b, a}}, {@code a} in the least significant bits.
     */
    CONCAT("concat", 2, Payload.NONE),
    /**
     * {@code add(a: bit[N], b: bit[N]): bit[N] = a + b}
     */
    ADD("add", 2, Payload.NONE),
    /**
     * {@code sub(a: bit[N], b: bit[N]): bit[N] = a - b}
     */
    SUB("sub", 2, Payload.NONE),
    /**
     * {@code mul(a: bit[N], b: bit[N]): bit[N] = a * b}
     */
    MUL("mul", 2, Payload.NONE),
    /**
     * {@code unsigned_div(a: unsigned bit[N], b: unsigned bit[N]): unsigned bit[N] = a / b}
     */
    UNSIGNED_DIV("unsigned_div", 2, Payload.NONE),
    /**
     * {@code unsigned_mod(a: unsigned bit[N], b: unsigned bit[N]): unsigned bit[N] = a % b}
     */
    UNSIGNED_MOD("unsigned_mod", 2, Payload.NONE),
    /**
     * {@code bitwise_and(a: bit[N], b: bit[N]): bit[N] = a & b}
     */
    BITWISE_AND("bitwise_and", 2, Payload.NONE),
    /**
     * {@code bitwise_or(a: bit[N], b: bit[N]): bit[N] = a | b}
     */
    BITWISE_OR("bitwise_or", 2, Payload.NONE),
    /**
     * {@code bitwise_xor(a: bit[N], b: bit[N]): bit[N] = a ^ b}
     */
    BITWISE_XOR("bitwise_xor", 2, Payload.NONE),
    /**
     * {@code bitwise_not(a: bit[N]): bit[N] = ~a}
     */
    BITWISE_NOT("bitwise_not", 1, Payload.NONE),
    /**
     * {@code reduce_and(a: bit[N]): bit[1] = &a}
     */
    REDUCE_AND("reduce_and", 1, Payload.NONE),
    /**
     * {@code reduce_or(a: bit[N]): bit[1] = |a}
     */
    REDUCE_OR("reduce_or", 1, Payload.NONE),
    /**
     * {@code reduce_xor(a: bit[N]): bit[1] = ^a}
     */
    REDUCE_XOR("reduce_xor", 1, Payload.NONE),
    /**
     * {@code unary_minus(a: bit[N]): bit[N] = -a}
     */
    UNARY_MINUS("unary_minus", 1, Payload.NONE),
    /**
     * {@code equal(a: bit[N], b: bit[N]): bit[1] = a == b}
     */
    EQUAL("equal", 2, Payload.NONE),
    /**
     * {@code not_equal(a: bit[N], b: bit[N]): bit[1] = a != b}
     */
    NOT_EQUAL("not_equal", 2, Payload.NONE),
    /**
     * {@code signed_greater_than(a: signed bit[N], b: signed bit[N]): bit[1] = a > b}
     */
    SIGNED_GREATER_THAN("signed_greater_than", 2, Payload.NONE),
    /**
     * {@code signed_greater_equal(a: signed bit[N], b: signed bit[N]): bit[1] = a >= b}
     */
    SIGNED_GREATER_EQUAL("signed_greater_equal", 2, Payload.NONE),
    /**
     * {@code unsigned_greater_than(a: unsigned bit[N], b: unsigned bit[N]): bit[1] = a > b}
     */
    UNSIGNED_GREATER_THAN("unsigned_greater_than", 2, Payload.NONE),
    /**
     * {@code unsigned_greater_equal(a: unsigned bit[N], b: unsigned bit[N]): bit[1] = a >= b}
     */
    UNSIGNED_GREATER_EQUAL("unsigned_greater_equal", 2, Payload.NONE),
    /**
     * {@code logical_shift_left(a: bit[N], b: unsigned bit[M]): bit[N] = a << b}, with {@code M == clog2(N)}
     */
    LOGICAL_SHIFT_LEFT("logical_shift_left", 2, Payload.NONE),
    /**
     * {@code logical_shift_right(a: unsigned bit[N], b: unsigned bit[M]): unsigned bit[N] = a >> b}, with {@code M == clog2(N)}
     */
    LOGICAL_SHIFT_RIGHT("logical_shift_right", 2, Payload.NONE),
    /**
     * {@code arithmetic_shift_right(a: signed bit[N], b: unsigned bit[M]): signed bit[N] = a >> b}, with {@code M == clog2(N)}
     */
    ARITHMETIC_SHIFT_RIGHT("arithmetic_shift_right", 2, Payload.NONE),
    /**
     * {@code mux(a: bit[N], b: bit[N], s: bit[1]): bit[N] = s ? b : a}
     */
    MUX("mux", 3, Payload.NONE),
    /**
     * {@code constant(a: Const[N]): bit[N] = a}
     */
    CONSTANT("constant", 0, Payload.CONST),
    /**
     * {@code input(name): any}, the current value of the named input.
     */
    INPUT("input", 0, Payload.NAME),
    /**
     * {@code state(name): any}, the current value of the named state variable.
     */
    STATE("state", 0, Payload.NAME),
    /**
     * {@code multiple(a: any, b: any, ...): any}, a value with more than one driver.
     */
    MULTIPLE("multiple", -1, Payload.NONE),
    /**
     * {@code undriven(width: int): bit[width]}, a value with no driver.
     */
    UNDRIVEN("undriven", 0, Payload.NONE),
    /**
     * {@code memory_read(mem: memory[A, D], addr: bit[A]): bit[D] = mem[addr]}
     */
    MEMORY_READ("memory_read", 2, Payload.NONE),
    /**
     * {@code memory_write(mem: memory[A, D], addr: bit[A], data: bit[D]): memory[A, D]},
     * a copy of {@code mem} with {@code data} stored at {@code addr}.
     */
    MEMORY_WRITE("memory_write", 3, Payload.NONE),
    ;

    /**
     * The kind of non-node data an operation carries.
     */
    public enum Payload {
        NONE,
        CONST,
        NAME,
        INT,
    }

    public final String mnemonic;
    /**
     * The number of node arguments, or -1 if variable.
     */
    public final int arity;
    public final Payload payload;

    Fn(String mnemonic, int arity, Payload payload) {
        this.mnemonic = mnemonic;
        this.arity = arity;
        this.payload = payload;
    }

    /**
     * Whether the result width is not implied by the arguments or payload,
     * and so is carried in {@link NodeData#width}.
     *
     * @return Whether the width is explicit.
     */
    public boolean hasExplicitWidth() {
        switch (this) {
            case SLICE:
            case ZERO_EXTEND:
            case SIGN_EXTEND:
            case UNDRIVEN:
                return true;
            default:
                return false;
        }
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
