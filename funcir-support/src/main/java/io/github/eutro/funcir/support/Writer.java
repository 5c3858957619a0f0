package io.github.eutro.funcir.support;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.function.Function;

/**
 * Writes text with format strings, for back-ends that emit source code.
 * <p>
 * In a format string, {@code {}} is replaced with the next argument, {@code {n}} with the
 * argument at index {@code n}, and {@code {{}} and {@code }}} with literal braces. The next argument
 * after {@code {n}} is the one at {@code n + 1}.
 */
public class Writer {
    private final Appendable out;

    public Writer(Appendable out) {
        this.out = out;
    }

    /**
     * Write something as is.
     *
     * @param o The thing, written with {@link String#valueOf(Object)}.
     * @return This writer.
     */
    public Writer append(Object o) {
        try {
            out.append(String.valueOf(o));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    /**
     * Write a format string.
     *
     * @param fmt  The format string.
     * @param args The arguments.
     * @return This writer.
     * @throws IllegalArgumentException If the format string is malformed, or refers to a missing argument.
     */
    public Writer print(String fmt, Object... args) {
        return printWith(Object.class, Function.identity(), fmt, args);
    }

    /**
     * Write a format string, converting arguments of some type with a function first.
     *
     * @param type The type of arguments to convert.
     * @param fn   The conversion.
     * @param fmt  The format string.
     * @param args The arguments.
     * @param <T>  The type of arguments to convert.
     * @return This writer.
     * @throws IllegalArgumentException If the format string is malformed, or refers to a missing argument.
     */
    public <T> Writer printWith(Class<T> type, Function<? super T, ?> fn, String fmt, Object... args) {
        StringBuilder sb = new StringBuilder();
        int next = 0;
        int i = 0;
        while (i < fmt.length()) {
            char c = fmt.charAt(i);
            if (c == '{') {
                if (i + 1 < fmt.length() && fmt.charAt(i + 1) == '{') {
                    sb.append('{');
                    i += 2;
                    continue;
                }
                int close = fmt.indexOf('}', i + 1);
                if (close == -1) {
                    throw new IllegalArgumentException("unterminated '{' at " + i + " in \"" + fmt + "\"");
                }
                int index;
                if (close == i + 1) {
                    index = next;
                } else {
                    String digits = fmt.substring(i + 1, close);
                    try {
                        index = Integer.parseUnsignedInt(digits);
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("bad placeholder {" + digits + "} in \"" + fmt + "\"", e);
                    }
                }
                if (index >= args.length) {
                    throw new IllegalArgumentException("placeholder " + index + " out of range, "
                            + args.length + " argument(s) in \"" + fmt + "\"");
                }
                Object arg = args[index];
                sb.append(type.isInstance(arg) ? fn.apply(type.cast(arg)) : arg);
                next = index + 1;
                i = close + 1;
            } else if (c == '}') {
                if (i + 1 < fmt.length() && fmt.charAt(i + 1) == '}') {
                    sb.append('}');
                    i += 2;
                    continue;
                }
                throw new IllegalArgumentException("unmatched '}' at " + i + " in \"" + fmt + "\"");
            } else {
                sb.append(c);
                i++;
            }
        }
        return append(sb);
    }
}
