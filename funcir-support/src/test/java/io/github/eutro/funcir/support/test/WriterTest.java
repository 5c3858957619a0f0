package io.github.eutro.funcir.support.test;

import io.github.eutro.funcir.support.Writer;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class WriterTest {
    private static String print(String fmt, Object... args) {
        StringBuilder sb = new StringBuilder();
        new Writer(sb).print(fmt, args);
        return sb.toString();
    }

    @Test
    void placeholders() {
        assertEquals("a + b", print("{} + {}", "a", "b"));
        assertEquals("b - a", print("{1} - {0}", "a", "b"));
        assertEquals("a b c", print("{0} {} {2}", "a", "b", "c"));
        assertEquals("x = 3;", print("{} = {};", "x", 3));
    }

    @Test
    void escapes() {
        assertEquals("{a}", print("{{{}}}", "a"));
        assertEquals("{} }", print("{{}} }}"));
    }

    @Test
    void malformed() {
        assertThrows(IllegalArgumentException.class, () -> print("{", "a"));
        assertThrows(IllegalArgumentException.class, () -> print("}"));
        assertThrows(IllegalArgumentException.class, () -> print("{x}", "a"));
        assertThrows(IllegalArgumentException.class, () -> print("{} {}", "a"));
        assertThrows(IllegalArgumentException.class, () -> print("{-1}", "a"));
    }

    @Test
    void nothingIsWrittenOnError() {
        StringBuilder sb = new StringBuilder();
        Writer w = new Writer(sb);
        assertThrows(IllegalArgumentException.class, () -> w.print("ok {} {}", "a"));
        assertEquals("", sb.toString());
    }

    @Test
    void printWithConvertsArgumentsOfAType() {
        StringBuilder sb = new StringBuilder();
        new Writer(sb)
                .printWith(Integer.class, i -> "r" + i, "{} <= {} + {};\n", 1, 2, "carry")
                .append("end");
        assertEquals("r1 <= r2 + carry;\nend", sb.toString());
    }
}
