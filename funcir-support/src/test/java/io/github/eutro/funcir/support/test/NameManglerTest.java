package io.github.eutro.funcir.support.test;

import io.github.eutro.funcir.support.NameMangler;
import io.github.eutro.funcir.support.NameMangler.IllegalSymbolPolicy;
import org.junit.jupiter.api.Test;

import java.util.function.IntPredicate;

import static org.junit.jupiter.api.Assertions.*;

public class NameManglerTest {
    private static final IntPredicate LOWER = c -> c >= 'a' && c <= 'z';

    @Test
    void legalNamesAreUnchanged() {
        for (IllegalSymbolPolicy policy : IllegalSymbolPolicy.values()) {
            String name = "foo";
            assertSame(name, NameMangler.legalChars(LOWER, policy).mangle(name));
        }
    }

    @Test
    void policies() {
        assertEquals("a_b", NameMangler.legalChars(LOWER, IllegalSymbolPolicy.SUBSTITUTE).mangle("a-b"));
        assertEquals("ab", NameMangler.legalChars(LOWER, IllegalSymbolPolicy.OMIT).mangle("a-b"));
        assertEquals("a__", NameMangler.legalChars(LOWER, IllegalSymbolPolicy.SUBSTITUTE).mangle("a\uD83D\uDE00."));
    }

    @Test
    void emptyNames() {
        assertEquals(NameMangler.EMPTY_TOKEN, NameMangler.legalChars(LOWER, IllegalSymbolPolicy.SUBSTITUTE).mangle(""));
        assertEquals(NameMangler.EMPTY_TOKEN, NameMangler.legalChars(LOWER, IllegalSymbolPolicy.OMIT).mangle("..."));
    }
}
