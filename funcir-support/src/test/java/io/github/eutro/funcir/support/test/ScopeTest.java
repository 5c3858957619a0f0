package io.github.eutro.funcir.support.test;

import io.github.eutro.funcir.support.NameMangler;
import io.github.eutro.funcir.support.Scope;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ScopeTest {
    @Test
    void collisionsAreSuffixed() {
        Scope<Integer> scope = Scope.forPredicate(Character::isLetterOrDigit);
        assertEquals("a", scope.uniqueName("a"));
        assertEquals("a_0", scope.uniqueName("a"));
        assertEquals("a_1", scope.uniqueName("a"));
        assertEquals("a_b", scope.uniqueName("a.b"));
        assertEquals("a_b_0", scope.uniqueName("a b"));
    }

    @Test
    void namesAreStablePerId() {
        Scope<String> scope = Scope.forPredicate(Character::isLetterOrDigit);
        String first = scope.apply("node1", "sum");
        String second = scope.apply("node2", "sum");
        assertEquals("sum", first);
        assertEquals("sum_0", second);
        assertEquals(first, scope.apply("node1", "ignored"));
        assertEquals(second, scope.apply("node2", "sum"));
    }

    @Test
    void reservedNamesAreAvoided() {
        Scope<Integer> scope = new Scope<>(NameMangler.legalChars(Character::isLetterOrDigit,
                NameMangler.IllegalSymbolPolicy.OMIT));
        scope.reserve("out");
        assertTrue(scope.isUsed("out"));
        assertFalse(scope.isUsed("in"));
        assertEquals("out_0", scope.uniqueName("out"));
        assertEquals("out_1", scope.uniqueName("o.u.t"));
        assertEquals("in", scope.uniqueName("in"));
    }
}
