package io.github.eutro.funcir.support;

import java.util.function.IntPredicate;

/**
 * Converts (possibly invalid) names to names that are valid in some target syntax.
 */
public interface NameMangler {
    /**
     * The name used when the input is empty, or nothing of it is left.
     */
    String EMPTY_TOKEN = "_EMPTY_";

    /**
     * A name mangler which only keeps characters matching a predicate.
     *
     * @param legal  Which characters are legal.
     * @param policy The policy for handling illegal characters.
     * @return The name mangler.
     */
    static NameMangler legalChars(IntPredicate legal, IllegalSymbolPolicy policy) {
        return new LegalChars(legal, policy);
    }

    /**
     * Mangle a name, so it becomes valid according to the rules of this mangler.
     *
     * @param name The name to mangle.
     * @return The mangled name, which is {@code name} itself if it was already valid.
     */
    String mangle(String name);

    /**
     * A policy for how illegal characters should be handled.
     */
    enum IllegalSymbolPolicy {
        /**
         * Illegal characters are replaced with {@code _}.
         */
        SUBSTITUTE,
        /**
         * Illegal characters are left out.
         */
        OMIT,
        ;

        void convert(StringBuilder into) {
            if (this == SUBSTITUTE) into.append('_');
        }
    }

    /**
     * A name mangler that allows the characters matching a predicate.
     */
    class LegalChars implements NameMangler {
        private final IntPredicate legal;
        private final IllegalSymbolPolicy policy;

        public LegalChars(IntPredicate legal, IllegalSymbolPolicy policy) {
            this.legal = legal;
            this.policy = policy;
        }

        @Override
        public String mangle(String str) {
            if (str.isEmpty()) return EMPTY_TOKEN;
            if (str.codePoints().allMatch(legal)) return str;
            StringBuilder sb = new StringBuilder(str.length());
            for (int i = 0; i < str.length(); i = str.offsetByCodePoints(i, 1)) {
                int c = str.codePointAt(i);
                if (legal.test(c)) {
                    sb.appendCodePoint(c);
                } else {
                    policy.convert(sb);
                }
            }
            return sb.length() == 0 ? EMPTY_TOKEN : sb.toString();
        }
    }
}
