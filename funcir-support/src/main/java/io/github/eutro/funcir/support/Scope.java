package io.github.eutro.funcir.support;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.IntPredicate;

/**
 * Hands out unique, legal names within one namespace of generated code.
 * <p>
 * Suggestions are first {@link NameMangler#mangle(String) mangled}, then suffixed with
 * {@code _0}, {@code _1}, and so on, until they are unused.
 *
 * @param <Id> The type of the things being named.
 */
public class Scope<Id> {
    private final NameMangler mangler;
    private final Set<String> used = new HashSet<>();
    private final Map<Id, String> byId = new HashMap<>();

    public Scope(NameMangler mangler) {
        this.mangler = mangler;
    }

    /**
     * Create a scope in which names may only contain certain characters; others are replaced with {@code _}.
     *
     * @param legal  Which characters are legal.
     * @param <Id>   The type of the things being named.
     * @return The scope.
     */
    public static <Id> Scope<Id> forPredicate(IntPredicate legal) {
        return new Scope<>(NameMangler.legalChars(legal, NameMangler.IllegalSymbolPolicy.SUBSTITUTE));
    }

    /**
     * Make a name unavailable, such as a keyword of the target language.
     *
     * @param name The name.
     */
    public void reserve(String name) {
        used.add(name);
    }

    /**
     * Whether a name has been handed out or reserved.
     *
     * @param name The name.
     * @return Whether it is taken.
     */
    public boolean isUsed(String name) {
        return used.contains(name);
    }

    /**
     * Get a fresh name based on a suggestion.
     *
     * @param suggestion The suggested name, which need not be legal.
     * @return A legal name that has not been handed out before.
     */
    public String uniqueName(String suggestion) {
        String base = mangler.mangle(suggestion);
        if (used.add(base)) return base;
        for (int i = 0; ; i++) {
            String suffixed = base + "_" + i;
            if (used.add(suffixed)) return suffixed;
        }
    }

    /**
     * Get the name of something, giving it a fresh name based on the suggestion the first time.
     *
     * @param id         The thing to name.
     * @param suggestion The name to suggest if it has none yet.
     * @return Its name.
     */
    public String apply(Id id, String suggestion) {
        String name = byId.get(id);
        if (name == null) {
            name = uniqueName(suggestion);
            byId.put(id, name);
        }
        return name;
    }
}
