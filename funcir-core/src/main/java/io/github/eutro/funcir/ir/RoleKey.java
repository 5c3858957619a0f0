package io.github.eutro.funcir.ir;

import java.util.Objects;

/**
 * Identifies the node that is a declared output, or the next value of a declared state variable.
 */
public final class RoleKey {
    public final String name;
    public final boolean nextState;

    private RoleKey(String name, boolean nextState) {
        this.name = Objects.requireNonNull(name);
        this.nextState = nextState;
    }

    public static RoleKey output(String name) {
        return new RoleKey(name, false);
    }

    public static RoleKey nextState(String name) {
        return new RoleKey(name, true);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RoleKey)) return false;
        RoleKey roleKey = (RoleKey) o;
        return nextState == roleKey.nextState && name.equals(roleKey.name);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + (nextState ? 1 : 0);
    }

    @Override
    public String toString() {
        return (nextState ? "next " : "output ") + name;
    }
}
