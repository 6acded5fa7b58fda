package com.csd.formulary.formula;

import java.util.HashSet;
import java.util.Set;

/**
 * Immutable set of names bound by enclosing LET/LAMBDA forms. {@link #with(String)} returns a new
 * scope, so a scope handed to one argument can never see bindings made while walking a sibling.
 */
public final class Scope {

    private static final Scope EMPTY = new Scope(Set.of());

    private final Set<String> names;

    private Scope(Set<String> names) {
        this.names = names;
    }

    public static Scope empty() {
        return EMPTY;
    }

    public Scope with(String name) {
        if (name == null || names.contains(name)) return this;
        Set<String> extended = new HashSet<>(names);
        extended.add(name);
        return new Scope(Set.copyOf(extended));
    }

    public boolean contains(String name) {
        return names.contains(name);
    }

    public Set<String> names() {
        return names;
    }

    @Override
    public String toString() {
        return "Scope" + names;
    }
}
