package com.lambdacalc.library;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import com.lambdacalc.term.Term.TermInterface;

/**
 * Registry of named terms.
 *
 * Terms are built on demand by their supplier, so there are no process-wide
 * term constants and no initialization order between them. Names are
 * case-sensitive and kept in registration order.
 */
public class TermLibrary {
    private final Map<String, Supplier<TermInterface>> terms = new LinkedHashMap<>();

    /** A library with the whole standard catalogue registered. */
    public static TermLibrary standard() {
        TermLibrary lib = new TermLibrary();
        Combinators.register(lib);
        Booleans.register(lib);
        Naturals.register(lib);
        Pairs.register(lib);
        Lists.register(lib);
        Integers.register(lib);
        Algorithms.register(lib);
        return lib;
    }

    public void register(String name, Supplier<TermInterface> supplier) {
        if (name == null || name.trim().isEmpty()) throw new IllegalArgumentException("term name required");
        if (supplier == null) throw new IllegalArgumentException("term supplier must not be null");
        terms.put(name.trim(), supplier);
    }

    public boolean has(String name) {
        if (name == null) return false;
        return terms.containsKey(name.trim());
    }

    public TermInterface get(String name) {
        if (name == null || name.trim().isEmpty()) throw new IllegalArgumentException("term name required");
        Supplier<TermInterface> s = terms.get(name.trim());
        if (s == null) throw new IllegalArgumentException("Unknown term: " + name);
        return s.get();
    }

    /** A registered name, or a non-negative decimal integer read as a Church numeral. */
    public TermInterface resolve(String token) {
        if (token != null && !token.isEmpty() && token.chars().allMatch(Character::isDigit)) {
            try {
                return Naturals.nat(Integer.parseInt(token));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Numeral too large: " + token, e);
            }
        }
        return get(token);
    }

    public List<String> names() {
        return Collections.unmodifiableList(new ArrayList<>(terms.keySet()));
    }
}
