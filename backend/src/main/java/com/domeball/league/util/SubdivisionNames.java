package com.domeball.league.util;

import java.util.Collection;
import java.util.List;

/**
 * Naming of subdivisions inside a division: {@code main} first, then the Greek alphabet,
 * then the alphabet again with a numeric suffix ({@code alpha_2}, {@code beta_2}, ...).
 */
public final class SubdivisionNames {

    public static final String MAIN = "main";

    private static final List<String> GREEK = List.of(
            "alpha", "beta", "gamma", "delta", "epsilon", "zeta", "eta", "theta",
            "iota", "kappa", "lambda", "mu", "nu", "xi", "omicron", "pi",
            "rho", "sigma", "tau", "upsilon", "phi", "chi", "psi", "omega");

    private SubdivisionNames() {}

    /** Name at a position of the naming sequence; 0 is {@code main}. */
    public static String nameAt(int index) {
        if (index < 0) throw new IllegalArgumentException("index must be >= 0");
        if (index == 0) return MAIN;
        int i = index - 1;
        String base = GREEK.get(i % GREEK.size());
        int cycle = i / GREEK.size();
        return cycle == 0 ? base : base + "_" + (cycle + 1);
    }

    /** First name of the sequence not present in {@code used}. */
    public static String nextUnused(Collection<String> used) {
        int i = 0;
        while (used.contains(nameAt(i))) {
            i++;
        }
        return nameAt(i);
    }
}
