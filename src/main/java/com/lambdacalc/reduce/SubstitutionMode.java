package com.lambdacalc.reduce;

/** How substitution treats a binder that would capture a free variable of the replacement. */
public enum SubstitutionMode {
    /** Never renames. A free variable of the replacement can be captured by an inner binder. */
    CAPTURING,
    /** Renames the inner binder to a fresh name first, so nothing is captured. */
    HYGIENIC
}
