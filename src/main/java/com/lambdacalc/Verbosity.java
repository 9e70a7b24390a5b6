package com.lambdacalc;

/** How much of a reduction the command line prints. */
public enum Verbosity {
    /** The starting term and the final form. */
    QUIET,
    /** A summary block with every intermediate form, printed once at the end. */
    SUMMARY,
    /** Every intermediate form as it is produced, then the summary block. */
    VERBOSE;

    public static Verbosity parse(String s) {
        if (s == null) return QUIET;
        switch (s.trim().toLowerCase()) {
            case "quiet": return QUIET;
            case "summary": return SUMMARY;
            case "verbose": return VERBOSE;
            default:
                throw new IllegalArgumentException("Unknown verbosity: " + s + " (expected quiet, summary or verbose)");
        }
    }
}
