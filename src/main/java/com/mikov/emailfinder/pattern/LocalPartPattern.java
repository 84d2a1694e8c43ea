package com.mikov.emailfinder.pattern;

import java.util.function.BiFunction;

/**
 * Address formats in the order they are tried. The first eight are the common business formats;
 * the rest are only reached when the candidate cap is raised or common formats are missing parts.
 */
public enum LocalPartPattern {
    FIRST_DOT_LAST(true, true, (f, l) -> f + "." + l),
    FIRST_LAST(true, true, (f, l) -> f + l),
    FIRST(true, false, (f, l) -> f),
    F_LAST(true, true, (f, l) -> initial(f) + l),
    FIRST_UNDERSCORE_LAST(true, true, (f, l) -> f + "_" + l),
    LAST_DOT_FIRST(true, true, (f, l) -> l + "." + f),
    LAST_FIRST(true, true, (f, l) -> l + f),
    F_DOT_LAST(true, true, (f, l) -> initial(f) + "." + l),
    LAST(false, true, (f, l) -> l),
    FIRST_L(true, true, (f, l) -> f + initial(l)),
    FIRST_HYPHEN_LAST(true, true, (f, l) -> f + "-" + l),
    F_UNDERSCORE_LAST(true, true, (f, l) -> initial(f) + "_" + l),
    LAST_F(true, true, (f, l) -> l + initial(f)),
    F_L(true, true, (f, l) -> initial(f) + initial(l));

    private final boolean needsFirst;
    private final boolean needsLast;
    private final BiFunction<String, String, String> format;

    LocalPartPattern(boolean needsFirst, boolean needsLast, BiFunction<String, String, String> format) {
        this.needsFirst = needsFirst;
        this.needsLast = needsLast;
        this.format = format;
    }

    public boolean isApplicable(String first, String last) {
        return (!needsFirst || !first.isEmpty()) && (!needsLast || !last.isEmpty());
    }

    public String apply(String first, String last) {
        return format.apply(first, last);
    }

    private static String initial(String name) {
        return new String(Character.toChars(name.codePointAt(0)));
    }
}
