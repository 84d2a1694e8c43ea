package com.mikov.emailfinder.domain;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reduces a company name to the key used for table lookups and caching.
 */
public final class CompanyNameNormalizer {
    private static final Pattern AFTER_COMMA = Pattern.compile(",.*$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LEGAL_SUFFIX = Pattern.compile(
            "\\s+(inc|llc|ltd|corp|corporation|company|co|group|holdings?|technologies|technology"
                    + "|solutions|services|international|worldwide|global)\\.?$");

    private CompanyNameNormalizer() {
    }

    public static String normalize(final String company) {
        if (company == null) {
            return "";
        }
        var normalized = company.toLowerCase(Locale.ROOT).trim();
        normalized = AFTER_COMMA.matcher(normalized).replaceAll("");
        normalized = WHITESPACE.matcher(normalized).replaceAll(" ").trim();

        String previous;
        do {
            previous = normalized;
            normalized = LEGAL_SUFFIX.matcher(normalized).replaceAll("").trim();
        } while (!normalized.equals(previous));

        return normalized;
    }

    /**
     * The normalized name with everything except ASCII letters and digits removed, e.g. for {@code <name>.com} guesses.
     */
    public static String compact(final String normalizedName) {
        return normalizedName.replaceAll("[^a-z0-9]", "");
    }
}
