package com.mikov.emailfinder.pattern;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Prepares name parts for use in local-parts.
 */
public final class NameNormalizer {
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ASCII_ALLOWED = Pattern.compile("[^a-z0-9.\\-]");
    private static final Pattern REPEATED_DOTS = Pattern.compile("\\.{2,}");
    private static final Pattern EDGE_SEPARATORS = Pattern.compile("^[.\\-]+|[.\\-]+$");

    // Letters that do not decompose into a base letter plus combining marks.
    private static final Map<Character, String> SPECIAL_LETTERS = Map.of(
            'ß', "ss",
            'æ', "ae",
            'ø', "o",
            'ł', "l",
            'đ', "d",
            'þ', "th",
            'œ', "oe",
            'ð', "d",
            'ı', "i");

    private NameNormalizer() {
    }

    /**
     * Case-folds and drops everything except letters, digits, {@code .} and {@code -}. Diacritics are kept.
     */
    public static String normalize(final String name) {
        if (name == null) {
            return "";
        }
        final String folded = Normalizer.normalize(name.strip(), Normalizer.Form.NFC).toLowerCase(Locale.ROOT);
        final var sb = new StringBuilder(folded.length());
        folded.codePoints()
                .filter(cp -> Character.isLetterOrDigit(cp) || cp == '.' || cp == '-')
                .forEach(sb::appendCodePoint);
        return tidy(sb.toString());
    }

    /**
     * ASCII form of an already normalized name part. Characters without an ASCII equivalent are dropped.
     */
    public static String transliterate(final String normalized) {
        final var sb = new StringBuilder(normalized.length());
        for (final char c : normalized.toCharArray()) {
            final String replacement = SPECIAL_LETTERS.get(c);
            if (replacement != null) {
                sb.append(replacement);
            } else {
                sb.append(c);
            }
        }
        final String decomposed = Normalizer.normalize(sb, Normalizer.Form.NFD);
        final String stripped = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        return tidy(NON_ASCII_ALLOWED.matcher(stripped).replaceAll(""));
    }

    private static String tidy(final String value) {
        final String collapsed = REPEATED_DOTS.matcher(value).replaceAll(".");
        return EDGE_SEPARATORS.matcher(collapsed).replaceAll("");
    }
}
