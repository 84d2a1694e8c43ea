package com.mikov.emailfinder.pattern;

import com.mikov.emailfinder.model.Candidate;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Generates ranked candidate addresses for a person at a domain. Pure and deterministic.
 * <p>
 * For each pattern the name as written comes first, followed by its ASCII transliteration when
 * that differs. Duplicate local-parts keep their earliest position, and the position in the returned
 * list is the candidate's rank.
 *
 * @author zahari.mikov
 */
public class PatternGenerator {
    static final int MAX_LOCAL_PART_LENGTH = 64;

    private final int maxCandidates;

    public PatternGenerator(final int maxCandidates) {
        if (maxCandidates < 1) {
            throw new IllegalArgumentException("maxCandidates must be positive: " + maxCandidates);
        }
        this.maxCandidates = maxCandidates;
    }

    public List<Candidate> generate(final String firstName, final String lastName, final String domain) {
        if (domain == null || domain.isBlank()) {
            return List.of();
        }
        final String mailDomain = domain.strip().toLowerCase(Locale.ROOT);

        final String first = NameNormalizer.normalize(firstName);
        final String last = NameNormalizer.normalize(lastName);
        final List<String[]> variants = new ArrayList<>();
        variants.add(new String[] {first, last});
        final String asciiFirst = NameNormalizer.transliterate(first);
        final String asciiLast = NameNormalizer.transliterate(last);
        if (!asciiFirst.equals(first) || !asciiLast.equals(last)) {
            variants.add(new String[] {asciiFirst, asciiLast});
        }

        final List<Candidate> candidates = new ArrayList<>();
        final Set<String> seen = new HashSet<>();
        for (final LocalPartPattern pattern : LocalPartPattern.values()) {
            for (final String[] variant : variants) {
                if (!pattern.isApplicable(variant[0], variant[1])) {
                    continue;
                }
                final String localPart = pattern.apply(variant[0], variant[1]);
                if (localPart.isEmpty() || localPart.length() > MAX_LOCAL_PART_LENGTH || !seen.add(localPart)) {
                    continue;
                }
                candidates.add(new Candidate(localPart, mailDomain, candidates.size()));
                if (candidates.size() == maxCandidates) {
                    return List.copyOf(candidates);
                }
            }
        }
        return List.copyOf(candidates);
    }

    public int getMaxCandidates() {
        return maxCandidates;
    }
}
