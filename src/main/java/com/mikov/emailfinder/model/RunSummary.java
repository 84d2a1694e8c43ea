package com.mikov.emailfinder.model;

import java.util.List;

/**
 * Counters reported at the end of a run.
 */
public record RunSummary(int total, int found, int verified, int catchAll, int noDomain, int noMatch) {

    public static RunSummary of(final List<ContactResult> results) {
        int found = 0;
        int verified = 0;
        int catchAll = 0;
        int noDomain = 0;
        int noMatch = 0;
        for (final var result : results) {
            if (result.getDomain() == null) {
                noDomain++;
            } else if (!result.hasEmail()) {
                noMatch++;
            }
            if (result.hasEmail()) {
                found++;
                if (result.getVerdict().getStatus() == VerificationStatus.VALID) {
                    verified++;
                } else if (result.getVerdict().getStatus() == VerificationStatus.CATCH_ALL) {
                    catchAll++;
                }
            }
        }
        return new RunSummary(results.size(), found, verified, catchAll, noDomain, noMatch);
    }

    public double successRate() {
        return total == 0 ? 0.0 : (double) found / total;
    }
}
