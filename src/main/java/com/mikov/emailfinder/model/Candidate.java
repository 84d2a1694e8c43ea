package com.mikov.emailfinder.model;

/**
 * A generated address to try. Lower rank is tried first.
 */
public record Candidate(String localPart, String domain, int patternRank) {

    public String email() {
        return localPart + "@" + domain;
    }
}
