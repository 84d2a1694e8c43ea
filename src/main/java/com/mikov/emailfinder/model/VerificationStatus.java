package com.mikov.emailfinder.model;

public enum VerificationStatus {
    VALID,
    CATCH_ALL,
    INVALID,
    UNKNOWN;

    /**
     * Whether a candidate with this status ends the search for its contact.
     */
    public boolean isAccepted() {
        return this == VALID || this == CATCH_ALL;
    }
}
