package com.mikov.emailfinder.smtp.verification;

public enum CatchAllStatus {
    CATCH_ALL,
    NOT_CATCH_ALL,
    /** The probe got no usable answer, so acceptances at this domain cannot be trusted either. */
    INDETERMINATE
}
