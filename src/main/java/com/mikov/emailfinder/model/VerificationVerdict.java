package com.mikov.emailfinder.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Result of one verification attempt for a candidate.
 *
 * @author zahari.mikov
 */
@Value
@Builder
public class VerificationVerdict {
    VerificationStatus status;
    double confidence;
    String reason;
    Instant checkedAt;

    public static VerificationVerdict of(final VerificationStatus status, final double confidence,
                                         final String reason, final Instant checkedAt) {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be within [0, 1]: " + confidence);
        }
        return VerificationVerdict.builder()
                .status(status)
                .confidence(confidence)
                .reason(reason)
                .checkedAt(checkedAt)
                .build();
    }

    public static VerificationVerdict unknown(final String reason, final Instant checkedAt) {
        return of(VerificationStatus.UNKNOWN, 0.0, reason, checkedAt);
    }

    public boolean isAccepted() {
        return status.isAccepted();
    }
}
