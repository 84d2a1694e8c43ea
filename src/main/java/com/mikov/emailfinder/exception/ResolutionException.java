package com.mikov.emailfinder.exception;

import lombok.Getter;

/**
 * Thrown when a company name cannot be turned into an accepted mail domain.
 */
@Getter
public class ResolutionException extends Exception {

    public enum Kind {
        /** Every source was consulted and no domain passed the MX/address check. */
        NO_VALID_DOMAIN,
        /** A lookup could not be completed, so the absence of a domain is not established. */
        LOOKUP_UNAVAILABLE
    }

    private final Kind kind;
    private final String company;

    public ResolutionException(final Kind kind, final String company, final String message) {
        super(message);
        this.kind = kind;
        this.company = company;
    }

    public ResolutionException(final Kind kind, final String company, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.company = company;
    }
}
