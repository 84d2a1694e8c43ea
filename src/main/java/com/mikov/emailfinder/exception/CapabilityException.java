package com.mikov.emailfinder.exception;

import lombok.Getter;

/**
 * Raised when an external capability (DNS, SMTP transport, company search) cannot be reached at all.
 */
@Getter
public class CapabilityException extends RuntimeException {

    public enum Capability {
        DNS,
        SMTP,
        SEARCH
    }

    private final Capability capability;

    public CapabilityException(final Capability capability, final String message) {
        super(message);
        this.capability = capability;
    }

    public CapabilityException(final Capability capability, final String message, final Throwable cause) {
        super(message, cause);
        this.capability = capability;
    }
}
