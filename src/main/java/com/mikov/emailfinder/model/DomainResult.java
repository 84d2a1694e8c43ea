package com.mikov.emailfinder.model;

import lombok.Value;

import java.util.Optional;

/**
 * Outcome of resolving one normalized company name. Shared read-only by every contact of that company.
 * A result without a domain records that no valid domain exists.
 */
@Value
public class DomainResult {
    private static final DomainResult UNRESOLVED = new DomainResult(null, null, false);

    String domain;
    DomainSource source;
    boolean mxConfirmed;

    public static DomainResult of(final String domain, final DomainSource source, final boolean mxConfirmed) {
        return new DomainResult(domain, source, mxConfirmed);
    }

    public static DomainResult unresolved() {
        return UNRESOLVED;
    }

    public boolean isResolved() {
        return domain != null;
    }

    public Optional<String> domain() {
        return Optional.ofNullable(domain);
    }
}
