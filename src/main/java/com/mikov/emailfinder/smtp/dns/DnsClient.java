package com.mikov.emailfinder.smtp.dns;

import java.util.List;

/**
 * DNS lookups the resolver and verifier depend on.
 * Implementations throw {@link com.mikov.emailfinder.exception.CapabilityException} when the
 * lookup could not be answered; an empty answer is not an error.
 */
public interface DnsClient {

    /**
     * Returns the MX records of the domain sorted by ascending priority, or an empty list if it has none.
     */
    List<MxRecord> lookupMx(String domain);

    /**
     * Returns whether the domain has an A or AAAA record.
     */
    boolean hasAddress(String domain);

    /**
     * Returns whether the domain publishes a null MX ({@code 0 .}), declaring that it accepts no mail.
     */
    boolean hasNullMx(String domain);
}
