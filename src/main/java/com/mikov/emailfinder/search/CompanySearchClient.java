package com.mikov.emailfinder.search;

import java.util.Optional;

/**
 * External lookup of a company's web domain.
 */
public interface CompanySearchClient {

    /**
     * @return the most likely domain, without scheme or {@code www.}, or empty when nothing plausible was found
     * @throws com.mikov.emailfinder.exception.CapabilityException when the search service cannot be reached
     */
    Optional<String> searchDomain(String company);
}
