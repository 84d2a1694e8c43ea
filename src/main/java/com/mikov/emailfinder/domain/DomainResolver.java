package com.mikov.emailfinder.domain;

import com.mikov.emailfinder.cache.DomainCache;
import com.mikov.emailfinder.exception.CapabilityException;
import com.mikov.emailfinder.exception.ResolutionException;
import com.mikov.emailfinder.model.DomainResult;
import com.mikov.emailfinder.model.DomainSource;
import com.mikov.emailfinder.search.CompanySearchClient;
import com.mikov.emailfinder.smtp.dns.DnsClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Maps a company name to its mail domain.
 * Sources are consulted in order: the known company table, the external search, and, when enabled,
 * a {@code <name>.com} guess. A domain is accepted only if it has MX records or, failing that, an
 * address record.
 *
 * @author zahari.mikov
 */
public class DomainResolver {
    private static final Logger logger = LoggerFactory.getLogger(DomainResolver.class);

    private final KnownDomains knownDomains;
    private final CompanySearchClient searchClient;
    private final DnsClient dnsClient;
    private final DomainCache cache;
    private final boolean guessFromName;

    public DomainResolver(final KnownDomains knownDomains,
                          final CompanySearchClient searchClient,
                          final DnsClient dnsClient,
                          final DomainCache cache,
                          final boolean guessFromName) {
        this.knownDomains = knownDomains;
        this.searchClient = searchClient;
        this.dnsClient = dnsClient;
        this.cache = cache;
        this.guessFromName = guessFromName;
    }

    public DomainResult resolve(final String companyName) throws ResolutionException {
        final String normalized = CompanyNameNormalizer.normalize(companyName);
        if (normalized.isEmpty()) {
            throw new ResolutionException(ResolutionException.Kind.NO_VALID_DOMAIN, companyName, "Company name is empty");
        }

        final DomainResult result = cache.getOrCompute(normalized, key -> lookup(companyName, key));
        if (!result.isResolved()) {
            throw new ResolutionException(ResolutionException.Kind.NO_VALID_DOMAIN, companyName,
                    "No valid mail domain for '" + companyName + "'");
        }
        return result;
    }

    private DomainResult lookup(final String companyName, final String normalized) throws ResolutionException {
        final var attempt = new Attempt(companyName);

        final Optional<String> known = knownDomains.lookup(normalized);
        if (known.isPresent()) {
            final Optional<DomainResult> accepted = attempt.accept(known.get(), DomainSource.KNOWN_DB);
            if (accepted.isPresent()) {
                return accepted.get();
            }
        }

        // the cached value must depend on the key alone, whichever spelling computes it
        final Optional<String> searched = search(normalized);
        if (searched.isPresent()) {
            final Optional<DomainResult> accepted = attempt.accept(searched.get(), DomainSource.SEARCH_FALLBACK);
            if (accepted.isPresent()) {
                return accepted.get();
            }
        }

        final String compact = CompanyNameNormalizer.compact(normalized);
        if (guessFromName && !compact.isEmpty()) {
            final Optional<DomainResult> accepted = attempt.accept(compact + ".com", DomainSource.NAME_GUESS);
            if (accepted.isPresent()) {
                return accepted.get();
            }
        }

        if (attempt.unavailable != null) {
            throw new ResolutionException(ResolutionException.Kind.LOOKUP_UNAVAILABLE, companyName,
                    "Domain lookup for '" + companyName + "' unavailable: " + attempt.unavailable.getMessage(),
                    attempt.unavailable);
        }
        logger.info("No valid mail domain found for company '{}'", companyName);
        return DomainResult.unresolved();
    }

    private Optional<String> search(final String normalized) {
        try {
            return searchClient.searchDomain(normalized).map(DomainResolver::cleanDomain);
        } catch (CapabilityException e) {
            logger.warn("Company search unavailable for '{}': {}", normalized, e.getMessage());
            return Optional.empty();
        }
    }

    static String cleanDomain(final String domain) {
        var cleaned = domain.trim().toLowerCase(Locale.ROOT);
        if (cleaned.endsWith(".")) {
            cleaned = cleaned.substring(0, cleaned.length() - 1);
        }
        if (cleaned.startsWith("www.")) {
            cleaned = cleaned.substring(4);
        }
        return cleaned;
    }

    /**
     * State of one resolution: domains already rejected and the first DNS failure seen.
     */
    private final class Attempt {
        private final String companyName;
        private final Set<String> rejected = new HashSet<>();
        private CapabilityException unavailable;

        private Attempt(final String companyName) {
            this.companyName = companyName;
        }

        private Optional<DomainResult> accept(final String domain, final DomainSource source) {
            if (domain.isEmpty() || !rejected.add(domain)) {
                return Optional.empty();
            }
            try {
                if (!dnsClient.lookupMx(domain).isEmpty()) {
                    logger.debug("Resolved '{}' to {} via {} (MX)", companyName, domain, source);
                    return Optional.of(DomainResult.of(domain, source, true));
                }
                if (dnsClient.hasNullMx(domain)) {
                    logger.debug("Rejected {} for '{}': null MX, domain accepts no mail", domain, companyName);
                    return Optional.empty();
                }
                if (dnsClient.hasAddress(domain)) {
                    logger.debug("Resolved '{}' to {} via {} (address record only)", companyName, domain, source);
                    return Optional.of(DomainResult.of(domain, source, false));
                }
                logger.debug("Rejected {} for '{}': no MX or address records", domain, companyName);
            } catch (CapabilityException e) {
                logger.warn("DNS check of {} for '{}' failed: {}", domain, companyName, e.getMessage());
                if (unavailable == null) {
                    unavailable = e;
                }
            }
            return Optional.empty();
        }
    }
}
