package com.mikov.emailfinder.services;

import com.mikov.emailfinder.cache.DomainCache;
import com.mikov.emailfinder.config.EmailFinderProperties;
import com.mikov.emailfinder.domain.DomainResolver;
import com.mikov.emailfinder.domain.KnownDomains;
import com.mikov.emailfinder.model.Contact;
import com.mikov.emailfinder.model.ContactResult;
import com.mikov.emailfinder.pattern.PatternGenerator;
import com.mikov.emailfinder.pipeline.PipelineOrchestrator;
import com.mikov.emailfinder.search.CompanySearchClient;
import com.mikov.emailfinder.smtp.SmtpTransport;
import com.mikov.emailfinder.smtp.dns.DnsClient;
import com.mikov.emailfinder.smtp.verification.CatchAllDetector;
import com.mikov.emailfinder.smtp.verification.EmailVerifier;
import com.mikov.emailfinder.smtp.verification.ProbeRetrier;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Finds emails for batches of contacts. Every call gets its own domain and catch-all caches,
 * so nothing learned in one run leaks into the next.
 *
 * @author zahari.mikov
 */
@Service
public class EmailFinderService {
    private static final Logger logger = LoggerFactory.getLogger(EmailFinderService.class);

    private final EmailFinderProperties properties;
    private final DnsClient dnsClient;
    private final SmtpTransport smtpTransport;
    private final CompanySearchClient searchClient;
    private final KnownDomains knownDomains;
    private final PatternGenerator patternGenerator;
    private final Clock clock;
    private final Set<PipelineOrchestrator> activeRuns = ConcurrentHashMap.newKeySet();

    @Autowired
    public EmailFinderService(final EmailFinderProperties properties,
                              final DnsClient dnsClient,
                              final SmtpTransport smtpTransport,
                              final CompanySearchClient searchClient,
                              final KnownDomains knownDomains,
                              final PatternGenerator patternGenerator,
                              final Clock clock) {
        this.properties = properties;
        this.dnsClient = dnsClient;
        this.smtpTransport = smtpTransport;
        this.searchClient = searchClient;
        this.knownDomains = knownDomains;
        this.patternGenerator = patternGenerator;
        this.clock = clock;
    }

    public List<ContactResult> findEmails(final List<Contact> contacts) {
        final var pipeline = properties.getPipeline();
        return findEmails(contacts, pipeline.getConcurrency(), pipeline.getPerDomainRateLimit());
    }

    public List<ContactResult> findEmails(final List<Contact> contacts, final int concurrency, final int perDomainRateLimit) {
        final PipelineOrchestrator orchestrator = newOrchestrator();
        activeRuns.add(orchestrator);
        try {
            return orchestrator.run(contacts, concurrency, perDomainRateLimit);
        } finally {
            activeRuns.remove(orchestrator);
        }
    }

    PipelineOrchestrator newOrchestrator() {
        final var smtp = properties.getSmtp();
        final var prober = new ProbeRetrier(smtpTransport, properties.getRetry());
        final var catchAllDetector = new CatchAllDetector(prober,
                CatchAllDetector.randomLocalPart(smtp.getCatchAllProbePrefix(), smtp.getCatchAllProbeLength()));
        final var verifier = new EmailVerifier(dnsClient, prober, catchAllDetector, properties, clock);
        final var resolver = new DomainResolver(knownDomains, searchClient, dnsClient, new DomainCache(),
                properties.getResolver().isGuessFromName());
        return new PipelineOrchestrator(resolver, patternGenerator, verifier, clock,
                properties.getPipeline().getFatalDnsFailures(), properties.getPipeline().getProgressLogInterval());
    }

    @PreDestroy
    public void shutdown() {
        if (!activeRuns.isEmpty()) {
            logger.info("Shutting down, cancelling {} active run(s)", activeRuns.size());
            activeRuns.forEach(PipelineOrchestrator::cancel);
        }
    }
}
