package com.mikov.emailfinder.pipeline;

import com.mikov.emailfinder.domain.DomainResolver;
import com.mikov.emailfinder.exception.CapabilityException;
import com.mikov.emailfinder.exception.ResolutionException;
import com.mikov.emailfinder.model.Candidate;
import com.mikov.emailfinder.model.Contact;
import com.mikov.emailfinder.model.ContactResult;
import com.mikov.emailfinder.model.DomainResult;
import com.mikov.emailfinder.model.RunSummary;
import com.mikov.emailfinder.model.VerificationAttempt;
import com.mikov.emailfinder.model.VerificationStatus;
import com.mikov.emailfinder.model.VerificationVerdict;
import com.mikov.emailfinder.pattern.PatternGenerator;
import com.mikov.emailfinder.smtp.verification.EmailVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Runs a batch of contacts through resolve, generate and verify.
 * <p>
 * Contacts are processed by a fixed pool of workers; submission blocks while every worker is busy, so
 * nothing queues without bound. Each contact stops at its first accepted candidate. Results are
 * returned in input order and every contact gets a row, including contacts that never started
 * because the run was cancelled or aborted.
 * <p>
 * An instance holds the caches of a single run and is not reused.
 *
 * @author zahari.mikov
 */
public class PipelineOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final DomainResolver resolver;
    private final PatternGenerator generator;
    private final EmailVerifier verifier;
    private final Clock clock;
    private final int fatalDnsFailures;
    private final int progressLogInterval;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicReference<CapabilityException> fatalFailure = new AtomicReference<>();

    public PipelineOrchestrator(final DomainResolver resolver,
                                final PatternGenerator generator,
                                final EmailVerifier verifier,
                                final Clock clock,
                                final int fatalDnsFailures,
                                final int progressLogInterval) {
        this.resolver = resolver;
        this.generator = generator;
        this.verifier = verifier;
        this.clock = clock;
        this.fatalDnsFailures = fatalDnsFailures;
        this.progressLogInterval = Math.max(1, progressLogInterval);
    }

    /**
     * @throws CapabilityException when DNS stayed unreachable for too many consecutive contacts
     */
    public List<ContactResult> run(final List<Contact> contacts, final int concurrencyLimit, final int perDomainRateLimit) {
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrencyLimit must be positive: " + concurrencyLimit);
        }
        logger.info("Starting run over {} contacts (concurrency {}, {} verifications/s per domain)",
                contacts.size(), concurrencyLimit, perDomainRateLimit);
        final long startTime = System.currentTimeMillis();

        final var rateLimiter = new DomainRateLimiter(perDomainRateLimit);
        final var failureTracker = new CapabilityFailureTracker(fatalDnsFailures);
        final var results = new AtomicReferenceArray<ContactResult>(contacts.size());
        final var completed = new AtomicInteger();
        final var permits = new Semaphore(concurrencyLimit);
        final ExecutorService executor = Executors.newFixedThreadPool(concurrencyLimit, workerThreadFactory());

        try {
            for (int i = 0; i < contacts.size(); i++) {
                permits.acquire();
                if (isStopped()) {
                    permits.release();
                    break;
                }
                final int index = i;
                final Contact contact = contacts.get(i);
                executor.execute(() -> {
                    try {
                        results.set(index, processContact(contact, rateLimiter, failureTracker));
                    } catch (RuntimeException e) {
                        logger.warn("Contact at row {} failed: {}", contact.rowIndex(), e.getMessage(), e);
                        results.set(index, noAttempts(contact, null, "processing_error"));
                    } finally {
                        permits.release();
                        logProgress(completed.incrementAndGet(), contacts.size());
                    }
                });
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Run interrupted, waiting for in-flight contacts");
            cancel();
        } finally {
            executor.shutdown();
            awaitTermination(executor);
        }

        final List<ContactResult> ordered = new ArrayList<>(contacts.size());
        for (int i = 0; i < contacts.size(); i++) {
            final ContactResult result = results.get(i);
            ordered.add(result != null ? result : noAttempts(contacts.get(i), null, "not_processed"));
        }

        final CapabilityException fatal = fatalFailure.get();
        if (fatal != null) {
            logger.error("Run aborted: {}", fatal.getMessage());
            throw fatal;
        }

        final RunSummary summary = RunSummary.of(ordered);
        logger.info("Run finished in {}ms: total={}, found={} (verified={}, catch-all={}), no domain={}, no match={}, success rate={}%",
                System.currentTimeMillis() - startTime, summary.total(), summary.found(), summary.verified(),
                summary.catchAll(), summary.noDomain(), summary.noMatch(),
                String.format("%.1f", summary.successRate() * 100));
        return ordered;
    }

    /**
     * Stops new contacts and new verifications from starting. Calls already on the wire finish or time out.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            logger.info("Cancellation requested, finishing in-flight work");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    private boolean isStopped() {
        return cancelled.get() || fatalFailure.get() != null;
    }

    ContactResult processContact(final Contact contact,
                                 final DomainRateLimiter rateLimiter,
                                 final CapabilityFailureTracker failureTracker) {
        if (isStopped()) {
            return noAttempts(contact, null, "not_processed");
        }

        final DomainResult domain;
        try {
            domain = resolver.resolve(contact.company());
            failureTracker.recordSuccess();
        } catch (ResolutionException e) {
            if (e.getKind() == ResolutionException.Kind.LOOKUP_UNAVAILABLE) {
                if (failureTracker.recordFailure()) {
                    fatalFailure.compareAndSet(null, new CapabilityException(CapabilityException.Capability.DNS,
                            "DNS unreachable for " + failureTracker.consecutiveFailures()
                                    + " consecutive contacts, last error: " + e.getMessage(), e));
                }
            } else {
                failureTracker.recordSuccess();
            }
            logger.debug("No domain for row {} ({}): {}", contact.rowIndex(), contact.company(), e.getMessage());
            return noAttempts(contact, null, e.getKind() == ResolutionException.Kind.LOOKUP_UNAVAILABLE
                    ? "lookup_unavailable" : "no_domain");
        }

        final List<Candidate> candidates = generator.generate(contact.firstName(), contact.lastName(), domain.getDomain());
        if (candidates.isEmpty()) {
            return noAttempts(contact, domain.getDomain(), "no_candidates");
        }

        final List<VerificationAttempt> attempts = new ArrayList<>();
        for (final Candidate candidate : candidates) {
            if (isStopped() || !rateLimiter.acquire(candidate.domain(), this::isStopped)) {
                // candidates remain untried
                return ContactResult.builder()
                        .contact(contact)
                        .domain(domain.getDomain())
                        .verdict(VerificationVerdict.unknown("not_processed", clock.instant()))
                        .attempts(attempts)
                        .build();
            }
            final VerificationVerdict verdict = verifier.verify(candidate);
            attempts.add(new VerificationAttempt(candidate, verdict));
            if (verdict.isAccepted()) {
                logger.debug("Row {}: {} accepted as {}", contact.rowIndex(), candidate.email(), verdict.getStatus());
                return ContactResult.builder()
                        .contact(contact)
                        .domain(domain.getDomain())
                        .chosenEmail(candidate.email())
                        .verdict(verdict)
                        .attempts(attempts)
                        .build();
            }
        }

        return ContactResult.builder()
                .contact(contact)
                .domain(domain.getDomain())
                .verdict(finalVerdict(attempts))
                .attempts(attempts)
                .build();
    }

    /**
     * Verdict for a contact without an accepted candidate: INVALID when every attempt was refuted,
     * otherwise UNKNOWN.
     */
    private VerificationVerdict finalVerdict(final List<VerificationAttempt> attempts) {
        double confidence = 1.0;
        for (final VerificationAttempt attempt : attempts) {
            if (attempt.verdict().getStatus() != VerificationStatus.INVALID) {
                return VerificationVerdict.unknown("no_match", clock.instant());
            }
            confidence = Math.min(confidence, attempt.verdict().getConfidence());
        }
        return VerificationVerdict.of(VerificationStatus.INVALID, confidence, "all_rejected", clock.instant());
    }

    private ContactResult noAttempts(final Contact contact, final String domain, final String reason) {
        return ContactResult.builder()
                .contact(contact)
                .domain(domain)
                .verdict(VerificationVerdict.unknown(reason, clock.instant()))
                .build();
    }

    private void logProgress(final int done, final int total) {
        if (done % progressLogInterval == 0 || done == total) {
            logger.info("Processed {}/{} contacts", done, total);
        }
    }

    private static void awaitTermination(final ExecutorService executor) {
        try {
            while (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.info("Waiting for in-flight contacts to finish");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for workers; unfinished contacts are reported as unknown");
        }
    }

    private static ThreadFactory workerThreadFactory() {
        final var counter = new AtomicInteger();
        return runnable -> {
            final var thread = new Thread(runnable, "emailfinder-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
