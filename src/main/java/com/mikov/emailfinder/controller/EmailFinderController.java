package com.mikov.emailfinder.controller;

import com.mikov.emailfinder.config.EmailFinderProperties;
import com.mikov.emailfinder.model.api.ContactResultResponse;
import com.mikov.emailfinder.model.api.FindEmailsRequest;
import com.mikov.emailfinder.services.EmailFinderService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.DeferredResult;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * REST controller for email discovery
 *
 * @author zahari.mikov
 */
@RestController
@RequestMapping("/emailfinder")
public class EmailFinderController {

    private static final Logger logger = LoggerFactory.getLogger(EmailFinderController.class);
    private static final long RESPONSE_TIMEOUT_MS = TimeUnit.MINUTES.toMillis(30);

    static final int MAX_CONCURRENT_RUNS = 2;
    static final int MAX_CONTACTS_PER_REQUEST = 1000;

    private final Semaphore runThrottler = new Semaphore(MAX_CONCURRENT_RUNS, true);
    private final EmailFinderService emailFinderService;
    private final EmailFinderProperties properties;

    @Autowired
    public EmailFinderController(final EmailFinderService emailFinderService, final EmailFinderProperties properties) {
        this.emailFinderService = emailFinderService;
        this.properties = properties;
    }

    @PostMapping(value = "/find", consumes = MediaType.APPLICATION_JSON_VALUE)
    public DeferredResult<ResponseEntity<List<ContactResultResponse>>> findEmails(@RequestBody final FindEmailsRequest request) {
        if (request == null || request.contacts() == null || request.contacts().isEmpty()) {
            throw new IllegalArgumentException("Request must contain at least one contact");
        }
        if (request.contacts().size() > MAX_CONTACTS_PER_REQUEST) {
            throw new IllegalArgumentException("Request exceeds maximum allowed size ("
                    + MAX_CONTACTS_PER_REQUEST + " contacts)");
        }
        if (request.contacts().stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Contacts must not contain null entries");
        }
        final int concurrency = request.concurrency() != null
                ? request.concurrency() : properties.getPipeline().getConcurrency();
        final int rateLimit = request.perDomainRateLimit() != null
                ? request.perDomainRateLimit() : properties.getPipeline().getPerDomainRateLimit();
        if (concurrency < 1 || rateLimit < 0) {
            throw new IllegalArgumentException("concurrency must be positive and perDomainRateLimit not negative");
        }

        final var deferredResult = new DeferredResult<ResponseEntity<List<ContactResultResponse>>>(RESPONSE_TIMEOUT_MS);
        if (!runThrottler.tryAcquire()) {
            logger.warn("Too many runs in progress, rejecting request for {} contacts", request.contacts().size());
            deferredResult.setResult(ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).build());
            return deferredResult;
        }

        logger.info("Received request to find emails for {} contacts", request.contacts().size());
        CompletableFuture.supplyAsync(() -> emailFinderService.findEmails(request.toContacts(), concurrency, rateLimit))
                .thenAccept(results -> deferredResult.setResult(ResponseEntity.ok(
                        results.stream().map(ContactResultResponse::from).toList())))
                .exceptionally(ex -> {
                    final Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                    logger.error("Email discovery run failed: {}", cause.getMessage());
                    deferredResult.setErrorResult(cause);
                    return null;
                })
                .whenComplete((r, e) -> runThrottler.release());
        return deferredResult;
    }
}
