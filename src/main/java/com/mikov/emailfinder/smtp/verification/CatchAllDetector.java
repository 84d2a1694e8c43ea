package com.mikov.emailfinder.smtp.verification;

import com.mikov.emailfinder.smtp.core.SmtpResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Detects domains that accept any recipient by probing a random local-part.
 * The probe runs at most once per domain for the lifetime of this detector; concurrent callers
 * for the same domain wait for the first caller's answer.
 */
@Slf4j
public class CatchAllDetector {
    private static final String ALLOWED_CHARS = "abcdefghijklmnopqrstuvwxyz0123456789";

    private final ProbeRetrier prober;
    private final Supplier<String> probeLocalPart;
    private final Map<String, CompletableFuture<CatchAllStatus>> results = new ConcurrentHashMap<>();

    public CatchAllDetector(final ProbeRetrier prober, final Supplier<String> probeLocalPart) {
        this.prober = prober;
        this.probeLocalPart = probeLocalPart;
    }

    public CatchAllStatus detect(final String domain, final String mxHost) {
        final var pending = new CompletableFuture<CatchAllStatus>();
        final var existing = results.putIfAbsent(domain, pending);
        if (existing != null) {
            return existing.join();
        }

        CatchAllStatus status = CatchAllStatus.INDETERMINATE;
        try {
            status = probe(domain, mxHost);
        } finally {
            pending.complete(status);
        }
        return status;
    }

    private CatchAllStatus probe(final String domain, final String mxHost) {
        final String localPart = probeLocalPart.get();
        try {
            final SmtpResponse response = prober.probe(mxHost, localPart, domain);
            if (response.isSuccess()) {
                log.info("Domain {} accepts any recipient (catch-all)", domain);
                return CatchAllStatus.CATCH_ALL;
            }
            if (response.isPermanentFailure()) {
                return CatchAllStatus.NOT_CATCH_ALL;
            }
            log.debug("Catch-all probe for {} inconclusive: {}", domain, response.getMessage());
            return CatchAllStatus.INDETERMINATE;
        } catch (IOException e) {
            log.debug("Catch-all probe for {} via {} failed: {}", domain, mxHost, e.getMessage());
            return CatchAllStatus.INDETERMINATE;
        }
    }

    public int probedDomainCount() {
        return results.size();
    }

    public static Supplier<String> randomLocalPart(final String prefix, final int length) {
        return () -> {
            final var random = ThreadLocalRandom.current();
            final var sb = new StringBuilder(prefix);
            for (int i = 0; i < length; i++) {
                sb.append(ALLOWED_CHARS.charAt(random.nextInt(ALLOWED_CHARS.length())));
            }
            return sb.toString();
        };
    }
}
