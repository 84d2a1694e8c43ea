package com.mikov.emailfinder.smtp.verification;

import com.mikov.emailfinder.config.EmailFinderProperties;
import com.mikov.emailfinder.exception.CapabilityException;
import com.mikov.emailfinder.model.Candidate;
import com.mikov.emailfinder.model.VerificationStatus;
import com.mikov.emailfinder.model.VerificationVerdict;
import com.mikov.emailfinder.smtp.core.SmtpResponse;
import com.mikov.emailfinder.smtp.core.SmtpSessionException;
import com.mikov.emailfinder.smtp.dns.DnsClient;
import com.mikov.emailfinder.smtp.dns.MxRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Locale;

/**
 * Turns a candidate address into a verdict: MX check first, then an optional SMTP recipient probe.
 * Network problems never escape as exceptions; they become {@link VerificationStatus#UNKNOWN}.
 *
 * @author zahari.mikov
 */
@Slf4j
public class EmailVerifier {
    private final DnsClient dnsClient;
    private final ProbeRetrier prober;
    private final CatchAllDetector catchAllDetector;
    private final EmailFinderProperties.Verifier policy;
    private final boolean smtpEnabled;
    private final int maxMxHosts;
    private final Clock clock;

    public EmailVerifier(final DnsClient dnsClient,
                         final ProbeRetrier prober,
                         final CatchAllDetector catchAllDetector,
                         final EmailFinderProperties properties,
                         final Clock clock) {
        this.dnsClient = dnsClient;
        this.prober = prober;
        this.catchAllDetector = catchAllDetector;
        this.policy = properties.getVerifier();
        this.smtpEnabled = properties.getSmtp().isEnabled();
        this.maxMxHosts = properties.getSmtp().getMaxMxHosts();
        this.clock = clock;
    }

    public VerificationVerdict verify(final Candidate candidate) {
        final String domain = candidate.domain();

        final List<MxRecord> mxRecords;
        try {
            mxRecords = dnsClient.lookupMx(domain);
        } catch (CapabilityException e) {
            log.warn("MX lookup for {} unavailable: {}", domain, e.getMessage());
            return unknown("dns_unavailable");
        }

        if (mxRecords.isEmpty()) {
            return verdict(VerificationStatus.INVALID, policy.getNoMxConfidence(), "no_mx");
        }

        if (!smtpEnabled) {
            return verdict(VerificationStatus.UNKNOWN, policy.getMxOnlyConfidence(), "smtp_disabled");
        }

        return probe(candidate, mxRecords);
    }

    private VerificationVerdict probe(final Candidate candidate, final List<MxRecord> mxRecords) {
        final int hosts = Math.min(maxMxHosts, mxRecords.size());
        for (int i = 0; i < hosts; i++) {
            final String host = mxRecords.get(i).hostname();
            try {
                final SmtpResponse response = prober.probe(host, candidate.localPart(), candidate.domain());
                return interpret(candidate, host, response);
            } catch (SmtpSessionException e) {
                log.debug("SMTP session with {} refused for {}: {}", host, candidate.email(), e.getMessage());
                return unknown(e.isTemporary() ? "session_deferred" : "session_refused");
            } catch (IOException e) {
                log.debug("SMTP probe of {} via {} failed: {}", candidate.email(), host, e.getMessage());
            }
        }
        log.info("No mail exchanger of {} reachable, verdict for {} stays unknown", candidate.domain(), candidate.email());
        return unknown("smtp_unreachable");
    }

    private VerificationVerdict interpret(final Candidate candidate, final String host, final SmtpResponse response) {
        if (response.isSuccess()) {
            final CatchAllStatus catchAll = catchAllDetector.detect(candidate.domain(), host);
            if (catchAll == CatchAllStatus.NOT_CATCH_ALL) {
                return verdict(VerificationStatus.VALID, policy.getValidConfidence(), "smtp_accepted");
            }
            return verdict(VerificationStatus.CATCH_ALL, policy.getCatchAllConfidence(), "catch_all");
        }
        if (response.isTemporaryFailure()) {
            final boolean greylisted = response.getMessage().toLowerCase(Locale.ROOT).contains("greylist")
                    || response.getCode() == 450 || response.getCode() == 451;
            return unknown(greylisted ? "greylisted" : "temporary_failure");
        }
        if (response.isPolicyBlock()) {
            log.warn("Probe from this host blocked by {}: {}", host, response.getMessage());
            return unknown("policy_block");
        }
        if (response.isPermanentFailure()) {
            return verdict(VerificationStatus.INVALID, policy.getInvalidConfidence(), "smtp_rejected");
        }
        return unknown("unexpected_response");
    }

    private VerificationVerdict verdict(final VerificationStatus status, final double confidence, final String reason) {
        return VerificationVerdict.of(status, confidence, reason, clock.instant());
    }

    private VerificationVerdict unknown(final String reason) {
        return VerificationVerdict.unknown(reason, clock.instant());
    }
}
