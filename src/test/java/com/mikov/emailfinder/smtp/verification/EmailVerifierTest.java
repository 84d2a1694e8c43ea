package com.mikov.emailfinder.smtp.verification;

import com.mikov.emailfinder.config.EmailFinderProperties;
import com.mikov.emailfinder.exception.CapabilityException;
import com.mikov.emailfinder.model.Candidate;
import com.mikov.emailfinder.model.VerificationStatus;
import com.mikov.emailfinder.model.VerificationVerdict;
import com.mikov.emailfinder.smtp.SmtpTransport;
import com.mikov.emailfinder.smtp.core.SmtpResponse;
import com.mikov.emailfinder.smtp.core.SmtpSessionException;
import com.mikov.emailfinder.smtp.dns.DnsClient;
import com.mikov.emailfinder.smtp.dns.MxRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class EmailVerifierTest {

    private static final String PROBE = "probe-catchall";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);

    private DnsClient dns;
    private SmtpTransport transport;
    private EmailFinderProperties properties;

    @BeforeEach
    void setUp() {
        dns = mock(DnsClient.class);
        transport = mock(SmtpTransport.class);
        properties = new EmailFinderProperties();
        properties.setRetry(ProbeRetrierTest.fastRetry());
        when(dns.lookupMx("acme.com")).thenReturn(List.of(
                new MxRecord("mx1.acme.com", 10), new MxRecord("mx2.acme.com", 20)));
    }

    private EmailVerifier verifier() {
        ProbeRetrier prober = new ProbeRetrier(transport, properties.getRetry());
        return new EmailVerifier(dns, prober, new CatchAllDetector(prober, () -> PROBE), properties, CLOCK);
    }

    private static Candidate candidate(String localPart) {
        return new Candidate(localPart, "acme.com", 0);
    }

    @Test
    void shouldMarkDomainWithoutMxInvalidWithoutSmtp() {
        when(dns.lookupMx("nomail.io")).thenReturn(List.of());

        VerificationVerdict verdict = verifier().verify(new Candidate("john", "nomail.io", 0));

        assertThat(verdict.getStatus()).isEqualTo(VerificationStatus.INVALID);
        assertThat(verdict.getConfidence()).isEqualTo(1.0);
        assertThat(verdict.getReason()).isEqualTo("no_mx");
        assertThat(verdict.getCheckedAt()).isEqualTo(CLOCK.instant());
        verifyNoInteractions(transport);
    }

    @Test
    void shouldAcceptMailboxOnNonCatchAllDomain() throws Exception {
        when(transport.probe("mx1.acme.com", "john.smith", "acme.com")).thenReturn(SmtpResponse.of(250, "OK"));
        when(transport.probe("mx1.acme.com", PROBE, "acme.com")).thenReturn(SmtpResponse.of(550, "No such user"));

        VerificationVerdict verdict = verifier().verify(candidate("john.smith"));

        assertThat(verdict.getStatus()).isEqualTo(VerificationStatus.VALID);
        assertThat(verdict.getConfidence()).isEqualTo(0.9);
    }

    @Test
    void shouldProbeCatchAllOnceAndMarkEveryAcceptedCandidate() throws Exception {
        when(transport.probe(eq("mx1.acme.com"), anyString(), eq("acme.com"))).thenReturn(SmtpResponse.of(250, "OK"));
        EmailVerifier verifier = verifier();

        VerificationVerdict first = verifier.verify(candidate("john.smith"));
        VerificationVerdict second = verifier.verify(candidate("johnsmith"));

        assertThat(first.getStatus()).isEqualTo(VerificationStatus.CATCH_ALL);
        assertThat(first.getConfidence()).isEqualTo(0.5);
        assertThat(second.getStatus()).isEqualTo(VerificationStatus.CATCH_ALL);
        verify(transport, times(1)).probe("mx1.acme.com", PROBE, "acme.com");
    }

    @Test
    void shouldTreatInconclusiveCatchAllProbeAsCatchAll() throws Exception {
        when(transport.probe("mx1.acme.com", "john.smith", "acme.com")).thenReturn(SmtpResponse.of(250, "OK"));
        when(transport.probe("mx1.acme.com", PROBE, "acme.com")).thenThrow(new ConnectException("refused"));

        assertThat(verifier().verify(candidate("john.smith")).getStatus()).isEqualTo(VerificationStatus.CATCH_ALL);
    }

    @Test
    void shouldMarkRejectedRecipientInvalid() throws Exception {
        when(transport.probe("mx1.acme.com", "jsmith", "acme.com")).thenReturn(SmtpResponse.of(550, "5.1.1 User unknown"));

        VerificationVerdict verdict = verifier().verify(candidate("jsmith"));

        assertThat(verdict.getStatus()).isEqualTo(VerificationStatus.INVALID);
        assertThat(verdict.getConfidence()).isEqualTo(0.85);
        assertThat(verdict.getReason()).isEqualTo("smtp_rejected");
        verify(transport, never()).probe("mx1.acme.com", PROBE, "acme.com");
    }

    @Test
    void shouldLeaveGreylistedRecipientUnknownAfterRetries() throws Exception {
        when(transport.probe("mx1.acme.com", "john", "acme.com")).thenReturn(SmtpResponse.of(450, "Greylisted"));

        VerificationVerdict verdict = verifier().verify(candidate("john"));

        assertThat(verdict.getStatus()).isEqualTo(VerificationStatus.UNKNOWN);
        assertThat(verdict.getConfidence()).isZero();
        assertThat(verdict.getReason()).isEqualTo("greylisted");
        verify(transport, times(3)).probe("mx1.acme.com", "john", "acme.com");
    }

    @Test
    void shouldNotCountPolicyBlockAsRejection() throws Exception {
        when(transport.probe("mx1.acme.com", "john", "acme.com"))
                .thenReturn(SmtpResponse.of(554, "Client host blocked using zen.spamhaus.org"));

        VerificationVerdict verdict = verifier().verify(candidate("john"));

        assertThat(verdict.getStatus()).isEqualTo(VerificationStatus.UNKNOWN);
        assertThat(verdict.getReason()).isEqualTo("policy_block");
    }

    @Test
    void shouldUseMxEvidenceOnlyWhenSmtpDisabled() {
        properties.getSmtp().setEnabled(false);

        VerificationVerdict verdict = verifier().verify(candidate("john"));

        assertThat(verdict.getStatus()).isEqualTo(VerificationStatus.UNKNOWN);
        assertThat(verdict.getConfidence()).isEqualTo(0.3);
        verifyNoInteractions(transport);
    }

    @Test
    void shouldFallBackToNextMxHostWhenFirstIsUnreachable() throws Exception {
        when(transport.probe(eq("mx1.acme.com"), anyString(), anyString())).thenThrow(new ConnectException("refused"));
        when(transport.probe("mx2.acme.com", "john", "acme.com")).thenReturn(SmtpResponse.of(250, "OK"));
        when(transport.probe("mx2.acme.com", PROBE, "acme.com")).thenReturn(SmtpResponse.of(550, "No such user"));

        VerificationVerdict verdict = verifier().verify(candidate("john"));

        assertThat(verdict.getStatus()).isEqualTo(VerificationStatus.VALID);
        verify(transport, times(3)).probe("mx1.acme.com", "john", "acme.com");
    }

    @Test
    void shouldStayUnknownWhenNoMxHostAnswers() throws Exception {
        when(transport.probe(anyString(), anyString(), anyString())).thenThrow(new ConnectException("refused"));

        VerificationVerdict verdict = verifier().verify(candidate("john"));

        assertThat(verdict.getStatus()).isEqualTo(VerificationStatus.UNKNOWN);
        assertThat(verdict.getReason()).isEqualTo("smtp_unreachable");
    }

    @Test
    void shouldStayUnknownWhenSessionIsRefused() throws Exception {
        when(transport.probe("mx1.acme.com", "john", "acme.com"))
                .thenThrow(new SmtpSessionException("MAIL FROM", SmtpResponse.of(553, "Sender address rejected")));

        VerificationVerdict verdict = verifier().verify(candidate("john"));

        assertThat(verdict.getStatus()).isEqualTo(VerificationStatus.UNKNOWN);
        assertThat(verdict.getReason()).isEqualTo("session_refused");
        verify(transport, never()).probe(eq("mx2.acme.com"), anyString(), anyString());
    }

    @Test
    void shouldStayUnknownWhenDnsIsUnavailable() {
        when(dns.lookupMx("acme.com")).thenThrow(new CapabilityException(CapabilityException.Capability.DNS, "timeout"));

        VerificationVerdict verdict = verifier().verify(candidate("john"));

        assertThat(verdict.getStatus()).isEqualTo(VerificationStatus.UNKNOWN);
        assertThat(verdict.getReason()).isEqualTo("dns_unavailable");
    }
}
