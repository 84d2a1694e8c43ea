package com.mikov.emailfinder.services;

import com.mikov.emailfinder.config.EmailFinderProperties;
import com.mikov.emailfinder.domain.KnownDomains;
import com.mikov.emailfinder.model.Contact;
import com.mikov.emailfinder.model.ContactResult;
import com.mikov.emailfinder.model.VerificationStatus;
import com.mikov.emailfinder.pattern.PatternGenerator;
import com.mikov.emailfinder.search.CompanySearchClient;
import com.mikov.emailfinder.smtp.SmtpTransport;
import com.mikov.emailfinder.smtp.core.SmtpResponse;
import com.mikov.emailfinder.smtp.dns.DnsClient;
import com.mikov.emailfinder.smtp.dns.MxRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EmailFinderServiceTest {

    private DnsClient dns;
    private SmtpTransport transport;
    private CompanySearchClient search;
    private EmailFinderService service;

    @BeforeEach
    void setUp() throws Exception {
        dns = mock(DnsClient.class);
        transport = mock(SmtpTransport.class);
        search = mock(CompanySearchClient.class);
        EmailFinderProperties properties = new EmailFinderProperties();
        properties.getRetry().setInitialBackoff(Duration.ofMillis(1));
        properties.getPipeline().setPerDomainRateLimit(0);
        service = new EmailFinderService(properties, dns, transport, search, new KnownDomains(),
                new PatternGenerator(8), Clock.systemUTC());

        when(search.searchDomain("acme")).thenReturn(Optional.of("acme.com"));
        when(dns.lookupMx("acme.com")).thenReturn(List.of(new MxRecord("mx.acme.com", 10)));
        when(transport.probe(eq("mx.acme.com"), anyString(), eq("acme.com")))
                .thenAnswer(invocation -> {
                    String localPart = invocation.getArgument(1);
                    return localPart.equals("john.smith") || localPart.equals("jane.doe")
                            ? SmtpResponse.of(250, "OK")
                            : SmtpResponse.of(550, "User unknown");
                });
    }

    @Test
    void shouldFindEmailsWithConfiguredDefaults() {
        List<ContactResult> results = service.findEmails(List.of(
                new Contact(0, "John", "Smith", "Acme Inc"),
                new Contact(1, "Jane", "Doe", "Acme Inc")));

        assertThat(results).extracting(ContactResult::getChosenEmail)
                .containsExactly("john.smith@acme.com", "jane.doe@acme.com");
        assertThat(results).extracting(result -> result.getVerdict().getStatus())
                .containsOnly(VerificationStatus.VALID);
    }

    @Test
    void shouldNotShareCachesBetweenRuns() {
        List<Contact> contacts = List.of(new Contact(0, "John", "Smith", "Acme Inc"));

        service.findEmails(contacts);
        service.findEmails(contacts);

        verify(search, times(2)).searchDomain("acme");
    }

    @Test
    void shouldCancelActiveRunsOnShutdown() throws Exception {
        when(transport.probe(eq("mx.acme.com"), anyString(), eq("acme.com"))).thenAnswer(invocation -> {
            service.shutdown();
            return SmtpResponse.of(550, "User unknown");
        });

        List<ContactResult> results = service.findEmails(List.of(
                new Contact(0, "John", "Smith", "Acme Inc"),
                new Contact(1, "Jane", "Doe", "Acme Inc")), 1, 0);

        assertThat(results.get(0).getPatternsTried()).isEqualTo(1);
        assertThat(results.get(1).getPatternsTried()).isZero();
        assertThat(results.get(1).getVerdict().getReason()).isEqualTo("not_processed");
    }
}
