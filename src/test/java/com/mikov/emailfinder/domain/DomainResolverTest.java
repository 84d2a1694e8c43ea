package com.mikov.emailfinder.domain;

import com.mikov.emailfinder.cache.DomainCache;
import com.mikov.emailfinder.exception.CapabilityException;
import com.mikov.emailfinder.exception.ResolutionException;
import com.mikov.emailfinder.model.DomainResult;
import com.mikov.emailfinder.model.DomainSource;
import com.mikov.emailfinder.search.CompanySearchClient;
import com.mikov.emailfinder.smtp.dns.DnsClient;
import com.mikov.emailfinder.smtp.dns.MxRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class DomainResolverTest {

    private DnsClient dns;
    private CompanySearchClient search;
    private DomainCache cache;
    private DomainResolver resolver;

    @BeforeEach
    void setUp() {
        dns = mock(DnsClient.class);
        search = mock(CompanySearchClient.class);
        cache = new DomainCache();
        resolver = new DomainResolver(new KnownDomains(), search, dns, cache, true);
    }

    private void withMx(String domain) {
        when(dns.lookupMx(domain)).thenReturn(List.of(new MxRecord("mx." + domain, 10)));
    }

    @Test
    void shouldUseKnownTableFirst() throws Exception {
        withMx("google.com");

        DomainResult result = resolver.resolve("Google LLC");

        assertThat(result.getDomain()).isEqualTo("google.com");
        assertThat(result.getSource()).isEqualTo(DomainSource.KNOWN_DB);
        assertThat(result.isMxConfirmed()).isTrue();
        verifyNoInteractions(search);
    }

    @Test
    void shouldFallBackToSearchAndCleanTheDomain() throws Exception {
        when(search.searchDomain("blue harbor labs")).thenReturn(Optional.of("WWW.BlueHarbor.io."));
        withMx("blueharbor.io");

        DomainResult result = resolver.resolve("Blue Harbor Labs");

        assertThat(result.getDomain()).isEqualTo("blueharbor.io");
        assertThat(result.getSource()).isEqualTo(DomainSource.SEARCH_FALLBACK);
    }

    @Test
    void shouldGuessFromNameWhenSearchFindsNothing() throws Exception {
        when(search.searchDomain(anyString())).thenReturn(Optional.empty());
        withMx("blueharborlabs.com");

        DomainResult result = resolver.resolve("Blue Harbor Labs Inc.");

        assertThat(result.getDomain()).isEqualTo("blueharborlabs.com");
        assertThat(result.getSource()).isEqualTo(DomainSource.NAME_GUESS);
    }

    @Test
    void shouldGuessWhenSearchIsUnavailable() throws Exception {
        when(search.searchDomain(anyString()))
                .thenThrow(new CapabilityException(CapabilityException.Capability.SEARCH, "rate limited"));
        withMx("acme.com");

        assertThat(resolver.resolve("Acme").getSource()).isEqualTo(DomainSource.NAME_GUESS);
    }

    @Test
    void shouldAcceptAddressRecordWhenMxIsMissing() throws Exception {
        when(search.searchDomain("acme")).thenReturn(Optional.of("acme.com"));
        when(dns.hasAddress("acme.com")).thenReturn(true);

        DomainResult result = resolver.resolve("Acme");

        assertThat(result.getDomain()).isEqualTo("acme.com");
        assertThat(result.isMxConfirmed()).isFalse();
    }

    @Test
    void shouldRejectDomainPublishingNullMx() {
        resolver = new DomainResolver(new KnownDomains(), search, dns, cache, false);
        when(search.searchDomain("acme")).thenReturn(Optional.of("acme.com"));
        when(dns.hasNullMx("acme.com")).thenReturn(true);
        when(dns.hasAddress("acme.com")).thenReturn(true);

        ResolutionException error = catchThrowableOfType(() -> resolver.resolve("Acme"), ResolutionException.class);

        assertThat(error.getKind()).isEqualTo(ResolutionException.Kind.NO_VALID_DOMAIN);
        verify(dns, never()).hasAddress("acme.com");
    }

    @Test
    void shouldSearchWithTheNormalizedNameWhateverTheSpelling() throws Exception {
        when(search.searchDomain("acme")).thenReturn(Optional.of("acme.com"));
        when(search.searchDomain("Acme, LLC")).thenReturn(Optional.of("acme-llc.io"));
        withMx("acme.com");
        withMx("acme-llc.io");

        assertThat(resolver.resolve("Acme, LLC").getDomain()).isEqualTo("acme.com");
        verify(search, never()).searchDomain("Acme, LLC");
    }

    @Test
    void shouldSkipKnownDomainWithoutRecordsAndTrySearch() throws Exception {
        when(search.searchDomain("stripe")).thenReturn(Optional.of("stripe.dev"));
        withMx("stripe.dev");

        DomainResult result = resolver.resolve("Stripe");

        assertThat(result.getDomain()).isEqualTo("stripe.dev");
        assertThat(result.getSource()).isEqualTo(DomainSource.SEARCH_FALLBACK);
    }

    @Test
    void shouldReportNoValidDomainAndCacheIt() throws Exception {
        when(search.searchDomain(anyString())).thenReturn(Optional.empty());

        ResolutionException first = catchThrowableOfType(() -> resolver.resolve("Nowhere Ltd"), ResolutionException.class);
        ResolutionException second = catchThrowableOfType(() -> resolver.resolve("NOWHERE"), ResolutionException.class);

        assertThat(first.getKind()).isEqualTo(ResolutionException.Kind.NO_VALID_DOMAIN);
        assertThat(second.getKind()).isEqualTo(ResolutionException.Kind.NO_VALID_DOMAIN);
        verify(search, times(1)).searchDomain(anyString());
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void shouldNotGuessWhenDisabled() {
        resolver = new DomainResolver(new KnownDomains(), search, dns, cache, false);
        when(search.searchDomain(anyString())).thenReturn(Optional.empty());

        ResolutionException error = catchThrowableOfType(() -> resolver.resolve("Acme"), ResolutionException.class);

        assertThat(error.getKind()).isEqualTo(ResolutionException.Kind.NO_VALID_DOMAIN);
        verify(dns, never()).lookupMx(anyString());
    }

    @Test
    void shouldReportLookupUnavailableWithoutCaching() {
        when(search.searchDomain(anyString())).thenReturn(Optional.empty());
        when(dns.lookupMx(anyString()))
                .thenThrow(new CapabilityException(CapabilityException.Capability.DNS, "SERVFAIL"));

        ResolutionException error = catchThrowableOfType(() -> resolver.resolve("Acme"), ResolutionException.class);
        catchThrowableOfType(() -> resolver.resolve("Acme"), ResolutionException.class);

        assertThat(error.getKind()).isEqualTo(ResolutionException.Kind.LOOKUP_UNAVAILABLE);
        assertThat(error.getCause()).isInstanceOf(CapabilityException.class);
        assertThat(cache.size()).isZero();
        verify(dns, times(2)).lookupMx("acme.com");
    }

    @Test
    void shouldShareResolutionAcrossSpellingsOfTheSameCompany() throws Exception {
        when(search.searchDomain(anyString())).thenReturn(Optional.of("acme.com"));
        withMx("acme.com");

        DomainResult first = resolver.resolve("Acme Inc");
        DomainResult second = resolver.resolve("ACME, Inc.");

        assertThat(second).isSameAs(first);
        verify(search, times(1)).searchDomain(anyString());
        assertThat(cache.hits()).isEqualTo(1);
    }

    @Test
    void shouldRejectEmptyCompanyWithoutLookups() {
        ResolutionException error = catchThrowableOfType(() -> resolver.resolve("  "), ResolutionException.class);

        assertThat(error.getKind()).isEqualTo(ResolutionException.Kind.NO_VALID_DOMAIN);
        verifyNoInteractions(search, dns);
    }
}
