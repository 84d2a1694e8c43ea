package com.mikov.emailfinder.domain;

import org.junit.jupiter.api.Test;

import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class KnownDomainsTest {

    @Test
    void shouldResolveBuiltInCompanies() {
        KnownDomains knownDomains = new KnownDomains();

        assertThat(knownDomains.lookup("facebook")).contains("meta.com");
        assertThat(knownDomains.lookup("zoom")).contains("zoom.us");
        assertThat(knownDomains.lookup("acme")).isEmpty();
    }

    @Test
    void shouldNormalizeOverrideKeys() {
        KnownDomains knownDomains = new KnownDomains(Map.of("Acme Corp", "Acme.IO", "Twitter", "twitter.com"));

        assertThat(knownDomains.lookup("acme")).contains("acme.io");
        assertThat(knownDomains.lookup("twitter")).contains("twitter.com");
        assertThat(knownDomains.size()).isEqualTo(new KnownDomains().size() + 1);
    }

    @Test
    void shouldLowercaseOverrideDomainsIndependentlyOfDefaultLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            KnownDomains knownDomains = new KnownDomains(Map.of("Illinois Tools", "ILLINOIS.IO"));

            assertThat(knownDomains.lookup("illinois tools")).contains("illinois.io");
        } finally {
            Locale.setDefault(original);
        }
    }
}
