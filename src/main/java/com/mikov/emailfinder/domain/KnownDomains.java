package com.mikov.emailfinder.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Static table of well-known companies. Keys are normalized company names and are matched exactly.
 */
public class KnownDomains {
    private static final Map<String, String> DEFAULTS = Map.ofEntries(
            Map.entry("google", "google.com"),
            Map.entry("microsoft", "microsoft.com"),
            Map.entry("apple", "apple.com"),
            Map.entry("amazon", "amazon.com"),
            Map.entry("meta", "meta.com"),
            Map.entry("facebook", "meta.com"),
            Map.entry("netflix", "netflix.com"),
            Map.entry("salesforce", "salesforce.com"),
            Map.entry("oracle", "oracle.com"),
            Map.entry("ibm", "ibm.com"),
            Map.entry("intel", "intel.com"),
            Map.entry("cisco", "cisco.com"),
            Map.entry("adobe", "adobe.com"),
            Map.entry("spotify", "spotify.com"),
            Map.entry("uber", "uber.com"),
            Map.entry("airbnb", "airbnb.com"),
            Map.entry("linkedin", "linkedin.com"),
            Map.entry("twitter", "x.com"),
            Map.entry("stripe", "stripe.com"),
            Map.entry("shopify", "shopify.com"),
            Map.entry("slack", "slack.com"),
            Map.entry("zoom", "zoom.us"),
            Map.entry("dropbox", "dropbox.com"),
            Map.entry("hubspot", "hubspot.com"),
            Map.entry("mailchimp", "mailchimp.com"),
            Map.entry("twilio", "twilio.com"),
            Map.entry("datadog", "datadoghq.com"),
            Map.entry("snowflake", "snowflake.com"),
            Map.entry("palantir", "palantir.com"));

    private final Map<String, String> domains;

    public KnownDomains() {
        this(Map.of());
    }

    /**
     * @param overrides extra or replacement entries; keys are normalized before use
     */
    public KnownDomains(final Map<String, String> overrides) {
        final var merged = new LinkedHashMap<>(DEFAULTS);
        overrides.forEach((company, domain) ->
                merged.put(CompanyNameNormalizer.normalize(company), domain.trim().toLowerCase(Locale.ROOT)));
        this.domains = Collections.unmodifiableMap(merged);
    }

    public Optional<String> lookup(final String normalizedName) {
        return Optional.ofNullable(domains.get(normalizedName));
    }

    public int size() {
        return domains.size();
    }
}
