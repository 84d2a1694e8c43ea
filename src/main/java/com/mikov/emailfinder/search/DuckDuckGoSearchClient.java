package com.mikov.emailfinder.search;

import com.mikov.emailfinder.config.EmailFinderProperties;
import com.mikov.emailfinder.domain.CompanyNameNormalizer;
import com.mikov.emailfinder.exception.CapabilityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds a company's domain from the DuckDuckGo HTML results page.
 * A result is accepted when its host contains one of the company's name words.
 *
 * @author zahari.mikov
 */
public class DuckDuckGoSearchClient implements CompanySearchClient {
    private static final Logger logger = LoggerFactory.getLogger(DuckDuckGoSearchClient.class);

    private static final Pattern HREF = Pattern.compile("href=\"((?:https?:)?//[^\"]+)\"");
    private static final Pattern REDIRECT_TARGET = Pattern.compile("[?&]uddg=([^&]+)");
    private static final String[] SKIPPED_HOSTS = {
        "duckduckgo", "google", "bing", "yahoo", "wikipedia", "linkedin.com", "facebook.com", "twitter.com",
        "youtube.com", "glassdoor", "indeed", "crunchbase", "bloomberg"
    };

    private final RestTemplate restTemplate;
    private final EmailFinderProperties.Search config;

    public DuckDuckGoSearchClient(final RestTemplate restTemplate, final EmailFinderProperties.Search config) {
        this.restTemplate = restTemplate;
        this.config = config;
    }

    @Override
    public Optional<String> searchDomain(final String company) {
        if (!config.isEnabled() || company == null || company.isBlank()) {
            return Optional.empty();
        }

        final URI uri = UriComponentsBuilder.fromHttpUrl(config.getEndpoint())
                .queryParam("q", company + " official website")
                .encode()
                .build()
                .toUri();
        final var headers = new HttpHeaders();
        headers.set(HttpHeaders.USER_AGENT, config.getUserAgent());

        final String html;
        try {
            html = restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), String.class).getBody();
        } catch (RestClientException e) {
            throw new CapabilityException(CapabilityException.Capability.SEARCH,
                    "Company search for '" + company + "' failed: " + e.getMessage(), e);
        }
        if (html == null) {
            return Optional.empty();
        }

        final Optional<String> domain = pickDomain(html, CompanyNameNormalizer.normalize(company));
        logger.debug("Search for '{}' returned {}", company, domain.orElse("nothing"));
        return domain;
    }

    Optional<String> pickDomain(final String html, final String normalizedCompany) {
        final List<String> words = new ArrayList<>();
        for (final String word : normalizedCompany.split("\\s+")) {
            final String compact = CompanyNameNormalizer.compact(word);
            if (compact.length() > 2) {
                words.add(compact);
            }
        }
        if (words.isEmpty()) {
            return Optional.empty();
        }

        final Matcher matcher = HREF.matcher(html);
        int seen = 0;
        while (matcher.find() && seen < config.getMaxResults()) {
            final String host = hostOf(unwrapRedirect(matcher.group(1)));
            if (host == null || isSkipped(host)) {
                continue;
            }
            seen++;
            final String candidate = host.startsWith("www.") ? host.substring(4) : host;
            for (final String word : words) {
                if (candidate.contains(word)) {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.empty();
    }

    private static String unwrapRedirect(final String href) {
        final Matcher redirect = REDIRECT_TARGET.matcher(href);
        if (href.contains("duckduckgo.com/l/") && redirect.find()) {
            return URLDecoder.decode(redirect.group(1), StandardCharsets.UTF_8);
        }
        return href.startsWith("//") ? "https:" + href : href;
    }

    private static String hostOf(final String url) {
        try {
            final String host = URI.create(url).getHost();
            return host == null ? null : host.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static boolean isSkipped(final String host) {
        for (final String skipped : SKIPPED_HOSTS) {
            if (host.contains(skipped)) {
                return true;
            }
        }
        return false;
    }
}
