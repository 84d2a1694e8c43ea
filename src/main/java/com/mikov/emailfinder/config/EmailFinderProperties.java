package com.mikov.emailfinder.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed settings for the email finder, bound from the {@code emailfinder} prefix.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "emailfinder")
public class EmailFinderProperties {

    @Valid
    private Dns dns = new Dns();

    @Valid
    private Smtp smtp = new Smtp();

    @Valid
    private Search search = new Search();

    @Valid
    private Resolver resolver = new Resolver();

    @Valid
    private Generator generator = new Generator();

    @Valid
    private Verifier verifier = new Verifier();

    @Valid
    private Retry retry = new Retry();

    @Valid
    private Pipeline pipeline = new Pipeline();

    @Data
    public static class Dns {
        /**
         * Nameserver addresses. Empty means the system resolver configuration.
         */
        private List<String> servers = new ArrayList<>();

        @NotNull
        private Duration timeout = Duration.ofSeconds(3);

        @Min(0)
        private int retries = 1;
    }

    @Data
    public static class Smtp {
        /**
         * Outbound port 25 is blocked on many networks; with probing disabled only MX evidence is used.
         */
        private boolean enabled = true;

        @Min(1)
        private int port = 25;

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);

        @NotNull
        private Duration readTimeout = Duration.ofSeconds(10);

        @NotBlank
        private String heloDomain = "verify.local";

        @NotBlank
        private String mailFrom = "verify@verify.local";

        @Min(1)
        private int maxMxHosts = 2;

        @NotBlank
        private String catchAllProbePrefix = "nonexistent-";

        @Min(4)
        private int catchAllProbeLength = 12;
    }

    @Data
    public static class Search {
        private boolean enabled = true;

        @NotBlank
        private String endpoint = "https://html.duckduckgo.com/html/";

        @NotBlank
        private String userAgent = "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36";

        @NotNull
        private Duration timeout = Duration.ofSeconds(10);

        @Min(1)
        private int maxResults = 10;
    }

    @Data
    public static class Resolver {
        /**
         * Try {@code <company>.com} when neither the known table nor the search produced a domain.
         */
        private boolean guessFromName = true;

        /**
         * Extra entries for the known company table, keyed by normalized company name.
         */
        private Map<String, String> knownDomains = new LinkedHashMap<>();
    }

    @Data
    public static class Generator {
        @Min(1)
        private int maxCandidates = 8;
    }

    @Data
    public static class Verifier {
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double validConfidence = 0.9;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double catchAllConfidence = 0.5;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double invalidConfidence = 0.85;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double noMxConfidence = 1.0;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double mxOnlyConfidence = 0.3;
    }

    @Data
    public static class Retry {
        @Min(1)
        private int maxAttempts = 3;

        @NotNull
        private Duration initialBackoff = Duration.ofMillis(500);

        @DecimalMin("1.0")
        private double multiplier = 2.0;

        @NotNull
        private Duration maxBackoff = Duration.ofSeconds(5);
    }

    @Data
    public static class Pipeline {
        @Min(1)
        private int concurrency = 3;

        /**
         * Verifications per second allowed against a single domain. Zero disables throttling.
         */
        @Min(0)
        private int perDomainRateLimit = 2;

        /**
         * Consecutive contacts failing with an unreachable resolver before the run is aborted. Zero disables.
         */
        @Min(0)
        private int fatalDnsFailures = 25;

        @Min(1)
        private int progressLogInterval = 50;
    }
}
