package com.mikov.emailfinder.config;

import com.mikov.emailfinder.csv.ContactCsvReader;
import com.mikov.emailfinder.csv.ContactResultCsvWriter;
import com.mikov.emailfinder.domain.KnownDomains;
import com.mikov.emailfinder.pattern.PatternGenerator;
import com.mikov.emailfinder.search.CompanySearchClient;
import com.mikov.emailfinder.search.DuckDuckGoSearchClient;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
public class EmailFinderConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate searchRestTemplate(final RestTemplateBuilder builder, final EmailFinderProperties properties) {
        return builder
                .setConnectTimeout(properties.getSearch().getTimeout())
                .setReadTimeout(properties.getSearch().getTimeout())
                .build();
    }

    @Bean
    public CompanySearchClient companySearchClient(final RestTemplate searchRestTemplate,
                                                   final EmailFinderProperties properties) {
        return new DuckDuckGoSearchClient(searchRestTemplate, properties.getSearch());
    }

    @Bean
    public KnownDomains knownDomains(final EmailFinderProperties properties) {
        return new KnownDomains(properties.getResolver().getKnownDomains());
    }

    @Bean
    public PatternGenerator patternGenerator(final EmailFinderProperties properties) {
        return new PatternGenerator(properties.getGenerator().getMaxCandidates());
    }

    @Bean
    public ContactCsvReader contactCsvReader() {
        return new ContactCsvReader();
    }

    @Bean
    public ContactResultCsvWriter contactResultCsvWriter() {
        return new ContactResultCsvWriter();
    }
}
