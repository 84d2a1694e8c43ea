package com.mikov.emailfinder.config;

import com.mikov.emailfinder.smtp.dns.DnsClient;
import com.mikov.emailfinder.smtp.dns.DnsJavaClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.xbill.DNS.ExtendedResolver;
import org.xbill.DNS.Resolver;

import java.net.UnknownHostException;

@Slf4j
@Configuration
public class DnsConfig {

    @Bean
    public Resolver dnsResolver(final EmailFinderProperties properties) throws UnknownHostException {
        final var dns = properties.getDns();
        final ExtendedResolver resolver = dns.getServers().isEmpty()
                ? new ExtendedResolver()
                : new ExtendedResolver(dns.getServers().toArray(new String[0]));
        resolver.setTimeout(dns.getTimeout());
        resolver.setRetries(dns.getRetries());
        log.info("DNS resolver configured with {} (timeout {}ms)",
                dns.getServers().isEmpty() ? "system nameservers" : dns.getServers(), dns.getTimeout().toMillis());
        return resolver;
    }

    @Bean
    public DnsClient dnsClient(final Resolver dnsResolver) {
        return new DnsJavaClient(dnsResolver);
    }
}
