package com.mikov.emailfinder.config;

import com.mikov.emailfinder.smtp.SmtpTransport;
import com.mikov.emailfinder.smtp.SocketSmtpTransport;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SmtpConfiguration {

    @Bean
    public SmtpTransport smtpTransport(final EmailFinderProperties properties) {
        return new SocketSmtpTransport(properties.getSmtp());
    }
}
