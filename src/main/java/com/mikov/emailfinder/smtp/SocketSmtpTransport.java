package com.mikov.emailfinder.smtp;

import com.mikov.emailfinder.config.EmailFinderProperties;
import com.mikov.emailfinder.smtp.core.SmtpClient;
import com.mikov.emailfinder.smtp.core.SmtpResponse;
import com.mikov.emailfinder.smtp.core.SmtpSessionException;
import com.mikov.emailfinder.smtp.core.commands.HeloCommand;
import com.mikov.emailfinder.smtp.core.commands.MailFromCommand;
import com.mikov.emailfinder.smtp.core.commands.RcptToCommand;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Opens one SMTP connection per probe and closes it with QUIT.
 *
 * @author zahari.mikov
 */
@Slf4j
public class SocketSmtpTransport implements SmtpTransport {
    private final EmailFinderProperties.Smtp config;

    public SocketSmtpTransport(final EmailFinderProperties.Smtp config) {
        this.config = config;
    }

    @Override
    public SmtpResponse probe(final String host, final String localPart, final String domain) throws IOException {
        try (SmtpClient client = new SmtpClient(host, config.getPort(),
                (int) config.getConnectTimeout().toMillis(), (int) config.getReadTimeout().toMillis())) {
            final SmtpResponse greeting = client.connect();
            if (!greeting.isSuccess()) {
                throw new SmtpSessionException("Greeting", greeting);
            }

            final SmtpResponse heloResponse = client.executeCommand(new HeloCommand(config.getHeloDomain()));
            if (!heloResponse.isSuccess()) {
                throw new SmtpSessionException("HELO", heloResponse);
            }

            final SmtpResponse mailFromResponse = client.executeCommand(new MailFromCommand(config.getMailFrom()));
            if (!mailFromResponse.isSuccess()) {
                throw new SmtpSessionException("MAIL FROM", mailFromResponse);
            }

            final SmtpResponse rcptToResponse = client.executeCommand(new RcptToCommand(localPart + "@" + domain));
            log.debug("RCPT TO {}@{} via {}: {}", localPart, domain, host, rcptToResponse.getCode());
            return rcptToResponse;
        }
    }
}
