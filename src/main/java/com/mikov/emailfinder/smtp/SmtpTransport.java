package com.mikov.emailfinder.smtp;

import com.mikov.emailfinder.smtp.core.SmtpResponse;

import java.io.IOException;

/**
 * Recipient probe against one mail exchanger: a sender/recipient handshake that never sends DATA.
 */
public interface SmtpTransport {

    /**
     * Returns the server's reply to {@code RCPT TO:<localPart@domain>}.
     *
     * @throws com.mikov.emailfinder.smtp.core.SmtpSessionException if the server refused the session
     *         before the recipient could be checked
     * @throws IOException on connection failures and timeouts
     */
    SmtpResponse probe(String host, String localPart, String domain) throws IOException;
}
