package com.mikov.emailfinder.smtp.core;

import lombok.Getter;

import java.io.IOException;

/**
 * The server answered but refused the session before the recipient could be checked
 * (greeting, HELO or MAIL FROM not accepted).
 */
@Getter
public class SmtpSessionException extends IOException {
    private final transient SmtpResponse response;

    public SmtpSessionException(String stage, SmtpResponse response) {
        super(stage + " rejected: " + response.getMessage());
        this.response = response;
    }

    public boolean isTemporary() {
        return response.isTemporaryFailure();
    }
}
