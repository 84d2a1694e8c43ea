package com.mikov.emailfinder.smtp.core.commands;

import com.mikov.emailfinder.smtp.core.SmtpCommand;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class MailFromCommand implements SmtpCommand {
    private final String email;

    @Override
    public String getCommand() {
        return "MAIL FROM:<" + email + ">";
    }

    @Override
    public String toString() {
        return getCommand();
    }
}
