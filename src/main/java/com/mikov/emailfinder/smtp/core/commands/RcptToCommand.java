package com.mikov.emailfinder.smtp.core.commands;

import com.mikov.emailfinder.smtp.core.SmtpCommand;

public class RcptToCommand implements SmtpCommand {
    private final String toEmail;

    public RcptToCommand(String toEmail) {
        this.toEmail = toEmail;
    }

    @Override
    public String getCommand() {
        return "RCPT TO:<" + toEmail + ">";
    }

    @Override
    public String toString() {
        return getCommand();
    }
}
