package com.mikov.emailfinder.smtp.core.commands;

import com.mikov.emailfinder.smtp.core.SmtpCommand;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class HeloCommand implements SmtpCommand {
    private final String domain;

    @Override
    public String getCommand() {
        return "HELO " + domain;
    }

    @Override
    public String toString() {
        return getCommand();
    }
}
