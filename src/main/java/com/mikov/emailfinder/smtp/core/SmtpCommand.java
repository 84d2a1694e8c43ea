package com.mikov.emailfinder.smtp.core;

public interface SmtpCommand {

    /**
     * Command line as sent on the wire, without the trailing CRLF.
     */
    String getCommand();
}
