package com.mikov.emailfinder.smtp.dns;

/**
 * Mail exchanger for a domain. Lower priority values are preferred.
 */
public record MxRecord(String hostname, int priority) {
}
