package com.mikov.emailfinder.smtp.core;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Locale;

/**
 * Parsed server reply. For multi-line replies the code of the first line is used and the
 * message keeps every line.
 */
@Getter
@ToString
@EqualsAndHashCode
public class SmtpResponse {
    private static final String[] POLICY_BLOCK_SUBSTRINGS = {
        "blocked", "blacklist", "blocklist", "spamhaus", "spam", "policy", "reputation", "not permitted"
    };

    private final int code;
    private final String message;
    private final SmtpResponseCode type;
    private final boolean tempError;

    public SmtpResponse(String response) {
        this.message = response == null ? "" : response;
        this.code = extractCode(message);
        this.type = SmtpResponseCode.fromCode(code);
        this.tempError = determineIfTempError(code, message);
    }

    public static SmtpResponse of(int code, String text) {
        return new SmtpResponse(code + " " + text);
    }

    private int extractCode(String response) {
        if (response.length() < 3) {
            return 0;
        }
        try {
            return Integer.parseInt(response.substring(0, 3));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private boolean determineIfTempError(int code, String response) {
        if (code >= 400 && code < 500) {
            return true;
        }
        if (code >= 500 && code < 600) {
            String lowerResponse = response.toLowerCase(Locale.ROOT);
            return lowerResponse.contains("try again") ||
                   lowerResponse.contains("try later") ||
                   lowerResponse.contains("temporarily");
        }
        return false;
    }

    public boolean isSuccess() {
        return type == SmtpResponseCode.SUCCESS;
    }

    public boolean isTemporaryFailure() {
        return tempError;
    }

    public boolean isPermanentFailure() {
        return type == SmtpResponseCode.PERMANENT_FAILURE && !tempError;
    }

    /**
     * A permanent failure that rejects the sender (our probe) rather than the recipient.
     */
    public boolean isPolicyBlock() {
        if (!isPermanentFailure()) {
            return false;
        }
        String lowerResponse = message.toLowerCase(Locale.ROOT);
        for (String marker : POLICY_BLOCK_SUBSTRINGS) {
            if (lowerResponse.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
