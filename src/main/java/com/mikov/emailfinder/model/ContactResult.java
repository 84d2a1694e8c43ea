package com.mikov.emailfinder.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Terminal record for one contact. Built once when the contact finishes and never changed afterwards.
 */
@Value
@Builder
public class ContactResult {
    Contact contact;
    String domain;
    String chosenEmail;
    VerificationVerdict verdict;
    @Singular
    List<VerificationAttempt> attempts;

    public boolean hasEmail() {
        return chosenEmail != null;
    }

    public int getPatternsTried() {
        return attempts.size();
    }
}
