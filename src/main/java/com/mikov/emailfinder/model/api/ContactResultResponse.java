package com.mikov.emailfinder.model.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.mikov.emailfinder.model.ContactResult;
import com.mikov.emailfinder.model.VerificationAttempt;
import lombok.Getter;

import java.util.List;

/**
 * Response model for one contact, with the attempts flattened to email/status pairs.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ContactResultResponse {

    private final int row;
    private final String firstName;
    private final String lastName;
    private final String company;
    private final String domain;
    private final String email;
    private final String status;
    private final double confidence;
    private final String reason;
    private final List<AttemptResponse> attempts;

    private ContactResultResponse(ContactResult result) {
        this.row = result.getContact().rowIndex();
        this.firstName = result.getContact().firstName();
        this.lastName = result.getContact().lastName();
        this.company = result.getContact().company();
        this.domain = result.getDomain();
        this.email = result.getChosenEmail();
        this.status = result.getVerdict().getStatus().name();
        this.confidence = result.getVerdict().getConfidence();
        this.reason = result.getVerdict().getReason();
        this.attempts = result.getAttempts().stream().map(AttemptResponse::from).toList();
    }

    public static ContactResultResponse from(ContactResult result) {
        return new ContactResultResponse(result);
    }

    public record AttemptResponse(String email, String status, double confidence, String reason) {
        static AttemptResponse from(VerificationAttempt attempt) {
            return new AttemptResponse(attempt.candidate().email(), attempt.verdict().getStatus().name(),
                    attempt.verdict().getConfidence(), attempt.verdict().getReason());
        }
    }
}
