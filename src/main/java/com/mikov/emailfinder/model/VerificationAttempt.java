package com.mikov.emailfinder.model;

public record VerificationAttempt(Candidate candidate, VerificationVerdict verdict) {
}
