package com.mikov.emailfinder.model.api;

import com.mikov.emailfinder.model.Contact;

import java.util.ArrayList;
import java.util.List;

/**
 * Request model for email discovery. Concurrency and rate default to the configured values when absent.
 *
 * @author zahari.mikov
 */
public record FindEmailsRequest(List<ContactInput> contacts, Integer concurrency, Integer perDomainRateLimit) {

    public record ContactInput(String firstName, String lastName, String company) {
    }

    public List<Contact> toContacts() {
        final List<Contact> result = new ArrayList<>(contacts.size());
        for (int i = 0; i < contacts.size(); i++) {
            final ContactInput input = contacts.get(i);
            result.add(new Contact(i, input.firstName(), input.lastName(), input.company()));
        }
        return result;
    }
}
