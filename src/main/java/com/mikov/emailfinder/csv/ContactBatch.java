package com.mikov.emailfinder.csv;

import com.mikov.emailfinder.model.Contact;

import java.util.List;

/**
 * Contacts read from one file together with the file's header, in column order.
 */
public record ContactBatch(List<String> headers, List<Contact> contacts) {

    public ContactBatch {
        headers = List.copyOf(headers);
        contacts = List.copyOf(contacts);
    }
}
