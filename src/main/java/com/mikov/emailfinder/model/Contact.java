package com.mikov.emailfinder.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One input row. Identity is the row index, so duplicate names are processed independently.
 */
public record Contact(int rowIndex, String firstName, String lastName, String company, Map<String, String> rawRow) {

    public Contact {
        firstName = firstName == null ? "" : firstName.trim();
        lastName = lastName == null ? "" : lastName.trim();
        company = company == null ? "" : company.trim();
        rawRow = rawRow == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(rawRow));
    }

    public Contact(int rowIndex, String firstName, String lastName, String company) {
        this(rowIndex, firstName, lastName, company, Map.of());
    }
}
