package com.mikov.emailfinder.csv;

import com.mikov.emailfinder.model.ContactResult;

import java.util.List;

/**
 * Destination for the finished results of a run, in input order.
 */
@FunctionalInterface
public interface ContactResultSink {

    void accept(List<ContactResult> results);
}
