package com.mikov.emailfinder.csv;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.mikov.emailfinder.exception.ContactFileException;
import com.mikov.emailfinder.model.Contact;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads contact files. The header row is located by its column names, so exports that start with
 * note lines (LinkedIn connection exports carry three) are read without preprocessing.
 *
 * @author zahari.mikov
 */
@Slf4j
public class ContactCsvReader {
    private static final int MAX_PREAMBLE_ROWS = 10;

    private static final Set<String> FIRST_NAME_ALIASES = Set.of("firstname", "first", "givenname");
    private static final Set<String> LAST_NAME_ALIASES = Set.of("lastname", "last", "surname", "familyname");
    private static final Set<String> COMPANY_ALIASES = Set.of("company", "companyname", "organization",
            "organisation", "employer");

    private final CsvMapper mapper;

    public ContactCsvReader() {
        this.mapper = new CsvMapper();
        this.mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        this.mapper.enable(CsvParser.Feature.TRIM_SPACES);
    }

    public ContactBatch read(final Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (IOException e) {
            throw new ContactFileException("Cannot read contact file " + path + ": " + e.getMessage(), e);
        }
    }

    public ContactBatch read(final Reader reader) {
        final List<String[]> rows;
        try (MappingIterator<String[]> iterator = mapper.readerFor(String[].class)
                .with(CsvSchema.emptySchema())
                .readValues(reader)) {
            rows = iterator.readAll();
        } catch (IOException e) {
            throw new ContactFileException("Malformed contact file: " + e.getMessage(), e);
        }

        for (int headerRow = 0; headerRow < Math.min(rows.size(), MAX_PREAMBLE_ROWS + 1); headerRow++) {
            final ColumnIndexes columns = ColumnIndexes.find(rows.get(headerRow));
            if (columns != null) {
                if (headerRow > 0) {
                    log.info("Skipped {} preamble line(s) before the header", headerRow);
                }
                return toBatch(rows, headerRow, columns);
            }
        }
        throw new ContactFileException("Contact file lacks a required column: expected first name, last name "
                + "and company (e.g. 'First Name', 'Last Name', 'Company')");
    }

    private static ContactBatch toBatch(final List<String[]> rows, final int headerRow, final ColumnIndexes columns) {
        final String[] header = rows.get(headerRow);
        final List<String> headers = new ArrayList<>(header.length);
        for (final String name : header) {
            headers.add(name.trim());
        }

        final List<Contact> contacts = new ArrayList<>(rows.size() - headerRow - 1);
        for (int i = headerRow + 1; i < rows.size(); i++) {
            final String[] row = rows.get(i);
            final Map<String, String> raw = new LinkedHashMap<>();
            for (int c = 0; c < headers.size(); c++) {
                raw.putIfAbsent(headers.get(c), cell(row, c));
            }
            contacts.add(new Contact(contacts.size(),
                    cell(row, columns.firstName()), cell(row, columns.lastName()), cell(row, columns.company()), raw));
        }
        log.info("Read {} contacts", contacts.size());
        return new ContactBatch(headers, contacts);
    }

    private static String cell(final String[] row, final int index) {
        return index < row.length && row[index] != null ? row[index].trim() : "";
    }

    static String normalizeHeader(final String header) {
        return header.toLowerCase(Locale.ROOT).replaceAll("[^a-z]", "");
    }

    private record ColumnIndexes(int firstName, int lastName, int company) {

        static ColumnIndexes find(final String[] row) {
            int first = -1;
            int last = -1;
            int company = -1;
            for (int i = 0; i < row.length; i++) {
                final String name = normalizeHeader(row[i]);
                if (first < 0 && FIRST_NAME_ALIASES.contains(name)) {
                    first = i;
                } else if (last < 0 && LAST_NAME_ALIASES.contains(name)) {
                    last = i;
                } else if (company < 0 && COMPANY_ALIASES.contains(name)) {
                    company = i;
                }
            }
            return first >= 0 && last >= 0 && company >= 0 ? new ColumnIndexes(first, last, company) : null;
        }
    }
}
