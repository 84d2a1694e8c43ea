package com.mikov.emailfinder.csv;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.mikov.emailfinder.exception.ContactFileException;
import com.mikov.emailfinder.model.ContactResult;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Writes results as the input columns followed by the discovery columns, one row per contact in input order.
 */
public class ContactResultCsvWriter {
    static final List<String> RESULT_COLUMNS = List.of(
            "chosen_email", "verdict_status", "confidence", "domain", "patterns_tried");

    private final CsvMapper mapper = new CsvMapper();

    /**
     * Sink that writes every accepted batch to {@code path}, replacing its content.
     */
    public ContactResultSink toFile(final Path path, final List<String> inputHeaders) {
        return results -> write(path, inputHeaders, results);
    }

    public void write(final Path path, final List<String> inputHeaders, final List<ContactResult> results) {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(writer, inputHeaders, results);
        } catch (IOException e) {
            throw new ContactFileException("Cannot write result file " + path + ": " + e.getMessage(), e);
        }
    }

    public void write(final Writer writer, final List<String> inputHeaders, final List<ContactResult> results)
            throws IOException {
        final Set<String> columns = new LinkedHashSet<>(inputHeaders);
        columns.addAll(RESULT_COLUMNS);

        final CsvSchema.Builder schema = CsvSchema.builder();
        columns.forEach(schema::addColumn);

        try (SequenceWriter rows = mapper.writer(schema.build().withHeader()).writeValues(writer)) {
            for (final ContactResult result : results) {
                rows.write(toRow(columns, result));
            }
        }
    }

    private static Map<String, String> toRow(final Set<String> columns, final ContactResult result) {
        final Map<String, String> row = new LinkedHashMap<>();
        for (final String column : columns) {
            row.put(column, result.getContact().rawRow().getOrDefault(column, ""));
        }
        row.put("chosen_email", result.hasEmail() ? result.getChosenEmail() : "");
        row.put("verdict_status", result.getVerdict().getStatus().name());
        row.put("confidence", String.format(Locale.ROOT, "%.2f", result.getVerdict().getConfidence()));
        row.put("domain", result.getDomain() != null ? result.getDomain() : "");
        row.put("patterns_tried", String.valueOf(result.getPatternsTried()));
        return row;
    }
}
