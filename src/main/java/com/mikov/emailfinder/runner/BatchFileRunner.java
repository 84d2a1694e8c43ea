package com.mikov.emailfinder.runner;

import com.mikov.emailfinder.csv.ContactBatch;
import com.mikov.emailfinder.csv.ContactCsvReader;
import com.mikov.emailfinder.csv.ContactResultCsvWriter;
import com.mikov.emailfinder.model.ContactResult;
import com.mikov.emailfinder.services.EmailFinderService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Processes one contact file when the application is started with {@code --input=<csv>}.
 * The output defaults to the input name with a {@code _results} suffix.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BatchFileRunner implements ApplicationRunner {
    static final String INPUT_OPTION = "input";
    static final String OUTPUT_OPTION = "output";

    private final EmailFinderService emailFinderService;
    private final ContactCsvReader reader;
    private final ContactResultCsvWriter writer;

    @Override
    public void run(final ApplicationArguments args) {
        if (!args.containsOption(INPUT_OPTION)) {
            return;
        }
        final Path input = Path.of(single(args, INPUT_OPTION));
        final Path output = args.containsOption(OUTPUT_OPTION)
                ? Path.of(single(args, OUTPUT_OPTION))
                : defaultOutput(input);

        log.info("Reading contacts from {}", input);
        final ContactBatch batch = reader.read(input);
        final List<ContactResult> results = emailFinderService.findEmails(batch.contacts());
        writer.toFile(output, batch.headers()).accept(results);
        log.info("Wrote {} results to {}", results.size(), output);
    }

    private static String single(final ApplicationArguments args, final String option) {
        final List<String> values = args.getOptionValues(option);
        if (values == null || values.size() != 1 || values.get(0).isBlank()) {
            throw new IllegalArgumentException("Option --" + option + " needs exactly one value");
        }
        return values.get(0);
    }

    static Path defaultOutput(final Path input) {
        final String name = input.getFileName().toString();
        final int dot = name.lastIndexOf('.');
        final String base = dot > 0 ? name.substring(0, dot) : name;
        return input.resolveSibling(base + "_results.csv");
    }
}
