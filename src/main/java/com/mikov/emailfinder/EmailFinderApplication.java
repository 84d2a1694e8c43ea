package com.mikov.emailfinder;

import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.util.Arrays;

/**
 * Entry point. Started with {@code --input} the application processes one contact file
 * and exits; otherwise it serves the REST endpoint.
 *
 * @author zahari.mikov
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class EmailFinderApplication {

    public static void main(String[] args) {
        final var batchMode = Arrays.stream(args).anyMatch(arg -> arg.startsWith("--input="));
        new SpringApplicationBuilder(EmailFinderApplication.class)
                .web(batchMode ? WebApplicationType.NONE : WebApplicationType.SERVLET)
                .run(args);
    }
}
