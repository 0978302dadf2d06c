package com.williamcallahan.actdb.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.actdb.domain.identifier.ActIdentifier;
import com.williamcallahan.actdb.service.ActIngestionOutcome;
import com.williamcallahan.actdb.service.ActIngestionService;
import com.williamcallahan.actdb.service.ActQueryService;
import com.williamcallahan.actdb.service.ActTextRenderer;
import com.williamcallahan.actdb.service.ActView;
import com.williamcallahan.actdb.service.AmendmentFailure;
import com.williamcallahan.actdb.service.AmendmentOutcome;
import com.williamcallahan.actdb.service.RecalculationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Command line entry point.
 *
 * <pre>
 * add &lt;path&gt;...
 * recalculate &lt;from&gt; &lt;to&gt;
 * show &lt;year/number&gt; [--date yyyy-MM-dd] [--format json|text]
 * </pre>
 *
 * Every item is attempted; the exit code is nonzero if any of them failed.
 */
@Component
public class ActDbCommandLine implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(ActDbCommandLine.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = String.join("\n",
            "Usage:",
            "  add <path>...",
            "  recalculate <from> <to>",
            "  show <year/number> [--date yyyy-MM-dd] [--format json|text]");

    private final ActIngestionService ingestionService;
    private final RecalculationService recalculationService;
    private final ActQueryService queryService;
    private final ActTextRenderer textRenderer;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final PrintStream out;

    private int exitCode = EXIT_OK;

    @Autowired
    public ActDbCommandLine(ActIngestionService ingestionService, RecalculationService recalculationService,
            ActQueryService queryService, ActTextRenderer textRenderer, ObjectMapper objectMapper, Clock clock) {
        this(ingestionService, recalculationService, queryService, textRenderer, objectMapper, clock, System.out);
    }

    ActDbCommandLine(ActIngestionService ingestionService, RecalculationService recalculationService,
            ActQueryService queryService, ActTextRenderer textRenderer, ObjectMapper objectMapper, Clock clock,
            PrintStream out) {
        this.ingestionService = ingestionService;
        this.recalculationService = recalculationService;
        this.queryService = queryService;
        this.textRenderer = textRenderer;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.out = out;
    }

    @Override
    public void run(String... args) {
        if (args.length == 0) {
            log.info(USAGE);
            exitCode = EXIT_USAGE;
            return;
        }
        List<String> rest = Arrays.asList(args).subList(1, args.length);
        try {
            exitCode = switch (args[0]) {
                case "add" -> add(rest);
                case "recalculate" -> recalculate(rest);
                case "show" -> show(rest);
                default -> usage("Unknown command: " + args[0]);
            };
        } catch (UsageException e) {
            exitCode = usage(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Command {} failed: {}", args[0], e.getMessage(), e);
            exitCode = EXIT_FAILURE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private int add(List<String> args) {
        if (args.isEmpty()) {
            throw new UsageException("add needs at least one path");
        }
        List<Path> paths = args.stream().map(Paths::get).toList();
        ActIngestionOutcome outcome = ingestionService.addAll(paths);
        log.info("Added {} acts ({})", outcome.processed(), outcome.status());
        if (outcome.hasFailures()) {
            log.error("Some acts were not processed: {}", outcome.failures());
            return EXIT_FAILURE;
        }
        return EXIT_OK;
    }

    private int recalculate(List<String> args) {
        if (args.size() != 2) {
            throw new UsageException("recalculate needs a start and an end date");
        }
        LocalDate from = parseDate(args.get(0));
        LocalDate to = parseDate(args.get(1));
        if (!to.isAfter(from)) {
            throw new UsageException("recalculate end date must be after the start date");
        }
        List<AmendmentFailure> failures = new ArrayList<>();
        for (AmendmentOutcome outcome : recalculationService.recalculate(from, to)) {
            failures.addAll(outcome.failures());
        }
        if (!failures.isEmpty()) {
            failures.forEach(failure -> log.error("{} on {} ({}): {}",
                    failure.act(), failure.date(), failure.stage(), failure.details()));
            return EXIT_FAILURE;
        }
        return EXIT_OK;
    }

    private int show(List<String> args) {
        if (args.isEmpty()) {
            throw new UsageException("show needs an act identifier");
        }
        ActIdentifier id;
        try {
            id = ActIdentifier.parse(args.get(0));
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage());
        }
        LocalDate date = LocalDate.now(clock);
        String format = "text";
        for (int i = 1; i < args.size(); i++) {
            String option = args.get(i);
            if (i + 1 >= args.size()) {
                throw new UsageException("Missing value for " + option);
            }
            String value = args.get(++i);
            switch (option) {
                case "--date" -> date = parseDate(value);
                case "--format" -> format = value;
                default -> throw new UsageException("Unknown option: " + option);
            }
        }
        if (!format.equals("json") && !format.equals("text")) {
            throw new UsageException("Unknown format: " + format);
        }

        Optional<ActView> view = queryService.view(id, date);
        if (view.isEmpty()) {
            log.error("Could not find act {} in the database at date {}", id, date);
            return EXIT_FAILURE;
        }
        if (format.equals("json")) {
            try {
                out.println(objectMapper.writeValueAsString(view.get().act()));
            } catch (JsonProcessingException e) {
                log.error("Could not encode {}: {}", id, e.getMessage());
                return EXIT_FAILURE;
            }
        } else {
            out.print(textRenderer.render(view.get()));
        }
        return EXIT_OK;
    }

    private static LocalDate parseDate(String text) {
        try {
            return LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            throw new UsageException("Invalid date: " + text);
        }
    }

    private static int usage(String message) {
        log.error("{}\n{}", message, USAGE);
        return EXIT_USAGE;
    }

    private static final class UsageException extends RuntimeException {
        UsageException(String message) {
            super(message);
        }
    }
}
