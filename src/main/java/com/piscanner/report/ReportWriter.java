package com.piscanner.report;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.piscanner.evaluation.EvaluationRecord;

/**
 * Writes one directory per scan run holding {@code evaluations.json} and {@code summary.json}.
 */
public class ReportWriter {
    static final String EVALUATIONS_FILE = "evaluations.json";
    static final String SUMMARY_FILE = "summary.json";
    private static final DateTimeFormatter RUN_ID_FORMATTER = DateTimeFormatter.ofPattern("yyyyMMdd_HHmm", Locale.ROOT)
            .withZone(ZoneOffset.UTC);

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ReportWriter() {
        this(JsonMapper.builder()
                .findAndAddModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build(), Clock.systemUTC());
    }

    ReportWriter(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Path write(Path outputRoot, ScanReport summary, List<EvaluationRecord> records) throws IOException {
        Files.createDirectories(outputRoot);
        String baseName = "pi-scan-" + summary.agentType() + "-" + RUN_ID_FORMATTER.format(clock.instant());
        Path runDirectory = outputRoot.resolve(baseName);
        for (int attempt = 2; Files.exists(runDirectory); attempt++) {
            runDirectory = outputRoot.resolve(baseName + "-" + attempt);
        }
        Files.createDirectories(runDirectory);

        objectMapper.writerWithDefaultPrettyPrinter().writeValue(runDirectory.resolve(EVALUATIONS_FILE).toFile(), records);
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(runDirectory.resolve(SUMMARY_FILE).toFile(), summary);
        return runDirectory;
    }
}
