package com.piscanner.host;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.piscanner.agent.AgentType;
import com.piscanner.agent.PromptDispatcher;
import com.piscanner.agent.PromptRecord;
import com.piscanner.agent.TargetAgent;
import com.piscanner.agent.TargetAgents;
import com.piscanner.evaluation.EvaluationPipeline;
import com.piscanner.evaluation.EvaluationRecord;
import com.piscanner.report.ReportWriter;
import com.piscanner.report.ScanReport;
import com.piscanner.runtime.AppConfig;
import com.piscanner.runtime.ConfigException;
import com.piscanner.runtime.ConfigValidator;

import okhttp3.OkHttpClient;

/**
 * Runs scans: every prompt goes to the target agent, every answer is evaluated, and the run is written to
 * a report directory. Separate agent runs share nothing but the read-only configuration and may run in
 * parallel.
 */
public class ScanHost {
    private static final Logger log = LoggerFactory.getLogger(ScanHost.class);

    private final AppConfig config;
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final ReportWriter reportWriter;
    private final Path promptsPath;
    private final Path outputDir;
    private final Clock clock;

    public ScanHost(AppConfig config, OkHttpClient httpClient, Path promptsPath, Path outputDir) {
        this(config, httpClient, new ObjectMapper(), new ReportWriter(), promptsPath, outputDir, Clock.systemUTC());
    }

    ScanHost(
            AppConfig config,
            OkHttpClient httpClient,
            ObjectMapper mapper,
            ReportWriter reportWriter,
            Path promptsPath,
            Path outputDir,
            Clock clock) {
        this.config = config;
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.reportWriter = reportWriter;
        this.promptsPath = promptsPath;
        this.outputDir = outputDir;
        this.clock = clock;
    }

    public ScanOutcome run(AgentType type) throws IOException {
        ConfigValidator.validateAgent(config, type);
        EvaluationPipeline pipeline = EvaluationPipeline.create(config.getEvaluator(), httpClient, mapper);
        TargetAgent agent = TargetAgents.create(type, config.getAgents(), mapper);
        List<String> prompts = loadPrompts(promptsPath);

        AppConfig.ScanConfig scan = config.getScan();
        PromptDispatcher dispatcher = new PromptDispatcher(
                httpClient,
                agent,
                Duration.ofMillis(scan.getRequestTimeoutMs()),
                Duration.ofMillis(scan.getDelayMs()));

        Instant startedAt = clock.instant();
        log.info("Generating {} agent responses", type.id());
        List<PromptRecord> promptRecords = dispatcher.dispatchAll(prompts);
        log.info("Generated {} responses, evaluating", promptRecords.size());

        List<EvaluationRecord> evaluations = new ArrayList<>();
        for (int i = 0; i < promptRecords.size(); i++) {
            evaluations.add(pipeline.evaluate(promptRecords.get(i)));
            log.info("Evaluation progress: {}/{}", i + 1, promptRecords.size());
        }

        ScanReport summary = ScanReport.summarize(type, startedAt, clock.instant(), evaluations);
        Path reportDirectory = reportWriter.write(outputDir, summary, evaluations);
        logSummary(summary, reportDirectory);
        return new ScanOutcome(summary, evaluations, reportDirectory);
    }

    /**
     * Runs every enabled agent type concurrently, one task each. A failing run is logged and does not
     * stop the others.
     */
    public List<ScanOutcome> runAllEnabled() {
        List<AgentType> enabled = Arrays.stream(AgentType.values())
                .filter(type -> TargetAgents.isEnabled(type, config.getAgents()))
                .toList();
        if (enabled.isEmpty()) {
            log.warn("No enabled agent types");
            return List.of();
        }

        ExecutorService executor = Executors.newFixedThreadPool(enabled.size());
        try {
            Map<AgentType, Future<ScanOutcome>> runs = new LinkedHashMap<>();
            for (AgentType type : enabled) {
                runs.put(type, executor.submit(() -> run(type)));
            }
            List<ScanOutcome> outcomes = new ArrayList<>();
            for (Map.Entry<AgentType, Future<ScanOutcome>> entry : runs.entrySet()) {
                try {
                    outcomes.add(entry.getValue().get());
                } catch (ExecutionException e) {
                    log.error("{} agent run failed", entry.getKey().id(), e.getCause());
                }
            }
            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for agent runs");
            return List.of();
        } finally {
            executor.shutdownNow();
        }
    }

    static List<String> loadPrompts(Path promptsPath) throws IOException {
        if (!Files.isRegularFile(promptsPath)) {
            throw new ConfigException("Prompts file not found: " + promptsPath.toAbsolutePath().normalize());
        }
        return Files.readAllLines(promptsPath, StandardCharsets.UTF_8).stream()
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .toList();
    }

    private static void logSummary(ScanReport summary, Path reportDirectory) {
        log.info("Results saved to {}", reportDirectory);
        log.info("Scan summary agent={} total={} injected={} notInjected={} unknown={} injectionRate={}",
                summary.agentType(),
                summary.total(),
                summary.injected(),
                summary.notInjected(),
                summary.unknown(),
                String.format(Locale.ROOT, "%.1f%%", summary.injectionRate() * 100));
    }
}
