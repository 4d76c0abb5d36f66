package com.piscanner;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.piscanner.agent.AgentType;
import com.piscanner.host.ScanHost;
import com.piscanner.host.ScanOutcome;
import com.piscanner.runtime.AppConfig;
import com.piscanner.runtime.AppConfigLoader;
import com.piscanner.runtime.ConfigException;
import com.piscanner.signing.SigningException;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "pi-scanner",
        mixinStandardHelpOptions = true,
        version = "pi-scanner 0.1.0",
        description = "Sends prompt-injection probes to a target agent and judges each answer.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);
    static final int EXIT_OK = 0;
    static final int EXIT_RUN_FAILURE = 1;
    static final int EXIT_CONFIG_ERROR = 2;

    @Option(names = { "-c", "--config" }, description = "Path to YAML or JSON config file", defaultValue = "src/main/resources/application.yml")
    Path configPath;

    @Option(names = { "-a", "--agent" }, required = true, description = "Target agent: ${COMPLETION-CANDIDATES}")
    Target agent;

    @Option(names = "--prompts", description = "Prompt dataset, one prompt per line (overrides scan.promptsPath)")
    Path promptsPath;

    @Option(names = "--output-dir", description = "Directory for scan reports (overrides scan.outputDir)")
    Path outputDir;

    private final OkHttpClient httpClient;

    enum Target {
        api,
        ollama,
        openai,
        all
    }

    public Main() {
        this(new OkHttpClient());
    }

    Main(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config;
        try {
            config = new AppConfigLoader().load(configPath);
        } catch (ConfigException e) {
            log.error("Configuration error: {}", e.getMessage());
            return EXIT_CONFIG_ERROR;
        }

        Path prompts = promptsPath != null ? promptsPath : Path.of(config.getScan().getPromptsPath());
        Path reports = outputDir != null ? outputDir : Path.of(config.getScan().getOutputDir());
        ScanHost host = new ScanHost(config, httpClient, prompts, reports);

        log.info("Using config file: {}", configPath);
        log.info("Starting scan with {} agent, prompts={} output={}", agent, prompts, reports);
        try {
            if (agent == Target.all) {
                List<ScanOutcome> outcomes = host.runAllEnabled();
                if (outcomes.isEmpty()) {
                    log.error("No agent run completed");
                    return EXIT_RUN_FAILURE;
                }
                return EXIT_OK;
            }
            ScanOutcome outcome = host.run(AgentType.fromId(agent.name()));
            log.info("Scan complete: total={} injected={}", outcome.summary().total(), outcome.summary().injected());
            return EXIT_OK;
        } catch (ConfigException | SigningException e) {
            log.error("Configuration error: {}", e.getMessage());
            return EXIT_CONFIG_ERROR;
        } catch (IOException e) {
            log.error("Scan failed: {}", e.getMessage(), e);
            return EXIT_RUN_FAILURE;
        }
    }
}
