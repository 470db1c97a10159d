package com.codelogickeep.agent.coverage;

import com.codelogickeep.agent.coverage.config.AppConfig;
import com.codelogickeep.agent.coverage.config.ConfigValidator;
import com.codelogickeep.agent.coverage.engine.CoverageAnalysisEngine;
import com.codelogickeep.agent.coverage.exception.AgentToolException;
import com.codelogickeep.agent.coverage.model.CoverageSummary;
import com.codelogickeep.agent.coverage.util.JsonUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "coverage-agent", mixinStandardHelpOptions = true, version = "0.1.0",
        description = "Aggregates JaCoCo XML coverage reports for a project scope and prints a JSON summary.")
public class App implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    static final int EXIT_OK = 0;
    static final int EXIT_COVERAGE_FAILURE = 1;
    static final int EXIT_CONFIG_ERROR = 2;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-p", "--project"}, required = true, description = "Project root directory to search for coverage reports.")
    private String projectDir;

    @Option(names = {"-m", "--modules"}, description = "Comma-separated module directories relative to the project root.")
    private String targetModules;

    @Option(names = {"--packages"}, description = "Comma-separated package prefixes to restrict the summary to.")
    private String targetPackages;

    @Option(names = {"--classes"}, description = "Comma-separated simple or fully qualified class names to restrict the summary to.")
    private String targetClasses;

    @Option(names = {"-c", "--config"}, description = "Path to agent configuration file (defaults to agent.yml in the working directory).")
    private String configPath;

    @Option(names = {"--pretty"}, description = "Pretty-print the JSON summary.")
    private boolean pretty;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new App()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        AppConfig config;
        try {
            config = loadAppConfig();
            ConfigValidator.validate(config);
        } catch (AgentToolException e) {
            err.println(e.toAgentMessage());
            return EXIT_CONFIG_ERROR;
        } catch (IOException e) {
            err.println("Configuration Error: " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        }

        CoverageAnalysisEngine engine = new CoverageAnalysisEngine(config.getCoverage());
        CoverageSummary summary = engine.analyze(projectDir, targetModules, targetPackages, targetClasses);

        out.println(pretty ? JsonUtil.toPrettyJson(summary) : JsonUtil.toJson(summary));
        out.flush();
        return summary.isSuccess() ? EXIT_OK : EXIT_COVERAGE_FAILURE;
    }

    private AppConfig loadAppConfig() throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AppConfig config = new AppConfig();

        // 1. Classpath (agent.yml) - Base defaults
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("agent.yml")) {
            if (in != null) {
                mapper.readerForUpdating(config).readValue(in);
            }
        }

        // 2. Current Directory
        mergeConfigFromFile(mapper, config, new File("agent.yml"));

        // 3. CLI Path - Highest priority, must exist
        if (configPath != null) {
            File file = new File(configPath);
            if (!file.isFile()) {
                throw new AgentToolException(AgentToolException.ErrorCode.CONFIG_INVALID,
                        "Configuration file not found: " + file.getAbsolutePath());
            }
            mapper.readerForUpdating(config).readValue(file);
            log.info("Merged configuration from {}", file.getAbsolutePath());
        }

        return config;
    }

    private void mergeConfigFromFile(ObjectMapper mapper, AppConfig config, File file) {
        if (file.isFile()) {
            try {
                mapper.readerForUpdating(config).readValue(file);
                log.info("Merged configuration from {}", file.getAbsolutePath());
            } catch (IOException e) {
                log.warn("Failed to merge config from {}: {}", file.getAbsolutePath(), e.getMessage());
            }
        }
    }
}
