package com.codelogickeep.agent.coverage.config;

import com.codelogickeep.agent.coverage.exception.AgentToolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Validates AppConfig before any engine component is built from it.
 */
public class ConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(ConfigValidator.class);

    /**
     * Validates the configuration and throws exception if invalid.
     *
     * @param config the configuration to validate
     * @throws AgentToolException if a value is out of range or a pattern does not compile
     */
    public static void validate(AppConfig config) {
        if (config == null || config.getCoverage() == null) {
            throw new AgentToolException(
                    AgentToolException.ErrorCode.CONFIG_INVALID,
                    "Configuration is missing the 'coverage' section",
                    "No configuration loaded"
            );
        }

        List<String> errors = new ArrayList<>();
        validateCoverageConfig(config.getCoverage(), errors);

        if (!errors.isEmpty()) {
            String errorMessage = "Configuration validation failed:\n  - " + String.join("\n  - ", errors);
            throw new AgentToolException(
                    AgentToolException.ErrorCode.CONFIG_INVALID,
                    errorMessage,
                    "Check your agent.yml or the file passed with --config"
            );
        }

        log.debug("Configuration validation passed");
    }

    private static void validateCoverageConfig(AppConfig.CoverageConfig coverage, List<String> errors) {
        if (coverage.getWorstClassLimit() <= 0) {
            errors.add("coverage.worst-class-limit: must be positive, was " + coverage.getWorstClassLimit());
        }
        if (coverage.getSearchMaxDepth() <= 0) {
            errors.add("coverage.search-max-depth: must be positive, was " + coverage.getSearchMaxDepth());
        }
        if (coverage.getParallelism() < 0) {
            errors.add("coverage.parallelism: must be 0 (auto) or positive, was " + coverage.getParallelism());
        }
        if (isNullOrEmpty(coverage.getReportFileNames())) {
            errors.add("coverage.report-file-names: at least one report file name is required");
        }
        if (coverage.getRootReportPaths() == null) {
            errors.add("coverage.root-report-paths: must be a list (may be empty)");
        }
        if (coverage.getModuleReportPaths() == null) {
            errors.add("coverage.module-report-paths: must be a list (may be empty)");
        }

        if (coverage.getExcludePatterns() != null) {
            for (String regex : coverage.getExcludePatterns()) {
                if (regex == null || regex.isBlank()) {
                    continue;
                }
                try {
                    Pattern.compile(regex);
                } catch (PatternSyntaxException e) {
                    errors.add("coverage.exclude-patterns: invalid regex '" + regex + "' (" + e.getDescription() + ")");
                }
            }
        }
    }

    private static boolean isNullOrEmpty(List<String> values) {
        return values == null || values.stream().allMatch(v -> v == null || v.isBlank());
    }
}
