package com.codelogickeep.agent.coverage.engine;

import com.codelogickeep.agent.coverage.config.AppConfig;
import com.codelogickeep.agent.coverage.exception.AgentToolException;
import com.codelogickeep.agent.coverage.model.CoverageSummary;
import com.codelogickeep.agent.coverage.model.ScopeQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.regex.PatternSyntaxException;

/**
 * Entry point of the aggregation pipeline: locate reports, parse them, summarize.
 * All collaborators are built from the supplied configuration; nothing is shared between instances.
 */
public class CoverageAnalysisEngine {
    private static final Logger log = LoggerFactory.getLogger(CoverageAnalysisEngine.class);

    private final AppConfig.CoverageConfig config;
    private final ReportLocator locator;
    private final CoverageAggregator aggregator;

    public CoverageAnalysisEngine(AppConfig.CoverageConfig config) {
        this(config,
                new ReportLocator(config),
                new CoverageAggregator(new StreamingReportParser(),
                        config.effectiveParallelism(), config.getWorstClassLimit()));
    }

    public CoverageAnalysisEngine(AppConfig.CoverageConfig config, ReportLocator locator,
                                  CoverageAggregator aggregator) {
        this.config = config;
        this.locator = locator;
        this.aggregator = aggregator;
    }

    /**
     * Builds the scope from comma-separated lists (configured exclusions appended) and analyzes.
     */
    public CoverageSummary analyze(String projectRoot, String targetModules, String targetPackages,
                                   String targetClasses) {
        if (projectRoot == null || projectRoot.isBlank()) {
            return CoverageSummary.failure(new AgentToolException(AgentToolException.ErrorCode.INVALID_ARGUMENT,
                    "projectRoot is required").toAgentMessage());
        }

        Path root;
        try {
            root = Paths.get(projectRoot.trim());
        } catch (InvalidPathException e) {
            return CoverageSummary.failure(new AgentToolException(AgentToolException.ErrorCode.INVALID_ARGUMENT,
                    "Invalid project root: " + projectRoot, e.getMessage()).toAgentMessage());
        }

        ScopeQuery query;
        try {
            query = ScopeQuery.fromCsv(targetModules, targetPackages, targetClasses, config.getExcludePatterns());
        } catch (PatternSyntaxException e) {
            return CoverageSummary.failure(new AgentToolException(AgentToolException.ErrorCode.CONFIG_INVALID,
                    "Invalid exclude pattern: " + e.getPattern(), e.getDescription()).toAgentMessage());
        }
        return analyze(root, query);
    }

    public CoverageSummary analyze(Path projectRoot, ScopeQuery query) {
        Path root = projectRoot.toAbsolutePath().normalize();
        log.info("Analyzing coverage under {} (modules={}, packages={}, classes={})",
                root, query.targetModules(), query.targetPackages(), query.targetClasses());

        try {
            List<Path> reports = locator.locate(root, query);
            return aggregator.aggregate(root, reports, query);
        } catch (RuntimeException e) {
            log.error("Coverage analysis failed for {}", root, e);
            return CoverageSummary.failure(new AgentToolException(AgentToolException.ErrorCode.UNKNOWN_ERROR,
                    "Coverage analysis failed: " + e.getMessage(), root.toString(), e).toAgentMessage());
        }
    }
}
