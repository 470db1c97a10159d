package com.codelogickeep.agent.coverage.tools;

import com.codelogickeep.agent.coverage.engine.CoverageAnalysisEngine;
import com.codelogickeep.agent.coverage.model.CoverageSummary;
import com.codelogickeep.agent.coverage.util.JsonUtil;
import dev.langchain4j.agent.tool.P;
import dev.langchain4j.agent.tool.Tool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Agent-facing coverage tool. Read-only: it never runs builds or tests.
 */
public class CoverageTool implements AgentTool {
    private static final Logger log = LoggerFactory.getLogger(CoverageTool.class);

    private final CoverageAnalysisEngine engine;

    public CoverageTool(CoverageAnalysisEngine engine) {
        this.engine = engine;
    }

    @Tool("Parse JaCoCo XML coverage reports and return overall line/branch coverage (0.0-1.0) for the requested scope "
            + "plus the worst-covered classes (lowest first, 20 by default). Checks TESTING_STANDARDS.md for a custom report path first. "
            + "Requires tests to have been executed with JaCoCo enabled.")
    public String readCoverageReport(
            @P("Path to the project root directory") String projectRoot,
            @P("Optional comma-separated module directories relative to the root (e.g. 'services/acm-service'). "
                    + "Only steers which reports are read.") String targetModules,
            @P("Optional comma-separated package prefixes (e.g. 'com.example.order,com.example.billing')") String targetPackages,
            @P("Optional comma-separated simple or fully qualified class names (e.g. 'UserService, com.example.AuthController')") String targetClasses) {

        log.info("Tool Input - readCoverageReport: projectRoot={}, targetModules={}, targetPackages={}, targetClasses={}",
                projectRoot, targetModules, targetPackages, targetClasses);

        CoverageSummary summary = engine.analyze(projectRoot, targetModules, targetPackages, targetClasses);
        String result = JsonUtil.toJson(summary);

        if (summary instanceof CoverageSummary.Success success) {
            log.info("Tool Output - readCoverageReport: line={}, branch={}, worstClasses={}",
                    String.format("%.1f%%", success.lineCoverage() * 100),
                    String.format("%.1f%%", success.branchCoverage() * 100),
                    success.worstClasses().size());
        } else {
            log.info("Tool Output - readCoverageReport: failure, length={}", result.length());
        }
        return result;
    }
}
