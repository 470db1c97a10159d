package com.codelogickeep.agent.coverage.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class AppConfig {
    private CoverageConfig coverage = new CoverageConfig();

    @Data
    public static class CoverageConfig {
        /**
         * Project document that may override the report location ("Report Path: ...").
         * Blank disables the override lookup.
         */
        @JsonProperty("standards-file")
        private String standardsFile = "TESTING_STANDARDS.md";

        /**
         * Aggregate report locations under the project root, highest priority first.
         */
        @JsonProperty("root-report-paths")
        private List<String> rootReportPaths = new ArrayList<>(List.of(
                "build/reports/jacoco/root/jacocoRootReport.xml",
                "target/site/jacoco-aggregate/jacoco.xml",
                "build/reports/jacoco/test/jacocoTestReport.xml",
                "target/site/jacoco/jacoco.xml"));

        /**
         * Report locations relative to a module directory, probed in order.
         */
        @JsonProperty("module-report-paths")
        private List<String> moduleReportPaths = new ArrayList<>(List.of(
                "build/reports/jacoco/test/jacocoTestReport.xml",
                "target/site/jacoco/jacoco.xml"));

        /**
         * File names matched by the recursive fallback search.
         */
        @JsonProperty("report-file-names")
        private List<String> reportFileNames = new ArrayList<>(List.of(
                "jacocoTestReport.xml",
                "jacocoRootReport.xml",
                "jacoco.xml"));

        @JsonProperty("search-max-depth")
        private int searchMaxDepth = 30; // 递归搜索最大目录深度

        @JsonProperty("worst-class-limit")
        private int worstClassLimit = 20; // 返回的最低覆盖率类数量上限

        private int parallelism = 0; // 解析线程数，0 表示按 CPU 核数

        /**
         * Extra case-insensitive regexes appended to the built-in class exclusions.
         */
        @JsonProperty("exclude-patterns")
        private List<String> excludePatterns = new ArrayList<>();

        public int effectiveParallelism() {
            return parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
        }
    }
}
