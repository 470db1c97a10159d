package com.codelogickeep.agent.coverage.engine;

import com.codelogickeep.agent.coverage.config.AppConfig;
import com.codelogickeep.agent.coverage.model.ScopeQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Finds the JaCoCo XML reports to aggregate for a request.
 * <p>
 * Resolution order, first tier with a hit wins:
 * <ol>
 *     <li>report path declared in the project's standards document</li>
 *     <li>conventional report of each requested module</li>
 *     <li>first existing conventional aggregate report at the project root</li>
 *     <li>every report file found by walking the tree</li>
 * </ol>
 */
public class ReportLocator {
    private static final Logger log = LoggerFactory.getLogger(ReportLocator.class);

    // e.g. "Report Path: build/custom/jacoco.xml" or "- Jacoco XML Report: `reports/all.xml`"
    private static final Pattern REPORT_PATH_DIRECTIVE =
            Pattern.compile("(?:Report Path|Jacoco.*Report):\\s*(\\S+)", Pattern.CASE_INSENSITIVE);

    private final AppConfig.CoverageConfig config;

    public ReportLocator(AppConfig.CoverageConfig config) {
        this.config = config;
    }

    /**
     * @return existing report files as normalized absolute paths, without duplicates; empty if none
     */
    public List<Path> locate(Path projectRoot, ScopeQuery query) {
        Path root = projectRoot.toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            log.warn("Project root is not a directory: {}", root);
            return List.of();
        }

        Optional<Path> override = findOverride(root);
        if (override.isPresent()) {
            log.info("Using report path from {}: {}", config.getStandardsFile(), override.get());
            return List.of(override.get());
        }

        if (!query.targetModules().isEmpty()) {
            List<Path> moduleReports = findModuleReports(root, query.targetModules());
            if (!moduleReports.isEmpty()) {
                log.info("Found {} module report(s) for modules {}", moduleReports.size(), query.targetModules());
                return moduleReports;
            }
            log.info("No module report found for {}, falling back to root reports", query.targetModules());
        }

        Optional<Path> rootReport = firstExisting(root, config.getRootReportPaths());
        if (rootReport.isPresent()) {
            log.info("Using root report: {}", rootReport.get());
            return List.of(rootReport.get());
        }

        // 兜底：递归搜索整个项目
        List<Path> found = searchRecursively(root);
        log.info("Recursive search under {} found {} report(s)", root, found.size());
        return found;
    }

    Optional<Path> findOverride(Path root) {
        String standardsFile = config.getStandardsFile();
        if (standardsFile == null || standardsFile.isBlank()) {
            return Optional.empty();
        }

        Path standards = root.resolve(standardsFile);
        if (!Files.isRegularFile(standards)) {
            return Optional.empty();
        }

        String content;
        try {
            content = Files.readString(standards, StandardCharsets.UTF_8);
        } catch (IOException | UncheckedIOException e) {
            log.warn("Failed to read {}, ignoring report path override: {}", standards, e.getMessage());
            return Optional.empty();
        }

        Matcher matcher = REPORT_PATH_DIRECTIVE.matcher(content);
        if (!matcher.find()) {
            return Optional.empty();
        }

        String declared = stripQuotes(matcher.group(1));
        try {
            Path candidate = root.resolve(declared).normalize();
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
            log.warn("Report path '{}' declared in {} does not exist", declared, standards);
        } catch (InvalidPathException e) {
            log.warn("Report path '{}' declared in {} is not a valid path", declared, standards);
        }
        return Optional.empty();
    }

    List<Path> findModuleReports(Path root, Set<String> modules) {
        Set<Path> reports = new LinkedHashSet<>();
        for (String module : modules) {
            Path moduleDir;
            try {
                moduleDir = root.resolve(module).normalize();
            } catch (InvalidPathException e) {
                log.warn("Ignoring invalid module name: {}", module);
                continue;
            }
            if (!Files.isDirectory(moduleDir)) {
                log.debug("Module directory does not exist: {}", moduleDir);
                continue;
            }
            firstExisting(moduleDir, config.getModuleReportPaths()).ifPresentOrElse(
                    reports::add,
                    () -> log.debug("No coverage report in module {}", module));
        }
        return new ArrayList<>(reports);
    }

    List<Path> searchRecursively(Path root) {
        Set<String> names = config.getReportFileNames().stream()
                .filter(n -> n != null && !n.isBlank())
                .map(String::trim)
                .collect(Collectors.toSet());

        ReportFileCollector collector = new ReportFileCollector(names);
        try {
            Files.walkFileTree(root, EnumSet.noneOf(FileVisitOption.class), config.getSearchMaxDepth(), collector);
        } catch (IOException | UncheckedIOException e) {
            log.warn("Recursive report search under {} aborted: {}", root, e.getMessage());
        }
        return collector.reports();
    }

    /**
     * Collects report files by name. Unreadable entries are logged and skipped so one
     * inaccessible directory does not hide reports found elsewhere.
     */
    static final class ReportFileCollector extends SimpleFileVisitor<Path> {
        private final Set<String> names;
        private final Set<Path> found = new TreeSet<>();

        ReportFileCollector(Set<String> names) {
            this.names = names;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.isRegularFile() && file.getFileName() != null
                    && names.contains(file.getFileName().toString())) {
                found.add(file.toAbsolutePath().normalize());
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
            log.warn("Skipping unreadable path during report search: {} ({})", file, exc.toString());
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
            if (exc != null) {
                log.warn("Directory listing incomplete during report search: {} ({})", dir, exc.toString());
            }
            return FileVisitResult.CONTINUE;
        }

        List<Path> reports() {
            return new ArrayList<>(found);
        }
    }

    private Optional<Path> firstExisting(Path base, List<String> relativePaths) {
        if (relativePaths == null) {
            return Optional.empty();
        }
        for (String relative : relativePaths) {
            if (relative == null || relative.isBlank()) {
                continue;
            }
            Path candidate = base.resolve(relative.trim()).normalize();
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static String stripQuotes(String value) {
        String result = value.trim();
        while (result.length() > 1 && isQuote(result.charAt(0)) && isQuote(result.charAt(result.length() - 1))) {
            result = result.substring(1, result.length() - 1).trim();
        }
        return result;
    }

    private static boolean isQuote(char c) {
        return c == '`' || c == '"' || c == '\'';
    }
}
