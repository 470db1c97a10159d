package com.codelogickeep.agent.coverage.engine;

import com.codelogickeep.agent.coverage.exception.AgentToolException;
import com.codelogickeep.agent.coverage.model.ClassCoverageRecord;
import com.codelogickeep.agent.coverage.model.Counter;
import com.codelogickeep.agent.coverage.model.CoverageSummary;
import com.codelogickeep.agent.coverage.model.ReportParseResult;
import com.codelogickeep.agent.coverage.model.ScopeQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Parses a set of reports in parallel and folds them into one {@link CoverageSummary}.
 * <p>
 * Each worker owns one file and returns an immutable {@link ReportParseResult}; the merge runs on the
 * calling thread once every worker has finished. Reports that fail to parse are logged and skipped
 * as long as at least one report succeeds.
 */
public class CoverageAggregator {
    private static final Logger log = LoggerFactory.getLogger(CoverageAggregator.class);

    private static final Comparator<ClassCoverageRecord> WORST_FIRST =
            Comparator.comparingDouble(ClassCoverageRecord::coverageRatio)
                    .thenComparing(ClassCoverageRecord::className);

    private final StreamingReportParser parser;
    private final int parallelism;
    private final int worstClassLimit;

    public CoverageAggregator(StreamingReportParser parser, int parallelism, int worstClassLimit) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive: " + parallelism);
        }
        if (worstClassLimit <= 0) {
            throw new IllegalArgumentException("worstClassLimit must be positive: " + worstClassLimit);
        }
        this.parser = parser;
        this.parallelism = parallelism;
        this.worstClassLimit = worstClassLimit;
    }

    /**
     * @param projectRoot root that was searched, used in the failure message when {@code reports} is empty
     * @param reports     report files from {@link ReportLocator}
     * @param query       scope applied to every report
     */
    public CoverageSummary aggregate(Path projectRoot, List<Path> reports, ScopeQuery query) {
        if (reports == null || reports.isEmpty()) {
            return CoverageSummary.failure(new AgentToolException(
                    AgentToolException.ErrorCode.COVERAGE_REPORT_NOT_FOUND,
                    "No coverage reports found under " + projectRoot,
                    "Checked the standards file override, module reports, root reports and a recursive search")
                    .toAgentMessage());
        }

        List<ReportParseResult> results;
        try {
            results = parseAll(reports, query);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Coverage aggregation interrupted after dispatching {} report(s)", reports.size());
            return CoverageSummary.failure("Coverage aggregation was interrupted");
        }
        return summarize(results);
    }

    /**
     * Merges per-file results. Counters are summed, class records concatenated without
     * de-duplication, then ranked ascending and truncated.
     */
    public CoverageSummary summarize(List<ReportParseResult> results) {
        Counter lines = Counter.EMPTY;
        Counter branches = Counter.EMPTY;
        List<ClassCoverageRecord> classes = new ArrayList<>();
        List<ReportParseResult.Failed> failures = new ArrayList<>();

        for (ReportParseResult result : results) {
            if (result instanceof ReportParseResult.Parsed parsed) {
                lines = lines.plus(parsed.lineTotals());
                branches = branches.plus(parsed.branchTotals());
                classes.addAll(parsed.classRecords());
            } else if (result instanceof ReportParseResult.Failed failed) {
                log.warn("Skipping coverage report {}: {}", failed.reportPath(), failed.message());
                failures.add(failed);
            }
        }

        // 全部失败才算失败，部分失败只跳过
        if (failures.size() == results.size()) {
            String detail = failures.isEmpty() ? "no results" : failures.get(0).message();
            return CoverageSummary.failure(new AgentToolException(
                    AgentToolException.ErrorCode.COVERAGE_ALL_REPORTS_FAILED,
                    "Failed to parse all " + failures.size() + " coverage report(s)",
                    "First error: " + detail)
                    .toAgentMessage());
        }

        List<String> worstClasses = classes.stream()
                .sorted(WORST_FIRST)
                .limit(worstClassLimit)
                .map(ClassCoverageRecord::className)
                .collect(Collectors.toList());

        log.info("Aggregated {} report(s) ({} skipped): line {}/{}, branch {}/{}, {} ranked classes",
                results.size() - failures.size(), failures.size(),
                lines.covered(), lines.total(), branches.covered(), branches.total(), classes.size());

        return CoverageSummary.success(lines.ratio(), branches.ratio(), worstClasses);
    }

    private List<ReportParseResult> parseAll(List<Path> reports, ScopeQuery query) throws InterruptedException {
        int threads = Math.min(parallelism, reports.size());
        ExecutorService pool = Executors.newFixedThreadPool(threads, new ParserThreadFactory());
        try {
            List<Callable<ReportParseResult>> tasks = new ArrayList<>();
            for (Path report : reports) {
                tasks.add(() -> parser.parse(report, query));
            }

            // 结果按输入顺序收集，合并在调用线程中完成
            List<Future<ReportParseResult>> futures = pool.invokeAll(tasks);
            List<ReportParseResult> results = new ArrayList<>(futures.size());
            for (int i = 0; i < futures.size(); i++) {
                Path report = reports.get(i);
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    results.add(ReportParseResult.failed(report,
                            "Unexpected error while parsing " + report + ": " + cause, cause));
                }
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    private static final class ParserThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "coverage-parser-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
