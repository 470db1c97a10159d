package com.codelogickeep.agent.coverage.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of parsing a single report file. The aggregator decides what to do with {@link Failed}.
 */
public sealed interface ReportParseResult permits ReportParseResult.Parsed, ReportParseResult.Failed {

    Path reportPath();

    boolean isParsed();

    static ReportParseResult parsed(Path reportPath, Counter lineTotals, Counter branchTotals,
                                    List<ClassCoverageRecord> classRecords) {
        return new Parsed(reportPath, lineTotals, branchTotals, classRecords);
    }

    static ReportParseResult failed(Path reportPath, String message, Throwable cause) {
        return new Failed(reportPath, message, cause);
    }

    /**
     * Counters summed over the in-scope classes of one report, plus their ranking records.
     */
    record Parsed(Path reportPath, Counter lineTotals, Counter branchTotals,
                  List<ClassCoverageRecord> classRecords) implements ReportParseResult {

        public Parsed {
            lineTotals = lineTotals != null ? lineTotals : Counter.EMPTY;
            branchTotals = branchTotals != null ? branchTotals : Counter.EMPTY;
            classRecords = classRecords != null ? List.copyOf(classRecords) : List.of();
        }

        @Override
        public boolean isParsed() {
            return true;
        }
    }

    record Failed(Path reportPath, String message, Throwable cause) implements ReportParseResult {

        @Override
        public boolean isParsed() {
            return false;
        }
    }
}
