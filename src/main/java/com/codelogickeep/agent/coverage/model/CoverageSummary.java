package com.codelogickeep.agent.coverage.model;

import java.util.List;
import java.util.Objects;

/**
 * Final result of one aggregation request.
 * <p>
 * A {@link Success} carries the scope-local metrics, a {@link Failure} only the reason.
 */
public sealed interface CoverageSummary permits CoverageSummary.Success, CoverageSummary.Failure {

    boolean isSuccess();

    static CoverageSummary success(double lineCoverage, double branchCoverage, List<String> worstClasses) {
        return new Success(lineCoverage, branchCoverage, worstClasses);
    }

    static CoverageSummary failure(String error) {
        return new Failure(error);
    }

    record Success(double lineCoverage, double branchCoverage, List<String> worstClasses)
            implements CoverageSummary {

        public Success {
            requireRatio("lineCoverage", lineCoverage);
            requireRatio("branchCoverage", branchCoverage);
            worstClasses = worstClasses != null ? List.copyOf(worstClasses) : List.of();
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        private static void requireRatio(String name, double value) {
            if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be within [0, 1]: " + value);
            }
        }
    }

    record Failure(String error) implements CoverageSummary {

        public Failure {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
