package com.codelogickeep.agent.coverage.model;

import java.util.Objects;

/**
 * Line coverage of one class that survived scope filtering.
 */
public record ClassCoverageRecord(String className, Counter lineCounter) {

    public ClassCoverageRecord {
        Objects.requireNonNull(className, "className");
        Objects.requireNonNull(lineCounter, "lineCounter");
    }

    public double coverageRatio() {
        return lineCounter.ratio();
    }
}
