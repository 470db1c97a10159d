package com.codelogickeep.agent.coverage.model;

/**
 * JaCoCo counter kinds that take part in aggregation. Other kinds (INSTRUCTION, METHOD, ...) are ignored.
 */
public enum CounterType {
    LINE,
    BRANCH;

    /**
     * Resolve the {@code type} attribute of a {@code counter} element.
     *
     * @return the matching type, or {@code null} for kinds that are not aggregated
     */
    public static CounterType fromAttribute(String value) {
        if (value == null) {
            return null;
        }
        for (CounterType type : values()) {
            if (type.name().equals(value)) {
                return type;
            }
        }
        return null;
    }
}
