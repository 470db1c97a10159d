package com.codelogickeep.agent.coverage.exception;

/**
 * Unified exception for coverage tool errors.
 * Carries an error code, the offending context and a recovery hint so a calling agent can react.
 */
public class AgentToolException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String context;
    private final String suggestion;

    public AgentToolException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    public AgentToolException(ErrorCode errorCode, String message, String context) {
        this(errorCode, message, context, null);
    }

    public AgentToolException(ErrorCode errorCode, String message, String context, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.context = context;
        this.suggestion = errorCode.getSuggestion();
    }

    private AgentToolException(Builder builder) {
        super(builder.message);
        this.errorCode = builder.errorCode;
        this.context = builder.context;
        this.suggestion = builder.errorCode.getSuggestion();
    }

    public static Builder builder(ErrorCode errorCode, String message) {
        return new Builder(errorCode, message);
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getContext() {
        return context;
    }

    /**
     * Formats the error for agent consumption: code, message, context and suggestion.
     */
    public String toAgentMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("ERROR [").append(errorCode.getCode()).append("]: ").append(getMessage());

        if (context != null && !context.isEmpty()) {
            sb.append("\nContext: ").append(context);
        }

        if (suggestion != null && !suggestion.isEmpty()) {
            sb.append("\nSuggestion: ").append(suggestion);
        }

        return sb.toString();
    }

    @Override
    public String toString() {
        return toAgentMessage();
    }

    public static class Builder {
        private final ErrorCode errorCode;
        private final String message;
        private String context;

        private Builder(ErrorCode errorCode, String message) {
            this.errorCode = errorCode;
            this.message = message;
        }

        public Builder context(String context) {
            this.context = context;
            return this;
        }

        public AgentToolException build() {
            return new AgentToolException(this);
        }
    }

    /**
     * Error codes grouped by concern.
     */
    public enum ErrorCode {
        // Argument Errors (1xx)
        INVALID_ARGUMENT("E108", "Check the parameter value and try again."),

        // Coverage Errors (4xx)
        COVERAGE_REPORT_NOT_FOUND("E401",
                "Run the tests with JaCoCo enabled (e.g. 'gradle test jacocoTestReport' or 'mvn test jacoco:report')."),
        COVERAGE_PARSE_ERROR("E402", "Ensure the JaCoCo XML report is valid."),
        COVERAGE_ALL_REPORTS_FAILED("E404",
                "Regenerate the reports; every candidate file was malformed or unreadable."),

        // Configuration Errors (6xx)
        CONFIG_INVALID("E602", "Check the configuration file for syntax errors."),

        // General Errors (9xx)
        UNKNOWN_ERROR("E999", "Check the logs for more details.");

        private final String code;
        private final String suggestion;

        ErrorCode(String code, String suggestion) {
            this.code = code;
            this.suggestion = suggestion;
        }

        public String getCode() {
            return code;
        }

        public String getSuggestion() {
            return suggestion;
        }
    }
}
