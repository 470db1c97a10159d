package com.codelogickeep.agent.coverage.util;

import com.codelogickeep.agent.coverage.model.CoverageSummary;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON rendering of coverage summaries for agents and the command line.
 * <p>
 * Both variants produce the same field set: {@code success, error, lineCoverage, branchCoverage,
 * worstClasses}. Failures report zero metrics and an empty class list.
 */
public class JsonUtil {

    private static final ObjectMapper mapper = new ObjectMapper();

    public static ObjectNode summaryToJson(CoverageSummary summary) {
        ObjectNode node = mapper.createObjectNode();
        node.put("success", summary.isSuccess());

        ArrayNode worst = mapper.createArrayNode();
        if (summary instanceof CoverageSummary.Success success) {
            node.putNull("error");
            node.put("lineCoverage", success.lineCoverage());
            node.put("branchCoverage", success.branchCoverage());
            success.worstClasses().forEach(worst::add);
        } else if (summary instanceof CoverageSummary.Failure failure) {
            node.put("error", failure.error());
            node.put("lineCoverage", 0.0);
            node.put("branchCoverage", 0.0);
        }
        node.set("worstClasses", worst);

        return node;
    }

    public static String toJson(CoverageSummary summary) {
        return write(summaryToJson(summary), false);
    }

    public static String toPrettyJson(CoverageSummary summary) {
        return write(summaryToJson(summary), true);
    }

    private static String write(ObjectNode node, boolean pretty) {
        try {
            return pretty
                    ? mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node)
                    : mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            // a tree of primitives cannot fail to serialize
            throw new IllegalStateException("Failed to serialize coverage summary", e);
        }
    }
}
