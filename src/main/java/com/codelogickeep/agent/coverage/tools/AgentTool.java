package com.codelogickeep.agent.coverage.tools;

/**
 * Marker for classes whose {@code @Tool} methods are exposed to the orchestrating agent.
 */
public interface AgentTool {
}
