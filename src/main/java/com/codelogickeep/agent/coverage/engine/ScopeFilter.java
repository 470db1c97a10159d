package com.codelogickeep.agent.coverage.engine;

import com.codelogickeep.agent.coverage.model.ScopeQuery;

import java.util.regex.Pattern;

/**
 * Decides whether a class takes part in aggregation.
 * <p>
 * Exclusion patterns win over everything, including explicit class targets. Without package or
 * class targets every remaining class is in scope; otherwise a class must match one of them.
 */
public final class ScopeFilter {

    private ScopeFilter() {
    }

    /**
     * @param className fully qualified, dot-separated class name
     * @param query     scope of the current request
     * @return {@code true} if the class is counted
     */
    public static boolean isIncluded(String className, ScopeQuery query) {
        if (className == null || className.isEmpty()) {
            return false;
        }

        if (isExcluded(className, query)) {
            return false;
        }

        if (!query.hasClassScope()) {
            return true;
        }

        for (String pkg : query.targetPackages()) {
            if (className.startsWith(pkg)) {
                return true;
            }
        }

        for (String target : query.targetClasses()) {
            // simple names are accepted as well as fully qualified ones
            if (className.equals(target) || className.endsWith("." + target)) {
                return true;
            }
        }

        return false;
    }

    static boolean isExcluded(String className, ScopeQuery query) {
        for (Pattern pattern : query.exclusionPatterns()) {
            if (pattern.matcher(className).find()) {
                return true;
            }
        }
        return false;
    }
}
