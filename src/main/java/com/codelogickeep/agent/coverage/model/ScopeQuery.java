package com.codelogickeep.agent.coverage.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Immutable filter settings for one aggregation request.
 * <p>
 * {@code targetModules} steers report discovery only; packages, classes and the exclusion
 * patterns decide which classes are counted.
 * <p>
 * The exclusion list given to the constructor is treated as extras: {@link #BUILT_IN_EXCLUSIONS}
 * are always placed first and cannot be removed.
 */
public record ScopeQuery(Set<String> targetModules,
                         Set<String> targetPackages,
                         Set<String> targetClasses,
                         List<Pattern> exclusionPatterns) {

    /**
     * Package and class-name markers of code that never needs hand-written tests:
     * generated sources, DTOs, model/entity holders and exception types.
     */
    public static final List<Pattern> BUILT_IN_EXCLUSIONS = List.of(
            Pattern.compile("\\.generated\\.", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\.dtos?\\.", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\.models?\\.", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\.exceptions?\\.", Pattern.CASE_INSENSITIVE),
            Pattern.compile("DTO$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("Exception$", Pattern.CASE_INSENSITIVE)
    );

    public ScopeQuery {
        targetModules = freeze(targetModules);
        targetPackages = freeze(targetPackages);
        targetClasses = freeze(targetClasses);
        exclusionPatterns = withBuiltIns(exclusionPatterns);
    }

    /**
     * Query without any scoping; only the built-in exclusions apply.
     */
    public static ScopeQuery unscoped() {
        return new ScopeQuery(Set.of(), Set.of(), Set.of(), List.of());
    }

    /**
     * Build a query from the comma-separated lists an agent passes in.
     * Entries are trimmed and blank entries dropped; {@code null} means "no restriction".
     */
    public static ScopeQuery fromCsv(String targetModules, String targetPackages, String targetClasses) {
        return fromCsv(targetModules, targetPackages, targetClasses, List.of());
    }

    /**
     * Same as {@link #fromCsv(String, String, String)} with additional case-insensitive
     * exclusion regexes appended to the built-in set.
     */
    public static ScopeQuery fromCsv(String targetModules, String targetPackages, String targetClasses,
                                     Collection<String> extraExclusions) {
        Set<String> packages = new LinkedHashSet<>();
        for (String pkg : splitCsv(targetPackages)) {
            packages.add(pkg.replace('/', '.'));
        }

        List<Pattern> patterns = new ArrayList<>();
        if (extraExclusions != null) {
            for (String regex : extraExclusions) {
                if (regex != null && !regex.isBlank()) {
                    patterns.add(Pattern.compile(regex.trim(), Pattern.CASE_INSENSITIVE));
                }
            }
        }

        return new ScopeQuery(splitCsv(targetModules), packages, splitCsv(targetClasses), patterns);
    }

    public static Set<String> splitCsv(String csv) {
        Set<String> result = new LinkedHashSet<>();
        if (csv == null || csv.isBlank()) {
            return result;
        }
        for (String part : csv.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return result;
    }

    public boolean hasClassScope() {
        return !targetPackages.isEmpty() || !targetClasses.isEmpty();
    }

    // built-ins always lead; extras equal to a built-in are dropped
    private static List<Pattern> withBuiltIns(List<Pattern> extras) {
        if (extras == null || extras.isEmpty()) {
            return BUILT_IN_EXCLUSIONS;
        }
        List<Pattern> merged = new ArrayList<>(BUILT_IN_EXCLUSIONS);
        for (Pattern extra : extras) {
            if (extra != null && !isBuiltIn(extra)) {
                merged.add(extra);
            }
        }
        return List.copyOf(merged);
    }

    private static boolean isBuiltIn(Pattern pattern) {
        for (Pattern builtIn : BUILT_IN_EXCLUSIONS) {
            if (builtIn.pattern().equals(pattern.pattern()) && builtIn.flags() == pattern.flags()) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> freeze(Set<String> values) {
        if (values == null || values.isEmpty()) {
            return Set.of();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }
}
