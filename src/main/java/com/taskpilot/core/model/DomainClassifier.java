package com.taskpilot.core.model;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Infers the routing domain of a task from its required skills and title.
 * <p>
 * The domain is what the spawn guard is consulted with, so it must be stable for
 * a given task record.
 */
public final class DomainClassifier {

    public static final String DEFAULT_DOMAIN = "engineering";

    private record DomainPattern(String domain, Pattern pattern) {}

    // First match wins
    private static final List<DomainPattern> DOMAIN_PATTERNS = List.of(
            new DomainPattern("marketing", Pattern.compile("market|campaign|thread|article|tweet|copy")),
            new DomainPattern("design", Pattern.compile("design|\\bux\\b|\\bui\\b|a11y")),
            new DomainPattern("operations", Pattern.compile("\\bops\\b|runbook|incident|reliability")),
            new DomainPattern("sales", Pattern.compile("sales|\\bdeal\\b|pipeline"))
    );

    private DomainClassifier() {}

    /**
     * @param explicitDomain domain field on the task record, wins when non-blank
     * @param requiredSkills skill tags, scanned before the title
     * @param title          task title
     * @return a lower-case domain, {@value #DEFAULT_DOMAIN} when nothing matches
     */
    public static String infer(String explicitDomain, List<String> requiredSkills, String title) {
        if (explicitDomain != null && !explicitDomain.isBlank()) {
            return explicitDomain.trim().toLowerCase(Locale.ROOT);
        }
        String skills = requiredSkills == null ? "" : String.join(" ", requiredSkills);
        String haystack = (skills + " " + (title == null ? "" : title)).toLowerCase(Locale.ROOT);
        for (DomainPattern candidate : DOMAIN_PATTERNS) {
            if (candidate.pattern().matcher(haystack).find()) {
                return candidate.domain();
            }
        }
        return DEFAULT_DOMAIN;
    }
}
