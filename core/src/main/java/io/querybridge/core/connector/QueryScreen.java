package io.querybridge.core.connector;

import io.querybridge.core.model.ProcessedQuery;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/** Screens query text for script and SQL injection markers. */
final class QueryScreen {

    private static final List<Pattern> XSS = List.of(
            Pattern.compile("<\\s*script", Pattern.CASE_INSENSITIVE),
            Pattern.compile("<\\s*(iframe|object|embed)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("javascript\\s*:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bon\\w+\\s*=", Pattern.CASE_INSENSITIVE));

    private static final List<Pattern> SQL_INJECTION = List.of(
            Pattern.compile("\\bunion\\b\\s+(all\\s+)?\\bselect\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile(";\\s*(drop|delete|insert|update|alter|create|truncate|exec)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("'\\s*(or|and)\\s+'?\\w+'?\\s*=\\s*'?\\w+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bdrop\\s+table\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(--|/\\*|\\*/)"));

    private QueryScreen() {
        // utility class
    }

    /** Threat classes found in {@code query}; empty when it is clean. */
    static List<String> threats(ProcessedQuery query) {
        List<String> threats = new ArrayList<>();
        String text = query.normalized();
        if (XSS.stream().anyMatch(p -> p.matcher(text).find())) {
            threats.add("XSS");
        }
        if (SQL_INJECTION.stream().anyMatch(p -> p.matcher(text).find())) {
            threats.add("SQL Injection");
        }
        if (query.securityInfo() != null && !query.securityInfo().secure()) {
            for (String threat : query.securityInfo().threats()) {
                if (!threats.contains(threat)) {
                    threats.add(threat);
                }
            }
        }
        return threats;
    }
}
