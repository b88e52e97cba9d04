package org.carball.querycollector.parser;

import lombok.extern.slf4j.Slf4j;

import java.util.regex.Pattern;

/**
 * Reduces a statement to its shape so that executions differing only in literal values group together.
 *
 * <p>Only {@code IN (...)} lists and the right-hand side of {@code =} comparisons are replaced. Literals in
 * other positions ({@code LIMIT 10}, {@code > 5}, {@code VALUES (1)}) stay in the shape.
 */
@Slf4j
public class SqlPatternNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern IN_LIST = Pattern.compile("\\bIN\\s*\\([^)]+\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern EQUALS_PARAMETER = Pattern.compile("=\\s*(?:\\?|%s|\\$\\d+|:\\w+)");
    private static final Pattern EQUALS_INTEGER = Pattern.compile("=\\s*-?\\d+(?![\\w.])");
    private static final Pattern EQUALS_STRING = Pattern.compile("=\\s*'[^']*+(?:''[^']*+)*+'");

    private SqlPatternNormalizer() {
        // Utility class - prevent instantiation
    }

    public static String normalize(String sql) {
        if (sql == null) {
            return "";
        }
        String collapsed = WHITESPACE.matcher(sql).replaceAll(" ").strip();
        try {
            String normalized = IN_LIST.matcher(collapsed).replaceAll("IN (?)");
            normalized = EQUALS_PARAMETER.matcher(normalized).replaceAll("= ?");
            normalized = EQUALS_INTEGER.matcher(normalized).replaceAll("= ?");
            return EQUALS_STRING.matcher(normalized).replaceAll("= ?");
        } catch (RuntimeException | StackOverflowError e) {
            log.debug("Literal replacement failed, using whitespace-collapsed statement: {}", e.toString());
            return collapsed;
        }
    }
}
