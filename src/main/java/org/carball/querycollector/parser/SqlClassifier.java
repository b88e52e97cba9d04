package org.carball.querycollector.parser;

import lombok.extern.slf4j.Slf4j;
import org.carball.querycollector.model.query.QueryType;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies raw SQL statements and pulls out the tables they touch.
 *
 * <p>Both operations are heuristics over the statement text, not a SQL parser. Schema-qualified names are kept
 * as a single token, aliases are ignored, and tables referenced only inside subqueries are found only when a
 * {@code FROM} or {@code JOIN} marker precedes them. Neither method throws: on any internal failure they degrade
 * to {@link QueryType#OTHER} or to whatever tables were found so far.
 */
@Slf4j
public class SqlClassifier {

    private static final QueryType[] LEADING_KEYWORDS = {
        QueryType.SELECT,
        QueryType.INSERT,
        QueryType.UPDATE,
        QueryType.DELETE,
        QueryType.CREATE,
        QueryType.DROP,
        QueryType.ALTER
    };

    // Patterns run against the uppercased statement
    private static final Pattern FROM_PATTERN = Pattern.compile("\\bFROM\\s+([^\\s,]+)");
    private static final Pattern JOIN_PATTERN = Pattern.compile("\\bJOIN\\s+([^\\s,]+)");
    private static final Pattern INSERT_PATTERN = Pattern.compile("\\bINSERT\\s+INTO\\s+([^\\s,(]+)");
    private static final Pattern UPDATE_PATTERN = Pattern.compile("\\bUPDATE\\s+([^\\s,]+)");
    private static final Pattern DELETE_PATTERN = Pattern.compile("\\bDELETE\\s+FROM\\s+([^\\s,]+)");

    private static final String QUOTE_CHARACTERS = "\"'`";

    private SqlClassifier() {
        // Utility class - prevent instantiation
    }

    /**
     * Classifies a statement by its leading keyword, ignoring case and surrounding whitespace.
     */
    public static QueryType classify(String sql) {
        if (sql == null) {
            return QueryType.OTHER;
        }
        try {
            String normalized = sql.strip().toUpperCase(Locale.ROOT);
            for (QueryType type : LEADING_KEYWORDS) {
                if (normalized.startsWith(type.name())) {
                    return type;
                }
            }
        } catch (RuntimeException e) {
            log.debug("Could not classify statement, treating as OTHER: {}", e.getMessage());
        }
        return QueryType.OTHER;
    }

    /**
     * Extracts lowercase table names in first-seen order without duplicates.
     *
     * <p>{@code FROM}, {@code INSERT INTO}, {@code UPDATE} and {@code DELETE FROM} contribute their first
     * occurrence only; every {@code JOIN} is scanned.
     */
    public static List<String> extractTableNames(String sql) {
        LinkedHashSet<String> tables = new LinkedHashSet<>();
        if (sql == null || sql.isBlank()) {
            return new ArrayList<>(tables);
        }
        try {
            String upper = sql.toUpperCase(Locale.ROOT);

            addFirstMatch(FROM_PATTERN, upper, tables);
            Matcher joins = JOIN_PATTERN.matcher(upper);
            while (joins.find()) {
                addCandidate(joins.group(1), tables);
            }
            addFirstMatch(INSERT_PATTERN, upper, tables);
            addFirstMatch(UPDATE_PATTERN, upper, tables);
            addFirstMatch(DELETE_PATTERN, upper, tables);
        } catch (RuntimeException | StackOverflowError e) {
            log.debug("Table extraction stopped early after {} table(s): {}", tables.size(), e.getMessage());
        }
        return new ArrayList<>(tables);
    }

    private static void addFirstMatch(Pattern pattern, String sql, LinkedHashSet<String> tables) {
        Matcher matcher = pattern.matcher(sql);
        if (matcher.find()) {
            addCandidate(matcher.group(1), tables);
        }
    }

    private static void addCandidate(String token, LinkedHashSet<String> tables) {
        if (token.startsWith("(")) {
            return; // subquery, not a table
        }
        String table = stripQuotes(trimStatementTerminator(token));
        if (!table.isEmpty()) {
            tables.add(table.toLowerCase(Locale.ROOT));
        }
    }

    private static String trimStatementTerminator(String token) {
        int end = token.length();
        while (end > 0 && (token.charAt(end - 1) == ';' || token.charAt(end - 1) == ')')) {
            end--;
        }
        return token.substring(0, end);
    }

    private static String stripQuotes(String token) {
        int start = 0;
        int end = token.length();
        while (start < end && QUOTE_CHARACTERS.indexOf(token.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && QUOTE_CHARACTERS.indexOf(token.charAt(end - 1)) >= 0) {
            end--;
        }
        return token.substring(start, end);
    }
}
