package org.sqltx.retry;

import java.util.Locale;
import java.util.Set;

/**
 * Rewrites a {@code SELECT} into a historical read with {@code AS OF SYSTEM TIME}.
 *
 * <p>The clause belongs right after the {@code FROM} list, so it is inserted before the
 * first top-level {@code WHERE}, {@code GROUP BY}, {@code HAVING}, {@code WINDOW},
 * {@code ORDER BY}, {@code LIMIT}, {@code OFFSET}, {@code FETCH} or {@code FOR} and
 * otherwise appended. Keywords inside string literals, quoted identifiers, comments and
 * parentheses are ignored.</p>
 *
 * <p>A plain interval such as {@code -5s} or a timestamp is embedded as a string literal.
 * An already quoted literal or a function call such as {@link #followerReads()} is embedded
 * as given.</p>
 */
public final class AsOfSystemTime {

    public static final String FOLLOWER_READ_TIMESTAMP = "follower_read_timestamp()";

    private static final Set<String> CLAUSE_KEYWORDS = Set.of(
            "WHERE", "GROUP", "HAVING", "WINDOW", "ORDER", "LIMIT", "OFFSET", "FETCH", "FOR");

    private AsOfSystemTime() {
    }

    /**
     * @return the expression for the closest timestamp a follower replica can serve
     */
    public static String followerReads() {
        return FOLLOWER_READ_TIMESTAMP;
    }

    public static String apply(String query, String interval) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query cannot be null or blank");
        }
        String clause = "AS OF SYSTEM TIME " + toExpression(interval);

        String body = query.trim();
        String terminator = "";
        if (body.endsWith(";")) {
            body = body.substring(0, body.length() - 1).trim();
            terminator = ";";
        }

        int position = findClauseStart(body);
        if (position < 0) {
            return body + " " + clause + terminator;
        }
        String head = body.substring(0, position).trim();
        return head + " " + clause + " " + body.substring(position) + terminator;
    }

    static String toExpression(String interval) {
        if (interval == null || interval.isBlank()) {
            throw new IllegalArgumentException("interval cannot be null or blank");
        }
        String trimmed = interval.trim();
        if (trimmed.startsWith("'") || trimmed.endsWith(")")) {
            return trimmed;
        }
        return "'" + trimmed.replace("'", "''") + "'";
    }

    /**
     * @return index of the first top-level clause keyword, or -1
     */
    static int findClauseStart(String sql) {
        int depth = 0;
        int i = 0;
        int length = sql.length();
        while (i < length) {
            char c = sql.charAt(i);
            if (c == '\'' || c == '"') {
                i = skipQuoted(sql, i, c);
                continue;
            }
            if (c == '-' && i + 1 < length && sql.charAt(i + 1) == '-') {
                int eol = sql.indexOf('\n', i);
                i = eol < 0 ? length : eol + 1;
                continue;
            }
            if (c == '/' && i + 1 < length && sql.charAt(i + 1) == '*') {
                int end = sql.indexOf("*/", i + 2);
                i = end < 0 ? length : end + 2;
                continue;
            }
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && isWordStart(sql, i)) {
                int end = i;
                while (end < length && isWordPart(sql.charAt(end))) {
                    end++;
                }
                if (CLAUSE_KEYWORDS.contains(sql.substring(i, end).toUpperCase(Locale.ROOT))) {
                    return i;
                }
                i = end;
                continue;
            }
            i++;
        }
        return -1;
    }

    private static int skipQuoted(String sql, int start, char quote) {
        int i = start + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == quote) {
                // Doubled quote stays inside the literal
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return sql.length();
    }

    private static boolean isWordStart(String sql, int i) {
        return Character.isLetter(sql.charAt(i)) && (i == 0 || !isWordPart(sql.charAt(i - 1)));
    }

    private static boolean isWordPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }
}
