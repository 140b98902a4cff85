package com.dashkit.queryengine.connector;

import com.dashkit.queryengine.exception.QueryExecutionException;
import com.dashkit.queryengine.exception.ValidationException;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Lexical helpers shared by JDBC connectors.
 *
 * <p>Both scans skip quoted text ({@code '...'}, {@code "..."}, doubled-quote escapes) and
 * comments, so a {@code ;} or {@code $name} inside a string literal is left alone.
 */
final class SqlStatements {

    private SqlStatements() {
    }

    /**
     * Parameter-bound statement ready for {@link java.sql.PreparedStatement}.
     */
    @Value
    static class BoundSql {
        String sql;
        List<Object> values;

        boolean hasParameters() {
            return !values.isEmpty();
        }
    }

    /**
     * Rejects input holding more than one statement.
     *
     * @param sql raw SQL
     * @return the statement with trailing semicolons and whitespace removed
     * @throws QueryExecutionException if a second statement follows a {@code ;}
     */
    static String requireSingleStatement(String sql) {
        Scanner scanner = new Scanner(sql);
        int end = sql.length();
        while (scanner.hasNext()) {
            int i = scanner.nextCodePosition();
            if (i < 0) {
                break;
            }
            if (sql.charAt(i) == ';') {
                if (!sql.substring(i).replace(";", "").isBlank()) {
                    throw new QueryExecutionException("Multiple statements are not supported");
                }
                end = i;
                break;
            }
        }
        return sql.substring(0, end).strip();
    }

    /**
     * Rewrites {@code $name} placeholders found in {@code parameters} to JDBC {@code ?} markers.
     * Placeholders without a matching parameter are left untouched for the backend to report.
     *
     * @param sql single statement
     * @param parameters name to scalar value
     * @return rewritten SQL plus positional values
     */
    static BoundSql bindNamedParameters(String sql, Map<String, Object> parameters) {
        if (parameters == null || parameters.isEmpty() || sql.indexOf('$') < 0) {
            return new BoundSql(sql, Collections.emptyList());
        }
        StringBuilder out = new StringBuilder(sql.length());
        List<Object> values = new ArrayList<>();
        Scanner scanner = new Scanner(sql);
        int copied = 0;
        while (scanner.hasNext()) {
            int i = scanner.nextCodePosition();
            if (i < 0) {
                break;
            }
            if (sql.charAt(i) != '$' || i + 1 >= sql.length() || !isIdentifierStart(sql.charAt(i + 1))) {
                continue;
            }
            int j = i + 1;
            while (j < sql.length() && isIdentifierPart(sql.charAt(j))) {
                j++;
            }
            String name = sql.substring(i + 1, j);
            if (!parameters.containsKey(name)) {
                scanner.skipTo(j);
                continue;
            }
            Object value = parameters.get(name);
            if (value instanceof Map || value instanceof Collection || (value != null && value.getClass().isArray())) {
                throw new ValidationException("Parameter '" + name + "' must be a scalar value");
            }
            out.append(sql, copied, i).append('?');
            values.add(value);
            copied = j;
            scanner.skipTo(j);
        }
        out.append(sql, copied, sql.length());
        return new BoundSql(out.toString(), Collections.unmodifiableList(values));
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    /**
     * Walks SQL text yielding positions of characters that sit outside literals and comments.
     */
    private static final class Scanner {
        private final String sql;
        private int pos;

        private Scanner(String sql) {
            this.sql = sql;
        }

        boolean hasNext() {
            return pos < sql.length();
        }

        void skipTo(int index) {
            pos = index;
        }

        /**
         * @return index of the next code character, or -1 when only literals/comments remain
         */
        int nextCodePosition() {
            while (pos < sql.length()) {
                char c = sql.charAt(pos);
                if (c == '\'' || c == '"') {
                    pos = skipQuoted(pos, c);
                } else if (c == '-' && pos + 1 < sql.length() && sql.charAt(pos + 1) == '-') {
                    int eol = sql.indexOf('\n', pos);
                    pos = eol < 0 ? sql.length() : eol + 1;
                } else if (c == '/' && pos + 1 < sql.length() && sql.charAt(pos + 1) == '*') {
                    int close = sql.indexOf("*/", pos + 2);
                    pos = close < 0 ? sql.length() : close + 2;
                } else {
                    return pos++;
                }
            }
            return -1;
        }

        private int skipQuoted(int start, char quote) {
            int i = start + 1;
            while (i < sql.length()) {
                if (sql.charAt(i) == quote) {
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
    }
}
