package org.lakeshift.migration.runner;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits migration text for drivers that accept one statement per call.
 * <p>
 * A {@code ;} ends a statement only outside {@code '...'} literals (doubled {@code ''}
 * included), backquoted identifiers and {@code --} comments. Leading comment lines of a
 * statement are dropped and comment-only segments are skipped.
 */
public final class SqlStatements {
    private SqlStatements() {
    }

    public static List<String> split(String sql) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int i = 0;
        int n = sql.length();
        while (i < n) {
            char ch = sql.charAt(i);
            if (ch == '\'' || ch == '`') {
                int end = closingQuote(sql, i + 1, ch);
                current.append(sql, i, end);
                i = end;
            } else if (ch == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
                int newline = sql.indexOf('\n', i);
                int end = newline < 0 ? n : newline;
                current.append(sql, i, end);
                i = end;
            } else if (ch == ';') {
                add(statements, current);
                current.setLength(0);
                i++;
            } else {
                current.append(ch);
                i++;
            }
        }
        add(statements, current);
        return statements;
    }

    /**
     * @return index just past the closing quote, or the end of input for an unterminated one
     */
    private static int closingQuote(String sql, int from, char quote) {
        int i = from;
        while (i < sql.length()) {
            char ch = sql.charAt(i);
            if (ch == '\\' && quote == '\'') {
                i += 2;
                continue;
            }
            if (ch == quote) {
                // '' 는 닫고 다시 여는 것과 같으므로 따로 처리하지 않는다
                return i + 1;
            }
            i++;
        }
        return sql.length();
    }

    private static void add(List<String> statements, StringBuilder segment) {
        String stmt = stripLeadingComments(segment.toString()).trim();
        if (!stmt.isEmpty()) {
            statements.add(stmt);
        }
    }

    private static String stripLeadingComments(String segment) {
        String rest = segment.stripLeading();
        while (rest.startsWith("--")) {
            int newline = rest.indexOf('\n');
            if (newline < 0) {
                return "";
            }
            rest = rest.substring(newline + 1).stripLeading();
        }
        return rest;
    }
}
