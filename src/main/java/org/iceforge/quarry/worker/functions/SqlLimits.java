package org.iceforge.quarry.worker.functions;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Row caps applied to ad-hoc SELECT statements.
 */
public final class SqlLimits {
    /** LIMIT appended to SELECT/WITH statements that have none. */
    public static final int AUTO_LIMIT = 10_000;

    /** Rows returned to the caller; the true count is reported separately. */
    public static final int MAX_RESULT_ROWS = 1_000;

    private static final Pattern SINGLE_QUOTED = Pattern.compile("'[^']*'");
    private static final Pattern DOUBLE_QUOTED = Pattern.compile("\"[^\"]*\"");
    private static final Pattern LINE_COMMENT = Pattern.compile("--.*$", Pattern.MULTILINE);
    private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);
    private static final Pattern LIMIT = Pattern.compile("\\bLIMIT\\b", Pattern.CASE_INSENSITIVE);
    /** Whitespace, comments and opening parentheses ahead of the first keyword. */
    private static final Pattern LEADING_NOISE = Pattern.compile("\\A(?:\\s+|--[^\\n]*|/\\*.*?\\*/|\\()*", Pattern.DOTALL);

    private SqlLimits() {}

    /** True when a LIMIT keyword appears outside literals, quoted identifiers and comments. */
    public static boolean hasLimit(String sql) {
        String cleaned = SINGLE_QUOTED.matcher(sql).replaceAll("");
        cleaned = DOUBLE_QUOTED.matcher(cleaned).replaceAll("");
        cleaned = LINE_COMMENT.matcher(cleaned).replaceAll("");
        cleaned = BLOCK_COMMENT.matcher(cleaned).replaceAll("");
        return LIMIT.matcher(cleaned).find();
    }

    /** True for statements that start, after comments and parentheses, with SELECT or WITH. */
    public static boolean isSelect(String sql) {
        String upper = LEADING_NOISE.matcher(sql).replaceFirst("").toUpperCase(Locale.ROOT);
        return upper.startsWith("SELECT") || upper.startsWith("WITH");
    }

    /**
     * Appends {@code LIMIT limit} when the statement is a SELECT without one.
     *
     * @return the statement to run, unchanged if no limit was needed
     */
    public static String applyAutoLimit(String sql, int limit) {
        if (!isSelect(sql) || hasLimit(sql)) {
            return sql;
        }
        String body = sql.strip();
        while (body.endsWith(";")) {
            body = body.substring(0, body.length() - 1).stripTrailing();
        }
        // newline so a trailing line comment cannot swallow the clause
        return body + "\nLIMIT " + limit;
    }
}
