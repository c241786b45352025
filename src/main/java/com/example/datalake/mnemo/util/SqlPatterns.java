package com.example.datalake.mnemo.util;

import java.util.Locale;

/**
 * LIKE pattern helpers. Every pattern produced here must be used with {@code ESCAPE '\'}.
 */
public final class SqlPatterns {

    public static final String ESCAPE_CLAUSE = " ESCAPE '\\'";

    private SqlPatterns() {
    }

    public static String escapeLike(String raw) {
        StringBuilder sb = new StringBuilder(raw.length() + 8);
        for (char c : raw.toCharArray()) {
            if (c == '\\' || c == '%' || c == '_') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    public static String startsWith(String prefix) {
        return escapeLike(prefix) + "%";
    }

    /**
     * Lower-cased contains pattern, to be compared against {@code LOWER(column)}.
     */
    public static String containsIgnoreCase(String token) {
        return "%" + escapeLike(token.toLowerCase(Locale.ROOT)) + "%";
    }
}
