package org.iceforge.kpigate.sql;

import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Renders caller-supplied data values as SQL string literals.
 *
 * <p>Values are wrapped in single quotes and embedded single quotes are doubled. Nothing here
 * ever produces an identifier; identifiers come from {@link Columns} only.
 */
public final class SqlLiterals {
    private SqlLiterals() {}

    public static String quote(String value) {
        Objects.requireNonNull(value, "value");
        return "'" + value.replace("'", "''") + "'";
    }

    /** {@code col IN ('a','b')}; {@code values} must be non-empty. */
    static String inList(String column, List<String> values) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("IN list for " + column + " is empty");
        }
        StringJoiner sj = new StringJoiner(",", column + " IN (", ")");
        for (String v : values) {
            sj.add(quote(v));
        }
        return sj.toString();
    }
}
