package org.iceforge.kpigate.request;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A {@code YYYYMM} month token. Only tokens matching the pattern are ever rendered into SQL.
 */
public record ReferenceMonth(String token) {

    private static final Pattern YEAR_MONTH = Pattern.compile("\\d{4}(0[1-9]|1[0-2])");

    public static final ReferenceMonth DEFAULT = new ReferenceMonth("202512");

    public ReferenceMonth {
        Objects.requireNonNull(token, "token");
        if (!isValid(token)) {
            throw new IllegalArgumentException("Not a YYYYMM token: " + token);
        }
    }

    /**
     * Non-conforming tokens are dropped in favour of {@link #DEFAULT}; they never reach the SQL text.
     */
    public static ReferenceMonth parseOrDefault(String token) {
        if (token == null) return DEFAULT;
        String t = token.trim();
        return isValid(t) ? new ReferenceMonth(t) : DEFAULT;
    }

    public static boolean isValid(String token) {
        return token != null && YEAR_MONTH.matcher(token).matches();
    }

    /** First month of the same calendar year, e.g. 202506 -> 202501. */
    public ReferenceMonth yearStart() {
        return new ReferenceMonth(token.substring(0, 4) + "01");
    }

    @Override
    public String toString() {
        return token;
    }
}
