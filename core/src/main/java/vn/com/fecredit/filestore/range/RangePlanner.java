package vn.com.fecredit.filestore.range;

/**
 * Parses a single {@code Range} header value against a known artifact length.
 *
 * <p>
 * Accepted forms, all prefixed by {@code bytes=}:
 * <ul>
 * <li>{@code start-end}: both inclusive, {@code start <= end < length}</li>
 * <li>{@code start-}: from {@code start} to the last byte</li>
 * <li>{@code -N}: the last {@code N} bytes, {@code 0 < N <= length}</li>
 * </ul>
 * Pure function, no I/O.
 */
public final class RangePlanner {

    static final String BYTES_PREFIX = "bytes=";

    private RangePlanner() {
    }

    public static RangePlan plan(String header, long length) {
        if (header == null || header.isBlank()) {
            return RangePlan.full();
        }
        String value = header.strip();
        if (!value.startsWith(BYTES_PREFIX)) {
            return RangePlan.rejected(RangeRejection.BAD_SYNTAX);
        }
        String rangeSet = value.substring(BYTES_PREFIX.length());
        if (rangeSet.indexOf(',') >= 0) {
            return RangePlan.rejected(RangeRejection.UNSUPPORTED);
        }

        int dash = rangeSet.indexOf('-');
        if (dash < 0 || rangeSet.indexOf('-', dash + 1) >= 0) {
            return RangePlan.rejected(RangeRejection.BAD_SYNTAX);
        }
        String first = rangeSet.substring(0, dash);
        String second = rangeSet.substring(dash + 1);

        if (first.isEmpty()) {
            return suffix(second, length);
        }
        if (!isDigits(first) || (!second.isEmpty() && !isDigits(second))) {
            return RangePlan.rejected(RangeRejection.BAD_SYNTAX);
        }

        long start;
        try {
            start = Long.parseLong(first);
        } catch (NumberFormatException e) {
            return RangePlan.rejected(RangeRejection.UNSATISFIABLE);
        }
        if (start >= length) {
            return RangePlan.rejected(RangeRejection.UNSATISFIABLE);
        }
        if (second.isEmpty()) {
            return RangePlan.window(start, length - 1);
        }

        long end;
        try {
            end = Long.parseLong(second);
        } catch (NumberFormatException e) {
            return RangePlan.rejected(RangeRejection.UNSATISFIABLE);
        }
        if (end < start || end > length - 1) {
            return RangePlan.rejected(RangeRejection.UNSATISFIABLE);
        }
        return RangePlan.window(start, end);
    }

    private static RangePlan suffix(String token, long length) {
        if (!isDigits(token)) {
            return RangePlan.rejected(RangeRejection.BAD_SYNTAX);
        }
        long n;
        try {
            n = Long.parseLong(token);
        } catch (NumberFormatException e) {
            return RangePlan.rejected(RangeRejection.UNSATISFIABLE);
        }
        if (n <= 0 || n > length) {
            return RangePlan.rejected(RangeRejection.UNSATISFIABLE);
        }
        return RangePlan.window(length - n, length - 1);
    }

    private static boolean isDigits(String token) {
        if (token.isEmpty()) {
            return false;
        }
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
