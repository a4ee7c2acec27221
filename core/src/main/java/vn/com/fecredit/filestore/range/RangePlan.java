package vn.com.fecredit.filestore.range;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of {@link RangePlanner#plan}: serve everything, serve one window, or reject.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class RangePlan {

    public enum Kind {
        FULL, WINDOW, REJECTED
    }

    private static final RangePlan FULL = new RangePlan(Kind.FULL, null, null);

    private final Kind kind;
    private final RangeWindow window;
    private final RangeRejection rejection;

    public static RangePlan full() {
        return FULL;
    }

    public static RangePlan window(long start, long end) {
        return new RangePlan(Kind.WINDOW, new RangeWindow(start, end), null);
    }

    public static RangePlan rejected(RangeRejection rejection) {
        return new RangePlan(Kind.REJECTED, null, rejection);
    }

    @Override
    public String toString() {
        switch (kind) {
            case WINDOW:
                return "WINDOW[" + window.getStart() + "-" + window.getEnd() + "]";
            case REJECTED:
                return "REJECTED[" + rejection + "]";
            default:
                return "FULL";
        }
    }
}
