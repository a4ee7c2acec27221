package vn.com.fecredit.filestore.exception;

import lombok.Getter;
import vn.com.fecredit.filestore.range.RangeRejection;

/**
 * A {@code Range} header that cannot be served for an artifact of {@code totalLength} bytes.
 */
@Getter
public class RangeRejectedException extends FileStoreException {

    private final RangeRejection rejection;
    private final long totalLength;

    public RangeRejectedException(RangeRejection rejection, String rangeHeader, long totalLength) {
        super(codeOf(rejection), "Cannot serve range '" + rangeHeader + "' of " + totalLength + " bytes",
                rejection == RangeRejection.BAD_SYNTAX ? 400 : 416);
        this.rejection = rejection;
        this.totalLength = totalLength;
    }

    private static String codeOf(RangeRejection rejection) {
        switch (rejection) {
            case BAD_SYNTAX:
                return "InvalidRange";
            case UNSUPPORTED:
                return "MultiRangeUnsupported";
            default:
                return "RangeNotSatisfiable";
        }
    }
}
