package vn.com.fecredit.filestore.range;

/**
 * Why a range header could not be served.
 */
public enum RangeRejection {
    /** Not a {@code bytes=} range, or a token is not a plain decimal number. */
    BAD_SYNTAX,
    /** Well formed, but outside the artifact. */
    UNSATISFIABLE,
    /** Several comma-separated ranges; only one is served. */
    UNSUPPORTED
}
