package vn.com.fecredit.filestore.range;

import lombok.Value;

/**
 * Inclusive byte window {@code [start, end]} of an artifact.
 */
@Value
public class RangeWindow {
    long start;
    long end;

    public long length() {
        return end - start + 1;
    }
}
