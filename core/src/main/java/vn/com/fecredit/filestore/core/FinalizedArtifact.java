package vn.com.fecredit.filestore.core;

import lombok.Value;

import java.nio.file.Path;

/**
 * An artifact merged into permanent storage.
 */
@Value
public class FinalizedArtifact {
    Path finalPath;
    /** Name actually used, possibly disambiguated. */
    String finalName;
    /** Display name requested by the client. */
    String originalName;
    long sizeBytes;
    String digestHex;
}
