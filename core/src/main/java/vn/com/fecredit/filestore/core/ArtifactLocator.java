package vn.com.fecredit.filestore.core;

import vn.com.fecredit.filestore.exception.ArtifactNotFoundException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Resolves a tenant-relative artifact path to a regular file in storage.
 *
 * <p>
 * Anything that would leave the tenant directory ({@code ..}, absolute
 * paths, symlinks pointing elsewhere) is reported as not found rather than as
 * a bad request, so callers cannot probe outside their own storage.
 */
public class ArtifactLocator {

    private final ArtifactFinalizer finalizer;

    public ArtifactLocator(ArtifactFinalizer finalizer) {
        this.finalizer = finalizer;
    }

    /**
     * @param tenantId     owner of the artifact
     * @param artifactPath path relative to the tenant directory
     * @return the real path of the artifact
     * @throws ArtifactNotFoundException if no readable regular file exists at that path for the tenant
     */
    public Path locate(String tenantId, String artifactPath) {
        if (artifactPath == null || artifactPath.isBlank() || artifactPath.indexOf('\0') >= 0) {
            throw new ArtifactNotFoundException(String.valueOf(artifactPath));
        }
        String relative = artifactPath.startsWith("/") ? artifactPath.substring(1) : artifactPath;

        Path tenantDir;
        try {
            tenantDir = finalizer.tenantDir(tenantId);
        } catch (IllegalArgumentException e) {
            throw new ArtifactNotFoundException(artifactPath, e);
        }
        if (!Files.isDirectory(tenantDir)) {
            throw new ArtifactNotFoundException(artifactPath);
        }

        try {
            Path root = tenantDir.toRealPath();
            Path candidate = root.resolve(relative).normalize();
            if (!candidate.startsWith(root) || candidate.equals(root)) {
                throw new ArtifactNotFoundException(artifactPath);
            }
            if (!Files.isRegularFile(candidate)) {
                throw new ArtifactNotFoundException(artifactPath);
            }
            Path real = candidate.toRealPath();
            if (!real.startsWith(root)) {
                throw new ArtifactNotFoundException(artifactPath);
            }
            return real;
        } catch (IOException | InvalidPathException e) {
            throw new ArtifactNotFoundException(artifactPath, e);
        }
    }
}
