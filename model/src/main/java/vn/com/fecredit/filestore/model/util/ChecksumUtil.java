package vn.com.fecredit.filestore.model.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Utility class for SHA-256 content digests.
 *
 * <p>
 * This class provides methods for:
 * <ul>
 * <li>Creating a fresh SHA-256 {@link MessageDigest} for streaming use</li>
 * <li>Computing the digest of a file in a streaming fashion</li>
 * <li>Rendering digests as lowercase hexadecimal strings</li>
 * </ul>
 *
 * <p>
 * Usage example:
 * <pre>
 * Path file = Paths.get("myfile.txt");
 * String checksum = ChecksumUtil.generateChecksum(file);
 * </pre>
 */
public final class ChecksumUtil {

    /** Digest algorithm used for every artifact. */
    public static final String ALGORITHM = "SHA-256";

    /** Size of buffer used for reading file data (8KB) */
    private static final int BUFFER_SIZE = 8192;

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private ChecksumUtil() {
        // Utility class, no instances allowed
    }

    /**
     * Creates a new SHA-256 digest.
     *
     * @return a fresh, unshared {@link MessageDigest}
     * @throws IllegalStateException if the JDK does not provide SHA-256
     */
    public static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    /**
     * Generates a SHA-256 checksum for a file.
     *
     * @param filePath Path to the file to checksum
     * @return SHA-256 checksum as a lowercase hex string
     * @throws IOException If the file cannot be read
     */
    public static String generateChecksum(Path filePath) throws IOException {
        return toHex(digest(filePath));
    }

    /**
     * Computes the raw SHA-256 digest of a file, reading it in fixed-size blocks.
     *
     * @param filePath Path to the file to digest
     * @return the 32-byte digest
     * @throws IOException If the file cannot be read
     */
    public static byte[] digest(Path filePath) throws IOException {
        MessageDigest digest = newDigest();
        try (InputStream in = Files.newInputStream(filePath)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return digest.digest();
    }

    /**
     * Computes the SHA-256 checksum of an in-memory byte array.
     *
     * @param data bytes to digest
     * @return SHA-256 checksum as a lowercase hex string
     */
    public static String checksumOf(byte[] data) {
        return toHex(newDigest().digest(data));
    }

    /**
     * Renders bytes as a lowercase hexadecimal string.
     *
     * @param hash bytes to render
     * @return hex string, two characters per byte
     */
    public static String toHex(byte[] hash) {
        char[] out = new char[hash.length * 2];
        for (int i = 0; i < hash.length; i++) {
            int v = hash[i] & 0xff;
            out[i * 2] = HEX[v >>> 4];
            out[i * 2 + 1] = HEX[v & 0x0f];
        }
        return new String(out);
    }
}
