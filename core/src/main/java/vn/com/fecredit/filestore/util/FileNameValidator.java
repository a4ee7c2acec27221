package vn.com.fecredit.filestore.util;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Validates single path segments supplied by clients: artifact display names
 * and tenant identifiers.
 *
 * <p>
 * A valid segment names exactly one entry inside its parent directory. Path
 * separators, {@code .}/{@code ..}, control characters and the Windows
 * reserved characters are rejected on every platform so that stored names
 * stay portable.
 */
public final class FileNameValidator {

    private static final String INVALID_CHARS = "<>:\"/\\|?*";
    private static final int MAX_LENGTH = 255;

    private FileNameValidator() {
    }

    public static boolean isValidFileName(String fileName) {
        if (fileName == null || fileName.trim().isEmpty() || fileName.length() > MAX_LENGTH) {
            return false;
        }
        if (fileName.equals(".") || fileName.equals("..")) {
            return false;
        }
        for (int i = 0; i < fileName.length(); i++) {
            char c = fileName.charAt(i);
            if (c < 0x20 || c == 0x7f || INVALID_CHARS.indexOf(c) >= 0) {
                return false;
            }
        }

        try {
            Path path = Paths.get(fileName);
            return path.getNameCount() == 1 && path.getFileName().toString().equals(fileName);
        } catch (InvalidPathException e) {
            return false;
        }
    }

    /**
     * Returns the name unchanged, or fails the request when it is not a single valid segment.
     *
     * @param fileName candidate name
     * @param what     what the name denotes, for the error message
     * @return {@code fileName}
     * @throws IllegalArgumentException if the name is invalid
     */
    public static String requireValid(String fileName, String what) {
        if (!isValidFileName(fileName)) {
            throw new IllegalArgumentException("Invalid " + what + ": " + fileName);
        }
        return fileName;
    }
}
