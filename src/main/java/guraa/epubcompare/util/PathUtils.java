package guraa.epubcompare.util;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Utility methods for the POSIX-style relative paths used inside EPUB containers.
 */
public final class PathUtils {

    private PathUtils() {
        // Utility class, no instances allowed
    }

    /**
     * Normalize an archive path: backslashes become forward slashes, surrounding
     * whitespace is trimmed, empty and "." segments are dropped and ".." segments
     * are collapsed against the preceding segment.
     *
     * @param path The raw path, may be null
     * @return The normalized path, empty for null or blank input
     */
    public static String normalize(String path) {
        if (path == null) {
            return "";
        }

        String unified = path.replace('\\', '/').trim();
        if (unified.isEmpty()) {
            return "";
        }

        boolean absolute = unified.startsWith("/");
        Deque<String> segments = new ArrayDeque<>();

        for (String segment : unified.split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                if (!segments.isEmpty() && !"..".equals(segments.peekLast())) {
                    segments.removeLast();
                } else if (!absolute) {
                    segments.addLast(segment);
                }
                continue;
            }
            segments.addLast(segment);
        }

        String joined = String.join("/", segments);
        return absolute ? "/" + joined : joined;
    }

    /**
     * Get the directory part of a normalized path.
     *
     * @param path The path
     * @return Everything before the last separator, or an empty string for top-level paths
     */
    public static String directoryOf(String path) {
        String normalized = normalize(path);
        int slash = normalized.lastIndexOf('/');
        if (slash < 0) {
            return "";
        }
        return slash == 0 ? "/" : normalized.substring(0, slash);
    }

    /**
     * Get the last segment of a path.
     *
     * @param path The path
     * @return The file name
     */
    public static String fileNameOf(String path) {
        String normalized = normalize(path);
        int slash = normalized.lastIndexOf('/');
        return slash < 0 ? normalized : normalized.substring(slash + 1);
    }

    /**
     * Resolve a reference against a base directory and normalize the result.
     *
     * @param baseDirectory The directory the reference is relative to, may be empty
     * @param reference The relative reference
     * @return The normalized resolved path
     */
    public static String resolve(String baseDirectory, String reference) {
        String ref = reference == null ? "" : reference.replace('\\', '/').trim();
        if (ref.startsWith("/") || baseDirectory == null || baseDirectory.isEmpty()) {
            return normalize(ref);
        }
        return normalize(baseDirectory + "/" + ref);
    }
}
