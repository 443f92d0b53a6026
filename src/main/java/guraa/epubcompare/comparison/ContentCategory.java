package guraa.epubcompare.comparison;

import java.util.Locale;

/**
 * Coarse classification of changed archive files.
 */
public enum ContentCategory {
    MARKUP,
    NON_MARKUP;

    private static final String MIMETYPE_PATH = "mimetype";

    /**
     * Classify a path by extension. The mimetype entry is never markup.
     *
     * @param path The archive path
     * @return The category
     */
    public static ContentCategory of(String path) {
        if (MIMETYPE_PATH.equals(path)) {
            return NON_MARKUP;
        }
        String lower = path.toLowerCase(Locale.ROOT);
        return lower.endsWith(".html") || lower.endsWith(".xhtml") ? MARKUP : NON_MARKUP;
    }
}
