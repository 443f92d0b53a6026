package guraa.epubcompare.comparison;

import lombok.Value;

/**
 * A file present in both archives whose bytes differ.
 */
@Value
public class ChangeRecord {
    String path;
    long originalSize;
    long translatedSize;
    String originalDigest;
    String translatedDigest;
    ContentCategory category;

    public boolean isMarkup() {
        return category == ContentCategory.MARKUP;
    }

    /**
     * Format as a report line, e.g. {@code text/ch1.xhtml  (120 -> 134 bytes)  a1b2c3d4e5 -> 0f9e8d7c6b}.
     *
     * @return The formatted line
     */
    public String describe() {
        return String.format("%s  (%d -> %d bytes)  %s -> %s",
                path, originalSize, translatedSize, originalDigest, translatedDigest);
    }
}
