package guraa.epubcompare.comparison;

import lombok.Value;

/**
 * A manifest resource declared with different media types on each side.
 */
@Value
public class MediaTypeDifference {
    String path;
    String originalMediaType;
    String translatedMediaType;
}
