package guraa.epubcompare.core;

import lombok.Value;

/**
 * An item declared in the package document manifest.
 */
@Value
public class ManifestEntry {

    String id;

    /**
     * Archive path, resolved against the package document directory.
     */
    String path;

    /**
     * Declared media type, empty when the item has none.
     */
    String mediaType;
}
