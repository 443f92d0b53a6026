package guraa.epubcompare.core;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Manifest and reading order of a parsed package document.
 */
@Value
public class PackageDocument {

    private static final PackageDocument EMPTY = new PackageDocument(List.of(), List.of());

    List<ManifestEntry> manifest;

    /**
     * Resource paths of every manifest item, in declaration order.
     */
    List<String> manifestPaths;

    /**
     * The manifest paths for membership checks.
     */
    Set<String> manifestPathSet;

    /**
     * Resource paths of the spine, in reading order.
     */
    List<String> readingOrder;

    /**
     * Resource path to declared media type. Items without a media type are left out.
     */
    Map<String, String> mediaTypes;

    public PackageDocument(List<ManifestEntry> manifest, List<String> readingOrder) {
        this.manifest = List.copyOf(manifest);
        this.readingOrder = List.copyOf(readingOrder);
        this.manifestPaths = manifest.stream()
                .map(ManifestEntry::getPath)
                .collect(Collectors.toUnmodifiableList());
        this.manifestPathSet = Collections.unmodifiableSet(new LinkedHashSet<>(manifestPaths));

        Map<String, String> byPath = new LinkedHashMap<>();
        for (ManifestEntry entry : manifest) {
            if (!entry.getMediaType().isEmpty()) {
                byPath.put(entry.getPath(), entry.getMediaType());
            }
        }
        this.mediaTypes = Collections.unmodifiableMap(byPath);
    }

    public static PackageDocument empty() {
        return EMPTY;
    }

    public String mediaTypeOf(String path) {
        return mediaTypes.getOrDefault(path, "");
    }

    public boolean isEmpty() {
        return manifest.isEmpty() && readingOrder.isEmpty();
    }
}
