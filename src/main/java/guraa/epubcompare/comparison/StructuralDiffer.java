package guraa.epubcompare.comparison;

import guraa.epubcompare.core.ArchiveEntry;
import guraa.epubcompare.core.EpubArchive;
import guraa.epubcompare.core.PackageDocument;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.CodingErrorAction;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Structural comparison of two EPUB containers: file sets, the mimetype entry,
 * rootfile paths, manifests and spines.
 */
@Slf4j
public class StructuralDiffer {

    public static final String MIMETYPE_PATH = "mimetype";
    public static final String EPUB_MIMETYPE = "application/epub+zip";

    /**
     * Compare the file listings of two archives.
     *
     * @param original The original archive
     * @param translated The translated archive
     * @return Files missing from and extra in the translation
     */
    public SetDifference diffFiles(EpubArchive original, EpubArchive translated) {
        return SetDifference.between(original.getFileSet(), translated.getFileSet());
    }

    /**
     * Check the mimetype entry of one archive. Existence, content, position and storage
     * are independent checks; every failing one is recorded.
     *
     * @param side Which archive is checked
     * @param archive The archive
     * @return The check result
     */
    public BootstrapCheck checkBootstrap(Side side, EpubArchive archive) {
        Optional<ArchiveEntry> entry = archive.getEntry(MIMETYPE_PATH);
        if (entry.isEmpty()) {
            return BootstrapCheck.builder()
                    .side(side)
                    .present(false)
                    .violation(BootstrapViolation.MISSING)
                    .build();
        }

        ArchiveEntry mimetype = entry.get();
        String content = archive.readText(MIMETYPE_PATH, "US-ASCII", CodingErrorAction.IGNORE)
                .map(String::trim)
                .orElse("");

        BootstrapCheck.BootstrapCheckBuilder builder = BootstrapCheck.builder()
                .side(side)
                .present(true)
                .content(content)
                .first(mimetype.isFirst())
                .compressionMethod(mimetype.getMethodName());

        if (!EPUB_MIMETYPE.equals(content)) {
            builder.violation(BootstrapViolation.INVALID_CONTENT);
        }
        if (!mimetype.isFirst()) {
            builder.violation(BootstrapViolation.NOT_FIRST);
        }
        if (!mimetype.isStored()) {
            builder.violation(BootstrapViolation.COMPRESSED);
        }

        BootstrapCheck check = builder.build();
        log.debug("[{}] mimetype check: {}", side.getLabel(), check.getViolations());
        return check;
    }

    /**
     * Check whether both archives point at the same package document.
     *
     * @param original The original rootfile path, null if unresolved
     * @param translated The translated rootfile path, null if unresolved
     * @return true if the paths differ, including when only one side resolved
     */
    public boolean isRootfileMismatch(String original, String translated) {
        return !Objects.equals(original, translated);
    }

    /**
     * Compare manifest resource paths.
     *
     * @param original The original package document
     * @param translated The translated package document
     * @return Manifest items missing from and extra in the translation
     */
    public SetDifference diffManifests(PackageDocument original, PackageDocument translated) {
        return SetDifference.between(original.getManifestPaths(), translated.getManifestPaths());
    }

    /**
     * Compare declared media types of resources present in both manifests.
     *
     * @param original The original package document
     * @param translated The translated package document
     * @return Every differing pair, sorted by path
     */
    public List<MediaTypeDifference> diffMediaTypes(PackageDocument original, PackageDocument translated) {
        Set<String> common = new TreeSet<>(original.getManifestPathSet());
        common.retainAll(translated.getManifestPathSet());

        List<MediaTypeDifference> differences = new ArrayList<>();
        for (String path : common) {
            String originalType = original.mediaTypeOf(path);
            String translatedType = translated.mediaTypeOf(path);
            if (!originalType.equals(translatedType)) {
                differences.add(new MediaTypeDifference(path, originalType, translatedType));
            }
        }
        return differences;
    }

    public ReadingOrderComparison compareReadingOrder(PackageDocument original, PackageDocument translated) {
        return ReadingOrderComparison.of(original.getReadingOrder(), translated.getReadingOrder());
    }

    /**
     * Find manifest items with no matching file in the same archive.
     *
     * @param document The package document
     * @param archive The archive it was read from
     * @return Unresolved manifest paths, sorted
     */
    public List<String> findUnresolvedManifestPaths(PackageDocument document, EpubArchive archive) {
        Set<String> unresolved = new TreeSet<>();
        for (String path : document.getManifestPaths()) {
            if (!archive.getFileSet().contains(path)) {
                unresolved.add(path);
            }
        }
        return List.copyOf(unresolved);
    }
}
