package guraa.epubcompare.comparison;

import guraa.epubcompare.core.EpubArchive;
import lombok.extern.slf4j.Slf4j;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Detects files whose bytes changed between the original and the translation.
 */
@Slf4j
public class ContentDiffer {

    private static final String DIGEST_ALGORITHM = "SHA-1";

    private final int digestLength;

    public ContentDiffer(int digestLength) {
        this.digestLength = digestLength;
    }

    /**
     * Compare every file present in both archives.
     *
     * @param original The original archive
     * @param translated The translated archive
     * @return The changed files, sorted by path
     */
    public ContentComparisonResult diff(EpubArchive original, EpubArchive translated) {
        Set<String> common = new TreeSet<>(original.getFileSet());
        common.retainAll(translated.getFileSet());

        List<ChangeRecord> changes = new ArrayList<>();
        Map<String, byte[]> translatedMarkup = new LinkedHashMap<>();

        for (String path : common) {
            Optional<byte[]> originalBytes = original.readBytes(path);
            Optional<byte[]> translatedBytes = translated.readBytes(path);
            if (originalBytes.isEmpty() || translatedBytes.isEmpty()) {
                log.warn("Skipping {}: content could not be read from both archives", path);
                continue;
            }

            byte[] before = originalBytes.get();
            byte[] after = translatedBytes.get();
            if (Arrays.equals(before, after)) {
                continue;
            }

            ChangeRecord change = new ChangeRecord(path, before.length, after.length,
                    shortDigest(before), shortDigest(after), ContentCategory.of(path));
            changes.add(change);
            if (change.isMarkup()) {
                translatedMarkup.put(path, after);
            }
        }

        log.debug("Compared {} common files, {} changed", common.size(), changes.size());
        return new ContentComparisonResult(Collections.unmodifiableList(changes),
                Collections.unmodifiableMap(translatedMarkup));
    }

    /**
     * Compute the hex SHA-1 of the data, truncated to the configured length.
     *
     * @param data The bytes to digest
     * @return The digest prefix
     */
    String shortDigest(byte[] data) {
        MessageDigest md;
        try {
            md = MessageDigest.getInstance(DIGEST_ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(DIGEST_ALGORITHM + " is not available", e);
        }
        byte[] digest = md.digest(data);

        // Convert to hex string
        StringBuilder sb = new StringBuilder();
        for (byte b : digest) {
            sb.append(String.format("%02x", b));
        }
        return sb.substring(0, Math.min(digestLength, sb.length()));
    }
}
