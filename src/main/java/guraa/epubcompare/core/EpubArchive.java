package guraa.epubcompare.core;

import guraa.epubcompare.util.PathUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.io.IOUtils;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only view of an EPUB (ZIP) container.
 * Exposes the normalized file listing, per-entry storage details and content lookup.
 * Instances hold an open file handle and must be closed.
 */
@Slf4j
public class EpubArchive implements Closeable {

    private final Path location;
    private final ZipFile zipFile;
    private final List<String> files;
    private final Set<String> fileSet;
    private final Map<String, ArchiveEntry> entries;
    private final Map<String, ZipArchiveEntry> zipEntries;

    private EpubArchive(Path location, ZipFile zipFile) {
        this.location = location;
        this.zipFile = zipFile;

        List<String> listing = new ArrayList<>();
        Map<String, ArchiveEntry> entryMap = new LinkedHashMap<>();
        Map<String, ZipArchiveEntry> zipEntryMap = new LinkedHashMap<>();

        int position = 0;
        Enumeration<ZipArchiveEntry> enumeration = zipFile.getEntries();
        while (enumeration.hasMoreElements()) {
            ZipArchiveEntry zipEntry = enumeration.nextElement();
            String rawName = zipEntry.getName();
            if (!isDirectoryName(rawName)) {
                String path = PathUtils.normalize(rawName);
                listing.add(path);
                if (!entryMap.containsKey(path)) {
                    entryMap.put(path, new ArchiveEntry(path, position, zipEntry.getMethod(), zipEntry.getSize()));
                    zipEntryMap.put(path, zipEntry);
                } else {
                    log.warn("Duplicate entry {} in {}, keeping the first occurrence", path, location.getFileName());
                }
            }
            position++;
        }

        this.files = Collections.unmodifiableList(listing);
        this.fileSet = Collections.unmodifiableSet(new LinkedHashSet<>(listing));
        this.entries = Collections.unmodifiableMap(entryMap);
        this.zipEntries = zipEntryMap;
    }

    /**
     * Open an EPUB container.
     *
     * @param location The archive file
     * @return The opened archive
     * @throws ArchiveReadException If the file does not exist or is not a readable ZIP container
     */
    public static EpubArchive open(Path location) throws ArchiveReadException {
        try {
            ZipFile zipFile = ZipFile.builder().setPath(location).get();
            EpubArchive archive = new EpubArchive(location, zipFile);
            log.debug("Opened {} with {} file entries", location, archive.files.size());
            return archive;
        } catch (IOException | RuntimeException e) {
            throw new ArchiveReadException(location, e);
        }
    }

    private static boolean isDirectoryName(String name) {
        return name.endsWith("/") || name.endsWith("\\");
    }

    public Path getLocation() {
        return location;
    }

    /**
     * Get the normalized paths of all non-directory entries, in archive listing order.
     *
     * @return The file listing
     */
    public List<String> getFiles() {
        return files;
    }

    public Set<String> getFileSet() {
        return fileSet;
    }

    public boolean contains(String path) {
        return fileSet.contains(PathUtils.normalize(path));
    }

    public Optional<ArchiveEntry> getEntry(String path) {
        return Optional.ofNullable(entries.get(PathUtils.normalize(path)));
    }

    /**
     * Read the full content of an entry.
     *
     * @param path The entry path
     * @return The bytes, or empty if the entry is absent or cannot be read
     */
    public Optional<byte[]> readBytes(String path) {
        ZipArchiveEntry zipEntry = zipEntries.get(PathUtils.normalize(path));
        if (zipEntry == null) {
            return Optional.empty();
        }

        try (InputStream in = zipFile.getInputStream(zipEntry)) {
            return Optional.of(IOUtils.toByteArray(in));
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to read {} from {}: {}", path, location.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Read an entry as text. Malformed input is replaced rather than rejected.
     *
     * @param path The entry path
     * @param charsetName The declared encoding; UTF-8 is used if it is unknown
     * @return The decoded text, or empty if the entry is absent
     */
    public Optional<String> readText(String path, String charsetName) {
        return readText(path, charsetName, CodingErrorAction.REPLACE);
    }

    /**
     * Read an entry as text with an explicit policy for undecodable bytes.
     *
     * @param path The entry path
     * @param charsetName The declared encoding; UTF-8 is used if it is unknown
     * @param onError REPLACE to substitute U+FFFD, IGNORE to drop the bytes
     * @return The decoded text, or empty if the entry is absent
     */
    public Optional<String> readText(String path, String charsetName, CodingErrorAction onError) {
        return readBytes(path).map(bytes -> decode(bytes, charsetName, onError));
    }

    /**
     * Decode bytes without ever failing.
     *
     * @param bytes The raw bytes
     * @param charsetName The declared encoding
     * @param onError Action for malformed or unmappable input
     * @return The decoded text
     */
    public static String decode(byte[] bytes, String charsetName, CodingErrorAction onError) {
        Charset charset = lookupCharset(charsetName);
        CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(onError)
                .onUnmappableCharacter(onError);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            log.debug("Decoding as {} failed ({}), falling back to lenient UTF-8", charset, e.getMessage());
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }

    private static Charset lookupCharset(String charsetName) {
        if (charsetName == null || charsetName.isBlank()) {
            return StandardCharsets.UTF_8;
        }
        try {
            return Charset.forName(charsetName.trim());
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            log.debug("Unknown charset {}, using UTF-8", charsetName);
            return StandardCharsets.UTF_8;
        }
    }

    @Override
    public void close() throws IOException {
        zipFile.close();
    }
}
