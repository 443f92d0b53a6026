package guraa.epubcompare.service;

import guraa.epubcompare.config.AppProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.UUID;

/**
 * Service for storing EPUB files and resolving file IDs inside the storage location.
 * A file ID is the name of a file directly or indirectly under the storage location.
 */
@Slf4j
@Service
public class EpubStorageService {

    public static final String EPUB_EXTENSION = ".epub";

    private final Path storageLocation;

    public EpubStorageService(AppProperties properties) {
        this.storageLocation = Paths.get(properties.getStorage().getLocation())
                .toAbsolutePath().normalize();

        try {
            Files.createDirectories(this.storageLocation);
        } catch (IOException e) {
            throw new IllegalStateException("Could not create the directory where EPUB files are stored: "
                    + storageLocation, e);
        }
        log.info("EPUB storage location: {}", storageLocation);
    }

    public Path getStorageLocation() {
        return storageLocation;
    }

    /**
     * Store an uploaded EPUB under a generated file ID.
     *
     * @param file The uploaded file
     * @return The file ID
     * @throws IOException If the file cannot be written
     */
    public String storeFile(MultipartFile file) throws IOException {
        String originalName = file.getOriginalFilename() != null ? StringUtils.cleanPath(file.getOriginalFilename()) : "";
        if (!originalName.toLowerCase(Locale.ROOT).endsWith(EPUB_EXTENSION)) {
            throw new IllegalArgumentException("Only .epub files are allowed");
        }

        String fileId = UUID.randomUUID() + EPUB_EXTENSION;
        Path target = storageLocation.resolve(fileId);
        try (InputStream in = file.getInputStream()) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }

        log.info("Stored {} ({} bytes) as {}", originalName, file.getSize(), fileId);
        return fileId;
    }

    /**
     * Resolve a file ID to its location. IDs that normalize outside the storage location are rejected.
     *
     * @param fileId The file ID
     * @return The file location
     * @throws IllegalArgumentException If the ID is blank or escapes the storage location
     */
    public Path resolve(String fileId) {
        if (fileId == null || fileId.isBlank()) {
            throw new IllegalArgumentException("File ID is required");
        }

        Path resolved = storageLocation.resolve(fileId).normalize();
        if (!resolved.startsWith(storageLocation) || resolved.equals(storageLocation)) {
            log.warn("Rejected file ID outside the storage location: {}", fileId);
            throw new IllegalArgumentException("File ID does not name a stored file: " + fileId);
        }
        return resolved;
    }
}
