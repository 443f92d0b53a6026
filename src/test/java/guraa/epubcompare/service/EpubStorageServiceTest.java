package guraa.epubcompare.service;

import guraa.epubcompare.config.AppProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EpubStorageServiceTest {

    @TempDir
    Path tempDir;

    private Path root;
    private EpubStorageService storageService;

    @BeforeEach
    void setUp() {
        root = tempDir.resolve("storage");
        AppProperties properties = new AppProperties();
        properties.getStorage().setLocation(root.toString());
        storageService = new EpubStorageService(properties);
    }

    @Test
    void createsStorageLocation() {
        assertTrue(Files.isDirectory(root));
        assertEquals(root.toAbsolutePath().normalize(), storageService.getStorageLocation());
    }

    @Test
    void resolvesIdsInsideStorageLocation() {
        Path location = storageService.getStorageLocation();

        assertEquals(location.resolve("book.epub"), storageService.resolve("book.epub"));
        assertEquals(location.resolve("uk/book.epub"), storageService.resolve("uk/./book.epub"));
        assertEquals(location.resolve("book.epub"), storageService.resolve("uk/../book.epub"));
    }

    @Test
    void rejectsIdsOutsideStorageLocation() {
        assertThrows(IllegalArgumentException.class, () -> storageService.resolve("../../etc/passwd"));
        assertThrows(IllegalArgumentException.class, () -> storageService.resolve("uk/../../other.epub"));
        assertThrows(IllegalArgumentException.class, () -> storageService.resolve(tempDir.resolve("other.epub").toAbsolutePath().toString()));
        assertThrows(IllegalArgumentException.class, () -> storageService.resolve("."));
        assertThrows(IllegalArgumentException.class, () -> storageService.resolve(" "));
        assertThrows(IllegalArgumentException.class, () -> storageService.resolve(null));
    }

    @Test
    void storesUploadUnderGeneratedId() throws IOException {
        byte[] content = "PK".getBytes(StandardCharsets.US_ASCII);
        MockMultipartFile upload = new MockMultipartFile("file", "Book.EPUB", "application/epub+zip", content);

        String fileId = storageService.storeFile(upload);

        assertTrue(fileId.endsWith(EpubStorageService.EPUB_EXTENSION));
        assertArrayEquals(content, Files.readAllBytes(storageService.resolve(fileId)));
    }

    @Test
    void rejectsNonEpubUpload() {
        MockMultipartFile upload = new MockMultipartFile("file", "notes.txt", "text/plain", new byte[]{1});

        assertThrows(IllegalArgumentException.class, () -> storageService.storeFile(upload));
    }
}
