package guraa.epubcompare.controller;

import guraa.epubcompare.report.ComparisonReport;
import guraa.epubcompare.report.ReportAggregator;
import guraa.epubcompare.service.EpubStorageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Controller exposing EPUB upload and comparison over HTTP.
 * Comparisons only ever read files from the configured storage location.
 */
@Slf4j
@RestController
@RequestMapping("/api/epubs")
@RequiredArgsConstructor
public class ComparisonController {

    private final ReportAggregator reportAggregator;
    private final EpubStorageService storageService;

    /**
     * Upload an EPUB file into the storage location.
     *
     * @param file The EPUB file
     * @return The file ID to use in comparison requests
     * @throws IOException If the file cannot be stored
     */
    @PostMapping("/upload")
    public ResponseEntity<FileUploadResponse> upload(@RequestParam("file") MultipartFile file) throws IOException {
        if (file.isEmpty()) {
            throw new IllegalArgumentException("File is empty");
        }

        String fileId = storageService.storeFile(file);
        return ResponseEntity.ok(new FileUploadResponse(fileId, file.getOriginalFilename(), file.getSize()));
    }

    /**
     * Compare two stored EPUB files and return the plain text report.
     *
     * @param request The comparison request
     * @return The rendered report
     * @throws IOException If either archive cannot be read
     */
    @PostMapping("/compare")
    public ResponseEntity<String> compare(@RequestBody CompareRequest request) throws IOException {
        ComparisonReport report = runComparison(request);
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_PLAIN)
                .body(report.render());
    }

    /**
     * Compare two stored EPUB files and return the report sections as JSON.
     *
     * @param request The comparison request
     * @return The structured report
     * @throws IOException If either archive cannot be read
     */
    @PostMapping("/compare/sections")
    public ResponseEntity<ComparisonReport> compareSections(@RequestBody CompareRequest request) throws IOException {
        return ResponseEntity.ok(runComparison(request));
    }

    private ComparisonReport runComparison(CompareRequest request) throws IOException {
        log.info("Received comparison request: originalFileId={}, translatedFileId={}",
                request.getOriginalFileId(), request.getTranslatedFileId());

        if (isBlank(request.getOriginalFileId()) || isBlank(request.getTranslatedFileId())) {
            throw new IllegalArgumentException("Both originalFileId and translatedFileId are required");
        }

        Path original = storageService.resolve(request.getOriginalFileId());
        Path translated = storageService.resolve(request.getTranslatedFileId());
        return reportAggregator.compare(original, translated);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
