package guraa.epubcompare.controller;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * IDs of the two stored EPUB files to compare.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompareRequest {
    private String originalFileId;
    private String translatedFileId;
}
