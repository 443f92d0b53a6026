package guraa.epubcompare.comparison;

import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Byte-level changes among the files both archives share.
 */
@Value
public class ContentComparisonResult {

    /**
     * All changes, sorted by path.
     */
    List<ChangeRecord> changes;

    /**
     * Translated payloads of the changed markup documents, keyed by path.
     */
    Map<String, byte[]> translatedMarkup;

    public boolean hasChanges() {
        return !changes.isEmpty();
    }

    public List<ChangeRecord> getMarkupChanges() {
        return changes.stream().filter(ChangeRecord::isMarkup).collect(Collectors.toList());
    }

    public List<ChangeRecord> getNonMarkupChanges() {
        return changes.stream().filter(change -> !change.isMarkup()).collect(Collectors.toList());
    }
}
