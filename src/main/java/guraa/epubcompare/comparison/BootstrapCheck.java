package guraa.epubcompare.comparison;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Result of checking the mimetype entry of one archive.
 */
@Value
@Builder
public class BootstrapCheck {

    Side side;

    boolean present;

    /**
     * Trimmed entry content, null when the entry is missing.
     */
    String content;

    boolean first;

    /**
     * Compression method name, null when the entry is missing.
     */
    String compressionMethod;

    @Singular
    Set<BootstrapViolation> violations;

    public boolean isValid() {
        return violations.isEmpty();
    }
}
