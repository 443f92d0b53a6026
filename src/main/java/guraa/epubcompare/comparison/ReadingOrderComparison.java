package guraa.epubcompare.comparison;

import lombok.Value;

import java.util.List;

/**
 * Comparison of two spine sequences.
 */
@Value
public class ReadingOrderComparison {

    /**
     * Divergence index reported when the compared prefix is identical.
     */
    public static final int NO_DIVERGENCE = -1;

    int originalLength;

    int translatedLength;

    /**
     * First position, within the shorter sequence, where the two differ.
     */
    int firstDivergenceIndex;

    /**
     * Compare two reading orders position by position up to the shorter length.
     *
     * @param original The original spine paths
     * @param translated The translated spine paths
     * @return The comparison
     */
    public static ReadingOrderComparison of(List<String> original, List<String> translated) {
        int limit = Math.min(original.size(), translated.size());
        int divergence = NO_DIVERGENCE;
        for (int i = 0; i < limit; i++) {
            if (!original.get(i).equals(translated.get(i))) {
                divergence = i;
                break;
            }
        }
        return new ReadingOrderComparison(original.size(), translated.size(), divergence);
    }

    public boolean hasDivergence() {
        return firstDivergenceIndex != NO_DIVERGENCE;
    }

    public boolean isLengthDifferent() {
        return originalLength != translatedLength;
    }

    public boolean isDifferent() {
        return hasDivergence() || isLengthDifferent();
    }
}
