package guraa.epubcompare.comparison;

import lombok.Value;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Entries exclusive to either side of a comparison, each list sorted.
 */
@Value
public class SetDifference {

    /**
     * Present in the original, absent from the translation.
     */
    List<String> missing;

    /**
     * Present in the translation, absent from the original.
     */
    List<String> extra;

    /**
     * Compute both directions of the set difference.
     *
     * @param original Entries of the original side
     * @param translated Entries of the translated side
     * @return The difference
     */
    public static SetDifference between(Collection<String> original, Collection<String> translated) {
        Set<String> originalSet = new TreeSet<>(original);
        Set<String> translatedSet = new TreeSet<>(translated);

        Set<String> missing = new TreeSet<>(originalSet);
        missing.removeAll(translatedSet);

        Set<String> extra = new TreeSet<>(translatedSet);
        extra.removeAll(originalSet);

        return new SetDifference(List.copyOf(missing), List.copyOf(extra));
    }

    public boolean isEmpty() {
        return missing.isEmpty() && extra.isEmpty();
    }
}
