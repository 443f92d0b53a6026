package guraa.epubcompare.validation;

import lombok.Value;

/**
 * A heuristic problem found in a translated content document.
 */
@Value
public class MarkupIssue {
    String path;
    String message;

    public String describe() {
        return path + ": " + message;
    }
}
