package guraa.epubcompare.comparison;

/**
 * Ways the mimetype entry of an EPUB can break the container rules.
 */
public enum BootstrapViolation {
    MISSING("missing mimetype file"),
    INVALID_CONTENT("ERROR: mimetype content invalid"),
    NOT_FIRST("ERROR: mimetype is not first"),
    COMPRESSED("ERROR: mimetype must be STORED (no compression)");

    private final String message;

    BootstrapViolation(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
