package guraa.epubcompare.core;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when an EPUB container cannot be opened or read at all.
 * This is the only failure that aborts a comparison.
 */
public class ArchiveReadException extends IOException {

    private final Path location;

    public ArchiveReadException(Path location, Throwable cause) {
        super("Failed to open archive " + location + ": " + (cause != null ? cause.getMessage() : "unknown error"), cause);
        this.location = location;
    }

    public Path getLocation() {
        return location;
    }
}
