package guraa.epubcompare.core;

import lombok.Value;
import org.apache.commons.compress.archivers.zip.ZipMethod;

/**
 * A non-directory entry of an EPUB container.
 */
@Value
public class ArchiveEntry {

    /**
     * Normalized path inside the archive (forward slashes, no leading "./").
     */
    String path;

    /**
     * Zero-based position of the entry in the archive listing order, directory entries included.
     */
    int position;

    /**
     * Raw ZIP compression method code.
     */
    int method;

    /**
     * Uncompressed size as declared by the archive, -1 if unknown.
     */
    long size;

    public boolean isStored() {
        return method == ZipMethod.STORED.getCode();
    }

    public boolean isFirst() {
        return position == 0;
    }

    /**
     * Get a readable name for the compression method, e.g. STORED or DEFLATED.
     *
     * @return The method name
     */
    public String getMethodName() {
        ZipMethod zipMethod = ZipMethod.getMethodByCode(method);
        return zipMethod != null ? zipMethod.name() : "UNKNOWN(" + method + ")";
    }
}
