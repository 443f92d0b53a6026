package guraa.epubcompare.core;

import guraa.epubcompare.util.PathUtils;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Locates the package document of an EPUB through META-INF/container.xml.
 */
@Slf4j
public class ContainerResolver {

    public static final String CONTAINER_PATH = "META-INF/container.xml";

    /**
     * Resolve the package document path declared by an archive.
     *
     * @param archive The archive
     * @return The normalized rootfile path, or empty if the descriptor is absent, unparsable or declares none
     */
    public Optional<String> resolveRootfile(EpubArchive archive) {
        Optional<String> descriptor = archive.readText(CONTAINER_PATH, "UTF-8");
        if (descriptor.isEmpty()) {
            log.debug("{} has no {}", archive.getLocation().getFileName(), CONTAINER_PATH);
            return Optional.empty();
        }
        return parseRootfile(descriptor.get());
    }

    /**
     * Extract the first rootfile path from container descriptor text.
     * Elements are matched by local name so any namespace prefix is accepted.
     *
     * @param containerXml The descriptor text
     * @return The normalized full path of the first rootfile, if any
     */
    public Optional<String> parseRootfile(String containerXml) {
        Document document;
        try {
            document = XmlDocuments.parse(containerXml);
        } catch (SAXException | IOException e) {
            log.warn("Unparsable container descriptor: {}", e.getMessage());
            return Optional.empty();
        }

        List<Element> rootfiles = XmlDocuments.descendantsByLocalName(document.getDocumentElement(), "rootfile");
        if (rootfiles.isEmpty()) {
            return Optional.empty();
        }

        Element rootfile = rootfiles.get(0);
        String fullPath = rootfile.getAttribute("full-path");
        if (fullPath.isEmpty()) {
            fullPath = rootfile.getAttribute("fullPath");
        }

        String normalized = PathUtils.normalize(fullPath);
        return normalized.isEmpty() ? Optional.empty() : Optional.of(normalized);
    }
}
