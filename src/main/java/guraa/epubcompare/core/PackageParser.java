package guraa.epubcompare.core;

import guraa.epubcompare.util.PathUtils;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses an OPF package document into its manifest and spine.
 */
@Slf4j
public class PackageParser {

    /**
     * Parse a package document.
     * The namespace is taken from the root element; manifest and spine items are looked up
     * in that namespace first and without a namespace when nothing is found.
     *
     * @param opfText The package document text
     * @param opfPath The archive path of the package document, used to resolve item hrefs
     * @return The parsed document, empty when the text is not well-formed
     */
    public PackageDocument parse(String opfText, String opfPath) {
        Document document;
        try {
            document = XmlDocuments.parse(opfText);
        } catch (SAXException | IOException e) {
            log.warn("Unparsable package document {}: {}", opfPath, e.getMessage());
            return PackageDocument.empty();
        }

        Element root = document.getDocumentElement();
        String namespace = root.getNamespaceURI();
        String baseDirectory = PathUtils.directoryOf(opfPath);

        List<ManifestEntry> manifest = new ArrayList<>();
        Map<String, String> pathsById = new HashMap<>();

        for (Element item : findItems(root, namespace, "manifest", "item")) {
            String href = item.getAttribute("href");
            if (href.isEmpty()) {
                continue;
            }
            String id = item.getAttribute("id");
            String path = PathUtils.resolve(baseDirectory, href);
            manifest.add(new ManifestEntry(id, path, item.getAttribute("media-type")));
            if (!id.isEmpty()) {
                pathsById.put(id, path);
            }
        }

        List<String> readingOrder = new ArrayList<>();
        for (Element itemref : findItems(root, namespace, "spine", "itemref")) {
            String path = pathsById.get(itemref.getAttribute("idref"));
            // Dangling idrefs are tolerated
            if (path != null) {
                readingOrder.add(path);
            }
        }

        log.debug("Parsed {}: {} manifest items, {} spine items", opfPath, manifest.size(), readingOrder.size());
        return new PackageDocument(manifest, readingOrder);
    }

    private List<Element> findItems(Element root, String namespace, String containerName, String itemName) {
        List<Element> items = collectItems(root, namespace, containerName, itemName);
        if (items.isEmpty() && namespace != null) {
            items = collectItems(root, null, containerName, itemName);
        }
        return items;
    }

    private List<Element> collectItems(Element root, String namespace, String containerName, String itemName) {
        List<Element> containers = new ArrayList<>();
        if (containerName.equals(root.getLocalName())) {
            containers.add(root);
        }
        containers.addAll(XmlDocuments.descendants(root, namespace, containerName));

        List<Element> items = new ArrayList<>();
        for (Element container : containers) {
            items.addAll(XmlDocuments.children(container, namespace, itemName));
        }
        return items;
    }
}
