package guraa.epubcompare.validation;

import guraa.epubcompare.comparison.ChangeRecord;
import guraa.epubcompare.comparison.ContentComparisonResult;
import guraa.epubcompare.core.EpubArchive;
import guraa.epubcompare.core.PackageDocument;
import guraa.epubcompare.core.XmlDocuments;
import guraa.epubcompare.util.PathUtils;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based checks for translated HTML/XHTML content documents.
 * No DOM is built except for the well-formedness check.
 */
@Slf4j
public class MarkupValidator {

    public static final String XHTML_MEDIA_TYPE = "application/xhtml+xml";

    private static final Pattern UNESCAPED_AMPERSAND =
            Pattern.compile("&(?!#\\d+;|#x[0-9A-Fa-f]+;|[A-Za-z][A-Za-z0-9]+;)");
    private static final Pattern RESOURCE_REFERENCE =
            Pattern.compile("(?:src|href)=[\"']([^\"']+)[\"']", Pattern.CASE_INSENSITIVE);
    private static final Pattern URI_SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*:");
    private static final List<String> VOID_ELEMENTS = List.of("img", "br", "hr");
    private static final Map<String, Pattern> UNCLOSED_VOID_ELEMENTS = Map.of(
            "img", unclosedPattern("img"),
            "br", unclosedPattern("br"),
            "hr", unclosedPattern("hr"));

    private final int documentLimit;
    private final int issueLimit;

    /**
     * @param documentLimit Maximum number of changed markup documents to validate
     * @param issueLimit Maximum number of issues returned across all documents
     */
    public MarkupValidator(int documentLimit, int issueLimit) {
        this.documentLimit = documentLimit;
        this.issueLimit = issueLimit;
    }

    private static Pattern unclosedPattern(String element) {
        return Pattern.compile("<" + element + "\\b[^>]*(?<!/)>", Pattern.CASE_INSENSITIVE);
    }

    /**
     * Validate the translated side of every changed markup document.
     *
     * @param content The content comparison
     * @param translatedFiles The file set of the translated archive
     * @return Issues in document order, capped at the issue limit
     */
    public List<MarkupIssue> validateChanged(ContentComparisonResult content, Set<String> translatedFiles) {
        List<MarkupIssue> issues = new ArrayList<>();
        List<ChangeRecord> markupChanges = content.getMarkupChanges();

        for (ChangeRecord change : markupChanges.subList(0, Math.min(documentLimit, markupChanges.size()))) {
            byte[] bytes = content.getTranslatedMarkup().get(change.getPath());
            if (bytes == null) {
                continue;
            }
            String text = EpubArchive.decode(bytes, StandardCharsets.UTF_8.name(), CodingErrorAction.REPLACE);
            issues.addAll(validate(change.getPath(), text, translatedFiles));
        }

        if (issues.size() > issueLimit) {
            log.debug("Truncating {} markup issues to {}", issues.size(), issueLimit);
            return List.copyOf(issues.subList(0, issueLimit));
        }
        return issues;
    }

    /**
     * Run every heuristic check on one document.
     *
     * @param path The archive path of the document
     * @param text The document text
     * @param archiveFiles The files of the archive the document belongs to
     * @return The issues found
     */
    public List<MarkupIssue> validate(String path, String text, Set<String> archiveFiles) {
        List<String> messages = new ArrayList<>();
        String lower = text.toLowerCase(Locale.ROOT);
        boolean xhtml = path.toLowerCase(Locale.ROOT).endsWith(".xhtml");

        if (xhtml && isMissingRootNamespace(lower)) {
            messages.add("missing xmlns on <html>");
        }

        if (UNESCAPED_AMPERSAND.matcher(text).find()) {
            messages.add("unescaped & found");
        }

        if (xhtml) {
            for (String element : VOID_ELEMENTS) {
                if (UNCLOSED_VOID_ELEMENTS.get(element).matcher(text).find()) {
                    messages.add("xhtml <" + element + "> not self-closed");
                }
            }
        }

        for (String missing : findMissingReferences(path, text, archiveFiles)) {
            messages.add("missing referenced resource: " + missing);
        }

        if (isToc(path) && !hasTocMarker(lower)) {
            messages.add("toc.xhtml: missing <nav epub:type=\"toc\"> or role=\"doc-toc\"");
        }

        List<MarkupIssue> issues = new ArrayList<>();
        for (String message : messages) {
            issues.add(new MarkupIssue(path, message));
        }
        return issues;
    }

    /**
     * Only the text before the first '>' of the document is inspected.
     */
    private boolean isMissingRootNamespace(String lower) {
        if (!lower.contains("<html")) {
            return false;
        }
        int end = lower.indexOf('>');
        String head = end < 0 ? lower : lower.substring(0, end);
        return !head.contains("xmlns=");
    }

    /**
     * Resolve src and href values against the document directory and report those absent from the archive.
     *
     * @param path The document path
     * @param text The document text
     * @param archiveFiles The archive file set
     * @return Resolved paths that do not exist, one per reference
     */
    List<String> findMissingReferences(String path, String text, Set<String> archiveFiles) {
        String baseDirectory = PathUtils.directoryOf(path);
        List<String> missing = new ArrayList<>();

        Matcher matcher = RESOURCE_REFERENCE.matcher(text);
        while (matcher.find()) {
            String reference = matcher.group(1).trim();
            if (reference.isEmpty() || reference.startsWith("#") || URI_SCHEME.matcher(reference).find()) {
                continue;
            }
            String resolved = PathUtils.resolve(baseDirectory, reference);
            if (!archiveFiles.contains(resolved)) {
                missing.add(resolved);
            }
        }
        return missing;
    }

    private boolean isToc(String path) {
        return PathUtils.fileNameOf(path).toLowerCase(Locale.ROOT).startsWith("toc");
    }

    private boolean hasTocMarker(String lower) {
        return lower.contains("nav")
                && (lower.contains("epub:type=\"toc\"") || lower.contains("role=\"doc-toc\""));
    }

    /**
     * Parse translated XHTML documents declared in both manifests and list those that are not
     * well-formed XML. Documents absent from the archive count as not well-formed.
     *
     * @param original The original package document, whose media types select the candidates
     * @param translatedDocument The translated package document
     * @param translated The translated archive
     * @param sampleLimit Maximum number of documents to parse
     * @return Paths of documents that failed to parse
     */
    public List<String> findMalformedDocuments(PackageDocument original, PackageDocument translatedDocument,
                                               EpubArchive translated, int sampleLimit) {
        Set<String> common = new TreeSet<>(original.getManifestPathSet());
        common.retainAll(translatedDocument.getManifestPathSet());

        List<String> malformed = new ArrayList<>();
        int checked = 0;
        for (String path : common) {
            if (!XHTML_MEDIA_TYPE.equals(original.mediaTypeOf(path))) {
                continue;
            }
            if (checked++ >= sampleLimit) {
                break;
            }
            Optional<String> text = translated.readText(path, StandardCharsets.UTF_8.name());
            if (text.isEmpty() || !XmlDocuments.isWellFormed(text.get())) {
                malformed.add(path);
            }
        }
        return malformed;
    }
}
