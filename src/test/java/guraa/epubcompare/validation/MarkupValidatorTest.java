package guraa.epubcompare.validation;

import guraa.epubcompare.EpubFixture;
import guraa.epubcompare.comparison.ContentComparisonResult;
import guraa.epubcompare.comparison.ContentDiffer;
import guraa.epubcompare.core.EpubArchive;
import guraa.epubcompare.core.ManifestEntry;
import guraa.epubcompare.core.PackageDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MarkupValidatorTest {

    private static final String XHTML_HEAD = "<html xmlns=\"http://www.w3.org/1999/xhtml\"><head><title>t</title></head>";

    private final MarkupValidator validator = new MarkupValidator(20, 50);

    @TempDir
    Path tempDir;

    private static List<String> messages(List<MarkupIssue> issues) {
        return issues.stream().map(MarkupIssue::getMessage).collect(Collectors.toList());
    }

    @Test
    void unclosedImageIsReportedOnce() {
        String text = XHTML_HEAD + "<body><img src=\"cover.png\"><br/><hr /></body></html>";

        List<String> found = messages(validator.validate("ch1.xhtml", text, Set.of("ch1.xhtml", "cover.png")));

        assertEquals(List.of("xhtml <img> not self-closed"), found);
    }

    @Test
    void eachVoidElementKindIsIndependent() {
        String text = XHTML_HEAD + "<body><img src=\"cover.png\"><br><BR><hr></body></html>";

        List<String> found = messages(validator.validate("ch1.xhtml", text, Set.of("cover.png")));

        assertEquals(List.of(
                "xhtml <img> not self-closed",
                "xhtml <br> not self-closed",
                "xhtml <hr> not self-closed"), found);
    }

    @Test
    void htmlDocumentsSkipXhtmlOnlyChecks() {
        String text = "<html><body><img src=\"cover.png\"><br></body></html>";

        assertEquals(List.of(), validator.validate("ch1.html", text, Set.of("cover.png")));
    }

    @Test
    void referencesResolveAgainstDocumentDirectory() {
        String text = XHTML_HEAD + "<body><img src=\"img/cover.png\"/></body></html>";

        List<MarkupIssue> issues = validator.validate("text/ch1.xhtml", text, Set.of("text/ch1.xhtml", "img/cover.png"));

        assertEquals(List.of(new MarkupIssue("text/ch1.xhtml", "missing referenced resource: text/img/cover.png")), issues);
        assertEquals("text/ch1.xhtml: missing referenced resource: text/img/cover.png", issues.get(0).describe());
    }

    @Test
    void parentReferencesAreResolved() {
        String text = XHTML_HEAD + "<body><img src='../images/cover.png'/>"
                + "<a href=\"ch2.xhtml\">n</a></body></html>";

        List<String> missing = validator.findMissingReferences("text/ch1.xhtml", text, Set.of("images/cover.png"));

        assertEquals(List.of("text/ch2.xhtml"), missing);
    }

    @Test
    void referencesAreComparedWithFragmentAndQuery() {
        String text = XHTML_HEAD + "<body><a href=\"ch2.xhtml#note\">n</a><a href=\"ch2.xhtml?v=2\">q</a></body></html>";

        List<String> missing = validator.findMissingReferences("ch1.xhtml", text, Set.of("ch1.xhtml", "ch2.xhtml"));

        assertEquals(List.of("ch2.xhtml#note", "ch2.xhtml?v=2"), missing);
    }

    @Test
    void fragmentsAndExternalUrisAreSkipped() {
        String text = XHTML_HEAD + "<body>"
                + "<a href=\"#top\">a</a>"
                + "<a href=\"https://example.com/x\">b</a>"
                + "<a href=\"mailto:someone@example.com\">c</a>"
                + "<img src=\"data:image/png;base64,AAAA\"/>"
                + "<a href=\" \">d</a>"
                + "</body></html>";

        assertEquals(List.of(), validator.findMissingReferences("ch1.xhtml", text, Set.of()));
    }

    @Test
    void unescapedAmpersandIsReportedOnce() {
        String text = XHTML_HEAD + "<body><p>Fish & chips & peas &amp; &#38; &#x26;</p></body></html>";

        assertEquals(List.of("unescaped & found"), messages(validator.validate("ch1.xhtml", text, Set.of())));
    }

    @Test
    void escapedAmpersandsAreAccepted() {
        String text = XHTML_HEAD + "<body><p>&amp; &nbsp; &#160; &#xA0;</p></body></html>";

        assertEquals(List.of(), validator.validate("ch1.xhtml", text, Set.of()));
    }

    @Test
    void rootNamespaceIsCheckedBeforeFirstTagEnd() {
        String withoutNamespace = "<html><head></head><body/></html>";
        String namespaceLater = "<html lang=\"uk\"><body xmlns=\"http://www.w3.org/1999/xhtml\"/></html>";

        assertEquals(List.of("missing xmlns on <html>"), messages(validator.validate("a.xhtml", withoutNamespace, Set.of())));
        assertEquals(List.of("missing xmlns on <html>"), messages(validator.validate("a.xhtml", namespaceLater, Set.of())));
        assertEquals(List.of(), validator.validate("a.html", withoutNamespace, Set.of()));
        assertEquals(List.of(), validator.validate("a.xhtml", "<p>fragment</p>", Set.of()));
    }

    @Test
    void xmlDeclarationEndsTheInspectedHead() {
        List<String> found = messages(validator.validate("a.xhtml", EpubFixture.CH1_XHTML, Set.of()));

        assertEquals(List.of("missing xmlns on <html>"), found);
    }

    @Test
    void tableOfContentsNeedsNavMarker() {
        String plain = XHTML_HEAD + "<body><ol><li>One</li></ol></body></html>";
        String landmark = XHTML_HEAD + "<body><nav epub:type=\"toc\"><ol/></nav></body></html>";
        String aria = XHTML_HEAD + "<body><nav role=\"doc-toc\"><ol/></nav></body></html>";

        assertEquals(List.of("toc.xhtml: missing <nav epub:type=\"toc\"> or role=\"doc-toc\""),
                messages(validator.validate("OEBPS/TOC.xhtml", plain, Set.of())));
        assertEquals(List.of(), validator.validate("OEBPS/toc.xhtml", landmark, Set.of()));
        assertEquals(List.of(), validator.validate("OEBPS/toc.xhtml", aria, Set.of()));
        assertEquals(List.of(), validator.validate("OEBPS/ch1.xhtml", plain, Set.of()));
    }

    @Test
    void changedMarkupIsValidatedWithinLimits() throws IOException {
        String broken = XHTML_HEAD + "<body><img src=\"a.png\"><p>R&D</p></body></html>";
        EpubFixture originalBook = EpubFixture.minimal();
        EpubFixture translatedBook = EpubFixture.minimal();
        for (int i = 1; i <= 3; i++) {
            originalBook.deflated("c" + i + ".xhtml", XHTML_HEAD + "<body/></html>");
            translatedBook.deflated("c" + i + ".xhtml", broken);
        }
        Path original = originalBook.writeTo(tempDir.resolve("orig.epub"));
        Path translated = translatedBook.writeTo(tempDir.resolve("tran.epub"));

        try (EpubArchive o = EpubArchive.open(original); EpubArchive t = EpubArchive.open(translated)) {
            ContentComparisonResult content = new ContentDiffer(10).diff(o, t);

            List<MarkupIssue> limitedDocuments = new MarkupValidator(2, 50).validateChanged(content, t.getFileSet());
            assertEquals(Set.of("c1.xhtml", "c2.xhtml"),
                    limitedDocuments.stream().map(MarkupIssue::getPath).collect(Collectors.toSet()));
            assertEquals(6, limitedDocuments.size());

            List<MarkupIssue> limitedIssues = new MarkupValidator(20, 4).validateChanged(content, t.getFileSet());
            assertEquals(4, limitedIssues.size());
            assertEquals("c1.xhtml", limitedIssues.get(0).getPath());
        }
    }

    @Test
    void malformedTranslatedXhtmlIsDetected() throws IOException {
        String chapter2 = XHTML_HEAD + "<body><p>ok</p></body></html>";
        Path translated = EpubFixture.minimal()
                .replace("ch1.xhtml", XHTML_HEAD + "<body><p>unclosed</body></html>")
                .deflated("ch2.xhtml", chapter2)
                .deflated("style.css", "p{}")
                .writeTo(tempDir.resolve("tran.epub"));
        PackageDocument document = new PackageDocument(List.of(
                new ManifestEntry("ch1", "ch1.xhtml", MarkupValidator.XHTML_MEDIA_TYPE),
                new ManifestEntry("ch2", "ch2.xhtml", MarkupValidator.XHTML_MEDIA_TYPE),
                new ManifestEntry("ch3", "ch3.xhtml", MarkupValidator.XHTML_MEDIA_TYPE),
                new ManifestEntry("css", "style.css", "text/css")), List.of());

        try (EpubArchive archive = EpubArchive.open(translated)) {
            assertEquals(List.of("ch1.xhtml", "ch3.xhtml"),
                    validator.findMalformedDocuments(document, document, archive, 50));
            assertEquals(List.of("ch1.xhtml"),
                    validator.findMalformedDocuments(document, document, archive, 2));
            assertTrue(validator.findMalformedDocuments(document, PackageDocument.empty(), archive, 50).isEmpty());
        }
    }
}
