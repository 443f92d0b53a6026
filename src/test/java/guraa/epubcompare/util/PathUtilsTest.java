package guraa.epubcompare.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PathUtilsTest {

    @Test
    void normalizeConvertsBackslashesAndStripsDotSegments() {
        assertEquals("OEBPS/text/ch1.xhtml", PathUtils.normalize(" .\\OEBPS\\text\\ch1.xhtml "));
        assertEquals("OEBPS/ch1.xhtml", PathUtils.normalize("./OEBPS/./ch1.xhtml"));
        assertEquals("OEBPS/ch1.xhtml", PathUtils.normalize("OEBPS//ch1.xhtml"));
    }

    @Test
    void normalizeCollapsesParentSegments() {
        assertEquals("OEBPS/images/cover.png", PathUtils.normalize("OEBPS/text/../images/cover.png"));
        assertEquals("../cover.png", PathUtils.normalize("../cover.png"));
    }

    @Test
    void normalizeHandlesEmptyInput() {
        assertEquals("", PathUtils.normalize(null));
        assertEquals("", PathUtils.normalize("   "));
        assertEquals("", PathUtils.normalize("./"));
    }

    @Test
    void directoryAndFileName() {
        assertEquals("OEBPS/text", PathUtils.directoryOf("OEBPS/text/ch1.xhtml"));
        assertEquals("", PathUtils.directoryOf("content.opf"));
        assertEquals("toc.xhtml", PathUtils.fileNameOf("OEBPS/toc.xhtml"));
    }

    @Test
    void resolveIsRelativeToBaseDirectory() {
        assertEquals("text/img/cover.png", PathUtils.resolve("text", "img/cover.png"));
        assertEquals("img/cover.png", PathUtils.resolve("text", "../img/cover.png"));
        assertEquals("ch1.xhtml", PathUtils.resolve("", "ch1.xhtml"));
    }
}
