package guraa.epubcompare.report;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ComparisonReportTest {

    @Test
    void namedSectionsRenderWithBanners() {
        ComparisonReport report = new ComparisonReport("a.epub", "b.epub");
        report.section(null).add("ORIG: a.epub").add("TRAN: b.epub");
        report.section("FILE COUNTS").add("orig files: 4").add("tran files: 5");
        report.section("SUMMARY");

        assertEquals("ORIG: a.epub\n"
                + "TRAN: b.epub\n"
                + "== FILE COUNTS ==\n"
                + "orig files: 4\n"
                + "tran files: 5\n"
                + "== SUMMARY ==", report.render());
        assertEquals(report.render(), report.toString());
    }

    @Test
    void sectionsCanBeLookedUpByName() {
        ComparisonReport report = new ComparisonReport("a.epub", "b.epub");
        report.section(null).add("header");
        report.section("MIMETYPE").add("[orig] missing mimetype file");

        assertEquals(1, report.findSection("MIMETYPE").orElseThrow().getLines().size());
        assertFalse(report.findSection("SUMMARY").isPresent());
        assertEquals(2, report.getSections().size());
    }

    @Test
    void completedReportRejectsAdditions() {
        ComparisonReport report = new ComparisonReport("a.epub", "b.epub");
        ReportSection summary = report.section("SUMMARY").add("OPF manifest differs.");

        report.complete();

        assertTrue(report.isComplete());
        assertThrows(IllegalStateException.class, () -> summary.add("late"));
        assertThrows(IllegalStateException.class, () -> report.section("LATE"));
        assertThrows(UnsupportedOperationException.class, () -> summary.getLines().add("direct"));
        assertEquals(1, summary.getLines().size());
    }
}
