package guraa.epubcompare.report;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Ordered, append-only text report produced by one comparison run.
 */
public class ComparisonReport {

    private static final String LINE_SEPARATOR = "\n";

    private final String original;
    private final String translated;
    private final LocalDateTime comparedAt;
    private final List<ReportSection> sections = new ArrayList<>();
    private boolean complete;

    public ComparisonReport(String original, String translated) {
        this.original = original;
        this.translated = translated;
        this.comparedAt = LocalDateTime.now();
    }

    /**
     * Append a new section.
     *
     * @param name The banner name, null for an unbannered header
     * @return The new section
     */
    public ReportSection section(String name) {
        if (complete) {
            throw new IllegalStateException("Report is complete");
        }
        ReportSection section = new ReportSection(name);
        sections.add(section);
        return section;
    }

    /**
     * Freeze the report. No section or line can be added afterwards.
     */
    public void complete() {
        complete = true;
        sections.forEach(ReportSection::seal);
    }

    @JsonIgnore
    public boolean isComplete() {
        return complete;
    }

    public String getOriginal() {
        return original;
    }

    public String getTranslated() {
        return translated;
    }

    public LocalDateTime getComparedAt() {
        return comparedAt;
    }

    public List<ReportSection> getSections() {
        return Collections.unmodifiableList(sections);
    }

    public Optional<ReportSection> findSection(String name) {
        return sections.stream()
                .filter(section -> name.equals(section.getName()))
                .findFirst();
    }

    /**
     * Render as plain text, each named section opened by an "== NAME ==" banner.
     *
     * @return The report text
     */
    public String render() {
        List<String> out = new ArrayList<>();
        for (ReportSection section : sections) {
            if (section.getName() != null) {
                out.add("== " + section.getName() + " ==");
            }
            out.addAll(section.getLines());
        }
        return String.join(LINE_SEPARATOR, out);
    }

    @Override
    public String toString() {
        return render();
    }
}
