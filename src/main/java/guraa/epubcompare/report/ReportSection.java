package guraa.epubcompare.report;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named group of report lines. Lines can only be appended, and only until the report is completed.
 */
public class ReportSection {

    private final String name;
    private final List<String> lines = new ArrayList<>();
    private boolean sealed;

    ReportSection(String name) {
        this.name = name;
    }

    /**
     * Get the section name, rendered as a banner. Null for the header section.
     *
     * @return The name
     */
    public String getName() {
        return name;
    }

    public List<String> getLines() {
        return Collections.unmodifiableList(lines);
    }

    public ReportSection add(String line) {
        if (sealed) {
            throw new IllegalStateException("Report section " + name + " is complete");
        }
        lines.add(line);
        return this;
    }

    public ReportSection addAll(List<String> newLines) {
        newLines.forEach(this::add);
        return this;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return lines.isEmpty();
    }

    void seal() {
        sealed = true;
    }
}
