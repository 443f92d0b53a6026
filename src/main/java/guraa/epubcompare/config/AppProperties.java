package guraa.epubcompare.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;

/**
 * Configuration properties for the application
 */
@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private final Storage storage = new Storage();
    private final Comparison comparison = new Comparison();

    public Storage getStorage() {
        return storage;
    }

    public Comparison getComparison() {
        return comparison;
    }

    /**
     * Storage configuration properties
     */
    public static class Storage {
        private String location = Paths.get(System.getProperty("java.io.tmpdir"), "epub-compare").toString();

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }
    }

    /**
     * Display limits applied while building a comparison report
     */
    public static class Comparison {
        private int listDisplayLimit = 50;
        private int contentDiffLimit = 50;
        private int markupValidationLimit = 20;
        private int markupIssueLimit = 50;
        private int wellFormedSampleLimit = 50;
        private int wellFormedReportLimit = 20;
        private int summarySampleLimit = 10;
        private int digestLength = 10;

        public int getListDisplayLimit() {
            return listDisplayLimit;
        }

        public void setListDisplayLimit(int listDisplayLimit) {
            this.listDisplayLimit = listDisplayLimit;
        }

        public int getContentDiffLimit() {
            return contentDiffLimit;
        }

        public void setContentDiffLimit(int contentDiffLimit) {
            this.contentDiffLimit = contentDiffLimit;
        }

        public int getMarkupValidationLimit() {
            return markupValidationLimit;
        }

        public void setMarkupValidationLimit(int markupValidationLimit) {
            this.markupValidationLimit = markupValidationLimit;
        }

        public int getMarkupIssueLimit() {
            return markupIssueLimit;
        }

        public void setMarkupIssueLimit(int markupIssueLimit) {
            this.markupIssueLimit = markupIssueLimit;
        }

        public int getWellFormedSampleLimit() {
            return wellFormedSampleLimit;
        }

        public void setWellFormedSampleLimit(int wellFormedSampleLimit) {
            this.wellFormedSampleLimit = wellFormedSampleLimit;
        }

        public int getWellFormedReportLimit() {
            return wellFormedReportLimit;
        }

        public void setWellFormedReportLimit(int wellFormedReportLimit) {
            this.wellFormedReportLimit = wellFormedReportLimit;
        }

        public int getSummarySampleLimit() {
            return summarySampleLimit;
        }

        public void setSummarySampleLimit(int summarySampleLimit) {
            this.summarySampleLimit = summarySampleLimit;
        }

        public int getDigestLength() {
            return digestLength;
        }

        public void setDigestLength(int digestLength) {
            this.digestLength = digestLength;
        }
    }
}
