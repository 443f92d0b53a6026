package guraa.epubcompare.comparison;

/**
 * Which of the two compared archives a finding belongs to.
 */
public enum Side {
    ORIGINAL("orig"),
    TRANSLATED("tran");

    private final String label;

    Side(String label) {
        this.label = label;
    }

    /**
     * Short label used in report lines.
     *
     * @return "orig" or "tran"
     */
    public String getLabel() {
        return label;
    }
}
