package guraa.epubcompare.report;

import guraa.epubcompare.comparison.BootstrapCheck;
import guraa.epubcompare.comparison.BootstrapViolation;
import guraa.epubcompare.comparison.ChangeRecord;
import guraa.epubcompare.comparison.ContentComparisonResult;
import guraa.epubcompare.comparison.ContentDiffer;
import guraa.epubcompare.comparison.MediaTypeDifference;
import guraa.epubcompare.comparison.ReadingOrderComparison;
import guraa.epubcompare.comparison.SetDifference;
import guraa.epubcompare.comparison.Side;
import guraa.epubcompare.comparison.StructuralDiffer;
import guraa.epubcompare.config.AppProperties;
import guraa.epubcompare.core.ContainerResolver;
import guraa.epubcompare.core.EpubArchive;
import guraa.epubcompare.core.PackageDocument;
import guraa.epubcompare.core.PackageParser;
import guraa.epubcompare.validation.MarkupIssue;
import guraa.epubcompare.validation.MarkupValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Drives a full comparison of an original and a translated EPUB and assembles the report.
 * Stages run in order: file sets, mimetype, rootfile, manifest and spine, content, markup, summary.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportAggregator {

    public static final String FILE_COUNTS = "FILE COUNTS";
    public static final String MIMETYPE = "MIMETYPE";
    public static final String OPF_PATHS = "OPF PATHS";
    public static final String OPF_MANIFEST = "OPF MANIFEST";
    public static final String OPF_SPINE = "OPF SPINE";
    public static final String MANIFEST_REFERENCES = "MANIFEST REFERENCES";
    public static final String CONTENT_DIFF = "COMMON FILE CONTENT DIFF";
    public static final String MARKUP_ISSUES = "XHTML/HTML ISSUES (translated, sample)";
    public static final String SUMMARY = "SUMMARY";

    public static final String MARKUP_HINT =
            "Structures and non-HTML content identical. If Apple Books fails, likely malformed HTML/XHTML content.";

    private final ContainerResolver containerResolver;
    private final PackageParser packageParser;
    private final StructuralDiffer structuralDiffer;
    private final ContentDiffer contentDiffer;
    private final MarkupValidator markupValidator;
    private final AppProperties properties;

    /**
     * Create an aggregator with default limits, outside of a Spring context.
     *
     * @return The aggregator
     */
    public static ReportAggregator withDefaults() {
        AppProperties properties = new AppProperties();
        AppProperties.Comparison limits = properties.getComparison();
        return new ReportAggregator(
                new ContainerResolver(),
                new PackageParser(),
                new StructuralDiffer(),
                new ContentDiffer(limits.getDigestLength()),
                new MarkupValidator(limits.getMarkupValidationLimit(), limits.getMarkupIssueLimit()),
                properties);
    }

    /**
     * Compare two EPUB files.
     *
     * @param original The original archive
     * @param translated The translated archive
     * @return The completed report
     * @throws IOException If either archive cannot be opened or read
     */
    public ComparisonReport compare(Path original, Path translated) throws IOException {
        log.info("Comparing {} with {}", original, translated);
        ComparisonReport report = new ComparisonReport(original.toString(), translated.toString());
        report.section(null)
                .add("ORIG: " + original)
                .add("TRAN: " + translated);

        try (EpubArchive originalArchive = EpubArchive.open(original);
             EpubArchive translatedArchive = EpubArchive.open(translated)) {
            Findings findings = compareArchives(originalArchive, translatedArchive, report);
            appendSummary(report, findings);
            log.info("Comparison finished: {} changed files, {} markup issues, structure {}",
                    findings.content.getChanges().size(), findings.markupIssues.size(),
                    findings.isStructureClean() ? "identical" : "differs");
        }

        report.complete();
        return report;
    }

    private Findings compareArchives(EpubArchive original, EpubArchive translated, ComparisonReport report) {
        AppProperties.Comparison limits = properties.getComparison();
        Findings findings = new Findings();

        // File sets
        findings.files = structuralDiffer.diffFiles(original, translated);
        ReportSection counts = report.section(FILE_COUNTS)
                .add("orig files: " + original.getFiles().size())
                .add("tran files: " + translated.getFiles().size());
        appendSetDifference(counts, findings.files, "Missing in translated:", "Extra in translated:");

        // Mimetype
        ReportSection mimetype = report.section(MIMETYPE);
        for (BootstrapCheck check : List.of(
                structuralDiffer.checkBootstrap(Side.ORIGINAL, original),
                structuralDiffer.checkBootstrap(Side.TRANSLATED, translated))) {
            findings.bootstrapChecks.add(check);
            appendBootstrapCheck(mimetype, check);
        }

        // Rootfile
        findings.originalRootfile = containerResolver.resolveRootfile(original).orElse(null);
        findings.translatedRootfile = containerResolver.resolveRootfile(translated).orElse(null);
        findings.rootfileMismatch = structuralDiffer.isRootfileMismatch(findings.originalRootfile, findings.translatedRootfile);
        ReportSection opfPaths = report.section(OPF_PATHS)
                .add("orig OPF: " + describeRootfile(findings.originalRootfile))
                .add("tran OPF: " + describeRootfile(findings.translatedRootfile));
        if (findings.rootfileMismatch) {
            opfPaths.add("ERROR: OPF path differs between original and translated");
        }

        // Package documents
        Optional<PackageDocument> originalPackage = loadPackage(original, findings.originalRootfile);
        Optional<PackageDocument> translatedPackage = loadPackage(translated, findings.translatedRootfile);
        if (originalPackage.isPresent() && translatedPackage.isPresent()) {
            comparePackages(originalPackage.get(), translatedPackage.get(), original, translated, report, findings);
        } else {
            report.section(OPF_MANIFEST)
                    .add("Package document unavailable (orig: " + availability(originalPackage)
                            + ", tran: " + availability(translatedPackage) + "), manifest and spine checks skipped");
        }

        // Content
        findings.content = contentDiffer.diff(original, translated);
        ReportSection contentSection = report.section(CONTENT_DIFF + " (first " + limits.getContentDiffLimit() + ")");
        if (findings.content.hasChanges()) {
            contentSection.addAll(findings.content.getChanges().stream()
                    .limit(limits.getContentDiffLimit())
                    .map(ChangeRecord::describe)
                    .collect(Collectors.toList()));
        } else {
            contentSection.add("no content diffs");
        }

        // Markup
        findings.markupIssues = markupValidator.validateChanged(findings.content, translated.getFileSet());
        if (!findings.markupIssues.isEmpty()) {
            report.section(MARKUP_ISSUES).addAll(findings.markupIssues.stream()
                    .map(MarkupIssue::describe)
                    .collect(Collectors.toList()));
        }

        return findings;
    }

    private void comparePackages(PackageDocument originalPackage, PackageDocument translatedPackage,
                                 EpubArchive original, EpubArchive translated,
                                 ComparisonReport report, Findings findings) {
        AppProperties.Comparison limits = properties.getComparison();
        findings.packagesCompared = true;

        ReportSection manifest = report.section(OPF_MANIFEST);
        findings.manifest = structuralDiffer.diffManifests(originalPackage, translatedPackage);
        appendSetDifference(manifest, findings.manifest, "Manifest missing in translated:", "Manifest extra in translated:");

        findings.mediaTypes = structuralDiffer.diffMediaTypes(originalPackage, translatedPackage);
        for (MediaTypeDifference difference : findings.mediaTypes) {
            manifest.add("MEDIA-TYPE DIFF: " + difference.getPath() + ": "
                    + difference.getOriginalMediaType() + " vs " + difference.getTranslatedMediaType());
        }
        if (manifest.isEmpty()) {
            manifest.add("manifest identical");
        }

        findings.readingOrder = structuralDiffer.compareReadingOrder(originalPackage, translatedPackage);
        report.section(OPF_SPINE)
                .add("SPINE length: " + findings.readingOrder.getOriginalLength()
                        + " vs " + findings.readingOrder.getTranslatedLength())
                .add("FIRST SPINE DIFF INDEX: " + findings.readingOrder.getFirstDivergenceIndex());

        ReportSection references = report.section(MANIFEST_REFERENCES);
        findings.unresolvedOriginal = structuralDiffer.findUnresolvedManifestPaths(originalPackage, original);
        findings.unresolvedTranslated = structuralDiffer.findUnresolvedManifestPaths(translatedPackage, translated);
        findings.unresolvedOriginal.forEach(path -> references.add("ORIG manifest references missing file in zip: " + path));
        findings.unresolvedTranslated.forEach(path -> references.add("TRAN manifest references missing file in zip: " + path));

        findings.malformedXhtml = markupValidator.findMalformedDocuments(
                originalPackage, translatedPackage, translated, limits.getWellFormedSampleLimit());
        if (!findings.malformedXhtml.isEmpty()) {
            references.add("Translated XHTML not well-formed (sample):");
            references.add(joinLimited(findings.malformedXhtml, limits.getWellFormedReportLimit()));
        }
        if (references.isEmpty()) {
            references.add("all manifest items present");
        }
    }

    private Optional<PackageDocument> loadPackage(EpubArchive archive, String rootfile) {
        if (rootfile == null || !archive.contains(rootfile)) {
            return Optional.empty();
        }
        return archive.readText(rootfile, StandardCharsets.UTF_8.name())
                .map(text -> packageParser.parse(text, rootfile));
    }

    private void appendSummary(ComparisonReport report, Findings findings) {
        AppProperties.Comparison limits = properties.getComparison();
        ReportSection summary = report.section(SUMMARY);

        if (!findings.files.isEmpty()) {
            summary.add("Files set differs (missing/extra).");
        }
        for (BootstrapCheck check : findings.bootstrapChecks) {
            if (!check.isValid()) {
                summary.add("[" + check.getSide().getLabel() + "] mimetype entry violates container rules.");
            }
        }
        if (findings.rootfileMismatch) {
            summary.add("OPF rootfile path differs.");
        }
        if (findings.packagesCompared) {
            if (!findings.manifest.isEmpty()) {
                summary.add("OPF manifest differs.");
            }
            if (!findings.mediaTypes.isEmpty()) {
                summary.add("Media-type differs for " + findings.mediaTypes.size() + " file(s).");
            }
            if (findings.readingOrder.isDifferent()) {
                summary.add("OPF spine order/length differs.");
            }
            if (!findings.unresolvedOriginal.isEmpty() || !findings.unresolvedTranslated.isEmpty()) {
                summary.add("Manifest references files missing from the archive.");
            }
            if (!findings.malformedXhtml.isEmpty()) {
                summary.add("Translated XHTML not well-formed: " + findings.malformedXhtml.size() + " file(s).");
            }
        }

        List<String> nonMarkup = findings.content.getNonMarkupChanges().stream()
                .map(ChangeRecord::getPath)
                .collect(Collectors.toList());
        if (!nonMarkup.isEmpty()) {
            summary.add("Non-HTML changed files (sample): "
                    + String.join(", ", nonMarkup.subList(0, Math.min(limits.getSummarySampleLimit(), nonMarkup.size()))));
        }
        if (!findings.markupIssues.isEmpty()) {
            summary.add("HTML/XHTML issues detected (see above).");
        }

        if (findings.isStructureClean() && nonMarkup.isEmpty()) {
            summary.add(MARKUP_HINT);
        }
    }

    private void appendSetDifference(ReportSection section, SetDifference difference, String missingLabel, String extraLabel) {
        int limit = properties.getComparison().getListDisplayLimit();
        if (!difference.getMissing().isEmpty()) {
            section.add(missingLabel);
            section.add(joinLimited(difference.getMissing(), limit));
        }
        if (!difference.getExtra().isEmpty()) {
            section.add(extraLabel);
            section.add(joinLimited(difference.getExtra(), limit));
        }
    }

    private void appendBootstrapCheck(ReportSection section, BootstrapCheck check) {
        String label = "[" + check.getSide().getLabel() + "] ";
        if (!check.isPresent()) {
            section.add(label + BootstrapViolation.MISSING.getMessage());
            return;
        }
        section.add(label + "mimetype content: '" + check.getContent() + "', first=" + check.isFirst()
                + ", compress_type=" + check.getCompressionMethod());
        for (BootstrapViolation violation : check.getViolations()) {
            section.add(label + violation.getMessage());
        }
    }

    /**
     * Join at most {@code limit} values, marking truncation with a trailing " ...".
     */
    static String joinLimited(List<String> values, int limit) {
        String joined = String.join(", ", values.subList(0, Math.min(limit, values.size())));
        return values.size() > limit ? joined + " ..." : joined;
    }

    private static String describeRootfile(String rootfile) {
        return rootfile != null ? rootfile : "none";
    }

    private static String availability(Optional<PackageDocument> document) {
        return document.isPresent() ? "ok" : "missing";
    }

    /**
     * Intermediate results of one run, used to build the summary.
     */
    private static class Findings {
        SetDifference files;
        List<BootstrapCheck> bootstrapChecks = new ArrayList<>();
        String originalRootfile;
        String translatedRootfile;
        boolean rootfileMismatch;
        boolean packagesCompared;
        SetDifference manifest;
        List<MediaTypeDifference> mediaTypes = List.of();
        ReadingOrderComparison readingOrder;
        List<String> unresolvedOriginal = List.of();
        List<String> unresolvedTranslated = List.of();
        List<String> malformedXhtml = List.of();
        ContentComparisonResult content;
        List<MarkupIssue> markupIssues = List.of();

        boolean isStructureClean() {
            boolean bootstrapClean = bootstrapChecks.stream().allMatch(BootstrapCheck::isValid);
            boolean packagesClean = !packagesCompared
                    || (manifest.isEmpty()
                    && mediaTypes.isEmpty()
                    && !readingOrder.isDifferent()
                    && unresolvedOriginal.isEmpty()
                    && unresolvedTranslated.isEmpty());
            return files.isEmpty() && bootstrapClean && !rootfileMismatch && packagesClean;
        }
    }
}
