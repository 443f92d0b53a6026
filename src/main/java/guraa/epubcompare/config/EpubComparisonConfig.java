package guraa.epubcompare.config;

import guraa.epubcompare.comparison.ContentDiffer;
import guraa.epubcompare.comparison.StructuralDiffer;
import guraa.epubcompare.core.ContainerResolver;
import guraa.epubcompare.core.PackageParser;
import guraa.epubcompare.validation.MarkupValidator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for EPUB comparison beans
 */
@Configuration
public class EpubComparisonConfig {

    @Bean
    public ContainerResolver containerResolver() {
        return new ContainerResolver();
    }

    @Bean
    public PackageParser packageParser() {
        return new PackageParser();
    }

    @Bean
    public StructuralDiffer structuralDiffer() {
        return new StructuralDiffer();
    }

    /**
     * Creates the content differ with the configured digest prefix length
     * @param properties The application properties
     * @return The ContentDiffer instance
     */
    @Bean
    public ContentDiffer contentDiffer(AppProperties properties) {
        return new ContentDiffer(properties.getComparison().getDigestLength());
    }

    /**
     * Creates the markup validator with the configured document and issue limits
     * @param properties The application properties
     * @return The MarkupValidator instance
     */
    @Bean
    public MarkupValidator markupValidator(AppProperties properties) {
        AppProperties.Comparison comparison = properties.getComparison();
        return new MarkupValidator(comparison.getMarkupValidationLimit(), comparison.getMarkupIssueLimit());
    }
}
