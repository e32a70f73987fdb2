package ai.legaldoc.reviser.pipeline;

import ai.legaldoc.reviser.amend.AmendmentFinder;
import ai.legaldoc.reviser.annotate.ComparisonLegend;
import ai.legaldoc.reviser.annotate.ReferenceAnnotator;
import ai.legaldoc.reviser.diff.DiffRegion;
import ai.legaldoc.reviser.diff.DiffRenderer;
import ai.legaldoc.reviser.diff.RegionType;
import ai.legaldoc.reviser.diff.StructuralDiffEngine;
import ai.legaldoc.reviser.format.FormatPreservingCopier;
import ai.legaldoc.reviser.model.Document;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the annotated comparison of two versions of a law: legend and title, the colored block diff,
 * the amending act's citation above each modified article, and the spacer after the first article.
 */
public class ComparisonPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(ComparisonPipeline.class);

    private final ComparisonLegend legend;
    private final StructuralDiffEngine diffEngine;
    private final DiffRenderer renderer;
    private final AmendmentFinder amendmentFinder;
    private final ReferenceAnnotator annotator;
    private final Optional<String> fallbackReference;

    public ComparisonPipeline(Optional<String> fallbackReference) {
        this(new FormatPreservingCopier(), fallbackReference);
    }

    private ComparisonPipeline(FormatPreservingCopier copier, Optional<String> fallbackReference) {
        this(new ComparisonLegend(), new StructuralDiffEngine(), new DiffRenderer(copier),
                new AmendmentFinder(), new ReferenceAnnotator(copier), fallbackReference);
    }

    public ComparisonPipeline(ComparisonLegend legend,
                              StructuralDiffEngine diffEngine,
                              DiffRenderer renderer,
                              AmendmentFinder amendmentFinder,
                              ReferenceAnnotator annotator,
                              Optional<String> fallbackReference) {
        this.legend = Objects.requireNonNull(legend, "legend");
        this.diffEngine = Objects.requireNonNull(diffEngine, "diffEngine");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.amendmentFinder = Objects.requireNonNull(amendmentFinder, "amendmentFinder");
        this.annotator = Objects.requireNonNull(annotator, "annotator");
        this.fallbackReference = Objects.requireNonNull(fallbackReference, "fallbackReference");
    }

    public Document buildComparisonDocument(Document oldVersion, Document newVersion, Document amendment) {
        Objects.requireNonNull(oldVersion, "oldVersion");
        Objects.requireNonNull(newVersion, "newVersion");
        Objects.requireNonNull(amendment, "amendment");

        Document comparison = new Document();
        legend.addTo(comparison);

        List<DiffRegion> regions = diffEngine.diff(oldVersion.blocks(), newVersion.blocks());
        long changed = regions.stream().filter(region -> region.type() != RegionType.EQUAL).count();
        LOGGER.info("Diff produced {} region(s), {} with changes", regions.size(), changed);
        renderer.render(regions, oldVersion.blocks(), newVersion.blocks(), comparison);

        Optional<String> reference = amendmentFinder.extractAmendingReference(amendment).or(() -> fallbackReference);
        if (reference.isPresent()) {
            int inserted = annotator.annotate(comparison, reference.get());
            LOGGER.info("Inserted {} amending reference(s)", inserted);
        } else {
            LOGGER.warn("Amending reference could not be derived from the amendment document; modified articles left unannotated");
        }
        annotator.insertSpacer(comparison);
        return comparison;
    }
}
