package ai.legaldoc.reviser.pipeline;

import ai.legaldoc.reviser.amend.AmendmentApplier;
import ai.legaldoc.reviser.amend.AmendmentFinder;
import ai.legaldoc.reviser.amend.AmendmentInstruction;
import ai.legaldoc.reviser.article.ArticleIndexer;
import ai.legaldoc.reviser.article.ArticleSpan;
import ai.legaldoc.reviser.article.GazetteMerger;
import ai.legaldoc.reviser.format.FormatPreservingCopier;
import ai.legaldoc.reviser.model.Block;
import ai.legaldoc.reviser.model.Document;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Produces the updated version of a law: a formatted copy of the original with the gazette citation
 * merged and every repealed paragraph removed.
 */
public class RevisionPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(RevisionPipeline.class);
    static final String ARTICLE_MDC_KEY = "article";

    private final FormatPreservingCopier copier;
    private final GazetteMerger gazetteMerger;
    private final ArticleIndexer articleIndexer;
    private final AmendmentFinder amendmentFinder;
    private final AmendmentApplier amendmentApplier;
    private final ArticleSplicer articleSplicer;
    private final int concurrency;

    public RevisionPipeline(AmendmentApplier amendmentApplier, int concurrency) {
        this(new FormatPreservingCopier(), amendmentApplier, concurrency);
    }

    private RevisionPipeline(FormatPreservingCopier copier, AmendmentApplier amendmentApplier, int concurrency) {
        this(copier, new GazetteMerger(copier), new ArticleIndexer(), new AmendmentFinder(),
                amendmentApplier, new ArticleSplicer(copier), concurrency);
    }

    public RevisionPipeline(FormatPreservingCopier copier,
                            GazetteMerger gazetteMerger,
                            ArticleIndexer articleIndexer,
                            AmendmentFinder amendmentFinder,
                            AmendmentApplier amendmentApplier,
                            ArticleSplicer articleSplicer,
                            int concurrency) {
        this.copier = Objects.requireNonNull(copier, "copier");
        this.gazetteMerger = Objects.requireNonNull(gazetteMerger, "gazetteMerger");
        this.articleIndexer = Objects.requireNonNull(articleIndexer, "articleIndexer");
        this.amendmentFinder = Objects.requireNonNull(amendmentFinder, "amendmentFinder");
        this.amendmentApplier = Objects.requireNonNull(amendmentApplier, "amendmentApplier");
        this.articleSplicer = Objects.requireNonNull(articleSplicer, "articleSplicer");
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1");
        }
        this.concurrency = concurrency;
    }

    public RevisionResult buildUpdatedDocument(Document original, Document amendment) {
        Objects.requireNonNull(original, "original");
        Objects.requireNonNull(amendment, "amendment");

        Document updated = new Document();
        for (Block block : original.blocks()) {
            copier.copyBlock(block, updated);
        }
        boolean gazetteMerged = gazetteMerger.mergeGazette(original, amendment, updated);

        Map<String, ArticleSpan> articles = articleIndexer.extractArticles(updated.blocks());
        List<AmendmentInstruction> instructions = amendmentFinder.findAmendments(amendment);
        LOGGER.info("Found {} amendment instruction(s) and {} article(s)", instructions.size(), articles.size());

        Map<String, SortedMap<Integer, AmendmentInstruction>> instructionsByArticle = new LinkedHashMap<>();
        List<AmendmentInstruction> skipped = new ArrayList<>();
        for (AmendmentInstruction instruction : instructions) {
            if (!articles.containsKey(instruction.articleId())) {
                LOGGER.info("Skipping instruction for {}: article not present in the original", instruction.articleId());
                skipped.add(instruction);
                continue;
            }
            // ordinals count the original body, so repeals run highest stav first
            instructionsByArticle.computeIfAbsent(instruction.articleId(), key -> new TreeMap<>(Comparator.<Integer>reverseOrder()))
                    .putIfAbsent(instruction.paragraphOrdinal(), instruction);
        }

        List<ArticleRevision> revisions = revise(updated, articles, instructionsByArticle);
        revisions.sort(Comparator.comparingInt((ArticleRevision revision) -> revision.span().start()).reversed());
        for (ArticleRevision revision : revisions) {
            if (revision.changed()) {
                articleSplicer.splice(updated, revision.span(), revision.lines());
            }
        }

        List<String> applied = revisions.stream()
                .filter(ArticleRevision::changed)
                .sorted(Comparator.comparingInt(revision -> revision.span().start()))
                .map(revision -> revision.span().id())
                .collect(Collectors.toList());
        LOGGER.info("Revision finished: {} article(s) amended, {} instruction(s) skipped", applied.size(), skipped.size());
        return new RevisionResult(updated, gazetteMerged, applied, skipped);
    }

    private List<ArticleRevision> revise(Document document,
                                         Map<String, ArticleSpan> articles,
                                         Map<String, SortedMap<Integer, AmendmentInstruction>> instructionsByArticle) {
        if (instructionsByArticle.isEmpty()) {
            return new ArrayList<>();
        }
        ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(concurrency, instructionsByArticle.size()), new AmendmentThreadFactory());
        try {
            List<Future<ArticleRevision>> futures = new ArrayList<>();
            for (Map.Entry<String, SortedMap<Integer, AmendmentInstruction>> entry : instructionsByArticle.entrySet()) {
                ArticleSpan span = articles.get(entry.getKey());
                String articleText = articleText(document, span);
                List<String> pending = entry.getValue().values().stream()
                        .map(AmendmentInstruction::directive)
                        .collect(Collectors.toList());
                futures.add(executor.submit(() -> reviseArticle(span, articleText, pending)));
            }
            List<ArticleRevision> revisions = new ArrayList<>(futures.size());
            for (Future<ArticleRevision> future : futures) {
                revisions.add(future.get());
            }
            return revisions;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while amending articles", ex);
        } catch (ExecutionException ex) {
            throw new IllegalStateException("Amending an article failed", ex.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private ArticleRevision reviseArticle(ArticleSpan span, String articleText, List<String> instructions) {
        MDC.put(ARTICLE_MDC_KEY, span.id());
        try {
            List<String> original = articleText.isEmpty() ? List.of() : List.of(articleText.split("\\R"));
            String current = articleText;
            List<String> lines = original;
            for (String instruction : instructions) {
                lines = amendmentApplier.applyAmendment(current, instruction);
                current = String.join("\n", lines);
            }
            return new ArticleRevision(span, lines, !lines.equals(original));
        } finally {
            MDC.remove(ARTICLE_MDC_KEY);
        }
    }

    private static String articleText(Document document, ArticleSpan span) {
        return document.blocks().subList(span.start(), span.end()).stream()
                .filter(Block::isParagraph)
                .map(block -> block.asParagraph().text())
                .collect(Collectors.joining("\n"));
    }

    private record ArticleRevision(ArticleSpan span, List<String> lines, boolean changed) {
    }

    private static final class AmendmentThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "amendment-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
