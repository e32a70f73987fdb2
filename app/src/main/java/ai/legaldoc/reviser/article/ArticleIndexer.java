package ai.legaldoc.reviser.article;

import ai.legaldoc.reviser.model.Block;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Partitions a block sequence into article spans keyed by normalized header id.
 * Blocks before the first header belong to no article.
 */
public class ArticleIndexer {

    public Map<String, ArticleSpan> extractArticles(List<Block> blocks) {
        Map<String, ArticleSpan> articles = new LinkedHashMap<>();
        String current = null;
        int start = 0;
        for (int i = 0; i < blocks.size(); i++) {
            Block block = blocks.get(i);
            if (!block.isParagraph()) {
                continue;
            }
            Optional<String> id = LegalPatterns.articleId(block.asParagraph().text());
            if (id.isEmpty()) {
                continue;
            }
            if (current != null) {
                articles.put(current, new ArticleSpan(current, start, i));
            }
            current = id.get();
            start = i;
        }
        if (current != null) {
            articles.put(current, new ArticleSpan(current, start, blocks.size()));
        }
        return articles;
    }
}
