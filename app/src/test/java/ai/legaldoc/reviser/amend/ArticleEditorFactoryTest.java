package ai.legaldoc.reviser.amend;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class ArticleEditorFactoryTest {

    @Test
    void offlineModesNeverBuildProductionEditor() {
        AtomicInteger created = new AtomicInteger();
        PassThroughArticleEditor dryRun = new PassThroughArticleEditor();
        RuleBasedArticleEditor mock = new RuleBasedArticleEditor();
        ArticleEditorFactory factory = new ArticleEditorFactory(() -> {
            created.incrementAndGet();
            return (text, instruction) -> text;
        }, dryRun, mock);

        assertThat(factory.select(EditMode.DRY_RUN)).isSameAs(dryRun);
        assertThat(factory.select(EditMode.MOCK)).isSameAs(mock);
        assertThat(created.get()).isZero();

        factory.select(EditMode.PRODUCTION);
        assertThat(created.get()).isEqualTo(1);
    }

    @Test
    void parsesEditModeNames() {
        assertThat(EditMode.from("dry-run")).isEqualTo(EditMode.DRY_RUN);
        assertThat(EditMode.from(" Mock ")).isEqualTo(EditMode.MOCK);
        assertThat(EditMode.from(null)).isEqualTo(EditMode.PRODUCTION);
    }
}
