package ai.legaldoc.reviser.amend;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Provides article editors based on the desired execution mode. The production editor is created on
 * first selection, so offline modes never build a model client.
 */
public class ArticleEditorFactory {

    private final Supplier<ArticleEditor> productionEditor;
    private final ArticleEditor dryRunEditor;
    private final ArticleEditor mockEditor;

    public ArticleEditorFactory(Supplier<ArticleEditor> productionEditor,
                                ArticleEditor dryRunEditor,
                                ArticleEditor mockEditor) {
        this.productionEditor = Objects.requireNonNull(productionEditor, "productionEditor");
        this.dryRunEditor = Objects.requireNonNull(dryRunEditor, "dryRunEditor");
        this.mockEditor = Objects.requireNonNull(mockEditor, "mockEditor");
    }

    public ArticleEditor select(EditMode mode) {
        return switch (mode) {
            case PRODUCTION -> Objects.requireNonNull(productionEditor.get(), "production editor");
            case DRY_RUN -> dryRunEditor;
            case MOCK -> mockEditor;
        };
    }
}
