package ai.legaldoc.reviser.cli;

import ai.legaldoc.reviser.amend.AmendmentApplier;
import ai.legaldoc.reviser.amend.ArticleEditException;
import ai.legaldoc.reviser.amend.ArticleEditor;
import ai.legaldoc.reviser.amend.ArticleEditorFactory;
import ai.legaldoc.reviser.amend.ChatModelArticleEditor;
import ai.legaldoc.reviser.amend.PassThroughArticleEditor;
import ai.legaldoc.reviser.amend.RuleBasedArticleEditor;
import ai.legaldoc.reviser.config.Config;
import ai.legaldoc.reviser.config.ConfigLoader;
import ai.legaldoc.reviser.config.EditorConfig;
import ai.legaldoc.reviser.config.Secrets;
import ai.legaldoc.reviser.config.SystemEnvironmentReader;
import ai.legaldoc.reviser.docx.DocxException;
import ai.legaldoc.reviser.docx.DocxReader;
import ai.legaldoc.reviser.docx.DocxWriter;
import ai.legaldoc.reviser.logging.LoggingConfigurator;
import ai.legaldoc.reviser.model.Document;
import ai.legaldoc.reviser.pipeline.ComparisonPipeline;
import ai.legaldoc.reviser.pipeline.RevisionPipeline;
import ai.legaldoc.reviser.pipeline.RevisionResult;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, the configuration loader and the two pipelines.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);
    private static final double TEMPERATURE = 0.1;
    private static final int MAX_TOKENS = 2000;
    private static final Duration TIMEOUT = Duration.ofMinutes(2);

    static final int EXIT_FAILURE = 1;

    private final ConfigLoader configLoader;
    private final Function<Config, ChatModel> chatModelFactory;
    private final DocxReader docxReader = new DocxReader();

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), CliApplication::createChatModel);
    }

    CliApplication(ConfigLoader configLoader, Function<Config, ChatModel> chatModelFactory) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.chatModelFactory = Objects.requireNonNull(chatModelFactory, "chatModelFactory");
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Running in {} mode (editMode={}): original={} amendment={}",
                config.mode(), config.editMode(), config.originalPath(), config.amendmentPath());

        try {
            execute(config);
            return 0;
        } catch (DocxException | ArticleEditException | IllegalStateException ex) {
            LOGGER.error("Run failed: {}", ex.getMessage(), ex);
            return EXIT_FAILURE;
        }
    }

    private void execute(Config config) {
        Document original = docxReader.read(config.originalPath());
        Document amendment = docxReader.read(config.amendmentPath());
        DocxWriter writer = new DocxWriter(config.originalPath());

        Document updated = null;
        if (config.mode().revises()) {
            RevisionPipeline revisionPipeline = new RevisionPipeline(createAmendmentApplier(config), config.amendmentConcurrency());
            RevisionResult result = revisionPipeline.buildUpdatedDocument(original, amendment);
            writer.write(result.document(), config.updatedOutputPath());
            LOGGER.info("Updated document written to {} (gazette merged={}, amended articles={})",
                    config.updatedOutputPath(), result.gazetteMerged(), result.appliedArticles());
            if (!result.skippedInstructions().isEmpty()) {
                LOGGER.warn("{} instruction(s) named articles missing from the original", result.skippedInstructions().size());
            }
            updated = result.document();
        }

        if (config.mode().compares()) {
            Document newVersion = config.newVersionPath().isPresent()
                    ? docxReader.read(config.newVersionPath().get())
                    : updated;
            ComparisonPipeline comparisonPipeline = new ComparisonPipeline(config.amendingReferenceFallback());
            Document comparison = comparisonPipeline.buildComparisonDocument(original, newVersion, amendment);
            writer.write(comparison, config.comparisonOutputPath());
            LOGGER.info("Comparison document written to {}", config.comparisonOutputPath());
        }
    }

    private AmendmentApplier createAmendmentApplier(Config config) {
        ArticleEditorFactory factory = new ArticleEditorFactory(
                () -> createProductionEditor(config),
                new PassThroughArticleEditor(),
                new RuleBasedArticleEditor());
        ArticleEditor editor = factory.select(config.editMode());
        return new AmendmentApplier(editor,
                config.llmMaxAttempts(),
                config.llmInitialBackoffSeconds(),
                config.llmMaxBackoffSeconds(),
                config.llmRetryJitterFactor());
    }

    private ArticleEditor createProductionEditor(Config config) {
        EditorConfig editorConfig = config.editorConfig();
        ChatModel chatModel = chatModelFactory.apply(config);
        return new ChatModelArticleEditor(chatModel, editorConfig.provider().name(), editorConfig.modelName());
    }

    static ChatModel createChatModel(Config config) {
        EditorConfig editorConfig = config.editorConfig();
        return switch (editorConfig.provider()) {
            case OPENAI -> createOpenAiChatModel(editorConfig, config.secrets());
            case GEMINI -> createGeminiChatModel(editorConfig, config.secrets());
            case OLLAMA -> createOllamaChatModel(editorConfig);
        };
    }

    private static ChatModel createOpenAiChatModel(EditorConfig editorConfig, Secrets secrets) {
        String apiKey = secrets.openAiApiKey()
                .filter(value -> !value.isBlank())
                .orElseThrow(() -> new IllegalStateException("OPENAI_API_KEY must be provided when LLM_PROVIDER=openai"));
        try {
            LOGGER.info("Using OpenAI model '{}'", editorConfig.modelName());
            return OpenAiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(editorConfig.modelName())
                    .temperature(TEMPERATURE)
                    .maxTokens(MAX_TOKENS)
                    .timeout(TIMEOUT)
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize OpenAI chat model", ex);
        }
    }

    private static ChatModel createGeminiChatModel(EditorConfig editorConfig, Secrets secrets) {
        String apiKey = secrets.geminiApiKey()
                .filter(value -> !value.isBlank())
                .orElseThrow(() -> new IllegalStateException("GEMINI_API_KEY must be provided when LLM_PROVIDER=gemini"));
        try {
            LOGGER.info("Using Gemini model '{}'", editorConfig.modelName());
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(editorConfig.modelName())
                    .temperature(TEMPERATURE)
                    .maxOutputTokens(MAX_TOKENS)
                    .timeout(TIMEOUT)
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Gemini chat model", ex);
        }
    }

    private static ChatModel createOllamaChatModel(EditorConfig editorConfig) {
        try {
            String baseUrl = editorConfig.baseUrl()
                    .orElseThrow(() -> new IllegalStateException("OLLAMA_BASE_URL must be configured when LLM_PROVIDER=ollama"));
            LOGGER.info("Using Ollama model '{}' via {}", editorConfig.modelName(), baseUrl);
            return OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(editorConfig.modelName())
                    .temperature(TEMPERATURE)
                    .numPredict(MAX_TOKENS)
                    .timeout(TIMEOUT)
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Ollama chat model", ex);
        }
    }
}
