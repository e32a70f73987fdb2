package ai.legaldoc.reviser.config;

import ai.legaldoc.reviser.amend.EditMode;
import ai.legaldoc.reviser.cli.CliArguments;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_MODE = "MODE";
    static final String ENV_ORIGINAL_PATH = "ORIGINAL_PATH";
    static final String ENV_AMENDMENT_PATH = "AMENDMENT_PATH";
    static final String ENV_NEW_VERSION_PATH = "NEW_VERSION_PATH";
    static final String ENV_OUTPUT_DIR = "OUTPUT_DIR";
    static final String ENV_EDIT_MODE = "EDIT_MODE";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_LLM_MODEL = "LLM_MODEL";
    static final String ENV_OPENAI_API_KEY = "OPENAI_API_KEY";
    static final String ENV_GEMINI_API_KEY = "GEMINI_API_KEY";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_LLM_MAX_ATTEMPTS = "LLM_MAX_ATTEMPTS";
    static final String ENV_LLM_INITIAL_BACKOFF_SECONDS = "LLM_INITIAL_BACKOFF_SECONDS";
    static final String ENV_LLM_MAX_BACKOFF_SECONDS = "LLM_MAX_BACKOFF_SECONDS";
    static final String ENV_LLM_RETRY_JITTER_FACTOR = "LLM_RETRY_JITTER_FACTOR";
    static final String ENV_AMENDMENT_CONCURRENCY = "AMENDMENT_CONCURRENCY";
    static final String ENV_AMENDING_REFERENCE_FALLBACK = "AMENDING_REFERENCE_FALLBACK";

    static final String DEFAULT_UPDATED_FILE_NAME = "new.docx";
    static final String DEFAULT_COMPARISON_FILE_NAME = "colored_diff.docx";
    private static final String DEFAULT_OUTPUT_DIR = ".";
    private static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";
    private static final int DEFAULT_LLM_MAX_ATTEMPTS = 3;
    private static final int DEFAULT_LLM_INITIAL_BACKOFF_SECONDS = 2;
    private static final int DEFAULT_LLM_MAX_BACKOFF_SECONDS = 60;
    private static final double DEFAULT_LLM_RETRY_JITTER_FACTOR = 0.3;
    private static final int DEFAULT_AMENDMENT_CONCURRENCY = 1;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Mode mode = resolveMode(arguments);
        EditMode editMode = resolveEditMode(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);

        Path originalPath = resolvePath(arguments.original(), ENV_ORIGINAL_PATH)
                .orElseThrow(() -> new IllegalArgumentException("original document must be provided (--original or " + ENV_ORIGINAL_PATH + ")"));
        Path amendmentPath = resolvePath(arguments.amendment(), ENV_AMENDMENT_PATH)
                .orElseThrow(() -> new IllegalArgumentException("amendment document must be provided (--amendment or " + ENV_AMENDMENT_PATH + ")"));
        Optional<Path> newVersionPath = resolvePath(arguments.newVersion(), ENV_NEW_VERSION_PATH);
        Path outputDir = resolvePath(arguments.outputDir(), ENV_OUTPUT_DIR).orElse(Path.of(DEFAULT_OUTPUT_DIR));

        String updatedFileName = isNotBlank(arguments.updatedName()) ? arguments.updatedName() : DEFAULT_UPDATED_FILE_NAME;
        String comparisonFileName = isNotBlank(arguments.comparisonName()) ? arguments.comparisonName() : DEFAULT_COMPARISON_FILE_NAME;

        Optional<String> openAiApiKey = environmentReader.get(ENV_OPENAI_API_KEY).filter(ConfigLoader::isNotBlank);
        Optional<String> geminiApiKey = environmentReader.get(ENV_GEMINI_API_KEY).filter(ConfigLoader::isNotBlank);

        LlmProvider provider = environmentReader.get(ENV_LLM_PROVIDER)
                .filter(ConfigLoader::isNotBlank)
                .map(LlmProvider::from)
                .orElse(LlmProvider.OPENAI);

        String modelName = environmentReader.get(ENV_LLM_MODEL)
                .filter(ConfigLoader::isNotBlank)
                .orElse(provider.defaultModel());

        Optional<String> baseUrl = Optional.empty();
        if (provider == LlmProvider.OLLAMA) {
            String value = environmentReader.get(ENV_OLLAMA_BASE_URL)
                    .filter(ConfigLoader::isNotBlank)
                    .orElse(DEFAULT_OLLAMA_BASE_URL);
            baseUrl = Optional.of(value);
        }

        int llmMaxAttempts = readInteger(ENV_LLM_MAX_ATTEMPTS, DEFAULT_LLM_MAX_ATTEMPTS);
        int llmInitialBackoffSeconds = readInteger(ENV_LLM_INITIAL_BACKOFF_SECONDS, DEFAULT_LLM_INITIAL_BACKOFF_SECONDS);
        int llmMaxBackoffSeconds = readInteger(ENV_LLM_MAX_BACKOFF_SECONDS, DEFAULT_LLM_MAX_BACKOFF_SECONDS);
        double llmRetryJitterFactor = environmentReader.get(ENV_LLM_RETRY_JITTER_FACTOR)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(raw -> parseDouble(raw, ENV_LLM_RETRY_JITTER_FACTOR))
                .orElse(DEFAULT_LLM_RETRY_JITTER_FACTOR);

        int amendmentConcurrency = arguments.concurrency() != null
                ? arguments.concurrency()
                : readInteger(ENV_AMENDMENT_CONCURRENCY, DEFAULT_AMENDMENT_CONCURRENCY);

        Optional<String> referenceFallback = environmentReader.get(ENV_AMENDING_REFERENCE_FALLBACK)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim);

        Secrets secrets = new Secrets(openAiApiKey, geminiApiKey);
        if (mode.revises() && editMode == EditMode.PRODUCTION) {
            requireApiKey(provider, secrets);
        }
        EditorConfig editorConfig = new EditorConfig(provider, modelName, baseUrl);

        return new Config(mode, originalPath, amendmentPath, newVersionPath, outputDir, updatedFileName,
                comparisonFileName, editMode, logFormat, editorConfig, secrets, llmMaxAttempts,
                llmInitialBackoffSeconds, llmMaxBackoffSeconds, llmRetryJitterFactor, amendmentConcurrency,
                referenceFallback);
    }

    private void requireApiKey(LlmProvider provider, Secrets secrets) {
        if (provider == LlmProvider.OPENAI && secrets.openAiApiKey().isEmpty()) {
            throw new IllegalStateException(ENV_OPENAI_API_KEY + " must be provided when LLM_PROVIDER=openai in production edit mode");
        }
        if (provider == LlmProvider.GEMINI && secrets.geminiApiKey().isEmpty()) {
            throw new IllegalStateException(ENV_GEMINI_API_KEY + " must be provided when LLM_PROVIDER=gemini in production edit mode");
        }
    }

    private Mode resolveMode(CliArguments arguments) {
        Mode cliMode = arguments.mode();
        if (cliMode != null) {
            return cliMode;
        }
        return environmentReader.get(ENV_MODE)
                .map(Mode::from)
                .orElse(Mode.BOTH);
    }

    private EditMode resolveEditMode(CliArguments arguments) {
        EditMode cliMode = arguments.editMode();
        if (cliMode != null) {
            return cliMode;
        }
        return environmentReader.get(ENV_EDIT_MODE)
                .map(EditMode::from)
                .orElse(EditMode.PRODUCTION);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private Optional<Path> resolvePath(Path cliValue, String envKey) {
        if (cliValue != null) {
            return Optional.of(cliValue);
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(Path::of);
    }

    private int readInteger(String envKey, int defaultValue) {
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(raw -> parseInteger(raw, envKey))
                .orElse(defaultValue);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static int parseInteger(String raw, String envKey) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(envKey + " must be an integer", ex);
        }
    }

    private static double parseDouble(String raw, String envKey) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(envKey + " must be a number", ex);
        }
    }
}
