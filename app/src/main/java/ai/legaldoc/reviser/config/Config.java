package ai.legaldoc.reviser.config;

import ai.legaldoc.reviser.amend.EditMode;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Mode mode,
        Path originalPath,
        Path amendmentPath,
        Optional<Path> newVersionPath,
        Path outputDir,
        String updatedFileName,
        String comparisonFileName,
        EditMode editMode,
        LogFormat logFormat,
        EditorConfig editorConfig,
        Secrets secrets,
        int llmMaxAttempts,
        int llmInitialBackoffSeconds,
        int llmMaxBackoffSeconds,
        double llmRetryJitterFactor,
        int amendmentConcurrency,
        Optional<String> amendingReferenceFallback
) {

    public Config {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(originalPath, "originalPath");
        Objects.requireNonNull(amendmentPath, "amendmentPath");
        newVersionPath = newVersionPath == null ? Optional.empty() : newVersionPath;
        Objects.requireNonNull(outputDir, "outputDir");
        updatedFileName = requireNonBlank(updatedFileName, "updatedFileName");
        comparisonFileName = requireNonBlank(comparisonFileName, "comparisonFileName");
        if (updatedFileName.equals(comparisonFileName)) {
            throw new IllegalArgumentException("updatedFileName and comparisonFileName must differ");
        }
        editMode = Objects.requireNonNull(editMode, "editMode");
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
        editorConfig = Objects.requireNonNull(editorConfig, "editorConfig");
        secrets = Objects.requireNonNull(secrets, "secrets");
        if (llmMaxAttempts < 1) {
            throw new IllegalArgumentException("llmMaxAttempts must be at least 1");
        }
        if (llmInitialBackoffSeconds < 1) {
            throw new IllegalArgumentException("llmInitialBackoffSeconds must be at least 1");
        }
        if (llmMaxBackoffSeconds < llmInitialBackoffSeconds) {
            throw new IllegalArgumentException("llmMaxBackoffSeconds must be at least llmInitialBackoffSeconds");
        }
        if (llmRetryJitterFactor < 0.0 || llmRetryJitterFactor > 1.0) {
            throw new IllegalArgumentException("llmRetryJitterFactor must be between 0.0 and 1.0");
        }
        if (amendmentConcurrency < 1) {
            throw new IllegalArgumentException("amendmentConcurrency must be at least 1");
        }
        if (mode == Mode.COMPARE && newVersionPath.isEmpty()) {
            throw new IllegalArgumentException("--new-version is required in compare mode");
        }
        amendingReferenceFallback = amendingReferenceFallback == null ? Optional.empty() : amendingReferenceFallback;
    }

    public Path updatedOutputPath() {
        return outputDir.resolve(updatedFileName);
    }

    public Path comparisonOutputPath() {
        return outputDir.resolve(comparisonFileName);
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
