package ai.legaldoc.reviser.config;

import java.util.Locale;

/**
 * Supported large language model providers.
 */
public enum LlmProvider {
    OPENAI("gpt-4.1-nano"),
    GEMINI("gemini-1.5-pro"),
    OLLAMA("llama3.1");

    private final String defaultModel;

    LlmProvider(String defaultModel) {
        this.defaultModel = defaultModel;
    }

    public String defaultModel() {
        return defaultModel;
    }

    public static LlmProvider from(String value) {
        if (value == null) {
            return OPENAI;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "openai", "" -> OPENAI;
            case "gemini" -> GEMINI;
            case "ollama" -> OLLAMA;
            default -> throw new IllegalArgumentException("Unsupported LLM provider: " + value);
        };
    }
}
