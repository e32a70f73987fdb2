package ai.legaldoc.reviser.amend;

import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.Objects;

/**
 * Article editor backed by a LangChain4j {@link ChatModel} implementation.
 */
public class ChatModelArticleEditor implements ArticleEditor {

    private final ChatModel model;
    private final String providerName;
    private final String modelName;

    public ChatModelArticleEditor(ChatModel model, String providerName, String modelName) {
        this.model = Objects.requireNonNull(model, "model");
        this.providerName = requireNonBlank(providerName, "providerName");
        this.modelName = requireNonBlank(modelName, "modelName");
    }

    @Override
    public String edit(String articleText, String instruction) {
        ChatRequest request = ChatRequest.builder()
                .messages(SystemMessage.from(AmendmentPrompt.SYSTEM_PERSONA),
                        UserMessage.from(AmendmentPrompt.build(articleText, instruction)))
                .build();
        String response;
        try {
            ChatResponse chatResponse = model.chat(request);
            response = chatResponse == null || chatResponse.aiMessage() == null ? null : chatResponse.aiMessage().text();
        } catch (RuntimeException ex) {
            if (isModelMissing(ex)) {
                throw new ArticleEditException("%s model '%s' is not available.".formatted(providerName, modelName), ex);
            }
            throw new ArticleEditException("%s request failed: %s".formatted(providerName, ex.getMessage()), ex);
        }
        if (response == null || response.isBlank()) {
            throw new ArticleEditException("%s model '%s' returned an empty response".formatted(providerName, modelName));
        }
        return stripQuotes(response.strip());
    }

    private String stripQuotes(String response) {
        if (response.length() > 1 && response.startsWith("'") && response.endsWith("'")) {
            return response.substring(1, response.length() - 1);
        }
        return response;
    }

    private boolean isModelMissing(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof ModelNotFoundException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
