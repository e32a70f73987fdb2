package ai.legaldoc.reviser.amend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ChatModelArticleEditorTest {

    @Test
    @DisplayName("Sends the persona as a system message and the article with both worked examples as the user message")
    void sendsPersonaAsSystemMessage() {
        AtomicReference<ChatRequest> captured = new AtomicReference<>();
        ChatModel stubModel = new ChatModel() {
            @Override
            public ChatResponse chat(ChatRequest request) {
                captured.set(request);
                return reply("Član 9*\nPrvi.");
            }
        };
        ChatModelArticleEditor editor = new ChatModelArticleEditor(stubModel, "OPENAI", "gpt-4.1-nano");

        String result = editor.edit("Član 9\nPrvi.\nDrugi.", "člana 9. stav 2. Zakona o računovodstvu prestaju da važe");

        assertThat(result).isEqualTo("Član 9*\nPrvi.");
        List<ChatMessage> messages = captured.get().messages();
        assertThat(messages).hasSize(2);
        assertThat(messages.get(0)).isInstanceOf(SystemMessage.class);
        assertThat(((SystemMessage) messages.get(0)).text()).isEqualTo(AmendmentPrompt.SYSTEM_PERSONA);
        assertThat(messages.get(1)).isInstanceOf(UserMessage.class);
        assertThat(((UserMessage) messages.get(1)).singleText())
                .doesNotContain(AmendmentPrompt.SYSTEM_PERSONA)
                .contains("Član 9\nPrvi.\nDrugi.")
                .contains("člana 9. stav 2. Zakona o računovodstvu prestaju da važe")
                .contains("Član 64");
    }

    @Test
    @DisplayName("Strips single quotes wrapped around the whole response")
    void stripsWrappingQuotes() {
        ChatModel stubModel = new ChatModel() {
            @Override
            public ChatResponse chat(ChatRequest request) {
                return reply("  'Član 9*\nPrvi.'  ");
            }
        };

        String result = new ChatModelArticleEditor(stubModel, "OPENAI", "gpt-4.1-nano").edit("Član 9\nPrvi.", "x");

        assertThat(result).isEqualTo("Član 9*\nPrvi.");
    }

    @Test
    void blankResponseIsAnError() {
        ChatModel stubModel = new ChatModel() {
            @Override
            public ChatResponse chat(ChatRequest request) {
                return reply("   ");
            }
        };

        assertThatThrownBy(() -> new ChatModelArticleEditor(stubModel, "OLLAMA", "llama3.1").edit("Član 9", "x"))
                .isInstanceOf(ArticleEditException.class)
                .hasMessageContaining("empty response");
    }

    @Test
    void reportsMissingModelWithProviderAndName() {
        ChatModel stubModel = new ChatModel() {
            @Override
            public ChatResponse chat(ChatRequest request) {
                throw new ModelNotFoundException("model not found");
            }
        };

        assertThatThrownBy(() -> new ChatModelArticleEditor(stubModel, "OLLAMA", "llama3.1").edit("Član 9", "x"))
                .isInstanceOf(ArticleEditException.class)
                .hasMessageContaining("OLLAMA")
                .hasMessageContaining("llama3.1")
                .hasCauseInstanceOf(ModelNotFoundException.class);
    }

    private static ChatResponse reply(String text) {
        return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
    }
}
