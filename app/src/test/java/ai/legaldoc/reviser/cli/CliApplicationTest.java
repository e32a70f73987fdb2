package ai.legaldoc.reviser.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.legaldoc.reviser.config.Config;
import ai.legaldoc.reviser.config.ConfigLoader;
import ai.legaldoc.reviser.docx.DocxReader;
import ai.legaldoc.reviser.docx.DocxWriter;
import ai.legaldoc.reviser.model.Document;
import ai.legaldoc.reviser.model.Paragraph;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class CliApplicationTest {

    private static final int INVALID_INPUT = new CommandLine(new CliArguments()).getCommandSpec().exitCodeOnInvalidInput();

    @TempDir
    Path tempDir;

    private Path original;
    private Path amendment;
    private Path outputDir;

    @BeforeEach
    void writeInputs() {
        DocxWriter writer = new DocxWriter();
        Document law = new Document();
        law.addParagraph("Član 1");
        law.addParagraph("text A");
        law.addParagraph("text B");
        original = tempDir.resolve("old.docx");
        writer.write(law, original);

        Document act = new Document();
        act.addParagraph("Odredbe člana 1. stav 2. Zakona o računovodstvu prestaju da važe.");
        amendment = tempDir.resolve("izmene.docx");
        writer.write(act, amendment);

        outputDir = tempDir.resolve("out");
    }

    @Test
    void mockRunWritesUpdatedAndComparisonDocuments() {
        CliApplication application = new CliApplication(new ConfigLoader(key -> Optional.empty()), unusedChatModel());

        int exitCode = application.run(new String[] {
                "--original", original.toString(),
                "--amendment", amendment.toString(),
                "--output-dir", outputDir.toString(),
                "--edit-mode", "mock"
        });

        assertThat(exitCode).isZero();
        DocxReader reader = new DocxReader();
        Document updated = reader.read(outputDir.resolve("new.docx"));
        assertThat(updated.paragraphs()).extracting(Paragraph::text).containsExactly("Član 1*", "text A");
        Document comparison = reader.read(outputDir.resolve("colored_diff.docx"));
        assertThat(comparison.paragraphs()).extracting(Paragraph::text).contains("Član 1*", "[text B]");
    }

    @Test
    void productionRunUsesConfiguredChatModel() {
        AtomicInteger calls = new AtomicInteger();
        ChatModel stubModel = new ChatModel() {
            @Override
            public ChatResponse chat(ChatRequest request) {
                calls.incrementAndGet();
                return ChatResponse.builder().aiMessage(AiMessage.from("Član 1*\ntext A")).build();
            }
        };
        Map<String, String> env = Map.of("OPENAI_API_KEY", "test-key");
        CliApplication application = new CliApplication(
                new ConfigLoader(key -> Optional.ofNullable(env.get(key))), config -> stubModel);

        int exitCode = application.run(new String[] {
                "--mode", "revise",
                "--original", original.toString(),
                "--amendment", amendment.toString(),
                "--output-dir", outputDir.toString(),
                "--updated-name", "zakon.docx"
        });

        assertThat(exitCode).isZero();
        assertThat(calls.get()).isEqualTo(1);
        assertThat(Files.exists(outputDir.resolve("zakon.docx"))).isTrue();
        assertThat(Files.exists(outputDir.resolve("colored_diff.docx"))).isFalse();
    }

    @Test
    void compareRunUsesGivenNewVersion() {
        Document newVersion = new Document();
        newVersion.addParagraph("Član 1*");
        newVersion.addParagraph("text A");
        newVersion.addParagraph("text C");
        Path newVersionPath = tempDir.resolve("new-version.docx");
        new DocxWriter().write(newVersion, newVersionPath);
        CliApplication application = new CliApplication(new ConfigLoader(key -> Optional.empty()), unusedChatModel());

        int exitCode = application.run(new String[] {
                "--mode", "compare",
                "--original", original.toString(),
                "--amendment", amendment.toString(),
                "--new-version", newVersionPath.toString(),
                "--output-dir", outputDir.toString()
        });

        assertThat(exitCode).isZero();
        Document comparison = new DocxReader().read(outputDir.resolve("colored_diff.docx"));
        assertThat(comparison.paragraphs()).extracting(Paragraph::text).contains("[text B]", "[text C]");
        assertThat(Files.exists(outputDir.resolve("new.docx"))).isFalse();
    }

    @Test
    void missingInputFileFailsRun() {
        CliApplication application = new CliApplication(new ConfigLoader(key -> Optional.empty()), unusedChatModel());

        int exitCode = application.run(new String[] {
                "--original", tempDir.resolve("missing.docx").toString(),
                "--amendment", amendment.toString(),
                "--output-dir", outputDir.toString(),
                "--edit-mode", "mock"
        });

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_FAILURE);
    }

    @Test
    void invalidArgumentsReturnInvalidInputCode() {
        CliApplication application = new CliApplication(new ConfigLoader(key -> Optional.empty()), unusedChatModel());

        assertThat(application.run(new String[] {"--concurrency", "many"})).isEqualTo(INVALID_INPUT);
        assertThat(application.run(new String[] {"--edit-mode", "mock"})).isEqualTo(INVALID_INPUT);
    }

    @Test
    void helpIsPrintedWithoutLoadingConfiguration() {
        CliApplication application = new CliApplication(new FailingConfigLoader(), unusedChatModel());

        assertThat(application.run(new String[] {"--help"})).isZero();
        assertThat(application.run(new String[] {"--version"})).isZero();
    }

    private static Function<Config, ChatModel> unusedChatModel() {
        return config -> {
            throw new AssertionError("chat model must not be created");
        };
    }

    private static final class FailingConfigLoader extends ConfigLoader {

        FailingConfigLoader() {
            super(key -> Optional.empty());
        }

        @Override
        public Config load(CliArguments arguments) {
            throw new AssertionError("configuration must not be loaded");
        }
    }
}
