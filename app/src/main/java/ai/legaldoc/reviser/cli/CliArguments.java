package ai.legaldoc.reviser.cli;

import ai.legaldoc.reviser.amend.EditMode;
import ai.legaldoc.reviser.config.LogFormat;
import ai.legaldoc.reviser.config.Mode;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "legaldoc-reviser", mixinStandardHelpOptions = true, version = "legaldoc-reviser 0.1.0",
        description = "Applies gazette amendments to a law and renders an annotated comparison")
public class CliArguments {

    @CommandLine.Option(names = "--mode", converter = ModeConverter.class, description = "What to produce: revise, compare or both")
    private Mode mode;

    @CommandLine.Option(names = "--original", description = "Original law (.docx)", paramLabel = "PATH")
    private Path original;

    @CommandLine.Option(names = "--amendment", description = "Amendment act (.docx)", paramLabel = "PATH")
    private Path amendment;

    @CommandLine.Option(names = "--new-version", description = "New version of the law to compare against (.docx)", paramLabel = "PATH")
    private Path newVersion;

    @CommandLine.Option(names = "--output-dir", description = "Directory receiving the generated documents", paramLabel = "DIR")
    private Path outputDir;

    @CommandLine.Option(names = "--updated-name", description = "File name of the updated law (default: new.docx)", paramLabel = "NAME")
    private String updatedName;

    @CommandLine.Option(names = "--comparison-name", description = "File name of the comparison (default: colored_diff.docx)", paramLabel = "NAME")
    private String comparisonName;

    @CommandLine.Option(names = "--edit-mode", converter = EditModeConverter.class, description = "Article editor: production, dry-run or mock")
    private EditMode editMode;

    @CommandLine.Option(names = "--concurrency", description = "Number of articles amended in parallel", paramLabel = "N")
    private Integer concurrency;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public Mode mode() {
        return mode;
    }

    public Path original() {
        return original;
    }

    public Path amendment() {
        return amendment;
    }

    public Path newVersion() {
        return newVersion;
    }

    public Path outputDir() {
        return outputDir;
    }

    public String updatedName() {
        return updatedName;
    }

    public String comparisonName() {
        return comparisonName;
    }

    public EditMode editMode() {
        return editMode;
    }

    public Integer concurrency() {
        return concurrency;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
