package ai.legaldoc.reviser.cli;

import ai.legaldoc.reviser.config.Mode;
import picocli.CommandLine;

public class ModeConverter implements CommandLine.ITypeConverter<Mode> {

    @Override
    public Mode convert(String value) {
        return Mode.from(value);
    }
}
