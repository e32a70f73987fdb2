package ai.legaldoc.reviser.cli;

import ai.legaldoc.reviser.amend.EditMode;
import picocli.CommandLine;

public class EditModeConverter implements CommandLine.ITypeConverter<EditMode> {

    @Override
    public EditMode convert(String value) {
        return EditMode.from(value);
    }
}
