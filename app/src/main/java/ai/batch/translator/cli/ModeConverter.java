package ai.batch.translator.cli;

import ai.batch.translator.config.Mode;
import picocli.CommandLine;

public class ModeConverter implements CommandLine.ITypeConverter<Mode> {

    @Override
    public Mode convert(String value) {
        return Mode.from(value);
    }
}
