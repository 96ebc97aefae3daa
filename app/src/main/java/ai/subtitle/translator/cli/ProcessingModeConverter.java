package ai.subtitle.translator.cli;

import ai.subtitle.translator.engine.ProcessingMode;
import picocli.CommandLine;

public class ProcessingModeConverter implements CommandLine.ITypeConverter<ProcessingMode> {

    @Override
    public ProcessingMode convert(String value) {
        return ProcessingMode.from(value);
    }
}
