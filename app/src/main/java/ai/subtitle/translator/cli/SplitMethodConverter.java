package ai.subtitle.translator.cli;

import ai.subtitle.translator.subtitle.SplitMethod;
import picocli.CommandLine;

public class SplitMethodConverter implements CommandLine.ITypeConverter<SplitMethod> {

    @Override
    public SplitMethod convert(String value) {
        return SplitMethod.from(value);
    }
}
