package nl.nfi.cnfnorm.main;

import nl.nfi.cnfnorm.normalize.NormalizerCli;
import picocli.CommandLine;

public final class NormalizerMain {

    public static void main(final String... args) {
        final int exitCode = new CommandLine(new NormalizerCli()).execute(args);
        System.exit(exitCode);
    }
}
