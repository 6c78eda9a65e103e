package nl.nfi.djlearn.main;

import nl.nfi.djlearn.diagnose.DiagnoseCli;
import picocli.CommandLine;

public final class DiagnoseMain {

    public static void main(final String... args) {
        final int exitCode = new CommandLine(new DiagnoseCli()).setCaseInsensitiveEnumValuesAllowed(true).execute(args);
        System.exit(exitCode);
    }
}
