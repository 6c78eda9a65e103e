package nl.nfi.djlearn.diagnose;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static nl.nfi.djlearn.Utils.TEST_RESOURCES_PATH;
import static org.assertj.core.api.Assertions.assertThat;

@DisabledOnOs(OS.WINDOWS)
class DiagnoseCliTest {

    @TempDir
    Path directory;

    private Path inputs;
    private Path oracle;

    @BeforeEach
    void setUp() throws IOException {
        inputs = Files.writeString(directory.resolve("inputs.txt"), "sqrt(-1)\n\ncos(2)\nsqrt(2)\ncos(-1)\n");
        oracle = Files.writeString(directory.resolve("oracle.sh"), "if grep -q 'sqrt(-'; then exit 1; fi\n");
    }

    private static int execute(final String... args) {
        return new CommandLine(new DiagnoseCli()).setCaseInsensitiveEnumValuesAllowed(true).execute(args);
    }

    @Test
    void learnsDiagnosesWithExternalOracle() throws IOException {
        final Path output = directory.resolve("diagnoses.tsv");

        final int exitCode = execute(
                "--grammar", TEST_RESOURCES_PATH.resolve("grammars/calculator.bnf").toString(),
                "--inputs", inputs.toString(),
                "--oracle", "sh " + oracle,
                "--relevant", "<f>,<n>",
                "--template_groups", "string,integer",
                "--mode", "LEARN",
                "--output", output.toString()
        );

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.OK);
        final List<String> lines = Files.readAllLines(output);
        assertThat(lines).isNotEmpty().allSatisfy(line -> {
            assertThat(line).startsWith("(").contains(" and ");
            assertThat(line.split("\t")).hasSize(3);
        });
        assertThat(lines).anySatisfy(line -> assertThat(line).startsWith("(int(<n>) <= -1 and str(<f>) == \"sqrt\")\t"));
    }

    @Test
    void readsSettingsFromConfigFile() throws IOException {
        final Path output = directory.resolve("diagnoses.tsv");

        final int exitCode = execute(
                "--grammar", TEST_RESOURCES_PATH.resolve("grammars/calculator.bnf").toString(),
                "--inputs", inputs.toString(),
                "--oracle", "sh " + oracle,
                "--config", TEST_RESOURCES_PATH.resolve("config/learner.ini").toString(),
                "--relevant", "<f>,<n>",
                "--mode", "learn",
                "--output", output.toString()
        );

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.OK);
        assertThat(Files.readAllLines(output)).isNotEmpty();
    }

    @Test
    void reportsFatalErrors() {
        final int exitCode = execute(
                "--grammar", directory.resolve("missing.bnf").toString(),
                "--inputs", inputs.toString(),
                "--oracle", "sh " + oracle,
                "--mode", "learn"
        );

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.SOFTWARE);
    }

    @Test
    void rejectsMissingRequiredOptions() {
        assertThat(execute("--inputs", inputs.toString())).isEqualTo(CommandLine.ExitCode.USAGE);
    }
}
