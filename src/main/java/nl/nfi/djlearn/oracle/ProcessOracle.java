package nl.nfi.djlearn.oracle;

import nl.nfi.djlearn.learn.BatchOracle;
import nl.nfi.djlearn.learn.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Runs an external command per input, with the input on its standard input. Exit code 0
 * means the input passes, any other exit code that it fails. Inputs for which the command
 * cannot be started or does not finish in time are {@link Verdict#UNDEFINED}.
 */
public final class ProcessOracle implements BatchOracle {

    private static final Logger LOG = LoggerFactory.getLogger(ProcessOracle.class);

    private final List<String> command;
    private final Duration timeout;

    private ProcessOracle(final List<String> command, final Duration timeout) {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Oracle command must not be empty");
        }
        this.command = command;
        this.timeout = timeout;
    }

    public static ProcessOracle forCommand(final List<String> command) {
        return new ProcessOracle(List.copyOf(command), Duration.ofSeconds(10));
    }

    public ProcessOracle timeout(final Duration timeout) {
        return new ProcessOracle(command, timeout);
    }

    public List<String> command() {
        return command;
    }

    @Override
    public Verdict evaluate(final String input) {
        final Process process;
        try {
            process = new ProcessBuilder(command)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
        } catch (final IOException e) {
            LOG.warn("Could not start oracle command {}", command, e);
            return Verdict.UNDEFINED;
        }
        try {
            try (final OutputStream stdin = process.getOutputStream()) {
                stdin.write(input.getBytes(UTF_8));
            } catch (final IOException e) {
                // the command may exit without reading its input
                LOG.debug("Could not write input to oracle command: {}", e.getMessage());
            }
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.debug("Oracle command timed out on input: {}", input);
                process.destroyForcibly();
                return Verdict.UNDEFINED;
            }
            return process.exitValue() == 0 ? Verdict.PASSING : Verdict.FAILING;
        } catch (final InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return Verdict.UNDEFINED;
        }
    }
}
