package nl.nfi.djlearn.diagnose;

import nl.nfi.djlearn.common.ini.IniConfig;
import nl.nfi.djlearn.grammar.Grammar;
import nl.nfi.djlearn.grammar.GrammarLoader;
import nl.nfi.djlearn.grammar.Symbol;
import nl.nfi.djlearn.learn.Candidate;
import nl.nfi.djlearn.learn.ConstraintLearner;
import nl.nfi.djlearn.learn.LearnerConfig;
import nl.nfi.djlearn.learn.TemplateRepository;
import nl.nfi.djlearn.oracle.ProcessOracle;
import nl.nfi.djlearn.refine.BatchExecutionHandler;
import nl.nfi.djlearn.refine.HypothesisRefiner;
import nl.nfi.djlearn.refine.RefinementConfig;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

import static picocli.CommandLine.Command;
import static picocli.CommandLine.ExitCode;
import static picocli.CommandLine.Option;

@Command(name = "dj_learn")
public class DiagnoseCli implements Callable<Integer> {

    @Option(names = {"--grammar"}, description = "The grammar describing the input format", required = true)
    private String grammarPath;

    @Option(names = {"--inputs"}, description = "File with one seed input per line", required = true)
    private String inputsPath;

    @Option(names = {"--oracle"}, description = "Command that reads an input from stdin and exits non-zero when it fails", required = true, split = " ")
    private List<String> oracleCommand;

    @Option(names = {"--oracle_timeout"}, description = "Seconds before an oracle run counts as undefined")
    private long oracleTimeout = 10;

    @Option(names = {"--templates"}, description = "JSON file with template groups to use instead of the built-in ones")
    private String templatesPath;

    @Option(names = {"--template_groups"}, description = "Only use the given template groups", split = ",")
    private List<String> templateGroups;

    @Option(names = {"--config"}, description = "INI file with [LEARNER] and [REFINEMENT] sections")
    private String configPath;

    @Option(names = {"--relevant"}, description = "Non-terminals to instantiate templates with, e.g. <digit>", split = ",")
    private List<String> relevantSymbols;

    @Option(names = {"--min_precision"}, description = "Minimum precision of a conjunction")
    private Double minPrecision;

    @Option(names = {"--min_recall"}, description = "Minimum recall of a candidate")
    private Double minRecall;

    @Option(names = {"--max_iterations"}, description = "Maximum number of refinement iterations")
    private Integer maxIterations;

    @Option(names = {"--timeout"}, description = "Refinement timeout in seconds")
    private Long timeoutSeconds;

    @Option(names = {"--workers"}, description = "Use <count> threads for input generation")
    private Integer workers;

    @Option(names = {"--output"}, description = "The file to write the diagnoses to")
    private String outputPath = "-";

    @Option(names = {"--log_directory_path"}, description = "Directory where to store live and archived log files")
    private String logPath;

    @Option(names = {"--mode"}, description = "Valid values: ${COMPLETION-CANDIDATES} (case insensitive)", defaultValue = "explain")
    private Mode mode;

    @Override
    public Integer call() throws Exception {
        if (logPath != null) {
            System.setProperty("LOG_DIRECTORY_PATH", logPath);
        }

        try {
            final IniConfig config = configPath != null ? IniConfig.loadFrom(Paths.get(configPath)) : IniConfig.empty();
            final Grammar grammar = GrammarLoader.loadFrom(Paths.get(grammarPath));
            final TemplateRepository templates = templatesPath != null
                    ? TemplateRepository.loadFrom(Paths.get(templatesPath))
                    : TemplateRepository.defaults();

            final List<String> groups = templateGroups != null
                    ? templateGroups
                    : config.getSection(LearnerConfig.SECTION).getStringList("template_groups", null);

            final ConstraintLearner learner = ConstraintLearner.forGrammar(grammar)
                    .templates(groups != null ? templates.select(groups) : templates.all())
                    .config(learnerConfig(config));
            final ProcessOracle oracle = ProcessOracle.forCommand(oracleCommand)
                    .timeout(Duration.ofSeconds(oracleTimeout));
            final List<String> seeds = readInputs(Paths.get(inputsPath));

            final List<Candidate> diagnoses = switch (mode) {
                case LEARN -> learner.learnFromStrings(learner.newSession(), seeds, relevant(), oracle);
                case EXPLAIN -> HypothesisRefiner.create(learner, new BatchExecutionHandler(oracle), seeds)
                        .config(refinementConfig(config))
                        .relevantSymbols(relevant())
                        .explain();
            };

            if (outputPath.equals("-")) {
                print(diagnoses, System.out);
                return ExitCode.OK;
            }
            try (final PrintStream output = new PrintStream(Files.newOutputStream(Paths.get(outputPath)))) {
                print(diagnoses, output);
            }
        }
        catch (final Throwable t) {
            LoggerFactory.getLogger(DiagnoseCli.class).error("Fatal error", t);
            System.err.println("Fatal error: " + t.getMessage());
            return ExitCode.SOFTWARE;
        }

        return ExitCode.OK;
    }

    private LearnerConfig learnerConfig(final IniConfig ini) {
        LearnerConfig config = LearnerConfig.loadFrom(ini.getSection(LearnerConfig.SECTION));
        if (minPrecision != null) {
            config = config.minPrecision(minPrecision);
        }
        if (minRecall != null) {
            config = config.minRecall(minRecall);
        }
        return config;
    }

    private RefinementConfig refinementConfig(final IniConfig ini) {
        RefinementConfig config = RefinementConfig.loadFrom(ini.getSection(RefinementConfig.SECTION));
        if (maxIterations != null) {
            config = config.maxIterations(maxIterations);
        }
        if (timeoutSeconds != null) {
            config = config.timeout(Duration.ofSeconds(timeoutSeconds));
        }
        if (workers != null) {
            config = config.workers(workers);
        }
        return config;
    }

    private Set<Symbol> relevant() {
        final Set<Symbol> symbols = new LinkedHashSet<>();
        if (relevantSymbols != null) {
            relevantSymbols.forEach(name -> symbols.add(Symbol.nonTerminal(name.trim())));
        }
        return symbols;
    }

    private static List<String> readInputs(final Path path) throws IOException {
        final List<String> inputs = new ArrayList<>();
        for (final String line : Files.readAllLines(path)) {
            if (!line.isBlank()) {
                inputs.add(line);
            }
        }
        return inputs;
    }

    private static void print(final List<Candidate> diagnoses, final PrintStream output) {
        for (final Candidate candidate : diagnoses) {
            output.printf("%s\tprecision=%.4f\trecall=%.4f%n", candidate.text(), candidate.precision(), candidate.recall());
        }
        output.flush();
    }
}
