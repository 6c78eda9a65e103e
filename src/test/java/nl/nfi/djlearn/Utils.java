package nl.nfi.djlearn;

import nl.nfi.djlearn.grammar.Grammar;
import nl.nfi.djlearn.grammar.GrammarLoader;
import nl.nfi.djlearn.learn.LabeledInput;
import nl.nfi.djlearn.learn.Oracle;
import nl.nfi.djlearn.learn.Verdict;

import java.math.BigInteger;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

public final class Utils {

    public static final Path TEST_RESOURCES_PATH = Paths.get("src/test/resources").toAbsolutePath();

    /**
     * Fails on the square root of a negative number.
     */
    public static final Oracle CALCULATOR_ORACLE = input -> {
        final int open = input.indexOf('(');
        final int close = input.lastIndexOf(')');
        if (open < 0 || close < open) {
            return Verdict.UNDEFINED;
        }
        final String function = input.substring(0, open);
        final BigInteger number = new BigInteger(input.substring(open + 1, close));
        return function.equals("sqrt") && number.signum() < 0 ? Verdict.FAILING : Verdict.PASSING;
    };

    private Utils() {
    }

    public static Grammar calculatorGrammar() {
        return GrammarLoader.loadFrom(TEST_RESOURCES_PATH.resolve("grammars/calculator.bnf"));
    }

    public static Grammar listGrammar() {
        return GrammarLoader.loadFrom(TEST_RESOURCES_PATH.resolve("grammars/list.bnf"));
    }

    public static List<LabeledInput> label(final Grammar grammar, final Oracle oracle, final String... inputs) {
        final List<LabeledInput> labeled = new ArrayList<>();
        for (final String input : inputs) {
            labeled.add(LabeledInput.label(grammar.parse(input), oracle));
        }
        return labeled;
    }
}
