package nl.nfi.djlearn.refine;

import nl.nfi.djlearn.grammar.DerivationTree;
import nl.nfi.djlearn.grammar.Grammar;
import nl.nfi.djlearn.learn.BatchOracle;
import nl.nfi.djlearn.learn.LabeledInput;
import nl.nfi.djlearn.learn.Verdict;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static nl.nfi.djlearn.Utils.CALCULATOR_ORACLE;
import static nl.nfi.djlearn.Utils.calculatorGrammar;
import static org.assertj.core.api.Assertions.assertThat;

class ExecutionHandlerTest {

    private static final Grammar GRAMMAR = calculatorGrammar();

    private static Set<DerivationTree> trees(final String... inputs) {
        final Set<DerivationTree> trees = new LinkedHashSet<>();
        for (final String input : inputs) {
            trees.add(GRAMMAR.parse(input));
        }
        return trees;
    }

    @Test
    void labelsEachInput() {
        final Set<LabeledInput> labeled = new SingleExecutionHandler(CALCULATOR_ORACLE).label(trees("sqrt(-1)", "cos(-1)"));

        assertThat(labeled).extracting(LabeledInput::verdict).containsExactly(Verdict.FAILING, Verdict.PASSING);
    }

    @Test
    void labelsRoundInSingleBatch() {
        final List<Set<String>> batches = new ArrayList<>();
        final BatchOracle oracle = new BatchOracle() {
            @Override
            public Verdict evaluate(final String input) {
                return CALCULATOR_ORACLE.evaluate(input);
            }

            @Override
            public Map<String, Verdict> evaluateAll(final Set<String> inputs) {
                batches.add(Set.copyOf(inputs));
                return BatchOracle.super.evaluateAll(inputs);
            }
        };

        final Set<LabeledInput> labeled = new BatchExecutionHandler(oracle).label(trees("sqrt(-1)", "cos(-1)", "sqrt(3)"));

        assertThat(batches).containsExactly(Set.of("sqrt(-1)", "cos(-1)", "sqrt(3)"));
        assertThat(labeled).extracting(LabeledInput::verdict).containsExactly(Verdict.FAILING, Verdict.PASSING, Verdict.PASSING);
    }

    @Test
    void missingVerdictsAreUndefined() {
        final BatchOracle oracle = new BatchOracle() {
            @Override
            public Verdict evaluate(final String input) {
                return Verdict.FAILING;
            }

            @Override
            public Map<String, Verdict> evaluateAll(final Set<String> inputs) {
                return Map.of("sqrt(-1)", Verdict.FAILING);
            }
        };

        final Set<LabeledInput> labeled = new BatchExecutionHandler(oracle).label(trees("sqrt(-1)", "cos(2)"));

        assertThat(labeled).extracting(LabeledInput::verdict).containsExactly(Verdict.FAILING, Verdict.UNDEFINED);
    }
}
