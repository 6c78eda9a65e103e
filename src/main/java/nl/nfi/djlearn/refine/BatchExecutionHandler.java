package nl.nfi.djlearn.refine;

import nl.nfi.djlearn.grammar.DerivationTree;
import nl.nfi.djlearn.learn.BatchOracle;
import nl.nfi.djlearn.learn.LabeledInput;
import nl.nfi.djlearn.learn.Verdict;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Sends all inputs of a round to the oracle in one call. Inputs the oracle leaves out of its
 * answer are labeled {@link Verdict#UNDEFINED}.
 */
public final class BatchExecutionHandler implements ExecutionHandler {

    private final BatchOracle oracle;

    public BatchExecutionHandler(final BatchOracle oracle) {
        this.oracle = oracle;
    }

    @Override
    public Set<LabeledInput> label(final Set<DerivationTree> trees) {
        final Map<String, DerivationTree> byText = new LinkedHashMap<>();
        for (final DerivationTree tree : trees) {
            byText.putIfAbsent(tree.toString(), tree);
        }
        final Map<String, Verdict> verdicts = oracle.evaluateAll(byText.keySet());

        final Set<LabeledInput> labeled = new LinkedHashSet<>();
        byText.forEach((text, tree) -> labeled.add(LabeledInput.of(tree, verdicts.getOrDefault(text, Verdict.UNDEFINED))));
        return labeled;
    }
}
