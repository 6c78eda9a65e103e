package nl.nfi.djlearn.refine;

import nl.nfi.djlearn.grammar.DerivationTree;
import nl.nfi.djlearn.learn.LabeledInput;
import nl.nfi.djlearn.learn.Oracle;

import java.util.LinkedHashSet;
import java.util.Set;

public final class SingleExecutionHandler implements ExecutionHandler {

    private final Oracle oracle;

    public SingleExecutionHandler(final Oracle oracle) {
        this.oracle = oracle;
    }

    @Override
    public Set<LabeledInput> label(final Set<DerivationTree> trees) {
        final Set<LabeledInput> labeled = new LinkedHashSet<>();
        for (final DerivationTree tree : trees) {
            labeled.add(LabeledInput.label(tree, oracle));
        }
        return labeled;
    }
}
