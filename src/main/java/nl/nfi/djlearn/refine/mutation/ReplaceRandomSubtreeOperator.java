package nl.nfi.djlearn.refine.mutation;

import nl.nfi.djlearn.grammar.DerivationTree;
import nl.nfi.djlearn.grammar.Grammar;

import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Replaces the subtree with a freshly generated one of the same symbol.
 */
public final class ReplaceRandomSubtreeOperator implements MutationOperator {

    private final Grammar grammar;

    public ReplaceRandomSubtreeOperator(final Grammar grammar) {
        this.grammar = grammar;
    }

    @Override
    public Optional<DerivationTree> apply(final DerivationTree tree, final List<Integer> path, final Random random) {
        final DerivationTree subtree = tree.get(path);
        if (subtree.symbol().terminal()) {
            return Optional.empty();
        }
        final DerivationTree generated = grammar.fuzz(subtree.symbol(), random);
        if (generated.equals(subtree)) {
            return Optional.empty();
        }
        return Optional.of(tree.replace(path, generated));
    }
}
