package nl.nfi.djlearn.refine.mutation;

import nl.nfi.djlearn.grammar.DerivationTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Replaces the subtree with a different fragment of the same symbol seen before.
 */
public final class ReplaceFragmentOperator implements MutationOperator {

    private final FragmentIndex fragments;

    public ReplaceFragmentOperator(final FragmentIndex fragments) {
        this.fragments = fragments;
    }

    @Override
    public Optional<DerivationTree> apply(final DerivationTree tree, final List<Integer> path, final Random random) {
        final DerivationTree subtree = tree.get(path);
        if (subtree.symbol().terminal()) {
            return Optional.empty();
        }
        final List<DerivationTree> different = new ArrayList<>();
        final String text = subtree.toString();
        for (final DerivationTree fragment : fragments.fragments(subtree.symbol())) {
            if (!fragment.toString().equals(text)) {
                different.add(fragment);
            }
        }
        if (different.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(tree.replace(path, different.get(random.nextInt(different.size()))));
    }
}
