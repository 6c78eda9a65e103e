package nl.nfi.djlearn.refine.mutation;

import nl.nfi.djlearn.grammar.DerivationTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Swaps the subtree with a different subtree of the same symbol elsewhere in the tree. The
 * two positions may not be nested in each other.
 */
public final class SwapSubtreeOperator implements MutationOperator {

    @Override
    public Optional<DerivationTree> apply(final DerivationTree tree, final List<Integer> path, final Random random) {
        final DerivationTree subtree = tree.get(path);
        if (subtree.symbol().terminal()) {
            return Optional.empty();
        }
        final List<DerivationTree.Located> partners = new ArrayList<>();
        for (final DerivationTree.Located located : tree.locate()) {
            if (located.tree().symbol().equals(subtree.symbol())
                    && !located.tree().equals(subtree)
                    && !isPrefix(located.path(), path)
                    && !isPrefix(path, located.path())) {
                partners.add(located);
            }
        }
        if (partners.isEmpty()) {
            return Optional.empty();
        }
        final DerivationTree.Located partner = partners.get(random.nextInt(partners.size()));
        return Optional.of(tree
                .replace(path, partner.tree())
                .replace(partner.path(), subtree));
    }

    private static boolean isPrefix(final List<Integer> prefix, final List<Integer> path) {
        return prefix.size() <= path.size() && path.subList(0, prefix.size()).equals(prefix);
    }
}
