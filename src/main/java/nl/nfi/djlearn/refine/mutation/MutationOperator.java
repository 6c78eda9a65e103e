package nl.nfi.djlearn.refine.mutation;

import nl.nfi.djlearn.grammar.DerivationTree;

import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Structural mutation of the subtree at a path. Returns a new tree, or empty when the
 * operator does not apply at that position.
 */
@FunctionalInterface
public interface MutationOperator {

    Optional<DerivationTree> apply(DerivationTree tree, List<Integer> path, Random random);
}
