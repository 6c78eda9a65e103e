package nl.nfi.djlearn.learn;

import nl.nfi.djlearn.grammar.DerivationTree;

import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A derivation tree with the oracle's verdict. Two labeled inputs are equal when their
 * trees are structurally equal, regardless of verdict.
 */
public final class LabeledInput {

    private final DerivationTree tree;
    private final Verdict verdict;

    private volatile Map<String, Double> features;

    private LabeledInput(final DerivationTree tree, final Verdict verdict) {
        this.tree = requireNonNull(tree);
        this.verdict = requireNonNull(verdict);
    }

    public static LabeledInput of(final DerivationTree tree, final Verdict verdict) {
        return new LabeledInput(tree, verdict);
    }

    public static LabeledInput label(final DerivationTree tree, final Oracle oracle) {
        return new LabeledInput(tree, oracle.evaluate(tree.toString()));
    }

    public DerivationTree tree() {
        return tree;
    }

    public Verdict verdict() {
        return verdict;
    }

    public boolean isFailing() {
        return verdict == Verdict.FAILING;
    }

    public boolean isPassing() {
        return verdict == Verdict.PASSING;
    }

    public Optional<Map<String, Double>> features() {
        return Optional.ofNullable(features);
    }

    /**
     * Attaches a feature vector. Features can be attached once.
     */
    public synchronized void attachFeatures(final Map<String, Double> features) {
        if (this.features != null) {
            throw new IllegalStateException("Features already attached to input: %s".formatted(tree));
        }
        this.features = Map.copyOf(features);
    }

    @Override
    public boolean equals(final Object o) {
        return this == o || (o instanceof LabeledInput other && tree.equals(other.tree));
    }

    @Override
    public int hashCode() {
        return tree.hashCode();
    }

    @Override
    public String toString() {
        return "%s (%s)".formatted(tree, verdict);
    }
}
