package nl.nfi.djlearn.learn;

import nl.nfi.djlearn.grammar.Symbol;

import java.util.Collection;
import java.util.Set;

/**
 * Selects the symbols worth reasoning about, typically from the feature vectors attached to
 * the inputs by a {@link FeatureCollector}.
 */
@FunctionalInterface
public interface RelevanceReducer {

    Set<Symbol> reduce(Collection<LabeledInput> inputs);
}
