package nl.nfi.djlearn.refine.generate;

import nl.nfi.djlearn.grammar.DerivationTree;
import nl.nfi.djlearn.learn.Candidate;

import java.util.Collection;
import java.util.Set;

/**
 * Runs an {@link InputGenerator} for every candidate and collects the produced inputs in no
 * particular order.
 */
public interface GenerationEngine {

    Set<DerivationTree> generate(InputGenerator generator, Collection<Candidate> candidates);
}
