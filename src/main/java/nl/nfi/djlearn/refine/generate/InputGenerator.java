package nl.nfi.djlearn.refine.generate;

import nl.nfi.djlearn.grammar.DerivationTree;
import nl.nfi.djlearn.learn.Candidate;

import java.util.Random;
import java.util.Set;

/**
 * Produces inputs for a candidate. Implementations are shared between worker threads and
 * must only keep per-call state; interruption of the calling thread ends generation early
 * with the inputs found so far.
 */
@FunctionalInterface
public interface InputGenerator {

    Set<DerivationTree> generate(Candidate candidate, Random random);
}
