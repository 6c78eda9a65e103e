package nl.nfi.djlearn.refine;

import nl.nfi.djlearn.grammar.DerivationTree;
import nl.nfi.djlearn.learn.LabeledInput;

import java.util.Set;

/**
 * Labels generated inputs with the oracle's verdict.
 */
public interface ExecutionHandler {

    Set<LabeledInput> label(Set<DerivationTree> trees);
}
