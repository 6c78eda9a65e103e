package nl.nfi.djlearn.learn;

/**
 * Classifies a concrete input. Implementations must be side-effect free.
 */
@FunctionalInterface
public interface Oracle {

    Verdict evaluate(String input);
}
