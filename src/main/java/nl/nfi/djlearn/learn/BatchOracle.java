package nl.nfi.djlearn.learn;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Oracle that can classify many inputs in one call, e.g. by running them in a single
 * process invocation.
 */
public interface BatchOracle extends Oracle {

    default Map<String, Verdict> evaluateAll(final Set<String> inputs) {
        final Map<String, Verdict> verdicts = new LinkedHashMap<>();
        for (final String input : inputs) {
            verdicts.put(input, evaluate(input));
        }
        return verdicts;
    }
}
