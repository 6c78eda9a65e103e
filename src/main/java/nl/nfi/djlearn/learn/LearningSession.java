package nl.nfi.djlearn.learn;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable state carried across {@link ConstraintLearner#learn} calls: every labeled input
 * seen so far, the kept candidates and the candidates rejected for good.
 */
public final class LearningSession {

    private final Set<LabeledInput> failingInputs = new LinkedHashSet<>();
    private final Set<LabeledInput> passingInputs = new LinkedHashSet<>();
    private final CandidateSet candidates = new CandidateSet();
    private final Set<Candidate> removed = new HashSet<>();

    /**
     * Merges the inputs and returns those not seen before.
     */
    List<LabeledInput> merge(final Collection<LabeledInput> inputs) {
        final List<LabeledInput> added = new ArrayList<>();
        for (final LabeledInput input : inputs) {
            final boolean isNew = switch (input.verdict()) {
                case FAILING -> !passingInputs.contains(input) && failingInputs.add(input);
                case PASSING -> !failingInputs.contains(input) && passingInputs.add(input);
                case UNDEFINED -> false;
            };
            if (isNew) {
                added.add(input);
            }
        }
        return added;
    }

    public Set<LabeledInput> failingInputs() {
        return Collections.unmodifiableSet(failingInputs);
    }

    public Set<LabeledInput> passingInputs() {
        return Collections.unmodifiableSet(passingInputs);
    }

    public Set<LabeledInput> allInputs() {
        final Set<LabeledInput> all = new LinkedHashSet<>(failingInputs);
        all.addAll(passingInputs);
        return all;
    }

    public Set<Candidate> candidates() {
        return Collections.unmodifiableSet(candidates);
    }

    CandidateSet mutableCandidates() {
        return candidates;
    }

    boolean isRemoved(final Candidate candidate) {
        return removed.contains(candidate);
    }

    void remove(final Candidate candidate) {
        candidates.remove(candidate);
        removed.add(candidate);
    }

    public int removedCount() {
        return removed.size();
    }

    /**
     * Forgets kept and rejected candidates, keeping the inputs.
     */
    public void resetCandidates() {
        candidates.clear();
        removed.clear();
    }
}
