package nl.nfi.djlearn.learn;

import nl.nfi.djlearn.constraint.ConstraintParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static nl.nfi.djlearn.Utils.CALCULATOR_ORACLE;
import static nl.nfi.djlearn.Utils.calculatorGrammar;
import static nl.nfi.djlearn.Utils.label;
import static org.assertj.core.api.Assertions.assertThat;

class FitnessTest {

    private Candidate broad;
    private Candidate exact;
    private Candidate wordy;
    private Candidate none;

    @BeforeEach
    void setUp() {
        final List<LabeledInput> inputs = label(calculatorGrammar(), CALCULATOR_ORACLE, "sqrt(-1)", "sqrt(-22)", "cos(2)", "cos(-1)");
        broad = evaluated("int(<n>) < 0", inputs);
        exact = evaluated("int(<n>) < -20", inputs);
        wordy = evaluated("(int(<n>) < -20 and str(<f>) == \"sqrt\")", inputs);
        none = evaluated("int(<n>) > 100", inputs);
    }

    private static Candidate evaluated(final String constraint, final List<LabeledInput> inputs) {
        final Candidate candidate = Candidate.of(ConstraintParser.parse(constraint));
        candidate.evaluate(inputs);
        return candidate;
    }

    @Test
    void ranksRecallBeforePrecision() {
        assertThat(Fitness.RECALL_PRECISION.sort(List.of(none, exact, broad)))
                .containsExactly(broad, exact, none);
    }

    @Test
    void breaksTiesBySize() {
        assertThat(Fitness.RECALL_PRECISION_SIZE.sort(List.of(wordy, exact)))
                .containsExactly(exact, wordy);
        assertThat(Fitness.RECALL_PRECISION_SIZE.best(List.of(wordy, broad, exact)))
                .containsExactly(broad);
    }

    @Test
    void bestReturnsAllTiedCandidates() {
        assertThat(Fitness.RECALL_PRECISION.best(List.of(wordy, exact, none)))
                .containsExactly(wordy, exact);
        assertThat(Fitness.RECALL_PRECISION.best(List.of())).isEmpty();
    }

    @Test
    void balancesPrecisionAndRecall() {
        // f1 of broad is 0.8, of exact 2/3
        assertThat(Fitness.F1_SIZE.sort(List.of(exact, broad, none)))
                .containsExactly(broad, exact, none);
        assertThat(Fitness.RECALL_SPECIFICITY_SIZE.sort(List.of(exact, broad)))
                .containsExactly(broad, exact);
    }
}
