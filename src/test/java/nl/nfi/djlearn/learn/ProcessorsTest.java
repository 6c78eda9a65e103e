package nl.nfi.djlearn.learn;

import nl.nfi.djlearn.constraint.ConstraintParser;
import nl.nfi.djlearn.grammar.Grammar;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static nl.nfi.djlearn.Utils.CALCULATOR_ORACLE;
import static nl.nfi.djlearn.Utils.calculatorGrammar;
import static nl.nfi.djlearn.Utils.label;
import static org.assertj.core.api.Assertions.assertThat;

class ProcessorsTest {

    private static final Grammar GRAMMAR = calculatorGrammar();

    private static Candidate evaluated(final String constraint, final List<LabeledInput> inputs) {
        final Candidate candidate = Candidate.of(ConstraintParser.parse(constraint));
        candidate.evaluate(inputs);
        return candidate;
    }

    @Nested
    class Conjunctions {

        private final List<LabeledInput> inputs = label(GRAMMAR, CALCULATOR_ORACLE, "sqrt(-1)", "cos(2)", "sqrt(2)", "cos(-1)");

        @Test
        void keepsOnlyConjunctionsImprovingEveryOperand() {
            final List<Candidate> candidates = List.of(
                    evaluated("int(<n>) <= -1", inputs),
                    evaluated("str(<f>) == \"sqrt\"", inputs),
                    evaluated("int(<n>) == 2", inputs)
            );

            final List<Candidate> conjunctions = ConjunctionProcessor.create(2, 0.6).process(candidates);

            assertThat(conjunctions).extracting(Candidate::text)
                    .containsExactly("(int(<n>) <= -1 and str(<f>) == \"sqrt\")");
            assertThat(conjunctions.get(0).precision()).isEqualTo(1.0);
        }

        @Test
        void respectsPrecisionFloor() {
            final List<Candidate> candidates = List.of(
                    evaluated("int(<n>) <= -1", inputs),
                    evaluated("str(<f>) == \"sqrt\"", inputs)
            );

            assertThat(ConjunctionProcessor.create(2, 1.0).process(candidates)).isEmpty();
        }

        @Test
        void ignoresExistingConjunctionsAndSizeOne() {
            final Candidate conjunction = evaluated("(int(<n>) <= -1 and str(<f>) == \"sqrt\")", inputs);
            final List<Candidate> candidates = List.of(conjunction, evaluated("int(<n>) <= -1", inputs));

            assertThat(ConjunctionProcessor.create(3, 0.0).process(candidates)).isEmpty();
            assertThat(ConjunctionProcessor.create(1, 0.0).process(List.of(evaluated("int(<n>) <= -1", inputs), evaluated("str(<f>) == \"sqrt\"", inputs)))).isEmpty();
        }
    }

    @Nested
    class Disjunctions {

        private final List<LabeledInput> inputs = label(GRAMMAR, CALCULATOR_ORACLE, "sqrt(-1)", "sqrt(-22)", "cos(2)");

        @Test
        void keepsDisjunctionsImprovingRecall() {
            final List<Candidate> candidates = List.of(
                    evaluated("int(<n>) == -1", inputs),
                    evaluated("int(<n>) == -22", inputs)
            );

            final List<Candidate> disjunctions = DisjunctionProcessor.create(2, 0.9).process(candidates);

            assertThat(disjunctions).extracting(Candidate::text)
                    .containsExactly("(int(<n>) == -1 or int(<n>) == -22)");
            assertThat(disjunctions.get(0).recall()).isEqualTo(1.0);
            assertThat(disjunctions.get(0).precision()).isEqualTo(1.0);
        }

        @Test
        void rejectsDisjunctionsWithoutRecallGain() {
            final List<Candidate> candidates = List.of(
                    evaluated("int(<n>) < 0", inputs),
                    evaluated("int(<n>) == -22", inputs)
            );

            assertThat(DisjunctionProcessor.create(2, 0.5).process(candidates)).isEmpty();
        }

        @Test
        void usesPluggableValidation() {
            final List<Candidate> candidates = List.of(
                    evaluated("int(<n>) == -1", inputs),
                    evaluated("int(<n>) == -22", inputs),
                    evaluated("int(<n>) == 2", inputs)
            );

            assertThat(DisjunctionProcessor.create(3, 0.0).validation((disjunction, operands) -> false).process(candidates)).isEmpty();
            assertThat(DisjunctionProcessor.create(3, 0.0).validation((disjunction, operands) -> true).process(candidates)).hasSize(4);
        }
    }

    @Nested
    class Validations {

        private final List<LabeledInput> inputs = label(GRAMMAR, CALCULATOR_ORACLE, "sqrt(-1)", "sqrt(-22)", "cos(2)", "cos(-1)");

        @Test
        void weighsRecallGainAgainstPrecisionLoss() {
            final Candidate one = evaluated("int(<n>) == -22", inputs);
            final Candidate other = evaluated("int(<n>) == -1", inputs);
            final Candidate disjunction = one.or(other);

            // recall gains 0.5, precision drops from 1.0 to 2/3
            assertThat(DisjunctionValidation.recallGainOutweighsPrecisionLoss(1.0).accept(disjunction, List.of(one, other))).isTrue();
            assertThat(DisjunctionValidation.recallGainOutweighsPrecisionLoss(2.0).accept(disjunction, List.of(one, other))).isFalse();
        }

        @Test
        void checksPrecisionFloorAndSpecificity() {
            final Candidate one = evaluated("int(<n>) == -22", inputs);
            final Candidate other = evaluated("int(<n>) == -1", inputs);
            final Candidate disjunction = one.or(other);

            assertThat(DisjunctionValidation.precisionFloor(0.6).accept(disjunction, List.of(one, other))).isTrue();
            assertThat(DisjunctionValidation.precisionFloor(0.7).accept(disjunction, List.of(one, other))).isFalse();
            assertThat(DisjunctionValidation.minimumSpecificity(0.5).accept(disjunction, List.of(one, other))).isTrue();
            assertThat(DisjunctionValidation.minimumSpecificity(0.75).accept(disjunction, List.of(one, other))).isFalse();
            assertThat(DisjunctionValidation.averagePrecisionDrop(0.2).accept(disjunction, List.of(one, other))).isTrue();
            assertThat(DisjunctionValidation.averagePrecisionDrop(0.05).accept(disjunction, List.of(one, other))).isFalse();
        }
    }
}
