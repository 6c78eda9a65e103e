package nl.nfi.djlearn.refine;

import nl.nfi.djlearn.constraint.Constraint;
import nl.nfi.djlearn.constraint.ConstraintParser;
import nl.nfi.djlearn.constraint.ConstraintPrinter;
import nl.nfi.djlearn.learn.Candidate;
import nl.nfi.djlearn.learn.LabeledInput;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static nl.nfi.djlearn.Utils.CALCULATOR_ORACLE;
import static nl.nfi.djlearn.Utils.calculatorGrammar;
import static nl.nfi.djlearn.Utils.label;
import static org.assertj.core.api.Assertions.assertThat;

class NegationsTest {

    private static List<String> negated(final String constraint) {
        return Negations.negate(ConstraintParser.parse(constraint)).stream()
                .map(ConstraintPrinter::print)
                .collect(Collectors.toList());
    }

    @Test
    void flipsComparisonOperator() {
        assertThat(negated("int(<n>) <= -1")).containsExactly("int(<n>) > -1");
        assertThat(negated("str(<f>) == \"sqrt\"")).containsExactly("str(<f>) != \"sqrt\"");
    }

    @Test
    void unwrapsNegationAndWrapsOtherConstraints() {
        assertThat(negated("not (int(<n>) < 0)")).containsExactly("int(<n>) < 0");
        assertThat(negated("exists <d> in <digit>: int(<d>) == 7"))
                .containsExactly("not ((exists <d> in <digit>: int(<d>) == 7))");
    }

    @Test
    void negatesEverySelectionOfConjunctionOperands() {
        assertThat(negated("(int(<n>) <= -1 and str(<f>) == \"sqrt\")")).containsExactly(
                "(int(<n>) > -1 and str(<f>) == \"sqrt\")",
                "(int(<n>) <= -1 and str(<f>) != \"sqrt\")",
                "(int(<n>) > -1 and str(<f>) != \"sqrt\")"
        );
        assertThat(negated("(int(<n>) < 1 and int(<n>) > -5 and str(<f>) == \"cos\")"))
                .hasSize(7)
                .doesNotHaveDuplicates();
    }

    @Test
    void negatesOneDisjunctionOperandAtATime() {
        assertThat(negated("(int(<n>) == 1 or int(<n>) == 2 or int(<n>) == 3)")).containsExactly(
                "(int(<n>) != 1 or int(<n>) == 2 or int(<n>) == 3)",
                "(int(<n>) == 1 or int(<n>) != 2 or int(<n>) == 3)",
                "(int(<n>) == 1 or int(<n>) == 2 or int(<n>) != 3)"
        );
    }

    @Test
    void collectsDistinctVariantsOfAllCandidates() {
        final Constraint first = ConstraintParser.parse("int(<n>) < 0");
        final Constraint second = ConstraintParser.parse("not (int(<n>) >= 0)");

        final Set<Candidate> negated = Negations.negateAll(List.of(Candidate.of(first), Candidate.of(second)));

        assertThat(negated).extracting(Candidate::text).containsExactly("int(<n>) >= 0");
    }

    @Test
    void flippedComparisonComplementsEvaluatedResults() {
        final List<LabeledInput> inputs = label(calculatorGrammar(), CALCULATOR_ORACLE, "sqrt(-1)", "cos(2)", "sqrt(2)");
        final Candidate candidate = Candidate.of(ConstraintParser.parse("int(<n>) <= -1"));
        candidate.evaluate(inputs);

        final List<Candidate> negated = Negations.negate(candidate);

        assertThat(negated).hasSize(1);
        final Candidate flipped = negated.get(0);
        assertThat(flipped.text()).isEqualTo("int(<n>) > -1");
        assertThat(flipped.cache().keySet()).containsExactlyInAnyOrderElementsOf(inputs);
        inputs.forEach(input -> assertThat(flipped.holdsFor(input)).isNotEqualTo(candidate.holdsFor(input)));
    }
}
