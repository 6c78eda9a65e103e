package nl.nfi.djlearn.learn;

import nl.nfi.djlearn.constraint.ConstraintParser;
import nl.nfi.djlearn.grammar.Grammar;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static nl.nfi.djlearn.Utils.CALCULATOR_ORACLE;
import static nl.nfi.djlearn.Utils.calculatorGrammar;
import static nl.nfi.djlearn.Utils.label;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CandidateTest {

    private Grammar grammar;
    private List<LabeledInput> inputs;

    @BeforeEach
    void setUp() {
        grammar = calculatorGrammar();
        inputs = label(grammar, CALCULATOR_ORACLE, "sqrt(-1)", "cos(2)", "sqrt(2)", "cos(-1)");
    }

    private static Candidate candidate(final String constraint) {
        return Candidate.of(ConstraintParser.parse(constraint));
    }

    @Test
    void computesScores() {
        final Candidate candidate = candidate("int(<n>) <= -1");
        candidate.evaluate(inputs);

        assertThat(candidate.failingCount()).isEqualTo(1);
        assertThat(candidate.passingCount()).isEqualTo(3);
        assertThat(candidate.recall()).isEqualTo(1.0);
        assertThat(candidate.precision()).isEqualTo(0.5);
        assertThat(candidate.specificity()).isCloseTo(2.0 / 3.0, within(1e-9));
        assertThat(candidate.holdsFor(inputs.get(3))).isTrue();
        assertThat(candidate.holdsFor(inputs.get(1))).isFalse();
    }

    @Test
    void evaluationIsIncrementalAndIdempotent() {
        final Candidate candidate = candidate("str(<f>) == \"sqrt\"");
        candidate.evaluate(inputs.subList(0, 2));
        candidate.evaluate(inputs);
        candidate.evaluate(inputs);

        assertThat(candidate.cache()).hasSize(4);
        assertThat(candidate.failingCount()).isEqualTo(1);
        assertThat(candidate.passingCount()).isEqualTo(3);
        assertThat(candidate.precision()).isEqualTo(0.5);
    }

    @Test
    void skipsUndefinedInputs() {
        final Candidate candidate = candidate("str(<f>) == \"sqrt\"");
        candidate.evaluate(List.of(LabeledInput.of(grammar.parse("sqrt(5)"), Verdict.UNDEFINED)));

        assertThat(candidate.cache()).isEmpty();
        assertThat(candidate.recall()).isZero();
        assertThat(candidate.precision()).isZero();
        assertThat(candidate.specificity()).isZero();
    }

    @Test
    void evaluationErrorsCountAsNotHolding() {
        final Candidate candidate = candidate("int(<f>) == 1");
        candidate.evaluate(inputs);

        assertThat(candidate.cache()).hasSize(4).doesNotContainValue(true);
        assertThat(candidate.recall()).isZero();
    }

    @Test
    void negationComplementsEveryResult() {
        final Candidate candidate = candidate("int(<n>) <= -1");
        candidate.evaluate(inputs);
        final Candidate negated = candidate.negate();

        assertThat(negated.text()).isEqualTo("int(<n>) > -1");
        assertThat(negated.cache().keySet()).isEqualTo(candidate.cache().keySet());
        inputs.forEach(input -> assertThat(negated.holdsFor(input)).isNotEqualTo(candidate.holdsFor(input)));
        assertThat(negated.recall()).isZero();
    }

    @Test
    void negationWrapsConstraintsWithoutOperator() {
        final Candidate candidate = candidate("\"-\" in str(<n>)");
        candidate.evaluate(inputs);
        final Candidate negated = candidate.negate();

        assertThat(negated.text()).isEqualTo("not (\"-\" in str(<n>))");
        inputs.forEach(input -> assertThat(negated.holdsFor(input)).isNotEqualTo(candidate.holdsFor(input)));
        assertThat(negated.negate()).isEqualTo(candidate);
    }

    @Test
    void combinesCachesPointwise() {
        final Candidate negative = candidate("int(<n>) <= -1");
        final Candidate sqrt = candidate("str(<f>) == \"sqrt\"");
        negative.evaluate(inputs);
        sqrt.evaluate(inputs);

        final Candidate conjunction = negative.and(sqrt);
        assertThat(conjunction.isConjunction()).isTrue();
        assertThat(conjunction.text()).isEqualTo("(int(<n>) <= -1 and str(<f>) == \"sqrt\")");
        assertThat(conjunction.precision()).isEqualTo(1.0);
        assertThat(conjunction.recall()).isEqualTo(1.0);

        final Candidate disjunction = negative.or(sqrt);
        assertThat(disjunction.isDisjunction()).isTrue();
        assertThat(disjunction.precision()).isCloseTo(1.0 / 3.0, within(1e-9));
        assertThat(disjunction.specificity()).isCloseTo(1.0 / 3.0, within(1e-9));
    }

    @Test
    void combinedCachesMatchDirectEvaluation() {
        final Candidate negative = candidate("int(<n>) <= -1");
        final Candidate sqrt = candidate("str(<f>) == \"sqrt\"");
        negative.evaluate(inputs);
        sqrt.evaluate(inputs);

        final Candidate combined = Candidate.conjunction(List.of(negative, sqrt));
        final Candidate direct = candidate("(int(<n>) <= -1 and str(<f>) == \"sqrt\")");
        direct.evaluate(inputs);

        assertThat(combined).isEqualTo(direct);
        assertThat(combined.cache()).isEqualTo(direct.cache());
    }

    @Test
    void refusesToCombineDifferentInputs() {
        final Candidate negative = candidate("int(<n>) <= -1");
        final Candidate sqrt = candidate("str(<f>) == \"sqrt\"");
        negative.evaluate(inputs);
        sqrt.evaluate(inputs.subList(0, 2));

        assertThatThrownBy(() -> negative.and(sqrt)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> sqrt.holdsFor(inputs.get(3))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void equalityFollowsCanonicalText() {
        assertThat(candidate("int(<n>)<=-1")).isEqualTo(candidate("int(<n>) <= -1"));
        assertThat(candidate("int(<n>) <= -1")).isNotEqualTo(candidate("int(<n>) < -1"));
        assertThat(candidate("int(<n>) <= -1").size()).isLessThan(candidate("(int(<n>) <= -1 and str(<f>) == \"sqrt\")").size());
    }
}
