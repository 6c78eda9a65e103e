package nl.nfi.djlearn.refine.generate;

import nl.nfi.djlearn.constraint.ConstraintParser;
import nl.nfi.djlearn.grammar.DerivationTree;
import nl.nfi.djlearn.grammar.Grammar;
import nl.nfi.djlearn.learn.Candidate;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static nl.nfi.djlearn.Utils.calculatorGrammar;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnginesTest {

    private static final Grammar GRAMMAR = calculatorGrammar();

    private static final List<Candidate> CANDIDATES = List.of(
            Candidate.of(ConstraintParser.parse("str(<f>) == \"sqrt\"")),
            Candidate.of(ConstraintParser.parse("str(<f>) == \"cos\"")),
            Candidate.of(ConstraintParser.parse("int(<n>) < 0"))
    );

    // one input per candidate, named after it
    private static final InputGenerator ECHO = (candidate, random) -> {
        final String function = candidate.text().contains("cos") ? "cos" : "sqrt";
        final String number = candidate.text().contains("<n>") ? "-1" : "1";
        return Set.of(GRAMMAR.parse("%s(%s)".formatted(function, number)));
    };

    @Nested
    class Single {

        @Test
        void generatesForEveryCandidate() {
            final Set<DerivationTree> generated = SingleEngine.create().random(new Random(0)).generate(ECHO, CANDIDATES);

            assertThat(generated).extracting(DerivationTree::toString).containsExactly("sqrt(1)", "cos(1)", "sqrt(-1)");
        }
    }

    @Nested
    class Parallel {

        @Test
        void collectsInputsOfAllWorkers() {
            final Set<String> threads = ConcurrentHashMap.newKeySet();
            final InputGenerator generator = (candidate, random) -> {
                threads.add(Thread.currentThread().getName());
                return ECHO.generate(candidate, random);
            };

            final Set<DerivationTree> generated = ParallelEngine.create().maxWorkers(2).seed(7).generate(generator, CANDIDATES);

            assertThat(generated).extracting(DerivationTree::toString).containsExactlyInAnyOrder("sqrt(1)", "cos(1)", "sqrt(-1)");
            assertThat(threads).isNotEmpty().hasSizeLessThanOrEqualTo(2);
        }

        @Test
        void handsEveryWorkerItsOwnSeededRandom() {
            final InputGenerator generator = (candidate, random) -> Set.of(GRAMMAR.fuzz(random));

            final Set<DerivationTree> first = ParallelEngine.create().maxWorkers(1).seed(11).generate(generator, CANDIDATES);
            final Set<DerivationTree> second = ParallelEngine.create().maxWorkers(1).seed(11).generate(generator, CANDIDATES);

            assertThat(first).isEqualTo(second);
        }

        @Test
        void survivesFailingGenerator() {
            final InputGenerator generator = (candidate, random) -> {
                if (candidate.text().contains("cos")) {
                    throw new IllegalStateException("generator failure");
                }
                return ECHO.generate(candidate, random);
            };

            final Set<DerivationTree> generated = ParallelEngine.create().maxWorkers(1).generate(generator, CANDIDATES);

            assertThat(generated).extracting(DerivationTree::toString).contains("sqrt(1)").doesNotContain("cos(1)");
        }

        @Test
        void keepsWorkingAfterFailingCandidate() {
            final InputGenerator generator = (candidate, random) -> {
                if (candidate.text().contains("sqrt")) {
                    throw new IllegalStateException("generator failure");
                }
                return ECHO.generate(candidate, random);
            };

            final Set<DerivationTree> generated = ParallelEngine.create().maxWorkers(1).generate(generator, CANDIDATES);

            assertThat(generated).extracting(DerivationTree::toString).containsExactlyInAnyOrder("cos(1)", "sqrt(-1)");
        }

        @Test
        @Timeout(20)
        void returnsPartialResultsWhenBudgetRunsOut() {
            final InputGenerator generator = (candidate, random) -> {
                if (candidate.text().contains("<n>")) {
                    try {
                        Thread.sleep(60_000);
                    } catch (final InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return Set.of();
                    }
                }
                return ECHO.generate(candidate, random);
            };

            final Set<DerivationTree> generated = ParallelEngine.create()
                    .maxWorkers(3)
                    .budget(Duration.ofMillis(500))
                    .generate(generator, CANDIDATES);

            assertThat(generated).extracting(DerivationTree::toString).containsExactlyInAnyOrder("sqrt(1)", "cos(1)");
        }

        @Test
        void handlesEmptyWorkAndRejectsInvalidPool() {
            assertThat(ParallelEngine.create().generate(ECHO, List.of())).isEmpty();
            assertThatThrownBy(() -> ParallelEngine.create().maxWorkers(0)).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
