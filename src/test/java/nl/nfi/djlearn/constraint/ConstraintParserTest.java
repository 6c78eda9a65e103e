package nl.nfi.djlearn.constraint;

import nl.nfi.djlearn.grammar.Symbol;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConstraintParserTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "str(<f>) == \"sqrt\"",
            "int(<n>) <= -1",
            "int(<n>) < len(str(<f>))",
            "(str(<f>) == \"sqrt\" and int(<n>) <= -1)",
            "(int(<n>) < 0 or str(<f>) == \"cos\")",
            "(str(<f>) == \"sqrt\" -> int(<n>) >= 0)",
            "not (int(<n>) == 3)",
            "(forall <elem> in <digit>: int(<elem>) < 5)",
            "(exists <elem> in <n>: \"1\" in str(<elem>))",
            "(forall <p> in <pair>: (exists <v> in <p>.<value>: int(<v>) > 3))",
            "str(<pair>.<key>) == \"a\"",
            "abs(int(<n>)) > 3",
            "count(str(<start>), \",\") != 2",
            "<digit> in <n>",
            "str(<f>) == \"say \\\"hi\\\"\""
    })
    void printedTextParsesBackToItself(final String text) {
        assertThat(ConstraintPrinter.print(ConstraintParser.parse(text))).isEqualTo(text);
    }

    @Test
    void precedence() {
        final Constraint constraint = ConstraintParser.parse("int(<n>) > 1 and int(<n>) < 5 or str(<f>) == \"cos\" -> int(<n>) != 0");

        assertThat(constraint).isInstanceOf(Constraint.Implication.class);
        final Constraint.Implication implication = (Constraint.Implication) constraint;
        assertThat(implication.antecedent()).isInstanceOf(Constraint.Disjunction.class);
        assertThat(((Constraint.Disjunction) implication.antecedent()).operands().get(0)).isInstanceOf(Constraint.Conjunction.class);
        assertThat(ConstraintPrinter.print(constraint)).isEqualTo("(((int(<n>) > 1 and int(<n>) < 5) or str(<f>) == \"cos\") -> int(<n>) != 0)");
    }

    @Test
    void referencesBecomeBindings() {
        final Constraint.Comparison comparison = (Constraint.Comparison) ConstraintParser.parse("str(<pair>.<key>) == \"a\"");

        assertThat(comparison.bindings().values()).hasSize(2);
        assertThat(comparison.bindings().values()).anySatisfy(search -> {
            assertThat(search).isInstanceOf(Search.RuleSearch.class);
            assertThat(search.symbol()).isEqualTo(Symbol.nonTerminal("<pair>"));
        });
        assertThat(comparison.bindings().values()).anySatisfy(search -> {
            assertThat(search).isInstanceOf(Search.AttributeSearch.class);
            assertThat(search.symbol()).isEqualTo(Symbol.nonTerminal("<key>"));
        });
        assertThat(Constraints.symbols(comparison)).containsExactlyInAnyOrder(Symbol.nonTerminal("<pair>"), Symbol.nonTerminal("<key>"));
    }

    @Test
    void placeholdersAreOrdinarySymbols() {
        final Constraint template = ConstraintParser.parse("int(<NON_TERMINAL>) == <INTEGER>");

        assertThat(Constraints.symbols(template)).containsExactlyInAnyOrder(Placeholders.NONTERMINAL, Placeholders.INTEGER);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "str(<f>) ==", "str(<f>) == \"x", "(int(<n>) < 3", "int(<n>) ~ 3", "forall <x> in <a>.<b>.<c>: <x> == 1", "str(<a>, <b>) == 1"})
    void rejectsMalformedConstraints(final String text) {
        assertThatThrownBy(() -> ConstraintParser.parse(text)).isInstanceOf(IllegalArgumentException.class);
    }
}
