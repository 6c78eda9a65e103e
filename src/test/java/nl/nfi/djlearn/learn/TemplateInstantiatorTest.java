package nl.nfi.djlearn.learn;

import nl.nfi.djlearn.constraint.Constraint;
import nl.nfi.djlearn.constraint.ConstraintParser;
import nl.nfi.djlearn.constraint.ConstraintPrinter;
import nl.nfi.djlearn.grammar.Grammar;
import nl.nfi.djlearn.grammar.Symbol;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collection;
import java.util.List;

import static nl.nfi.djlearn.Utils.CALCULATOR_ORACLE;
import static nl.nfi.djlearn.Utils.calculatorGrammar;
import static nl.nfi.djlearn.Utils.label;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TemplateInstantiatorTest {

    private static final Symbol F = Symbol.nonTerminal("<f>");
    private static final Symbol N = Symbol.nonTerminal("<n>");

    private Grammar grammar;
    private List<LabeledInput> failing;

    @BeforeEach
    void setUp() {
        grammar = calculatorGrammar();
        failing = label(grammar, CALCULATOR_ORACLE, "sqrt(-1)");
    }

    private TemplateInstantiator instantiator(final Collection<Symbol> relevant) {
        return TemplateInstantiator.create(relevant, grammar.reachability(), ValueMaps.extract(relevant, failing), failing);
    }

    private static List<String> texts(final List<Constraint> constraints) {
        return constraints.stream().map(ConstraintPrinter::print).toList();
    }

    @Test
    void expandsNonTerminalsAndStringValues() {
        final List<Constraint> constraints = instantiator(List.of(F, N)).instantiate(ConstraintParser.parse("str(<NON_TERMINAL>) == <STRING>"));

        assertThat(texts(constraints)).containsExactly("str(<f>) == \"sqrt\"", "str(<n>) == \"-1\"");
    }

    @Test
    void fallsBackToRuntimeValuesAndDropsUnresolvableBranches() {
        final TemplateInstantiator instantiator = instantiator(List.of(F, N));
        final List<Constraint> constraints = instantiator.instantiate(List.of(ConstraintParser.parse("int(<NON_TERMINAL>) <= <INTEGER>")));

        assertThat(texts(constraints)).containsExactly("int(<n>) <= -1");
        // int("sqrt") cannot be computed
        assertThat(instantiator.fallbackErrors()).isEqualTo(1);
    }

    @Test
    void singleNonTerminalGivesOneConstraintPerRelevantSymbol() {
        final List<Constraint> constraints = instantiator(List.of(F, N)).instantiate(ConstraintParser.parse("int(<NON_TERMINAL>) > 0"));

        assertThat(texts(constraints)).hasSize(2).containsExactly("int(<f>) > 0", "int(<n>) > 0");
    }

    @Test
    void valuePlaceholdersAreFilledIndependently() {
        final List<LabeledInput> inputs = label(grammar, CALCULATOR_ORACLE, "sqrt(-1)", "sqrt(-22)");
        final TemplateInstantiator instantiator = TemplateInstantiator.create(List.of(N), grammar.reachability(), ValueMaps.extract(List.of(N), inputs), inputs);

        final List<Constraint> constraints = instantiator.instantiate(ConstraintParser.parse("count(str(<NON_TERMINAL>), str(<INTEGER>)) <= abs(<INTEGER>)"));

        assertThat(texts(constraints)).hasSize(4).contains(
                "count(str(<n>), str(-22)) <= abs(-1)",
                "count(str(<n>), str(-1)) <= abs(-22)"
        );
    }

    @Test
    void combinesNonTerminalPairs() {
        final List<Constraint> constraints = instantiator(List.of(F, N)).instantiate(ConstraintParser.parse("int(<NON_TERMINAL>) < len(str(<NON_TERMINAL>))"));

        assertThat(texts(constraints)).containsExactlyInAnyOrder(
                "int(<f>) < len(str(<f>))",
                "int(<f>) < len(str(<n>))",
                "int(<n>) < len(str(<f>))",
                "int(<n>) < len(str(<n>))"
        );
    }

    @Test
    void quantifiedVariablesProvideValues() {
        final List<Constraint> constraints = instantiator(List.of(F, N)).instantiate(ConstraintParser.parse("exists <elem> in <NON_TERMINAL>: str(<elem>) == <STRING>"));

        assertThat(texts(constraints)).containsExactly(
                "(exists <elem> in <f>: str(<elem>) == \"sqrt\")",
                "(exists <elem> in <n>: str(<elem>) == \"-1\")"
        );
    }

    @Test
    void attributeSearchesFollowReachability() {
        final List<Constraint> constraints = instantiator(List.of(N)).instantiate(ConstraintParser.parse("forall <p> in <NON_TERMINAL>: int(<p>.<NON_TERMINAL>) >= 0"));

        assertThat(texts(constraints)).containsExactlyInAnyOrder(
                "(forall <p> in <n>: int(<p>.<sign>) >= 0)",
                "(forall <p> in <n>: int(<p>.<digits>) >= 0)",
                "(forall <p> in <n>: int(<p>.<digit>) >= 0)"
        );
    }

    @Test
    void conjunctionsAndNegationsAreInstantiatedPerOperand() {
        final TemplateInstantiator instantiator = instantiator(List.of(F, N));

        assertThat(instantiator.instantiate(ConstraintParser.parse("str(<NON_TERMINAL>) == <STRING> and int(<NON_TERMINAL>) <= <INTEGER>"))).hasSize(2);
        assertThat(texts(instantiator.instantiate(ConstraintParser.parse("not (int(<NON_TERMINAL>) == <INTEGER>)")))).containsExactly("not (int(<n>) == -1)");
    }

    @Test
    void concreteConstraintsPassThrough() {
        final List<Constraint> constraints = instantiator(List.of(F, N)).instantiate(ConstraintParser.parse("int(<n>) > 3"));

        assertThat(texts(constraints)).containsExactly("int(<n>) > 3");
    }

    @Test
    void noRelevantSymbolsMeansNoConstraints() {
        assertThat(instantiator(List.of()).instantiate(ConstraintParser.parse("str(<NON_TERMINAL>) == <STRING>"))).isEmpty();
    }

    @Test
    void rejectsDisjunctionTemplates() {
        assertThatThrownBy(() -> instantiator(List.of(F)).instantiate(ConstraintParser.parse("str(<NON_TERMINAL>) == <STRING> or int(<NON_TERMINAL>) > 0")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void defaultTemplatesInstantiate() {
        final List<Constraint> constraints = instantiator(List.of(F, N)).instantiate(TemplateRepository.defaults().all());

        assertThat(texts(constraints)).contains(
                "str(<f>) == \"sqrt\"",
                "int(<n>) <= -1",
                "int(<n>) == int(<n>)"
        );
    }
}
