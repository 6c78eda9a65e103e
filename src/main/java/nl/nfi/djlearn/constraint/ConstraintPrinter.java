package nl.nfi.djlearn.constraint;

import nl.nfi.djlearn.grammar.Symbol;

import java.util.List;
import java.util.Map;

/**
 * Renders constraints to their canonical text. Placeholder names do not occur in the
 * output, so structurally equal constraints render identically.
 */
public final class ConstraintPrinter implements ConstraintVisitor<String> {

    private static final ConstraintPrinter INSTANCE = new ConstraintPrinter();

    private ConstraintPrinter() {
    }

    public static String print(final Constraint constraint) {
        return constraint.accept(INSTANCE);
    }

    public static String print(final Term term, final Map<String, Search> bindings) {
        return term.accept(new TermPrinter(bindings));
    }

    @Override
    public String visitComparison(final Constraint.Comparison comparison) {
        final TermPrinter terms = new TermPrinter(comparison.bindings());
        return "%s %s %s".formatted(comparison.left().accept(terms), comparison.operator().text(), comparison.right().accept(terms));
    }

    @Override
    public String visitExpression(final Constraint.Expression expression) {
        return expression.body().accept(new TermPrinter(expression.bindings()));
    }

    @Override
    public String visitConjunction(final Constraint.Conjunction conjunction) {
        return join(conjunction.operands(), " and ");
    }

    @Override
    public String visitDisjunction(final Constraint.Disjunction disjunction) {
        return join(disjunction.operands(), " or ");
    }

    @Override
    public String visitImplication(final Constraint.Implication implication) {
        return "(%s -> %s)".formatted(implication.antecedent().accept(this), implication.consequent().accept(this));
    }

    @Override
    public String visitNegation(final Constraint.Negation negation) {
        return "not (%s)".formatted(negation.inner().accept(this));
    }

    @Override
    public String visitForall(final Constraint.Forall forall) {
        return "(forall <%s> in %s: %s)".formatted(forall.variable(), search(forall.search(), Map.of()), forall.body().accept(this));
    }

    @Override
    public String visitExists(final Constraint.Exists exists) {
        return "(exists <%s> in %s: %s)".formatted(exists.variable(), search(exists.search(), Map.of()), exists.body().accept(this));
    }

    private String join(final List<Constraint> operands, final String separator) {
        final StringBuilder builder = new StringBuilder("(");
        for (int i = 0; i < operands.size(); i++) {
            if (i > 0) {
                builder.append(separator);
            }
            builder.append(operands.get(i).accept(this));
        }
        return builder.append(')').toString();
    }

    private static String search(final Search search, final Map<String, Search> bindings) {
        if (search instanceof Search.AttributeSearch attribute) {
            final Search base = bindings.get(attribute.base());
            final String prefix = base == null ? "<%s>".formatted(attribute.base()) : search(base, bindings);
            return prefix + "." + attribute.symbol().name();
        }
        return search.symbol().name();
    }

    private static final class TermPrinter implements TermVisitor<String> {

        private final Map<String, Search> bindings;

        private TermPrinter(final Map<String, Search> bindings) {
            this.bindings = bindings;
        }

        @Override
        public String visitRef(final Term.Ref ref) {
            final Search search = bindings.get(ref.name());
            return search == null ? "<%s>".formatted(ref.name()) : search(search, bindings);
        }

        @Override
        public String visitStr(final Term.Str str) {
            return "str(%s)".formatted(str.operand().accept(this));
        }

        @Override
        public String visitInt(final Term.Int integer) {
            return "int(%s)".formatted(integer.operand().accept(this));
        }

        @Override
        public String visitLen(final Term.Len len) {
            return "len(%s)".formatted(len.operand().accept(this));
        }

        @Override
        public String visitStringLiteral(final Term.StringLiteral literal) {
            return Symbol.quote(literal.value());
        }

        @Override
        public String visitIntLiteral(final Term.IntLiteral literal) {
            return Long.toString(literal.value());
        }

        @Override
        public String visitContains(final Term.Contains contains) {
            return "%s in %s".formatted(contains.needle().accept(this), contains.haystack().accept(this));
        }

        @Override
        public String visitCall(final Term.Call call) {
            final StringBuilder builder = new StringBuilder(call.function()).append('(');
            for (int i = 0; i < call.arguments().size(); i++) {
                if (i > 0) {
                    builder.append(", ");
                }
                builder.append(call.arguments().get(i).accept(this));
            }
            return builder.append(')').toString();
        }
    }
}
