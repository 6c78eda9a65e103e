package nl.nfi.djlearn.constraint;

import nl.nfi.djlearn.grammar.Symbol;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class Constraints {

    private Constraints() {
    }

    public static Constraint and(final List<Constraint> operands) {
        return operands.size() == 1 ? operands.get(0) : new Constraint.Conjunction(operands);
    }

    public static Constraint or(final List<Constraint> operands) {
        return operands.size() == 1 ? operands.get(0) : new Constraint.Disjunction(operands);
    }

    /**
     * Negation of a single constraint: comparisons get their operator flipped, a negation is
     * unwrapped and anything else is wrapped in a {@link Constraint.Negation}.
     */
    public static Constraint negate(final Constraint constraint) {
        if (constraint instanceof Constraint.Comparison comparison) {
            return comparison.withOperator(comparison.operator().negate());
        }
        if (constraint instanceof Constraint.Negation negation) {
            return negation.inner();
        }
        return new Constraint.Negation(constraint);
    }

    /**
     * Number of constraint and term nodes.
     */
    public static int size(final Constraint constraint) {
        return constraint.accept(new ConstraintVisitor<Integer>() {
            @Override
            public Integer visitComparison(final Constraint.Comparison comparison) {
                return 1 + Terms.size(comparison.left()) + Terms.size(comparison.right());
            }

            @Override
            public Integer visitExpression(final Constraint.Expression expression) {
                return 1 + Terms.size(expression.body());
            }

            @Override
            public Integer visitConjunction(final Constraint.Conjunction conjunction) {
                return 1 + sum(conjunction.operands());
            }

            @Override
            public Integer visitDisjunction(final Constraint.Disjunction disjunction) {
                return 1 + sum(disjunction.operands());
            }

            @Override
            public Integer visitImplication(final Constraint.Implication implication) {
                return 1 + implication.antecedent().accept(this) + implication.consequent().accept(this);
            }

            @Override
            public Integer visitNegation(final Constraint.Negation negation) {
                return 1 + negation.inner().accept(this);
            }

            @Override
            public Integer visitForall(final Constraint.Forall forall) {
                return 2 + forall.body().accept(this);
            }

            @Override
            public Integer visitExists(final Constraint.Exists exists) {
                return 2 + exists.body().accept(this);
            }

            private int sum(final List<Constraint> operands) {
                int size = 0;
                for (final Constraint operand : operands) {
                    size += operand.accept(this);
                }
                return size;
            }
        });
    }

    /**
     * Every symbol searched for anywhere in the constraint.
     */
    public static Set<Symbol> symbols(final Constraint constraint) {
        final Set<Symbol> symbols = new LinkedHashSet<>();
        constraint.accept(new ConstraintVisitor<Void>() {
            @Override
            public Void visitComparison(final Constraint.Comparison comparison) {
                comparison.bindings().values().forEach(search -> symbols.add(search.symbol()));
                return null;
            }

            @Override
            public Void visitExpression(final Constraint.Expression expression) {
                expression.bindings().values().forEach(search -> symbols.add(search.symbol()));
                return null;
            }

            @Override
            public Void visitConjunction(final Constraint.Conjunction conjunction) {
                conjunction.operands().forEach(operand -> operand.accept(this));
                return null;
            }

            @Override
            public Void visitDisjunction(final Constraint.Disjunction disjunction) {
                disjunction.operands().forEach(operand -> operand.accept(this));
                return null;
            }

            @Override
            public Void visitImplication(final Constraint.Implication implication) {
                implication.antecedent().accept(this);
                return implication.consequent().accept(this);
            }

            @Override
            public Void visitNegation(final Constraint.Negation negation) {
                return negation.inner().accept(this);
            }

            @Override
            public Void visitForall(final Constraint.Forall forall) {
                symbols.add(forall.search().symbol());
                return forall.body().accept(this);
            }

            @Override
            public Void visitExists(final Constraint.Exists exists) {
                symbols.add(exists.search().symbol());
                return exists.body().accept(this);
            }
        });
        return symbols;
    }
}
