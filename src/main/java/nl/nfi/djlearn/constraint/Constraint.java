package nl.nfi.djlearn.constraint;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Boolean constraint over a derivation tree.
 */
public sealed interface Constraint permits Constraint.Comparison, Constraint.Expression, Constraint.Conjunction, Constraint.Disjunction,
        Constraint.Implication, Constraint.Negation, Constraint.Forall, Constraint.Exists {

    <R> R accept(ConstraintVisitor<R> visitor);

    record Comparison(Term left, ComparisonOperator operator, Term right, Map<String, Search> bindings) implements Constraint {

        public Comparison {
            requireNonNull(left);
            requireNonNull(operator);
            requireNonNull(right);
            bindings = freeze(bindings);
        }

        public Comparison withOperator(final ComparisonOperator operator) {
            return new Comparison(left, operator, right, bindings);
        }

        @Override
        public <R> R accept(final ConstraintVisitor<R> visitor) {
            return visitor.visitComparison(this);
        }
    }

    /**
     * A boolean valued term, such as a containment test.
     */
    record Expression(Term body, Map<String, Search> bindings) implements Constraint {

        public Expression {
            requireNonNull(body);
            bindings = freeze(bindings);
        }

        @Override
        public <R> R accept(final ConstraintVisitor<R> visitor) {
            return visitor.visitExpression(this);
        }
    }

    record Conjunction(List<Constraint> operands) implements Constraint {

        public Conjunction {
            operands = List.copyOf(operands);
            if (operands.size() < 2) {
                throw new IllegalArgumentException("Conjunction needs at least two operands, got %d".formatted(operands.size()));
            }
        }

        @Override
        public <R> R accept(final ConstraintVisitor<R> visitor) {
            return visitor.visitConjunction(this);
        }
    }

    record Disjunction(List<Constraint> operands) implements Constraint {

        public Disjunction {
            operands = List.copyOf(operands);
            if (operands.size() < 2) {
                throw new IllegalArgumentException("Disjunction needs at least two operands, got %d".formatted(operands.size()));
            }
        }

        @Override
        public <R> R accept(final ConstraintVisitor<R> visitor) {
            return visitor.visitDisjunction(this);
        }
    }

    record Implication(Constraint antecedent, Constraint consequent) implements Constraint {

        public Implication {
            requireNonNull(antecedent);
            requireNonNull(consequent);
        }

        @Override
        public <R> R accept(final ConstraintVisitor<R> visitor) {
            return visitor.visitImplication(this);
        }
    }

    record Negation(Constraint inner) implements Constraint {

        public Negation {
            requireNonNull(inner);
        }

        @Override
        public <R> R accept(final ConstraintVisitor<R> visitor) {
            return visitor.visitNegation(this);
        }
    }

    record Forall(String variable, Search search, Constraint body) implements Constraint {

        public Forall {
            requireNonNull(variable);
            requireNonNull(search);
            requireNonNull(body);
        }

        @Override
        public <R> R accept(final ConstraintVisitor<R> visitor) {
            return visitor.visitForall(this);
        }
    }

    record Exists(String variable, Search search, Constraint body) implements Constraint {

        public Exists {
            requireNonNull(variable);
            requireNonNull(search);
            requireNonNull(body);
        }

        @Override
        public <R> R accept(final ConstraintVisitor<R> visitor) {
            return visitor.visitExists(this);
        }
    }

    private static Map<String, Search> freeze(final Map<String, Search> bindings) {
        // keeps insertion order, attribute searches may refer to earlier bindings
        return Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    }
}
