package nl.nfi.djlearn.constraint;

public interface ConstraintVisitor<R> {

    R visitComparison(Constraint.Comparison comparison);

    R visitExpression(Constraint.Expression expression);

    R visitConjunction(Constraint.Conjunction conjunction);

    R visitDisjunction(Constraint.Disjunction disjunction);

    R visitImplication(Constraint.Implication implication);

    R visitNegation(Constraint.Negation negation);

    R visitForall(Constraint.Forall forall);

    R visitExists(Constraint.Exists exists);
}
