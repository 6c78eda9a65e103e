package nl.nfi.djlearn.constraint;

import nl.nfi.djlearn.grammar.DerivationTree;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import static nl.nfi.djlearn.constraint.Values.asBoolean;
import static nl.nfi.djlearn.constraint.Values.asLong;
import static nl.nfi.djlearn.constraint.Values.asString;

/**
 * Checks constraints against derivation trees. A comparison or expression holds when it holds
 * for every combination of subtrees its bindings find; a binding without any match raises
 * {@link ConstraintEvaluationException}.
 */
public final class ConstraintEvaluator implements ConstraintVisitor<Boolean> {

    private final DerivationTree root;
    private final Map<String, DerivationTree> scope;

    private ConstraintEvaluator(final DerivationTree root, final Map<String, DerivationTree> scope) {
        this.root = root;
        this.scope = scope;
    }

    public static boolean check(final Constraint constraint, final DerivationTree tree) {
        return constraint.accept(new ConstraintEvaluator(tree, new HashMap<>()));
    }

    /**
     * Values of the term for every combination of the bindings' matches.
     */
    public static List<Object> evaluate(final Term term, final Map<String, Search> bindings, final DerivationTree tree, final Map<String, DerivationTree> scope) {
        final List<Object> values = new ArrayList<>();
        final ConstraintEvaluator evaluator = new ConstraintEvaluator(tree, new HashMap<>(scope));
        evaluator.forAll(new ArrayList<>(bindings.entrySet()), 0, new HashMap<>(scope), assignment -> {
            values.add(term.accept(new TermEvaluator(assignment)));
            return true;
        });
        return values;
    }

    @Override
    public Boolean visitComparison(final Constraint.Comparison comparison) {
        return forAll(new ArrayList<>(comparison.bindings().entrySet()), 0, new HashMap<>(scope), assignment -> {
            final TermEvaluator terms = new TermEvaluator(assignment);
            return Values.compare(comparison.left().accept(terms), comparison.operator(), comparison.right().accept(terms));
        });
    }

    @Override
    public Boolean visitExpression(final Constraint.Expression expression) {
        return forAll(new ArrayList<>(expression.bindings().entrySet()), 0, new HashMap<>(scope),
                assignment -> asBoolean(expression.body().accept(new TermEvaluator(assignment))));
    }

    @Override
    public Boolean visitConjunction(final Constraint.Conjunction conjunction) {
        for (final Constraint operand : conjunction.operands()) {
            if (!operand.accept(this)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public Boolean visitDisjunction(final Constraint.Disjunction disjunction) {
        for (final Constraint operand : disjunction.operands()) {
            if (operand.accept(this)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Boolean visitImplication(final Constraint.Implication implication) {
        return !implication.antecedent().accept(this) || implication.consequent().accept(this);
    }

    @Override
    public Boolean visitNegation(final Constraint.Negation negation) {
        return !negation.inner().accept(this);
    }

    @Override
    public Boolean visitForall(final Constraint.Forall forall) {
        for (final DerivationTree match : find(forall.search(), scope)) {
            if (!withBound(forall.variable(), match, forall.body())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public Boolean visitExists(final Constraint.Exists exists) {
        for (final DerivationTree match : find(exists.search(), scope)) {
            if (withBound(exists.variable(), match, exists.body())) {
                return true;
            }
        }
        return false;
    }

    private boolean withBound(final String variable, final DerivationTree match, final Constraint body) {
        final DerivationTree previous = scope.put(variable, match);
        try {
            return body.accept(this);
        } finally {
            if (previous == null) {
                scope.remove(variable);
            } else {
                scope.put(variable, previous);
            }
        }
    }

    private boolean forAll(final List<Map.Entry<String, Search>> bindings, final int index, final Map<String, DerivationTree> assignment, final Predicate<Map<String, DerivationTree>> test) {
        if (index == bindings.size()) {
            return test.test(assignment);
        }
        final Map.Entry<String, Search> binding = bindings.get(index);
        final List<DerivationTree> matches = find(binding.getValue(), assignment);
        if (matches.isEmpty()) {
            throw new ConstraintEvaluationException("No subtree found for %s".formatted(binding.getValue().symbol()));
        }
        for (final DerivationTree match : matches) {
            assignment.put(binding.getKey(), match);
            if (!forAll(bindings, index + 1, assignment, test)) {
                assignment.remove(binding.getKey());
                return false;
            }
        }
        assignment.remove(binding.getKey());
        return true;
    }

    private List<DerivationTree> find(final Search search, final Map<String, DerivationTree> assignment) {
        if (search instanceof Search.AttributeSearch attribute) {
            final DerivationTree base = assignment.get(attribute.base());
            if (base == null) {
                throw new ConstraintEvaluationException("Unbound attribute base: %s".formatted(attribute.base()));
            }
            return base.findDescendants(attribute.symbol());
        }
        return root.findAll(search.symbol());
    }

    private static final class TermEvaluator implements TermVisitor<Object> {

        private final Map<String, DerivationTree> assignment;

        private TermEvaluator(final Map<String, DerivationTree> assignment) {
            this.assignment = assignment;
        }

        @Override
        public Object visitRef(final Term.Ref ref) {
            final DerivationTree tree = assignment.get(ref.name());
            if (tree == null) {
                throw new ConstraintEvaluationException("Unbound reference: %s".formatted(ref.name()));
            }
            return tree;
        }

        @Override
        public Object visitStr(final Term.Str str) {
            return asString(str.operand().accept(this));
        }

        @Override
        public Object visitInt(final Term.Int integer) {
            return asLong(integer.operand().accept(this));
        }

        @Override
        public Object visitLen(final Term.Len len) {
            return (long) asString(len.operand().accept(this)).length();
        }

        @Override
        public Object visitStringLiteral(final Term.StringLiteral literal) {
            return literal.value();
        }

        @Override
        public Object visitIntLiteral(final Term.IntLiteral literal) {
            return literal.value();
        }

        @Override
        public Object visitContains(final Term.Contains contains) {
            final Object needle = contains.needle().accept(this);
            final Object haystack = contains.haystack().accept(this);
            if (needle instanceof DerivationTree subtree && haystack instanceof DerivationTree tree) {
                return tree.contains(subtree);
            }
            return asString(haystack).contains(asString(needle));
        }

        @Override
        public Object visitCall(final Term.Call call) {
            final List<Object> arguments = new ArrayList<>();
            for (final Term argument : call.arguments()) {
                arguments.add(argument.accept(this));
            }
            return Functions.apply(call.function(), arguments);
        }
    }
}
