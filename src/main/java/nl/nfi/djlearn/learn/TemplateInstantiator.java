package nl.nfi.djlearn.learn;

import nl.nfi.djlearn.constraint.Constraint;
import nl.nfi.djlearn.constraint.ConstraintEvaluationException;
import nl.nfi.djlearn.constraint.ConstraintEvaluator;
import nl.nfi.djlearn.constraint.ConstraintVisitor;
import nl.nfi.djlearn.constraint.Placeholders;
import nl.nfi.djlearn.constraint.Search;
import nl.nfi.djlearn.constraint.Term;
import nl.nfi.djlearn.constraint.Terms;
import nl.nfi.djlearn.grammar.DerivationTree;
import nl.nfi.djlearn.grammar.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Expands templates into concrete constraints. Placeholders that cannot be resolved drop the
 * branch they occur in.
 */
public final class TemplateInstantiator {

    private static final Logger LOG = LoggerFactory.getLogger(TemplateInstantiator.class);

    private static final Pattern INTEGER = Pattern.compile("-?\\d{1,18}");

    private final List<Symbol> relevantSymbols;
    private final Map<Symbol, Set<Symbol>> reachability;
    private final ValueMaps values;
    private final Collection<LabeledInput> inputs;

    private int fallbackErrors;

    private TemplateInstantiator(final List<Symbol> relevantSymbols, final Map<Symbol, Set<Symbol>> reachability, final ValueMaps values, final Collection<LabeledInput> inputs) {
        this.relevantSymbols = relevantSymbols;
        this.reachability = reachability;
        this.values = values;
        this.inputs = inputs;
    }

    public static TemplateInstantiator create(final Collection<Symbol> relevantSymbols, final Map<Symbol, Set<Symbol>> reachability, final ValueMaps values, final Collection<LabeledInput> inputs) {
        return new TemplateInstantiator(List.copyOf(new LinkedHashSet<>(relevantSymbols)), reachability, values, List.copyOf(inputs));
    }

    public List<Constraint> instantiate(final Collection<Constraint> templates) {
        fallbackErrors = 0;
        final List<Constraint> constraints = new ArrayList<>();
        for (final Constraint template : templates) {
            constraints.addAll(instantiate(template));
        }
        if (fallbackErrors > 0) {
            LOG.debug("Ignored {} evaluation errors while collecting runtime values", fallbackErrors);
        }
        return constraints;
    }

    public List<Constraint> instantiate(final Constraint template) {
        return template.accept(new Instantiation());
    }

    int fallbackErrors() {
        return fallbackErrors;
    }

    private final class Instantiation implements ConstraintVisitor<List<Constraint>> {

        private final Map<String, Symbol> boundSymbols = new HashMap<>();

        @Override
        public List<Constraint> visitComparison(final Constraint.Comparison comparison) {
            return instantiateAtom(comparison.bindings(), List.of(comparison.left(), comparison.right()), (bindings, substitutions) ->
                    new Constraint.Comparison(
                            Terms.substitute(comparison.left(), substitutions),
                            comparison.operator(),
                            Terms.substitute(comparison.right(), substitutions),
                            bindings
                    ));
        }

        @Override
        public List<Constraint> visitExpression(final Constraint.Expression expression) {
            final List<Term> operands = expression.body() instanceof Term.Contains contains
                    ? List.of(contains.needle(), contains.haystack())
                    : List.of(expression.body());
            return instantiateAtom(expression.bindings(), operands, (bindings, substitutions) ->
                    new Constraint.Expression(Terms.substitute(expression.body(), substitutions), bindings));
        }

        @Override
        public List<Constraint> visitConjunction(final Constraint.Conjunction conjunction) {
            return product(conjunction.operands(), Constraint.Conjunction::new);
        }

        @Override
        public List<Constraint> visitDisjunction(final Constraint.Disjunction disjunction) {
            throw new UnsupportedOperationException("Disjunction templates are not supported: %s".formatted(disjunction));
        }

        @Override
        public List<Constraint> visitImplication(final Constraint.Implication implication) {
            return product(List.of(implication.antecedent(), implication.consequent()),
                    operands -> new Constraint.Implication(operands.get(0), operands.get(1)));
        }

        @Override
        public List<Constraint> visitNegation(final Constraint.Negation negation) {
            final List<Constraint> negated = new ArrayList<>();
            for (final Constraint inner : negation.inner().accept(this)) {
                negated.add(new Constraint.Negation(inner));
            }
            return negated;
        }

        @Override
        public List<Constraint> visitForall(final Constraint.Forall forall) {
            return quantified(forall.variable(), forall.search(), forall.body(),
                    (search, body) -> new Constraint.Forall(forall.variable(), search, body));
        }

        @Override
        public List<Constraint> visitExists(final Constraint.Exists exists) {
            return quantified(exists.variable(), exists.search(), exists.body(),
                    (search, body) -> new Constraint.Exists(exists.variable(), search, body));
        }

        private List<Constraint> quantified(final String variable, final Search search, final Constraint body, final BiFunction<Search, Constraint, Constraint> wrap) {
            final List<Constraint> instantiated = new ArrayList<>();
            for (final Search option : searchOptions(search, Map.of())) {
                final Symbol previous = boundSymbols.put(variable, option.symbol());
                try {
                    for (final Constraint instantiatedBody : body.accept(this)) {
                        instantiated.add(wrap.apply(option, instantiatedBody));
                    }
                } finally {
                    if (previous == null) {
                        boundSymbols.remove(variable);
                    } else {
                        boundSymbols.put(variable, previous);
                    }
                }
            }
            return instantiated;
        }

        private List<Constraint> product(final List<Constraint> operands, final Function<List<Constraint>, Constraint> wrap) {
            List<List<Constraint>> combinations = List.of(List.of());
            for (final Constraint operand : operands) {
                final List<Constraint> options = operand.accept(this);
                final List<List<Constraint>> extended = new ArrayList<>();
                for (final List<Constraint> combination : combinations) {
                    for (final Constraint option : options) {
                        final List<Constraint> next = new ArrayList<>(combination);
                        next.add(option);
                        extended.add(next);
                    }
                }
                combinations = extended;
            }
            final List<Constraint> wrapped = new ArrayList<>();
            for (final List<Constraint> combination : combinations) {
                wrapped.add(wrap.apply(combination));
            }
            return wrapped;
        }

        private List<Constraint> instantiateAtom(final Map<String, Search> bindings, final List<Term> operands, final BiFunction<Map<String, Search>, Map<String, Term>, Constraint> rebuild) {
            final List<Constraint> instantiated = new ArrayList<>();
            for (final Map<String, Search> concrete : expandNonTerminals(bindings)) {
                for (final Map<String, Term> substitutions : valueSubstitutions(concrete, operands)) {
                    final Map<String, Search> remaining = new LinkedHashMap<>(concrete);
                    remaining.keySet().removeAll(substitutions.keySet());
                    instantiated.add(rebuild.apply(remaining, substitutions));
                }
            }
            return instantiated;
        }

        private List<Map<String, Search>> expandNonTerminals(final Map<String, Search> bindings) {
            List<Map<String, Search>> expanded = List.of(new LinkedHashMap<>());
            for (final Map.Entry<String, Search> binding : bindings.entrySet()) {
                final List<Map<String, Search>> next = new ArrayList<>();
                for (final Map<String, Search> partial : expanded) {
                    for (final Search option : searchOptions(binding.getValue(), partial)) {
                        final Map<String, Search> extended = new LinkedHashMap<>(partial);
                        extended.put(binding.getKey(), option);
                        next.add(extended);
                    }
                }
                expanded = next;
            }
            return expanded;
        }

        private List<Search> searchOptions(final Search search, final Map<String, Search> partial) {
            if (!Placeholders.NONTERMINAL.equals(search.symbol())) {
                return List.of(search);
            }
            final Collection<Symbol> candidates;
            if (search instanceof Search.AttributeSearch attribute) {
                final Symbol base = baseSymbol(attribute.base(), partial);
                candidates = base == null ? List.of() : reachability.getOrDefault(base, Set.of());
            } else {
                candidates = relevantSymbols;
            }
            final List<Search> options = new ArrayList<>();
            for (final Symbol candidate : candidates) {
                options.add(search.withSymbol(candidate));
            }
            return options;
        }

        private Symbol baseSymbol(final String base, final Map<String, Search> partial) {
            final Search search = partial.get(base);
            return search != null ? search.symbol() : boundSymbols.get(base);
        }

        private List<Map<String, Term>> valueSubstitutions(final Map<String, Search> bindings, final List<Term> operands) {
            List<Map<String, Term>> substitutions = List.of(Map.of());
            for (final Symbol kind : List.of(Placeholders.STRING, Placeholders.INTEGER)) {
                final List<String> placeholders = new ArrayList<>();
                bindings.forEach((name, search) -> {
                    if (search instanceof Search.RuleSearch && kind.equals(search.symbol())) {
                        placeholders.add(name);
                    }
                });
                if (placeholders.isEmpty()) {
                    continue;
                }

                final Set<Term> literals = literals(kind, bindings, operands);
                // each placeholder of this kind takes every literal independently
                for (final String name : placeholders) {
                    final List<Map<String, Term>> next = new ArrayList<>();
                    for (final Map<String, Term> partial : substitutions) {
                        for (final Term literal : literals) {
                            final Map<String, Term> extended = new HashMap<>(partial);
                            extended.put(name, literal);
                            next.add(extended);
                        }
                    }
                    substitutions = next;
                }
            }
            return substitutions;
        }

        private Set<Term> literals(final Symbol kind, final Map<String, Search> bindings, final List<Term> operands) {
            final Set<Term> literals = new LinkedHashSet<>();
            for (final Symbol owner : owners(bindings, operands)) {
                if (Placeholders.STRING.equals(kind)) {
                    values.strings(owner).forEach(value -> literals.add(new Term.StringLiteral(value)));
                } else {
                    values.filteredIntegers(owner).forEach(value -> literals.add(new Term.IntLiteral(value)));
                }
            }
            if (literals.isEmpty()) {
                for (final Object value : runtimeValues(bindings, operands)) {
                    final String text = value.toString();
                    if (Placeholders.STRING.equals(kind)) {
                        literals.add(new Term.StringLiteral(text));
                    } else if (INTEGER.matcher(text).matches()) {
                        literals.add(new Term.IntLiteral(Long.parseLong(text)));
                    }
                }
            }
            return literals;
        }

        private Set<Symbol> owners(final Map<String, Search> bindings, final List<Term> operands) {
            final Set<Symbol> owners = new LinkedHashSet<>();
            for (final Search search : bindings.values()) {
                if (!Placeholders.isPlaceholder(search.symbol())) {
                    owners.add(search.symbol());
                }
            }
            for (final String variable : scopeVariables(bindings, operands)) {
                owners.add(boundSymbols.get(variable));
            }
            return owners;
        }

        private Set<String> scopeVariables(final Map<String, Search> bindings, final List<Term> operands) {
            final Set<String> variables = new LinkedHashSet<>();
            for (final Term operand : operands) {
                variables.addAll(Terms.references(operand));
            }
            for (final Search search : bindings.values()) {
                if (search instanceof Search.AttributeSearch attribute) {
                    variables.add(attribute.base());
                }
            }
            variables.removeAll(bindings.keySet());
            variables.retainAll(boundSymbols.keySet());
            return variables;
        }

        /**
         * Evaluates the placeholder free operands against the inputs, binding quantified
         * variables to every subtree of their symbol.
         */
        private Set<Object> runtimeValues(final Map<String, Search> bindings, final List<Term> operands) {
            final Map<String, Search> concrete = new LinkedHashMap<>();
            bindings.forEach((name, search) -> {
                if (!Placeholders.isValue(search.symbol())) {
                    concrete.put(name, search);
                }
            });
            final List<Term> evaluable = new ArrayList<>();
            for (final Term operand : operands) {
                final Set<String> references = Terms.references(operand);
                if (references.stream().noneMatch(name -> bindings.containsKey(name) && !concrete.containsKey(name))) {
                    evaluable.add(operand);
                }
            }
            final List<String> variables = new ArrayList<>(scopeVariables(concrete, evaluable));

            final Set<Object> collected = new LinkedHashSet<>();
            for (final LabeledInput input : inputs) {
                for (final Map<String, DerivationTree> scope : scopes(input.tree(), variables, 0, new HashMap<>())) {
                    for (final Term operand : evaluable) {
                        try {
                            for (final Object value : ConstraintEvaluator.evaluate(operand, concrete, input.tree(), scope)) {
                                if (!(value instanceof Boolean)) {
                                    collected.add(value);
                                }
                            }
                        } catch (final ConstraintEvaluationException e) {
                            fallbackErrors++;
                            LOG.debug("Could not evaluate {} on input {}: {}", operand, input.tree(), e.getMessage());
                        }
                    }
                }
            }
            return collected;
        }

        private List<Map<String, DerivationTree>> scopes(final DerivationTree tree, final List<String> variables, final int index, final Map<String, DerivationTree> partial) {
            if (index == variables.size()) {
                return List.of(new HashMap<>(partial));
            }
            final List<Map<String, DerivationTree>> scopes = new ArrayList<>();
            final String variable = variables.get(index);
            for (final DerivationTree subtree : tree.findAll(boundSymbols.get(variable))) {
                partial.put(variable, subtree);
                scopes.addAll(scopes(tree, variables, index + 1, partial));
            }
            partial.remove(variable);
            return scopes;
        }
    }
}
