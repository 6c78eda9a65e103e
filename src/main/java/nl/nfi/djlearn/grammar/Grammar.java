package nl.nfi.djlearn.grammar;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

import static java.util.Collections.unmodifiableMap;
import static java.util.Collections.unmodifiableSet;

/**
 * Context free grammar over {@link Symbol}s. Instances are immutable and may be
 * shared between threads.
 */
public final class Grammar {

    public static final Symbol START = Symbol.nonTerminal("<start>");

    private static final int DEFAULT_MAX_DEPTH = 16;

    private final Map<Symbol, List<List<Symbol>>> rules;
    private final Map<Symbol, Integer> minDepths;
    private final Map<Symbol, Set<Symbol>> reachability;
    private final int maxDepth;

    private Grammar(final Map<Symbol, List<List<Symbol>>> rules, final Map<Symbol, Integer> minDepths, final Map<Symbol, Set<Symbol>> reachability, final int maxDepth) {
        this.rules = rules;
        this.minDepths = minDepths;
        this.reachability = reachability;
        this.maxDepth = maxDepth;
    }

    public static Grammar of(final Map<Symbol, List<List<Symbol>>> rules) {
        if (!rules.containsKey(START)) {
            throw new IllegalArgumentException("Grammar has no rule for %s".formatted(START));
        }
        final Map<Symbol, List<List<Symbol>>> copy = new LinkedHashMap<>();
        rules.forEach((symbol, alternatives) -> {
            final List<List<Symbol>> alternativesCopy = new ArrayList<>();
            for (final List<Symbol> alternative : alternatives) {
                for (final Symbol element : alternative) {
                    if (element.isNonTerminal() && !rules.containsKey(element)) {
                        throw new IllegalArgumentException("Rule for %s references undefined symbol %s".formatted(symbol, element));
                    }
                }
                alternativesCopy.add(List.copyOf(alternative));
            }
            copy.put(symbol, List.copyOf(alternativesCopy));
        });
        final Map<Symbol, List<List<Symbol>>> frozen = unmodifiableMap(copy);
        return new Grammar(frozen, computeMinDepths(frozen), computeReachability(frozen), DEFAULT_MAX_DEPTH);
    }

    public Grammar maxDepth(final int maxDepth) {
        return new Grammar(rules, minDepths, reachability, maxDepth);
    }

    public Set<Symbol> nonTerminals() {
        return rules.keySet();
    }

    public List<List<Symbol>> alternatives(final Symbol symbol) {
        final List<List<Symbol>> alternatives = rules.get(symbol);
        if (alternatives == null) {
            throw new IllegalArgumentException("Grammar does not define symbol: %s".formatted(symbol));
        }
        return alternatives;
    }

    public boolean defines(final Symbol symbol) {
        return rules.containsKey(symbol);
    }

    /**
     * Maps every non-terminal to the non-terminals that can occur strictly below it.
     */
    public Map<Symbol, Set<Symbol>> reachability() {
        return reachability;
    }

    public DerivationTree parse(final String text) {
        return tryParse(text).orElseThrow(() -> new IllegalArgumentException("Input cannot be parsed by grammar: %s".formatted(text)));
    }

    public Optional<DerivationTree> tryParse(final String text) {
        return Parser.forGrammar(this).parse(START, text);
    }

    public DerivationTree fuzz(final Random random) {
        return fuzz(START, random);
    }

    public DerivationTree fuzz(final Symbol symbol, final Random random) {
        return expand(symbol, 0, random);
    }

    private DerivationTree expand(final Symbol symbol, final int depth, final Random random) {
        if (symbol.terminal()) {
            return DerivationTree.leaf(symbol);
        }
        final List<List<Symbol>> alternatives = alternatives(symbol);
        final List<Symbol> chosen;
        if (depth < maxDepth) {
            chosen = alternatives.get(random.nextInt(alternatives.size()));
        } else {
            // past the depth limit only the cheapest expansions are allowed
            final List<List<Symbol>> cheapest = new ArrayList<>();
            int best = Integer.MAX_VALUE;
            for (final List<Symbol> alternative : alternatives) {
                final int cost = cost(alternative, minDepths);
                if (cost < best) {
                    best = cost;
                    cheapest.clear();
                }
                if (cost == best) {
                    cheapest.add(alternative);
                }
            }
            chosen = cheapest.get(random.nextInt(cheapest.size()));
        }
        final List<DerivationTree> children = new ArrayList<>(chosen.size());
        for (final Symbol element : chosen) {
            children.add(expand(element, depth + 1, random));
        }
        return DerivationTree.node(symbol, children);
    }

    private static int cost(final List<Symbol> alternative, final Map<Symbol, Integer> depths) {
        int cost = 1;
        for (final Symbol element : alternative) {
            if (element.isNonTerminal()) {
                final Integer depth = depths.get(element);
                if (depth == null) {
                    return Integer.MAX_VALUE;
                }
                cost = Math.max(cost, depth + 1);
            }
        }
        return cost;
    }

    private static Map<Symbol, Integer> computeMinDepths(final Map<Symbol, List<List<Symbol>>> rules) {
        final Map<Symbol, Integer> depths = new HashMap<>();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (final Map.Entry<Symbol, List<List<Symbol>>> rule : rules.entrySet()) {
                for (final List<Symbol> alternative : rule.getValue()) {
                    final int cost = cost(alternative, depths);
                    if (cost == Integer.MAX_VALUE) {
                        continue;
                    }
                    final Integer current = depths.get(rule.getKey());
                    if (current == null || cost < current) {
                        depths.put(rule.getKey(), cost);
                        changed = true;
                    }
                }
            }
        }
        for (final Symbol symbol : rules.keySet()) {
            if (!depths.containsKey(symbol)) {
                throw new IllegalArgumentException("Symbol cannot derive a finite string: %s".formatted(symbol));
            }
        }
        return unmodifiableMap(depths);
    }

    private static Map<Symbol, Set<Symbol>> computeReachability(final Map<Symbol, List<List<Symbol>>> rules) {
        final Map<Symbol, Set<Symbol>> reachability = new LinkedHashMap<>();
        for (final Symbol origin : rules.keySet()) {
            final Set<Symbol> reached = new LinkedHashSet<>();
            final Deque<Symbol> pending = new ArrayDeque<>(List.of(origin));
            while (!pending.isEmpty()) {
                for (final List<Symbol> alternative : rules.get(pending.pop())) {
                    for (final Symbol element : alternative) {
                        if (element.isNonTerminal() && reached.add(element)) {
                            pending.push(element);
                        }
                    }
                }
            }
            reachability.put(origin, unmodifiableSet(reached));
        }
        return Collections.unmodifiableMap(reachability);
    }

    @Override
    public String toString() {
        final StringBuilder builder = new StringBuilder();
        rules.forEach((symbol, alternatives) -> {
            builder.append(symbol).append(" ::= ");
            for (int i = 0; i < alternatives.size(); i++) {
                if (i > 0) {
                    builder.append(" | ");
                }
                final List<Symbol> alternative = alternatives.get(i);
                if (alternative.isEmpty()) {
                    builder.append("\"\"");
                }
                for (int j = 0; j < alternative.size(); j++) {
                    if (j > 0) {
                        builder.append(' ');
                    }
                    builder.append(alternative.get(j));
                }
            }
            builder.append(";\n");
        });
        return builder.toString();
    }
}
