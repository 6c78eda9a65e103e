package nl.nfi.djlearn.grammar;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Memoising backtracking parser. Left recursive rules are cut off at re-entry,
 * so they only contribute their non left recursive alternatives.
 */
final class Parser {

    // bound on the number of parses kept per symbol and position
    private static final int MAX_PARSES = 32;

    private final Grammar grammar;

    private Parser(final Grammar grammar) {
        this.grammar = grammar;
    }

    static Parser forGrammar(final Grammar grammar) {
        return new Parser(grammar);
    }

    Optional<DerivationTree> parse(final Symbol start, final String text) {
        final Run run = new Run(text);
        for (final Partial partial : run.parseSymbol(start, 0)) {
            if (partial.end() == text.length()) {
                return Optional.of(partial.tree());
            }
        }
        return Optional.empty();
    }

    private record Partial(DerivationTree tree, int end) {
    }

    private record Sequence(List<DerivationTree> children, int end) {
    }

    private record Key(Symbol symbol, int position) {
    }

    private final class Run {

        private final String text;
        private final Map<Key, List<Partial>> memo = new HashMap<>();

        private Run(final String text) {
            this.text = text;
        }

        private List<Partial> parseSymbol(final Symbol symbol, final int position) {
            if (symbol.terminal()) {
                if (text.startsWith(symbol.name(), position)) {
                    return List.of(new Partial(DerivationTree.leaf(symbol), position + symbol.name().length()));
                }
                return List.of();
            }

            final Key key = new Key(symbol, position);
            final List<Partial> known = memo.get(key);
            if (known != null) {
                return known;
            }
            // placeholder breaks left recursion
            memo.put(key, List.of());

            final List<Partial> partials = new ArrayList<>();
            for (final List<Symbol> alternative : grammar.alternatives(symbol)) {
                for (final Sequence sequence : parseSequence(alternative, 0, position)) {
                    partials.add(new Partial(DerivationTree.node(symbol, sequence.children()), sequence.end()));
                    if (partials.size() >= MAX_PARSES) {
                        break;
                    }
                }
                if (partials.size() >= MAX_PARSES) {
                    break;
                }
            }
            memo.put(key, partials);
            return partials;
        }

        private List<Sequence> parseSequence(final List<Symbol> alternative, final int index, final int position) {
            if (index == alternative.size()) {
                return List.of(new Sequence(List.of(), position));
            }
            final List<Sequence> sequences = new ArrayList<>();
            for (final Partial head : parseSymbol(alternative.get(index), position)) {
                for (final Sequence tail : parseSequence(alternative, index + 1, head.end())) {
                    final List<DerivationTree> children = new ArrayList<>(tail.children().size() + 1);
                    children.add(head.tree());
                    children.addAll(tail.children());
                    sequences.add(new Sequence(children, tail.end()));
                    if (sequences.size() >= MAX_PARSES) {
                        return sequences;
                    }
                }
            }
            return sequences;
        }
    }
}
