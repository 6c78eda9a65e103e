package nl.nfi.djlearn.grammar;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static java.util.Collections.unmodifiableList;

/**
 * Immutable derivation tree. Equality and hash code are structural, so two trees
 * obtained by parsing the same text with the same grammar are equal.
 */
public final class DerivationTree {

    private final Symbol symbol;
    private final List<DerivationTree> children;
    private final int hash;
    private final int size;

    // lazily computed, racy but idempotent
    private String text;

    private DerivationTree(final Symbol symbol, final List<DerivationTree> children) {
        this.symbol = symbol;
        this.children = children;

        int hash = symbol.hashCode();
        int size = 1;
        for (final DerivationTree child : children) {
            hash = 31 * hash + child.hash;
            size += child.size;
        }
        this.hash = hash;
        this.size = size;
    }

    public static DerivationTree leaf(final Symbol symbol) {
        return new DerivationTree(symbol, List.of());
    }

    public static DerivationTree node(final Symbol symbol, final List<DerivationTree> children) {
        if (symbol.terminal() && !children.isEmpty()) {
            throw new IllegalArgumentException("Terminal node cannot have children: %s".formatted(symbol));
        }
        return new DerivationTree(symbol, unmodifiableList(new ArrayList<>(children)));
    }

    public Symbol symbol() {
        return symbol;
    }

    public List<DerivationTree> children() {
        return children;
    }

    public int size() {
        return size;
    }

    /**
     * All subtrees (including this one) labeled with the given symbol, in pre-order.
     */
    public List<DerivationTree> findAll(final Symbol target) {
        final List<DerivationTree> found = new ArrayList<>();
        collect(target, found);
        return found;
    }

    /**
     * All proper descendants labeled with the given symbol, in pre-order.
     */
    public List<DerivationTree> findDescendants(final Symbol target) {
        final List<DerivationTree> found = new ArrayList<>();
        for (final DerivationTree child : children) {
            child.collect(target, found);
        }
        return found;
    }

    private void collect(final Symbol target, final List<DerivationTree> found) {
        if (symbol.equals(target)) {
            found.add(this);
        }
        for (final DerivationTree child : children) {
            child.collect(target, found);
        }
    }

    public boolean contains(final DerivationTree other) {
        if (other.size > size) {
            return false;
        }
        if (equals(other)) {
            return true;
        }
        for (final DerivationTree child : children) {
            if (child.contains(other)) {
                return true;
            }
        }
        return false;
    }

    public Set<Symbol> nonTerminalSymbols() {
        final Set<Symbol> symbols = new LinkedHashSet<>();
        collectNonTerminals(symbols);
        return symbols;
    }

    private void collectNonTerminals(final Set<Symbol> symbols) {
        if (symbol.isNonTerminal()) {
            symbols.add(symbol);
        }
        for (final DerivationTree child : children) {
            child.collectNonTerminals(symbols);
        }
    }

    /**
     * Every node paired with the child-index path leading to it, in pre-order.
     */
    public List<Located> locate() {
        final List<Located> located = new ArrayList<>();
        locate(new ArrayList<>(), located);
        return located;
    }

    private void locate(final List<Integer> path, final List<Located> located) {
        located.add(new Located(List.copyOf(path), this));
        for (int i = 0; i < children.size(); i++) {
            path.add(i);
            children.get(i).locate(path, located);
            path.remove(path.size() - 1);
        }
    }

    public DerivationTree get(final List<Integer> path) {
        DerivationTree current = this;
        for (final int index : path) {
            current = current.children.get(index);
        }
        return current;
    }

    /**
     * Returns a new tree in which the node at the given path is replaced. Subtrees
     * off the path are shared with this tree.
     */
    public DerivationTree replace(final List<Integer> path, final DerivationTree replacement) {
        return replace(path, 0, replacement);
    }

    private DerivationTree replace(final List<Integer> path, final int depth, final DerivationTree replacement) {
        if (depth == path.size()) {
            return replacement;
        }
        final int index = path.get(depth);
        final List<DerivationTree> newChildren = new ArrayList<>(children);
        newChildren.set(index, children.get(index).replace(path, depth + 1, replacement));
        return new DerivationTree(symbol, unmodifiableList(newChildren));
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DerivationTree other)) {
            return false;
        }
        return hash == other.hash
                && size == other.size
                && symbol.equals(other.symbol)
                && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        String result = text;
        if (result == null) {
            final StringBuilder builder = new StringBuilder();
            appendText(builder);
            result = builder.toString();
            text = result;
        }
        return result;
    }

    private void appendText(final StringBuilder builder) {
        if (symbol.terminal()) {
            builder.append(symbol.name());
            return;
        }
        if (text != null) {
            builder.append(text);
            return;
        }
        for (final DerivationTree child : children) {
            child.appendText(builder);
        }
    }

    public record Located(List<Integer> path, DerivationTree tree) {
    }
}
