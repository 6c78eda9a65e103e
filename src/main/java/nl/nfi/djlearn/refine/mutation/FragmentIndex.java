package nl.nfi.djlearn.refine.mutation;

import nl.nfi.djlearn.grammar.DerivationTree;
import nl.nfi.djlearn.grammar.Symbol;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Distinct subtrees observed per non-terminal.
 */
public final class FragmentIndex {

    private final Map<Symbol, Set<DerivationTree>> fragments = new LinkedHashMap<>();

    public void add(final DerivationTree tree) {
        for (final DerivationTree.Located located : tree.locate()) {
            final DerivationTree subtree = located.tree();
            if (subtree.symbol().isNonTerminal()) {
                fragments.computeIfAbsent(subtree.symbol(), symbol -> new LinkedHashSet<>()).add(subtree);
            }
        }
    }

    public List<DerivationTree> fragments(final Symbol symbol) {
        return new ArrayList<>(fragments.getOrDefault(symbol, Set.of()));
    }

    public int size() {
        int size = 0;
        for (final Set<DerivationTree> trees : fragments.values()) {
            size += trees.size();
        }
        return size;
    }
}
