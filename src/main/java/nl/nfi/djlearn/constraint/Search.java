package nl.nfi.djlearn.constraint;

import nl.nfi.djlearn.grammar.Symbol;

import static java.util.Objects.requireNonNull;

/**
 * Where a placeholder finds the subtrees it stands for.
 */
public sealed interface Search permits Search.RuleSearch, Search.AttributeSearch {

    Symbol symbol();

    Search withSymbol(Symbol symbol);

    /**
     * Subtrees labeled with the symbol, anywhere in the tree under evaluation.
     */
    record RuleSearch(Symbol symbol) implements Search {

        public RuleSearch {
            requireNonNull(symbol);
        }

        @Override
        public Search withSymbol(final Symbol symbol) {
            return new RuleSearch(symbol);
        }
    }

    /**
     * Descendants labeled with the symbol below the subtree bound to {@code base}, which is
     * either a quantified variable or an earlier binding of the same atom.
     */
    record AttributeSearch(String base, Symbol symbol) implements Search {

        public AttributeSearch {
            requireNonNull(base);
            requireNonNull(symbol);
        }

        @Override
        public Search withSymbol(final Symbol symbol) {
            return new AttributeSearch(base, symbol);
        }
    }
}
