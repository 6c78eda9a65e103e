package nl.nfi.djlearn.constraint;

import nl.nfi.djlearn.grammar.Symbol;

/**
 * Pseudo-symbols that may appear in template searches instead of grammar symbols.
 */
public final class Placeholders {

    public static final Symbol NONTERMINAL = Symbol.nonTerminal("<NON_TERMINAL>");
    public static final Symbol STRING = Symbol.nonTerminal("<STRING>");
    public static final Symbol INTEGER = Symbol.nonTerminal("<INTEGER>");

    private Placeholders() {
    }

    public static boolean isPlaceholder(final Symbol symbol) {
        return isValue(symbol) || NONTERMINAL.equals(symbol);
    }

    public static boolean isValue(final Symbol symbol) {
        return STRING.equals(symbol) || INTEGER.equals(symbol);
    }
}
