package nl.nfi.djlearn.grammar;

import static java.util.Objects.requireNonNull;

public record Symbol(String name, boolean terminal) {

    public Symbol {
        requireNonNull(name);
        if (!terminal && !(name.startsWith("<") && name.endsWith(">") && name.length() > 2)) {
            throw new IllegalArgumentException("Non-terminal name must be of the form <name>: %s".formatted(name));
        }
    }

    public static Symbol nonTerminal(final String name) {
        return new Symbol(name, false);
    }

    public static Symbol terminal(final String text) {
        return new Symbol(text, true);
    }

    public boolean isNonTerminal() {
        return !terminal;
    }

    @Override
    public String toString() {
        return terminal ? quote(name) : name;
    }

    public static String quote(final String text) {
        final StringBuilder builder = new StringBuilder("\"");
        for (final char c : text.toCharArray()) {
            switch (c) {
                case '"' -> builder.append("\\\"");
                case '\\' -> builder.append("\\\\");
                case '\n' -> builder.append("\\n");
                case '\t' -> builder.append("\\t");
                case '\r' -> builder.append("\\r");
                default -> builder.append(c);
            }
        }
        return builder.append('"').toString();
    }
}
