package nl.nfi.djlearn.grammar;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Reads grammars written as
 * <pre>
 * &lt;start&gt; ::= &lt;f&gt; "(" &lt;n&gt; ")";
 * &lt;f&gt; ::= "sqrt" | "cos";
 * </pre>
 * Lines starting with {@code #} are comments, {@code ""} denotes the empty string.
 */
public final class GrammarLoader {

    private final String source;
    private int position;

    private GrammarLoader(final String source) {
        this.source = source;
    }

    public static Grammar loadFrom(final Path path) {
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Grammar file does not exist: %s".formatted(path));
        }
        try {
            return parse(Files.readString(path, UTF_8));
        } catch (final IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Grammar parse(final String source) {
        return new GrammarLoader(source).readGrammar();
    }

    private Grammar readGrammar() {
        final Map<Symbol, List<List<Symbol>>> rules = new LinkedHashMap<>();
        skipWhitespace();
        while (position < source.length()) {
            final Symbol head = Symbol.nonTerminal(readNonTerminal());
            if (rules.containsKey(head)) {
                throw error("Duplicate rule for %s".formatted(head));
            }
            skipWhitespace();
            expect("::=");
            rules.put(head, readAlternatives());
            skipWhitespace();
        }
        return Grammar.of(rules);
    }

    private List<List<Symbol>> readAlternatives() {
        final List<List<Symbol>> alternatives = new ArrayList<>();
        List<Symbol> current = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (position >= source.length()) {
                throw error("Unterminated rule, expected ';'");
            }
            final char c = source.charAt(position);
            if (c == ';') {
                position++;
                alternatives.add(current);
                return alternatives;
            } else if (c == '|') {
                position++;
                alternatives.add(current);
                current = new ArrayList<>();
            } else if (c == '<') {
                current.add(Symbol.nonTerminal(readNonTerminal()));
            } else if (c == '"') {
                final String text = readString();
                // the empty terminal contributes nothing to a derivation
                if (!text.isEmpty()) {
                    current.add(Symbol.terminal(text));
                }
            } else {
                throw error("Unexpected character '%s'".formatted(c));
            }
        }
    }

    private String readNonTerminal() {
        final int start = position;
        final int end = source.indexOf('>', start);
        if (source.charAt(start) != '<' || end < 0) {
            throw error("Expected non-terminal");
        }
        final String name = source.substring(start, end + 1);
        if (name.length() <= 2 || name.chars().anyMatch(Character::isWhitespace)) {
            throw error("Invalid non-terminal name %s".formatted(name));
        }
        position = end + 1;
        return name;
    }

    private String readString() {
        final StringBuilder builder = new StringBuilder();
        position++;
        while (position < source.length()) {
            final char c = source.charAt(position++);
            if (c == '"') {
                return builder.toString();
            }
            if (c == '\\') {
                if (position >= source.length()) {
                    break;
                }
                final char escaped = source.charAt(position++);
                switch (escaped) {
                    case 'n' -> builder.append('\n');
                    case 't' -> builder.append('\t');
                    case 'r' -> builder.append('\r');
                    default -> builder.append(escaped);
                }
            } else {
                builder.append(c);
            }
        }
        throw error("Unterminated string literal");
    }

    private void expect(final String token) {
        if (!source.startsWith(token, position)) {
            throw error("Expected '%s'".formatted(token));
        }
        position += token.length();
    }

    private void skipWhitespace() {
        while (position < source.length()) {
            final char c = source.charAt(position);
            if (c == '#') {
                while (position < source.length() && source.charAt(position) != '\n') {
                    position++;
                }
            } else if (Character.isWhitespace(c)) {
                position++;
            } else {
                return;
            }
        }
    }

    private IllegalArgumentException error(final String message) {
        return new IllegalArgumentException("%s at offset %d".formatted(message, position));
    }
}
