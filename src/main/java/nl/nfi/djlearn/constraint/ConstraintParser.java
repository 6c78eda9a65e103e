package nl.nfi.djlearn.constraint;

import nl.nfi.djlearn.grammar.Symbol;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses the constraint language produced by {@link ConstraintPrinter}:
 * <pre>
 * constraint  := implication
 * implication := disjunction ('-&gt;' implication)?
 * disjunction := conjunction ('or' conjunction)*
 * conjunction := unary ('and' unary)*
 * unary       := 'not' unary | '(' constraint ')' | quantifier | atom
 * quantifier  := ('forall' | 'exists') &lt;var&gt; 'in' reference ':' constraint
 * atom        := term (operator term | 'in' term)?
 * term        := ('str' | 'int' | 'len') '(' term ')' | name '(' terms ')' | string | integer | reference
 * reference   := &lt;symbol&gt; ('.' &lt;symbol&gt;)*
 * </pre>
 */
public final class ConstraintParser {

    private static final Set<String> KEYWORDS = Set.of("and", "or", "not", "forall", "exists", "in", "str", "int", "len");

    private final List<Token> tokens;
    private final String source;
    private final Deque<String> variables = new ArrayDeque<>();
    private int position;
    private int fresh;
    private Map<String, Search> bindings;

    private ConstraintParser(final String source, final List<Token> tokens) {
        this.source = source;
        this.tokens = tokens;
    }

    public static Constraint parse(final String source) {
        final ConstraintParser parser = new ConstraintParser(source, tokenize(source));
        final Constraint constraint = parser.constraint();
        if (parser.position != parser.tokens.size()) {
            throw parser.error("Unexpected trailing input");
        }
        return constraint;
    }

    private Constraint constraint() {
        final Constraint antecedent = disjunction();
        if (accept(Type.ARROW)) {
            return new Constraint.Implication(antecedent, constraint());
        }
        return antecedent;
    }

    private Constraint disjunction() {
        final List<Constraint> operands = new ArrayList<>(List.of(conjunction()));
        while (acceptKeyword("or")) {
            operands.add(conjunction());
        }
        return Constraints.or(operands);
    }

    private Constraint conjunction() {
        final List<Constraint> operands = new ArrayList<>(List.of(unary()));
        while (acceptKeyword("and")) {
            operands.add(unary());
        }
        return Constraints.and(operands);
    }

    private Constraint unary() {
        if (acceptKeyword("not")) {
            return new Constraint.Negation(unary());
        }
        if (accept(Type.LEFT_PAREN)) {
            final Constraint inner = constraint();
            expect(Type.RIGHT_PAREN);
            return inner;
        }
        if (peekKeyword("forall") || peekKeyword("exists")) {
            return quantifier();
        }
        return atom();
    }

    private Constraint quantifier() {
        final boolean universal = next().text().equals("forall");
        final String variable = unwrap(expect(Type.NON_TERMINAL).text());
        expectKeyword("in");
        final Symbol first = Symbol.nonTerminal(expect(Type.NON_TERMINAL).text());
        final Search search;
        if (variables.contains(unwrap(first.name())) && accept(Type.DOT)) {
            search = new Search.AttributeSearch(unwrap(first.name()), Symbol.nonTerminal(expect(Type.NON_TERMINAL).text()));
        } else {
            search = new Search.RuleSearch(first);
        }
        if (peek(Type.DOT)) {
            throw error("Quantifier searches support a single attribute step");
        }
        expect(Type.COLON);

        variables.push(variable);
        final Constraint body;
        try {
            body = constraint();
        } finally {
            variables.pop();
        }
        return universal
                ? new Constraint.Forall(variable, search, body)
                : new Constraint.Exists(variable, search, body);
    }

    private Constraint atom() {
        bindings = new LinkedHashMap<>();
        final Term left = term();
        if (peek(Type.OPERATOR)) {
            final ComparisonOperator operator = ComparisonOperator.fromText(next().text());
            final Term right = term();
            return new Constraint.Comparison(left, operator, right, bindings);
        }
        if (acceptKeyword("in")) {
            return new Constraint.Expression(new Term.Contains(left, term()), bindings);
        }
        return new Constraint.Expression(left, bindings);
    }

    private Term term() {
        final Token token = next();
        return switch (token.type()) {
            case STRING -> new Term.StringLiteral(token.text());
            case INTEGER -> new Term.IntLiteral(Long.parseLong(token.text()));
            case NON_TERMINAL -> reference(token);
            case NAME -> call(token);
            default -> throw error("Unexpected token '%s'".formatted(token.text()));
        };
    }

    private Term call(final Token name) {
        expect(Type.LEFT_PAREN);
        final List<Term> arguments = new ArrayList<>();
        if (!accept(Type.RIGHT_PAREN)) {
            do {
                arguments.add(term());
            } while (accept(Type.COMMA));
            expect(Type.RIGHT_PAREN);
        }
        switch (name.text()) {
            case "str", "int", "len" -> {
                if (arguments.size() != 1) {
                    throw error("%s expects one argument".formatted(name.text()));
                }
                final Term operand = arguments.get(0);
                return switch (name.text()) {
                    case "str" -> new Term.Str(operand);
                    case "int" -> new Term.Int(operand);
                    default -> new Term.Len(operand);
                };
            }
            default -> {
                if (KEYWORDS.contains(name.text())) {
                    throw error("Keyword '%s' cannot be called".formatted(name.text()));
                }
                return new Term.Call(name.text(), arguments);
            }
        }
    }

    private Term reference(final Token first) {
        final String name = unwrap(first.text());
        String current;
        if (variables.contains(name)) {
            current = name;
        } else {
            current = bind(new Search.RuleSearch(Symbol.nonTerminal(first.text())));
        }
        while (accept(Type.DOT)) {
            current = bind(new Search.AttributeSearch(current, Symbol.nonTerminal(expect(Type.NON_TERMINAL).text())));
        }
        return new Term.Ref(current);
    }

    private String bind(final Search search) {
        final String name = "_%d".formatted(fresh++);
        bindings.put(name, search);
        return name;
    }

    private static String unwrap(final String nonTerminal) {
        return nonTerminal.substring(1, nonTerminal.length() - 1);
    }

    private Token next() {
        if (position >= tokens.size()) {
            throw error("Unexpected end of input");
        }
        return tokens.get(position++);
    }

    private boolean peek(final Type type) {
        return position < tokens.size() && tokens.get(position).type() == type;
    }

    private boolean peekKeyword(final String keyword) {
        return peek(Type.NAME) && tokens.get(position).text().equals(keyword);
    }

    private boolean accept(final Type type) {
        if (peek(type)) {
            position++;
            return true;
        }
        return false;
    }

    private boolean acceptKeyword(final String keyword) {
        if (peekKeyword(keyword)) {
            position++;
            return true;
        }
        return false;
    }

    private Token expect(final Type type) {
        if (!peek(type)) {
            throw error("Expected %s".formatted(type));
        }
        return tokens.get(position++);
    }

    private void expectKeyword(final String keyword) {
        if (!acceptKeyword(keyword)) {
            throw error("Expected '%s'".formatted(keyword));
        }
    }

    private IllegalArgumentException error(final String message) {
        final int offset = position < tokens.size() ? tokens.get(position).offset() : source.length();
        return new IllegalArgumentException("%s at offset %d in constraint: %s".formatted(message, offset, source));
    }

    private enum Type {
        NON_TERMINAL, STRING, INTEGER, NAME, OPERATOR, ARROW, LEFT_PAREN, RIGHT_PAREN, COMMA, DOT, COLON
    }

    private record Token(Type type, String text, int offset) {
    }

    private static List<Token> tokenize(final String source) {
        final List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < source.length()) {
            final char c = source.charAt(i);
            final int start = i;
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '<' && nonTerminalEnd(source, i) > 0) {
                i = nonTerminalEnd(source, i);
                tokens.add(new Token(Type.NON_TERMINAL, source.substring(start, i), start));
            } else if (c == '"') {
                final StringBuilder text = new StringBuilder();
                i++;
                while (i < source.length() && source.charAt(i) != '"') {
                    char next = source.charAt(i++);
                    if (next == '\\' && i < source.length()) {
                        next = switch (source.charAt(i++)) {
                            case 'n' -> '\n';
                            case 't' -> '\t';
                            case 'r' -> '\r';
                            default -> source.charAt(i - 1);
                        };
                    }
                    text.append(next);
                }
                if (i >= source.length()) {
                    throw new IllegalArgumentException("Unterminated string at offset %d in constraint: %s".formatted(start, source));
                }
                i++;
                tokens.add(new Token(Type.STRING, text.toString(), start));
            } else if (Character.isDigit(c) || (c == '-' && i + 1 < source.length() && Character.isDigit(source.charAt(i + 1)))) {
                i++;
                while (i < source.length() && Character.isDigit(source.charAt(i))) {
                    i++;
                }
                tokens.add(new Token(Type.INTEGER, source.substring(start, i), start));
            } else if (Character.isLetter(c) || c == '_') {
                while (i < source.length() && (Character.isLetterOrDigit(source.charAt(i)) || source.charAt(i) == '_')) {
                    i++;
                }
                tokens.add(new Token(Type.NAME, source.substring(start, i), start));
            } else if (source.startsWith("->", i)) {
                i += 2;
                tokens.add(new Token(Type.ARROW, "->", start));
            } else if (source.startsWith("==", i) || source.startsWith("!=", i) || source.startsWith("<=", i) || source.startsWith(">=", i)) {
                i += 2;
                tokens.add(new Token(Type.OPERATOR, source.substring(start, i), start));
            } else if (c == '<' || c == '>') {
                i++;
                tokens.add(new Token(Type.OPERATOR, String.valueOf(c), start));
            } else {
                final Type type = switch (c) {
                    case '(' -> Type.LEFT_PAREN;
                    case ')' -> Type.RIGHT_PAREN;
                    case ',' -> Type.COMMA;
                    case '.' -> Type.DOT;
                    case ':' -> Type.COLON;
                    default -> throw new IllegalArgumentException("Unexpected character '%s' at offset %d in constraint: %s".formatted(c, i, source));
                };
                i++;
                tokens.add(new Token(type, String.valueOf(c), start));
            }
        }
        return tokens;
    }

    private static int nonTerminalEnd(final String source, final int start) {
        int i = start + 1;
        while (i < source.length() && (Character.isLetterOrDigit(source.charAt(i)) || source.charAt(i) == '_' || source.charAt(i) == '-')) {
            i++;
        }
        if (i > start + 1 && i < source.length() && source.charAt(i) == '>') {
            return i + 1;
        }
        return -1;
    }
}
