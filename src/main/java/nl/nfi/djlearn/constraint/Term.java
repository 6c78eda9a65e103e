package nl.nfi.djlearn.constraint;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Value expression inside a comparison or expression constraint. Evaluates to a
 * derivation tree, a string, a long or a boolean.
 */
public sealed interface Term permits Term.Ref, Term.Str, Term.Int, Term.Len, Term.StringLiteral, Term.IntLiteral, Term.Contains, Term.Call {

    <R> R accept(TermVisitor<R> visitor);

    /**
     * The subtree bound to a placeholder or a quantified variable.
     */
    record Ref(String name) implements Term {

        public Ref {
            requireNonNull(name);
        }

        @Override
        public <R> R accept(final TermVisitor<R> visitor) {
            return visitor.visitRef(this);
        }
    }

    record Str(Term operand) implements Term {

        public Str {
            requireNonNull(operand);
        }

        @Override
        public <R> R accept(final TermVisitor<R> visitor) {
            return visitor.visitStr(this);
        }
    }

    record Int(Term operand) implements Term {

        public Int {
            requireNonNull(operand);
        }

        @Override
        public <R> R accept(final TermVisitor<R> visitor) {
            return visitor.visitInt(this);
        }
    }

    record Len(Term operand) implements Term {

        public Len {
            requireNonNull(operand);
        }

        @Override
        public <R> R accept(final TermVisitor<R> visitor) {
            return visitor.visitLen(this);
        }
    }

    record StringLiteral(String value) implements Term {

        public StringLiteral {
            requireNonNull(value);
        }

        @Override
        public <R> R accept(final TermVisitor<R> visitor) {
            return visitor.visitStringLiteral(this);
        }
    }

    record IntLiteral(long value) implements Term {

        @Override
        public <R> R accept(final TermVisitor<R> visitor) {
            return visitor.visitIntLiteral(this);
        }
    }

    /**
     * Substring test on strings, subtree test on derivation trees.
     */
    record Contains(Term needle, Term haystack) implements Term {

        public Contains {
            requireNonNull(needle);
            requireNonNull(haystack);
        }

        @Override
        public <R> R accept(final TermVisitor<R> visitor) {
            return visitor.visitContains(this);
        }
    }

    /**
     * Invocation of a function registered in {@link Functions}.
     */
    record Call(String function, List<Term> arguments) implements Term {

        public Call {
            requireNonNull(function);
            arguments = List.copyOf(arguments);
        }

        @Override
        public <R> R accept(final TermVisitor<R> visitor) {
            return visitor.visitCall(this);
        }
    }
}
