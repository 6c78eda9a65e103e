package nl.nfi.djlearn.constraint;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class Terms {

    private Terms() {
    }

    /**
     * Names of all {@link Term.Ref}s occurring in the term.
     */
    public static Set<String> references(final Term term) {
        final Set<String> names = new LinkedHashSet<>();
        term.accept(new TermVisitor<Void>() {
            @Override
            public Void visitRef(final Term.Ref ref) {
                names.add(ref.name());
                return null;
            }

            @Override
            public Void visitStr(final Term.Str str) {
                return str.operand().accept(this);
            }

            @Override
            public Void visitInt(final Term.Int integer) {
                return integer.operand().accept(this);
            }

            @Override
            public Void visitLen(final Term.Len len) {
                return len.operand().accept(this);
            }

            @Override
            public Void visitStringLiteral(final Term.StringLiteral literal) {
                return null;
            }

            @Override
            public Void visitIntLiteral(final Term.IntLiteral literal) {
                return null;
            }

            @Override
            public Void visitContains(final Term.Contains contains) {
                contains.needle().accept(this);
                return contains.haystack().accept(this);
            }

            @Override
            public Void visitCall(final Term.Call call) {
                call.arguments().forEach(argument -> argument.accept(this));
                return null;
            }
        });
        return names;
    }

    /**
     * Copy of the term with the named references replaced.
     */
    public static Term substitute(final Term term, final Map<String, Term> replacements) {
        return term.accept(new TermVisitor<Term>() {
            @Override
            public Term visitRef(final Term.Ref ref) {
                return replacements.getOrDefault(ref.name(), ref);
            }

            @Override
            public Term visitStr(final Term.Str str) {
                return new Term.Str(str.operand().accept(this));
            }

            @Override
            public Term visitInt(final Term.Int integer) {
                return new Term.Int(integer.operand().accept(this));
            }

            @Override
            public Term visitLen(final Term.Len len) {
                return new Term.Len(len.operand().accept(this));
            }

            @Override
            public Term visitStringLiteral(final Term.StringLiteral literal) {
                return literal;
            }

            @Override
            public Term visitIntLiteral(final Term.IntLiteral literal) {
                return literal;
            }

            @Override
            public Term visitContains(final Term.Contains contains) {
                return new Term.Contains(contains.needle().accept(this), contains.haystack().accept(this));
            }

            @Override
            public Term visitCall(final Term.Call call) {
                final List<Term> arguments = new ArrayList<>();
                call.arguments().forEach(argument -> arguments.add(argument.accept(this)));
                return new Term.Call(call.function(), arguments);
            }
        });
    }

    /**
     * Number of nodes in the term.
     */
    public static int size(final Term term) {
        return term.accept(new TermVisitor<Integer>() {
            @Override
            public Integer visitRef(final Term.Ref ref) {
                return 1;
            }

            @Override
            public Integer visitStr(final Term.Str str) {
                return 1 + str.operand().accept(this);
            }

            @Override
            public Integer visitInt(final Term.Int integer) {
                return 1 + integer.operand().accept(this);
            }

            @Override
            public Integer visitLen(final Term.Len len) {
                return 1 + len.operand().accept(this);
            }

            @Override
            public Integer visitStringLiteral(final Term.StringLiteral literal) {
                return 1;
            }

            @Override
            public Integer visitIntLiteral(final Term.IntLiteral literal) {
                return 1;
            }

            @Override
            public Integer visitContains(final Term.Contains contains) {
                return 1 + contains.needle().accept(this) + contains.haystack().accept(this);
            }

            @Override
            public Integer visitCall(final Term.Call call) {
                int size = 1;
                for (final Term argument : call.arguments()) {
                    size += argument.accept(this);
                }
                return size;
            }
        });
    }
}
