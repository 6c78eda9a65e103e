package nl.nfi.djlearn.constraint;

public interface TermVisitor<R> {

    R visitRef(Term.Ref ref);

    R visitStr(Term.Str str);

    R visitInt(Term.Int integer);

    R visitLen(Term.Len len);

    R visitStringLiteral(Term.StringLiteral literal);

    R visitIntLiteral(Term.IntLiteral literal);

    R visitContains(Term.Contains contains);

    R visitCall(Term.Call call);
}
