package ef;

import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;

/**
 * A skolem function together with its application to the universal variables in scope.
 */
public class SkolemTerm {
    private final FuncDecl function;
    private final Expr application;

    public SkolemTerm(FuncDecl function, Expr application) {
        this.function = function;
        this.application = application;
    }

    public FuncDecl getFunction() {
        return function;
    }

    public Expr getApplication() {
        return application;
    }

    @Override
    public String toString() {
        return function.getName() + " : " + application;
    }
}
