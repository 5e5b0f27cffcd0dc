package solver;

import com.microsoft.z3.*;
import com.microsoft.z3.enumerations.Z3_sort_kind;
import ef.SubstitutionFailureException;
import utils.Log;

import java.util.List;

/**
 * Narrow term service used by the EF core: kind and polarity queries,
 * reconstruction, quantifier opening and simultaneous substitution.
 */
public class TermManager {
    private final Context ctx;

    public TermManager(Context ctx) {
        this.ctx = ctx;
    }

    public Context getContext() {
        return ctx;
    }

    public TermKind kindOf(Expr t) {
        return TermKind.of(t);
    }

    public boolean isAtomic(Expr t) {
        return kindOf(t).isAtomic();
    }

    public boolean isComposite(Expr t) {
        return !isAtomic(t);
    }

    /**
     * Leaves are zero-argument applications: constants, numerals and model values.
     */
    public boolean isLeaf(Expr t) {
        return kindOf(t) == TermKind.CONSTANT;
    }

    public boolean isApplication(Expr t) {
        return kindOf(t) == TermKind.APP;
    }

    /**
     * Interpreted literals stand for themselves in any model.
     */
    public boolean isLiteral(Expr t) {
        return isLeaf(t) && (t.isNumeral() || t.isTrue() || t.isFalse());
    }

    public boolean isBoolean(Expr t) {
        return t.getSort().getSortKind() == Z3_sort_kind.Z3_BOOL_SORT;
    }

    public boolean isUninterpreted(Sort sort) {
        return sort.getSortKind() == Z3_sort_kind.Z3_UNINTERPRETED_SORT;
    }

    public boolean isNegated(Expr t) {
        return kindOf(t) == TermKind.NOT;
    }

    public Expr unsigned(Expr t) {
        return isNegated(t) ? t.getArgs()[0] : t;
    }

    public Expr opposite(Expr t) {
        if (isNegated(t)) {
            return t.getArgs()[0];
        }
        return ctx.mkNot((BoolExpr) t);
    }

    public Expr[] children(Expr t) {
        switch (kindOf(t)) {
            case CONSTANT:
            case VARIABLE:
            case LAMBDA:
                return new Expr[0];
            case FORALL:
            case EXISTS:
                return new Expr[]{((Quantifier) t).getBody()};
            default:
                return t.getArgs();
        }
    }

    public Expr rebuild(Expr t, Expr[] children) {
        return kindOf(t).rebuild(ctx, t, children);
    }

    public BoolExpr mkTrue() {
        return ctx.mkTrue();
    }

    public BoolExpr mkEq(Expr a, Expr b) {
        return ctx.mkEq(a, b);
    }

    public BoolExpr mkImplies(Expr a, Expr b) {
        return ctx.mkImplies((BoolExpr) a, (BoolExpr) b);
    }

    public BoolExpr mkAnd(Expr... args) {
        return ctx.mkAnd(toBool(args));
    }

    public BoolExpr mkOr(Expr... args) {
        return ctx.mkOr(toBool(args));
    }

    /**
     * Conjunction that drops {@code true} conjuncts.
     */
    public BoolExpr conjoin(List<? extends Expr> conjuncts) {
        BoolExpr[] kept = conjuncts.stream()
                .filter(c -> !c.isTrue())
                .map(c -> (BoolExpr) c)
                .toArray(BoolExpr[]::new);
        if (kept.length == 0) {
            return ctx.mkTrue();
        }
        if (kept.length == 1) {
            return kept[0];
        }
        return ctx.mkAnd(kept);
    }

    /**
     * Pairwise distinctness, {@code true} for fewer than two terms.
     */
    public BoolExpr mkDistinct(List<? extends Expr> terms) {
        if (terms.size() < 2) {
            return ctx.mkTrue();
        }
        return ctx.mkDistinct(terms.toArray(new Expr[0]));
    }

    public FuncDecl mkFunction(String name, Sort[] domain, Sort range) {
        return ctx.mkFuncDecl(name, domain, range);
    }

    public Expr mkApp(FuncDecl f, Expr... args) {
        return ctx.mkApp(f, args);
    }

    public Sort[] sortsOf(List<? extends Expr> terms) {
        Sort[] sorts = new Sort[terms.size()];
        for (int i = 0; i < sorts.length; i++) {
            sorts[i] = terms.get(i).getSort();
        }
        return sorts;
    }

    /**
     * Fresh constants standing for the bound variables of q, in declaration order.
     */
    public Expr[] freshVariables(Quantifier q) {
        Symbol[] names = q.getBoundVariableNames();
        Sort[] sorts = q.getBoundVariableSorts();
        Expr[] vars = new Expr[names.length];
        for (int i = 0; i < names.length; i++) {
            vars[i] = ctx.mkFreshConst(names[i].toString(), sorts[i]);
        }
        return vars;
    }

    /**
     * Instantiate the body of q with one term per bound variable, in declaration order.
     * The last declared variable has de Bruijn index 0.
     */
    public Expr instantiate(Quantifier q, Expr[] replacements) {
        int n = q.getNumBound();
        if (replacements.length != n) {
            throw new IllegalArgumentException("quantifier binds " + n + " variables, got " + replacements.length);
        }
        Expr[] byIndex = new Expr[n];
        for (int i = 0; i < n; i++) {
            byIndex[n - 1 - i] = replacements[i];
        }
        return q.getBody().substituteVars(byIndex);
    }

    /**
     * Simultaneous substitution of leaves.
     *
     * @throws SubstitutionFailureException if a source is not a leaf, the sorts
     *                                      differ or Z3 rejects the substitution
     */
    public Expr substitute(Expr t, Expr[] from, Expr[] to) {
        if (from.length != to.length) {
            throw substitutionFailure(t, "mismatched substitution arrays: " + from.length + " vs " + to.length);
        }
        if (from.length == 0) {
            return t;
        }
        for (int i = 0; i < from.length; i++) {
            if (!isLeaf(from[i])) {
                throw substitutionFailure(t, "cannot substitute non-leaf term " + from[i]);
            }
            if (!from[i].getSort().equals(to[i].getSort())) {
                throw substitutionFailure(t, "ill-typed replacement " + from[i] + " := " + to[i]);
            }
        }
        try {
            return t.substitute(from, to);
        } catch (Z3Exception e) {
            Log.errorStack("Substitution rejected on " + t, e);
            throw new SubstitutionFailureException(t, e.getMessage(), e);
        }
    }

    private static SubstitutionFailureException substitutionFailure(Expr t, String reason) {
        Log.error("Substitution failed on " + t + ": " + reason);
        return new SubstitutionFailureException(t, reason);
    }

    private static BoolExpr[] toBool(Expr[] args) {
        BoolExpr[] result = new BoolExpr[args.length];
        for (int i = 0; i < args.length; i++) {
            result[i] = (BoolExpr) args[i];
        }
        return result;
    }
}
