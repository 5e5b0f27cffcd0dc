package ef;

import com.microsoft.z3.Expr;
import com.microsoft.z3.Quantifier;
import init.Config;
import solver.TermKind;
import solver.TermManager;
import utils.Log;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Rewrites a formula into negation normal form without existential quantifiers.
 * Universal quantifiers are opened and their variables left free in the result;
 * existential variables are replaced by skolem terms over the universals in scope.
 * <p>
 * Not reentrant: one {@link #skolemize(Expr)} call must finish before the next starts.
 */
public class EfSkolemizer {
    private final EfAnalyzer analyzer;
    private final TermManager terms;
    private final boolean flattenIte;
    private final boolean flattenIff;

    private final List<Expr> uvars = new ArrayList<>();

    public EfSkolemizer(EfAnalyzer analyzer) {
        this(analyzer, Config.flattenIte, Config.flattenIff);
    }

    public EfSkolemizer(EfAnalyzer analyzer, boolean flattenIte, boolean flattenIff) {
        this.analyzer = analyzer;
        this.terms = analyzer.getTerms();
        this.flattenIte = flattenIte;
        this.flattenIff = flattenIff;
    }

    public Expr skolemize(Expr formula) {
        if (!uvars.isEmpty()) {
            throw new IllegalStateException("skolemize called with a non-empty universal scope");
        }
        Log.debug("Skolemize: " + formula);
        Expr result = rewrite(formula);
        Log.debug("Skolemized: " + result);
        return result;
    }

    /**
     * Universal variables currently in scope, outermost first.
     */
    public List<Expr> getScope() {
        return List.copyOf(uvars);
    }

    private Expr rewrite(Expr t) {
        if (terms.isNegated(t)) {
            return negative(t, terms.unsigned(t));
        }
        return positive(t);
    }

    // t is (not u)
    private Expr negative(Expr t, Expr u) {
        if (terms.isAtomic(u)) {
            return t;
        }
        Expr[] args = terms.children(u);
        TermKind kind = terms.kindOf(u);
        switch (kind) {
            case ITE:
                if (flattenIte && terms.isBoolean(args[1])) {
                    // (c => not a) and (not c => not b)
                    return rewrite(terms.mkAnd(
                            terms.mkImplies(args[0], terms.opposite(args[1])),
                            terms.mkImplies(terms.opposite(args[0]), terms.opposite(args[2]))));
                }
                break;
            case EQ:
                if (flattenIff && isIff(u)) {
                    // (a => not b) and (not a => b)
                    return rewrite(terms.mkAnd(
                            terms.mkImplies(args[0], terms.opposite(args[1])),
                            terms.mkImplies(terms.opposite(args[0]), args[1])));
                }
                break;
            case OR:
                return terms.mkAnd(rewriteOpposites(args));
            case AND:
                return terms.mkOr(rewriteOpposites(args));
            case IMPLIES:
                return terms.mkAnd(rewrite(args[0]), rewrite(terms.opposite(args[1])));
            case NOT:
                return rewrite(args[0]);
            case FORALL:
                return rewrite(analyzer.eliminate((Quantifier) u, true, uvars));
            case EXISTS:
                return underUniversal((Quantifier) u, true);
            default:
                break;
        }
        return terms.opposite(rebuild(u, args));
    }

    private Expr positive(Expr t) {
        if (terms.isAtomic(t)) {
            return t;
        }
        Expr[] args = terms.children(t);
        switch (terms.kindOf(t)) {
            case ITE:
                if (flattenIte && terms.isBoolean(args[1])) {
                    return rewrite(terms.mkAnd(
                            terms.mkImplies(args[0], args[1]),
                            terms.mkImplies(terms.opposite(args[0]), args[2])));
                }
                break;
            case EQ:
                if (flattenIff && isIff(t)) {
                    return rewrite(terms.mkAnd(
                            terms.mkImplies(args[0], args[1]),
                            terms.mkImplies(args[1], args[0])));
                }
                break;
            case IMPLIES:
                return terms.mkOr(rewrite(terms.opposite(args[0])), rewrite(args[1]));
            case FORALL:
                return underUniversal((Quantifier) t, false);
            case EXISTS:
                return rewrite(analyzer.eliminate((Quantifier) t, false, uvars));
            default:
                break;
        }
        return rebuild(t, args);
    }

    private Expr underUniversal(Quantifier q, boolean negateBody) {
        Expr[] vars = analyzer.universalVariables(q);
        Expr body = terms.instantiate(q, vars);
        if (negateBody) {
            body = terms.opposite(body);
        }
        int mark = uvars.size();
        uvars.addAll(Arrays.asList(vars));
        try {
            return rewrite(body);
        } finally {
            uvars.subList(mark, uvars.size()).clear();
        }
    }

    private Expr rebuild(Expr t, Expr[] args) {
        Expr[] rewritten = new Expr[args.length];
        for (int i = 0; i < args.length; i++) {
            rewritten[i] = rewrite(args[i]);
        }
        return terms.rebuild(t, rewritten);
    }

    private Expr[] rewriteOpposites(Expr[] args) {
        Expr[] result = new Expr[args.length];
        for (int i = 0; i < args.length; i++) {
            result[i] = rewrite(terms.opposite(args[i]));
        }
        return result;
    }

    private boolean isIff(Expr t) {
        return t.getNumArgs() == 2 && terms.isBoolean(t.getArgs()[0]);
    }
}
