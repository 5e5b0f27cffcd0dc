package ef;

import com.microsoft.z3.*;
import init.Config;
import solver.EfContext;
import solver.TermKind;
import solver.TermManager;
import utils.Log;

import java.util.*;

/**
 * Per-problem state shared by the skolemizer and the parent-map entry point:
 * existential variables and what replaced them, and the universal variables
 * chosen for each universal quantifier.
 */
public class EfAnalyzer {
    private final EfContext context;
    private final TermManager terms;

    // variable -> its own declaration, or the skolem function replacing it
    private final Map<Expr, FuncDecl> existentials = new LinkedHashMap<>();
    private final Set<Expr> universals = new LinkedHashSet<>();
    private final Map<Expr, Expr[]> boundVariables = new HashMap<>();

    public EfAnalyzer(EfContext context) {
        this.context = context;
        this.terms = context.getTerms();
    }

    public EfContext getContext() {
        return context;
    }

    public TermManager getTerms() {
        return terms;
    }

    public Map<Expr, FuncDecl> getExistentials() {
        return Collections.unmodifiableMap(existentials);
    }

    public List<Expr> getUniversals() {
        return List.copyOf(universals);
    }

    /**
     * Skolemize variable x using uvars as skolem arguments.
     */
    public SkolemTerm skolemTerm(Expr x, List<Expr> uvars) {
        int index = context.nextSkolemIndex();
        Sort[] domain = terms.sortsOf(uvars);
        String name = Config.skolemPrefix + index + "_" + nameOf(x);

        FuncDecl func = terms.mkFunction(name, domain, x.getSort());
        Expr fapp = terms.mkApp(func, uvars.toArray(new Expr[0]));
        Log.debug("Skolemization: " + nameOf(x) + " --> " + fapp);
        return new SkolemTerm(func, fapp);
    }

    /**
     * Stable variables for the bound variables of q, created on first request.
     */
    public Expr[] boundVariables(Quantifier q) {
        return boundVariables.computeIfAbsent(q, k -> terms.freshVariables(q)).clone();
    }

    /**
     * Bound variables of a universally scoped quantifier, recorded as universals.
     */
    public Expr[] universalVariables(Quantifier q) {
        Expr[] vars = boundVariables(q);
        universals.addAll(Arrays.asList(vars));
        return vars;
    }

    /**
     * Remove the quantifier of t by skolemization, with the universal scope
     * rebuilt from the parent map. t is (not (forall ..)) or (exists ..).
     *
     * @param toplevel when true the scope is empty and the parent map is not consulted
     * @return the body with the existential variables eliminated
     */
    public Expr addExistentialsAt(Expr t, boolean toplevel, ParentMap parents) {
        Quantifier q = existentialQuantifier(t);
        if (q == null) {
            throw new IllegalArgumentException("not an existential: " + t);
        }

        List<Expr> uvars = new ArrayList<>();
        if (!toplevel) {
            Expr p = parents.parentOf(t);
            while (p != null) {
                Quantifier scope = universalQuantifier(p);
                if (scope != null) {
                    // ancestors are met innermost first
                    uvars.addAll(0, Arrays.asList(universalVariables(scope)));
                }
                p = parents.parentOf(p);
            }
        }
        return eliminate(q, terms.isNegated(t), uvars);
    }

    /**
     * Open q and replace each bound variable by a skolem term over uvars, or
     * keep it as a genuine existential when uvars is empty.
     */
    Expr eliminate(Quantifier q, boolean negateBody, List<Expr> uvars) {
        Expr[] vars = terms.freshVariables(q);
        Expr body = terms.instantiate(q, vars);
        if (negateBody) {
            body = terms.opposite(body);
        }

        if (uvars.isEmpty()) {
            for (Expr x : vars) {
                registerExistential(x, x.getFuncDecl());
            }
            return body;
        }

        Expr[] skolems = new Expr[vars.length];
        for (int i = 0; i < vars.length; i++) {
            SkolemTerm sk = skolemTerm(vars[i], uvars);
            skolems[i] = sk.getApplication();
            registerExistential(vars[i], sk.getFunction());
        }
        return terms.substitute(body, vars, skolems);
    }

    /**
     * Quantifier eliminated by skolemization at t, or null.
     */
    Quantifier existentialQuantifier(Expr t) {
        TermKind kind = terms.kindOf(t);
        if (kind == TermKind.EXISTS) {
            return (Quantifier) t;
        }
        if (kind == TermKind.NOT && terms.kindOf(terms.unsigned(t)) == TermKind.FORALL) {
            return (Quantifier) terms.unsigned(t);
        }
        return null;
    }

    /**
     * Quantifier whose variables are universal at t, or null.
     */
    Quantifier universalQuantifier(Expr t) {
        TermKind kind = terms.kindOf(t);
        if (kind == TermKind.FORALL) {
            return (Quantifier) t;
        }
        if (kind == TermKind.NOT && terms.kindOf(terms.unsigned(t)) == TermKind.EXISTS) {
            return (Quantifier) terms.unsigned(t);
        }
        return null;
    }

    private void registerExistential(Expr x, FuncDecl replacement) {
        if (existentials.containsKey(x)) {
            throw new IllegalStateException("existential variable registered twice: " + x);
        }
        existentials.put(x, replacement);
    }

    private static String nameOf(Expr x) {
        return x.isApp() ? x.getFuncDecl().getName().toString() : x.toString();
    }
}
