package ef;

import com.microsoft.z3.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import solver.EfContext;
import solver.TermKind;
import solver.TermManager;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class EfSkolemizerTest {
    private EfContext ef;
    private Context ctx;
    private TermManager terms;
    private EfAnalyzer analyzer;
    private Sort t;
    private Sort u;

    @BeforeEach
    void setUp() {
        ef = new EfContext();
        ctx = ef.getContext();
        terms = ef.getTerms();
        analyzer = new EfAnalyzer(ef);
        t = ctx.mkUninterpretedSort("T");
        u = ctx.mkUninterpretedSort("U");
    }

    @AfterEach
    void tearDown() {
        ef.close();
    }

    private Quantifier forall(Expr x, Expr body) {
        return ctx.mkForall(new Expr[]{x}, (BoolExpr) body, 1, null, null, null, null);
    }

    private Quantifier exists(Expr[] xs, Expr body) {
        return ctx.mkExists(xs, (BoolExpr) body, 1, null, null, null, null);
    }

    @Test
    void negatedForallAtTopLevelKeepsExistential() {
        IntExpr x = ctx.mkIntConst("x");
        FuncDecl p = ctx.mkFuncDecl("P", ctx.getIntSort(), ctx.getBoolSort());
        EfSkolemizer skolemizer = new EfSkolemizer(analyzer);

        Expr result = skolemizer.skolemize(ctx.mkNot(forall(x, ctx.mkApp(p, x))));

        assertEquals(TermKind.NOT, terms.kindOf(result));
        Expr app = terms.unsigned(result);
        assertEquals(p, app.getFuncDecl());
        Expr k = app.getArgs()[0];
        assertTrue(terms.isLeaf(k));
        assertEquals(ctx.getIntSort(), k.getSort());
        assertEquals(Map.of(k, k.getFuncDecl()), analyzer.getExistentials());
        assertEquals(0, ef.getNumSkolem());
    }

    @Test
    void rerunGivesFreshSymbolOfSameShape() {
        IntExpr x = ctx.mkIntConst("x");
        FuncDecl p = ctx.mkFuncDecl("P", ctx.getIntSort(), ctx.getBoolSort());
        EfSkolemizer skolemizer = new EfSkolemizer(analyzer);

        Expr first = skolemizer.skolemize(ctx.mkNot(forall(x, ctx.mkApp(p, x))));
        Expr second = skolemizer.skolemize(ctx.mkNot(forall(x, ctx.mkApp(p, x))));

        Expr k1 = terms.unsigned(first).getArgs()[0];
        Expr k2 = terms.unsigned(second).getArgs()[0];
        assertNotEquals(k1.toString(), k2.toString());
        assertEquals(k1.getSort(), k2.getSort());
        assertEquals(0, k2.getFuncDecl().getArity());
    }

    @Test
    void nestedNegatedForallsAtTopLevelAreNullary() {
        Expr x = ctx.mkConst("x", t);
        Expr y = ctx.mkConst("y", u);
        FuncDecl r = ctx.mkFuncDecl("R", new Sort[]{t, u}, ctx.getBoolSort());

        new EfSkolemizer(analyzer).skolemize(ctx.mkNot(forall(x, forall(y, ctx.mkApp(r, x, y)))));

        assertEquals(2, analyzer.getExistentials().size());
        for (FuncDecl f : analyzer.getExistentials().values()) {
            assertEquals(0, f.getArity());
        }
    }

    @Test
    void existentialUnderForallDependsOnUniversal() {
        Expr x = ctx.mkConst("x", t);
        Expr y = ctx.mkConst("y", u);
        FuncDecl r = ctx.mkFuncDecl("R", new Sort[]{t, u}, ctx.getBoolSort());

        Expr result = new EfSkolemizer(analyzer).skolemize(forall(x, ctx.mkNot(forall(y, ctx.mkApp(r, x, y)))));

        assertEquals(1, ef.getNumSkolem());
        assertEquals(1, analyzer.getUniversals().size());
        Expr xv = analyzer.getUniversals().get(0);
        assertEquals(t, xv.getSort());

        FuncDecl sk = analyzer.getExistentials().values().iterator().next();
        assertEquals(1, sk.getArity());
        assertEquals(t, sk.getDomain()[0]);
        assertEquals(u, sk.getRange());
        assertTrue(sk.getName().toString().startsWith("skolem1_y"));
        assertEquals(ctx.mkNot((BoolExpr) ctx.mkApp(r, xv, ctx.mkApp(sk, xv))), result);
    }

    @Test
    void coBoundExistentialsAreReplacedTogether() {
        Expr z = ctx.mkConst("z", t);
        Expr a = ctx.mkConst("a", t);
        Expr b = ctx.mkConst("b", t);
        FuncDecl s = ctx.mkFuncDecl("S", new Sort[]{t, t}, ctx.getBoolSort());

        Expr result = new EfSkolemizer(analyzer).skolemize(forall(z, exists(new Expr[]{a, b}, ctx.mkApp(s, a, b))));

        assertEquals(2, ef.getNumSkolem());
        assertEquals(s, result.getFuncDecl());
        Expr first = result.getArgs()[0];
        Expr second = result.getArgs()[1];
        assertNotEquals(first.getFuncDecl(), second.getFuncDecl());
        Expr zv = analyzer.getUniversals().get(0);
        assertArrayEquals(new Expr[]{zv}, first.getArgs());
        assertArrayEquals(new Expr[]{zv}, second.getArgs());
        assertTrue(first.getFuncDecl().getName().toString().startsWith("skolem1_a"));
        assertTrue(second.getFuncDecl().getName().toString().startsWith("skolem2_b"));
    }

    @Test
    void skolemTermAppliesFunctionToScope() {
        Expr x = ctx.mkConst("x", t);
        Expr y = ctx.mkConst("y", u);

        SkolemTerm first = analyzer.skolemTerm(y, List.of(x));
        SkolemTerm second = analyzer.skolemTerm(y, List.of(x));

        assertEquals("skolem1_y", first.getFunction().getName().toString());
        assertEquals("skolem2_y", second.getFunction().getName().toString());
        assertEquals(ctx.mkApp(first.getFunction(), x), first.getApplication());
        assertEquals(u, first.getApplication().getSort());
    }

    @Test
    void resultIsInNegationNormalForm() {
        Expr x = ctx.mkConst("x", t);
        Expr y = ctx.mkConst("y", t);
        Expr z = ctx.mkConst("z", t);
        FuncDecl p = ctx.mkFuncDecl("P", t, ctx.getBoolSort());
        FuncDecl r = ctx.mkFuncDecl("R", new Sort[]{t, t}, ctx.getBoolSort());
        BoolExpr q = ctx.mkBoolConst("q");

        Expr inner = exists(new Expr[]{y}, ctx.mkNot(forall(z, ctx.mkApp(r, y, z))));
        Expr formula = ctx.mkNot(ctx.mkOr(
                forall(x, ctx.mkApp(p, x)),
                ctx.mkImplies(q, inner),
                ctx.mkAnd(q, forall(x, ctx.mkNot(ctx.mkApp(p, x))))));

        Expr result = new EfSkolemizer(analyzer).skolemize(formula);

        Deque<Expr> todo = new ArrayDeque<>();
        todo.push(result);
        while (!todo.isEmpty()) {
            Expr e = todo.pop();
            TermKind kind = terms.kindOf(e);
            assertNotEquals(TermKind.EXISTS, kind);
            assertNotEquals(TermKind.FORALL, kind);
            if (kind == TermKind.NOT) {
                TermKind under = terms.kindOf(terms.unsigned(e));
                assertTrue(under == TermKind.CONSTANT || under == TermKind.APP, "negation over " + under);
            }
            for (Expr child : terms.children(e)) {
                todo.push(child);
            }
        }
    }

    @Test
    void implicationUnderPositivePolarityBecomesDisjunction() {
        Expr x = ctx.mkConst("x", t);
        FuncDecl p = ctx.mkFuncDecl("P", t, ctx.getBoolSort());
        BoolExpr q = ctx.mkBoolConst("q");

        Expr result = new EfSkolemizer(analyzer).skolemize(ctx.mkImplies(q, exists(new Expr[]{x}, ctx.mkApp(p, x))));

        Expr k = analyzer.getExistentials().keySet().iterator().next();
        assertEquals(ctx.mkOr(ctx.mkNot(q), (BoolExpr) ctx.mkApp(p, k)), result);
    }

    @Test
    void iteFlatteningExposesQuantifiers() {
        Expr x = ctx.mkConst("x", t);
        FuncDecl p = ctx.mkFuncDecl("P", t, ctx.getBoolSort());
        BoolExpr c = ctx.mkBoolConst("c");
        BoolExpr q = ctx.mkBoolConst("q");
        Expr formula = ctx.mkNot(ctx.mkITE(c, forall(x, ctx.mkApp(p, x)), q));

        EfAnalyzer flat = new EfAnalyzer(ef);
        Expr flattened = new EfSkolemizer(flat, true, true).skolemize(formula);
        assertEquals(TermKind.AND, terms.kindOf(flattened));
        assertEquals(1, flat.getExistentials().size());
        assertTrue(flat.getUniversals().isEmpty());

        EfAnalyzer kept = new EfAnalyzer(ef);
        Expr generic = new EfSkolemizer(kept, false, true).skolemize(formula);
        assertEquals(TermKind.NOT, terms.kindOf(generic));
        assertEquals(TermKind.ITE, terms.kindOf(terms.unsigned(generic)));
        assertTrue(kept.getExistentials().isEmpty());
        assertEquals(1, kept.getUniversals().size());
    }

    @Test
    void iffFlatteningSplitsPolarities() {
        Expr x = ctx.mkConst("x", t);
        FuncDecl p = ctx.mkFuncDecl("P", t, ctx.getBoolSort());
        BoolExpr q = ctx.mkBoolConst("q");
        Expr formula = ctx.mkNot(ctx.mkIff(q, forall(x, ctx.mkApp(p, x))));

        EfAnalyzer flat = new EfAnalyzer(ef);
        new EfSkolemizer(flat, true, true).skolemize(formula);
        assertEquals(1, flat.getExistentials().size());
        assertEquals(1, flat.getUniversals().size());

        EfAnalyzer kept = new EfAnalyzer(ef);
        Expr generic = new EfSkolemizer(kept, true, false).skolemize(formula);
        assertEquals(TermKind.NOT, terms.kindOf(generic));
        assertEquals(TermKind.EQ, terms.kindOf(terms.unsigned(generic)));
        assertTrue(kept.getExistentials().isEmpty());
    }

    @Test
    void scopeIsRestoredAfterEachCall() {
        Expr x = ctx.mkConst("x", t);
        FuncDecl p = ctx.mkFuncDecl("P", t, ctx.getBoolSort());
        EfSkolemizer skolemizer = new EfSkolemizer(analyzer);

        skolemizer.skolemize(forall(x, ctx.mkApp(p, x)));
        assertTrue(skolemizer.getScope().isEmpty());
        skolemizer.skolemize(ctx.mkNot(forall(x, ctx.mkApp(p, x))));
        assertTrue(skolemizer.getScope().isEmpty());
    }
}
