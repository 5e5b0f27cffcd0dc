package ef;

import com.microsoft.z3.Expr;
import com.microsoft.z3.Quantifier;
import solver.TermKind;
import solver.TermManager;

import java.util.*;

/**
 * Lookup table from a subterm to its enclosing term. Quantifier bodies are
 * recorded in instantiated form, with the analyzer's bound variables, and
 * point to the signed quantifier occurrence.
 */
public class ParentMap {
    private final Map<Expr, Expr> parents = new HashMap<>();

    public static ParentMap build(EfAnalyzer analyzer, Expr root) {
        ParentMap map = new ParentMap();
        TermManager terms = analyzer.getTerms();
        Deque<Expr> stack = new ArrayDeque<>();
        Set<Expr> visited = new HashSet<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Expr node = stack.pop();
            if (!visited.add(node)) {
                continue;
            }
            for (Expr child : childrenOf(analyzer, terms, node)) {
                map.put(child, node);
                stack.push(child);
            }
        }
        return map;
    }

    private static Expr[] childrenOf(EfAnalyzer analyzer, TermManager terms, Expr node) {
        TermKind kind = terms.kindOf(node);
        if (kind == TermKind.NOT && isQuantifier(terms, terms.unsigned(node))) {
            Quantifier q = (Quantifier) terms.unsigned(node);
            return new Expr[]{terms.instantiate(q, analyzer.boundVariables(q))};
        }
        if (kind == TermKind.FORALL || kind == TermKind.EXISTS) {
            Quantifier q = (Quantifier) node;
            return new Expr[]{terms.instantiate(q, analyzer.boundVariables(q))};
        }
        return terms.children(node);
    }

    private static boolean isQuantifier(TermManager terms, Expr t) {
        TermKind kind = terms.kindOf(t);
        return kind == TermKind.FORALL || kind == TermKind.EXISTS;
    }

    /**
     * Record parent for child unless one is already known.
     */
    public void put(Expr child, Expr parent) {
        parents.putIfAbsent(child, parent);
    }

    public Expr parentOf(Expr t) {
        return parents.get(t);
    }

    public int size() {
        return parents.size();
    }
}
