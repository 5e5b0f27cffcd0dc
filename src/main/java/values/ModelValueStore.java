package values;

import com.microsoft.z3.*;
import com.microsoft.z3.enumerations.Z3_sort_kind;
import solver.TermManager;
import utils.Log;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory value store. Terms are interned in registration order so value ids
 * are stable for a given sequence of registrations.
 */
public class ModelValueStore implements ValueStore {
    private final TermManager terms;
    private final List<Object> objects = new ArrayList<>();
    private final List<ValueKind> kinds = new ArrayList<>();
    private final Map<Expr, Integer> termIds = new HashMap<>();

    public ModelValueStore(TermManager terms) {
        this.terms = terms;
    }

    /**
     * Intern a non-function value term.
     */
    public int intern(Expr value) {
        Integer id = termIds.get(value);
        if (id != null) {
            return id;
        }
        id = register(value, kindOf(value));
        termIds.put(value, id);
        return id;
    }

    public int mkFunction(Sort[] domain, Sort range, List<FunctionValue.Entry> entries, int defaultValue) {
        for (FunctionValue.Entry entry : entries) {
            checkId(entry.getResult());
            for (int arg : entry.getArgs()) {
                checkId(arg);
            }
        }
        if (defaultValue != UNKNOWN) {
            checkId(defaultValue);
        }
        return register(new FunctionValue(domain, range, entries, defaultValue), ValueKind.FUNCTION);
    }

    /**
     * Read the value of a declaration from a Z3 model.
     */
    public int valueOf(Model model, FuncDecl decl) {
        Context ctx = terms.getContext();
        if (decl.getArity() == 0) {
            Expr value = model.getConstInterp(decl);
            if (value == null) {
                value = model.eval(ctx.mkConst(decl), true);
            }
            return intern(value);
        }

        Sort[] domain = decl.getDomain();
        Sort range = decl.getRange();
        FuncInterp interp = model.getFuncInterp(decl);
        if (interp == null) {
            Expr[] args = new Expr[domain.length];
            for (int i = 0; i < domain.length; i++) {
                args[i] = ctx.mkFreshConst("arg", domain[i]);
            }
            Expr value = model.eval(ctx.mkApp(decl, args), true);
            Log.debug("No interpretation for " + decl.getName() + ", completed default " + value);
            return mkFunction(domain, range, List.of(), intern(value));
        }

        List<FunctionValue.Entry> entries = new ArrayList<>();
        for (FuncInterp.Entry entry : interp.getEntries()) {
            Expr[] args = entry.getArgs();
            int[] ids = new int[args.length];
            for (int i = 0; i < args.length; i++) {
                ids[i] = intern(args[i]);
            }
            entries.add(new FunctionValue.Entry(ids, intern(entry.getValue())));
        }
        Expr otherwise = interp.getElse();
        int defaultValue = otherwise == null ? UNKNOWN : intern(otherwise);
        return mkFunction(domain, range, entries, defaultValue);
    }

    @Override
    public ValueKind kind(int value) {
        checkId(value);
        return kinds.get(value);
    }

    @Override
    public Expr leaf(int value) {
        checkId(value);
        Object object = objects.get(value);
        if (!(object instanceof Expr)) {
            throw new IllegalArgumentException("value " + value + " is a function value");
        }
        return (Expr) object;
    }

    @Override
    public FunctionValue function(int value) {
        checkId(value);
        Object object = objects.get(value);
        if (!(object instanceof FunctionValue)) {
            throw new IllegalArgumentException("value " + value + " is not a function value");
        }
        return (FunctionValue) object;
    }

    public int size() {
        return objects.size();
    }

    private int register(Object object, ValueKind kind) {
        objects.add(object);
        kinds.add(kind);
        return objects.size() - 1;
    }

    private ValueKind kindOf(Expr value) {
        if (!terms.isLeaf(value)) {
            return ValueKind.OTHER;
        }
        Z3_sort_kind sortKind = value.getSort().getSortKind();
        switch (sortKind) {
            case Z3_BOOL_SORT:
                return ValueKind.BOOLEAN;
            case Z3_INT_SORT:
            case Z3_REAL_SORT:
                return value.isAlgebraicNumber() ? ValueKind.ALGEBRAIC : ValueKind.RATIONAL;
            case Z3_BV_SORT:
                return ValueKind.BITVECTOR;
            case Z3_UNINTERPRETED_SORT:
                return ValueKind.UNINTERPRETED;
            default:
                return ValueKind.OTHER;
        }
    }

    private void checkId(int value) {
        if (value < 0 || value >= objects.size()) {
            throw new IllegalArgumentException("unknown value id " + value);
        }
    }
}
