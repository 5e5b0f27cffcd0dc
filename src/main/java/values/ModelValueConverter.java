package values;

import com.microsoft.z3.*;
import ef.UnsupportedFunctionDefaultException;
import solver.TermManager;
import utils.Log;

import java.util.Arrays;
import java.util.List;

/**
 * Leaf values convert to themselves; function values convert to a lambda
 * over an if-then-else chain of their entries.
 */
public class ModelValueConverter implements ValueConverter {
    private final TermManager terms;
    private final ValueStore store;

    public ModelValueConverter(TermManager terms, ValueStore store) {
        this.terms = terms;
        this.store = store;
    }

    @Override
    public Expr convert(int value) {
        if (store.kind(value) == ValueKind.FUNCTION) {
            return convertFunction(store.function(value));
        }
        return store.leaf(value);
    }

    private Expr convertFunction(FunctionValue fun) {
        Context ctx = terms.getContext();
        Sort[] domain = fun.getDomain();
        Expr[] params = new Expr[domain.length];
        for (int i = 0; i < domain.length; i++) {
            params[i] = ctx.mkConst("ef!arg" + i, domain[i]);
        }

        List<FunctionValue.Entry> entries = fun.getEntries();
        int last = entries.size();
        Expr body;
        if (fun.hasDefault()) {
            body = convert(fun.getDefaultValue());
            if (!terms.isLeaf(body)) {
                Log.error("Default " + body + " of function value is not a value term");
                throw new UnsupportedFunctionDefaultException(body, "default is not a value term");
            }
        } else if (!entries.isEmpty()) {
            last--;
            body = convert(entries.get(last).getResult());
        } else {
            Log.error("Function value over " + Arrays.toString(domain) + " has neither entries nor default");
            throw new UnsupportedFunctionDefaultException(null, "function value has neither entries nor default");
        }

        for (int i = last - 1; i >= 0; i--) {
            FunctionValue.Entry entry = entries.get(i);
            Expr[] eqs = new Expr[entry.getArity()];
            for (int j = 0; j < eqs.length; j++) {
                eqs[j] = terms.mkEq(params[j], convert(entry.getArg(j)));
            }
            Expr cond = eqs.length == 1 ? eqs[0] : terms.mkAnd(eqs);
            body = ctx.mkITE((BoolExpr) cond, convert(entry.getResult()), body);
        }
        return Lambda.of(ctx, params, body);
    }
}
