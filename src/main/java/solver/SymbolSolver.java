package solver;

import com.microsoft.z3.*;
import utils.Log;
import values.ModelValueStore;

import java.util.List;

/**
 * Inner solver calls of the EF loop: check a candidate and read back the
 * values it assigns to the existential declarations.
 */
public class SymbolSolver {

    /**
     * Solve the constraints.
     *
     * @return the model when satisfiable, null when unsat or unknown
     */
    public static Model solve(Context ctx, List<Expr> constraints) {
        Solver solver = ctx.mkSolver();
        for (Expr constraint : constraints) {
            solver.add((BoolExpr) constraint);
        }

        long start = System.currentTimeMillis();
        Status status = solver.check();
        Log.printTime("Inner solver check (" + status + ")", start);
        if (status == Status.SATISFIABLE) {
            return solver.getModel();
        }
        if (status == Status.UNKNOWN) {
            Log.warn("Inner solver returned unknown: " + solver.getReasonUnknown());
        }
        return null;
    }

    public static boolean solveConstraintsSingle(Context ctx, List<Expr> constraints) {
        if (constraints.isEmpty()) {
            return true;
        }
        return solve(ctx, constraints) != null;
    }

    /**
     * Value identifiers the model assigns to decls, interned into store.
     * The result is parallel to decls.
     */
    public static int[] extractAssignment(Model model, FuncDecl[] decls, ModelValueStore store) {
        int[] values = new int[decls.length];
        for (int i = 0; i < decls.length; i++) {
            values[i] = store.valueOf(model, decls[i]);
            if (Log.isDebugEnabled()) {
                Log.debug("Model value " + decls[i].getName() + " -> #" + values[i] + " (" + store.kind(values[i]) + ")");
            }
        }
        return values;
    }
}
