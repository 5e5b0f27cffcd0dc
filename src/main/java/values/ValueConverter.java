package values;

import com.microsoft.z3.Expr;

public interface ValueConverter {

    /**
     * Canonical witness term for a value. Callers memoize.
     */
    Expr convert(int value);
}
