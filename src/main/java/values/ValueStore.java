package values;

import com.microsoft.z3.Expr;

/**
 * Read-only view of the semantic values of a model, addressed by integer ids.
 */
public interface ValueStore {
    int UNKNOWN = -1;

    ValueKind kind(int value);

    /**
     * Term of a non-function value.
     */
    Expr leaf(int value);

    FunctionValue function(int value);

    default boolean isUnknown(int value) {
        return value == UNKNOWN;
    }
}
