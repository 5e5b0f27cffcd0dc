package ef;

import com.microsoft.z3.Expr;

/**
 * A function value carries a default entry that cannot be encoded as a witness.
 */
public class UnsupportedFunctionDefaultException extends EfException {

    public UnsupportedFunctionDefaultException(Expr function, String reason) {
        super(function, "Unsupported default in interpretation of " + function + ": " + reason);
    }
}
