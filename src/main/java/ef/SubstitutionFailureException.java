package ef;

import com.microsoft.z3.Expr;

public class SubstitutionFailureException extends EfException {

    public SubstitutionFailureException(Expr term, String reason) {
        super(term, "Substitution failed on " + term + ": " + reason);
    }

    public SubstitutionFailureException(Expr term, String reason, Throwable cause) {
        super(term, "Substitution failed on " + term + ": " + reason, cause);
    }
}
