package ef;

import com.microsoft.z3.Expr;

/**
 * Base of the fatal EF model-resolution failures. These signal a malformed
 * model or a defect upstream and abort the current EF iteration.
 */
public class EfException extends RuntimeException {
    private final transient Expr term;

    public EfException(Expr term, String message) {
        super(message);
        this.term = term;
    }

    public EfException(Expr term, String message, Throwable cause) {
        super(message, cause);
        this.term = term;
    }

    /**
     * The witness, value or formula term the failure is about.
     */
    public Expr getTerm() {
        return term;
    }
}
