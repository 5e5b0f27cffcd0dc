package ef;

import com.microsoft.z3.Expr;

/**
 * The representative worklist went through a full cycle without resolving anything.
 */
public class UnresolvableDependencyException extends EfException {
    private final int pending;

    public UnresolvableDependencyException(Expr witness, int pending) {
        super(witness, "Unable to clear dependency for " + witness + " (" + pending + " values pending)");
        this.pending = pending;
    }

    public int getPending() {
        return pending;
    }
}
