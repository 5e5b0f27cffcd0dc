package ef;

import com.microsoft.z3.Expr;

import java.util.List;

public class CircularRepresentativeException extends EfException {
    private final transient List<Expr> requests;

    public CircularRepresentativeException(Expr witness, List<Expr> requests) {
        super(witness, "Circular dependency encountered while finding a representative for " + witness
                + ", pending requests " + requests);
        this.requests = List.copyOf(requests);
    }

    /**
     * Witness terms that were being resolved when the cycle closed, outermost first.
     */
    public List<Expr> getRequests() {
        return requests;
    }
}
