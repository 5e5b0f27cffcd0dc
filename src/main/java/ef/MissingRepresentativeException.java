package ef;

import com.microsoft.z3.Expr;

public class MissingRepresentativeException extends EfException {

    public MissingRepresentativeException(Expr witness, String reason) {
        super(witness, "Unable to find a representative for " + witness + ": " + reason);
    }
}
