package solver;

import com.microsoft.z3.Context;
import utils.Log;

import java.util.Map;

/**
 * Session handle for one EF problem: owns the Z3 context, the term service
 * and the skolem counter. Single writer at a time.
 */
public class EfContext implements AutoCloseable {
    private static final Map<String, String> DEFAULT_CONFIG = Map.of("model", "true");

    private final Context ctx;
    private final TermManager terms;
    private int numSkolem;
    private boolean closed;

    public EfContext() {
        this(DEFAULT_CONFIG);
    }

    public EfContext(Map<String, String> z3Config) {
        Log.initLogLevel();
        this.ctx = new Context(z3Config);
        this.terms = new TermManager(ctx);
        this.numSkolem = 0;
        Log.debug("EfContext created with config " + z3Config);
    }

    public Context getContext() {
        return ctx;
    }

    public TermManager getTerms() {
        return terms;
    }

    /**
     * Advance the skolem counter and return its new value.
     */
    public int nextSkolemIndex() {
        return ++numSkolem;
    }

    public int getNumSkolem() {
        return numSkolem;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            ctx.close();
        } catch (Exception e) {
            Log.error("Error closing Z3 context: " + e.getMessage());
        }
        Log.debug("EfContext closed after " + numSkolem + " skolem functions");
    }
}
