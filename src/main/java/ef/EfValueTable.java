package ef;

import com.microsoft.z3.*;
import init.Config;
import solver.TermManager;
import utils.Log;
import utils.TableExporter;
import values.FunctionValue;
import values.ValueConverter;
import values.ValueKind;
import values.ValueStore;

import java.util.*;

/**
 * Value table for the EF solver.
 *
 * Maps every value of a candidate model to the terms that evaluate to it and
 * picks, for each value, the cheapest term that can stand for it. All maps keep
 * insertion order, so ties go to the first term discovered.
 *
 * Filled once per EF iteration by {@link #fill}, read-only afterwards until {@link #reset}.
 */
public class EfValueTable {
    private final TermManager terms;
    private ValueStore store;
    private ValueConverter converter;

    // witness term -> source terms that evaluate to it
    private final Map<Expr, Set<Expr>> valueToTerms = new LinkedHashMap<>();
    // sort -> simple witness terms of that sort
    private final Map<Sort, Set<Expr>> typeToValues = new LinkedHashMap<>();
    private final Map<Integer, Expr> valueIdToTerm = new LinkedHashMap<>();
    private final Map<Expr, Integer> priority = new LinkedHashMap<>();
    private final Map<Expr, Expr> representative = new LinkedHashMap<>();

    public EfValueTable(TermManager terms, ValueStore store, ValueConverter converter) {
        this.terms = terms;
        this.store = store;
        this.converter = converter;
    }

    /**
     * Release every entry and bind the table to the next iteration's model.
     */
    public void reset(ValueStore store, ValueConverter converter) {
        valueToTerms.clear();
        typeToValues.clear();
        valueIdToTerm.clear();
        priority.clear();
        representative.clear();
        this.store = store;
        this.converter = converter;
    }

    /**
     * Fill the table from a flat assignment vars[i] = values[i].
     *
     * @throws UnresolvableDependencyException if some value cannot be given a representative
     * @throws UnsupportedFunctionDefaultException if a function default is rejected
     */
    public void fill(FuncDecl[] vars, int[] values) {
        if (vars.length != values.length) {
            throw new IllegalArgumentException("vars and values differ in length: " + vars.length + " vs " + values.length);
        }
        long startTime = System.currentTimeMillis();
        Context ctx = terms.getContext();

        // first pass: top-level terms
        for (int i = 0; i < vars.length; i++) {
            if (vars[i].getArity() == 0) {
                storeTermValue(ctx.mkConst(vars[i]), values[i]);
            } else {
                if (store.kind(values[i]) != ValueKind.FUNCTION) {
                    throw new IllegalArgumentException("function " + vars[i].getName() + " assigned a non-function value " + values[i]);
                }
                witnessOf(values[i]);
            }
        }

        // second pass: function values
        for (int i = 0; i < vars.length; i++) {
            if (store.kind(values[i]) == ValueKind.FUNCTION) {
                storeFunctionValues(vars[i], values[i]);
            }
        }

        // third pass: function instances
        resolveDependencies();

        Log.printTime("EF value table filled with " + valueToTerms.size() + " values", startTime);
        if (Log.isDebugEnabled()) {
            Log.debug(snapshot().toString());
        }
        if (Config.dumpValueTable) {
            try (TableExporter exporter = new TableExporter(Config.valueTableDumpPath)) {
                exporter.writeSnapshot(snapshot());
            }
        }
    }

    /**
     * Add a witness to the inventory of its sort if the value is simple.
     *
     * @param check skip witnesses that already have source terms
     */
    public void storeTypeValue(int value, Expr witness, boolean check) {
        if (check && valueToTerms.containsKey(witness)) {
            return;
        }
        if (!store.kind(value).isSimple()) {
            return;
        }
        typeToValues.computeIfAbsent(witness.getSort(), k -> new LinkedHashSet<>()).add(witness);
    }

    private Expr witnessOf(int value) {
        Expr witness = valueIdToTerm.get(value);
        if (witness == null) {
            witness = converter.convert(value);
            valueIdToTerm.put(value, witness);
            storeTypeValue(value, witness, false);
        }
        return witness;
    }

    private void storeTermValue(Expr var, int value) {
        Expr witness = witnessOf(value);
        valueToTerms.computeIfAbsent(witness, k -> new LinkedHashSet<>()).add(var);
        if (terms.isLiteral(witness)) {
            // literals stand for themselves, never for one of their sources
            storePriority(witness, 0);
            storeRepresentative(witness, witness);
        }
        if (terms.isAtomic(var)) {
            storePriority(var, 0);
            storePriority(witness, 0);
            storeRepresentative(witness, var);
        }
    }

    private void storeFunctionValues(FuncDecl func, int value) {
        FunctionValue fun = store.function(value);
        if (fun.hasDefault()) {
            Expr defaultTerm = converter.convert(fun.getDefaultValue());
            if (!Config.acceptFunctionDefaults) {
                Log.error("Default value " + defaultTerm + " in interpretation of " + func.getName());
                throw new UnsupportedFunctionDefaultException(witnessOf(value), "default value " + defaultTerm + " is not enumerated");
            }
            Log.warn("Default value " + defaultTerm + " of " + func.getName() + " is only covered by its witness " + witnessOf(value));
        }

        int m = fun.getArity();
        for (FunctionValue.Entry entry : fun.getEntries()) {
            Expr[] args = new Expr[m];
            for (int j = 0; j < m; j++) {
                args[j] = converter.convert(entry.getArg(j));
            }
            storeTermValue(terms.mkApp(func, args), entry.getResult());
        }
    }

    private void storePriority(Expr t, int value) {
        priority.putIfAbsent(t, value);
    }

    private void storeRepresentative(Expr witness, Expr var) {
        representative.putIfAbsent(witness, var);
    }

    /**
     * 1 + sum of argument priorities, empty while an argument is still unranked.
     */
    private OptionalInt computePriority(Expr x) {
        Integer known = priority.get(x);
        if (known != null) {
            return OptionalInt.of(known);
        }
        if (terms.isAtomic(x)) {
            return terms.isLiteral(x) ? OptionalInt.of(0) : OptionalInt.empty();
        }
        int result = 1;
        for (Expr arg : terms.children(x)) {
            Integer p = priority.get(arg);
            if (p == null) {
                if (!terms.isLiteral(arg)) {
                    return OptionalInt.empty();
                }
                p = 0;
            }
            result += p;
        }
        return OptionalInt.of(result);
    }

    private void resolveDependencies() {
        Deque<Expr> queue = new ArrayDeque<>();
        for (Expr witness : valueToTerms.keySet()) {
            if (!representative.containsKey(witness)) {
                queue.add(witness);
            }
        }
        Log.debug("Resolving representatives for " + queue.size() + " values");

        int stalls = 0;
        while (!queue.isEmpty()) {
            Expr witness = queue.poll();
            Set<Expr> sources = valueToTerms.get(witness);
            if (sources.isEmpty()) {
                Log.error("No source terms for " + witness);
                throw new MissingRepresentativeException(witness, "no source terms");
            }

            Expr best = null;
            int bestPriority = Integer.MAX_VALUE;
            for (Expr x : sources) {
                OptionalInt p = computePriority(x);
                if (p.isPresent()) {
                    storePriority(x, p.getAsInt());
                    if (p.getAsInt() < bestPriority) {
                        bestPriority = p.getAsInt();
                        best = x;
                    }
                }
            }

            if (best != null) {
                storePriority(witness, bestPriority);
                storeRepresentative(witness, best);
                stalls = 0;
                Log.debug("Representative of " + witness + " is " + best + " (priority " + bestPriority + ")");
            } else {
                stalls++;
                queue.add(witness);
                if (stalls >= queue.size()) {
                    Log.fatal("Unable to clear dependency for " + witness);
                    Log.error(snapshot().toString());
                    throw new UnresolvableDependencyException(witness, queue.size());
                }
            }
        }
    }

    /**
     * Term to use in place of a witness: its representative with every argument
     * witness replaced, recursively, by that argument's own representative.
     *
     * @throws MissingRepresentativeException  if the witness is unknown or unresolved
     * @throws CircularRepresentativeException if the unfolding reaches a witness twice
     */
    public Expr getValueRepresentative(Expr witness) {
        return representativeOf(witness, new LinkedHashSet<>());
    }

    private Expr representativeOf(Expr witness, Set<Expr> requests) {
        if (!valueToTerms.containsKey(witness)) {
            if (terms.isLiteral(witness)) {
                return witness;
            }
            Log.error("Unable to find a representative for term: " + witness);
            throw new MissingRepresentativeException(witness, "no source terms");
        }
        Expr best = representative.get(witness);
        if (best == null) {
            Log.error("Representative requested before resolution of " + witness);
            throw new MissingRepresentativeException(witness, "dependency resolution has not completed");
        }
        if (terms.isAtomic(best)) {
            return best;
        }

        requests.add(witness);
        try {
            Map<Expr, Expr> replacements = new LinkedHashMap<>();
            for (Expr arg : terms.children(best)) {
                if (requests.contains(arg)) {
                    Log.error("Circular dependency encountered while finding a representative for term: " + witness);
                    throw new CircularRepresentativeException(arg, new ArrayList<>(requests));
                }
                Expr rep = representativeOf(arg, requests);
                if (!arg.equals(rep)) {
                    replacements.put(arg, rep);
                }
            }
            Expr[] from = replacements.keySet().toArray(new Expr[0]);
            Expr[] to = replacements.values().toArray(new Expr[0]);
            return terms.substitute(best, from, to);
        } finally {
            requests.remove(witness);
        }
    }

    /**
     * Copy of values where every term of uninterpreted sort is replaced by its representative.
     */
    public Expr[] setValuesFromTable(Expr[] values) {
        Expr[] result = values.clone();
        for (int i = 0; i < result.length; i++) {
            if (terms.isUninterpreted(result[i].getSort())) {
                result[i] = getValueRepresentative(result[i]);
            }
        }
        return result;
    }

    /**
     * Replace every known uninterpreted witness in t by its representative.
     */
    public Expr substituteRepresentatives(Expr t) {
        List<Expr> from = new ArrayList<>();
        List<Expr> to = new ArrayList<>();
        for (Map.Entry<Sort, Set<Expr>> entry : typeToValues.entrySet()) {
            if (!terms.isUninterpreted(entry.getKey())) {
                continue;
            }
            for (Expr witness : entry.getValue()) {
                Expr rep = getValueRepresentative(witness);
                if (!rep.equals(witness)) {
                    from.add(witness);
                    to.add(rep);
                }
            }
        }
        return terms.substitute(t, from.toArray(new Expr[0]), to.toArray(new Expr[0]));
    }

    /**
     * Pairwise distinctness of the known values of every uninterpreted sort.
     */
    public BoolExpr constraintAllDistinct() {
        List<BoolExpr> constraints = new ArrayList<>();
        for (Map.Entry<Sort, Set<Expr>> entry : typeToValues.entrySet()) {
            if (terms.isUninterpreted(entry.getKey())) {
                constraints.add(terms.mkDistinct(new ArrayList<>(entry.getValue())));
            }
        }
        return terms.conjoin(constraints);
    }

    /**
     * Pairwise distinctness of the given variables, grouped by uninterpreted sort.
     */
    public BoolExpr constraintAllDistinctFor(Expr[] vars) {
        Map<Sort, List<Expr>> groups = new LinkedHashMap<>();
        for (Expr t : vars) {
            Sort sort = t.getSort();
            if (terms.isUninterpreted(sort)) {
                groups.computeIfAbsent(sort, k -> new ArrayList<>()).add(t);
            }
        }
        List<BoolExpr> constraints = new ArrayList<>();
        for (List<Expr> group : groups.values()) {
            constraints.add(terms.mkDistinct(group));
        }
        return terms.conjoin(constraints);
    }

    public BoolExpr constraintEnumerate(Expr[] vars) {
        return constraintEnumerate(vars, Config.enumerationBound);
    }

    /**
     * Every variable of uninterpreted sort equals one of the known values of
     * its sort. With a non-negative bound, values ranked above it are left out.
     */
    public BoolExpr constraintEnumerate(Expr[] vars, int bound) {
        List<BoolExpr> constraints = new ArrayList<>();
        for (Expr t : vars) {
            Sort sort = t.getSort();
            if (!terms.isUninterpreted(sort)) {
                continue;
            }
            Set<Expr> known = typeToValues.get(sort);
            if (known == null) {
                continue;
            }
            List<Expr> eqs = new ArrayList<>();
            for (Expr u : known) {
                if (bound >= 0) {
                    Integer p = priority.get(u);
                    if (p != null && p > bound) {
                        continue;
                    }
                }
                eqs.add(terms.mkEq(t, u));
            }
            if (eqs.isEmpty()) {
                constraints.add(terms.getContext().mkFalse());
            } else if (eqs.size() == 1) {
                constraints.add((BoolExpr) eqs.get(0));
            } else {
                constraints.add(terms.mkOr(eqs.toArray(new Expr[0])));
            }
        }
        return terms.conjoin(constraints);
    }

    public List<Expr> sourceTerms(Expr witness) {
        Set<Expr> sources = valueToTerms.get(witness);
        return sources == null ? List.of() : List.copyOf(sources);
    }

    public List<Expr> valuesOfType(Sort sort) {
        Set<Expr> known = typeToValues.get(sort);
        return known == null ? List.of() : List.copyOf(known);
    }

    public OptionalInt priority(Expr t) {
        Integer p = priority.get(t);
        return p == null ? OptionalInt.empty() : OptionalInt.of(p);
    }

    /**
     * Memoized representative, null when none has been chosen.
     */
    public Expr representative(Expr witness) {
        return representative.get(witness);
    }

    public Expr witness(int value) {
        return valueIdToTerm.get(value);
    }

    public Set<Expr> getWitnesses() {
        return Collections.unmodifiableSet(valueToTerms.keySet());
    }

    public ValueTableSnapshot snapshot() {
        Map<String, List<String>> types = new LinkedHashMap<>();
        typeToValues.forEach((sort, known) -> types.put(sort.toString(), toStrings(known)));

        Map<String, String> values = new LinkedHashMap<>();
        valueIdToTerm.forEach((id, witness) -> values.put(String.valueOf(id), witness.toString()));

        Map<String, Integer> priorities = new LinkedHashMap<>();
        priority.forEach((t, p) -> priorities.put(t.toString(), p));

        Map<String, List<String>> valueTerms = new LinkedHashMap<>();
        valueToTerms.forEach((witness, sources) -> valueTerms.put(witness.toString(), toStrings(sources)));

        Map<String, String> representatives = new LinkedHashMap<>();
        representative.forEach((witness, rep) -> representatives.put(witness.toString(), rep.toString()));

        return new ValueTableSnapshot(types, values, priorities, valueTerms, representatives);
    }

    private static List<String> toStrings(Collection<Expr> exprs) {
        List<String> result = new ArrayList<>(exprs.size());
        for (Expr e : exprs) {
            result.add(e.toString());
        }
        return result;
    }
}
