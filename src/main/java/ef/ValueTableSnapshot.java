package ef;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Printable copy of a value table, keyed by term text.
 */
public class ValueTableSnapshot {
    private final Map<String, List<String>> types;
    private final Map<String, String> values;
    private final Map<String, Integer> priorities;
    private final Map<String, List<String>> valueTerms;
    private final Map<String, String> representatives;

    public ValueTableSnapshot(Map<String, List<String>> types, Map<String, String> values,
                              Map<String, Integer> priorities, Map<String, List<String>> valueTerms,
                              Map<String, String> representatives) {
        this.types = Collections.unmodifiableMap(types);
        this.values = Collections.unmodifiableMap(values);
        this.priorities = Collections.unmodifiableMap(priorities);
        this.valueTerms = Collections.unmodifiableMap(valueTerms);
        this.representatives = Collections.unmodifiableMap(representatives);
    }

    public Map<String, List<String>> getTypes() {
        return types;
    }

    public Map<String, String> getValues() {
        return values;
    }

    public Map<String, Integer> getPriorities() {
        return priorities;
    }

    public Map<String, List<String>> getValueTerms() {
        return valueTerms;
    }

    public Map<String, String> getRepresentatives() {
        return representatives;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("\n== EF VALUE TYPES ==\n");
        types.forEach((type, known) -> sb.append(type).append(" -> ").append(known).append('\n'));
        sb.append("\n== EF VALUES ==\n");
        values.forEach((id, witness) -> sb.append(id).append(" -> ").append(witness).append('\n'));
        sb.append("\n== EF PRIORITY ==\n");
        priorities.forEach((t, p) -> sb.append(t).append(" -> ").append(p).append('\n'));
        sb.append("\n== EF VALUE TERMS ==\n");
        valueTerms.forEach((witness, sources) -> sb.append(witness).append(" -> ").append(sources).append('\n'));
        sb.append("\n== EF REPRESENTATIVES ==\n");
        representatives.forEach((witness, rep) -> sb.append(witness).append(" -> ").append(rep).append('\n'));
        return sb.toString();
    }
}
