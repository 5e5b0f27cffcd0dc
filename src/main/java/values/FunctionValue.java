package values;

import com.microsoft.z3.Sort;

import java.util.Arrays;
import java.util.List;

/**
 * Finite function interpretation: explicit entries plus an optional default.
 */
public class FunctionValue {
    private final Sort[] domain;
    private final Sort range;
    private final List<Entry> entries;
    private final int defaultValue;

    public FunctionValue(Sort[] domain, Sort range, List<Entry> entries, int defaultValue) {
        this.domain = domain.clone();
        this.range = range;
        this.entries = List.copyOf(entries);
        this.defaultValue = defaultValue;
        for (Entry entry : this.entries) {
            if (entry.getArity() != domain.length) {
                throw new IllegalArgumentException("entry arity " + entry.getArity() + " does not match function arity " + domain.length);
            }
        }
    }

    public Sort[] getDomain() {
        return domain.clone();
    }

    public Sort getRange() {
        return range;
    }

    public int getArity() {
        return domain.length;
    }

    public List<Entry> getEntries() {
        return entries;
    }

    public int getDefaultValue() {
        return defaultValue;
    }

    public boolean hasDefault() {
        return defaultValue != ValueStore.UNKNOWN;
    }

    public static class Entry {
        private final int[] args;
        private final int result;

        public Entry(int[] args, int result) {
            this.args = args.clone();
            this.result = result;
        }

        public int[] getArgs() {
            return args.clone();
        }

        public int getArg(int i) {
            return args[i];
        }

        public int getArity() {
            return args.length;
        }

        public int getResult() {
            return result;
        }

        @Override
        public String toString() {
            return Arrays.toString(args) + " -> " + result;
        }
    }
}
