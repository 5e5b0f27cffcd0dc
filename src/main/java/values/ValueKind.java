package values;

public enum ValueKind {
    BOOLEAN,
    RATIONAL,
    ALGEBRAIC,
    BITVECTOR,
    UNINTERPRETED,
    FUNCTION,
    OTHER;

    /**
     * Kinds that take part in per-type value inventories.
     */
    public boolean isSimple() {
        switch (this) {
            case BOOLEAN:
            case RATIONAL:
            case BITVECTOR:
            case UNINTERPRETED:
                return true;
            default:
                return false;
        }
    }
}
