package work.lcod.recli.tree;

/**
 * Value types a flag can be declared with. List variants accept repeated or comma separated values.
 */
public enum FlagType {
    BOOLEAN(false),
    STRING(false),
    INTEGER(false),
    FLOAT(false),
    BOOLEAN_LIST(true),
    STRING_LIST(true),
    INTEGER_LIST(true),
    FLOAT_LIST(true);

    private final boolean multiValue;

    FlagType(boolean multiValue) {
        this.multiValue = multiValue;
    }

    public boolean multiValue() {
        return multiValue;
    }
}
