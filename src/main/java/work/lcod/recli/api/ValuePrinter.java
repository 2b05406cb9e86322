package work.lcod.recli.api;

/**
 * Sink for single values printed by leaf actions.
 */
@FunctionalInterface
public interface ValuePrinter {
    void print(Object value);
}
