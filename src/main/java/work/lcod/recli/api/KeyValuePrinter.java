package work.lcod.recli.api;

/**
 * Sink for key/value pairs printed by map dumps.
 */
@FunctionalInterface
public interface KeyValuePrinter {
    void print(Object key, Object value);
}
