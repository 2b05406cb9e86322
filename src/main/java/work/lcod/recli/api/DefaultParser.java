package work.lcod.recli.api;

/**
 * Implemented by field values that know how to apply their own default tag.
 */
@FunctionalInterface
public interface DefaultParser {
    void parseDefault(String value) throws Exception;
}
