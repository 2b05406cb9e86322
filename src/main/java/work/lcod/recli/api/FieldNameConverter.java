package work.lcod.recli.api;

/**
 * Maps a declared field name to the command (and flag) name exposed on the command line.
 */
@FunctionalInterface
public interface FieldNameConverter {
    String convert(String fieldName);
}
