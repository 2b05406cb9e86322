package work.lcod.recli.reflect;

import java.util.Map;

/**
 * Logical scalar kinds. Every integer width maps to {@link #INTEGER}; the width only matters for range checks.
 */
public enum ScalarKind {
    BOOLEAN,
    INTEGER,
    FLOAT,
    STRING;

    private static final Map<Class<?>, ScalarKind> KINDS = Map.ofEntries(
        Map.entry(boolean.class, BOOLEAN),
        Map.entry(Boolean.class, BOOLEAN),
        Map.entry(byte.class, INTEGER),
        Map.entry(Byte.class, INTEGER),
        Map.entry(short.class, INTEGER),
        Map.entry(Short.class, INTEGER),
        Map.entry(int.class, INTEGER),
        Map.entry(Integer.class, INTEGER),
        Map.entry(long.class, INTEGER),
        Map.entry(Long.class, INTEGER),
        Map.entry(float.class, FLOAT),
        Map.entry(Float.class, FLOAT),
        Map.entry(double.class, FLOAT),
        Map.entry(Double.class, FLOAT),
        Map.entry(char.class, STRING),
        Map.entry(Character.class, STRING),
        Map.entry(String.class, STRING)
    );

    /**
     * Returns the kind of {@code type}, or {@code null} when it is not a raw scalar.
     */
    public static ScalarKind of(Class<?> type) {
        return KINDS.get(type);
    }
}
