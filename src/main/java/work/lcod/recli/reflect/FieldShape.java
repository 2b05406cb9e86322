package work.lcod.recli.reflect;

import java.lang.reflect.Type;
import work.lcod.recli.api.TextCodec;

/**
 * Storage shape of a field, element, key or value, as decided by {@link ValueClassifier}.
 */
public sealed interface FieldShape {
    Type type();

    default boolean isScalar() {
        return this instanceof ScalarShape || this instanceof CodecShape;
    }

    record ScalarShape(Class<?> type, ScalarKind kind) implements FieldShape {}

    record CodecShape(Class<?> type, TextCodec<?> codec) implements FieldShape {}

    record RecordShape(Class<?> type) implements FieldShape {}

    /**
     * A {@code List<E>} or an {@code E[]}.
     */
    record SequenceShape(Type type, Type elementType, boolean array) implements FieldShape {}

    record MappingShape(Type type, Type keyType, Type valueType) implements FieldShape {}
}
