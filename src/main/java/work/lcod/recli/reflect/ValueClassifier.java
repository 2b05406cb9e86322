package work.lcod.recli.reflect;

import java.lang.reflect.Array;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import work.lcod.recli.api.RecliException;
import work.lcod.recli.api.TextCodec;

/**
 * Reduces a declared type to one of the {@link FieldShape} variants.
 */
public final class ValueClassifier {
    private static final List<String> PLATFORM_PACKAGES = List.of("java.", "javax.", "jdk.", "sun.", "com.sun.");

    private final Function<Class<?>, TextCodec<?>> codecs;

    public ValueClassifier(Function<Class<?>, TextCodec<?>> codecs) {
        this.codecs = Objects.requireNonNull(codecs, "codecs");
    }

    public FieldShape classify(Type type) {
        return tryClassify(type).orElseThrow(() -> RecliException.unsupportedKind(type.getTypeName()));
    }

    /**
     * Like {@link #classify(Type)} but empty for types without a defined handling.
     */
    public Optional<FieldShape> tryClassify(Type type) {
        Class<?> raw = rawType(type);
        if (raw == null) {
            return Optional.empty();
        }

        // a codec wins over the raw kind so enum-like values keep their symbolic names
        TextCodec<?> codec = codecFor(raw);
        if (codec != null) {
            return Optional.of(new FieldShape.CodecShape(raw, codec));
        }

        ScalarKind kind = ScalarKind.of(raw);
        if (kind != null) {
            return Optional.of(new FieldShape.ScalarShape(raw, kind));
        }
        if (raw.isArray()) {
            Type component = type instanceof GenericArrayType generic
                ? generic.getGenericComponentType()
                : raw.getComponentType();
            return Optional.of(new FieldShape.SequenceShape(type, component, true));
        }
        if (List.class.isAssignableFrom(raw)) {
            return Optional.ofNullable(typeArgument(type, List.class, 0))
                .map(element -> new FieldShape.SequenceShape(type, element, false));
        }
        if (Map.class.isAssignableFrom(raw)) {
            Type key = typeArgument(type, Map.class, 0);
            Type value = typeArgument(type, Map.class, 1);
            if (key == null || value == null) {
                return Optional.empty();
            }
            return Optional.of(new FieldShape.MappingShape(type, key, value));
        }
        if (isRecordClass(raw)) {
            return Optional.of(new FieldShape.RecordShape(raw));
        }
        return Optional.empty();
    }

    public TextCodec<?> codecFor(Class<?> raw) {
        TextCodec<?> codec = codecs.apply(raw);
        if (codec == null && raw.isEnum()) {
            codec = EnumTextCodec.of(raw);
        }
        return codec;
    }

    /**
     * Concrete user classes with fields the builder can walk.
     */
    public static boolean isRecordClass(Class<?> type) {
        if (type.isPrimitive() || type.isArray() || type.isInterface() || type.isEnum()
            || type.isAnnotation() || Modifier.isAbstract(type.getModifiers())) {
            return false;
        }
        if (Collection.class.isAssignableFrom(type) || Map.class.isAssignableFrom(type)) {
            return false;
        }
        String name = type.getName();
        for (String prefix : PLATFORM_PACKAGES) {
            if (name.startsWith(prefix)) {
                return false;
            }
        }
        return true;
    }

    public static Class<?> rawType(Type type) {
        if (type instanceof Class<?> cls) {
            return cls;
        }
        if (type instanceof ParameterizedType parameterized) {
            return rawType(parameterized.getRawType());
        }
        if (type instanceof GenericArrayType array) {
            Class<?> component = rawType(array.getGenericComponentType());
            return component == null ? null : Array.newInstance(component, 0).getClass();
        }
        if (type instanceof WildcardType wildcard) {
            return rawType(wildcard.getUpperBounds()[0]);
        }
        return null;
    }

    /**
     * Resolves the {@code index}-th type argument of {@code target} as seen from {@code type}, looking
     * through concrete subclasses such as {@code class Ports extends ArrayList<Integer>}.
     */
    static Type typeArgument(Type type, Class<?> target, int index) {
        if (type instanceof ParameterizedType parameterized) {
            Class<?> raw = rawType(parameterized.getRawType());
            boolean platform = raw.getName().startsWith("java.");
            if (raw == target || (platform && raw.getTypeParameters().length == target.getTypeParameters().length)) {
                return concrete(parameterized.getActualTypeArguments()[index]);
            }
            return typeArgument(raw, target, index);
        }
        if (type instanceof Class<?> cls) {
            if (cls.getGenericSuperclass() != null && target.isAssignableFrom(rawOrObject(cls.getGenericSuperclass()))) {
                Type found = typeArgument(cls.getGenericSuperclass(), target, index);
                if (found != null) {
                    return found;
                }
            }
            for (Type iface : cls.getGenericInterfaces()) {
                if (target.isAssignableFrom(rawOrObject(iface))) {
                    Type found = typeArgument(iface, target, index);
                    if (found != null) {
                        return found;
                    }
                }
            }
        }
        return null;
    }

    private static Class<?> rawOrObject(Type type) {
        Class<?> raw = rawType(type);
        return raw == null ? Object.class : raw;
    }

    private static Type concrete(Type argument) {
        if (argument instanceof WildcardType wildcard) {
            return concrete(wildcard.getUpperBounds()[0]);
        }
        if (argument instanceof TypeVariable<?>) {
            return null;
        }
        return argument;
    }
}
