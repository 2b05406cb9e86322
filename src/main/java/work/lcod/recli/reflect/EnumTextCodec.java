package work.lcod.recli.reflect;

import java.util.Arrays;
import java.util.stream.Collectors;
import work.lcod.recli.api.TextCodec;

/**
 * Codec used for any enum without a registered one: the symbolic name is the constant's {@code toString()},
 * the constant's {@code name()} is also accepted when parsing.
 */
final class EnumTextCodec implements TextCodec<Object> {
    private final Class<?> type;
    private final Object[] constants;

    private EnumTextCodec(Class<?> type) {
        this.type = type;
        this.constants = type.getEnumConstants();
    }

    static EnumTextCodec of(Class<?> type) {
        if (!type.isEnum()) {
            throw new IllegalArgumentException(type.getName() + " is not an enum");
        }
        return new EnumTextCodec(type);
    }

    @Override
    public String marshal(Object value) {
        return value.toString();
    }

    @Override
    public Object unmarshal(String text) {
        for (Object constant : constants) {
            if (constant.toString().equals(text)) {
                return constant;
            }
        }
        for (Object constant : constants) {
            if (((Enum<?>) constant).name().equals(text)) {
                return constant;
            }
        }
        String expected = Arrays.stream(constants).map(Object::toString).collect(Collectors.joining(", "));
        throw new IllegalArgumentException(
            "invalid " + type.getSimpleName() + " value \"" + text + "\", expected one of: " + expected
        );
    }
}
