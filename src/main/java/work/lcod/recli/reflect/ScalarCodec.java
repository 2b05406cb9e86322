package work.lcod.recli.reflect;

import java.lang.reflect.Type;
import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import work.lcod.recli.api.RecliException;
import work.lcod.recli.api.TextCodec;

/**
 * Converts between command line text and typed scalar values, delegating to a {@link TextCodec}
 * when the type has one.
 */
public final class ScalarCodec {
    private static final Set<String> TRUE_LITERALS = Set.of("1", "t", "T", "TRUE", "true", "True");
    private static final Set<String> FALSE_LITERALS = Set.of("0", "f", "F", "FALSE", "false", "False");
    private static final Map<Class<?>, Integer> INTEGER_BITS = Map.of(
        byte.class, 8,
        Byte.class, 8,
        short.class, 16,
        Short.class, 16,
        int.class, 32,
        Integer.class, 32,
        long.class, 64,
        Long.class, 64
    );

    private final ValueClassifier classifier;

    public ScalarCodec(ValueClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    public String read(Binding binding) {
        return format(binding.type(), binding.get());
    }

    /**
     * Parses {@code text} for the binding's type and stores it. The binding is left unchanged on failure.
     */
    public void write(Binding binding, String text) {
        binding.set(parse(binding.type(), text));
    }

    public String format(Type type, Object value) {
        FieldShape shape = classifier.classify(type);
        if (value == null) {
            return "null";
        }
        if (shape instanceof FieldShape.CodecShape codec) {
            return marshal(codec.codec(), value);
        }
        if (shape instanceof FieldShape.ScalarShape) {
            return String.valueOf(value);
        }
        throw RecliException.unsupportedKind(type.getTypeName());
    }

    public Object parse(Type type, String text) {
        FieldShape shape = classifier.classify(type);
        if (shape instanceof FieldShape.CodecShape codec) {
            return unmarshal(codec.codec(), text);
        }
        if (shape instanceof FieldShape.ScalarShape scalar) {
            return parseScalar(scalar, text);
        }
        throw RecliException.unsupportedKind(type.getTypeName());
    }

    @SuppressWarnings("unchecked")
    private static String marshal(TextCodec<?> codec, Object value) {
        return ((TextCodec<Object>) codec).marshal(value);
    }

    private static Object unmarshal(TextCodec<?> codec, String text) {
        try {
            return codec.unmarshal(text);
        } catch (RecliException ex) {
            throw ex;
        } catch (Exception ex) {
            String message = ex.getMessage() == null || ex.getMessage().isBlank()
                ? "cannot parse \"" + text + "\""
                : ex.getMessage();
            throw RecliException.conversion(message, ex);
        }
    }

    private static Object parseScalar(FieldShape.ScalarShape shape, String text) {
        Class<?> type = shape.type();
        return switch (shape.kind()) {
            case BOOLEAN -> parseBoolean(text);
            case INTEGER -> parseInteger(text, type);
            case FLOAT -> parseFloat(text, type);
            case STRING -> type == char.class || type == Character.class ? parseChar(text) : text;
        };
    }

    private static Character parseChar(String text) {
        if (text.length() != 1) {
            throw RecliException.conversion("expected a single character, got \"" + text + "\"", null);
        }
        return text.charAt(0);
    }

    static Boolean parseBoolean(String text) {
        if (TRUE_LITERALS.contains(text)) {
            return Boolean.TRUE;
        }
        if (FALSE_LITERALS.contains(text)) {
            return Boolean.FALSE;
        }
        throw RecliException.conversion("invalid boolean value \"" + text + "\"", null);
    }

    /**
     * Accepts an optional sign followed by a decimal number or a {@code 0x}, {@code 0o}, {@code 0b}
     * or leading-zero octal literal, then checks it fits the target width.
     */
    static Object parseInteger(String text, Class<?> type) {
        String digits = text;
        boolean negative = false;
        if (digits.startsWith("+") || digits.startsWith("-")) {
            negative = digits.charAt(0) == '-';
            digits = digits.substring(1);
        }
        int radix = 10;
        if (digits.length() > 1 && digits.charAt(0) == '0') {
            char prefix = Character.toLowerCase(digits.charAt(1));
            if (prefix == 'x') {
                radix = 16;
                digits = digits.substring(2);
            } else if (prefix == 'o') {
                radix = 8;
                digits = digits.substring(2);
            } else if (prefix == 'b') {
                radix = 2;
                digits = digits.substring(2);
            } else {
                radix = 8;
                digits = digits.substring(1);
            }
        }
        if (digits.isEmpty() || !digits.chars().allMatch(ch -> ch < 0x80 && Character.isLetterOrDigit(ch))) {
            throw RecliException.conversion("invalid integer value \"" + text + "\"", null);
        }

        BigInteger value;
        try {
            value = new BigInteger(digits, radix);
        } catch (NumberFormatException ex) {
            throw RecliException.conversion("invalid integer value \"" + text + "\"", ex);
        }
        if (negative) {
            value = value.negate();
        }

        int bits = INTEGER_BITS.get(type);
        if (value.bitLength() > bits - 1) {
            throw RecliException.conversion("value overflows " + type.getSimpleName() + ": " + value, null);
        }
        if (bits == 8) {
            return value.byteValue();
        }
        if (bits == 16) {
            return value.shortValue();
        }
        if (bits == 32) {
            return value.intValue();
        }
        return value.longValue();
    }

    static Object parseFloat(String text, Class<?> type) {
        if (text.isEmpty() || !text.strip().equals(text) || endsWithTypeSuffix(text)) {
            throw RecliException.conversion("invalid float value \"" + text + "\"", null);
        }
        double value;
        try {
            value = Double.parseDouble(text);
        } catch (NumberFormatException ex) {
            throw RecliException.conversion("invalid float value \"" + text + "\"", ex);
        }
        if (type == float.class || type == Float.class) {
            float narrowed = (float) value;
            if (Float.isInfinite(narrowed) && !Double.isInfinite(value)) {
                throw RecliException.conversion("value overflows float: " + text, null);
            }
            return narrowed;
        }
        return value;
    }

    private static boolean endsWithTypeSuffix(String text) {
        char last = Character.toLowerCase(text.charAt(text.length() - 1));
        return last == 'f' || last == 'd';
    }
}
