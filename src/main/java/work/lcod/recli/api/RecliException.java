package work.lcod.recli.api;

/**
 * Failure raised while building a command tree or running one of its leaf actions.
 */
public final class RecliException extends RuntimeException {
    private final Kind kind;

    public RecliException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RecliException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Prefixes the message with the field the failure was found under, keeping the kind.
     */
    public RecliException withField(String fieldName) {
        return new RecliException(kind, fieldName + ": " + getMessage(), this);
    }

    public static RecliException unsupportedKind(String what) {
        return new RecliException(Kind.UNSUPPORTED_KIND, "unsupported kind: " + what);
    }

    public static RecliException conversion(String message, Throwable cause) {
        return new RecliException(Kind.CONVERSION, message, cause);
    }

    public enum Kind {
        INVALID_INPUT,
        UNSUPPORTED_KIND,
        CONVERSION,
        WRONG_ARITY,
        NO_PROPERTIES_SPECIFIED,
        NOT_FOUND
    }
}
