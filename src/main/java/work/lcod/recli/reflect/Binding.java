package work.lcod.recli.reflect;

import java.lang.reflect.Type;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;
import work.lcod.recli.api.RecliException;

/**
 * Live accessor pair for one storage location (a field of an object or an element of a collection).
 * Leaf actions read and write through it, so changes land in the caller's object.
 */
public record Binding(Type type, Supplier<Object> getter, Consumer<Object> setter) {
    public Binding {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(getter, "getter");
    }

    public Object get() {
        return getter.get();
    }

    public void set(Object value) {
        if (setter == null) {
            throw new RecliException(RecliException.Kind.UNSUPPORTED_KIND, "value of type " + type.getTypeName() + " is read-only");
        }
        setter.accept(value);
    }

    public boolean settable() {
        return setter != null;
    }
}
