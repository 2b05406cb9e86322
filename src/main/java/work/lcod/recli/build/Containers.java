package work.lcod.recli.build;

import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import work.lcod.recli.api.RecliException;
import work.lcod.recli.reflect.Binding;
import work.lcod.recli.reflect.ValueClassifier;

/**
 * Instantiation and copy-on-write helpers for records, lists and maps reached through bindings.
 */
final class Containers {
    private Containers() {}

    static Object newInstance(Class<?> type) {
        try {
            Constructor<?> constructor = type.getDeclaredConstructor();
            constructor.trySetAccessible();
            return constructor.newInstance();
        } catch (NoSuchMethodException ex) {
            throw new RecliException(
                RecliException.Kind.UNSUPPORTED_KIND,
                "cannot instantiate " + type.getName() + ": no no-arg constructor",
                ex
            );
        } catch (ReflectiveOperationException ex) {
            throw new RecliException(
                RecliException.Kind.UNSUPPORTED_KIND,
                "cannot instantiate " + type.getName() + ": " + ex.getMessage(),
                ex
            );
        }
    }

    /**
     * A fresh container of the declared type when it is concrete, otherwise {@code fallback}.
     */
    @SuppressWarnings("unchecked")
    static <C> C newContainer(Type declared, Supplier<C> fallback) {
        Class<?> raw = ValueClassifier.rawType(declared);
        if (raw != null && !raw.isArray() && !raw.isInterface() && !Modifier.isAbstract(raw.getModifiers())) {
            return (C) newInstance(raw);
        }
        return fallback.get();
    }

    /**
     * Applies {@code change} to the container held by {@code binding}. A missing or unmodifiable
     * container is replaced by {@code copier.apply(current)} when the binding can be written.
     */
    @SuppressWarnings("unchecked")
    static <C> void mutate(Binding binding, Function<C, C> copier, Consumer<C> change) {
        C current = (C) binding.get();
        if (current != null) {
            try {
                change.accept(current);
                return;
            } catch (UnsupportedOperationException ex) {
                if (!binding.settable()) {
                    throw new RecliException(RecliException.Kind.UNSUPPORTED_KIND, "collection is read-only", ex);
                }
            }
        } else if (!binding.settable()) {
            throw new RecliException(RecliException.Kind.UNSUPPORTED_KIND, "collection is null and read-only");
        }
        C replacement = copier.apply(current);
        change.accept(replacement);
        binding.set(replacement);
    }
}
