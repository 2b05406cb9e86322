package work.lcod.recli.build;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.List;
import work.lcod.recli.api.RecliException;
import work.lcod.recli.reflect.Binding;
import work.lcod.recli.reflect.FieldShape;
import work.lcod.recli.reflect.ValueClassifier;

/**
 * Index-based view over a list or array field. Every call goes back to the binding, so the view
 * follows the field even when the collection instance is replaced.
 */
final class SequenceAccess {
    private final Binding binding;
    private final FieldShape.SequenceShape shape;

    SequenceAccess(Binding binding, FieldShape.SequenceShape shape) {
        this.binding = binding;
        this.shape = shape;
    }

    int size() {
        Object current = binding.get();
        if (current == null) {
            return 0;
        }
        return shape.array() ? Array.getLength(current) : ((List<?>) current).size();
    }

    Object get(int index) {
        Object current = binding.get();
        return shape.array() ? Array.get(current, index) : ((List<?>) current).get(index);
    }

    void set(int index, Object value) {
        if (shape.array()) {
            Array.set(binding.get(), index, value);
            return;
        }
        Containers.<List<Object>>mutate(binding, this::copyList, list -> list.set(index, value));
    }

    void append(Object value) {
        if (shape.array()) {
            Object current = binding.get();
            int length = current == null ? 0 : Array.getLength(current);
            Object grown = newArray(length + 1);
            if (current != null) {
                System.arraycopy(current, 0, grown, 0, length);
            }
            Array.set(grown, length, value);
            binding.set(grown);
            return;
        }
        Containers.<List<Object>>mutate(binding, this::copyList, list -> list.add(value));
    }

    /**
     * Removes one element; the remaining elements keep their relative order.
     */
    void remove(int index) {
        if (index < 0 || index >= size()) {
            throw new RecliException(RecliException.Kind.NOT_FOUND, "no item at index " + index);
        }
        if (shape.array()) {
            Object current = binding.get();
            int length = Array.getLength(current);
            Object shrunk = newArray(length - 1);
            System.arraycopy(current, 0, shrunk, 0, index);
            System.arraycopy(current, index + 1, shrunk, index, length - index - 1);
            binding.set(shrunk);
            return;
        }
        Containers.<List<Object>>mutate(binding, this::copyList, list -> list.remove(index));
    }

    Binding elementBinding(int index) {
        return new Binding(shape.elementType(), () -> get(index), value -> set(index, value));
    }

    /**
     * Builds a value for a sequence of {@code shape}'s declared type holding {@code elements}.
     */
    static Object create(FieldShape.SequenceShape shape, List<?> elements) {
        if (shape.array()) {
            Object array = Array.newInstance(ValueClassifier.rawType(shape.elementType()), elements.size());
            for (int i = 0; i < elements.size(); i++) {
                Array.set(array, i, elements.get(i));
            }
            return array;
        }
        List<Object> list = Containers.newContainer(shape.type(), ArrayList::new);
        list.addAll(elements);
        return list;
    }

    private List<Object> copyList(List<Object> existing) {
        List<Object> copy = Containers.newContainer(shape.type(), ArrayList::new);
        if (existing != null) {
            copy.addAll(existing);
        }
        return copy;
    }

    private Object newArray(int length) {
        return Array.newInstance(ValueClassifier.rawType(shape.elementType()), length);
    }
}
