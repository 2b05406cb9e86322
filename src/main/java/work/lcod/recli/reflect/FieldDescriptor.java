package work.lcod.recli.reflect;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import work.lcod.recli.api.FieldTag;
import work.lcod.recli.api.TagSpec;

/**
 * Read-only view of one record field and its tags, created fresh for every tree build.
 */
public record FieldDescriptor(Field field, List<FieldTag> tags) {
    public FieldDescriptor {
        tags = List.copyOf(tags);
    }

    /**
     * Declared instance fields of {@code type} that can be bound: static, transient and synthetic
     * fields are left out, as are fields the module system keeps us from opening. Inherited fields
     * are not listed.
     */
    public static List<FieldDescriptor> visibleFields(Class<?> type) {
        var fields = new ArrayList<FieldDescriptor>();
        for (Field field : type.getDeclaredFields()) {
            int modifiers = field.getModifiers();
            if (Modifier.isStatic(modifiers) || Modifier.isTransient(modifiers) || field.isSynthetic()) {
                continue;
            }
            if (!field.trySetAccessible()) {
                continue;
            }
            fields.add(new FieldDescriptor(field, List.of(field.getAnnotationsByType(FieldTag.class))));
        }
        return fields;
    }

    public String name() {
        return field.getName();
    }

    public Type type() {
        return field.getGenericType();
    }

    public boolean settable() {
        return !Modifier.isFinal(field.getModifiers());
    }

    public boolean hasTag(TagSpec spec) {
        for (FieldTag tag : tags) {
            if (!tag.name().equals(spec.name())) {
                continue;
            }
            for (String entry : tag.value().split(",", -1)) {
                if (entry.equals(spec.value())) {
                    return true;
                }
            }
        }
        return false;
    }

    public Optional<String> tag(String name) {
        return tags.stream()
            .filter(tag -> tag.name().equals(name))
            .map(FieldTag::value)
            .findFirst();
    }

    public Binding bind(Object owner) {
        return new Binding(
            type(),
            () -> read(owner),
            settable() ? value -> write(owner, value) : null
        );
    }

    public Object read(Object owner) {
        try {
            return field.get(owner);
        } catch (IllegalAccessException ex) {
            throw new IllegalStateException("Cannot read field " + name(), ex);
        }
    }

    private void write(Object owner, Object value) {
        try {
            field.set(owner, value);
        } catch (IllegalAccessException ex) {
            throw new IllegalStateException("Cannot write field " + name(), ex);
        }
    }
}
