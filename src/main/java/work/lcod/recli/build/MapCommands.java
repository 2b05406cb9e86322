package work.lcod.recli.build;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.recli.api.RecliConfiguration;
import work.lcod.recli.api.RecliException;
import work.lcod.recli.reflect.Binding;
import work.lcod.recli.reflect.FieldShape;
import work.lcod.recli.reflect.ScalarCodec;
import work.lcod.recli.reflect.ValueClassifier;
import work.lcod.recli.tree.Arity;
import work.lcod.recli.tree.CommandNode;

/**
 * {@code dump}/{@code get}/{@code set}/{@code unset} commands for a map of scalars.
 */
public final class MapCommands {
    /**
     * Printed by {@code get} when the key is absent.
     */
    public static final String NOT_FOUND = "<not found>";

    private final RecliConfiguration config;
    private final ValueClassifier classifier;
    private final ScalarCodec codec;

    MapCommands(RecliConfiguration config, ValueClassifier classifier, ScalarCodec codec) {
        this.config = config;
        this.classifier = classifier;
        this.codec = codec;
    }

    List<CommandNode> build(Binding binding, FieldShape.MappingShape shape) {
        if (!classifier.classify(shape.keyType()).isScalar()) {
            throw RecliException.unsupportedKind("map key " + shape.keyType().getTypeName());
        }
        if (!classifier.classify(shape.valueType()).isScalar()) {
            throw RecliException.unsupportedKind("map value " + shape.valueType().getTypeName());
        }

        return List.of(
            CommandNode.action("dump", "Dump all keys and their values", "", Arity.expect(0, invocation -> {
                Map<?, ?> map = (Map<?, ?>) binding.get();
                if (map == null) {
                    return;
                }
                for (Map.Entry<?, ?> entry : map.entrySet()) {
                    config.keyValuePrinter().print(
                        codec.format(shape.keyType(), entry.getKey()),
                        codec.format(shape.valueType(), entry.getValue())
                    );
                }
            })),
            CommandNode.action("get", "Get the value of a given key", "[key]", Arity.expect(1, invocation -> {
                Object key = codec.parse(shape.keyType(), invocation.arg(0));
                Map<?, ?> map = (Map<?, ?>) binding.get();
                if (map == null || !map.containsKey(key)) {
                    config.valuePrinter().print(NOT_FOUND);
                    return;
                }
                config.valuePrinter().print(codec.format(shape.valueType(), map.get(key)));
            })),
            CommandNode.action("set", "Set the key to the given value", "[key] [value]", Arity.expect(2, invocation -> {
                Object key = codec.parse(shape.keyType(), invocation.arg(0));
                Object value = codec.parse(shape.valueType(), invocation.arg(1));
                Containers.<Map<Object, Object>>mutate(binding, existing -> copy(shape, existing), map -> map.put(key, value));
            })),
            CommandNode.action("unset", "Remove the key from the map", "[key]", Arity.expect(1, invocation -> {
                Object key = codec.parse(shape.keyType(), invocation.arg(0));
                Map<?, ?> map = (Map<?, ?>) binding.get();
                if (map == null || !map.containsKey(key)) {
                    return;
                }
                Containers.<Map<Object, Object>>mutate(binding, existing -> copy(shape, existing), entries -> entries.remove(key));
            }))
        );
    }

    private static Map<Object, Object> copy(FieldShape.MappingShape shape, Map<Object, Object> existing) {
        Map<Object, Object> copy = Containers.newContainer(shape.type(), LinkedHashMap::new);
        if (existing != null) {
            copy.putAll(existing);
        }
        return copy;
    }
}
