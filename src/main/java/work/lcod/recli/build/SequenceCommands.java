package work.lcod.recli.build;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.IntFunction;
import work.lcod.recli.api.RecliConfiguration;
import work.lcod.recli.api.RecliException;
import work.lcod.recli.reflect.Binding;
import work.lcod.recli.reflect.FieldDescriptor;
import work.lcod.recli.reflect.FieldShape;
import work.lcod.recli.reflect.ScalarCodec;
import work.lcod.recli.reflect.ValueClassifier;
import work.lcod.recli.serial.BlobCodec;
import work.lcod.recli.tree.Arity;
import work.lcod.recli.tree.CommandNode;

/**
 * Commands for a list or array field: one node per item (keyed by index or by the item's id field),
 * {@code list}, and the {@code add} variants matching the item kind.
 */
final class SequenceCommands {
    private final CommandTreeBuilder builder;
    private final RecliConfiguration config;
    private final ValueClassifier classifier;
    private final ScalarCodec codec;
    private final BlobCodec blobs;
    private final DefaultsEngine defaults;
    private final ItemFlags itemFlags;

    SequenceCommands(
        CommandTreeBuilder builder,
        RecliConfiguration config,
        ValueClassifier classifier,
        ScalarCodec codec,
        BlobCodec blobs,
        DefaultsEngine defaults
    ) {
        this.builder = builder;
        this.config = config;
        this.classifier = classifier;
        this.codec = codec;
        this.blobs = blobs;
        this.defaults = defaults;
        this.itemFlags = new ItemFlags(config, classifier, codec);
    }

    List<CommandNode> build(Binding binding, FieldShape.SequenceShape shape, Set<Object> path) {
        FieldShape element = classifier.classify(shape.elementType());
        if (!element.isScalar() && !(element instanceof FieldShape.RecordShape)) {
            throw RecliException.unsupportedKind("collection of " + shape.elementType().getTypeName());
        }

        var access = new SequenceAccess(binding, shape);
        IntFunction<String> keyer = keyer(access, element);
        var cmds = new ArrayList<CommandNode>(access.size() + 3);
        for (int i = 0; i < access.size(); i++) {
            int index = i;
            String key = keyer.apply(index);
            var itemCmds = new ArrayList<CommandNode>();
            try {
                itemCmds.addAll(builder.valueCommands(access.elementBinding(index), path));
            } catch (RecliException ex) {
                throw ex.withField(key);
            }
            itemCmds.add(CommandNode.action(
                "delete",
                "Delete item represented by key \"" + key + "\" from the collection",
                "",
                Arity.expect(0, invocation -> access.remove(index))
            ));
            cmds.add(CommandNode.group(key, "", CommandNode.ITEMS, itemCmds));
        }

        cmds.add(CommandNode.action("list", "List item keys in the collection", "", Arity.expect(0, invocation -> {
            for (int i = 0; i < access.size(); i++) {
                config.valuePrinter().print(keyer.apply(i));
            }
        })));

        if (element.isScalar()) {
            cmds.add(CommandNode.action("add", "Add a new item to collection", "[value]", Arity.expect(1, invocation ->
                access.append(codec.parse(shape.elementType(), invocation.arg(0)))
            )));
        } else {
            cmds.addAll(itemBuilders(access, shape, ((FieldShape.RecordShape) element).type()));
        }
        return cmds;
    }

    private List<CommandNode> itemBuilders(SequenceAccess access, FieldShape.SequenceShape shape, Class<?> itemType) {
        CommandNode add = CommandNode.action("add", "Add a new item to collection", "-attribute=value", Arity.expect(0, invocation -> {
            if (invocation.flagCount() == 0) {
                throw new RecliException(RecliException.Kind.NO_PROPERTIES_SPECIFIED, "no properties specified");
            }
            Object item = Containers.newInstance(itemType);
            defaults.applyDefaults(item, config.defaultTagName());
            itemFlags.apply(item, invocation);
            access.append(item);
        })).withFlags(itemFlags.flagsFor(itemType));

        String format = blobs.format().id();
        CommandNode addBlob = CommandNode.action(
            "add-" + format,
            "Add a new item to collection deserialised from " + format.toUpperCase(Locale.ROOT),
            "[value]",
            Arity.expect(1, invocation -> {
                Object item = blobs.decode(invocation.arg(0), shape.elementType());
                access.append(item != null ? item : Containers.newInstance(itemType));
            })
        );
        return List.of(add, addBlob);
    }

    /**
     * Item keys are positional indexes unless the item type has exactly one field with the id tag,
     * in which case that field's text is used.
     */
    private IntFunction<String> keyer(SequenceAccess access, FieldShape element) {
        if (element instanceof FieldShape.RecordShape record) {
            List<FieldDescriptor> ids = FieldDescriptor.visibleFields(record.type()).stream()
                .filter(field -> field.hasTag(config.idTag()))
                .toList();
            if (ids.size() == 1) {
                FieldDescriptor id = ids.get(0);
                if (!classifier.classify(id.type()).isScalar()) {
                    throw RecliException.unsupportedKind("id field " + id.name() + " of type " + id.type().getTypeName());
                }
                return index -> {
                    Object item = access.get(index);
                    return item == null ? String.valueOf(index) : codec.format(id.type(), id.read(item));
                };
            }
        }
        return String::valueOf;
    }
}
