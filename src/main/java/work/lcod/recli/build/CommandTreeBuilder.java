package work.lcod.recli.build;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
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
 * Derives a command tree from the fields of a live object.
 *
 * <p>Each visible field becomes a {@code PROPERTIES} node named through the configured converter:
 * scalars get {@code get}/{@code set}, nested records recurse, lists and maps get their collection
 * commands. Every level also gets a dump command for the whole (sub-)record. Leaf actions read and
 * write the object passed to {@link #construct(Object)} in place.
 */
public final class CommandTreeBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(CommandTreeBuilder.class);

    private final RecliConfiguration config;
    private final ValueClassifier classifier;
    private final ScalarCodec codec;
    private final BlobCodec blobs;
    private final DefaultsEngine defaults;
    private final SequenceCommands sequences;
    private final MapCommands maps;

    public CommandTreeBuilder(RecliConfiguration config) {
        this.config = Objects.requireNonNull(config, "config");
        this.classifier = new ValueClassifier(config::codecFor);
        this.codec = new ScalarCodec(classifier);
        this.blobs = new BlobCodec(config.serializationFormat(), config.codecs());
        this.defaults = new DefaultsEngine(classifier, codec);
        this.sequences = new SequenceCommands(this, config, classifier, codec, blobs, defaults);
        this.maps = new MapCommands(config, classifier, codec);
    }

    public RecliConfiguration configuration() {
        return config;
    }

    public DefaultsEngine defaults() {
        return defaults;
    }

    public BlobCodec blobs() {
        return blobs;
    }

    /**
     * Builds the full tree for {@code record}, or fails without returning a partial tree.
     *
     * @throws RecliException {@code INVALID_INPUT} when {@code record} is not a mutable record object,
     *     or the first construction error wrapped with the path of the offending field
     */
    public List<CommandNode> construct(Object record) {
        if (record == null) {
            throw new RecliException(RecliException.Kind.INVALID_INPUT, "expected a record object, got null");
        }
        Class<?> type = record.getClass();
        if (!ValueClassifier.isRecordClass(type) || classifier.codecFor(type) != null) {
            throw new RecliException(RecliException.Kind.INVALID_INPUT, "expected a record object, got: " + type.getName());
        }
        if (type.isRecord()) {
            throw new RecliException(
                RecliException.Kind.INVALID_INPUT,
                "expected a mutable record object, got immutable: " + type.getName()
            );
        }
        List<CommandNode> tree = recordCommands(record, DefaultsEngine.newVisitedSet());
        LOG.debug("Built {} top-level commands for {}", tree.size(), type.getName());
        return tree;
    }

    List<CommandNode> recordCommands(Object record, Set<Object> path) {
        path.add(record);
        try {
            var cmds = new ArrayList<CommandNode>();
            for (FieldDescriptor field : FieldDescriptor.visibleFields(record.getClass())) {
                if (field.hasTag(config.skipTag())) {
                    LOG.trace("Skipping tagged field {}", field.name());
                    continue;
                }
                List<CommandNode> children;
                try {
                    children = valueCommands(field.bind(record), path);
                } catch (RecliException ex) {
                    throw ex.withField(field.name());
                }
                cmds.add(CommandNode.group(
                    config.fieldNameConverter().convert(field.name()),
                    field.tag(config.usageTagName()).orElse(""),
                    CommandNode.PROPERTIES,
                    children
                ));
            }
            cmds.add(dumpCommand(record));
            return cmds;
        } finally {
            path.remove(record);
        }
    }

    List<CommandNode> valueCommands(Binding binding, Set<Object> path) {
        FieldShape shape = classifier.classify(binding.type());
        LOG.trace("Classified {} as {}", binding.type().getTypeName(), shape.getClass().getSimpleName());
        if (shape.isScalar()) {
            return scalarCommands(binding);
        }
        if (shape instanceof FieldShape.MappingShape mapping) {
            return maps.build(binding, mapping);
        }
        if (shape instanceof FieldShape.SequenceShape sequence) {
            return sequences.build(binding, sequence, path);
        }
        var record = (FieldShape.RecordShape) shape;
        Object value = binding.get();
        if (value == null) {
            throw RecliException.unsupportedKind("null " + record.type().getName());
        }
        if (path.contains(value)) {
            throw RecliException.unsupportedKind("cyclic reference to " + record.type().getName());
        }
        return recordCommands(value, path);
    }

    private List<CommandNode> scalarCommands(Binding binding) {
        var cmds = new ArrayList<CommandNode>(2);
        cmds.add(CommandNode.action("get", "Get the value", "", Arity.expect(0, invocation ->
            config.valuePrinter().print(codec.read(binding))
        )));
        if (binding.settable()) {
            cmds.add(CommandNode.action("set", "Set the value", "[value]", Arity.expect(1, invocation ->
                codec.write(binding, invocation.arg(0))
            )));
        }
        return cmds;
    }

    private CommandNode dumpCommand(Object record) {
        String format = blobs.format().id();
        return CommandNode.action(
            "dump-" + format,
            "Dump item as " + format.toUpperCase(Locale.ROOT),
            "",
            Arity.expect(0, invocation -> config.valuePrinter().print(blobs.encode(record)))
        );
    }
}
