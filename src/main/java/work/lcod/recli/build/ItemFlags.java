package work.lcod.recli.build;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import work.lcod.recli.api.RecliConfiguration;
import work.lcod.recli.api.RecliException;
import work.lcod.recli.reflect.FieldDescriptor;
import work.lcod.recli.reflect.FieldShape;
import work.lcod.recli.reflect.ScalarCodec;
import work.lcod.recli.reflect.ValueClassifier;
import work.lcod.recli.tree.FlagSpec;
import work.lcod.recli.tree.FlagType;
import work.lcod.recli.tree.Invocation;

/**
 * Flags of the flag-based {@code add} command: one per settable scalar field of the item type and one
 * multi-value flag per list of scalars. Other fields get no flag.
 */
final class ItemFlags {
    private final RecliConfiguration config;
    private final ValueClassifier classifier;
    private final ScalarCodec codec;

    ItemFlags(RecliConfiguration config, ValueClassifier classifier, ScalarCodec codec) {
        this.config = config;
        this.classifier = classifier;
        this.codec = codec;
    }

    List<FlagSpec> flagsFor(Class<?> itemType) {
        var flags = new ArrayList<FlagSpec>();
        for (FieldDescriptor field : flagFields(itemType)) {
            flagType(field).ifPresent(type -> flags.add(new FlagSpec(flagName(field), type, usage(field))));
        }
        return flags;
    }

    /**
     * Copies the flags present in {@code invocation} onto {@code item}; fields without a flag keep their value.
     */
    void apply(Object item, Invocation invocation) {
        for (FieldDescriptor field : flagFields(item.getClass())) {
            String name = flagName(field);
            if (!invocation.isSet(name) || flagType(field).isEmpty()) {
                continue;
            }
            Object flagValue = invocation.flag(name);
            try {
                FieldShape shape = classifier.classify(field.type());
                if (shape instanceof FieldShape.SequenceShape sequence) {
                    var elements = new ArrayList<Object>();
                    for (Object element : (List<?>) flagValue) {
                        elements.add(codec.parse(sequence.elementType(), String.valueOf(element)));
                    }
                    field.bind(item).set(SequenceAccess.create(sequence, elements));
                } else {
                    codec.write(field.bind(item), String.valueOf(flagValue));
                }
            } catch (RecliException ex) {
                throw ex.withField(name);
            }
        }
    }

    private List<FieldDescriptor> flagFields(Class<?> itemType) {
        var fields = new ArrayList<FieldDescriptor>();
        for (FieldDescriptor field : FieldDescriptor.visibleFields(itemType)) {
            if (field.settable() && !field.hasTag(config.skipTag())) {
                fields.add(field);
            }
        }
        return fields;
    }

    private String flagName(FieldDescriptor field) {
        return config.fieldNameConverter().convert(field.name());
    }

    private String usage(FieldDescriptor field) {
        Optional<String> defaultValue = field.tag(config.defaultTagName());
        if (defaultValue.isPresent()) {
            return "default value: " + defaultValue.get();
        }
        return field.tag(config.usageTagName()).orElse("");
    }

    private Optional<FlagType> flagType(FieldDescriptor field) {
        Optional<FieldShape> shape = classifier.tryClassify(field.type());
        if (shape.isEmpty()) {
            return Optional.empty();
        }
        if (shape.get().isScalar()) {
            return Optional.of(scalarFlagType(shape.get(), false));
        }
        if (shape.get() instanceof FieldShape.SequenceShape sequence) {
            return classifier.tryClassify(sequence.elementType())
                .filter(FieldShape::isScalar)
                .map(element -> scalarFlagType(element, true));
        }
        return Optional.empty();
    }

    private static FlagType scalarFlagType(FieldShape shape, boolean list) {
        if (!(shape instanceof FieldShape.ScalarShape scalar)) {
            return list ? FlagType.STRING_LIST : FlagType.STRING;
        }
        return switch (scalar.kind()) {
            case BOOLEAN -> list ? FlagType.BOOLEAN_LIST : FlagType.BOOLEAN;
            case INTEGER -> list ? FlagType.INTEGER_LIST : FlagType.INTEGER;
            case FLOAT -> list ? FlagType.FLOAT_LIST : FlagType.FLOAT;
            case STRING -> list ? FlagType.STRING_LIST : FlagType.STRING;
        };
    }
}
