package work.lcod.recli.build;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.recli.api.DefaultParser;
import work.lcod.recli.api.RecliException;
import work.lcod.recli.reflect.Binding;
import work.lcod.recli.reflect.FieldDescriptor;
import work.lcod.recli.reflect.FieldShape;
import work.lcod.recli.reflect.ScalarCodec;
import work.lcod.recli.reflect.ValueClassifier;

/**
 * Applies tag-declared default values across a record graph.
 *
 * <p>Nested records are visited before any tag on the field itself is looked at, and each record
 * instance is visited at most once, so shared or self-referencing records terminate.
 */
public final class DefaultsEngine {
    private static final Logger LOG = LoggerFactory.getLogger(DefaultsEngine.class);

    private final ValueClassifier classifier;
    private final ScalarCodec codec;

    public DefaultsEngine(ValueClassifier classifier, ScalarCodec codec) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public static Set<Object> newVisitedSet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }

    public void applyDefaults(Object record, String defaultTagName) {
        applyDefaults(record, defaultTagName, newVisitedSet());
    }

    public void applyDefaults(Object record, String defaultTagName, Set<Object> visited) {
        Objects.requireNonNull(record, "record");
        if (!visited.add(record)) {
            LOG.trace("Defaults already applied to {}@{}", record.getClass().getSimpleName(), System.identityHashCode(record));
            return;
        }
        for (FieldDescriptor field : FieldDescriptor.visibleFields(record.getClass())) {
            try {
                applyField(record, field, defaultTagName, visited);
            } catch (RecliException ex) {
                throw ex.withField(field.name());
            }
        }
    }

    private void applyField(Object record, FieldDescriptor field, String defaultTagName, Set<Object> visited) {
        Class<?> raw = ValueClassifier.rawType(field.type());
        Object current = field.read(record);
        Optional<String> tagValue = field.tag(defaultTagName);
        boolean parsesItself = current instanceof DefaultParser && tagValue.isPresent();
        if (raw != null && current != null && !parsesItself
            && classifier.codecFor(raw) == null && ValueClassifier.isRecordClass(raw)) {
            applyDefaults(current, defaultTagName, visited);
            return;
        }

        if (tagValue.isEmpty()) {
            return;
        }
        String value = tagValue.get();

        if (current instanceof DefaultParser parser) {
            parseWith(parser, value);
            return;
        }
        if (!field.settable()) {
            throw new RecliException(RecliException.Kind.UNSUPPORTED_KIND, "field with a default is not settable");
        }

        Binding binding = field.bind(record);
        FieldShape shape = classifier.classify(field.type());
        if (shape.isScalar()) {
            codec.write(binding, value);
            LOG.debug("Default {}={} applied", field.name(), value);
            return;
        }
        if (shape instanceof FieldShape.SequenceShape sequence && classifier.classify(sequence.elementType()).isScalar()) {
            var elements = new ArrayList<Object>();
            for (String item : value.split(",", -1)) {
                elements.add(codec.parse(sequence.elementType(), item));
            }
            binding.set(SequenceAccess.create(sequence, elements));
            LOG.debug("Default {}={} applied", field.name(), value);
            return;
        }
        throw RecliException.unsupportedKind("default for " + field.type().getTypeName());
    }

    private static void parseWith(DefaultParser parser, String value) {
        try {
            parser.parseDefault(value);
        } catch (RecliException ex) {
            throw ex;
        } catch (Exception ex) {
            throw RecliException.conversion(ex.getMessage() == null ? "cannot parse default \"" + value + "\"" : ex.getMessage(), ex);
        }
    }
}
