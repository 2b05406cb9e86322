package work.lcod.recli.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.lcod.recli.reflect.NameConverters;
import work.lcod.recli.serial.SerializationFormat;

/**
 * Immutable policy used while building a command tree: tag roles, naming, output sinks and codecs.
 */
public record RecliConfiguration(
    TagSpec skipTag,
    TagSpec idTag,
    String usageTagName,
    String defaultTagName,
    FieldNameConverter fieldNameConverter,
    ValuePrinter valuePrinter,
    KeyValuePrinter keyValuePrinter,
    Map<Class<?>, TextCodec<?>> codecs,
    SerializationFormat serializationFormat
) {
    /**
     * Conventional settings: {@code recli:"-"} skips, {@code recli:"id"} keys collection items,
     * {@code usage} and {@code default} tags, lower-dash-case names and stdout printers.
     */
    public static final RecliConfiguration STANDARD = builder().build();

    public RecliConfiguration {
        Objects.requireNonNull(skipTag, "skipTag");
        Objects.requireNonNull(idTag, "idTag");
        Objects.requireNonNull(usageTagName, "usageTagName");
        Objects.requireNonNull(defaultTagName, "defaultTagName");
        Objects.requireNonNull(fieldNameConverter, "fieldNameConverter");
        Objects.requireNonNull(valuePrinter, "valuePrinter");
        Objects.requireNonNull(keyValuePrinter, "keyValuePrinter");
        Objects.requireNonNull(serializationFormat, "serializationFormat");
        codecs = codecs == null ? Map.of() : Map.copyOf(codecs);
    }

    public TextCodec<?> codecFor(Class<?> type) {
        return codecs.get(type);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        var builder = new Builder()
            .skipTag(skipTag)
            .idTag(idTag)
            .usageTagName(usageTagName)
            .defaultTagName(defaultTagName)
            .fieldNameConverter(fieldNameConverter)
            .valuePrinter(valuePrinter)
            .keyValuePrinter(keyValuePrinter)
            .serializationFormat(serializationFormat);
        builder.codecs.putAll(codecs);
        return builder;
    }

    public static final class Builder {
        private TagSpec skipTag = new TagSpec("recli", "-");
        private TagSpec idTag = new TagSpec("recli", "id");
        private String usageTagName = "usage";
        private String defaultTagName = "default";
        private FieldNameConverter fieldNameConverter = NameConverters::toLowerDashCase;
        private ValuePrinter valuePrinter = System.out::println;
        private KeyValuePrinter keyValuePrinter = (key, value) -> System.out.println(key + " = " + value);
        private final Map<Class<?>, TextCodec<?>> codecs = new LinkedHashMap<>();
        private SerializationFormat serializationFormat = SerializationFormat.JSON;

        public Builder skipTag(TagSpec skipTag) {
            this.skipTag = skipTag;
            return this;
        }

        public Builder idTag(TagSpec idTag) {
            this.idTag = idTag;
            return this;
        }

        public Builder usageTagName(String usageTagName) {
            this.usageTagName = usageTagName;
            return this;
        }

        public Builder defaultTagName(String defaultTagName) {
            this.defaultTagName = defaultTagName;
            return this;
        }

        public Builder fieldNameConverter(FieldNameConverter fieldNameConverter) {
            this.fieldNameConverter = fieldNameConverter;
            return this;
        }

        public Builder valuePrinter(ValuePrinter valuePrinter) {
            this.valuePrinter = valuePrinter;
            return this;
        }

        public Builder keyValuePrinter(KeyValuePrinter keyValuePrinter) {
            this.keyValuePrinter = keyValuePrinter;
            return this;
        }

        public <T> Builder codec(Class<T> type, TextCodec<T> codec) {
            codecs.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(codec, "codec"));
            return this;
        }

        public Builder serializationFormat(SerializationFormat serializationFormat) {
            this.serializationFormat = serializationFormat;
            return this;
        }

        public RecliConfiguration build() {
            return new RecliConfiguration(
                skipTag,
                idTag,
                usageTagName,
                defaultTagName,
                fieldNameConverter,
                valuePrinter,
                keyValuePrinter,
                codecs,
                serializationFormat
            );
        }
    }
}
