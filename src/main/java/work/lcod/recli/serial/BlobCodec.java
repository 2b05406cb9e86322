package work.lcod.recli.serial;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.lang.reflect.Type;
import java.util.Map;
import java.util.Objects;
import work.lcod.recli.api.RecliException;
import work.lcod.recli.api.TextCodec;

/**
 * Encodes and decodes whole values as JSON or YAML text. Objects are mapped through their fields, the same
 * storage the command tree binds to; enums and codec-backed types use their symbolic text.
 */
public final class BlobCodec {
    private final SerializationFormat format;
    private final ObjectMapper mapper;
    private final ObjectWriter writer;

    public BlobCodec(SerializationFormat format, Map<Class<?>, TextCodec<?>> codecs) {
        this.format = Objects.requireNonNull(format, "format");
        this.mapper = format == SerializationFormat.YAML ? new ObjectMapper(new YAMLFactory()) : new ObjectMapper();
        mapper.setVisibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE);
        mapper.setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        mapper.configure(SerializationFeature.WRITE_ENUMS_USING_TO_STRING, true);
        mapper.configure(DeserializationFeature.READ_ENUMS_USING_TO_STRING, true);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.registerModule(new TextCodecModule(codecs == null ? Map.of() : codecs));
        this.writer = mapper.writerWithDefaultPrettyPrinter();
    }

    public SerializationFormat format() {
        return format;
    }

    public String encode(Object value) {
        try {
            return writer.writeValueAsString(value).stripTrailing();
        } catch (JsonProcessingException ex) {
            throw RecliException.conversion("cannot encode " + format.id() + ": " + ex.getOriginalMessage(), ex);
        }
    }

    public Object decode(String text, Type type) {
        try {
            return mapper.readValue(text, mapper.constructType(type));
        } catch (JsonProcessingException ex) {
            throw RecliException.conversion("cannot decode " + format.id() + ": " + ex.getOriginalMessage(), ex);
        }
    }

    public <T> T decode(String text, Class<T> type) {
        return type.cast(decode(text, (Type) type));
    }
}
