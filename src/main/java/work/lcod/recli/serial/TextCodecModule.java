package work.lcod.recli.serial;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;
import java.util.Map;
import work.lcod.recli.api.TextCodec;

/**
 * Jackson module writing codec-backed types as their symbolic text, so blobs agree with {@code get}/{@code set}.
 */
final class TextCodecModule extends SimpleModule {
    TextCodecModule(Map<Class<?>, TextCodec<?>> codecs) {
        super("recli-text-codecs");
        for (var entry : codecs.entrySet()) {
            register(entry.getKey(), entry.getValue());
        }
    }

    @SuppressWarnings("unchecked")
    private <T> void register(Class<T> type, TextCodec<?> codec) {
        if (type.isPrimitive()) {
            return;
        }
        var typed = (TextCodec<T>) codec;
        addSerializer(type, new CodecSerializer<>(type, typed));
        addDeserializer(type, new CodecDeserializer<>(type, typed));
    }

    private static final class CodecSerializer<T> extends StdSerializer<T> {
        private final transient TextCodec<T> codec;

        CodecSerializer(Class<T> type, TextCodec<T> codec) {
            super(type);
            this.codec = codec;
        }

        @Override
        public void serialize(T value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(codec.marshal(value));
        }
    }

    private static final class CodecDeserializer<T> extends StdDeserializer<T> {
        private final transient TextCodec<T> codec;

        CodecDeserializer(Class<T> type, TextCodec<T> codec) {
            super(type);
            this.codec = codec;
        }

        @Override
        public T deserialize(JsonParser parser, DeserializationContext ctxt) throws IOException {
            String text = parser.getValueAsString();
            try {
                return codec.unmarshal(text);
            } catch (IOException ex) {
                throw ex;
            } catch (Exception ex) {
                throw ctxt.weirdStringException(text, handledType(), ex.getMessage());
            }
        }
    }
}
