package work.lcod.recli.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.recli.serial.SerializationFormat;

class RecliConfigurationTest {
    private static final TextCodec<StringBuilder> BUILDER_CODEC = new TextCodec<>() {
        @Override
        public String marshal(StringBuilder value) {
            return value.toString();
        }

        @Override
        public StringBuilder unmarshal(String text) {
            return new StringBuilder(text);
        }
    };

    @Test
    void standardConventions() {
        RecliConfiguration standard = RecliConfiguration.STANDARD;
        assertEquals(new TagSpec("recli", "-"), standard.skipTag());
        assertEquals(new TagSpec("recli", "id"), standard.idTag());
        assertEquals("usage", standard.usageTagName());
        assertEquals("default", standard.defaultTagName());
        assertEquals("timeout-ms", standard.fieldNameConverter().convert("timeoutMS"));
        assertEquals(SerializationFormat.JSON, standard.serializationFormat());
        assertEquals(Map.of(), standard.codecs());
    }

    @Test
    void toBuilderLeavesOriginalUntouched() {
        RecliConfiguration custom = RecliConfiguration.STANDARD.toBuilder()
            .usageTagName("help")
            .codec(StringBuilder.class, BUILDER_CODEC)
            .build();

        assertEquals("help", custom.usageTagName());
        assertSame(BUILDER_CODEC, custom.codecFor(StringBuilder.class));
        assertEquals("usage", RecliConfiguration.STANDARD.usageTagName());
        assertNull(RecliConfiguration.STANDARD.codecFor(StringBuilder.class));
        assertNotSame(RecliConfiguration.STANDARD, custom);
    }

    @Test
    void codecMapIsImmutable() {
        RecliConfiguration custom = RecliConfiguration.builder().codec(StringBuilder.class, BUILDER_CODEC).build();
        assertThrows(UnsupportedOperationException.class, () -> custom.codecs().clear());
    }

    @Test
    void requiresTagRoles() {
        assertThrows(NullPointerException.class, () -> RecliConfiguration.builder().idTag(null).build());
    }

    @Test
    void wrappingKeepsKindAndCause() {
        var cause = new RecliException(RecliException.Kind.NOT_FOUND, "no item at index 3");
        RecliException wrapped = cause.withField("backends");
        assertEquals(RecliException.Kind.NOT_FOUND, wrapped.kind());
        assertEquals("backends: no item at index 3", wrapped.getMessage());
        assertSame(cause, wrapped.getCause());
    }
}
