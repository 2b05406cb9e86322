package work.lcod.recli.serial;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Text formats available for whole-record dumps and blob imports.
 */
public enum SerializationFormat {
    JSON("json"),
    YAML("yaml");

    private final String id;

    SerializationFormat(String id) {
        this.id = id;
    }

    /**
     * Lower-case name used in command names ({@code dump-json}, {@code add-yaml}).
     */
    public String id() {
        return id;
    }

    public static SerializationFormat forPath(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".yaml") || name.endsWith(".yml")) {
            return YAML;
        }
        return JSON;
    }
}
