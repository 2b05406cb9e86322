package work.lcod.recli.api;

import java.util.Objects;

/**
 * A tag role selector: matches fields tagged {@code name} whose value lists {@code value}.
 */
public record TagSpec(String name, String value) {
    public TagSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }
}
