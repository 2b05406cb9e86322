package work.lcod.recli.tree;

import java.util.Objects;

/**
 * Declared flag of a leaf command.
 */
public record FlagSpec(String name, FlagType type, String usage) {
    public FlagSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        usage = usage == null ? "" : usage;
    }
}
