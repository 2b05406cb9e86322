package work.lcod.recli.tree;

import java.util.List;
import java.util.Objects;

/**
 * One named entry of a command tree: either a group (children only) or a leaf (action only).
 */
public record CommandNode(
    String name,
    String usage,
    String argsUsage,
    String category,
    List<CommandNode> children,
    List<FlagSpec> flags,
    CommandAction action
) {
    public static final String PROPERTIES = "PROPERTIES";
    public static final String ITEMS = "ITEMS";
    public static final String ACTIONS = "ACTIONS";

    public CommandNode {
        Objects.requireNonNull(name, "name");
        usage = usage == null ? "" : usage;
        argsUsage = argsUsage == null ? "" : argsUsage;
        category = category == null ? "" : category;
        children = children == null ? List.of() : List.copyOf(children);
        flags = flags == null ? List.of() : List.copyOf(flags);
    }

    public static CommandNode group(String name, String usage, String category, List<CommandNode> children) {
        return new CommandNode(name, usage, "", category, children, List.of(), null);
    }

    public static CommandNode action(String name, String usage, String argsUsage, CommandAction action) {
        return new CommandNode(name, usage, argsUsage, ACTIONS, List.of(), List.of(), action);
    }

    public CommandNode withFlags(List<FlagSpec> newFlags) {
        return new CommandNode(name, usage, argsUsage, category, children, newFlags, action);
    }

    public boolean isLeaf() {
        return action != null;
    }

    /**
     * Child with the given name, or {@code null}. Collection items may share a key; the last one wins.
     */
    public CommandNode child(String childName) {
        CommandNode found = null;
        for (CommandNode child : children) {
            if (child.name().equals(childName)) {
                found = child;
            }
        }
        return found;
    }

    /**
     * Follows {@code path} through nested children, or returns {@code null} when a segment is missing.
     */
    public CommandNode find(String... path) {
        CommandNode current = this;
        for (String segment : path) {
            current = current.child(segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }
}
