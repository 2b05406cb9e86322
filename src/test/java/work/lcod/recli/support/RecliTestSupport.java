package work.lcod.recli.support;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import work.lcod.recli.api.RecliConfiguration;
import work.lcod.recli.tree.CommandNode;
import work.lcod.recli.tree.Invocation;

/**
 * Shared helpers for tree tests: a configuration whose printers record into lists, and direct
 * execution of leaves by path without going through picocli.
 */
public final class RecliTestSupport {
    private final List<String> printed = new ArrayList<>();
    private final RecliConfiguration configuration;

    public RecliTestSupport() {
        this(RecliConfiguration.builder());
    }

    public RecliTestSupport(RecliConfiguration.Builder builder) {
        this.configuration = builder
            .valuePrinter(value -> printed.add(String.valueOf(value)))
            .keyValuePrinter((key, value) -> printed.add(key + " = " + value))
            .build();
    }

    public RecliConfiguration configuration() {
        return configuration;
    }

    public List<String> printed() {
        return printed;
    }

    /**
     * Returns and clears what the printers recorded so far.
     */
    public List<String> drain() {
        var copy = List.copyOf(printed);
        printed.clear();
        return copy;
    }

    public static CommandNode root(List<CommandNode> nodes) {
        return CommandNode.group("root", "", "", nodes);
    }

    public static CommandNode find(List<CommandNode> nodes, String... path) {
        CommandNode node = root(nodes).find(path);
        if (node == null) {
            throw new AssertionError("no command at " + Arrays.toString(path));
        }
        return node;
    }

    public static void run(List<CommandNode> nodes, List<String> path, String... args) throws Exception {
        find(nodes, path.toArray(new String[0])).action().run(Invocation.of(args));
    }

    public static void runWithFlags(List<CommandNode> nodes, List<String> path, Map<String, Object> flags)
        throws Exception {
        find(nodes, path.toArray(new String[0])).action().run(Invocation.withFlags(flags));
    }

    public static List<String> names(CommandNode node) {
        return node.children().stream().map(CommandNode::name).toList();
    }

    public static List<String> names(List<CommandNode> nodes) {
        return nodes.stream().map(CommandNode::name).toList();
    }
}
