package work.lcod.recli.api;

import java.util.List;
import picocli.CommandLine;
import work.lcod.recli.build.CommandTreeBuilder;
import work.lcod.recli.build.DefaultsEngine;
import work.lcod.recli.cli.CommandLineFactory;
import work.lcod.recli.tree.CommandNode;

/**
 * Public entry point for embedding applications.
 */
public final class Recli {
    private Recli() {}

    public static List<CommandNode> construct(RecliConfiguration configuration, Object record) {
        return new CommandTreeBuilder(configuration).construct(record);
    }

    public static List<CommandNode> construct(Object record) {
        return construct(RecliConfiguration.STANDARD, record);
    }

    /**
     * Applies the configuration's default tags to {@code record} and every record reachable from it.
     */
    public static void applyDefaults(RecliConfiguration configuration, Object record) {
        new CommandTreeBuilder(configuration).defaults()
            .applyDefaults(record, configuration.defaultTagName(), DefaultsEngine.newVisitedSet());
    }

    /**
     * Builds the tree for {@code record} and wraps it in a picocli command named {@code name}.
     */
    public static CommandLine commandLine(String name, RecliConfiguration configuration, Object record) {
        return CommandLineFactory.create(name, construct(configuration, record));
    }
}
