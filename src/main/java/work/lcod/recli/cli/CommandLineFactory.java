package work.lcod.recli.cli;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Model.OptionSpec;
import picocli.CommandLine.Model.PositionalParamSpec;
import picocli.CommandLine.Model.UsageMessageSpec;
import picocli.CommandLine.ParseResult;
import work.lcod.recli.tree.CommandNode;
import work.lcod.recli.tree.FlagSpec;
import work.lcod.recli.tree.FlagType;
import work.lcod.recli.tree.Invocation;

/**
 * Turns a command tree into a picocli {@link CommandLine}.
 *
 * <p>Specs are built programmatically, one per node, with the node as user object. Leaves accept any
 * number of positionals (arity is checked by the action itself) and one option per declared flag,
 * available as {@code --name} and {@code -name}. Dash-prefixed arguments that match no option are
 * passed as positionals so negative numbers can be set.
 */
public final class CommandLineFactory {
    private static final Logger LOG = LoggerFactory.getLogger(CommandLineFactory.class);

    private CommandLineFactory() {}

    public static CommandLine create(String name, List<CommandNode> nodes) {
        CommandLine commandLine = toCommandLine(CommandNode.group(name, "", "", nodes));
        commandLine.setUnmatchedOptionsArePositionalParams(true);
        commandLine.setExecutionStrategy(CommandLineFactory::execute);
        commandLine.setExecutionExceptionHandler(new ActionErrorHandler());
        return commandLine;
    }

    private static CommandLine toCommandLine(CommandNode node) {
        CommandSpec spec = CommandSpec.wrapWithoutInspection(node);
        spec.name(node.name());
        spec.mixinStandardHelpOptions(true);

        var description = new ArrayList<String>();
        if (!node.usage().isEmpty()) {
            description.add(node.usage());
        }
        if (!node.argsUsage().isEmpty()) {
            description.add("Arguments: " + node.argsUsage());
        }
        spec.usageMessage().description(description.toArray(new String[0]));

        if (node.isLeaf()) {
            spec.addPositional(PositionalParamSpec.builder()
                .index("0..*")
                .arity("0..*")
                .type(List.class)
                .auxiliaryTypes(String.class)
                .paramLabel("ARG")
                .hidden(true)
                .build());
            for (FlagSpec flag : node.flags()) {
                option(spec, flag).ifPresent(spec::addOption);
            }
        }

        CommandLine commandLine = new CommandLine(spec);
        for (CommandNode child : lastByName(node.children())) {
            commandLine.addSubcommand(child.name(), toCommandLine(child));
        }
        if (!node.children().isEmpty()) {
            spec.usageMessage().commandListHeading("%n");
            var sections = new LinkedHashMap<>(commandLine.getHelpSectionMap());
            sections.put(UsageMessageSpec.SECTION_KEY_COMMAND_LIST, new CategorizedCommandList());
            commandLine.setHelpSectionMap(sections);
        }
        return commandLine;
    }

    /**
     * Empty when the flag's long name is taken by a standard help option; a taken short form is dropped.
     */
    private static Optional<OptionSpec> option(CommandSpec spec, FlagSpec flag) {
        String longName = "--" + flag.name();
        String shortName = "-" + flag.name();
        if (spec.findOption(longName) != null) {
            LOG.warn("Flag {} of {} clashes with a standard option and is not exposed", longName, spec.name());
            return Optional.empty();
        }
        String[] names = spec.findOption(shortName) != null
            ? new String[] {longName}
            : new String[] {longName, shortName};
        OptionSpec.Builder builder = OptionSpec.builder(names).description(flag.usage());
        Class<?> valueType = switch (flag.type()) {
            case BOOLEAN, BOOLEAN_LIST -> Boolean.class;
            case STRING, STRING_LIST -> String.class;
            case INTEGER, INTEGER_LIST -> Long.class;
            case FLOAT, FLOAT_LIST -> Double.class;
        };
        String label = switch (flag.type()) {
            case BOOLEAN, BOOLEAN_LIST -> "BOOL";
            case STRING, STRING_LIST -> "TEXT";
            case INTEGER, INTEGER_LIST -> "INT";
            case FLOAT, FLOAT_LIST -> "FLOAT";
        };
        if (flag.type().multiValue()) {
            builder.type(List.class).auxiliaryTypes(valueType).splitRegex(",").paramLabel(label);
        } else if (flag.type() == FlagType.BOOLEAN) {
            builder.type(boolean.class).arity("0..1");
        } else {
            builder.type(valueType).paramLabel(label);
        }
        return Optional.of(builder.build());
    }

    /**
     * Collection items may share a key; the last one wins, at the position of its first occurrence.
     */
    private static List<CommandNode> lastByName(List<CommandNode> children) {
        Map<String, CommandNode> byName = new LinkedHashMap<>();
        for (CommandNode child : children) {
            byName.put(child.name(), child);
        }
        return new ArrayList<>(byName.values());
    }

    private static int execute(ParseResult parseResult) {
        Integer helpExitCode = CommandLine.executeHelpRequest(parseResult);
        if (helpExitCode != null) {
            return helpExitCode;
        }

        ParseResult leaf = parseResult;
        while (leaf.hasSubcommand()) {
            leaf = leaf.subcommand();
        }
        CommandSpec spec = leaf.commandSpec();
        CommandNode node = (CommandNode) spec.userObject();
        if (!node.isLeaf()) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
        }

        List<String> args = leaf.matchedPositionalValue(0, List.<String>of());
        Map<String, Object> flags = new LinkedHashMap<>();
        for (FlagSpec flag : node.flags()) {
            String optionName = "--" + flag.name();
            if (leaf.hasMatchedOption(optionName)) {
                flags.put(flag.name(), leaf.matchedOptionValue(optionName, null));
            }
        }

        try {
            node.action().run(new Invocation(args, flags));
        } catch (CommandLine.ParameterException | CommandLine.ExecutionException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new CommandLine.ExecutionException(spec.commandLine(), ex.getMessage(), ex);
        }
        return spec.exitCodeOnSuccess();
    }
}
