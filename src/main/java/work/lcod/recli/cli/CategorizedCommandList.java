package work.lcod.recli.cli;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import picocli.CommandLine;
import picocli.CommandLine.Help;
import work.lcod.recli.tree.CommandNode;

/**
 * Lists subcommands grouped under their category ({@code PROPERTIES}, {@code ITEMS}, {@code ACTIONS}).
 */
final class CategorizedCommandList implements CommandLine.IHelpSectionRenderer {
    private static final String UNCATEGORIZED = "COMMANDS";

    @Override
    public String render(Help help) {
        Map<String, List<Map.Entry<String, Help>>> byCategory = new LinkedHashMap<>();
        int width = 0;
        for (Map.Entry<String, Help> entry : help.subcommands().entrySet()) {
            Object userObject = entry.getValue().commandSpec().userObject();
            String category = userObject instanceof CommandNode node && !node.category().isEmpty()
                ? node.category()
                : UNCATEGORIZED;
            byCategory.computeIfAbsent(category, key -> new ArrayList<>()).add(entry);
            width = Math.max(width, entry.getKey().length());
        }

        var out = new StringBuilder();
        for (Map.Entry<String, List<Map.Entry<String, Help>>> category : byCategory.entrySet()) {
            out.append(category.getKey()).append(':').append(System.lineSeparator());
            for (Map.Entry<String, Help> entry : category.getValue()) {
                String[] description = entry.getValue().commandSpec().usageMessage().description();
                String summary = description.length == 0 ? "" : description[0];
                out.append(String.format("  %-" + width + "s  %s", entry.getKey(), summary).stripTrailing())
                    .append(System.lineSeparator());
            }
        }
        return out.toString();
    }
}
