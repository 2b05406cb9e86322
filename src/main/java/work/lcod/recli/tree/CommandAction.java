package work.lcod.recli.tree;

/**
 * Leaf behaviour of a {@link CommandNode}.
 */
@FunctionalInterface
public interface CommandAction {
    void run(Invocation invocation) throws Exception;
}
