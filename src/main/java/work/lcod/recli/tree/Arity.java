package work.lcod.recli.tree;

import work.lcod.recli.api.RecliException;

/**
 * Positional argument count checks for leaf actions.
 */
public final class Arity {
    private Arity() {}

    public static CommandAction expect(int count, CommandAction action) {
        return invocation -> {
            if (invocation.argCount() != count) {
                String plural = count == 1 ? "" : "s";
                throw new RecliException(
                    RecliException.Kind.WRONG_ARITY,
                    "expected " + count + " argument" + plural + ", got " + invocation.argCount()
                );
            }
            action.run(invocation);
        };
    }
}
