package work.lcod.recli.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Arguments handed to a leaf action: positional values plus the flags that were explicitly set,
 * already converted to their declared {@link FlagType}.
 */
public record Invocation(List<String> args, Map<String, Object> flags) {
    public Invocation {
        args = args == null ? List.of() : List.copyOf(args);
        flags = flags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(flags));
    }

    public static Invocation of(String... args) {
        return new Invocation(List.of(args), Map.of());
    }

    public static Invocation withFlags(Map<String, Object> flags) {
        return new Invocation(List.of(), flags);
    }

    public int argCount() {
        return args.size();
    }

    public String arg(int index) {
        return args.get(index);
    }

    public boolean isSet(String flag) {
        return flags.containsKey(flag);
    }

    public Object flag(String flag) {
        return flags.get(flag);
    }

    public int flagCount() {
        return flags.size();
    }
}
