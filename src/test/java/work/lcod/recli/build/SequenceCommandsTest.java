package work.lcod.recli.build;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static work.lcod.recli.support.RecliTestSupport.find;
import static work.lcod.recli.support.RecliTestSupport.names;
import static work.lcod.recli.support.RecliTestSupport.run;
import static work.lcod.recli.support.RecliTestSupport.runWithFlags;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.recli.api.FieldTag;
import work.lcod.recli.api.RecliConfiguration;
import work.lcod.recli.api.RecliException;
import work.lcod.recli.serial.SerializationFormat;
import work.lcod.recli.support.RecliTestSupport;
import work.lcod.recli.tree.CommandNode;
import work.lcod.recli.tree.FlagSpec;
import work.lcod.recli.tree.FlagType;

class SequenceCommandsTest {
    static final class Pool {
        List<Backend> backends = new ArrayList<>();
        List<String> tags = new ArrayList<>();
        int[] weights = {1, 2};
        List<String> aliases;
        List<String> frozen = List.of("a");
    }

    static final class Backend {
        @FieldTag(name = "recli", value = "id")
        String hostname;

        @FieldTag(name = "default", value = "2019")
        int port;

        @FieldTag(name = "usage", value = "Use TLS")
        boolean secure;

        double weight;

        List<Integer> ports;

        Health health = new Health();

        @FieldTag(name = "recli", value = "-")
        String token;

        final String kind = "http";

        Backend() {}

        Backend(String hostname, int port) {
            this.hostname = hostname;
            this.port = port;
        }
    }

    static final class Health {
        String path = "/healthz";
    }

    static final class Route {
        String path;
    }

    static final class Routes {
        List<Route> routes = new ArrayList<>(List.of(new Route(), new Route()));
    }

    static final class Nested {
        List<List<String>> groups = new ArrayList<>();
    }

    static final class Opaque {
        Object anything;
    }

    static final class OpaqueItems {
        List<Opaque> items = new ArrayList<>(List.of(new Opaque()));
    }

    private final RecliTestSupport support = new RecliTestSupport();

    private List<CommandNode> build(Object record) {
        return new CommandTreeBuilder(support.configuration()).construct(record);
    }

    @Test
    void keysItemsByIdField() throws Exception {
        var pool = new Pool();
        pool.backends.add(new Backend("b1.com", 1010));
        pool.backends.add(new Backend("b2.com", 1020));
        List<CommandNode> tree = build(pool);

        assertEquals(List.of("b1.com", "b2.com", "list", "add", "add-json"), names(find(tree, "backends")));
        run(tree, List.of("backends", "list"));
        assertEquals(List.of("b1.com", "b2.com"), support.printed());
    }

    @Test
    void keysItemsByIndexWithoutIdField() throws Exception {
        List<CommandNode> tree = build(new Routes());
        assertEquals(List.of("0", "1", "list", "add", "add-json"), names(find(tree, "routes")));
    }

    @Test
    void addsScalarItemsAndDeletesPreservingOrder() throws Exception {
        var pool = new Pool();
        List<CommandNode> tree = build(pool);
        run(tree, List.of("tags", "add"), "a");
        run(tree, List.of("tags", "add"), "b");
        run(tree, List.of("tags", "add"), "c");
        assertEquals(List.of("a", "b", "c"), pool.tags);

        tree = build(pool);
        run(tree, List.of("tags", "1", "delete"));
        assertEquals(List.of("a", "c"), pool.tags);

        tree = build(pool);
        run(tree, List.of("tags", "list"));
        run(tree, List.of("tags", "1", "get"));
        assertEquals(List.of("0", "1", "c"), support.printed());
    }

    @Test
    void deleteOfVanishedItemIsNotFound() throws Exception {
        var pool = new Pool();
        pool.tags.addAll(List.of("a", "b"));
        List<CommandNode> tree = build(pool);
        run(tree, List.of("tags", "1", "delete"));
        var ex = assertThrows(RecliException.class, () -> run(tree, List.of("tags", "1", "delete")));
        assertEquals(RecliException.Kind.NOT_FOUND, ex.kind());
        assertEquals(List.of("a"), pool.tags);
    }

    @Test
    void itemSubtreeEditsElementInPlace() throws Exception {
        var pool = new Pool();
        pool.tags.add("old");
        List<CommandNode> tree = build(pool);
        run(tree, List.of("tags", "0", "set"), "new");
        assertEquals(List.of("new"), pool.tags);
    }

    @Test
    void addsToArrays() throws Exception {
        var pool = new Pool();
        List<CommandNode> tree = build(pool);
        run(tree, List.of("weights", "add"), "3");
        assertArrayEquals(new int[] {1, 2, 3}, pool.weights);

        tree = build(pool);
        run(tree, List.of("weights", "0", "delete"));
        assertArrayEquals(new int[] {2, 3}, pool.weights);

        tree = build(pool);
        run(tree, List.of("weights", "1", "set"), "9");
        assertArrayEquals(new int[] {2, 9}, pool.weights);
    }

    @Test
    void createsMissingListAndCopiesImmutableOne() throws Exception {
        var pool = new Pool();
        List<CommandNode> tree = build(pool);
        assertEquals(List.of("list", "add"), names(find(tree, "aliases")));

        run(tree, List.of("aliases", "add"), "x");
        run(tree, List.of("frozen", "add"), "b");
        assertEquals(List.of("x"), pool.aliases);
        assertEquals(List.of("a", "b"), pool.frozen);
    }

    @Test
    void declaresFlagsForSettableScalarFields() {
        List<CommandNode> tree = build(new Pool());
        List<FlagSpec> flags = find(tree, "backends", "add").flags();
        assertEquals(List.of(
            new FlagSpec("hostname", FlagType.STRING, ""),
            new FlagSpec("port", FlagType.INTEGER, "default value: 2019"),
            new FlagSpec("secure", FlagType.BOOLEAN, "Use TLS"),
            new FlagSpec("weight", FlagType.FLOAT, ""),
            new FlagSpec("ports", FlagType.INTEGER_LIST, "")
        ), flags);
    }

    @Test
    void flagAddAppliesDefaultsThenFlags() throws Exception {
        var pool = new Pool();
        pool.backends.add(new Backend("b1.com", 1010));
        List<CommandNode> tree = build(pool);

        runWithFlags(tree, List.of("backends", "add"), Map.of("hostname", "b2.com"));
        runWithFlags(tree, List.of("backends", "add"), Map.of(
            "hostname", "b3.com",
            "port", 3000L,
            "secure", true,
            "ports", List.of(1L, 2L)
        ));

        assertEquals(3, pool.backends.size());
        Backend added = pool.backends.get(1);
        assertEquals("b2.com", added.hostname);
        assertEquals(2019, added.port);
        Backend overridden = pool.backends.get(2);
        assertEquals(3000, overridden.port);
        assertEquals(true, overridden.secure);
        assertEquals(List.of(1, 2), overridden.ports);
        assertEquals("/healthz", overridden.health.path);
    }

    @Test
    void flagAddWithoutFlagsFails() {
        var pool = new Pool();
        List<CommandNode> tree = build(pool);
        var ex = assertThrows(RecliException.class, () -> runWithFlags(tree, List.of("backends", "add"), Map.of()));
        assertEquals(RecliException.Kind.NO_PROPERTIES_SPECIFIED, ex.kind());
        assertEquals(0, pool.backends.size());
    }

    @Test
    void flagAddReportsBadValueByFlag() {
        var pool = new Pool();
        List<CommandNode> tree = build(pool);
        var ex = assertThrows(RecliException.class,
            () -> runWithFlags(tree, List.of("backends", "add"), Map.of("weight", "heavy")));
        assertEquals(RecliException.Kind.CONVERSION, ex.kind());
        assertEquals("weight: invalid float value \"heavy\"", ex.getMessage());
        assertEquals(0, pool.backends.size());
    }

    @Test
    void addsDecodedBlob() throws Exception {
        var pool = new Pool();
        List<CommandNode> tree = build(pool);
        run(tree, List.of("backends", "add-json"), "{\"hostname\":\"b3.com\",\"port\":1,\"unknown\":true}");
        assertEquals("b3.com", pool.backends.get(0).hostname);
        assertEquals(1, pool.backends.get(0).port);

        var ex = assertThrows(RecliException.class, () -> run(tree, List.of("backends", "add-json"), "{"));
        assertEquals(RecliException.Kind.CONVERSION, ex.kind());
        assertEquals(1, pool.backends.size());
    }

    @Test
    void nullBlobAddsEmptyItem() throws Exception {
        var pool = new Pool();
        run(build(pool), List.of("backends", "add-json"), "null");
        assertEquals(1, pool.backends.size());
        Backend added = pool.backends.get(0);
        assertNotNull(added);
        assertNull(added.hostname);
        assertEquals("/healthz", added.health.path);

        List<CommandNode> rebuilt = build(pool);
        run(rebuilt, List.of("backends", "add-json"), "{\"hostname\":\"b5.com\"}");
        assertEquals(2, pool.backends.size());
    }

    @Test
    void blobCommandsFollowConfiguredFormat() throws Exception {
        var support = new RecliTestSupport(RecliConfiguration.builder().serializationFormat(SerializationFormat.YAML));
        var pool = new Pool();
        List<CommandNode> tree = new CommandTreeBuilder(support.configuration()).construct(pool);
        assertEquals(List.of("list", "add", "add-yaml"), names(find(tree, "backends")));
        run(tree, List.of("backends", "add-yaml"), "hostname: b4.com\nport: 4\n");
        assertEquals("b4.com", pool.backends.get(0).hostname);
    }

    @Test
    void duplicateKeysResolveToLastItem() throws Exception {
        var pool = new Pool();
        pool.backends.add(new Backend("dup.com", 1));
        pool.backends.add(new Backend("dup.com", 2));
        List<CommandNode> tree = build(pool);
        assertEquals(List.of("dup.com", "dup.com", "list", "add", "add-json"), names(find(tree, "backends")));
        run(tree, List.of("backends", "dup.com", "port", "get"));
        assertEquals(List.of("2"), support.printed());
    }

    @Test
    void rejectsNestedCollections() {
        var ex = assertThrows(RecliException.class, () -> build(new Nested()));
        assertEquals(RecliException.Kind.UNSUPPORTED_KIND, ex.kind());
        assertEquals("groups: unsupported kind: collection of java.util.List<java.lang.String>", ex.getMessage());
    }

    @Test
    void wrapsItemErrorsWithKey() {
        var ex = assertThrows(RecliException.class, () -> build(new OpaqueItems()));
        assertEquals("items: 0: anything: unsupported kind: java.lang.Object", ex.getMessage());
    }

    @Test
    void tracksReplacedList() throws Exception {
        var pool = new Pool();
        List<CommandNode> tree = build(pool);
        List<String> replacement = new ArrayList<>(List.of("z"));
        pool.tags = replacement;
        run(tree, List.of("tags", "add"), "y");
        assertSame(replacement, pool.tags);
        assertEquals(List.of("z", "y"), pool.tags);
    }
}
