package work.lcod.recli.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class RecliDemoCommandTest {
    @TempDir
    Path dir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine commandLine = RecliDemoCommand.commandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    private String takeOut() {
        String text = out.toString();
        out.getBuffer().setLength(0);
        return text;
    }

    @Test
    void readsDefaultsWithoutWritingFile() {
        Path file = dir.resolve("proxy.json");
        assertEquals(0, run("-f", file.toString(), "address", "get"));
        assertEquals(":8080", takeOut().strip());
        assertEquals(0, run("-f", file.toString(), "timeout-ms", "get"));
        assertEquals("30000", takeOut().strip());
        assertEquals(0, run("-f", file.toString(), "allowed-origins", "list"));
        assertEquals("0", takeOut().strip());
        assertFalse(Files.exists(file));
    }

    @Test
    void savesChangesBetweenRuns() throws Exception {
        Path file = dir.resolve("proxy.json");
        assertEquals(0, run("-f", file.toString(), "backends", "add", "-hostname=b2.com"));
        assertEquals(0, run("-f", file.toString(), "auth-mode", "set", "ldap"));

        String saved = Files.readString(file, StandardCharsets.UTF_8);
        assertTrue(saved.contains("\"hostname\" : \"b2.com\""), saved);
        assertTrue(saved.contains("\"port\" : 2019"), saved);
        assertTrue(saved.contains("\"authMode\" : \"ldap\""), saved);

        assertEquals(0, run("-f", file.toString(), "backends", "list"));
        assertEquals("b2.com", takeOut().strip());
        assertEquals(0, run("-f", file.toString(), "backends", "b2.com", "port", "get"));
        assertEquals("2019", takeOut().strip());
        assertEquals(0, run("-f", file.toString(), "auth-mode", "get"));
        assertEquals("ldap", takeOut().strip());
    }

    @Test
    void editsYamlFiles() throws Exception {
        Path file = dir.resolve("proxy.yaml");
        assertEquals(0, run("-f", file.toString(), "headers", "set", "X-Env", "prod"));
        assertEquals(0, run("-f", file.toString(), "headers", "dump"));
        assertEquals("X-Env = prod", takeOut().strip());

        assertEquals(0, run("-f", file.toString(), "backends", "add-yaml", "hostname: b5.com\nport: 5\n"));
        assertEquals(0, run("-f", file.toString(), "backends", "b5.com", "port", "get"));
        assertEquals("5", takeOut().strip());
        assertTrue(Files.readString(file, StandardCharsets.UTF_8).contains("b5.com"));
    }

    @Test
    void failedCommandLeavesFileUntouched() throws Exception {
        Path file = dir.resolve("proxy.json");
        assertEquals(0, run("-f", file.toString(), "address", "set", ":9000"));
        String before = Files.readString(file, StandardCharsets.UTF_8);

        assertEquals(1, run("-f", file.toString(), "timeout-ms", "set", "soon"));
        assertTrue(err.toString().contains("invalid integer value \"soon\""), err.toString());
        assertEquals(before, Files.readString(file, StandardCharsets.UTF_8));
    }

    @Test
    void skippedFieldHasNoCommand() {
        Path file = dir.resolve("proxy.json");
        assertEquals(2, run("-f", file.toString(), "admin-token", "get"));
    }

    @Test
    void showsTreeUsageWithoutCommand() {
        assertEquals(0, run("-f", dir.resolve("proxy.json").toString()));
        String usage = takeOut();
        assertTrue(usage.contains("PROPERTIES:"), usage);
        assertTrue(usage.contains("backends"), usage);
        assertTrue(usage.contains("Upstream servers"), usage);
    }

    @Test
    void printsVersion() {
        assertEquals(0, run("--version"));
        assertTrue(takeOut().startsWith("recli-demo "));
    }
}
