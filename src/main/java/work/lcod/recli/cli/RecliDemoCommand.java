package work.lcod.recli.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import work.lcod.recli.api.Recli;
import work.lcod.recli.api.RecliConfiguration;
import work.lcod.recli.demo.ProxyConfig;
import work.lcod.recli.serial.BlobCodec;
import work.lcod.recli.serial.SerializationFormat;

@CommandLine.Command(
    name = "recli-demo",
    description = "Inspect and edit a proxy configuration file one field at a time.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class RecliDemoCommand implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(RecliDemoCommand.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-f", "--file"},
        paramLabel = "PATH",
        description = "Configuration file; .yaml/.yml is read as YAML, anything else as JSON.",
        defaultValue = "proxy.json"
    )
    private Path file;

    @CommandLine.Parameters(
        paramLabel = "COMMAND",
        arity = "0..*",
        description = "Command path and arguments, e.g. 'backends add -hostname=b2.com'."
    )
    private List<String> command = new ArrayList<>();

    /**
     * Everything after the first positional belongs to the generated command tree.
     */
    static CommandLine commandLine() {
        return new CommandLine(new RecliDemoCommand())
            .setStopAtPositional(true)
            .setExecutionExceptionHandler(new ActionErrorHandler());
    }

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        SerializationFormat format = SerializationFormat.forPath(file);
        RecliConfiguration configuration = RecliConfiguration.builder()
            .valuePrinter(out::println)
            .keyValuePrinter((key, value) -> out.println(key + " = " + value))
            .serializationFormat(format)
            .build();
        BlobCodec blobs = new BlobCodec(format, configuration.codecs());

        ProxyConfig proxy = load(configuration, blobs);
        String before = blobs.encode(proxy);

        CommandLine tree = Recli.commandLine(spec.name(), configuration, proxy);
        tree.setOut(out);
        tree.setErr(spec.commandLine().getErr());
        if (command.isEmpty()) {
            tree.usage(out);
            return spec.exitCodeOnSuccess();
        }
        int exitCode = tree.execute(command.toArray(new String[0]));
        out.flush();

        String after = blobs.encode(proxy);
        if (exitCode == 0 && !after.equals(before)) {
            Files.writeString(file, after + System.lineSeparator(), StandardCharsets.UTF_8);
            LOG.info("Saved {}", file);
        }
        return exitCode;
    }

    private ProxyConfig load(RecliConfiguration configuration, BlobCodec blobs) throws IOException {
        if (Files.exists(file)) {
            LOG.debug("Loading {}", file);
            return blobs.decode(Files.readString(file, StandardCharsets.UTF_8), ProxyConfig.class);
        }
        LOG.debug("{} not found, starting from defaults", file);
        var proxy = new ProxyConfig();
        Recli.applyDefaults(configuration, proxy);
        return proxy;
    }
}
