package work.lcod.recli.cli;

import java.util.Optional;
import picocli.CommandLine;

/**
 * Version lines for {@code recli-demo --version}: the jar's implementation version, then the
 * picocli and JVM it runs on.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String version = Optional.ofNullable(RecliDemoCommand.class.getPackage().getImplementationVersion())
            .orElse("development");
        return new String[] {
            "recli-demo " + version,
            "picocli " + CommandLine.VERSION + ", JVM " + System.getProperty("java.version")
        };
    }
}
