package work.lcod.recli.cli;

/**
 * Entry point for the {@code java -jar} distribution.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) {
        int exitCode = RecliDemoCommand.commandLine().execute(args);
        System.exit(exitCode);
    }
}
