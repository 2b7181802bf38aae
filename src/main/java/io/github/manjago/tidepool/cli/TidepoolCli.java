package io.github.manjago.tidepool.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Tidepool CLI.
 *
 * Usage:
 *   tidepool run [options]            - Run (or resume) a simulation
 *   tidepool checkpoint info <file>   - Show checkpoint info
 *   tidepool checkpoint diff <a> <b>  - Compare checkpoints
 *   tidepool info                     - Show version and config
 */
@Command(
    name = "tidepool",
    description = "Fish tank artificial life - energy economy and life cycles",
    mixinStandardHelpOptions = true,
    version = "Tidepool 1.0.0",
    subcommands = {
        RunCommand.class,
        CheckpointCommand.class,
        InfoCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class TidepoolCli implements Runnable {

    @Override
    public void run() {
        // If no subcommand, show help
        CommandLine.usage(this, System.out);
    }

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    /**
     * Run the CLI without exiting the JVM.
     */
    public static int execute(String... args) {
        return new CommandLine(new TidepoolCli())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
    }
}
