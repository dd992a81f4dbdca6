package org.lakeshift.cli;

import picocli.CommandLine;

@CommandLine.Command(
        name = "lakeshift",
        mixinStandardHelpOptions = true,
        version = "lakeshift 0.1.0",
        description = "Lakehouse schema migration generator and runner",
        subcommands = {
                DiffCommand.class,
                GenerateCommand.class,
                ValidateCommand.class,
                StatusCommand.class,
                PlanCommand.class,
                RunCommand.class,
                ExportCommand.class
        }
)
public class LakeshiftCli implements Runnable {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new LakeshiftCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }
}
