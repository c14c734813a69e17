package io.regrada.cli.commands;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/// Top-level `regrada` command.
///
/// Registers the subcommands:
/// - `format` - Parse a choreography and print it back in canonical form
/// - `simulate` - Fire a sequence of events and print the resulting marking
/// - `export` - Write a choreography as a laid-out project file
/// - `compile` - Submit a choreography to the compile service and print the projections
///
/// @see FormatCommand
/// @see SimulateCommand
/// @see ExportCommand
/// @see CompileCommand
@Command(
        name = "regrada",
        description = "Choreographies as DCR graphs",
        mixinStandardHelpOptions = true,
        version = "regrada 0.1.0",
        subcommands = {
            FormatCommand.class,
            SimulateCommand.class,
            ExportCommand.class,
            CompileCommand.class
        })
public class RegradaCli implements Runnable {

    @Spec private CommandSpec spec;

    /// Prints usage when no subcommand is given.
    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }
}
