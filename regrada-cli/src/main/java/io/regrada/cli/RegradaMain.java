package io.regrada.cli;

import io.regrada.cli.commands.RegradaCli;
import picocli.CommandLine;

/// Launches the `regrada` command line.
public final class RegradaMain {

    private RegradaMain() {}

    public static void main(String[] args) {
        int exitCode = new CommandLine(new RegradaCli()).execute(args);
        System.exit(exitCode);
    }
}
