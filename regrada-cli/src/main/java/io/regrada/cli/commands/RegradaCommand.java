package io.regrada.cli.commands;

/// Minimal abstract base for all ReGraDa CLI commands.
///
/// Owns the banner display and the [#run()] / [#execute()] contract.
/// Subclasses provide command-specific options and implement [#execute()].
///
/// @see SourceCommand
public abstract class RegradaCommand implements Runnable {

    private static final String[] BANNER = {
        "",
        "  ___       ___          ___",
        " | _ \\___  / __|_ _ __ _|   \\ __ _",
        " |   / -_)| (_ | '_/ _` | |) / _` |",
        " |_|_\\___| \\___|_| \\__,_|___/\\__,_|",
        "",
        " Choreographies as DCR graphs",
        ""
    };

    @Override
    public final void run() {
        if (showBanner()) {
            for (String line : BANNER) {
                System.out.println(line);
            }
        }
        execute();
    }

    /// Returns whether the banner goes to standard output before the command runs.
    ///
    /// Commands that print a document on standard output return `false` so the
    /// output can be piped.
    protected boolean showBanner() {
        return true;
    }

    protected abstract void execute();
}
