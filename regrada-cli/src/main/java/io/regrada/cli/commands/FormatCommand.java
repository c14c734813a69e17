package io.regrada.cli.commands;

import io.regrada.core.Regrada;
import io.regrada.core.graph.Graph;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import picocli.CommandLine;

/// Parses a choreography and writes it back in canonical form.
///
/// Scope endpoints are expanded and nests are flattened on the way out.
/// Parse errors are reported with their line numbers and nothing is written.
///
/// ### Usage
/// ```bash
/// regrada format <source> [-o <output>]
/// ```
@CommandLine.Command(name = "format", description = "Parse a choreography and print it in canonical form")
class FormatCommand extends SourceCommand {

    @CommandLine.Option(
            names = {"-o", "--output"},
            description = "Write to this file instead of standard output")
    private Path output;

    @Override
    protected boolean showBanner() {
        return output != null;
    }

    @Override
    protected void execute() {
        try {
            Graph graph = loadGraph();
            String text = Regrada.serialize(graph);
            if (output == null) {
                System.out.println(text);
                return;
            }
            Files.writeString(output, text + System.lineSeparator(), StandardCharsets.UTF_8);
            System.out.println(" [OK] Formatted " + graph.getEvents().size() + " events to " + output);
        } catch (IOException e) {
            System.err.println(" [FAIL] Cannot write " + output + ": " + e.getMessage());
        } catch (Exception e) {
            System.err.println(" [FAIL] Format failed: " + e.getMessage());
        }
    }
}
