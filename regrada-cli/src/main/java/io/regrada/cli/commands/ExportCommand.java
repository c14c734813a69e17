package io.regrada.cli.commands;

import io.regrada.core.graph.Graph;
import io.regrada.core.layout.LayeredLayout;
import io.regrada.core.project.Project;
import io.regrada.serialization.ProjectFormat;
import io.regrada.serialization.ProjectSerializer;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import picocli.CommandLine;

/// Converts a choreography source file into a project file.
///
/// Every node is placed by [LayeredLayout]. The full format also stores the
/// source text and the id pools; `--reduced` keeps only the graph structure.
///
/// ### Usage
/// ```bash
/// regrada export <source> [-o <project.json>] [--reduced]
/// ```
@CommandLine.Command(name = "export", description = "Write a choreography as a project file")
class ExportCommand extends SourceCommand {

    @CommandLine.Option(
            names = {"-o", "--output"},
            description = "Write to this file instead of standard output")
    private Path output;

    @CommandLine.Option(
            names = {"--reduced"},
            description = "Omit source text, id pools and geometry")
    private boolean reduced;

    @Override
    protected boolean showBanner() {
        return output != null;
    }

    @Override
    protected void execute() {
        try {
            String source = readSource();
            Graph graph = parse(source);
            Project project = Project.of(graph, source).laidOut(new LayeredLayout());
            String json = ProjectSerializer.toJson(project, reduced ? ProjectFormat.REDUCED : ProjectFormat.FULL);

            if (output == null) {
                System.out.println(json);
                return;
            }
            Files.writeString(output, json, StandardCharsets.UTF_8);
            System.out.println(" [OK] Exported " + graph.getEvents().size() + " events to " + output);
        } catch (IOException e) {
            System.err.println(" [FAIL] Cannot write " + output + ": " + e.getMessage());
        } catch (Exception e) {
            System.err.println(" [FAIL] Export failed: " + e.getMessage());
        }
    }
}
