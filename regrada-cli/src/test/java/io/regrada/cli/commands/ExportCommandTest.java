package io.regrada.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import io.regrada.core.project.Project;
import io.regrada.serialization.ProjectSerializer;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ExportCommandTest extends BaseCommandTest {

    @TempDir Path tempDir;

    private ExportCommand command;

    @BeforeEach
    void setUp() throws Exception {
        command = new ExportCommand();
        injectField(command, "sourceFile", writeSource(tempDir, BUYER));
    }

    @Test
    void shouldExportLaidOutProject() throws Exception {
        // Given
        Path output = tempDir.resolve("buyer.json");
        injectField(command, "output", output);

        // When
        command.run();

        // Then
        assertThat(outContent.toString()).contains("Exported 2 events");
        Project project = ProjectSerializer.fromJson(Files.readString(output));
        assertThat(project.code()).isEqualTo(BUYER);
        assertThat(project.graph().getEvents()).hasSize(2);
        assertThat(project.geometry()).containsKeys("e0", "e1");
        assertThat(project.geometry().get("e1").position().x())
                .isGreaterThan(project.geometry().get("e0").position().x());
    }

    @Test
    void shouldExportReducedProjectToStandardOutput() throws Exception {
        // Given
        injectField(command, "reduced", true);

        // When
        command.run();

        // Then
        String output = outContent.toString();
        assertThat(output).contains("\"edges\"");
        assertThat(output).doesNotContain("\"code\"");
        assertThat(output).doesNotContain("\"position\"");
        Project project = ProjectSerializer.fromJson(output);
        assertThat(project.graph().getRelations()).hasSize(1);
    }

    @Test
    void shouldReportParseErrors() throws Exception {
        // Given
        injectField(command, "sourceFile", writeSource(tempDir, "Buyer\n;\nPublic\n;\n(order:Order) [?]"));

        // When
        command.run();

        // Then
        assertThat(errContent.toString()).contains("Export failed");
    }
}
