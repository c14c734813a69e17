package io.regrada.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SimulateCommandTest extends BaseCommandTest {

    @TempDir Path tempDir;

    private SimulateCommand command;

    @BeforeEach
    void setUp() throws Exception {
        command = new SimulateCommand();
        injectField(command, "sourceFile", writeSource(tempDir, BUYER));
    }

    @Test
    void shouldPrintInitialMarking() {
        // When
        command.run();

        // Then
        String output = outContent.toString();
        assertThat(output).contains("Choreographies as DCR graphs");
        assertThat(output).contains("Enabled: e0");
        assertThat(output).doesNotContain("Fired");
    }

    @Test
    void shouldFireEventsInOrder() throws Exception {
        // Given
        injectField(command, "fire", List.of("e0", "e1"));

        // When
        command.run();

        // Then
        String output = outContent.toString();
        assertThat(output).contains("Fired e0");
        assertThat(output).contains("Fired e1");
        assertThat(output).contains("Enabled: e0, e1");
        assertThat(errContent.toString()).doesNotContain("[FAIL]").doesNotContain("Cannot fire");
    }

    @Test
    void shouldStopAtRejectedEvent() throws Exception {
        // Given
        injectField(command, "fire", List.of("e1", "e0"));

        // When
        command.run();

        // Then
        assertThat(errContent.toString()).contains("Cannot fire e1: NOT_EXECUTABLE");
        assertThat(outContent.toString()).doesNotContain("Fired e0");
    }

    @Test
    void shouldRejectUnknownEvent() throws Exception {
        // Given
        injectField(command, "fire", List.of("e9"));

        // When
        command.run();

        // Then
        assertThat(errContent.toString()).contains("Cannot fire e9: UNKNOWN_EVENT");
    }
}
