package io.regrada.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.regrada.cli.config.CompileServiceConfig;
import io.regrada.core.compile.CompileError;
import io.regrada.core.compile.CompileOutcome;
import io.regrada.core.compile.CompileService;
import io.regrada.core.compile.CompileServiceException;
import io.regrada.core.compile.Diagnostic;
import io.regrada.core.compile.SourceSpan;
import io.regrada.core.projection.model.DataType;
import io.regrada.core.projection.model.EventCommon;
import io.regrada.core.projection.model.ProjectedRole;
import io.regrada.core.projection.model.Projection;
import io.regrada.core.projection.model.ProjectionEvent;
import io.regrada.core.projection.model.ProjectionGraph;
import io.regrada.core.projection.model.RoleExpr;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CompileCommandTest extends BaseCommandTest {

    @TempDir Path tempDir;

    @Mock private CompileService compileService;

    private CompileCommand command;

    @BeforeEach
    void setUp() throws Exception {
        command = spy(new CompileCommand());
        injectField(command, "sourceFile", writeSource(tempDir, BUYER));
    }

    @Test
    void shouldPrintImportedProjections() throws Exception {
        // Given
        EventCommon common = new EventCommon(
                "order", "order_Buyer", "Order", new DataType.Value("void"), true, false, null);
        Projection projection = new Projection(
                new ProjectedRole("Buyer", List.of()),
                new ProjectionGraph(
                        List.of(new ProjectionEvent.InputEvent(
                                common, List.of(new RoleExpr.RoleRef("Buyer", List.of())))),
                        List.of()));
        doReturn(compileService).when(command).createCompileService(any());
        when(compileService.compile(anyString())).thenReturn(new CompileOutcome.Completed(List.of(projection)));

        // When
        command.run();

        // Then
        String output = outContent.toString();
        assertThat(output).contains("Compiling");
        assertThat(output).contains("[OK] 1 projection(s)");
        assertThat(output).contains("== Buyer ==");
        assertThat(output).contains("(order:Order)");
    }

    @Test
    void shouldPrintDiagnostics() throws Exception {
        // Given
        CompileError error = new CompileError(List.of(
                new Diagnostic("Unknown role Seller", new SourceSpan(5, 1, 5, 30)),
                new Diagnostic("while checking events", null)));
        doReturn(compileService).when(command).createCompileService(any());
        when(compileService.compile(anyString())).thenReturn(new CompileOutcome.Failed(error));

        // When
        command.run();

        // Then
        String errOutput = errContent.toString();
        assertThat(errOutput).contains("Compile error");
        assertThat(errOutput).contains("5:1-5:30 Unknown role Seller");
        assertThat(errOutput).contains("while checking events");
    }

    @Test
    void shouldWarnWhenResultIsPending() throws Exception {
        // Given
        doReturn(compileService).when(command).createCompileService(any());
        when(compileService.compile(anyString())).thenReturn(new CompileOutcome.Pending(10));

        // When
        command.run();

        // Then
        assertThat(errContent.toString()).contains("No result after 10 poll(s)");
    }

    @Test
    void shouldReportTransportFailure() throws Exception {
        // Given
        doReturn(compileService).when(command).createCompileService(any());
        when(compileService.compile(anyString()))
                .thenThrow(new CompileServiceException("Failed to connect to compile service"));

        // When
        command.run();

        // Then
        assertThat(errContent.toString()).contains("[FAIL] Failed to connect to compile service");
    }

    @Test
    void shouldNotSubmitUnparsableSource() throws Exception {
        // Given
        injectField(command, "sourceFile", writeSource(tempDir, BUYER + "\norder -->* missing"));

        // When
        command.run();

        // Then
        assertThat(errContent.toString()).contains("Compile failed");
        verify(command, never()).createCompileService(any());
    }

    @Test
    void shouldLetOptionsOverrideConfiguration() throws Exception {
        // Given
        injectField(command, "url", "http://compile.test/");
        injectField(command, "pollAttempts", 3);

        // When
        CompileServiceConfig config = command.resolveConfig();

        // Then
        assertThat(config.getUrl()).isEqualTo("http://compile.test");
        assertThat(config.getPollAttempts()).isEqualTo(3);
        assertThat(config.getPollIntervalMs()).isEqualTo(500);
        assertThat(config.getTimeoutMs()).isEqualTo(10_000);
    }
}
