package io.regrada.cli.commands;

import io.regrada.cli.exception.InvalidSourceException;
import io.regrada.core.Regrada;
import io.regrada.core.dsl.ParseError;
import io.regrada.core.dsl.ParseResult;
import io.regrada.core.graph.Graph;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;
import picocli.CommandLine.Parameters;

/// Base class for commands that read one choreography source file.
///
/// ### Source Loading
/// The file named by the positional parameter is read as UTF-8 and parsed.
/// Any parse error makes the whole source unusable: [#loadGraph()] reports
/// every error line in the exception message.
///
/// @implNote Subclasses must be package-private and annotated with `@Command`.
/// @see FormatCommand
/// @see SimulateCommand
/// @see ExportCommand
/// @see CompileCommand
public abstract class SourceCommand extends RegradaCommand {

    @Parameters(index = "0", description = "Choreography source file (.tardisdcr)")
    protected Path sourceFile;

    /// Reads the source file.
    ///
    /// @return file contents, never null
    /// @throws InvalidSourceException if the file is missing or unreadable
    protected String readSource() throws InvalidSourceException {
        if (sourceFile == null) {
            throw new InvalidSourceException("No source file specified");
        }
        if (!Files.isRegularFile(sourceFile)) {
            throw new InvalidSourceException("Source file not found: " + sourceFile);
        }
        try {
            return Files.readString(sourceFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InvalidSourceException("Cannot read " + sourceFile + ": " + e.getMessage(), e);
        }
    }

    /// Reads and parses the source file.
    ///
    /// @return parsed graph, never null
    /// @throws InvalidSourceException if the file cannot be read or has parse errors
    protected Graph loadGraph() throws InvalidSourceException {
        return parse(readSource());
    }

    /// Parses source text, rejecting it when any line fails.
    ///
    /// @param source choreography source, not null
    /// @return parsed graph, never null
    /// @throws InvalidSourceException listing every parse error
    protected Graph parse(String source) throws InvalidSourceException {
        ParseResult result = Regrada.parse(source);
        if (!result.isSuccessful()) {
            String errors = result.errors().stream()
                    .map(ParseError::toString)
                    .collect(Collectors.joining(System.lineSeparator() + "   "));
            throw new InvalidSourceException(
                    result.errors().size() + " parse error(s):" + System.lineSeparator() + "   " + errors);
        }
        return result.graph();
    }
}
