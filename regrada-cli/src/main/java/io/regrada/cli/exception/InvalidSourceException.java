package io.regrada.cli.exception;

import java.io.Serial;

/// Thrown when a choreography source file cannot be read or does not parse.
///
/// Common causes:
/// - Source file not found or unreadable
/// - Parse errors, one line each in the message
///
/// @see io.regrada.cli.commands.SourceCommand
public class InvalidSourceException extends Exception {

    @Serial private static final long serialVersionUID = 5206489177357325318L;

    /// Creates an exception with the specified detail message.
    ///
    /// @param message description of why the source is unusable, not null
    public InvalidSourceException(String message) {
        super(message);
    }

    /// Creates an exception with the specified detail message and cause.
    ///
    /// @param message description of why the source is unusable, not null
    /// @param cause underlying I/O failure
    public InvalidSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
