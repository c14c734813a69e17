package io.regrada.core.compile;

import java.io.Serial;

/// Thrown when the compile service cannot be reached or answers with
/// something other than a compile result.
public class CompileServiceException extends Exception {

    @Serial private static final long serialVersionUID = -2718094473120559362L;

    public CompileServiceException(String message) {
        super(message);
    }

    public CompileServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
