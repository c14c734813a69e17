package io.regrada.core.compile;

import java.util.Optional;

/// Parses the compile service's result payload.
///
/// Keeps `regrada-core` free of JSON libraries; the Jackson implementation
/// lives in `regrada-serialization` as `JacksonCompileResponseParser`.
///
/// ### Payload
/// A JSON array whose entries are either a projection
/// ```json
/// {"role": {"label": "P", "params": []}, "graph": {"events": [], "relations": []}}
/// ```
/// or a compile error
/// ```json
/// {"compileError": {"stackTrace": [{"message": "...", "location": {"from": {...}, "to": {...}}}]}}
/// ```
public interface CompileResponseParser {

    /// Parses one poll response.
    ///
    /// @param content response body, not null
    /// @return empty when the array is empty (not ready yet), otherwise a
    ///     completed or failed outcome
    /// @throws CompileServiceException if the body is not a valid payload
    Optional<CompileOutcome> parse(String content) throws CompileServiceException;
}
