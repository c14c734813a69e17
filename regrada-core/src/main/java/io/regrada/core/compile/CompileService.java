package io.regrada.core.compile;

/// Remote type checker and projector for choreography source.
///
/// @see CompileOutcome for the possible results
public interface CompileService {

    /// Submits source text and waits for its result.
    ///
    /// @param source choreography source, not null
    /// @return projections, a compile error, or pending; never null
    /// @throws CompileServiceException on transport failures or malformed replies
    CompileOutcome compile(String source) throws CompileServiceException;
}
