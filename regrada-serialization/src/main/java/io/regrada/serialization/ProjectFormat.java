package io.regrada.serialization;

/// Variant of the project file written by [ProjectSerializer].
///
/// Both variants are read by the same deserializer.
public enum ProjectFormat {

    /// Everything needed to resume editing: node geometry, source text and
    /// the three id pools (`nextNodeId`, `nextGroupId`, `nextSubprocessId`).
    FULL,

    /// Structure only. Geometry, source text and pools are left out; pools are
    /// rebuilt from the ids in use when the file is read back.
    REDUCED
}
