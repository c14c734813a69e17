package io.regrada.core.compile;

/// Source range reported by the compile service, 1-based lines and columns.
public record SourceSpan(int fromLine, int fromColumn, int toLine, int toColumn) {

    @Override
    public String toString() {
        return fromLine + ":" + fromColumn + "-" + toLine + ":" + toColumn;
    }
}
