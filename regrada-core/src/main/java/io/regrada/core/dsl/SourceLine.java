package io.regrada.core.dsl;

/// Trimmed non-blank source line with its 1-based number.
record SourceLine(int number, String text) {

    boolean is(String token) {
        return text.equals(token);
    }
}
