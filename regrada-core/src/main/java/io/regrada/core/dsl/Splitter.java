package io.regrada.core.dsl;

import java.util.ArrayList;
import java.util.List;

/// Splits text on separators that sit outside parentheses and quotes.
final class Splitter {

    private Splitter() {}

    /// Splits on a separator character, trimming parts and dropping blank ones.
    static List<String> splitTopLevel(String text, char separator) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        boolean quoted = false;
        for (char c : text.toCharArray()) {
            if (c == '\'') {
                quoted = !quoted;
            } else if (!quoted && c == '(') {
                depth++;
            } else if (!quoted && c == ')') {
                depth--;
            }
            if (c == separator && depth == 0 && !quoted) {
                addPart(parts, current);
            } else {
                current.append(c);
            }
        }
        addPart(parts, current);
        return parts;
    }

    /// Returns the index of the first occurrence of a token outside parentheses
    /// and quotes, or -1.
    static int indexOfTopLevel(String text, String token) {
        int depth = 0;
        boolean quoted = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
            } else if (!quoted && c == '(') {
                depth++;
            } else if (!quoted && c == ')') {
                depth--;
            } else if (!quoted && depth == 0 && text.startsWith(token, i)) {
                return i;
            }
        }
        return -1;
    }

    private static void addPart(List<String> parts, StringBuilder current) {
        String part = current.toString().trim();
        if (!part.isEmpty()) {
            parts.add(part);
        }
        current.setLength(0);
    }
}
