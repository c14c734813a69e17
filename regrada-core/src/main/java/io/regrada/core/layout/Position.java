package io.regrada.core.layout;

/// Top-left canvas position of a node.
public record Position(double x, double y) {}
