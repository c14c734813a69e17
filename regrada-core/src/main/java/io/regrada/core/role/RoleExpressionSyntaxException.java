package io.regrada.core.role;

import java.io.Serial;

/// Thrown when role-expression text cannot be parsed.
public class RoleExpressionSyntaxException extends Exception {

    @Serial private static final long serialVersionUID = 4127301986543229814L;

    public RoleExpressionSyntaxException(String message) {
        super(message);
    }
}
