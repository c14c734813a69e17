package io.regrada.core.role;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Parses and prints role expressions.
///
/// ### Grammar
/// ```
/// expr     := '@Initiator(' id ')' | '@Receiver(' id ')' | Label ('(' binding (';' binding)* ')')?
/// binding  := '#' name ('as' Var)? | name '=' ('*' | value)
/// ```
///
/// [#format(RoleExpression)] is the inverse of [#parse(String)] up to
/// whitespace: `P( id = 1 )` prints as `P(id=1)`.
public final class RoleExpressions {

    private static final Pattern EVENT_ROLE = Pattern.compile("^(@Initiator|@Receiver)\\(\\s*([^()\\s]+)\\s*\\)$");
    private static final Pattern ROLE = Pattern.compile("^([A-Za-z_][\\w]*)\\s*(?:\\((.*)\\))?$");
    private static final Pattern NAME = Pattern.compile("[A-Za-z_][\\w]*");
    private static final Pattern DECLARED = Pattern.compile("^#([A-Za-z_][\\w]*)(?:\\s+as\\s+([A-Za-z_][\\w]*))?$");

    private RoleExpressions() {}

    /// Parses role-expression text.
    ///
    /// @param text expression text, not null
    /// @return structured expression, never null
    /// @throws RoleExpressionSyntaxException if the text is not a role expression
    public static RoleExpression parse(String text) throws RoleExpressionSyntaxException {
        String trimmed = text.trim();
        Matcher eventRole = EVENT_ROLE.matcher(trimmed);
        if (eventRole.matches()) {
            RoleExpression.Side side = "@Initiator".equals(eventRole.group(1))
                    ? RoleExpression.Side.INITIATOR
                    : RoleExpression.Side.RECEIVER;
            return new RoleExpression.EventRoleRef(side, eventRole.group(2));
        }
        Matcher role = ROLE.matcher(trimmed);
        if (!role.matches()) {
            throw new RoleExpressionSyntaxException("Invalid role expression: '" + text + "'");
        }
        List<ParameterBinding> bindings = new ArrayList<>();
        String body = role.group(2);
        if (body != null && !body.isBlank()) {
            for (String part : splitBindings(body)) {
                bindings.add(parseBinding(part.trim(), text));
            }
        }
        return new RoleExpression.RoleRef(role.group(1), bindings);
    }

    /// Parses a list of role expressions, skipping blank entries.
    public static List<RoleExpression> parseAll(List<String> texts) throws RoleExpressionSyntaxException {
        List<RoleExpression> result = new ArrayList<>();
        for (String text : texts) {
            if (!text.isBlank()) {
                result.add(parse(text));
            }
        }
        return result;
    }

    /// Prints a role expression.
    public static String format(RoleExpression expression) {
        if (expression instanceof RoleExpression.EventRoleRef ref) {
            return ref.side().keyword() + "(" + ref.eventId() + ")";
        }
        RoleExpression.RoleRef ref = (RoleExpression.RoleRef) expression;
        if (ref.bindings().isEmpty()) {
            return ref.label();
        }
        List<String> parts = new ArrayList<>();
        for (ParameterBinding binding : ref.bindings()) {
            parts.add(format(binding));
        }
        return ref.label() + "(" + String.join("; ", parts) + ")";
    }

    public static String format(ParameterBinding binding) {
        if (binding instanceof ParameterBinding.Bound bound) {
            return bound.name() + "=" + bound.value();
        }
        if (binding instanceof ParameterBinding.Declared declared) {
            return declared.alias() == null
                    ? "#" + declared.name()
                    : "#" + declared.name() + " as " + declared.alias();
        }
        return binding.name() + "=*";
    }

    /// Returns the role label an expression refers to, or null for event-role references.
    public static String roleLabel(RoleExpression expression) {
        return expression instanceof RoleExpression.RoleRef ref ? ref.label() : null;
    }

    private static ParameterBinding parseBinding(String part, String text) throws RoleExpressionSyntaxException {
        Matcher declared = DECLARED.matcher(part);
        if (declared.matches()) {
            return new ParameterBinding.Declared(declared.group(1), declared.group(2));
        }
        int eq = part.indexOf('=');
        if (eq > 0) {
            String name = part.substring(0, eq).trim();
            String value = part.substring(eq + 1).trim();
            if (NAME.matcher(name).matches() && !value.isEmpty()) {
                return "*".equals(value)
                        ? new ParameterBinding.Wildcard(name)
                        : new ParameterBinding.Bound(name, value);
            }
        }
        throw new RoleExpressionSyntaxException("Invalid parameter binding '" + part + "' in '" + text + "'");
    }

    // quoted values may contain ';'
    private static List<String> splitBindings(String body) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (char c : body.toCharArray()) {
            if (c == '\'') {
                quoted = !quoted;
            }
            if (c == ';' && !quoted) {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        parts.add(current.toString());
        return parts;
    }
}
