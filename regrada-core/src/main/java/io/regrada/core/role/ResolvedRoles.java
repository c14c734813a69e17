package io.regrada.core.role;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Role expressions for both sides of a compiled interaction.
///
/// @param self expression for the projected role
/// @param counterparts expressions for the other side, in service order
public record ResolvedRoles(RoleExpression self, List<RoleExpression> counterparts) {

    public ResolvedRoles {
        Objects.requireNonNull(self, "self must not be null");
        counterparts = List.copyOf(counterparts);
    }

    public String selfText() {
        return RoleExpressions.format(self);
    }

    public List<String> counterpartTexts() {
        List<String> texts = new ArrayList<>();
        for (RoleExpression counterpart : counterparts) {
            texts.add(RoleExpressions.format(counterpart));
        }
        return texts;
    }
}
