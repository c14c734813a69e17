package io.regrada.core.role;

import static org.assertj.core.api.Assertions.assertThat;

import io.regrada.core.graph.RoleParameter;
import io.regrada.core.projection.model.Expression;
import io.regrada.core.projection.model.Expressions;
import io.regrada.core.projection.model.ProjectedRole;
import io.regrada.core.projection.model.RoleExpr;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RoleBindingResolverTest {

    private static final ProjectedRole SELF = new ProjectedRole("P", List.of(new RoleParameter("id", "Integer")));

    static Expression selfParam(String name) {
        return new Expression.PropDeref(
                new Expression.PropDeref(new Expression.EventRef(Expressions.SELF), "params"), name);
    }

    private static RoleExpr counterpart(String label, String param, Expression value) {
        return new RoleExpr.RoleRef(label, List.of(new RoleExpr.Param(param, value)));
    }

    @Test
    @DisplayName("shares a parameter read by the counterpart through a variable")
    void shouldShareParameter() {
        ResolvedRoles roles = RoleBindingResolver.resolve(
                SELF, List.of(counterpart("Q", "pid", selfParam("id"))), null);

        assertThat(roles.selfText()).isEqualTo("P(#id as A)");
        assertThat(roles.counterpartTexts()).containsExactly("Q(pid=A)");
    }

    @Test
    @DisplayName("binds a parameter fixed by an equality constraint")
    void shouldBindConstrainedParameter() {
        Expression constraint = new Expression.BinaryOp(selfParam("id"), new Expression.IntLit(1), "equals");

        ResolvedRoles roles = RoleBindingResolver.resolve(
                SELF, List.of(counterpart("Q", "pid", selfParam("id"))), constraint);

        assertThat(roles.selfText()).isEqualTo("P(id=1)");
        assertThat(roles.counterpartTexts()).containsExactly("Q(pid=A)");
    }

    @Test
    @DisplayName("lets the last conjunct on a parameter decide its binding")
    void shouldPreferLastConjunctOnSameParameter() {
        Expression first = new Expression.BinaryOp(selfParam("id"), new Expression.IntLit(1), "equals");
        Expression second = new Expression.BinaryOp(selfParam("id"), new Expression.IntLit(2), "equals");
        Expression narrowing = new Expression.BinaryOp(selfParam("id"), new Expression.IntLit(0), "intGreaterThan");

        ResolvedRoles overridden = RoleBindingResolver.resolve(
                SELF, List.of(), new Expression.BinaryOp(first, second, "and"));
        ResolvedRoles dropped = RoleBindingResolver.resolve(
                SELF, List.of(), new Expression.BinaryOp(first, narrowing, "and"));

        assertThat(overridden.selfText()).isEqualTo("P(id=2)");
        assertThat(dropped.selfText()).isEqualTo("P(#id)");
    }

    @Test
    @DisplayName("keeps the declared form for non-equality constraints")
    void shouldIgnoreOtherOperators() {
        Expression constraint = new Expression.BinaryOp(
                new Expression.BinaryOp(selfParam("id"), new Expression.IntLit(3), "intGreaterThan"),
                new Expression.BoolLit(true),
                "and");

        ResolvedRoles roles = RoleBindingResolver.resolve(SELF, List.of(), constraint);

        assertThat(roles.selfText()).isEqualTo("P(#id)");
        assertThat(roles.counterpartTexts()).isEmpty();
    }

    @Test
    @DisplayName("assigns variables in parameter declaration order")
    void shouldAssignVariablesInOrder() {
        ProjectedRole self = new ProjectedRole("P", List.of(
                new RoleParameter("id", "Integer"), new RoleParameter("name", "String")));
        RoleExpr other = new RoleExpr.RoleRef("Q", List.of(
                new RoleExpr.Param("n", selfParam("name")),
                new RoleExpr.Param("i", selfParam("id")),
                new RoleExpr.Param("any", null)));

        ResolvedRoles roles = RoleBindingResolver.resolve(self, List.of(other), null);

        assertThat(roles.selfText()).isEqualTo("P(#id as A; #name as B)");
        assertThat(roles.counterpartTexts()).containsExactly("Q(n=B; i=A; any=*)");
    }

    @Test
    @DisplayName("prints event role counterparts and literal values")
    void shouldPrintEventRolesAndLiterals() {
        ResolvedRoles roles = RoleBindingResolver.resolve(SELF, List.of(
                new RoleExpr.InitiatorOf("e1"),
                counterpart("Q", "name", new Expression.StringLit("bob"))), null);

        assertThat(roles.counterpartTexts()).containsExactly("@Initiator(e1)", "Q(name='bob')");
    }
}
