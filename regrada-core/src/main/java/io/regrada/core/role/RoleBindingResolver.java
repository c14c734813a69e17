package io.regrada.core.role;

import io.regrada.core.graph.RoleParameter;
import io.regrada.core.projection.model.Expression;
import io.regrada.core.projection.model.Expressions;
import io.regrada.core.projection.model.ProjectedRole;
import io.regrada.core.projection.model.RoleExpr;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Infers parameter bindings for the two sides of a compiled interaction.
///
/// A counterpart parameter whose value reads the triggering event's own
/// parameter (`_@self.params.<name>`) makes that parameter shared. Shared
/// parameters receive existential variables `A`, `B`, `C`, ... in order of
/// first use: the self side declares `#name as A` and every counterpart
/// reference prints `A`. Unshared self parameters print `#name`.
///
/// ### Instantiation constraints
/// With a constraint (a conjunction), each self parameter takes the first
/// conjunct whose left-hand side names it. An equality binds `name=<rhs>`,
/// with a self reference in the rhs replaced by its variable. Any other
/// operator, or no matching conjunct at all, keeps the shared form.
///
/// ```
/// self P(id:Integer), counterpart Q(pid=_@self.params.id)
///   -> P(#id as A)   Q(pid=A)
/// constraint _@self.params.id == 1
///   -> P(id=1)       Q(pid=A)
/// ```
///
/// @implNote Purely structural; knows nothing about concrete role instances.
public final class RoleBindingResolver {

    private RoleBindingResolver() {}

    /// Resolves both sides of an interaction.
    ///
    /// @param self the projected role, not null
    /// @param counterparts compiled counterpart expressions, not null
    /// @param instantiationConstraint optional constraint, may be null
    /// @return resolved expressions, never null
    public static ResolvedRoles resolve(
            ProjectedRole self, List<RoleExpr> counterparts, Expression instantiationConstraint) {
        Map<String, String> variables = sharedVariables(self, counterparts);

        List<RoleExpression> resolvedCounterparts = new ArrayList<>();
        for (RoleExpr counterpart : counterparts) {
            resolvedCounterparts.add(resolveCounterpart(counterpart, variables));
        }

        List<Expression> conjuncts = Expressions.conjuncts(instantiationConstraint);
        List<ParameterBinding> selfBindings = new ArrayList<>();
        for (RoleParameter param : self.params()) {
            ParameterBinding shared = new ParameterBinding.Declared(param.name(), variables.get(param.name()));
            Expression conjunct = matchingConjunct(conjuncts, param.name());
            if (conjunct instanceof Expression.BinaryOp op && "equals".equals(op.op())) {
                selfBindings.add(new ParameterBinding.Bound(param.name(), value(op.right(), variables)));
            } else {
                selfBindings.add(shared);
            }
        }
        return new ResolvedRoles(
                new RoleExpression.RoleRef(self.label(), selfBindings), resolvedCounterparts);
    }

    /// Assigns variables to self parameters read by some counterpart, in
    /// declaration order.
    static Map<String, String> sharedVariables(ProjectedRole self, List<RoleExpr> counterparts) {
        List<String> referenced = new ArrayList<>();
        for (RoleExpr counterpart : counterparts) {
            if (counterpart instanceof RoleExpr.RoleRef ref) {
                for (RoleExpr.Param param : ref.params()) {
                    String selfParam = Expressions.selfParameter(param.value());
                    if (selfParam != null) {
                        referenced.add(selfParam);
                    }
                }
            }
        }
        Map<String, String> variables = new LinkedHashMap<>();
        char next = 'A';
        for (RoleParameter param : self.params()) {
            if (referenced.contains(param.name())) {
                variables.put(param.name(), String.valueOf(next));
                next++;
            }
        }
        return variables;
    }

    private static RoleExpression resolveCounterpart(RoleExpr counterpart, Map<String, String> variables) {
        if (counterpart instanceof RoleExpr.InitiatorOf initiator) {
            return new RoleExpression.EventRoleRef(RoleExpression.Side.INITIATOR, initiator.eventId());
        }
        if (counterpart instanceof RoleExpr.ReceiverOf receiver) {
            return new RoleExpression.EventRoleRef(RoleExpression.Side.RECEIVER, receiver.eventId());
        }
        RoleExpr.RoleRef ref = (RoleExpr.RoleRef) counterpart;
        List<ParameterBinding> bindings = new ArrayList<>();
        for (RoleExpr.Param param : ref.params()) {
            if (param.value() == null) {
                bindings.add(new ParameterBinding.Wildcard(param.name()));
            } else {
                bindings.add(new ParameterBinding.Bound(param.name(), value(param.value(), variables)));
            }
        }
        return new RoleExpression.RoleRef(ref.roleLabel(), bindings);
    }

    /// Returns the last conjunct constraining the parameter; later conjuncts override earlier ones.
    private static Expression matchingConjunct(List<Expression> conjuncts, String paramName) {
        Expression match = null;
        for (Expression conjunct : conjuncts) {
            if (conjunct instanceof Expression.BinaryOp op
                    && paramName.equals(Expressions.trailingName(op.left()))) {
                match = conjunct;
            }
        }
        return match;
    }

    private static String value(Expression expression, Map<String, String> variables) {
        if (expression == null) {
            return "*";
        }
        String selfParam = Expressions.selfParameter(expression);
        if (selfParam != null && variables.containsKey(selfParam)) {
            return variables.get(selfParam);
        }
        return Expressions.format(expression);
    }
}
