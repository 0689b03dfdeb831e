package org.pragmatica.symex.match;

import org.pragmatica.symex.directive.Directive;
import org.pragmatica.symex.expr.Expression;
import org.pragmatica.symex.math.BitMath;

import java.util.ArrayList;
import java.util.List;

/**
 * Matches a pattern against an expression node by node.
 *
 * <p>Constants match constants of equal value within the expression's width, variables bind
 * consistently and honour their lookup type, operations match the same operator. For
 * commutative operators the swapped operand order is tried after the direct one.
 * Meta-directives never match.
 */
final class StructuralMatcher implements Matcher {
    static final StructuralMatcher INSTANCE = new StructuralMatcher();

    private StructuralMatcher() {}

    @Override
    public List<SymbolTable> match(Directive pattern, Expression expression) {
        return match(pattern, expression, SymbolTable.empty()).stream()
                                                              .distinct()
                                                              .toList();
    }

    private List<SymbolTable> match(Directive pattern, Expression expression, SymbolTable table) {
        if (pattern instanceof Directive.Constant constant) {
            return expression instanceof Expression.Constant value
                   && value.value() == BitMath.zeroExtend(constant.value(), value.bits())
                   ? List.of(table)
                   : List.of();
        }
        if (pattern instanceof Directive.Variable variable) {
            if (!variable.lookup()
                         .accepts(expression)) {
                return List.of();
            }
            return table.bind(variable.id(), expression)
                        .map(List::of)
                        .orElse(List.of());
        }
        if (pattern instanceof Directive.Operation operation
            && expression instanceof Expression.Operation node
            && operation.op() == node.op()) {
            return matchOperation(operation, node, table);
        }
        return List.of();
    }

    private List<SymbolTable> matchOperation(Directive.Operation pattern, Expression.Operation node, SymbolTable table) {
        if (pattern.lhs()
                   .isEmpty()) {
            return match(pattern.rhs(), node.rhs(), table);
        }
        var lhsPattern = pattern.lhs()
                                .get();
        var lhs = node.lhs()
                      .orElseThrow();
        var results = new ArrayList<>(matchBoth(lhsPattern, lhs, pattern.rhs(), node.rhs(), table));
        if (pattern.op()
                   .isCommutative()) {
            results.addAll(matchBoth(lhsPattern, node.rhs(), pattern.rhs(), lhs, table));
        }
        return results;
    }

    private List<SymbolTable> matchBoth(Directive lhsPattern,
                                        Expression lhs,
                                        Directive rhsPattern,
                                        Expression rhs,
                                        SymbolTable table) {
        var results = new ArrayList<SymbolTable>();
        for (var partial : match(lhsPattern, lhs, table)) {
            results.addAll(match(rhsPattern, rhs, partial));
        }
        return results;
    }
}
