package org.pragmatica.symex.match;

import org.junit.jupiter.api.Test;
import org.pragmatica.symex.directive.Directive;
import org.pragmatica.symex.expr.Expression;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class SymbolTableTest {

    private static final Expression RAX = Expression.symbol("rax", 64);
    private static final Expression RBX = Expression.symbol("rbx", 64);

    @Test
    void empty_resolvesNothing() {
        var table = SymbolTable.empty();

        assertTrue(table.isEmpty());
        assertEquals(Optional.empty(), table.resolve("X"));
    }

    @Test
    void bind_returnsExtendedTable_leavesOriginalUnchanged() {
        var table = SymbolTable.empty();

        var extended = table.bind("X", RAX)
                            .orElseThrow();

        assertEquals(Optional.of(RAX), extended.resolve("X"));
        assertTrue(table.isEmpty());
        assertEquals(1, extended.size());
    }

    @Test
    void bind_sameExpressionAgain_keepsTable() {
        var table = SymbolTable.of(Map.of("X", RAX));

        var rebound = table.bind("X", Expression.symbol("rax", 64));

        assertThat(rebound).containsSame(table);
    }

    @Test
    void bind_conflictingExpression_isRejected() {
        var table = SymbolTable.of(Map.of("X", RAX));

        assertTrue(table.bind("X", RBX)
                        .isEmpty());
    }

    @Test
    void translate_resolvesVariableLeaf() {
        var table = SymbolTable.of(Map.of("X", RAX));

        assertEquals(Optional.of(RAX), table.translate((Directive.Variable) Directive.var("X")));
    }

    @Test
    void tables_withSameBindings_areEqual() {
        var first = SymbolTable.empty()
                               .bind("X", RAX)
                               .flatMap(table -> table.bind("Y", RBX))
                               .orElseThrow();
        var second = SymbolTable.of(Map.of("Y", RBX, "X", RAX));

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    void variables_keepBindingOrder() {
        var table = SymbolTable.empty()
                               .bind("B", RBX)
                               .flatMap(t -> t.bind("A", RAX))
                               .orElseThrow();

        assertThat(table.variables()).containsExactly("B", "A");
        assertEquals("{B=rbx, A=rax}", table.toString());
    }
}
