package com.traverse.poc.traversal;

import com.traverse.poc.ast.BinaryOperatorNode;
import com.traverse.poc.ast.ExprNode;
import com.traverse.poc.ast.Node;
import com.traverse.poc.ast.NodeArena;
import com.traverse.poc.ast.NodeVisitor;
import com.traverse.poc.ast.SelectItemNode;
import com.traverse.poc.ast.SelectNode;
import com.traverse.poc.ast.SetExprNode;
import com.traverse.poc.ast.StatementNode;
import com.traverse.poc.ast.TableWithJoinsNode;
import io.trino.sql.tree.Join;
import io.trino.sql.tree.Query;
import io.trino.sql.tree.QuerySpecification;
import io.trino.sql.tree.Relation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Produces the children of arena nodes one at a time.
 * <p>
 * Each call to {@link #next(EnumerationCursor)} looks at the node under the cursor and the
 * cursor's step count, then either allocates exactly one child into the arena and returns
 * its id, or reports exhaustion. Node kinds (or variants) without an enumeration order
 * here are exhausted immediately: partial coverage ends the branch, it never fails the walk.
 * <p>
 * Enumeration order per kind:
 * <ul>
 *   <li>Statement: a {@link Query} yields its body as a SetExpr; other statements have no children.</li>
 *   <li>SetExpr: a SELECT block yields its FROM entries as TableWithJoins, in source order.
 *       Set operations, VALUES, TABLE and nested queries have no children yet.</li>
 *   <li>Select, SelectItem, TableWithJoins, Expr, BinaryOperator: no children yet.</li>
 * </ul>
 */
public class ChildEnumerator implements NodeVisitor<OptionalInt, EnumerationCursor> {

    private final NodeArena arena;

    public ChildEnumerator(NodeArena arena) {
        this.arena = Objects.requireNonNull(arena, "arena is null");
    }

    public NodeArena getArena() {
        return arena;
    }

    /**
     * Produces the next child of the cursor's node.
     * @param cursor The enumeration state of the node being expanded. Advanced on success.
     * @return The id of the newly allocated child, or empty once the node is exhausted.
     */
    public OptionalInt next(EnumerationCursor cursor) {
        Objects.requireNonNull(cursor, "cursor is null");
        if (cursor.isExhausted()) {
            return OptionalInt.empty();
        }
        Optional<Node<?>> node = arena.get(cursor.getNodeId());
        if (node.isEmpty()) {
            System.err.println("WARN: Node id " + cursor.getNodeId() + " is outside the arena (size "
                    + arena.size() + "), ending this branch.");
            return exhausted(cursor);
        }
        return node.get().accept(this, cursor);
    }

    // --- Visitor Methods ---

    @Override
    public OptionalInt visitStatement(StatementNode node, EnumerationCursor cursor) {
        if (node.getValue() instanceof Query) {
            if (cursor.getStep() == 0) {
                Query query = (Query) node.getValue();
                return produce(new SetExprNode(query.getQueryBody()), cursor);
            }
        }
        // TODO: enumerate INSERT sources, the next statement kind after queries
        return exhausted(cursor);
    }

    @Override
    public OptionalInt visitSetExpr(SetExprNode node, EnumerationCursor cursor) {
        if (node.isSelect()) {
            List<Relation> from = fromEntries((QuerySpecification) node.getValue());
            int step = cursor.getStep();
            if (step < from.size()) {
                return produce(new TableWithJoinsNode(from.get(step)), cursor);
            }
            // Projection and WHERE are not enumerated.
        }
        return exhausted(cursor);
    }

    @Override
    public OptionalInt visitSelect(SelectNode node, EnumerationCursor cursor) {
        return exhausted(cursor);
    }

    @Override
    public OptionalInt visitSelectItem(SelectItemNode node, EnumerationCursor cursor) {
        return exhausted(cursor);
    }

    @Override
    public OptionalInt visitTableWithJoins(TableWithJoinsNode node, EnumerationCursor cursor) {
        return exhausted(cursor);
    }

    @Override
    public OptionalInt visitExpr(ExprNode node, EnumerationCursor cursor) {
        return exhausted(cursor);
    }

    @Override
    public OptionalInt visitBinaryOperator(BinaryOperatorNode node, EnumerationCursor cursor) {
        return exhausted(cursor);
    }

    // --- Helpers ---

    private OptionalInt produce(Node<?> child, EnumerationCursor cursor) {
        int id = arena.allocate(child);
        cursor.advance();
        return OptionalInt.of(id);
    }

    private static OptionalInt exhausted(EnumerationCursor cursor) {
        cursor.markExhausted();
        return OptionalInt.empty();
    }

    /**
     * Splits the FROM clause of a SELECT block into its comma-separated entries.
     * The parser folds {@code FROM a, b, c} into left-deep implicit joins; those are unfolded
     * here, while explicit joins stay inside the entry they belong to.
     * @param select The SELECT block.
     * @return The FROM entries in source order, empty if there is no FROM clause.
     */
    static List<Relation> fromEntries(QuerySpecification select) {
        if (select.getFrom().isEmpty()) {
            return List.of();
        }
        List<Relation> entries = new ArrayList<>();
        collectFromEntries(select.getFrom().get(), entries);
        return entries;
    }

    private static void collectFromEntries(Relation relation, List<Relation> entries) {
        if (relation instanceof Join && ((Join) relation).getType() == Join.Type.IMPLICIT) {
            Join join = (Join) relation;
            collectFromEntries(join.getLeft(), entries);
            collectFromEntries(join.getRight(), entries);
        } else {
            entries.add(relation);
        }
    }
}
