package com.traverse.poc;

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
import com.traverse.poc.traversal.VisitedNode;
import com.traverse.poc.util.SqlStringUtils;

import java.util.Objects;
import java.util.Optional;

/**
 * Renders visited nodes as indented one-line summaries, e.g.
 * <pre>
 *   SET_EXPR: QuerySpecification: SELECT a, b FROM t WHERE (a = 1)
 * </pre>
 */
public class NodePrinter implements NodeVisitor<String, Void> {

    private final Config.OutputOptions options;

    public NodePrinter(Config.OutputOptions options) {
        this.options = Objects.requireNonNull(options, "options is null");
    }

    /**
     * Formats one traversal step.
     * @param visited The visited node.
     * @param arena The arena the traversal ran over.
     * @return The indented line, without line terminator.
     */
    public String format(VisitedNode visited, NodeArena arena) {
        String indent = options.getIndent().repeat(visited.getDepth());
        Optional<Node<?>> node = visited.resolve(arena);
        if (node.isEmpty()) {
            return indent + "<missing node #" + visited.getNodeId() + ">";
        }
        return indent + node.get().getNodeKind() + ": " + summarize(node.get());
    }

    /**
     * @return The single-line summary of a node, cut to the configured width.
     */
    public String summarize(Node<?> node) {
        return SqlStringUtils.abbreviate(node.accept(this, null), options.getMaxSummaryWidth());
    }

    @Override
    public String visitStatement(StatementNode node, Void context) {
        return SqlStringUtils.formatSql(node.getValue());
    }

    @Override
    public String visitSetExpr(SetExprNode node, Void context) {
        return node.getValue().getClass().getSimpleName() + ": " + SqlStringUtils.formatSql(node.getValue());
    }

    @Override
    public String visitSelect(SelectNode node, Void context) {
        return SqlStringUtils.formatSql(node.getValue());
    }

    @Override
    public String visitSelectItem(SelectItemNode node, Void context) {
        return SqlStringUtils.formatSql(node.getValue());
    }

    @Override
    public String visitTableWithJoins(TableWithJoinsNode node, Void context) {
        return SqlStringUtils.formatSql(node.getValue());
    }

    @Override
    public String visitExpr(ExprNode node, Void context) {
        return SqlStringUtils.formatSql(node.getValue());
    }

    @Override
    public String visitBinaryOperator(BinaryOperatorNode node, Void context) {
        return node.getSymbol();
    }
}
