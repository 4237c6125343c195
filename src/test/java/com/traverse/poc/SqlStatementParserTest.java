package com.traverse.poc;

import com.traverse.poc.ast.Node;
import com.traverse.poc.ast.NodeKind;
import com.traverse.poc.ast.SetExprNode;
import com.traverse.poc.ast.TableWithJoinsNode;
import com.traverse.poc.traversal.VisitedNode;
import io.trino.sql.tree.Query;
import io.trino.sql.tree.QuerySpecification;
import io.trino.sql.tree.Table;
import io.trino.sql.tree.Union;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class SqlStatementParserTest {

    private static final String QUERY_SIMPLE_SELECT = "select a, b from t where a = 1";
    private static final String QUERY_UNION = "select a from t1 union select b from t2";
    private static final String QUERY_MALFORMED = "select from";

    private SqlStatementParser parser;

    @BeforeAll
    void setup() {
        parser = new SqlStatementParser();
    }

    @Test
    @DisplayName("Simple SELECT walks statement, body and its single table")
    void testSimpleSelect() {
        List<StatementTraversal> traversals = parser.traverse(QUERY_SIMPLE_SELECT);
        assertEquals(1, traversals.size());

        StatementTraversal statement = traversals.get(0);
        assertEquals(0, statement.getRootId());
        List<VisitedNode> visited = statement.getTraversal().traverseAll();

        assertEquals(3, visited.size());
        List<Node<?>> nodes = resolve(statement, visited);
        assertEquals(List.of(0, 1, 2), depths(visited));
        assertEquals(NodeKind.STATEMENT, nodes.get(0).getNodeKind());
        assertInstanceOf(Query.class, nodes.get(0).getValue());
        assertInstanceOf(SetExprNode.class, nodes.get(1));
        assertInstanceOf(QuerySpecification.class, nodes.get(1).getValue());
        assertInstanceOf(TableWithJoinsNode.class, nodes.get(2));
        assertEquals("t", ((Table) nodes.get(2).getValue()).getName().getSuffix());
        assertEquals(3, statement.getArena().size());
    }

    @Test
    @DisplayName("UNION stops below the set expression")
    void testUnionIsTruncated() {
        StatementTraversal statement = parser.traverse(QUERY_UNION).get(0);
        List<VisitedNode> visited = statement.getTraversal().traverseAll();

        assertEquals(2, visited.size());
        assertEquals(List.of(0, 1), depths(visited));
        List<Node<?>> nodes = resolve(statement, visited);
        assertEquals(NodeKind.STATEMENT, nodes.get(0).getNodeKind());
        assertEquals(NodeKind.SET_EXPR, nodes.get(1).getNodeKind());
        assertInstanceOf(Union.class, nodes.get(1).getValue());
        assertTrue(((SetExprNode) nodes.get(1)).isSetOperation());
    }

    @Test
    @DisplayName("Malformed SQL is rejected with the parser diagnostic")
    void testMalformedInput() {
        QueryParseException e = assertThrows(QueryParseException.class, () -> parser.traverse(QUERY_MALFORMED));

        assertEquals(QUERY_MALFORMED, e.getSql());
        assertEquals(1, e.getLineNumber());
        assertTrue(e.getColumnNumber() > 0);
        assertTrue(e.getMessage().contains(e.getErrorMessage()));
        assertInstanceOf(io.trino.sql.parser.ParsingException.class, e.getCause());
    }

    @Test
    @DisplayName("Each statement gets its own traversal and arena")
    void testMultipleStatements() {
        List<StatementTraversal> traversals = parser.traverse(
                "select a from t1, t2; select b from t3 union select c from t4;\n select 1");

        assertEquals(3, traversals.size());
        List<Integer> counts = new ArrayList<>();
        for (StatementTraversal statement : traversals) {
            assertEquals(0, statement.getRootId());
            counts.add(statement.getTraversal().traverseAll().size());
            assertEquals(statement.getTraversal().getVisitedCount(), statement.getArena().size());
        }
        assertEquals(List.of(4, 2, 2), counts);
    }

    @Test
    @DisplayName("Parse failures are reported only through the exception")
    void testParseFailureWritesNothing() {
        PrintStream originalErr = System.err;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        System.setErr(new PrintStream(captured, true, StandardCharsets.UTF_8));
        try {
            assertThrows(QueryParseException.class, () -> parser.parse(QUERY_MALFORMED));
        } finally {
            System.setErr(originalErr);
        }
        assertEquals("", new String(captured.toByteArray(), StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Semicolons in literals, quoted identifiers and comments do not split statements")
    void testSplitRespectsQuotesAndComments() {
        List<String> texts = SqlStatementParser.split(
                "select 'a;b' as \"x;y\" from t -- trailing; comment\n;"
                        + " /* block; comment */ select 'it''s;' from u;\n-- only a comment;\n");

        assertEquals(List.of(
                "select 'a;b' as \"x;y\" from t -- trailing; comment",
                "/* block; comment */ select 'it''s;' from u"), texts);
        assertEquals(2, parser.parse(String.join(";\n", texts)).size());
    }

    @Test
    @DisplayName("A statement without terminator after terminated ones is kept")
    void testSplitTrailingStatement() {
        assertEquals(List.of("select 1", "select 2"), SqlStatementParser.split("select 1;\n  select 2  "));
        assertEquals(List.of("select 1"), SqlStatementParser.split(";;select 1;;"));
    }

    @Test
    @DisplayName("An unterminated string is rejected by the parser")
    void testUnterminatedString() {
        assertThrows(QueryParseException.class, () -> parser.parse("select 'abc; select 1"));
    }

    @Test
    @DisplayName("One bad statement rejects the whole input")
    void testBadStatementRejectsInput() {
        assertThrows(QueryParseException.class, () -> parser.traverse("select a from t; select from"));
    }

    @Test
    @DisplayName("Blank input has no statements")
    void testBlankInput() {
        assertTrue(parser.parse("").isEmpty());
        assertTrue(parser.parse("  ;  ").isEmpty());
        assertTrue(parser.parse("-- nothing here;\n/* still nothing */ ;").isEmpty());
    }

    @Test
    @DisplayName("Statements other than queries yield only the root")
    void testInsertStatement() {
        List<VisitedNode> visited = parser.traverse("insert into t select a from u").get(0)
                .getTraversal().traverseAll();
        assertEquals(List.of(new VisitedNode(0, 0)), visited);
    }

    private static List<Node<?>> resolve(StatementTraversal statement, List<VisitedNode> visited) {
        List<Node<?>> nodes = new ArrayList<>();
        for (VisitedNode node : visited) {
            nodes.add(node.resolve(statement.getArena()).orElseThrow());
        }
        return nodes;
    }

    private static List<Integer> depths(List<VisitedNode> visited) {
        List<Integer> depths = new ArrayList<>();
        for (VisitedNode node : visited) {
            depths.add(node.getDepth());
        }
        return depths;
    }
}
