package com.traverse.poc;

import com.traverse.poc.traversal.PreOrderTraversal;
import com.traverse.poc.traversal.VisitedNode;

import java.io.PrintStream;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Command line entry point: parses the SQL given as arguments (or the configured
 * default query) and prints every node of each statement in pre-order.
 */
public class Main {

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Runs the tool.
     * @param args SQL text, joined with spaces. Falls back to the configured default query when empty.
     * @param out Destination for the traversal output.
     * @param err Destination for errors.
     * @return Process exit status: 0 on success, 1 on configuration or parse failure, 2 when there is nothing to parse.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        printHeader(out);

        // --- Load Config ---
        Config config;
        try {
            config = Config.loadFromResources(Config.DEFAULT_RESOURCE);
            out.println("INFO: Configuration loaded successfully.");
        } catch (RuntimeException e) {
            err.println("FATAL: Configuration loading failed: " + e.getMessage());
            e.printStackTrace(err);
            return 1;
        }

        String sql = args.length > 0 ? String.join(" ", args) : config.getDefaultQuery();
        if (sql == null || sql.isBlank()) {
            err.println("ERROR: No SQL given and no defaultQuery configured.");
            return 2;
        }

        List<StatementTraversal> traversals;
        try {
            traversals = new SqlStatementParser().traverse(sql);
        } catch (QueryParseException e) {
            err.println("ERROR: " + e.getErrorMessage() + " (line " + e.getLineNumber()
                    + ", column " + e.getColumnNumber() + ")");
            return 1;
        }

        NodePrinter printer = new NodePrinter(config.getOutput());
        for (StatementTraversal statement : traversals) {
            if (config.getOutput().isPrintStatement()) {
                out.println("--------------------------------------------------------");
                out.println(statement.getStatement());
                out.println("--------------------------------------------------------");
            }
            PreOrderTraversal traversal = statement.getTraversal();
            while (traversal.hasNext()) {
                VisitedNode visited = traversal.next();
                out.println(printer.format(visited, statement.getArena()));
            }
            out.println("INFO: Visited " + traversal.getVisitedCount() + " node(s).");
        }
        return 0;
    }

    /**
     * Prints a header with current timestamp.
     */
    private static void printHeader(PrintStream out) {
        DateTimeFormatter formatter = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");
        out.println("--- SQL AST Traversal ---");
        out.println("Run Time: " + ZonedDateTime.now().format(formatter));
        out.println("-------------------------");
    }
}
