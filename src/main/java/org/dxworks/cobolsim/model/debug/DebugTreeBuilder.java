package org.dxworks.cobolsim.model.debug;

import org.dxworks.cobolsim.model.Program;
import org.dxworks.cobolsim.model.SourceSpan;
import org.dxworks.cobolsim.model.statement.IfStatement;
import org.dxworks.cobolsim.model.statement.ReadStatement;
import org.dxworks.cobolsim.model.statement.Statement;

import java.util.List;

/**
 * Derives the debug tree from the spans carried by the program tree.
 */
public final class DebugTreeBuilder {

    private DebugTreeBuilder() {
    }

    public static DebugNode build(Program program) {
        DebugNode root = node("PROGRAM", program.span);
        DebugNode procedure = node("PROCEDURE_DIVISION", program.procedureDivision.span);
        addStatements(procedure, program.procedureDivision.statements);
        root.children.add(procedure);
        return root;
    }

    private static void addStatements(DebugNode parent, List<Statement> statements) {
        for (Statement statement : statements) {
            parent.children.add(build(statement));
        }
    }

    private static DebugNode build(Statement statement) {
        DebugNode node = node(statement.kind().name(), statement.span);
        if (statement instanceof IfStatement ifStatement) {
            addBranch(node, "THEN", ifStatement.thenBody);
            addBranch(node, "ELSE", ifStatement.elseBody);
        } else if (statement instanceof ReadStatement read) {
            addBranch(node, "AT_END", read.atEnd);
        } else {
            for (List<Statement> body : statement.bodies()) {
                addStatements(node, body);
            }
        }
        return node;
    }

    private static void addBranch(DebugNode parent, String kind, List<Statement> body) {
        if (body.isEmpty()) {
            return;
        }
        DebugNode branch = new DebugNode(kind, body.get(0).span.startLine, body.get(body.size() - 1).span.endLine);
        addStatements(branch, body);
        parent.children.add(branch);
    }

    private static DebugNode node(String kind, SourceSpan span) {
        return new DebugNode(kind, span.startLine, span.endLine);
    }
}
