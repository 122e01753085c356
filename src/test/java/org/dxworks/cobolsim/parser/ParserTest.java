package org.dxworks.cobolsim.parser;

import org.dxworks.cobolsim.CompilationError;
import org.dxworks.cobolsim.model.*;
import org.dxworks.cobolsim.model.expression.*;
import org.dxworks.cobolsim.model.statement.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.cobolsim.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    @Test
    void parsesWorkingStorageDeclarations() {
        Program program = parse(program("DECLS", storage(
                "01 WS-NAME PIC X(10) VALUE \"ALICE\".",
                "01 WS-AMOUNT PIC S9(3)V99.",
                "01 WS-COUNT PIC 9 VALUE ZERO."),
                "STOP RUN."));

        assertEquals("DECLS", program.id);
        List<VariableDeclaration> storage = program.dataDivision.workingStorage;
        assertEquals(3, storage.size());

        VariableDeclaration name = storage.get(0);
        assertEquals(PicType.ALPHANUMERIC, name.picType);
        assertEquals(10, name.length);
        assertEquals("X(10)", name.picture);
        assertEquals("ALICE", ((StringLiteral) name.initialValue).value);
        assertEquals(DataSection.WORKING_STORAGE, name.section);
        assertEquals(5, name.line);
        assertEquals(8, name.column);

        VariableDeclaration amount = storage.get(1);
        assertEquals(PicType.NUMERIC, amount.picType);
        assertEquals(5, amount.length);

        assertEquals(FigurativeConstant.ZERO, ((Figurative) storage.get(2).initialValue).constant);
    }

    @Test
    void statementSpanCoversAllLinesOfTheStatement() {
        Program program = parse(program("SPANS", storage("01 WS-A PIC 9."),
                "IF WS-A = 1",
                "    DISPLAY \"ONE\"",
                "END-IF",
                "STOP RUN."));

        List<Statement> statements = program.procedureDivision.statements;
        assertEquals(2, statements.size());

        Statement ifStatement = statements.get(0);
        assertEquals(StatementKind.IF, ifStatement.kind());
        assertEquals(7, ifStatement.span.startLine);
        assertEquals(12, ifStatement.span.startColumn);
        assertEquals(9, ifStatement.span.endLine);

        assertEquals(10, statements.get(1).line());
    }

    @Test
    void periodClosesEveryOpenScope() {
        Program program = parse(program("SENTENCE", storage("01 WS-A PIC 9."),
                "IF WS-A = 1",
                "    DISPLAY \"ONE\"",
                "ELSE",
                "    PERFORM 2 TIMES",
                "        DISPLAY \"OTHER\".",
                "DISPLAY \"AFTER\"."));

        List<Statement> statements = program.procedureDivision.statements;
        assertEquals(2, statements.size());

        IfStatement ifStatement = (IfStatement) statements.get(0);
        assertEquals(1, ifStatement.thenBody.size());
        PerformStatement perform = (PerformStatement) ifStatement.elseBody.get(0);
        assertEquals(1, perform.body.size());
        assertEquals(2, ((NumericLiteral) perform.times).value.intValue());
    }

    @Test
    void performWithoutTerminatorOrPeriodIsASyntaxError() {
        CompileResult result = Parser.parse(program("NOEND", storage(),
                "PERFORM 3 TIMES",
                "    DISPLAY \"A\""));

        assertFalse(result.isSuccess());
        assertEquals(Parser.SYNTAX_ERROR, result.getError().code);
        assertTrue(result.getError().message.contains("END-PERFORM"));
    }

    @Test
    void strayScopeTerminatorsHaveDedicatedCodes() {
        assertStray("ELSE", Parser.ELSE_WITHOUT_IF);
        assertStray("END-IF", Parser.END_IF_WITHOUT_IF);
        assertStray("END-PERFORM", Parser.END_PERFORM_WITHOUT_PERFORM);
        assertStray("END-READ", Parser.END_READ_WITHOUT_READ);
    }

    private static void assertStray(String terminator, String code) {
        CompileResult result = Parser.parse(program("STRAY", storage(), "DISPLAY \"A\"", terminator + "."));

        CompilationError error = result.getError();
        assertEquals(code, error.code);
        assertEquals(7, error.line);
        assertEquals(12, error.column);
    }

    @Test
    void unknownStatementReportsTokenPosition() {
        CompileResult result = Parser.parse(program("UNKNOWN", storage(), "FROBNICATE X."));

        CompilationError error = result.getError();
        assertEquals(Parser.SYNTAX_ERROR, error.code);
        assertEquals(6, error.line);
        assertEquals(12, error.column);
        assertTrue(error.message.contains("'FROBNICATE'"));
    }

    @Test
    void conditionNameTestsItsParentAgainstItsValue() {
        Program program = parse(program("FLAGS", storage(
                "01 WS-FLAG PIC X VALUE \"N\".",
                "    88 IS-DONE VALUE \"Y\"."),
                "IF NOT IS-DONE DISPLAY \"PENDING\" END-IF."));

        ConditionName conditionName = program.dataDivision.conditionNames.get(0);
        assertEquals("IS-DONE", conditionName.name);
        assertEquals("WS-FLAG", conditionName.parent);
        assertEquals(1, program.dataDivision.workingStorage.size());

        Condition condition = ((IfStatement) program.procedureDivision.statements.get(0)).condition;
        assertEquals("WS-FLAG", ((VariableRef) condition.left).name);
        assertEquals(RelationalOperator.EQUAL, condition.operator);
        assertEquals("Y", ((StringLiteral) condition.right).value);
        assertTrue(condition.negated);
    }

    @Test
    void greaterOrEqualIsNegatedLess() {
        Program program = parse(program("GE", storage("01 WS-A PIC 9."),
                "IF WS-A >= 5 DISPLAY \"BIG\" END-IF."));

        Condition condition = ((IfStatement) program.procedureDivision.statements.get(0)).condition;
        assertEquals(RelationalOperator.LESS, condition.operator);
        assertTrue(condition.negated);
    }

    @Test
    void computeRespectsOperatorPrecedence() {
        Program program = parse(program("CALC", storage("01 WS-R PIC 9(4)."),
                "COMPUTE WS-R = 2 + 3 * 4 ** 2."));

        ComputeStatement compute = (ComputeStatement) program.procedureDivision.statements.get(0);
        Expression.Binary sum = (Expression.Binary) compute.expression;
        assertEquals(ArithmeticOperator.ADD, sum.operator);
        Expression.Binary product = (Expression.Binary) sum.right;
        assertEquals(ArithmeticOperator.MULTIPLY, product.operator);
        assertEquals(ArithmeticOperator.POWER, ((Expression.Binary) product.right).operator);
    }

    @Test
    void divideByWithoutGivingIsRejected() {
        CompileResult result = Parser.parse(program("DIV", storage("01 WS-A PIC 9."), "DIVIDE WS-A BY 2."));

        assertEquals(Parser.SYNTAX_ERROR, result.getError().code);
        assertTrue(result.getError().message.contains("GIVING"));
    }

    @Test
    void referenceModificationIsAttachedToTheVariable() {
        Program program = parse(program("REFMOD", storage("01 WS-A PIC X(10)."),
                "DISPLAY WS-A(3:4)."));

        DisplayStatement display = (DisplayStatement) program.procedureDivision.statements.get(0);
        VariableRef ref = (VariableRef) display.values.get(0);
        assertEquals(3, ref.refMod.start);
        assertEquals(4, ref.refMod.length);
    }

    @Test
    void callAndLinkageSection() {
        String source = cobol(
                "IDENTIFICATION DIVISION.",
                "PROGRAM-ID. CALLEE.",
                "DATA DIVISION.",
                "LINKAGE SECTION.",
                "01 LK-A PIC 9(3).",
                "01 LK-B PIC X(5).",
                "PROCEDURE DIVISION USING LK-A LK-B.",
                "    CALL \"OTHER\" USING BY REFERENCE LK-A LK-B.",
                "    GOBACK.");

        Program program = parse(source);

        assertEquals(List.of("LK-A", "LK-B"), program.procedureDivision.usingParameters);
        assertEquals(DataSection.LINKAGE, program.dataDivision.linkageSection.get(0).section);
        CallStatement call = (CallStatement) program.procedureDivision.statements.get(0);
        assertEquals("OTHER", ((StringLiteral) call.program).value);
        assertEquals(2, call.using.size());
    }

    @Test
    void fileControlAndFileSection() {
        String source = cobol(
                "IDENTIFICATION DIVISION.",
                "PROGRAM-ID. FILES.",
                "ENVIRONMENT DIVISION.",
                "INPUT-OUTPUT SECTION.",
                "FILE-CONTROL.",
                "    SELECT CUST-FILE ASSIGN TO \"CUSTOMERS\"",
                "        ORGANIZATION IS INDEXED",
                "        ACCESS MODE IS RANDOM",
                "        RECORD KEY IS CUST-ID.",
                "DATA DIVISION.",
                "FILE SECTION.",
                "FD CUST-FILE.",
                "01 CUST-REC PIC X(20).",
                "WORKING-STORAGE SECTION.",
                "01 CUST-ID PIC X(4).",
                "PROCEDURE DIVISION.",
                "    OPEN I-O CUST-FILE.",
                "    READ CUST-FILE INTO CUST-REC",
                "        AT END DISPLAY \"EOF\"",
                "    END-READ.",
                "    CLOSE CUST-FILE.");

        Program program = parse(source);

        FileControlEntry entry = program.fileControl.get(0);
        assertEquals("CUST-FILE", entry.fileName);
        assertEquals("CUSTOMERS", entry.externalName);
        assertEquals(FileOrganization.INDEXED, entry.organization);
        assertEquals(AccessMode.RANDOM, entry.accessMode);
        assertEquals("CUST-ID", entry.recordKey);

        FileDescription fd = program.dataDivision.fileSection.get(0);
        assertEquals("CUST-REC", fd.records.get(0).name);
        assertEquals(DataSection.FILE, fd.records.get(0).section);

        ReadStatement read = (ReadStatement) program.procedureDivision.statements.get(1);
        assertTrue(read.hasAtEnd);
        assertEquals(1, read.atEnd.size());
        assertEquals("CUST-REC", read.into.name);
    }

    @Test
    void mapSectionDefinesFields() {
        String source = cobol(
                "IDENTIFICATION DIVISION.",
                "PROGRAM-ID. SCREEN.",
                "DATA DIVISION.",
                "MAP SECTION.",
                "MAP MENU MAPSET MENUSET.",
                "    FIELD TITLE LINE 1 COLUMN 10 LENGTH 9 INITIAL \"MAIN MENU\".",
                "    FIELD CHOICE LINE 3 COLUMN 2 LENGTH 1.",
                "PROCEDURE DIVISION.",
                "    STOP RUN.");

        MapDefinition map = parse(source).dataDivision.mapSection.get(0);

        assertEquals("MENU", map.mapName);
        assertEquals("MENUSET", map.mapsetName);
        assertEquals(2, map.fields.size());
        assertEquals("MAIN MENU", map.fields.get(0).initial);
        assertEquals(3, map.fields.get(1).row);
        assertNull(map.fields.get(1).initial);
    }

    @Test
    void execCicsKeepsOptionsInSourceOrder() {
        Program program = parse(program("CICS", storage(),
                "EXEC CICS SEND MAP('MENU') MAPSET('MENUSET') ERASE END-EXEC.",
                "EXEC CICS HANDLE CONDITION NOTFND(NO-RECORD) END-EXEC."));

        ExecCicsStatement send = (ExecCicsStatement) program.procedureDivision.statements.get(0);
        assertEquals(CicsCommand.SEND_MAP, send.command);
        assertEquals(List.of("MAP", "MAPSET", "ERASE"), List.copyOf(send.params.keySet()));
        assertEquals("MENU", ((StringLiteral) send.param("MAP")).value);
        assertTrue(send.hasParam("ERASE"));
        assertNull(send.param("ERASE"));

        ExecCicsStatement handle = (ExecCicsStatement) program.procedureDivision.statements.get(1);
        assertEquals(CicsCommand.HANDLE_CONDITION, handle.command);
        assertEquals("NO-RECORD", ((VariableRef) handle.param("NOTFND")).name);
    }

    @Test
    void paragraphHeadersAreFallThroughLabels() {
        Program program = parse(program("PARAS", storage(),
                "MAIN-PARA.",
                "    DISPLAY \"A\".",
                "SECOND-PARA SECTION.",
                "    DISPLAY \"B\".",
                "    STOP RUN."));

        assertEquals(3, program.procedureDivision.statements.size());
    }
}
