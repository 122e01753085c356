package org.dxworks.cobolsim.runtime;

import org.dxworks.cobolsim.model.Program;
import org.dxworks.cobolsim.runtime.cics.ScreenBuffer;
import org.dxworks.cobolsim.runtime.cics.ScreenChar;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.dxworks.cobolsim.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

public class CicsRuntimeTest {

    private static final Program MENU = parse(cobol(
            "IDENTIFICATION DIVISION.",
            "PROGRAM-ID. MENUPGM.",
            "DATA DIVISION.",
            "WORKING-STORAGE SECTION.",
            "01 MSG PIC X(20) VALUE \"WELCOME\".",
            "01 CHOICE PIC X.",
            "MAP SECTION.",
            "MAP MENU MAPSET MENUSET.",
            "    FIELD TITLE LINE 1 COLUMN 1 LENGTH 9 INITIAL \"MAIN MENU\".",
            "    FIELD MSG LINE 2 COLUMN 1 LENGTH 20.",
            "    FIELD CHOICE LINE 3 COLUMN 5 LENGTH 1.",
            "PROCEDURE DIVISION.",
            "    EXEC CICS SEND MAP('MENU') MAPSET('MENUSET') END-EXEC.",
            "    EXEC CICS RECEIVE MAP('MENU') MAPSET('MENUSET') END-EXEC.",
            "    DISPLAY \"CHOICE=\" CHOICE.",
            "    EXEC CICS RETURN TRANSID('MENU') COMMAREA(CHOICE) END-EXEC.",
            "    DISPLAY \"NOT REACHED\"."));

    @Test
    void sendMapRendersFieldsAndReceiveMapSuspends() {
        List<List<ScreenChar>> updates = new ArrayList<>();
        CobolRuntime runtime = new CobolRuntime(InputHandler.SUSPENDING, updates::add, ScreenInputHandler.SUSPENDING);

        ExecutionResult result = runtime.run(MENU);

        assertEquals(1, updates.size());
        assertEquals(ScreenBuffer.ROWS * ScreenBuffer.COLUMNS, updates.get(0).size());
        ScreenBuffer screen = runtime.getCicsContext().getScreen();
        assertTrue(screen.rowText(1).startsWith("MAIN MENU "));
        assertTrue(screen.rowText(2).startsWith("WELCOME "));

        assertTrue(result.isSuspended());
        assertEquals(SuspensionKind.RECEIVE_MAP, result.suspension.kind);
        assertEquals("MENU", result.suspension.mapName);
        assertEquals("MENUSET", result.suspension.mapsetName);
    }

    @Test
    void receiveMapScrapesTheScreenOnResume() {
        CobolRuntime runtime = new CobolRuntime();
        ExecutionResult suspended = runtime.run(MENU);

        runtime.getCicsContext().getScreen().write(3, 5, "2");
        ExecutionResult result = runtime.resume(suspended.suspension.token, null);

        assertTrue(result.isCompleted());
        assertEquals(List.of("CHOICE=2"), result.output);
        assertEquals("MENU", result.nextTransaction.transId);
        assertEquals("2", result.nextTransaction.commarea);
    }

    @Test
    void screenInputHandlerThatIsReadyAvoidsSuspension() {
        CobolRuntime runtime = new CobolRuntime(InputHandler.SUSPENDING, ScreenUpdateHandler.IGNORE, () -> true);

        ExecutionResult result = runtime.run(MENU);

        assertTrue(result.isCompleted());
        assertEquals(List.of("CHOICE= "), result.output);
    }

    @Test
    void dataOnlyKeepsTheRestOfTheScreen() {
        CobolRuntime runtime = new CobolRuntime();
        runtime.getCicsContext().getScreen().write(10, 1, "KEEP ME");
        Program program = parse(cobol(
                "IDENTIFICATION DIVISION.",
                "PROGRAM-ID. DATAONLY.",
                "DATA DIVISION.",
                "WORKING-STORAGE SECTION.",
                "01 MSG PIC X(5) VALUE \"HI\".",
                "MAP SECTION.",
                "MAP M1 MAPSET S1.",
                "    FIELD TITLE LINE 1 COLUMN 1 LENGTH 5 INITIAL \"TITLE\".",
                "    FIELD MSG LINE 2 COLUMN 1 LENGTH 5.",
                "PROCEDURE DIVISION.",
                "    EXEC CICS SEND MAP('M1') MAPSET('S1') DATAONLY END-EXEC."));

        runtime.run(program);

        ScreenBuffer screen = runtime.getCicsContext().getScreen();
        assertTrue(screen.rowText(10).startsWith("KEEP ME"));
        assertTrue(screen.rowText(1).isBlank());
        assertTrue(screen.rowText(2).startsWith("HI   "));
    }

    @Test
    void unknownMapRaisesMapfail() {
        ExecutionResult result = new CobolRuntime().run(parse(program("NOMAP", storage(),
                "EXEC CICS SEND MAP('NOPE') END-EXEC.")));

        assertTrue(result.abended);
        assertEquals(CobolRuntime.ABEND_PREFIX + "DFHAC2206 CICS CONDITION 'MAPFAIL' NOT HANDLED.", result.errors.get(0));
    }

    @Test
    void readByKeyFillsTheIntoItem() {
        CobolRuntime runtime = new CobolRuntime();
        runtime.getDatasets().defineKeyed("CUSTOMERS", Map.of("C1", "JANE DOE"));

        ExecutionResult result = runtime.run(parse(program("CREAD",
                storage("01 WS-KEY PIC X(2) VALUE \"C1\".", "01 WS-REC PIC X(10)."),
                "EXEC CICS READ FILE('CUSTOMERS') INTO(WS-REC) RIDFLD(WS-KEY) END-EXEC.",
                "DISPLAY WS-REC.")));

        assertEquals(List.of("JANE DOE  "), result.output);
    }

    @Test
    void unhandledNotFoundAbends() {
        CobolRuntime runtime = new CobolRuntime();
        runtime.getDatasets().defineKeyed("CUSTOMERS", Map.of());

        ExecutionResult result = runtime.run(parse(program("NOTFND",
                storage("01 WS-KEY PIC X(2) VALUE \"X9\".", "01 WS-REC PIC X(10)."),
                "EXEC CICS READ FILE('CUSTOMERS') INTO(WS-REC) RIDFLD(WS-KEY) END-EXEC.",
                "DISPLAY \"AFTER\".")));

        assertTrue(result.output.isEmpty());
        assertTrue(result.abended);
        assertEquals(CobolRuntime.ABEND_PREFIX + "DFHAC2206 CICS CONDITION 'NOTFND' NOT HANDLED.", result.errors.get(0));
    }

    @Test
    void handledNotFoundIsReportedAndExecutionContinues() {
        CobolRuntime runtime = new CobolRuntime();
        runtime.getDatasets().defineKeyed("CUSTOMERS", Map.of());

        ExecutionResult result = runtime.run(parse(program("HANDLED",
                storage("01 WS-KEY PIC X(2) VALUE \"X9\".", "01 WS-REC PIC X(10)."),
                "EXEC CICS HANDLE CONDITION NOTFND(NOT-FOUND) END-EXEC.",
                "EXEC CICS READ FILE('CUSTOMERS') INTO(WS-REC) RIDFLD(WS-KEY) END-EXEC.",
                "DISPLAY \"AFTER\".")));

        assertFalse(result.abended);
        assertEquals(List.of("AFTER"), result.output);
        assertEquals(List.of("CICS HANDLE CONDITION TRIGGERED: NOTFND -> NOT-FOUND"), result.errors);
    }

    @Test
    void writeCreatesDatasetAndRejectsDuplicates() {
        CobolRuntime runtime = new CobolRuntime();

        ExecutionResult result = runtime.run(parse(program("CWRITE",
                storage("01 WS-KEY PIC X(2) VALUE \"K1\".", "01 WS-REC PIC X(6) VALUE \"DATA\"."),
                "EXEC CICS WRITE FILE('NEWFILE') FROM(WS-REC) RIDFLD(WS-KEY) END-EXEC.",
                "EXEC CICS WRITE FILE('NEWFILE') FROM(WS-REC) RIDFLD(WS-KEY) END-EXEC.")));

        assertEquals("DATA  ", runtime.getDatasets().find("NEWFILE").orElseThrow().get("K1").orElseThrow());
        assertEquals(CobolRuntime.ABEND_PREFIX + "DFHAC2206 CICS CONDITION 'DUPREC' NOT HANDLED.", result.errors.get(0));
    }

    @Test
    void rewriteAndDeleteExistingRecords() {
        CobolRuntime runtime = new CobolRuntime();
        runtime.getDatasets().defineKeyed("STOCK", Map.of("A", "OLD", "B", "GONE"));

        ExecutionResult result = runtime.run(parse(program("CUPDATE",
                storage("01 WS-KEY PIC X VALUE \"A\".", "01 WS-REC PIC X(3) VALUE \"NEW\"."),
                "EXEC CICS REWRITE FILE('STOCK') FROM(WS-REC) RIDFLD(WS-KEY) END-EXEC.",
                "MOVE \"B\" TO WS-KEY.",
                "EXEC CICS DELETE FILE('STOCK') RIDFLD(WS-KEY) END-EXEC.")));

        assertFalse(result.abended, result.errors::toString);
        assertEquals(Map.of("A", "NEW"), runtime.getDatasets().find("STOCK").orElseThrow().getKeyedRecords());
    }

    @Test
    void linkSharesTheCommareaWithTheLinkedProgram() {
        CobolRuntime runtime = new CobolRuntime();
        runtime.registerProgram(parse(cobol(
                "IDENTIFICATION DIVISION.",
                "PROGRAM-ID. SUBPGM.",
                "DATA DIVISION.",
                "LINKAGE SECTION.",
                "01 DFHCOMMAREA PIC X(10).",
                "PROCEDURE DIVISION.",
                "    DISPLAY \"GOT \" DFHCOMMAREA.",
                "    MOVE \"RESPONSE\" TO DFHCOMMAREA.",
                "    EXEC CICS RETURN END-EXEC.")));

        ExecutionResult result = runtime.run(parse(program("LINKER",
                storage("01 WS-AREA PIC X(10) VALUE \"REQUEST\"."),
                "EXEC CICS LINK PROGRAM('SUBPGM') COMMAREA(WS-AREA) END-EXEC.",
                "DISPLAY \"BACK \" WS-AREA.")));

        assertEquals(List.of("GOT REQUEST   ", "BACK RESPONSE  "), result.output);
    }

    @Test
    void linkToUnknownProgramRaisesPgmiderr() {
        ExecutionResult result = new CobolRuntime().run(parse(program("NOLINK", storage(),
                "EXEC CICS HANDLE CONDITION PGMIDERR(NO-PROGRAM) END-EXEC.",
                "EXEC CICS LINK PROGRAM('MISSING') END-EXEC.",
                "DISPLAY \"CONTINUED\".")));

        assertEquals(List.of("CONTINUED"), result.output);
        assertEquals(List.of("CICS HANDLE CONDITION TRIGGERED: PGMIDERR -> NO-PROGRAM"), result.errors);
    }

    @Test
    void transactionStartsItsProgramWithTheCommarea() {
        CobolRuntime runtime = new CobolRuntime();
        runtime.registerProgram(parse(cobol(
                "IDENTIFICATION DIVISION.",
                "PROGRAM-ID. ORDERPGM.",
                "DATA DIVISION.",
                "LINKAGE SECTION.",
                "01 DFHCOMMAREA PIC X(8).",
                "PROCEDURE DIVISION.",
                "    DISPLAY \"STATE \" DFHCOMMAREA.",
                "    EXEC CICS RETURN TRANSID('ORD1') COMMAREA(DFHCOMMAREA) END-EXEC.")));
        runtime.registerTransaction("ORD1", "ORDERPGM");

        ExecutionResult result = runtime.runTransaction("ORD1", "STEP2");

        assertEquals(List.of("STATE STEP2   "), result.output);
        assertEquals("ORD1", runtime.getCicsContext().getTransId());
        assertEquals("ORD1", result.nextTransaction.transId);
        assertEquals("STEP2   ", result.nextTransaction.commarea);
    }

    @Test
    void unknownTransactionIsNotRecognized() {
        ExecutionResult result = new CobolRuntime().runTransaction("ZZZZ", "");

        assertTrue(result.abended);
        assertEquals(CobolRuntime.ABEND_PREFIX + CobolRuntime.UNKNOWN_TRANSACTION
                + " TRANSACTION 'ZZZZ' IS NOT RECOGNIZED.", result.errors.get(0));
    }

    private static Program offScreenMap(String command) {
        return parse(cobol(
                "IDENTIFICATION DIVISION.",
                "PROGRAM-ID. OFFSCRN.",
                "DATA DIVISION.",
                "WORKING-STORAGE SECTION.",
                "01 MSG PIC X(5) VALUE \"HELLO\".",
                "MAP SECTION.",
                "MAP M1 MAPSET S1.",
                "    FIELD MSG LINE 30 COLUMN 1 LENGTH 5.",
                "PROCEDURE DIVISION.",
                "    DISPLAY \"BEFORE\".",
                "    EXEC CICS " + command + " MAP('M1') END-EXEC.",
                "    DISPLAY \"AFTER\"."));
    }

    @Test
    void sendMapWithFieldOffTheScreenAbends() {
        ExecutionResult result = assertDoesNotThrow(() -> new CobolRuntime().run(offScreenMap("SEND")));

        assertTrue(result.isCompleted());
        assertTrue(result.abended);
        assertEquals(List.of("BEFORE"), result.output);
        assertEquals(CobolRuntime.ABEND_PREFIX + "DFHAC2206 FIELD 'MSG' OF MAP 'M1' STARTS OFF THE SCREEN AT LINE 30, COLUMN 1.",
                result.errors.get(result.errors.size() - 1));
    }

    @Test
    void receiveMapWithFieldOffTheScreenAbendsWithoutSuspending() {
        ExecutionResult result = assertDoesNotThrow(() -> new CobolRuntime().run(offScreenMap("RECEIVE")));

        assertFalse(result.isSuspended());
        assertTrue(result.abended);
        assertEquals(List.of("BEFORE"), result.output);
    }
}
