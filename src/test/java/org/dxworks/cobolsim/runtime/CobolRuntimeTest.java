package org.dxworks.cobolsim.runtime;

import org.dxworks.cobolsim.model.Program;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.cobolsim.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

public class CobolRuntimeTest {

    private static final String DOUBLER = cobol(
            "IDENTIFICATION DIVISION.",
            "PROGRAM-ID. DOUBLER.",
            "DATA DIVISION.",
            "LINKAGE SECTION.",
            "01 LK-N PIC 9(3).",
            "PROCEDURE DIVISION USING LK-N.",
            "    COMPUTE LK-N = LK-N * 2.",
            "    GOBACK.");

    private static ExecutionResult run(String source) {
        return new CobolRuntime().run(parse(source));
    }

    private static void assertAbend(ExecutionResult result, String code, String detail) {
        assertTrue(result.abended);
        assertTrue(result.isCompleted());
        assertEquals(CobolRuntime.ABEND_PREFIX + code + " " + detail, result.errors.get(result.errors.size() - 1));
    }

    @Test
    void countsToFive() {
        CobolRuntime runtime = new CobolRuntime();
        ExecutionResult result = runtime.run(parse(program("COUNTER", storage("01 WS-I PIC 9 VALUE 1."),
                "PERFORM UNTIL WS-I > 5",
                "    DISPLAY \"COUNT: \" WS-I",
                "    ADD 1 TO WS-I",
                "END-PERFORM.",
                "STOP RUN.")));

        assertEquals(List.of("COUNT: 1", "COUNT: 2", "COUNT: 3", "COUNT: 4", "COUNT: 5"), result.output);
        assertTrue(result.errors.isEmpty());
        assertFalse(result.abended);
        assertEquals("6", runtime.getMemory().get("WS-I").getDisplayValue());
    }

    @Test
    void alphanumericMovesPadAndTruncate() {
        ExecutionResult result = run(program("PAD", storage("01 WS-SHORT PIC X(3).", "01 WS-LONG PIC X(6)."),
                "MOVE \"ABCDEF\" TO WS-SHORT.",
                "MOVE \"AB\" TO WS-LONG.",
                "DISPLAY \"[\" WS-SHORT \"]\".",
                "DISPLAY \"[\" WS-LONG \"]\"."));

        assertEquals(List.of("[ABC]", "[AB    ]"), result.output);
    }

    @Test
    void numericStorageKeepsLowOrderDigits() {
        ExecutionResult result = run(program("WRAP", storage("01 WS-N PIC 9(2) VALUE 99.", "01 WS-Q PIC 9(3)."),
                "ADD 1 TO WS-N.",
                "DISPLAY WS-N.",
                "COMPUTE WS-Q = 7 / 2.",
                "DISPLAY WS-Q.",
                "MOVE 12345 TO WS-Q.",
                "DISPLAY WS-Q."));

        assertEquals(List.of("0", "3", "345"), result.output);
    }

    @Test
    void signedItemKeepsItsSign() {
        ExecutionResult result = run(program("SIGN", storage("01 WS-S PIC S9(3)."),
                "SUBTRACT 5 FROM WS-S.",
                "DISPLAY WS-S."));

        assertEquals(List.of("-5"), result.output);
    }

    @Test
    void untilConditionTestedBeforeFirstIteration() {
        ExecutionResult result = run(program("NOLOOP", storage("01 WS-I PIC 9 VALUE 9."),
                "PERFORM UNTIL WS-I > 5",
                "    DISPLAY \"NEVER\"",
                "END-PERFORM.",
                "DISPLAY \"DONE\"."));

        assertEquals(List.of("DONE"), result.output);
    }

    @Test
    void performTimesAndNestedIf() {
        ExecutionResult result = run(program("NESTED", storage("01 WS-I PIC 9 VALUE 0."),
                "PERFORM 3 TIMES",
                "    ADD 1 TO WS-I",
                "    IF WS-I = 2",
                "        DISPLAY \"TWO\"",
                "    ELSE",
                "        DISPLAY \"NOT TWO\"",
                "    END-IF",
                "END-PERFORM.",
                "PERFORM 0 TIMES DISPLAY \"SKIPPED\" END-PERFORM."));

        assertEquals(List.of("NOT TWO", "TWO", "NOT TWO"), result.output);
    }

    @Test
    void paddedStringComparison() {
        ExecutionResult result = run(program("CMP", storage("01 WS-A PIC X(5) VALUE \"AB\"."),
                "IF WS-A = \"AB\" DISPLAY \"EQUAL\" END-IF.",
                "IF WS-A < \"AC\" DISPLAY \"LESS\" END-IF."));

        assertEquals(List.of("EQUAL", "LESS"), result.output);
    }

    @Test
    void stopRunEndsTheRun() {
        ExecutionResult result = run(program("STOP", storage(),
                "DISPLAY \"A\".",
                "STOP RUN.",
                "DISPLAY \"B\"."));

        assertEquals(List.of("A"), result.output);
    }

    @Test
    void referenceModificationReadsAndWritesASlice() {
        ExecutionResult result = run(program("SLICE", storage("01 WS-A PIC X(5) VALUE \"HELLO\"."),
                "DISPLAY WS-A(2:3).",
                "MOVE \"J\" TO WS-A(1:1).",
                "DISPLAY WS-A.",
                "DISPLAY WS-A(7:1)."));

        assertEquals(List.of("ELL", "JELLO"), result.output);
        assertTrue(result.errors.get(0).startsWith(CobolRuntime.ABEND_PREFIX + RuntimeAbend.REFERENCE_MODIFICATION));
    }

    @Test
    void callPassesArgumentsByReference() {
        CobolRuntime runtime = new CobolRuntime();
        runtime.registerProgram(parse(DOUBLER));

        ExecutionResult result = runtime.run(parse(program("CALLER", storage("01 WS-X PIC 9(3) VALUE 21."),
                "CALL \"DOUBLER\" USING WS-X.",
                "DISPLAY WS-X.",
                "STOP RUN.")));

        assertEquals(List.of("42"), result.output);
        assertEquals(1, runtime.getCallDepth());
    }

    @Test
    void callerNamesProgramThroughADataItem() {
        CobolRuntime runtime = new CobolRuntime();
        runtime.registerProgram(parse(DOUBLER));

        ExecutionResult result = runtime.run(parse(program("DYNAMIC",
                storage("01 WS-PGM PIC X(8) VALUE \"doubler\".", "01 WS-X PIC 9(3) VALUE 4."),
                "CALL WS-PGM USING WS-X.",
                "DISPLAY WS-X.")));

        assertEquals(List.of("8"), result.output);
    }

    @Test
    void parameterCountMismatchAbendsAndKeepsEarlierOutput() {
        CobolRuntime runtime = new CobolRuntime();
        runtime.registerProgram(parse(DOUBLER));

        ExecutionResult result = runtime.run(parse(program("BADCALL", storage(),
                "DISPLAY \"BEFORE\".",
                "CALL \"DOUBLER\".",
                "DISPLAY \"AFTER\".")));

        assertEquals(List.of("BEFORE"), result.output);
        assertAbend(result, RuntimeAbend.PARAMETER_MISMATCH,
                "PARAMETER MISMATCH. PROGRAM 'DOUBLER' EXPECTS 1 PARAMETER(S), 0 PASSED.");
    }

    @Test
    void callToUnknownProgramAbends() {
        ExecutionResult result = run(program("LOST", storage(), "CALL \"NOWHERE\"."));

        assertAbend(result, RuntimeAbend.UNDEFINED_PROGRAM, "CALL TO UNDEFINED PROGRAM 'NOWHERE'.");
    }

    @Test
    void exitProgramReturnsToCaller() {
        CobolRuntime runtime = new CobolRuntime();
        runtime.registerProgram(parse(cobol(
                "IDENTIFICATION DIVISION.",
                "PROGRAM-ID. GREETER.",
                "PROCEDURE DIVISION.",
                "    DISPLAY \"IN GREETER\".",
                "    EXIT PROGRAM.",
                "    DISPLAY \"UNREACHABLE\".")));

        ExecutionResult result = runtime.run(parse(program("MAIN", storage(),
                "CALL \"GREETER\".",
                "DISPLAY \"BACK IN MAIN\".")));

        assertEquals(List.of("IN GREETER", "BACK IN MAIN"), result.output);
    }

    @Test
    void runawayLoopHitsTheIterationCeiling() {
        CobolRuntime runtime = new CobolRuntime(InputHandler.SUSPENDING, ScreenUpdateHandler.IGNORE,
                ScreenInputHandler.SUSPENDING, 50, CobolRuntime.DEFAULT_MAX_CALL_DEPTH);

        ExecutionResult result = runtime.run(parse(program("FOREVER", storage("01 WS-C PIC 9(3)."),
                "DISPLAY \"START\".",
                "PERFORM UNTIL 1 = 0",
                "    ADD 1 TO WS-C",
                "END-PERFORM.")));

        assertEquals(List.of("START"), result.output);
        assertAbend(result, RuntimeAbend.LIMIT_EXCEEDED, "INFINITE LOOP. PERFORM AT LINE 8 EXCEEDED 50 ITERATIONS.");
        assertEquals("50", runtime.getMemory().get("WS-C").getDisplayValue());
    }

    @Test
    void timesLoopIsAlsoBoundedByTheCeiling() {
        CobolRuntime runtime = new CobolRuntime(InputHandler.SUSPENDING, ScreenUpdateHandler.IGNORE,
                ScreenInputHandler.SUSPENDING, 50, CobolRuntime.DEFAULT_MAX_CALL_DEPTH);

        ExecutionResult result = runtime.run(parse(program("MANY", storage("01 WS-C PIC 9(3)."),
                "DISPLAY \"START\".",
                "PERFORM 100 TIMES",
                "    ADD 1 TO WS-C",
                "END-PERFORM.",
                "DISPLAY \"NOT REACHED\".")));

        assertEquals(List.of("START"), result.output);
        assertAbend(result, RuntimeAbend.LIMIT_EXCEEDED, "INFINITE LOOP. PERFORM AT LINE 8 EXCEEDED 50 ITERATIONS.");
        assertEquals("50", runtime.getMemory().get("WS-C").getDisplayValue());
    }

    @Test
    void unboundedRecursionOverflowsTheStack() {
        CobolRuntime runtime = new CobolRuntime(InputHandler.SUSPENDING, ScreenUpdateHandler.IGNORE,
                ScreenInputHandler.SUSPENDING, CobolRuntime.DEFAULT_MAX_LOOP_ITERATIONS, 10);

        ExecutionResult result = runtime.run(parse(program("RECUR", storage(), "CALL \"RECUR\".")));

        assertAbend(result, RuntimeAbend.LIMIT_EXCEEDED, "STACK OVERFLOW.");
        assertEquals(10, runtime.getCallDepth());
    }

    @Test
    void divisionByZeroAbends() {
        ExecutionResult result = run(program("DIVZERO", storage("01 WS-N PIC 9(3) VALUE 10."),
                "DIVIDE 0 INTO WS-N."));

        assertAbend(result, RuntimeAbend.DIVIDE_BY_ZERO, "DIVIDE BY ZERO.");
    }

    @Test
    void divideByGiving() {
        ExecutionResult result = run(program("DIVBY", storage("01 WS-R PIC 9(3)."),
                "DIVIDE 100 BY 8 GIVING WS-R.",
                "DISPLAY WS-R."));

        assertEquals(List.of("12"), result.output);
    }

    @Test
    void nonNumericTextIntoNumericItemAbends() {
        ExecutionResult result = run(program("BADNUM", storage("01 WS-N PIC 9(3)."),
                "MOVE \"ABC\" TO WS-N."));

        assertAbend(result, RuntimeAbend.INVALID_NUMERIC_DATA, "INVALID NUMERIC DATA 'ABC'.");
    }

    @Test
    void undefinedVariableAbendsAtRuntime() {
        ExecutionResult result = run(program("UNDEF", storage(), "DISPLAY WS-GHOST."));

        assertAbend(result, RuntimeAbend.UNDEFINED_VARIABLE, "REFERENCE TO UNDEFINED VARIABLE 'WS-GHOST'.");
    }

    @Test
    void eachRunStartsFromFreshStorage() {
        CobolRuntime runtime = new CobolRuntime();
        Program program = parse(program("AGAIN", storage("01 WS-N PIC 9 VALUE 1."),
                "ADD 1 TO WS-N.",
                "DISPLAY WS-N."));

        assertEquals(List.of("2"), runtime.run(program).output);
        assertEquals(List.of("2"), runtime.run(program).output);
    }
}
