package org.dxworks.cobolsim;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.dxworks.cobolsim.TestUtils.SAMPLES_BASE_PATH;
import static org.junit.jupiter.api.Assertions.*;

public class AppTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) throws Exception {
        return App.run(args, new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private List<String> outLines() {
        return out.toString(StandardCharsets.UTF_8).lines().toList();
    }

    private String errText() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private static List<JsonNode> records(Path jsonl) throws Exception {
        List<JsonNode> records = new ArrayList<>();
        for (String line : Files.readAllLines(jsonl, StandardCharsets.UTF_8)) {
            records.add(MAPPER.readTree(line));
        }
        return records;
    }

    @Test
    void noArgumentsPrintsUsage() throws Exception {
        assertEquals(App.EXIT_USAGE, run());
        assertTrue(errText().startsWith("Usage:"));
    }

    @Test
    void unknownOptionPrintsUsage() throws Exception {
        assertEquals(App.EXIT_USAGE, run(SAMPLES_BASE_PATH + "counter.cbl", "--verbose", "yes"));
    }

    @Test
    void missingProgramFile() throws Exception {
        assertEquals(App.EXIT_USAGE, run(SAMPLES_BASE_PATH + "nope.cbl"));
        assertTrue(errText().contains("Program file does not exist"));
    }

    @Test
    void runsProgramAndWritesJsonLines() throws Exception {
        Path output = tempDir.resolve("out/run.jsonl");

        int exitCode = run(SAMPLES_BASE_PATH + "counter.cbl", "--output", output.toString());

        assertEquals(App.EXIT_OK, exitCode);
        assertEquals(List.of("COUNT 01", "COUNT 02", "COUNT 03", "DONE"), outLines());

        List<JsonNode> records = records(output);
        assertEquals(List.of("run", "compile", "execution", "done"),
                records.stream().map(r -> r.get("kind").asText()).toList());
        assertEquals("COUNTER", records.get(1).get("result").get("programId").asText());
        assertEquals("PROGRAM", records.get(1).get("result").get("debugTree").get("kind").asText());
        assertEquals("COMPLETED", records.get(2).get("result").get("status").asText());
        assertEquals(4, records.get(2).get("result").get("output").size());
        assertEquals(0, records.get(3).get("exit_code").asInt());
    }

    @Test
    void callsAnotherProgramGivenOnTheCommandLine() throws Exception {
        int exitCode = run(SAMPLES_BASE_PATH + "caller.cbl", SAMPLES_BASE_PATH + "doubler.cbl");

        assertEquals(App.EXIT_OK, exitCode);
        assertEquals(List.of("RESULT 042"), outLines());
    }

    @Test
    void acceptReadsInputFile() throws Exception {
        Path input = tempDir.resolve("input.txt");
        Files.writeString(input, "BOB\n", StandardCharsets.UTF_8);

        int exitCode = run(SAMPLES_BASE_PATH + "ask.cbl", "--input", input.toString());

        assertEquals(App.EXIT_OK, exitCode);
        assertEquals(List.of("> BOB", "HI BOB  !"), outLines());
    }

    @Test
    void semanticErrorBlocksExecution() throws Exception {
        Path output = tempDir.resolve("run.jsonl");

        int exitCode = run(SAMPLES_BASE_PATH + "undefined-variable.cbl", "--output", output.toString());

        assertEquals(App.EXIT_FAILED, exitCode);
        assertTrue(errText().contains("IGYPS2001-E"));
        assertTrue(errText().contains("nothing was executed"));
        assertEquals(List.of("run", "compile", "done"),
                records(output).stream().map(r -> r.get("kind").asText()).toList());
    }

    @Test
    void missingCopybookIsReported() throws Exception {
        int exitCode = run(SAMPLES_BASE_PATH + "missing-copy.cbl");

        assertEquals(App.EXIT_FAILED, exitCode);
        assertTrue(errText().contains("COPYBOOK 'ABSENT' NOT FOUND (Line 5, Column 8)"));
    }

    @Test
    void copybookDirectoryOption() throws Exception {
        Path program = tempDir.resolve("greet.cbl");
        Files.copy(Path.of(SAMPLES_BASE_PATH + "greet.cbl"), program);

        int exitCode = run(program.toString(), "--copybooks", SAMPLES_BASE_PATH);

        assertEquals(App.EXIT_OK, exitCode);
        assertEquals(List.of("HELLO"), outLines());
    }

    @Test
    void abendGivesFailureExitCode() throws Exception {
        int exitCode = run(SAMPLES_BASE_PATH + "divide-by-zero.cbl");

        assertEquals(App.EXIT_FAILED, exitCode);
        assertTrue(errText().contains("IGZ0013S"));
    }
}
