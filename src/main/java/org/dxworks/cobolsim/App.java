package org.dxworks.cobolsim;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.cobolsim.preprocessor.CopybookLibrary;
import org.dxworks.cobolsim.runtime.CobolRuntime;
import org.dxworks.cobolsim.runtime.ExecutionResult;
import org.dxworks.cobolsim.runtime.InputHandler;
import org.dxworks.cobolsim.runtime.ScreenInputHandler;
import org.dxworks.cobolsim.runtime.cics.ScreenBuffer;
import org.dxworks.cobolsim.runtime.cics.ScreenChar;
import org.dxworks.cobolsim.validator.Diagnostic;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) throws IOException {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Compiles every program given, registers them, and runs the first one.
     *
     * @return the process exit code
     */
    static int run(String[] args, PrintStream out, PrintStream err) throws IOException {
        Options options = Options.parse(args);
        if (options == null) {
            printUsage(err);
            return EXIT_USAGE;
        }
        for (Path program : options.programs) {
            if (!Files.isRegularFile(program)) {
                err.println("Error: Program file does not exist: " + program);
                return EXIT_USAGE;
            }
        }

        CobolSimConfig config = CobolSimConfig.load();
        Path copybookDir = options.copybooks != null ? options.copybooks : options.programs.get(0).toAbsolutePath().getParent();
        CopybookLibrary library = CopybookLibrary.fromDirectory(copybookDir, config.getCopybookExtensions());
        CobolCompiler compiler = new CobolCompiler(config);

        Instant startTime = Instant.now();
        try (BufferedWriter writer = options.output != null ? openWriter(options.output) : null) {
            Map<String, Object> runInfo = new LinkedHashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("programs", options.programs.stream().map(Path::toString).toList());
            writeRecord(writer, runInfo);

            List<Compilation> compilations = new ArrayList<>();
            boolean blocked = false;
            for (Path file : options.programs) {
                Compilation compilation = compiler.compile(readSource(file), library);
                compilations.add(compilation);
                blocked |= !report(file, compilation, out, err);

                Map<String, Object> record = new LinkedHashMap<>();
                record.put("kind", "compile");
                record.put("file", file.toString());
                record.put("result", compilation);
                writeRecord(writer, record);
            }

            int exitCode;
            if (blocked) {
                err.println("Compilation failed; nothing was executed.");
                exitCode = EXIT_FAILED;
            } else {
                CobolRuntime runtime = new CobolRuntime(
                        inputFrom(options.input),
                        buffer -> printScreen(buffer, out),
                        ScreenInputHandler.SUSPENDING,
                        config.getMaxLoopIterations(),
                        config.getMaxCallDepth());
                compilations.forEach(c -> runtime.registerProgram(c.program));
                ExecutionResult result = runtime.run(compilations.get(0).program);
                while (result.isSuspended()) {
                    // no operator at a terminal here; screen input is taken as it stands
                    result = runtime.resume(result.suspension.token, "");
                }
                result.output.forEach(out::println);
                result.errors.forEach(err::println);
                if (result.nextTransaction != null) {
                    out.println("Next transaction: " + result.nextTransaction.transId);
                }

                Map<String, Object> record = new LinkedHashMap<>();
                record.put("kind", "execution");
                record.put("program", compilations.get(0).programId);
                record.put("result", result);
                writeRecord(writer, record);
                exitCode = result.abended ? EXIT_FAILED : EXIT_OK;
            }

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new LinkedHashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("exit_code", exitCode);
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writeRecord(writer, doneInfo);
            return exitCode;
        }
    }

    /**
     * Prints diagnostics and fatal errors.
     *
     * @return true when the program may be executed
     */
    private static boolean report(Path file, Compilation compilation, PrintStream out, PrintStream err) {
        if (compilation.missingCopy != null) {
            err.println(file.getFileName() + ": COPYBOOK '" + compilation.missingCopy.name + "' NOT FOUND (Line "
                    + compilation.missingCopy.line + ", Column " + compilation.missingCopy.column + ")");
            return false;
        }
        if (compilation.error != null) {
            err.println(file.getFileName() + ": " + compilation.error.format());
            return false;
        }
        for (Diagnostic diagnostic : compilation.diagnostics) {
            (diagnostic.isError() ? err : out).println(file.getFileName() + ": " + diagnostic.severity + " " + diagnostic);
        }
        return compilation.isExecutable();
    }

    private static InputHandler inputFrom(Path input) throws IOException {
        Iterator<String> lines;
        if (input != null) {
            lines = Files.readAllLines(input, StandardCharsets.UTF_8).iterator();
        } else {
            BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            lines = stdin.lines().iterator();
        }
        return (name, type, length) -> Optional.of(lines.hasNext() ? lines.next() : "");
    }

    private static void printScreen(List<ScreenChar> buffer, PrintStream out) {
        String border = "+" + "-".repeat(ScreenBuffer.COLUMNS) + "+";
        out.println(border);
        for (int row = 0; row < ScreenBuffer.ROWS; row++) {
            StringBuilder line = new StringBuilder(ScreenBuffer.COLUMNS);
            for (ScreenChar c : buffer.subList(row * ScreenBuffer.COLUMNS, (row + 1) * ScreenBuffer.COLUMNS)) {
                line.append(c.ch);
            }
            out.println("|" + line + "|");
        }
        out.println(border);
    }

    private static String readSource(Path file) throws IOException {
        String source = Files.readString(file, StandardCharsets.UTF_8);
        return source.startsWith("\uFEFF") ? source.substring(1) : source;
    }

    private static BufferedWriter openWriter(Path output) throws IOException {
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }
        return Files.newBufferedWriter(output, StandardCharsets.UTF_8);
    }

    private static void writeRecord(BufferedWriter writer, Map<String, Object> record) throws IOException {
        if (writer == null) {
            return;
        }
        writer.write(MAPPER.writeValueAsString(record));
        writer.newLine();
        writer.flush();
    }

    private static void printUsage(PrintStream err) {
        err.println("Usage: java -jar cobolsim.jar <program.cbl> [more.cbl ...] [--copybooks <dir>] [--output <file.jsonl>] [--input <file>]");
        err.println("  <program.cbl>: fixed-format COBOL sources; the first one is run, the others can be CALLed");
        err.println("  --copybooks:   directory searched for COPY members (default: the first program's directory)");
        err.println("  --output:      JSONL file receiving compile and execution records");
        err.println("  --input:       file whose lines answer ACCEPT (default: standard input)");
    }

    static final class Options {
        final List<Path> programs = new ArrayList<>();
        Path copybooks;
        Path output;
        Path input;

        static Options parse(String[] args) {
            Options options = new Options();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (arg.startsWith("--")) {
                    if (i + 1 >= args.length) {
                        return null;
                    }
                    Path value = Paths.get(args[++i]);
                    switch (arg) {
                        case "--copybooks" -> options.copybooks = value;
                        case "--output" -> options.output = value;
                        case "--input" -> options.input = value;
                        default -> {
                            return null;
                        }
                    }
                } else {
                    options.programs.add(Paths.get(arg));
                }
            }
            return options.programs.isEmpty() ? null : options;
        }
    }
}
