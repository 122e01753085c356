package org.dxworks.cobolsim;

import org.dxworks.cobolsim.preprocessor.CobolPreprocessor;
import org.dxworks.cobolsim.preprocessor.CopybookLibrary;
import org.dxworks.cobolsim.runtime.CobolRuntime;
import org.dxworks.cobolsim.runtime.InputHandler;
import org.dxworks.cobolsim.runtime.ScreenInputHandler;
import org.dxworks.cobolsim.runtime.ScreenUpdateHandler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CobolSimConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileGivesDefaults() {
        CobolSimConfig config = CobolSimConfig.load(tempDir.resolve("cobolsim-config.yml"));

        assertEquals(CobolRuntime.DEFAULT_MAX_LOOP_ITERATIONS, config.getMaxLoopIterations());
        assertEquals(CobolRuntime.DEFAULT_MAX_CALL_DEPTH, config.getMaxCallDepth());
        assertEquals(CobolPreprocessor.DEFAULT_MAX_PASSES, config.getMaxCopyPasses());
        assertEquals(List.of(".cpy", ".cbl"), config.getCopybookExtensions());
    }

    @Test
    void readsYamlValues() throws Exception {
        Path file = tempDir.resolve("cobolsim-config.yml");
        Files.writeString(file, String.join("\n",
                "maxLoopIterations: 500",
                "maxCallDepth: 8",
                "maxCopyPasses: 4",
                "copybookExtensions:",
                "  - .copy"), StandardCharsets.UTF_8);

        CobolSimConfig config = CobolSimConfig.load(file);

        assertEquals(500, config.getMaxLoopIterations());
        assertEquals(8, config.getMaxCallDepth());
        assertEquals(4, config.getMaxCopyPasses());
        assertEquals(List.of(".copy"), config.getCopybookExtensions());
    }

    @Test
    void absentAndNonPositiveKeysFallBack() throws Exception {
        Path file = tempDir.resolve("cobolsim-config.yml");
        Files.writeString(file, "maxLoopIterations: 0\nmaxCallDepth: 12\n", StandardCharsets.UTF_8);

        CobolSimConfig config = CobolSimConfig.load(file);

        assertEquals(CobolRuntime.DEFAULT_MAX_LOOP_ITERATIONS, config.getMaxLoopIterations());
        assertEquals(12, config.getMaxCallDepth());
        assertEquals(CobolPreprocessor.DEFAULT_MAX_PASSES, config.getMaxCopyPasses());
        assertEquals(List.of(".cpy", ".cbl"), config.getCopybookExtensions());
    }

    @Test
    void unreadableFileGivesDefaults() throws Exception {
        Path file = tempDir.resolve("cobolsim-config.yml");
        Files.writeString(file, "maxLoopIterations: [not, a, number\n", StandardCharsets.UTF_8);

        CobolSimConfig config = CobolSimConfig.load(file);

        assertEquals(CobolRuntime.DEFAULT_MAX_LOOP_ITERATIONS, config.getMaxLoopIterations());
    }

    @Test
    void configuredLimitsReachTheRuntime() {
        CobolSimConfig config = CobolSimConfig.with(3, 0, 0, null);
        String source = TestUtils.program("SPIN", TestUtils.storage("01 WS-C PIC 9(3) VALUE 0."),
                "PERFORM UNTIL WS-C > 10",
                "    ADD 1 TO WS-C",
                "END-PERFORM.");
        Compilation compilation = new CobolCompiler(config).compile(source, CopybookLibrary.empty());

        CobolRuntime runtime = new CobolRuntime(InputHandler.SUSPENDING, ScreenUpdateHandler.IGNORE,
                ScreenInputHandler.SUSPENDING, config.getMaxLoopIterations(), config.getMaxCallDepth());

        assertTrue(runtime.run(compilation.program).abended);
    }
}
