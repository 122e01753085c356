package org.dxworks.cobolsim;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.cobolsim.preprocessor.CobolPreprocessor;
import org.dxworks.cobolsim.runtime.CobolRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

public class CobolSimConfig {

    private static final Logger log = LoggerFactory.getLogger(CobolSimConfig.class);

    private static final String CONFIG_FILE_NAME = "cobolsim-config.yml";
    private static final List<String> DEFAULT_COPYBOOK_EXTENSIONS = List.of(".cpy", ".cbl");

    private final int maxLoopIterations;
    private final int maxCallDepth;
    private final int maxCopyPasses;
    private final List<String> copybookExtensions;

    private CobolSimConfig(int maxLoopIterations, int maxCallDepth, int maxCopyPasses, List<String> copybookExtensions) {
        this.maxLoopIterations = maxLoopIterations;
        this.maxCallDepth = maxCallDepth;
        this.maxCopyPasses = maxCopyPasses;
        this.copybookExtensions = List.copyOf(copybookExtensions);
    }

    public int getMaxLoopIterations() {
        return maxLoopIterations;
    }

    public int getMaxCallDepth() {
        return maxCallDepth;
    }

    public int getMaxCopyPasses() {
        return maxCopyPasses;
    }

    public List<String> getCopybookExtensions() {
        return copybookExtensions;
    }

    public static CobolSimConfig defaults() {
        return with(0, 0, 0, null);
    }

    public static CobolSimConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static CobolSimConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return with(
                        yamlConfig.maxLoopIterations != null ? yamlConfig.maxLoopIterations : 0,
                        yamlConfig.maxCallDepth != null ? yamlConfig.maxCallDepth : 0,
                        yamlConfig.maxCopyPasses != null ? yamlConfig.maxCopyPasses : 0,
                        yamlConfig.copybookExtensions);
            }
        } catch (IOException e) {
            log.warn("Ignoring unreadable {}: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    /**
     * Non-positive limits and a null or empty extension list fall back to the defaults.
     */
    public static CobolSimConfig with(int maxLoopIterations, int maxCallDepth, int maxCopyPasses,
                                      List<String> copybookExtensions) {
        return new CobolSimConfig(
                maxLoopIterations > 0 ? maxLoopIterations : CobolRuntime.DEFAULT_MAX_LOOP_ITERATIONS,
                maxCallDepth > 0 ? maxCallDepth : CobolRuntime.DEFAULT_MAX_CALL_DEPTH,
                maxCopyPasses > 0 ? maxCopyPasses : CobolPreprocessor.DEFAULT_MAX_PASSES,
                copybookExtensions != null && !copybookExtensions.isEmpty() ? copybookExtensions : DEFAULT_COPYBOOK_EXTENSIONS);
    }

    private static class YamlConfig {
        public Integer maxLoopIterations;
        public Integer maxCallDepth;
        public Integer maxCopyPasses;
        public List<String> copybookExtensions;
    }
}
