package org.dxworks.cteframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.cteframe.options.SqlPreview;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class CteframeConfig {

    private static final String CONFIG_FILE_NAME = "cteframe-config.yml";
    private static final int DEFAULT_PREVIEW_LENGTH = SqlPreview.DEFAULT_MAX_LENGTH;
    private static final ActionMode DEFAULT_MODE = ActionMode.FROM_HERE;

    private final int previewLength;
    private final ActionMode defaultMode;

    private CteframeConfig(int previewLength, ActionMode defaultMode) {
        this.previewLength = previewLength;
        this.defaultMode = defaultMode;
    }

    public int getPreviewLength() {
        return previewLength;
    }

    public ActionMode getDefaultMode() {
        return defaultMode;
    }

    public static CteframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static CteframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                int effectivePreviewLength = (yamlConfig.previewLength != null && yamlConfig.previewLength > 0)
                        ? yamlConfig.previewLength
                        : DEFAULT_PREVIEW_LENGTH;
                ActionMode effectiveMode = yamlConfig.defaultMode != null
                        ? ActionMode.fromName(yamlConfig.defaultMode)
                        : DEFAULT_MODE;
                return new CteframeConfig(effectivePreviewLength, effectiveMode);
            }
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("Ignoring unreadable " + configPath + ": " + e.getMessage());
        }

        return defaults();
    }

    public static CteframeConfig defaults() {
        return new CteframeConfig(DEFAULT_PREVIEW_LENGTH, DEFAULT_MODE);
    }

    public static CteframeConfig with(int previewLength, ActionMode defaultMode) {
        int effectivePreviewLength = previewLength > 0 ? previewLength : DEFAULT_PREVIEW_LENGTH;
        return new CteframeConfig(effectivePreviewLength, defaultMode != null ? defaultMode : DEFAULT_MODE);
    }

    private static class YamlConfig {
        public Integer previewLength;
        public String defaultMode;
    }
}
