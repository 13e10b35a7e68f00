package com.variantforge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.variantforge.models.VariantDefaults;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class VariantDefaultsStore {
    private final ObjectMapper objectMapper;
    private Path configPath;

    public VariantDefaultsStore(Path workspaceRoot, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        configure(workspaceRoot);
    }

    public void configure(Path workspaceRoot) {
        this.configPath = AppConfig.settingsDirectory(workspaceRoot).resolve("variant-defaults.json");
    }

    public Path getConfigPath() {
        return configPath;
    }

    public VariantDefaults loadOrDefault() {
        if (configPath == null || !Files.exists(configPath)) {
            return new VariantDefaults();
        }
        try {
            VariantDefaults loaded = objectMapper.readValue(configPath.toFile(), VariantDefaults.class);
            return loaded != null ? loaded : new VariantDefaults();
        } catch (IOException e) {
            log("Unreadable " + configPath + ", using built-in defaults: " + e.getMessage());
            return new VariantDefaults();
        }
    }

    public void save(VariantDefaults defaults) throws IOException {
        if (configPath == null || defaults == null) {
            return;
        }
        Files.createDirectories(configPath.getParent());
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(configPath.toFile(), defaults);
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[VariantDefaultsStore] " + message);
        }
    }
}
