package com.variantforge;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @Test
    void parsesSeparateAndInlineForms() {
        AppConfig.Builder builder = new AppConfig.Builder()
            .parseArgs(new String[] {"--workspace", "work", "--port=9001", "--dev"});

        assertEquals(Paths.get("work").toAbsolutePath().normalize(), builder.getWorkspacePath());
        assertEquals(9001, builder.getPreferredPort());
        assertTrue(builder.isDevMode());
    }

    @Test
    void invalidPortKeepsThePreviousValue() {
        AppConfig.Builder builder = new AppConfig.Builder()
            .port(7000)
            .parseArgs(new String[] {"--port", "abc", "--workspace="});

        assertEquals(7000, builder.getPreferredPort());
        assertNull(builder.getWorkspacePath());
        assertFalse(builder.isDevMode());
    }

    @Test
    void danglingFlagIsIgnored() {
        AppConfig.Builder builder = new AppConfig.Builder().parseArgs(new String[] {"--port"});

        assertEquals(8080, builder.getPreferredPort());
    }

    @Test
    void logsLiveInTheWorkspaceSettingsFolder(@TempDir Path root) throws Exception {
        AppConfig config = new AppConfig.Builder()
            .workspacePath(root.toString())
            .port(0)
            .build();

        assertEquals(root.toAbsolutePath().normalize(), config.getWorkspacePath());
        assertEquals(AppConfig.settingsDirectory(config.getWorkspacePath()).resolve("logs").resolve("variant-forge.log"),
            config.getLogPath());
        assertTrue(Files.isDirectory(config.getLogPath().getParent()));
    }
}
