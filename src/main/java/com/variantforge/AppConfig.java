package com.variantforge;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command-line settings. Everything the tool keeps for a workspace (variant defaults, history, logs)
 * lives under the workspace's {@value #SETTINGS_DIR} folder.
 */
public class AppConfig {

    public static final String SETTINGS_DIR = ".variant-forge";
    static final String LOG_FILE = "variant-forge.log";
    static final int DEFAULT_PORT = 8080;

    private final Path workspacePath;
    private final Path logPath;
    private final int port;
    private final boolean devMode;

    private AppConfig(Path workspacePath, Path logPath, int port, boolean devMode) {
        this.workspacePath = workspacePath;
        this.logPath = logPath;
        this.port = port;
        this.devMode = devMode;
    }

    public Path getWorkspacePath() {
        return workspacePath;
    }

    public Path getLogPath() {
        return logPath;
    }

    public int getPort() {
        return port;
    }

    public boolean isDevMode() {
        return devMode;
    }

    /** {@code <workspace>/.variant-forge} */
    public static Path settingsDirectory(Path workspaceRoot) {
        return workspaceRoot.resolve(SETTINGS_DIR);
    }

    /**
     * The preferred port when free, otherwise any port the OS hands out.
     */
    static int findAvailablePort(int preferredPort) {
        try (ServerSocket socket = new ServerSocket(preferredPort)) {
            socket.setReuseAddress(true);
            return preferredPort;
        } catch (IOException busy) {
            try (ServerSocket socket = new ServerSocket(0)) {
                return socket.getLocalPort();
            } catch (IOException e) {
                return preferredPort;
            }
        }
    }

    public static class Builder {
        private Path workspacePath = null;
        private int preferredPort = DEFAULT_PORT;
        private boolean devMode = false;

        public Builder workspacePath(String path) {
            if (path != null && !path.isEmpty()) {
                this.workspacePath = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder port(int port) {
            this.preferredPort = port;
            return this;
        }

        /**
         * Accepts {@code --workspace <dir>}, {@code --port <n>} (or the {@code --flag=value} forms) and {@code --dev}.
         */
        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (arg.startsWith("--workspace=")) {
                    workspacePath(arg.substring("--workspace=".length()));
                } else if ("--workspace".equals(arg) && i + 1 < args.length) {
                    workspacePath(args[++i]);
                } else if (arg.startsWith("--port=")) {
                    this.preferredPort = parsePort(arg.substring("--port=".length()), preferredPort);
                } else if ("--port".equals(arg) && i + 1 < args.length) {
                    this.preferredPort = parsePort(args[++i], preferredPort);
                } else if ("--dev".equals(arg)) {
                    this.devMode = true;
                }
            }
            return this;
        }

        Path getWorkspacePath() {
            return workspacePath;
        }

        int getPreferredPort() {
            return preferredPort;
        }

        boolean isDevMode() {
            return devMode;
        }

        /**
         * Without {@code --workspace} the current directory is the workspace, so the tool can be
         * started from inside a mod project.
         */
        public AppConfig build() throws IOException {
            Path workspace = workspacePath != null ? workspacePath : Paths.get("").toAbsolutePath().normalize();
            Path logDirectory = settingsDirectory(workspace).resolve("logs");
            Files.createDirectories(logDirectory);
            return new AppConfig(workspace, logDirectory.resolve(LOG_FILE), findAvailablePort(preferredPort), devMode);
        }

        private static int parsePort(String value, int fallback) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                System.err.println("Ignoring invalid port '" + value + "', using " + fallback);
                return fallback;
            }
        }
    }
}
