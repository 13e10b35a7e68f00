package com.variantforge;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Process-wide log writer. Lines go to the log file and, in dev mode, to the console.
 * Engine classes look it up with {@link #get()} and stay silent when it was never initialized.
 */
public class AppLogger {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final PrintStream fileOutput;
    private final PrintStream consoleOutput;
    private final boolean consoleEnabled;

    private static AppLogger instance;

    private AppLogger(Path logFile, boolean consoleEnabled) throws IOException {
        this.consoleOutput = System.out;
        this.consoleEnabled = consoleEnabled;
        this.fileOutput = new PrintStream(new FileOutputStream(logFile.toFile(), true), true, "UTF-8");

        String separator = "=".repeat(60);
        fileOutput.println();
        fileOutput.println(separator);
        fileOutput.println("Variant Forge started at " + LocalDateTime.now().format(TIME_FORMAT));
        fileOutput.println(separator);
    }

    public static synchronized void initialize(Path logFile, boolean consoleEnabled) throws IOException {
        if (instance == null) {
            instance = new AppLogger(logFile, consoleEnabled);
        }
    }

    public static AppLogger get() {
        return instance;
    }

    public void info(String message) {
        log("INFO", message);
    }

    public void warn(String message) {
        log("WARN", message);
    }

    public void error(String message) {
        log("ERROR", message);
    }

    public void error(String message, Throwable t) {
        log("ERROR", message);
        t.printStackTrace(fileOutput);
        if (consoleEnabled) {
            t.printStackTrace(consoleOutput);
        }
    }

    /**
     * Banner lines: always written to the file, echoed to the console in dev mode.
     */
    public void console(String message) {
        if (consoleEnabled) {
            consoleOutput.println(message);
        }
        fileOutput.println(message);
    }

    public void close() {
        fileOutput.close();
    }

    private void log(String level, String message) {
        String line = String.format("[%s] [%s] %s", LocalDateTime.now().format(TIME_FORMAT), level, message);
        fileOutput.println(line);
        if (consoleEnabled) {
            consoleOutput.println(line);
        }
    }
}
