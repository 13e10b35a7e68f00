package com.variantforge;

import com.variantforge.models.AuditRecord;
import com.variantforge.storage.JsonStorage;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only history of applied transforms, kept in {@code .variant-forge/history.json}.
 */
public class TransformAuditStore {

    private final Path historyPath;

    public TransformAuditStore(Path workspaceRoot) {
        this.historyPath = AppConfig.settingsDirectory(workspaceRoot).resolve("history.json");
    }

    public Path getHistoryPath() {
        return historyPath;
    }

    public synchronized void append(AuditRecord record) throws IOException {
        List<AuditRecord> records = new ArrayList<>(list());
        records.add(record);
        JsonStorage.writeJsonList(historyPath, records);
    }

    public synchronized List<AuditRecord> list() throws IOException {
        return JsonStorage.readJsonList(historyPath, AuditRecord[].class);
    }
}
