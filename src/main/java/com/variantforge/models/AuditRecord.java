package com.variantforge.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * One applied transform, as stored in the workspace history file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AuditRecord {

    private long timestamp;
    private String kind;
    private String documentPath;
    private boolean success;
    private String message;
    private List<String> affectedIdentifiers = new ArrayList<>();
    private List<String> writtenFiles = new ArrayList<>();
    private List<String> backups = new ArrayList<>();

    public AuditRecord() {
    }

    public AuditRecord(long timestamp, String kind, String documentPath, boolean success, String message,
                       List<String> affectedIdentifiers, List<String> writtenFiles, List<String> backups) {
        this.timestamp = timestamp;
        this.kind = kind;
        this.documentPath = documentPath;
        this.success = success;
        this.message = message;
        this.affectedIdentifiers = affectedIdentifiers != null ? new ArrayList<>(affectedIdentifiers) : new ArrayList<>();
        this.writtenFiles = writtenFiles != null ? new ArrayList<>(writtenFiles) : new ArrayList<>();
        this.backups = backups != null ? new ArrayList<>(backups) : new ArrayList<>();
    }

    public long getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(long timestamp) {
        this.timestamp = timestamp;
    }

    public String getKind() {
        return kind;
    }

    public void setKind(String kind) {
        this.kind = kind;
    }

    public String getDocumentPath() {
        return documentPath;
    }

    public void setDocumentPath(String documentPath) {
        this.documentPath = documentPath;
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public List<String> getAffectedIdentifiers() {
        return affectedIdentifiers;
    }

    public void setAffectedIdentifiers(List<String> affectedIdentifiers) {
        this.affectedIdentifiers = affectedIdentifiers;
    }

    public List<String> getWrittenFiles() {
        return writtenFiles;
    }

    public void setWrittenFiles(List<String> writtenFiles) {
        this.writtenFiles = writtenFiles;
    }

    public List<String> getBackups() {
        return backups;
    }

    public void setBackups(List<String> backups) {
        this.backups = backups;
    }
}
