package com.variantforge.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * A planned rewrite of one document: the unified diff for display and the full text to write.
 */
public class DocumentChange {

    private final String path;
    private final boolean created;
    private final String diff;
    private final String newText;
    private final List<String> droppedDuplicates;

    public DocumentChange(String path, boolean created, String diff, String newText, List<String> droppedDuplicates) {
        this.path = path;
        this.created = created;
        this.diff = diff;
        this.newText = newText;
        this.droppedDuplicates = droppedDuplicates != null ? List.copyOf(droppedDuplicates) : List.of();
    }

    public String getPath() {
        return path;
    }

    public boolean isCreated() {
        return created;
    }

    public String getDiff() {
        return diff;
    }

    @JsonIgnore
    public String getNewText() {
        return newText;
    }

    public boolean isChanged() {
        return diff != null && !diff.isEmpty();
    }

    public List<String> getDroppedDuplicates() {
        return droppedDuplicates;
    }
}
