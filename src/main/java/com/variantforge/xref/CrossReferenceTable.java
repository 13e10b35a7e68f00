package com.variantforge.xref;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only snapshot of a document's resolver records and linked-file list, both in source order.
 */
public class CrossReferenceTable {

    private final boolean resolverFound;
    private final Map<String, String> records;
    private final boolean linkedFound;
    private final List<String> linkedFiles;

    public CrossReferenceTable(boolean resolverFound, Map<String, String> records,
                               boolean linkedFound, List<String> linkedFiles) {
        this.resolverFound = resolverFound;
        this.records = Collections.unmodifiableMap(new LinkedHashMap<>(records));
        this.linkedFound = linkedFound;
        this.linkedFiles = List.copyOf(linkedFiles);
    }

    public boolean isResolverFound() {
        return resolverFound;
    }

    public Map<String, String> getRecords() {
        return records;
    }

    public boolean isLinkedFound() {
        return linkedFound;
    }

    public List<String> getLinkedFiles() {
        return linkedFiles;
    }

    public boolean hasRecord(String key) {
        return records.containsKey(key);
    }

    public boolean isLinked(String path) {
        return linkedFiles.stream().anyMatch(p -> p.equalsIgnoreCase(path));
    }
}
