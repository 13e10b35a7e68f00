package com.variantforge.document;

import java.util.List;
import java.util.Optional;

/**
 * A parsed view over one document's raw text: header, ordered Entries, footer.
 */
public class Document {

    private final String text;
    private final String header;
    private final List<Entry> entries;
    private final String footer;

    public Document(String text, String header, List<Entry> entries, String footer) {
        this.text = text;
        this.header = header;
        this.entries = List.copyOf(entries);
        this.footer = footer;
    }

    public String getText() {
        return text;
    }

    public String getHeader() {
        return header;
    }

    public List<Entry> getEntries() {
        return entries;
    }

    public String getFooter() {
        return footer;
    }

    public Optional<Entry> find(String identifier) {
        if (identifier == null) {
            return Optional.empty();
        }
        return entries.stream()
            .filter(e -> identifier.equals(e.getIdentifier()))
            .findFirst();
    }

    public boolean isDegraded() {
        return entries.stream().anyMatch(Entry::isDegraded);
    }

    /**
     * Rebuilds the raw text from its parts. Equals {@link #getText()} for any document the reader produced.
     */
    public String reassemble() {
        StringBuilder sb = new StringBuilder(header);
        for (Entry entry : entries) {
            sb.append(entry.getPrefix()).append(entry.getText());
        }
        sb.append(footer);
        return sb.toString();
    }
}
