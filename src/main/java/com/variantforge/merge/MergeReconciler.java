package com.variantforge.merge;

import com.variantforge.AppLogger;
import com.variantforge.document.BlockScanner;
import com.variantforge.document.Document;
import com.variantforge.document.DocumentReader;
import com.variantforge.document.Entry;
import com.variantforge.document.SourceText;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Unions Entries generated for a secondary document with the ones it already holds.
 * Existing Entries always win; an incoming Entry whose identifier is taken is dropped and reported.
 */
public class MergeReconciler {

    private static final Pattern ENTRIES_SECTION = Pattern.compile(
        "^\\s*" + SecondaryDocuments.ENTRIES_PROPERTY + "\\s*:[^=]*=\\s*\\{");

    private final DocumentReader reader;

    public MergeReconciler() {
        this(new DocumentReader());
    }

    public MergeReconciler(DocumentReader reader) {
        this.reader = reader != null ? reader : new DocumentReader();
    }

    /**
     * Existing Entries first, in order, then every incoming Entry with an unseen identifier.
     */
    public List<Entry> reconcile(List<Entry> existing, List<Entry> incoming, List<String> droppedOut) {
        List<Entry> merged = new ArrayList<>(existing);
        Set<String> seen = new LinkedHashSet<>();
        for (Entry entry : existing) {
            seen.add(entry.getIdentifier());
        }
        for (Entry entry : incoming) {
            if (!seen.add(entry.getIdentifier())) {
                log("Skipping duplicate entry: " + entry.getIdentifier());
                if (droppedOut != null) {
                    droppedOut.add(entry.getIdentifier());
                }
                continue;
            }
            merged.add(entry);
        }
        return merged;
    }

    public List<Entry> reconcile(List<Entry> existing, List<Entry> incoming) {
        return reconcile(existing, incoming, null);
    }

    /**
     * Merges Entry texts into a secondary document's current text. Blank or missing text
     * produces a new document from {@link SecondaryDocuments}. Existing text is kept byte for byte;
     * accepted Entries are inserted after the last existing Entry, or into the entries map when
     * the document has none yet.
     */
    public MergeResult mergeIntoDocument(String existingText, List<String> newEntryTexts) {
        List<Entry> incoming = new ArrayList<>();
        for (String text : newEntryTexts) {
            reader.readEntry(text).ifPresent(incoming::add);
        }
        boolean created = existingText == null || existingText.isBlank();
        Document document = reader.read(created ? "" : existingText);
        List<String> dropped = new ArrayList<>();
        List<Entry> merged = reconcile(document.getEntries(), incoming, dropped);
        List<Entry> accepted = merged.subList(document.getEntries().size(), merged.size());

        List<String> identifiers = new ArrayList<>();
        merged.forEach(e -> identifiers.add(e.getIdentifier()));
        List<String> added = new ArrayList<>();
        List<String> acceptedTexts = new ArrayList<>();
        for (Entry entry : accepted) {
            added.add(entry.getIdentifier());
            acceptedTexts.add(entry.getText());
        }

        String text;
        if (created) {
            text = SecondaryDocuments.render(acceptedTexts);
        } else if (acceptedTexts.isEmpty()) {
            text = existingText;
        } else if (!document.getEntries().isEmpty()) {
            text = appendAfterLastEntry(document, acceptedTexts);
        } else {
            text = insertIntoEntriesSection(existingText, acceptedTexts);
        }
        log("Merged " + added.size() + " new + " + document.getEntries().size() + " existing entries, dropped "
            + dropped.size());
        return new MergeResult(text, identifiers, added, dropped, created);
    }

    private static String appendAfterLastEntry(Document document, List<String> texts) {
        StringBuilder sb = new StringBuilder(document.getHeader());
        for (Entry entry : document.getEntries()) {
            sb.append(entry.getPrefix()).append(entry.getText());
        }
        for (String text : texts) {
            sb.append('\n').append(text);
        }
        sb.append(document.getFooter());
        return sb.toString();
    }

    private static String insertIntoEntriesSection(String existingText, List<String> texts) {
        SourceText source = new SourceText(existingText);
        Optional<Integer> sectionLine = Optional.empty();
        for (int i = 0; i < source.lineCount(); i++) {
            if (ENTRIES_SECTION.matcher(source.line(i)).find()) {
                sectionLine = Optional.of(i);
                break;
            }
        }
        String joined = String.join("\n", texts);
        if (sectionLine.isEmpty()) {
            String separator = existingText.endsWith("\n") ? "" : "\n";
            return existingText + separator + joined + "\n";
        }
        int start = sectionLine.get();
        BlockScanner.BlockEnd end = BlockScanner.findBlockEnd(source.lines(), start);
        if (end.line() == start) {
            String line = source.line(start);
            int open = BlockScanner.indexOfDelimiter(line, '{');
            int close = BlockScanner.lastIndexOfDelimiter(line, '}');
            String rewritten = line.substring(0, open + 1) + "\n" + joined + "\n"
                + SourceText.indentOf(line) + line.substring(close);
            return existingText.substring(0, source.lineStart(start)) + rewritten
                + existingText.substring(source.lineEnd(start));
        }
        int at = source.lineStart(end.line());
        return existingText.substring(0, at) + joined + "\n" + existingText.substring(at);
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[MergeReconciler] " + message);
        }
    }
}
