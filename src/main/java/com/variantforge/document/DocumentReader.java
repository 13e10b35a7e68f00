package com.variantforge.document;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Splits a document into header, ordered top-level Entries and footer.
 * Text between Entries is kept verbatim as the following Entry's prefix.
 */
public class DocumentReader {

    private final EntityExtractor extractor;

    public DocumentReader() {
        this(new EntityExtractor());
    }

    public DocumentReader(EntityExtractor extractor) {
        this.extractor = extractor != null ? extractor : new EntityExtractor();
    }

    public EntityExtractor getExtractor() {
        return extractor;
    }

    public Document read(String text) {
        SourceText source = new SourceText(text);
        FormatProfile profile = extractor.getProfile();
        List<Entry> entries = new ArrayList<>();
        List<String> lines = source.lines();
        int headerEnd = source.text().length();
        int previousEnd = -1;

        for (int i = 0; i < lines.size(); i++) {
            Optional<FormatProfile.Header> header = profile.matchEntryHeader(lines.get(i));
            if (header.isEmpty()) {
                continue;
            }
            BlockScanner.BlockEnd end = BlockScanner.findBlockEnd(lines, i);
            int startOffset = source.lineStart(i);
            String prefix;
            if (previousEnd < 0) {
                headerEnd = startOffset;
                prefix = "";
            } else {
                prefix = source.text().substring(previousEnd, startOffset);
            }
            String entryText = source.slice(i, end.line());
            entries.add(buildEntry(header.get(), i, end.line(), entryText, prefix, end.degraded()));
            previousEnd = source.lineEnd(end.line());
            i = end.line();
        }

        String all = source.text();
        String head = all.substring(0, headerEnd);
        String footer = previousEnd < 0 ? "" : all.substring(previousEnd);
        return new Document(all, head, entries, footer);
    }

    /**
     * Reads a single Entry from text whose first matching header starts the block.
     */
    public Optional<Entry> readEntry(String entryText) {
        Document doc = read(entryText);
        return doc.getEntries().isEmpty() ? Optional.empty() : Optional.of(doc.getEntries().get(0));
    }

    private Entry buildEntry(FormatProfile.Header header, int start, int end, String text, String prefix,
                             boolean degraded) {
        List<SubEntry> subs = extractor.extractSubEntries(text);
        String identifier = header.identifier();
        return new Entry(header.identifierToken(), header.typeTag(), start, end, text, prefix,
            extractor.displayName(text, identifier), subs, extractor.variantState(text, subs),
            degraded || subs.stream().anyMatch(SubEntry::isDegraded));
    }
}
