package com.variantforge.xref;

import com.variantforge.AppLogger;
import com.variantforge.document.BlockScanner;
import com.variantforge.document.FormatProfile;
import com.variantforge.document.SourceText;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Inserts and removes records in the resolver map and paths in the linked-file list.
 * New items always go just before the section's closing brace; every other line is kept as is.
 */
public class CrossReferenceUpdater {

    public static final String DEFAULT_RESOLVER_TYPE = "ResourceResolver";
    public static final String DEFAULT_RESOLVER_MAP = "resourceMap";
    public static final String DEFAULT_LINKED_PROPERTY = "linked";

    private static final Pattern RECORD = Pattern.compile(
        "^\\s*(" + FormatProfile.IDENTIFIER_TOKEN + ")\\s*=\\s*(.+?)\\s*,?\\s*$");
    private static final Pattern QUOTED = Pattern.compile("\"((?:[^\"\\\\]|\\\\.)*)\"");

    private final FormatProfile profile;
    private final String resolverType;
    private final String resolverMapProperty;
    private final String linkedProperty;

    public CrossReferenceUpdater() {
        this(FormatProfile.defaults(), DEFAULT_RESOLVER_TYPE, DEFAULT_RESOLVER_MAP, DEFAULT_LINKED_PROPERTY);
    }

    public CrossReferenceUpdater(FormatProfile profile, String resolverType, String resolverMapProperty,
                                 String linkedProperty) {
        this.profile = profile != null ? profile : FormatProfile.defaults();
        this.resolverType = resolverType;
        this.resolverMapProperty = resolverMapProperty;
        this.linkedProperty = linkedProperty;
    }

    public String getResolverType() {
        return resolverType;
    }

    public CrossReferenceTable read(String text) {
        SourceText source = new SourceText(text);
        Optional<Section> resolver = resolverMap(source);
        Map<String, String> records = new LinkedHashMap<>();
        resolver.ifPresent(section -> {
            for (Record record : records(source, section)) {
                records.putIfAbsent(record.key, record.value);
            }
        });
        Optional<Section> linked = linkedList(source);
        List<String> files = linked.map(section -> items(source, section)).orElse(List.of());
        return new CrossReferenceTable(resolver.isPresent(), records, linked.isPresent(), files);
    }

    /**
     * Adds {@code key = value} records to the resolver map. Keys already present are skipped.
     */
    public XrefEdit addResolverRecords(String text, Map<String, String> additions) {
        List<String> requested = new ArrayList<>(additions.keySet());
        SourceText source = new SourceText(text);
        Optional<Section> found = resolverMap(source);
        if (found.isEmpty()) {
            log("No " + resolverType + " map found, skipping " + requested.size() + " record(s)");
            return XrefEdit.missingSection(text, requested);
        }
        Section section = found.get();
        List<String> existing = new ArrayList<>();
        for (Record record : records(source, section)) {
            existing.add(record.key);
        }
        List<String> applied = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        List<String> lines = new ArrayList<>();
        for (Map.Entry<String, String> addition : additions.entrySet()) {
            if (existing.contains(addition.getKey()) || applied.contains(addition.getKey())) {
                skipped.add(addition.getKey());
                continue;
            }
            applied.add(addition.getKey());
            lines.add(FormatProfile.quote(addition.getKey()) + " = " + FormatProfile.quote(addition.getValue()));
        }
        if (lines.isEmpty()) {
            return XrefEdit.of(text, applied, skipped);
        }
        return XrefEdit.of(insertBeforeClose(source, section, lines), applied, skipped);
    }

    public XrefEdit removeResolverRecords(String text, List<String> keys) {
        SourceText source = new SourceText(text);
        Optional<Section> found = resolverMap(source);
        if (found.isEmpty()) {
            return XrefEdit.missingSection(text, keys);
        }
        Section section = found.get();
        List<String> applied = new ArrayList<>();
        List<Integer> drop = new ArrayList<>();
        for (Record record : records(source, section)) {
            if (keys.contains(record.key)) {
                applied.add(record.key);
                drop.add(record.line);
            }
        }
        List<String> skipped = new ArrayList<>(keys);
        skipped.removeAll(applied);
        if (drop.isEmpty()) {
            return XrefEdit.of(text, applied, skipped);
        }
        if (section.isSingleLine()) {
            return XrefEdit.of(replaceLine(source, section.start, section.emptied(source)), applied, skipped);
        }
        return XrefEdit.of(dropLines(source, drop), applied, skipped);
    }

    /**
     * Appends document paths to the linked-file list. Paths already listed (case-insensitive) are skipped.
     */
    public XrefEdit addLinkedFiles(String text, List<String> paths) {
        SourceText source = new SourceText(text);
        Optional<Section> found = linkedList(source);
        if (found.isEmpty()) {
            log("No " + linkedProperty + " list found, skipping " + paths.size() + " path(s)");
            return XrefEdit.missingSection(text, paths);
        }
        Section section = found.get();
        List<String> existing = items(source, section);
        List<String> applied = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        List<String> lines = new ArrayList<>();
        for (String path : paths) {
            if (containsIgnoreCase(existing, path) || containsIgnoreCase(applied, path)) {
                skipped.add(path);
                continue;
            }
            applied.add(path);
            lines.add(FormatProfile.quote(path));
        }
        if (lines.isEmpty()) {
            return XrefEdit.of(text, applied, skipped);
        }
        return XrefEdit.of(insertBeforeClose(source, section, lines), applied, skipped);
    }

    public XrefEdit removeLinkedFiles(String text, List<String> paths) {
        SourceText source = new SourceText(text);
        Optional<Section> found = linkedList(source);
        if (found.isEmpty()) {
            return XrefEdit.missingSection(text, paths);
        }
        Section section = found.get();
        List<String> applied = new ArrayList<>();
        for (String item : items(source, section)) {
            if (containsIgnoreCase(paths, item)) {
                applied.add(item);
            }
        }
        List<String> skipped = new ArrayList<>();
        for (String path : paths) {
            if (!containsIgnoreCase(applied, path)) {
                skipped.add(path);
            }
        }
        if (applied.isEmpty()) {
            return XrefEdit.of(text, applied, skipped);
        }
        if (section.isSingleLine()) {
            List<String> remaining = new ArrayList<>(items(source, section));
            remaining.removeIf(item -> containsIgnoreCase(paths, item));
            String rewritten = section.emptied(source);
            String result = replaceLine(source, section.start, rewritten);
            if (!remaining.isEmpty()) {
                SourceText updated = new SourceText(result);
                List<String> lines = new ArrayList<>();
                remaining.forEach(item -> lines.add(FormatProfile.quote(item)));
                result = insertBeforeClose(updated, linkedList(updated).orElseThrow(), lines);
            }
            return XrefEdit.of(result, applied, skipped);
        }
        List<Integer> drop = new ArrayList<>();
        for (int i = section.start + 1; i < section.end; i++) {
            Matcher m = QUOTED.matcher(source.line(i));
            if (m.find() && containsIgnoreCase(paths, m.group(1))) {
                drop.add(i);
            }
        }
        return XrefEdit.of(dropLines(source, drop), applied, skipped);
    }

    private Optional<Section> resolverMap(SourceText source) {
        List<String> lines = source.lines();
        for (int i = 0; i < lines.size(); i++) {
            Optional<FormatProfile.Header> header = profile.matchEntryHeader(lines.get(i));
            if (header.isEmpty() || !resolverType.equals(header.get().typeTag())) {
                continue;
            }
            BlockScanner.BlockEnd end = BlockScanner.findBlockEnd(lines, i);
            return findSection(source, resolverMapProperty, i + 1, end.line());
        }
        return Optional.empty();
    }

    private Optional<Section> linkedList(SourceText source) {
        return findSection(source, linkedProperty, 0, source.lineCount() - 1);
    }

    private Optional<Section> findSection(SourceText source, String property, int from, int to) {
        Pattern opening = Pattern.compile("^(\\s*)" + Pattern.quote(property) + "\\s*:[^=]*=\\s*\\{",
            Pattern.CASE_INSENSITIVE);
        for (int i = Math.max(from, 0); i <= to && i < source.lineCount(); i++) {
            Matcher m = opening.matcher(source.line(i));
            if (m.find()) {
                BlockScanner.BlockEnd end = BlockScanner.findBlockEnd(source.lines(), i);
                if (end.degraded()) {
                    log("Section " + property + " at line " + (i + 1) + " is not closed, leaving it alone");
                    return Optional.empty();
                }
                return Optional.of(new Section(i, end.line(), m.group(1)));
            }
        }
        return Optional.empty();
    }

    private List<Record> records(SourceText source, Section section) {
        List<Record> result = new ArrayList<>();
        if (section.isSingleLine()) {
            Matcher m = RECORD.matcher(section.body(source));
            if (m.matches()) {
                result.add(new Record(FormatProfile.unquote(m.group(1)), FormatProfile.unquote(m.group(2)),
                    section.start));
            }
            return result;
        }
        int depth = 1;
        for (int i = section.start + 1; i < section.end; i++) {
            String line = source.line(i);
            if (depth == 1) {
                Matcher m = RECORD.matcher(line);
                if (m.matches()) {
                    result.add(new Record(FormatProfile.unquote(m.group(1)), FormatProfile.unquote(m.group(2)), i));
                }
            }
            BlockScanner.DelimiterCount count = BlockScanner.countDelimiters(line);
            depth += count.opens() - count.closes();
        }
        return result;
    }

    private List<String> items(SourceText source, Section section) {
        String body;
        if (section.isSingleLine()) {
            body = section.body(source);
        } else {
            StringBuilder sb = new StringBuilder();
            for (int i = section.start + 1; i < section.end; i++) {
                sb.append(source.line(i)).append('\n');
            }
            body = sb.toString();
        }
        List<String> result = new ArrayList<>();
        Matcher m = QUOTED.matcher(body);
        while (m.find()) {
            result.add(m.group(1));
        }
        return result;
    }

    private String insertBeforeClose(SourceText source, Section section, List<String> items) {
        String text = source.text();
        if (section.isSingleLine()) {
            String line = source.line(section.start);
            int open = BlockScanner.indexOfDelimiter(line, '{');
            int close = BlockScanner.lastIndexOfDelimiter(line, '}');
            String itemIndent = section.indent + "    ";
            StringBuilder sb = new StringBuilder(line.substring(0, open + 1));
            String inner = section.body(source);
            if (!inner.isEmpty()) {
                sb.append('\n').append(itemIndent).append(inner);
            }
            for (String item : items) {
                sb.append('\n').append(itemIndent).append(item);
            }
            sb.append('\n').append(section.indent).append(line.substring(close));
            return replaceLine(source, section.start, sb.toString());
        }
        String itemIndent = section.indent + "    ";
        for (int i = section.start + 1; i < section.end; i++) {
            if (!source.line(i).isBlank()) {
                itemIndent = SourceText.indentOf(source.line(i));
                break;
            }
        }
        StringBuilder sb = new StringBuilder();
        for (String item : items) {
            sb.append(itemIndent).append(item).append('\n');
        }
        int at = source.lineStart(section.end);
        return text.substring(0, at) + sb + text.substring(at);
    }

    private static String replaceLine(SourceText source, int line, String replacement) {
        String text = source.text();
        return text.substring(0, source.lineStart(line)) + replacement + text.substring(source.lineEnd(line));
    }

    private static String dropLines(SourceText source, List<Integer> drop) {
        StringBuilder sb = new StringBuilder();
        int cursor = 0;
        String text = source.text();
        for (int line : drop) {
            sb.append(text, cursor, source.lineStart(line));
            cursor = line + 1 < source.lineCount() ? source.lineStart(line + 1) : source.lineEnd(line);
        }
        sb.append(text.substring(cursor));
        return sb.toString();
    }

    private static boolean containsIgnoreCase(List<String> values, String candidate) {
        return values.stream().anyMatch(v -> v.equalsIgnoreCase(candidate));
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[CrossReferenceUpdater] " + message);
        }
    }

    private static final class Record {
        final String key;
        final String value;
        final int line;

        Record(String key, String value, int line) {
            this.key = key;
            this.value = value;
            this.line = line;
        }
    }

    private static final class Section {
        final int start;
        final int end;
        final String indent;

        Section(int start, int end, String indent) {
            this.start = start;
            this.end = end;
            this.indent = indent;
        }

        boolean isSingleLine() {
            return start == end;
        }

        /** Text between the braces of a single-line section, trimmed. */
        String body(SourceText source) {
            String line = source.line(start);
            int open = BlockScanner.indexOfDelimiter(line, '{');
            int close = BlockScanner.lastIndexOfDelimiter(line, '}');
            return open >= 0 && close > open ? line.substring(open + 1, close).trim() : "";
        }

        /** The single-line section with its braces emptied. */
        String emptied(SourceText source) {
            String line = source.line(start);
            int open = BlockScanner.indexOfDelimiter(line, '{');
            int close = BlockScanner.lastIndexOfDelimiter(line, '}');
            return line.substring(0, open + 1) + line.substring(close);
        }
    }
}
