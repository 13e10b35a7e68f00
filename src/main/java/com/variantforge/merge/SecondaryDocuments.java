package com.variantforge.merge;

import java.util.List;

/**
 * Skeleton of a freshly created secondary document: the fixed property header, an entries map
 * holding the generated Entries, and its closing brace.
 */
public final class SecondaryDocuments {

    public static final String HEADER = "#PROP_text\n"
        + "type: string = \"PROP\"\n"
        + "version: u32 = 3\n"
        + "linked: list[string] = {}\n"
        + "entries: map[hash,embed] = {\n";

    public static final String FOOTER = "\n}\n";

    public static final String ENTRIES_PROPERTY = "entries";

    private SecondaryDocuments() {
    }

    public static String render(List<String> entryTexts) {
        return HEADER + String.join("\n", entryTexts) + FOOTER;
    }
}
