package com.variantforge.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Typed assignments ({@code name: type = value}) found in one bounded block of text.
 * Names are matched case-insensitively; the first assignment of a name wins for {@link #get}.
 */
public class PropertyBag {

    private static final Pattern ASSIGNMENT = Pattern.compile(
        "^\\s*([A-Za-z_]\\w*)\\s*:\\s*([^=]+?)\\s*=\\s*(.*?)\\s*$");

    private final Map<String, List<Property>> byName;

    private PropertyBag(Map<String, List<Property>> byName) {
        this.byName = byName;
    }

    public static PropertyBag of(String blockText) {
        Map<String, List<Property>> byName = new LinkedHashMap<>();
        if (blockText == null || blockText.isEmpty()) {
            return new PropertyBag(byName);
        }
        String[] lines = blockText.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            Property property = parseLine(lines[i], i);
            if (property != null) {
                byName.computeIfAbsent(key(property.name()), k -> new ArrayList<>()).add(property);
            }
        }
        return new PropertyBag(byName);
    }

    /**
     * Parses a single assignment line, or returns null when the line is not one.
     */
    public static Property parseLine(String line, int lineIndex) {
        if (line == null) {
            return null;
        }
        Matcher m = ASSIGNMENT.matcher(line);
        if (!m.matches()) {
            return null;
        }
        return new Property(m.group(1), m.group(2).trim(), m.group(3), lineIndex);
    }

    public boolean has(String name) {
        return name != null && byName.containsKey(key(name));
    }

    /**
     * True when the property exists with the given declared type, e.g. {@code stencilMode: u8}.
     */
    public boolean has(String name, String type) {
        return get(name).map(p -> p.type().equalsIgnoreCase(type)).orElse(false);
    }

    public Optional<Property> get(String name) {
        List<Property> all = getAll(name);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(0));
    }

    public List<Property> getAll(String name) {
        if (name == null) {
            return List.of();
        }
        List<Property> found = byName.get(key(name));
        return found != null ? Collections.unmodifiableList(found) : List.of();
    }

    public Optional<String> getString(String name) {
        return get(name).map(Property::unquotedValue);
    }

    public Optional<Long> getLong(String name) {
        return get(name).flatMap(Property::longValue);
    }

    public boolean isTrue(String name) {
        return get(name).map(p -> "true".equalsIgnoreCase(p.value())).orElse(false);
    }

    public int size() {
        return byName.values().stream().mapToInt(List::size).sum();
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    /**
     * One typed assignment. {@code line} is relative to the text the bag was built from.
     */
    public record Property(String name, String type, String value, int line) {

        public String unquotedValue() {
            return FormatProfile.unquote(value);
        }

        public Optional<Long> longValue() {
            try {
                String v = value.trim();
                if (v.startsWith("0x") || v.startsWith("0X")) {
                    return Optional.of(Long.parseLong(v.substring(2), 16));
                }
                return Optional.of(Long.parseLong(v));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
    }
}
