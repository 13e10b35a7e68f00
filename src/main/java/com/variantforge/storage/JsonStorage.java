package com.variantforge.storage;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads and writes JSON array files. A missing file reads as an empty list.
 */
public final class JsonStorage {

    private static final ObjectMapper mapper = new ObjectMapper();

    private JsonStorage() {
    }

    public static <T> List<T> readJsonList(Path path, Class<T[]> clazz) throws IOException {
        if (!Files.exists(path)) {
            return new ArrayList<>();
        }
        T[] items = mapper.readValue(path.toFile(), clazz);
        if (items == null) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Arrays.asList(items));
    }

    public static void writeJsonList(Path path, List<?> data) throws IOException {
        Path parent = path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), data);
    }
}
