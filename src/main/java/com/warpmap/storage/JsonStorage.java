package com.warpmap.storage;

import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Deterministic JSON rendering for the extractor artifacts: map entries and
 * bean properties sorted by key, two-space indent, "\n" line endings on every
 * platform, trailing newline.
 */
public class JsonStorage {

    private static final ObjectMapper mapper = JsonMapper.builder()
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
        .build();

    private static final ObjectWriter writer = mapper.writer(
        new DefaultPrettyPrinter()
            .withObjectIndenter(new DefaultIndenter("  ", "\n"))
            .withArrayIndenter(new DefaultIndenter("  ", "\n")));

    private JsonStorage() {
    }

    public static ObjectMapper mapper() {
        return mapper;
    }

    public static String render(Object data) throws IOException {
        return writer.writeValueAsString(data) + "\n";
    }

    public static void writeJson(Path filePath, Object data) throws IOException {
        writeRendered(filePath, render(data));
    }

    public static void writeRendered(Path filePath, String rendered) throws IOException {
        Path parent = filePath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(filePath, rendered, StandardCharsets.UTF_8);
    }
}
