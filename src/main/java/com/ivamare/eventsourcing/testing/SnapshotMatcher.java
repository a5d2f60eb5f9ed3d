package com.ivamare.eventsourcing.testing;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Compares values against JSON snapshot files.
 *
 * <p>A missing snapshot is written and the match passes. An existing snapshot must be
 * structurally equal to the value's JSON tree. With {@code update} set, every snapshot is
 * rewritten.
 */
public class SnapshotMatcher {

    private static final Logger log = LoggerFactory.getLogger(SnapshotMatcher.class);

    private final ObjectMapper objectMapper;
    private final Path directory;
    private final boolean update;

    public SnapshotMatcher(ObjectMapper objectMapper, Path directory, boolean update) {
        this.objectMapper = objectMapper;
        this.directory = directory;
        this.update = update;
    }

    /**
     * Mapper reading fields rather than getters, with sorted properties and map keys and
     * ISO-8601 dates.
     */
    public static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .visibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE)
            .visibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
            .build();
        mapper.findAndRegisterModules(); // JSR310
        return mapper;
    }

    /**
     * @param name Snapshot name, used as file name
     * @param actual Value to compare
     * @throws AssertionError if the stored snapshot differs
     */
    public void match(String name, Object actual) throws IOException {
        Path file = snapshotFile(name);
        JsonNode actualTree = objectMapper.valueToTree(actual);

        if (update || !Files.exists(file)) {
            Files.createDirectories(file.getParent());
            Files.writeString(file, render(actualTree), StandardCharsets.UTF_8);
            log.info("Wrote snapshot {}", file);
            return;
        }

        JsonNode expectedTree = objectMapper.readTree(Files.readString(file, StandardCharsets.UTF_8));
        if (!expectedTree.equals(actualTree)) {
            assertThat(render(actualTree))
                .as("snapshot %s (%s)", name, file)
                .isEqualTo(render(expectedTree));
        }
        log.debug("Snapshot {} matched", name);
    }

    public Path snapshotFile(String name) {
        return directory.resolve(name.replaceAll("[^A-Za-z0-9._-]", "_") + ".json");
    }

    public Path getDirectory() {
        return directory;
    }

    public boolean isUpdate() {
        return update;
    }

    private String render(JsonNode tree) throws IOException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(tree) + System.lineSeparator();
    }
}
