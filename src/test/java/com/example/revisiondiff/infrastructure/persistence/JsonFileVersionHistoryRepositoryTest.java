package com.example.revisiondiff.infrastructure.persistence;

import com.example.revisiondiff.domain.TextVersion;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileVersionHistoryRepositoryTest {

    @TempDir Path storageDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private JsonFileVersionHistoryRepository repository;

    @BeforeEach
    void setUp() {
        repository = new JsonFileVersionHistoryRepository(storageDir.resolve("versions").toString(), objectMapper);
    }

    @Test
    void storeWritesArrayWithSnakeCaseFields() throws IOException {
        TextVersion version =
                new TextVersion("abcdef012345", "Hello", LocalDateTime.of(2024, 3, 1, 12, 30, 15), null, "plain");

        repository.store("doc", List.of(version));

        Path file = storageDir.resolve("versions").resolve("doc.json");
        JsonNode json = objectMapper.readTree(Files.readString(file, StandardCharsets.UTF_8));
        assertThat(json.isArray()).isTrue();
        assertThat(json.size()).isEqualTo(1);
        JsonNode entry = json.get(0);
        assertThat(entry.get("version_id").asText()).isEqualTo("abcdef012345");
        assertThat(entry.get("content").asText()).isEqualTo("Hello");
        assertThat(entry.get("timestamp").asText()).isEqualTo("2024-03-01T12:30:15");
        assertThat(entry.get("label").isNull()).isTrue();
        assertThat(entry.get("style").asText()).isEqualTo("plain");
        assertThat(Files.exists(file.resolveSibling("doc.json.tmp"))).isFalse();
    }

    @Test
    void storedHistoryLoadsBackInOrder() throws IOException {
        List<TextVersion> history =
                List.of(
                        new TextVersion("000000000001", "one", LocalDateTime.of(2024, 1, 1, 9, 0), "a", null),
                        new TextVersion("000000000002", "two\n😀", LocalDateTime.of(2024, 1, 1, 9, 0, 0, 5000), null, null));

        repository.store("doc", history);

        assertThat(repository.load("doc")).containsExactlyElementsOf(history);
    }

    @Test
    void storeReplacesPreviousHistory() throws IOException {
        TextVersion first = new TextVersion("000000000001", "one", LocalDateTime.of(2024, 1, 1, 9, 0), null, null);
        TextVersion second = new TextVersion("000000000002", "two", LocalDateTime.of(2024, 1, 1, 9, 1), null, null);
        repository.store("doc", List.of(first));

        repository.store("doc", List.of(first, second));

        assertThat(repository.load("doc")).containsExactly(first, second);
    }

    @Test
    void missingFileLoadsAsEmpty() throws IOException {
        assertThat(repository.load("nothing")).isEmpty();
    }

    @Test
    void deleteOfMissingFileIsNoOp() throws IOException {
        repository.delete("nothing");

        assertThat(repository.load("nothing")).isEmpty();
    }

    @Test
    void deleteRemovesStoredFile() throws IOException {
        repository.store(
                "doc",
                List.of(new TextVersion("000000000001", "one", LocalDateTime.of(2024, 1, 1, 9, 0), null, null)));

        repository.delete("doc");

        assertThat(Files.exists(storageDir.resolve("versions").resolve("doc.json"))).isFalse();
    }

    @Test
    void unknownFieldsAreIgnored() throws IOException {
        Files.createDirectories(storageDir.resolve("versions"));
        Files.writeString(
                storageDir.resolve("versions").resolve("doc.json"),
                "[{\"version_id\":\"abc\",\"content\":\"x\",\"timestamp\":\"2024-01-01T00:00:00\",\"extra\":1}]",
                StandardCharsets.UTF_8);

        assertThat(repository.load("doc"))
                .containsExactly(new TextVersion("abc", "x", LocalDateTime.of(2024, 1, 1, 0, 0), null, null));
    }

    @Test
    void incompleteEntryFailsToLoad() throws IOException {
        Files.createDirectories(storageDir.resolve("versions"));
        Files.writeString(
                storageDir.resolve("versions").resolve("doc.json"),
                "[{\"version_id\":\"abc\",\"timestamp\":\"2024-01-01T00:00:00\"}]",
                StandardCharsets.UTF_8);

        assertThatThrownBy(() -> repository.load("doc")).isInstanceOf(IOException.class);
    }

    @Test
    void unreadableTimestampFailsToLoad() throws IOException {
        Files.createDirectories(storageDir.resolve("versions"));
        Files.writeString(
                storageDir.resolve("versions").resolve("doc.json"),
                "[{\"version_id\":\"abc\",\"content\":\"x\",\"timestamp\":\"yesterday\"}]",
                StandardCharsets.UTF_8);

        assertThatThrownBy(() -> repository.load("doc"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("timestamp");
    }

    @Test
    void documentIdCannotEscapeStorageDirectory() {
        assertThatThrownBy(() -> repository.fileFor("../outside"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(repository.fileFor("doc").getFileName().toString()).isEqualTo("doc.json");
    }
}
