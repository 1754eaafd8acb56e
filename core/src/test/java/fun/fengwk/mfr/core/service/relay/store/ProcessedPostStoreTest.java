package fun.fengwk.mfr.core.service.relay.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.mfr.core.service.relay.RelayProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class ProcessedPostStoreTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RelayProperties relayProperties;

    @BeforeEach
    void setUp() {
        relayProperties = new RelayProperties();
        relayProperties.setProcessedPostsFile(tempDir.resolve("data/processed_posts.json").toString());
    }

    @Test
    public void shouldPersistProcessedIds() throws IOException {
        ProcessedPostStore store = new ProcessedPostStore(relayProperties, objectMapper);
        store.load();
        store.markProcessed(10);
        store.markProcessed(30);
        store.markProcessed(20);
        store.save();

        ProcessedPostStore reloaded = new ProcessedPostStore(relayProperties, objectMapper);
        reloaded.load();

        assertThat(reloaded.isProcessed(10)).isTrue();
        assertThat(reloaded.isProcessed(20)).isTrue();
        assertThat(reloaded.isProcessed(30)).isTrue();
        assertThat(reloaded.isProcessed(99)).isFalse();
        JsonNode saved = objectMapper.readTree(Files.readString(Path.of(relayProperties.getProcessedPostsFile())));
        assertThat(saved.get("posts")).hasSize(3);
        assertThat(saved.get("lastPost").asLong()).isEqualTo(30);
    }

    @Test
    public void shouldKeepMostRecentIds() throws IOException {
        relayProperties.setProcessedKeep(2);
        ProcessedPostStore store = new ProcessedPostStore(relayProperties, objectMapper);
        store.markProcessed(1);
        store.markProcessed(2);
        store.markProcessed(3);
        store.markProcessed(1);

        store.save();

        assertThat(store.isProcessed(2)).isFalse();
        assertThat(store.isProcessed(3)).isTrue();
        assertThat(store.isProcessed(1)).isTrue();
        JsonNode saved = objectMapper.readTree(Files.readString(Path.of(relayProperties.getProcessedPostsFile())));
        assertThat(saved.get("posts")).hasSize(2);
        assertThat(saved.get("posts").get(0).asLong()).isEqualTo(3);
        assertThat(saved.get("posts").get(1).asLong()).isEqualTo(1);
        assertThat(saved.get("lastPost").asLong()).isEqualTo(3);
        assertThat(saved.get("lastUpdate").asText()).isNotBlank();
    }

    @Test
    public void shouldStartEmptyWhenFileCorrupted() throws IOException {
        Path file = Path.of(relayProperties.getProcessedPostsFile());
        Files.createDirectories(file.getParent());
        Files.writeString(file, "[broken");

        ProcessedPostStore store = new ProcessedPostStore(relayProperties, objectMapper);
        store.load();

        assertThat(store.isProcessed(1)).isFalse();
        store.markProcessed(7);
        store.save();
        JsonNode saved = objectMapper.readTree(Files.readString(file));
        assertThat(saved.get("posts")).hasSize(1);
        assertThat(saved.get("lastPost").asLong()).isEqualTo(7);
    }

}
