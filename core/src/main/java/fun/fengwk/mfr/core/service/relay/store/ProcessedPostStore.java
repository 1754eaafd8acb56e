package fun.fengwk.mfr.core.service.relay.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.mfr.core.service.relay.RelayProperties;
import fun.fengwk.mfr.core.utils.AtomicFiles;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Ids of threads already relayed, in the order they were relayed.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProcessedPostStore {

    private final RelayProperties relayProperties;
    private final ObjectMapper objectMapper;

    private final LinkedHashSet<Long> processed = new LinkedHashSet<>();

    @PostConstruct
    public synchronized void load() {
        Path file = storeFile();
        if (!Files.exists(file)) {
            return;
        }
        try {
            ProcessedPostsState state = objectMapper.readValue(Files.readString(file), ProcessedPostsState.class);
            processed.clear();
            if (state.getPosts() != null) {
                processed.addAll(state.getPosts());
            }
            log.info("processed posts loaded, count={}, lastPost={}, file={}", processed.size(), state.getLastPost(), file);
        } catch (Exception ex) {
            log.error("load processed posts failed, file={}, error={}", file, ex.getMessage(), ex);
        }
    }

    public synchronized boolean isProcessed(long postId) {
        return processed.contains(postId);
    }

    public synchronized void markProcessed(long postId) {
        processed.remove(postId);
        processed.add(postId);
    }

    /**
     * Drops all but the most recent ids and writes the store.
     */
    public synchronized void save() {
        trim();
        ProcessedPostsState state = new ProcessedPostsState();
        state.setPosts(new ArrayList<>(processed));
        state.setLastPost(processed.stream().mapToLong(Long::longValue).max().orElse(0L));
        state.setLastUpdate(LocalDateTime.now().toString());
        Path file = storeFile();
        try {
            AtomicFiles.writeString(file, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(state));
            log.debug("processed posts saved, count={}, lastPost={}", state.getPosts().size(), state.getLastPost());
        } catch (Exception ex) {
            log.error("save processed posts failed, file={}, error={}", file, ex.getMessage(), ex);
        }
    }

    private void trim() {
        int keep = Math.max(0, relayProperties.getProcessedKeep());
        Iterator<Long> iterator = processed.iterator();
        int excess = processed.size() - keep;
        while (excess-- > 0 && iterator.hasNext()) {
            iterator.next();
            iterator.remove();
        }
    }

    private Path storeFile() {
        return Path.of(relayProperties.getProcessedPostsFile());
    }

    @Data
    public static class ProcessedPostsState {

        private List<Long> posts = new ArrayList<>();
        private long lastPost;
        private String lastUpdate;

    }

}
