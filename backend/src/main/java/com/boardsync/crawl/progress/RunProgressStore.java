package com.boardsync.crawl.progress;

import com.boardsync.config.CrawlerProperties;
import com.boardsync.crawl.model.RunProgress;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * JSON progress file holding the resume pointer. Writes go to a sibling temp file that is then moved over the
 * target, so a crash mid-write leaves the previous checkpoint intact.
 */
@Component
public class RunProgressStore {
    private static final Logger log = LoggerFactory.getLogger(RunProgressStore.class);

    private final CrawlerProperties properties;
    private final ObjectMapper objectMapper;

    public RunProgressStore(CrawlerProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public Optional<RunProgress> load() {
        Path path = path();
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(path.toFile(), RunProgress.class));
        } catch (IOException e) {
            throw new CheckpointException("Progress file " + path + " is unreadable", e);
        }
    }

    public void save(RunProgress progress) {
        Path path = path();
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = path.resolveSibling(path.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), progress);
            try {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Checkpointed progress at index {} of {} (cycle {})",
                progress.lastCompletedIndex(), progress.employers().size(), progress.cycle());
        } catch (IOException e) {
            throw new CheckpointException("Failed to write progress file " + path, e);
        }
    }

    public Path path() {
        return Paths.get(properties.getRun().getProgressFile());
    }
}
