package com.taskpilot.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Optional;

/**
 * Reads and writes {@link JobState} snapshots.
 * <p>
 * Writes go to a sibling temp file which is then moved over the target, so a crash
 * mid-write leaves either the previous snapshot or the new one, never a torn file.
 * A missing or unreadable snapshot is treated as "no prior state".
 */
@Component
public class JobStateStore {

    private static final Logger log = LoggerFactory.getLogger(JobStateStore.class);

    private final ObjectMapper mapper;
    private final Clock clock;

    @Autowired
    public JobStateStore(Clock clock) {
        this(JsonSupport.newMapper(), clock);
    }

    JobStateStore(ObjectMapper mapper, Clock clock) {
        this.mapper = mapper;
        this.clock = clock;
    }

    public Optional<JobState> load(Path stateFile) {
        if (!Files.isRegularFile(stateFile)) {
            return Optional.empty();
        }
        try {
            if (Files.size(stateFile) == 0) {
                log.warn("Ignoring empty job state file {}", stateFile);
                return Optional.empty();
            }
            return Optional.of(mapper.readValue(stateFile.toFile(), JobState.class));
        } catch (IOException e) {
            log.warn("Ignoring unreadable job state file {}: {}", stateFile, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Stamps {@code updatedAt} and atomically replaces the snapshot at {@code stateFile}.
     *
     * @throws StateStoreException when the snapshot cannot be written
     */
    public void persist(Path stateFile, JobState state) {
        state.setUpdatedAt(clock.instant());
        Path target = stateFile.toAbsolutePath();
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.createDirectories(target.getParent());
            mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), state);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move unsupported for {}, replacing in place", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StateStoreException("Failed to write job state " + target, e);
        }
    }
}
