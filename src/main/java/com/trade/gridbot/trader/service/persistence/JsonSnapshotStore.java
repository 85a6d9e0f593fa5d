package com.trade.gridbot.trader.service.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.gridbot.trader.common.exception.PersistenceException;
import com.trade.gridbot.trader.model.PersistedSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Optional;

/**
 * Stores the snapshot as {@code <dir>/<symbol>-<instance>.json}. Each save writes a temp file
 * in the same directory and moves it over the target, so readers never see a partial file.
 */
@Slf4j
public class JsonSnapshotStore implements SnapshotStore {

    private final ObjectMapper mapper;
    private final Path file;

    public JsonSnapshotStore(ObjectMapper mapper, Path directory, String symbol, String instance) {
        this.mapper = mapper;
        String name = (symbol + "-" + instance).replaceAll("[^A-Za-z0-9._-]", "_").toLowerCase(Locale.ROOT);
        this.file = directory.resolve(name + ".json");
    }

    @Override
    public void save(PersistedSnapshot snapshot) {
        Path tmp = null;
        try {
            Files.createDirectories(file.getParent());
            tmp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
            mapper.writeValue(tmp.toFile(), snapshot);
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("atomic move unsupported for {}, falling back to replace", file);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new PersistenceException("Failed to write snapshot " + file, e);
        }
    }

    @Override
    public Optional<PersistedSnapshot> load() {
        if (!Files.exists(file)) return Optional.empty();
        try {
            PersistedSnapshot snapshot = mapper.readValue(file.toFile(), PersistedSnapshot.class);
            if (snapshot == null || snapshot.getConfig() == null) {
                throw new PersistenceException("Snapshot " + file + " has no config", null);
            }
            if (snapshot.getVersion() > PersistedSnapshot.FORMAT_VERSION) {
                log.warn("snapshot {} has newer format {} (reader {})", file, snapshot.getVersion(),
                        PersistedSnapshot.FORMAT_VERSION);
            }
            return Optional.of(snapshot);
        } catch (IOException e) {
            throw new PersistenceException("Corrupted snapshot " + file, e);
        }
    }

    @Override
    public String location() {
        return file.toString();
    }

    private static void deleteQuietly(Path p) {
        if (p == null) return;
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.debug("could not delete temp file {}: {}", p, e.getMessage());
        }
    }
}
