package com.trade.gridbot.trader.service.persistence;

import com.trade.gridbot.trader.model.PersistedSnapshot;

import java.util.Optional;

/**
 * Durable home of one bot's {@link PersistedSnapshot}.
 */
public interface SnapshotStore {

    /**
     * @throws com.trade.gridbot.trader.common.exception.PersistenceException when the write fails
     */
    void save(PersistedSnapshot snapshot);

    /**
     * @return empty when nothing was saved yet
     * @throws com.trade.gridbot.trader.common.exception.PersistenceException when the stored file is unreadable
     */
    Optional<PersistedSnapshot> load();

    /** Where the snapshot lives, for log messages. */
    String location();
}
