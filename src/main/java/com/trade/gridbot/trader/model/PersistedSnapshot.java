package com.trade.gridbot.trader.model;

import com.trade.gridbot.trader.enums.BotState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything that survives a process restart. Readers ignore unknown fields so a newer
 * writer never breaks an older reader.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PersistedSnapshot {

    public static final int FORMAT_VERSION = 1;

    @Builder.Default
    private int version = FORMAT_VERSION;
    private GridConfig config;
    private BotState state;
    private long placementEpoch;
    @Builder.Default
    private List<LedgerEntry> entries = new ArrayList<>();
    @Builder.Default
    private List<GridLevel> plannedLevels = new ArrayList<>();
    private PositionSnapshot position;
    private GridStats stats;
    private Instant savedAt;
}
