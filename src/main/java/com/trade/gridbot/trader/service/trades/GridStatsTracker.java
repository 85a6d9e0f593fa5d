package com.trade.gridbot.trader.service.trades;

import com.trade.gridbot.trader.enums.OrderSide;
import com.trade.gridbot.trader.model.CompletedCycle;
import com.trade.gridbot.trader.model.GridStats;
import com.trade.gridbot.trader.model.GridTrade;
import com.trade.gridbot.trader.service.calculator.GridCalculator;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Running performance of one bot. A fill opens a leg that waits at its replenishment level;
 * the opposite fill at that level closes the leg into a {@link CompletedCycle}.
 * Equity is realized profit plus unrealized P&L; drawdown is measured from its peak.
 * Snapshots may be taken from any thread.
 */
@Slf4j
public class GridStatsTracker {

    private static final int MAX_RECENT = 100;

    private final int replenishStep;
    private final BigDecimal feeRate;
    private final Map<Integer, GridTrade> openLegs = new HashMap<>();

    private GridStats stats = GridStats.builder().build();
    private BigDecimal unrealizedPnl = BigDecimal.ZERO;

    public GridStatsTracker(int replenishStep, BigDecimal feeRate) {
        this.replenishStep = replenishStep;
        this.feeRate = feeRate;
    }

    public synchronized Optional<CompletedCycle> onTrade(GridTrade trade) {
        BigDecimal notional = trade.fillPrice().multiply(trade.quantity());
        stats.setTotalFills(stats.getTotalFills() + 1);
        stats.setFeesPaid(stats.getFeesPaid().add(notional.multiply(feeRate)));

        GridTrade opening = openLegs.get(trade.levelIndex());
        if (opening != null && opening.side() == trade.side().opposite()) {
            openLegs.remove(trade.levelIndex());
            CompletedCycle cycle = close(opening, trade);
            updateEquity();
            return Optional.of(cycle);
        }
        int target = trade.side() == OrderSide.BUY
                ? trade.levelIndex() + replenishStep
                : trade.levelIndex() - replenishStep;
        openLegs.put(target, trade);
        return Optional.empty();
    }

    public synchronized void onUnrealizedPnl(BigDecimal pnl) {
        unrealizedPnl = pnl == null ? BigDecimal.ZERO : pnl;
        updateEquity();
    }

    public synchronized GridStats snapshot() {
        return stats.copy();
    }

    public synchronized void restore(GridStats restored) {
        if (restored == null) return;
        stats = restored.copy();
        if (stats.getRecentCycles() == null) stats.setRecentCycles(new ArrayList<>());
    }

    private CompletedCycle close(GridTrade opening, GridTrade closing) {
        GridTrade buy = opening.side() == OrderSide.BUY ? opening : closing;
        GridTrade sell = opening.side() == OrderSide.SELL ? opening : closing;
        BigDecimal qty = opening.quantity().min(closing.quantity());
        BigDecimal profit = GridCalculator.gridProfit(buy.fillPrice(), sell.fillPrice(), qty, feeRate);
        BigDecimal fees = buy.fillPrice().add(sell.fillPrice()).multiply(qty).multiply(feeRate);

        CompletedCycle cycle = new CompletedCycle(opening.levelIndex(), closing.levelIndex(),
                buy.fillPrice(), sell.fillPrice(), qty, fees, profit, closing.filledAt());

        stats.setCompletedCycles(stats.getCompletedCycles() + 1);
        if (profit.signum() > 0) stats.setWinningCycles(stats.getWinningCycles() + 1);
        else stats.setLosingCycles(stats.getLosingCycles() + 1);
        stats.setRealizedProfit(stats.getRealizedProfit().add(profit));

        List<CompletedCycle> recent = stats.getRecentCycles();
        recent.add(cycle);
        if (recent.size() > MAX_RECENT) recent.remove(0);

        log.info("cycle {}->{} qty {} profit {} (total {})", opening.levelIndex(), closing.levelIndex(),
                qty.toPlainString(), profit.toPlainString(), stats.getRealizedProfit().toPlainString());
        return cycle;
    }

    private void updateEquity() {
        BigDecimal equity = stats.getRealizedProfit().add(unrealizedPnl);
        if (equity.compareTo(stats.getPeakEquity()) > 0) stats.setPeakEquity(equity);
        BigDecimal drawdown = stats.getPeakEquity().subtract(equity).max(BigDecimal.ZERO);
        stats.setCurrentDrawdown(drawdown);
        if (drawdown.compareTo(stats.getMaxDrawdown()) > 0) stats.setMaxDrawdown(drawdown);
    }
}
