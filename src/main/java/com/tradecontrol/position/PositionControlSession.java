package com.tradecontrol.position;

import com.tradecontrol.common.Decimals;
import com.tradecontrol.common.Transition;
import com.tradecontrol.domain.enums.PositionSide;
import com.tradecontrol.exception.InvalidInputException;
import com.tradecontrol.grid.GridLevelProfit;
import com.tradecontrol.grid.GridProfitStats;
import com.tradecontrol.grid.GridProfitTracker;
import com.tradecontrol.grid.GridTrail;
import com.tradecontrol.grid.TrailingGridConfig;
import com.tradecontrol.grid.TrailingGridManager;
import com.tradecontrol.grid.TrailingGridState;
import com.tradecontrol.ladder.AverageEntry;
import com.tradecontrol.ladder.LadderState;
import com.tradecontrol.ladder.SafetyOrder;
import com.tradecontrol.ladder.SafetyOrderConfig;
import com.tradecontrol.ladder.SafetyOrderLadder;
import com.tradecontrol.ladder.SafetyOrderStatus;
import com.tradecontrol.risk.RiskDecision;
import com.tradecontrol.risk.RiskGatekeeper;
import com.tradecontrol.risk.RiskLimits;
import com.tradecontrol.risk.RiskState;
import com.tradecontrol.takeprofit.LevelTakeProfit;
import com.tradecontrol.takeprofit.LevelTakeProfitConfig;
import com.tradecontrol.takeprofit.LevelTakeProfitManager;
import com.tradecontrol.takeprofit.LevelTakeProfitState;
import com.tradecontrol.takeprofit.TakeProfitCheck;
import com.tradecontrol.takeprofit.TakeProfitTarget;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Control state of one bot: its risk gate, the safety ladder and take-profit levels of
 * the current position, and an optional trailing grid.
 *
 * <p>Each price observation runs through {@link #tick} in a fixed order:
 * <ol>
 *   <li>Drawdown against the average entry. At the cap the tick asks for an emergency
 *       close and nothing new is committed.</li>
 *   <li>Safety ladder triggers. Every breached order must pass the risk gate first;
 *       the first rejection ends the batch and the remaining orders stay PENDING.</li>
 *   <li>Level take-profit against the current average entry.</li>
 *   <li>Grid trail.</li>
 * </ol>
 *
 * <p>Risk state lives for the whole session and carries across positions (losing
 * streak, daily loss, circuit breaker). Ladder, take-profit and grid state are reset
 * when the position closes.
 *
 * <p>Not thread-safe. Callers serialize access per session; separate sessions share
 * nothing and may run concurrently.
 */
public class PositionControlSession {

    private static final Logger log = LoggerFactory.getLogger(PositionControlSession.class);

    private final String sessionId;
    private final Clock clock;
    private final GridProfitTracker profitTracker;

    private RiskGatekeeper riskGatekeeper;
    private SafetyOrderLadder ladder;
    private LevelTakeProfitManager takeProfitManager;
    private TrailingGridManager gridManager;

    private PositionBook position = PositionBook.flat();
    private RiskState riskState;
    private LadderState ladderState = LadderState.empty(PositionSide.LONG);
    private LevelTakeProfitState takeProfitState;
    private TrailingGridState gridState = TrailingGridState.empty();

    public PositionControlSession(
            String sessionId,
            RiskLimits riskLimits,
            SafetyOrderConfig safetyOrderConfig,
            LevelTakeProfitConfig takeProfitConfig,
            TrailingGridConfig trailingGridConfig,
            BigDecimal initialBalance,
            Clock clock) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new InvalidInputException("sessionId must not be blank");
        }
        this.sessionId = sessionId;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.riskGatekeeper = new RiskGatekeeper(riskLimits, clock);
        this.ladder = new SafetyOrderLadder(safetyOrderConfig, clock);
        this.takeProfitManager = new LevelTakeProfitManager(takeProfitConfig);
        this.gridManager = new TrailingGridManager(trailingGridConfig, clock);
        this.profitTracker = new GridProfitTracker(clock);
        this.riskState = riskGatekeeper.initialState(initialBalance);
        this.takeProfitState = takeProfitManager.initialState();
    }

    // ========================
    // POSITION LIFECYCLE
    // ========================

    /**
     * Opens a position after the circuit breaker and open-position checks pass. On
     * approval the safety ladder is built from {@code entryPrice} and take-profit
     * tracking starts at level 0.
     *
     * <p>Calling this again for the symbol already held is a no-op that returns
     * allowed; a different symbol while a position is open is an error.
     *
     * @param existingSymbols distinct symbols with open positions in other sessions; each
     *     counts as one position toward {@code maxOpenPositions}
     */
    public RiskDecision openPosition(
            String symbol,
            Collection<String> existingSymbols,
            PositionSide side,
            BigDecimal entryPrice,
            BigDecimal quantity) {
        if (symbol == null || symbol.isBlank()) {
            throw new InvalidInputException("symbol must not be blank");
        }
        requirePositive("entryPrice", entryPrice);
        requirePositive("quantity", quantity);
        Objects.requireNonNull(side, "side");

        if (position.isOpen()) {
            if (position.getSymbol().equals(symbol)) {
                log.debug("[{}] Position in {} already open, ignoring open request", sessionId, symbol);
                return RiskDecision.allowed();
            }
            throw new InvalidInputException(
                    "Session " + sessionId + " already holds a position in " + position.getSymbol());
        }

        Transition<RiskState, RiskDecision> breaker = riskGatekeeper.checkCircuitBreaker(riskState);
        riskState = breaker.getState();
        if (breaker.getResult().isRejected()) {
            log.warn("[{}] Open {} {} rejected: {}", sessionId, side, symbol, breaker.getResult());
            return breaker.getResult();
        }

        int openElsewhere = existingSymbols == null ? 0 : Set.copyOf(existingSymbols).size();
        RiskDecision decision = riskGatekeeper.canOpenNewPosition(riskState, symbol, existingSymbols, openElsewhere);
        if (decision.isRejected()) {
            log.warn("[{}] Open {} {} rejected: {}", sessionId, side, symbol, decision);
            return decision;
        }

        boolean alreadyCounted = existingSymbols != null && existingSymbols.contains(symbol);
        if (!alreadyCounted) {
            riskState = riskGatekeeper.recordPositionOpened(riskState);
        }
        ladderState = ladder.initialize(entryPrice, side);
        takeProfitState = takeProfitManager.updateAvgEntryPrice(takeProfitManager.initialState(), entryPrice);
        position = PositionBook.builder()
                .open(true)
                .symbol(symbol)
                .side(side)
                .baseEntryPrice(entryPrice)
                .baseQuantity(quantity)
                .avgEntryPrice(entryPrice)
                .filledQuantity(quantity)
                .closedQuantity(BigDecimal.ZERO)
                .totalInvested(entryPrice.multiply(quantity, Decimals.MC))
                .build();

        log.info("[{}] Opened {} {} qty {} @ {}", sessionId, side, symbol, quantity, entryPrice);
        return decision;
    }

    /**
     * Applies a safety order fill: recomputes the average entry and moves the
     * take-profit level to the number of filled safety orders. Duplicate or unknown
     * fills change nothing.
     */
    public PositionBook onSafetyOrderFilled(int index, BigDecimal filledPrice) {
        requirePositive("filledPrice", filledPrice);
        if (!position.isOpen()) {
            log.debug("[{}] Safety order #{} fill ignored, no open position", sessionId, index);
            return position;
        }
        LadderState next = ladder.markFilled(ladderState, index, filledPrice);
        if (next == ladderState) {
            return position;
        }
        ladderState = next;

        AverageEntry average =
                ladder.calculateAverageEntry(ladderState, position.getBaseEntryPrice(), position.getBaseQuantity());
        int level = ladder.getFilledOrders(ladderState).size();
        takeProfitState = takeProfitManager.updateAvgEntryPrice(
                takeProfitManager.updateLevel(takeProfitState, level), average.getAvgEntryPrice());
        position = position.toBuilder()
                .avgEntryPrice(average.getAvgEntryPrice())
                .filledQuantity(average.getTotalQuantity())
                .totalInvested(average.getTotalInvested())
                .build();

        log.info(
                "[{}] Safety order #{} filled @ {}: level {}, avg entry {}",
                sessionId,
                index,
                filledPrice,
                level,
                average.getAvgEntryPrice());
        return position;
    }

    /** Reduces the open quantity after a take-profit fill. Never goes below zero. */
    public PositionBook onPartialClose(BigDecimal quantity) {
        requirePositive("quantity", quantity);
        if (!position.isOpen()) {
            log.debug("[{}] Partial close ignored, no open position", sessionId);
            return position;
        }
        BigDecimal closed = quantity.min(position.getOpenQuantity());
        position = position.toBuilder()
                .closedQuantity(position.getClosedQuantity().add(closed))
                .build();
        log.info("[{}] Partial close {} {}, {} remaining", sessionId, closed, position.getSymbol(),
                position.getOpenQuantity());
        return position;
    }

    /**
     * Records the realized result with the risk gate and resets the ladder, take-profit
     * and grid state. Grid profit history goes with the grid; read
     * {@link #getGridProfitStats()} before closing to keep it. A negative {@code pnl}
     * counts as a loss.
     *
     * @return safety orders that were TRIGGERED but never reported filled; the caller
     *     should cancel them on the venue
     */
    public List<SafetyOrder> closePosition(BigDecimal pnl) {
        Objects.requireNonNull(pnl, "pnl");
        if (!position.isOpen()) {
            log.debug("[{}] Close ignored, no open position", sessionId);
            return List.of();
        }
        riskState = riskGatekeeper.recordPositionClosed(riskState, pnl, pnl.signum() < 0);

        LadderState cancelled = ladder.cancelAll(ladderState);
        List<SafetyOrder> outstanding = cancelled.getOrders().stream()
                .filter(order -> order.is(SafetyOrderStatus.TRIGGERED))
                .collect(Collectors.toUnmodifiableList());

        log.info(
                "[{}] Closed {} {} pnl {} ({} safety orders cancelled, {} outstanding)",
                sessionId,
                position.getSide(),
                position.getSymbol(),
                pnl,
                cancelled.count(SafetyOrderStatus.CANCELLED),
                outstanding.size());

        ladderState = ladder.reset(cancelled);
        takeProfitState = takeProfitManager.reset();
        if (!profitTracker.getHistory().isEmpty()) {
            log.info(
                    "[{}] Grid closed with {} round trips, profit {}",
                    sessionId,
                    profitTracker.getHistory().size(),
                    profitTracker.getStats().getTotalProfit());
        }
        gridState = TrailingGridState.empty();
        profitTracker.clear();
        position = PositionBook.flat();
        return outstanding;
    }

    // ========================
    // GRID
    // ========================

    /** Starts trailing a freshly placed grid. Profit history of any previous grid is dropped. */
    public TrailingGridState openGrid(BigDecimal centerPrice, List<BigDecimal> levels) {
        gridState = gridManager.reset(centerPrice, levels);
        profitTracker.clear();
        log.info("[{}] Grid opened around {} with {} levels", sessionId, centerPrice, gridState.getLevels().size());
        return gridState;
    }

    public GridLevelProfit recordGridRoundTrip(
            int level,
            BigDecimal buyPrice,
            BigDecimal sellPrice,
            BigDecimal buyQuantity,
            BigDecimal sellQuantity,
            Instant buyTime) {
        return profitTracker.recordCompletedLevel(level, buyPrice, sellPrice, buyQuantity, sellQuantity, buyTime);
    }

    public GridProfitStats getGridProfitStats() {
        return profitTracker.getStats();
    }

    public List<BigDecimal> getGridLevels() {
        return gridManager.getLevels(gridState);
    }

    // ========================
    // TICK
    // ========================

    public TickResult tick(BigDecimal price) {
        return tick(price, List.of());
    }

    /**
     * Evaluates one price observation.
     *
     * @param otherOpenSymbols symbols with open positions in other sessions
     */
    public TickResult tick(BigDecimal price, Collection<String> otherOpenSymbols) {
        requirePositive("price", price);
        TickResult.TickResultBuilder result = TickResult.builder().price(price);

        if (position.isOpen()) {
            Transition<RiskState, RiskDecision> drawdown = riskGatekeeper.updateDrawdown(riskState, drawdownPercent(price));
            riskState = drawdown.getState();
            result.drawdownDecision(drawdown.getResult());

            if (drawdown.getResult().isRejected()) {
                log.warn("[{}] Emergency close of {} requested: {}", sessionId, position.getSymbol(), drawdown.getResult());
                result.emergencyClose(true);
            } else {
                evaluateSafetyOrders(price, otherOpenSymbols, result);
                evaluateTakeProfit(price, result);
            }
        }

        Transition<TrailingGridState, Optional<GridTrail>> trail = gridManager.executeTrail(gridState, price);
        gridState = trail.getState();
        trail.getResult().ifPresent(result::gridTrail);

        return result.build();
    }

    private void evaluateSafetyOrders(BigDecimal price, Collection<String> otherOpenSymbols, TickResult.TickResultBuilder result) {
        RiskAdmission admission = new RiskAdmission(otherOpenSymbols);
        Transition<LadderState, List<SafetyOrder>> triggers = ladder.checkTriggers(ladderState, price, admission);
        ladderState = triggers.getState();
        riskState = admission.state;
        result.safetyOrdersToPlace(triggers.getResult()).safetyOrderBlockedBy(admission.rejection);
    }

    private void evaluateTakeProfit(BigDecimal price, TickResult.TickResultBuilder result) {
        Transition<LevelTakeProfitState, TakeProfitCheck> check =
                takeProfitManager.checkTP(takeProfitState, price, position.getSide());
        takeProfitState = check.getState();
        if (check.getResult().isHit()) {
            LevelTakeProfit level = check.getResult().getLevel();
            BigDecimal closeQuantity = takeProfitManager.calculateCloseQuantity(level, position.getOpenQuantity());
            result.takeProfit(new TakeProfitAction(level, closeQuantity));
        }
        result.trailingStopEnabled(takeProfitManager.shouldEnableTrailing(takeProfitState));
    }

    /** Adverse move from the average entry in percent, zero when in profit. */
    private BigDecimal drawdownPercent(BigDecimal price) {
        BigDecimal avg = position.getAvgEntryPrice();
        if (!Decimals.isPositive(avg)) {
            return BigDecimal.ZERO;
        }
        BigDecimal adverse = position.getSide() == PositionSide.LONG ? avg.subtract(price) : price.subtract(avg);
        return Decimals.percentOf(adverse, avg).max(BigDecimal.ZERO);
    }

    /** Puts each breached safety order through the risk gate and books the approved ones. */
    private final class RiskAdmission implements Predicate<SafetyOrder> {

        private final Collection<String> otherOpenSymbols;
        private RiskState state;
        private RiskDecision rejection;

        private RiskAdmission(Collection<String> otherOpenSymbols) {
            this.otherOpenSymbols = otherOpenSymbols;
            this.state = riskState;
        }

        @Override
        public boolean test(SafetyOrder order) {
            Transition<RiskState, RiskDecision> check = riskGatekeeper.canOpenAveragingOrder(
                    state, order.getAmount(), position.getSymbol(), otherOpenSymbols);
            state = check.getState();
            RiskDecision decision = check.getResult();
            if (decision.isRejected()) {
                log.info("[{}] Safety order #{} held back: {}", sessionId, order.getIndex(), decision);
                rejection = decision;
                return false;
            }
            if (decision.hasWarning()) {
                log.warn("[{}] {}", sessionId, decision.getWarning());
            }
            state = riskGatekeeper.recordOrderOpened(state, order.getAmount());
            return true;
        }
    }

    // ========================
    // ACCOUNT AND CONFIGURATION
    // ========================

    public void updateBalance(BigDecimal balance) {
        riskState = riskGatekeeper.updateBalance(riskState, balance);
    }

    public void resetDailyRisk() {
        riskState = riskGatekeeper.resetDaily(riskState);
    }

    /** Clears counters, streak and circuit breaker. The balance is kept. */
    public void resetRisk() {
        riskState = riskGatekeeper.reset(riskState);
    }

    public void updateRiskLimits(RiskLimits limits) {
        riskGatekeeper = new RiskGatekeeper(limits, clock);
        log.info("[{}] Risk limits updated", sessionId);
    }

    /** Applies to ladders built from now on; the current ladder keeps its orders. */
    public void updateSafetyOrderConfig(SafetyOrderConfig config) {
        ladder = new SafetyOrderLadder(config, clock);
        log.info("[{}] Safety order config updated", sessionId);
    }

    public void updateTakeProfitConfig(LevelTakeProfitConfig config) {
        takeProfitManager = new LevelTakeProfitManager(config);
        log.info("[{}] Take-profit levels updated", sessionId);
    }

    public void updateTrailingGridConfig(TrailingGridConfig config) {
        gridManager = new TrailingGridManager(config, clock);
        log.info("[{}] Trailing grid config updated", sessionId);
    }

    // ========================
    // STATE
    // ========================

    public PositionControlSnapshot snapshot() {
        return PositionControlSnapshot.builder()
                .sessionId(sessionId)
                .position(position)
                .risk(riskState)
                .ladder(ladderState)
                .takeProfit(takeProfitState)
                .grid(gridState)
                .build();
    }

    /** Replaces all machine state with a previously taken snapshot of this session. */
    public void restore(PositionControlSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        if (!sessionId.equals(snapshot.getSessionId())) {
            throw new InvalidInputException(
                    "Snapshot of session " + snapshot.getSessionId() + " cannot be restored into " + sessionId);
        }
        if (snapshot.getPosition() == null
                || snapshot.getRisk() == null
                || snapshot.getLadder() == null
                || snapshot.getTakeProfit() == null
                || snapshot.getGrid() == null) {
            throw new InvalidInputException("Snapshot of session " + sessionId + " is incomplete");
        }
        position = snapshot.getPosition();
        riskState = snapshot.getRisk();
        ladderState = snapshot.getLadder();
        takeProfitState = snapshot.getTakeProfit();
        gridState = snapshot.getGrid();
        log.info("[{}] State restored (position open: {})", sessionId, position.isOpen());
    }

    public String getSessionId() {
        return sessionId;
    }

    public PositionBook getPosition() {
        return position;
    }

    public RiskState getRiskState() {
        return riskState;
    }

    public LadderState getLadderState() {
        return ladderState;
    }

    public LevelTakeProfitState getTakeProfitState() {
        return takeProfitState;
    }

    public TrailingGridState getGridState() {
        return gridState;
    }

    public List<SafetyOrder> getFilledSafetyOrders() {
        return ladder.getFilledOrders(ladderState);
    }

    public Optional<TakeProfitTarget> getNextTakeProfitTarget() {
        return takeProfitManager.getNextTPTarget(takeProfitState);
    }

    public RiskLimits getRiskLimits() {
        return riskGatekeeper.getLimits();
    }

    private static void requirePositive(String field, BigDecimal value) {
        if (value == null || value.signum() <= 0) {
            throw new InvalidInputException(field + " must be positive (was " + value + ")");
        }
    }
}
