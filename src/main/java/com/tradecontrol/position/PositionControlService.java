package com.tradecontrol.position;

import com.tradecontrol.domain.enums.PositionSide;
import com.tradecontrol.exception.InvalidInputException;
import com.tradecontrol.exception.SessionNotFoundException;
import com.tradecontrol.grid.TrailingGridProperties;
import com.tradecontrol.ladder.SafetyOrder;
import com.tradecontrol.ladder.SafetyOrderProperties;
import com.tradecontrol.observability.ControlMetricsService;
import com.tradecontrol.risk.RiskDecision;
import com.tradecontrol.risk.RiskGatekeeperConfig;
import com.tradecontrol.takeprofit.LevelTakeProfitProperties;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Registry of independent {@link PositionControlSession}s keyed by bot id.
 *
 * <p>Sessions are built from the application defaults ({@code tradecontrol.*}
 * properties) with per-session {@link PositionControlOptions} on top. Calls for one
 * session are serialized on that session; different sessions block each other only
 * while opening.
 *
 * <p>The open-position limit of each session counts the positions held by every other
 * registered session, one per distinct symbol. Opens are serialized across sessions so
 * two sessions cannot both take the last free slot.
 */
@Service
public class PositionControlService {

    private static final Logger log = LoggerFactory.getLogger(PositionControlService.class);

    private final Map<String, PositionControlSession> sessions = new ConcurrentHashMap<>();
    private final Object openLock = new Object();

    private final RiskGatekeeperConfig riskGatekeeperConfig;
    private final SafetyOrderProperties safetyOrderProperties;
    private final LevelTakeProfitProperties levelTakeProfitProperties;
    private final TrailingGridProperties trailingGridProperties;
    private final Clock clock;
    private final ControlMetricsService controlMetricsService;

    public PositionControlService(
            RiskGatekeeperConfig riskGatekeeperConfig,
            SafetyOrderProperties safetyOrderProperties,
            LevelTakeProfitProperties levelTakeProfitProperties,
            TrailingGridProperties trailingGridProperties,
            Clock clock,
            ControlMetricsService controlMetricsService) {
        this.riskGatekeeperConfig = riskGatekeeperConfig;
        this.safetyOrderProperties = safetyOrderProperties;
        this.levelTakeProfitProperties = levelTakeProfitProperties;
        this.trailingGridProperties = trailingGridProperties;
        this.clock = clock;
        this.controlMetricsService = controlMetricsService;
    }

    // ========================
    // REGISTRY
    // ========================

    public PositionControlSession createSession(String sessionId) {
        return createSession(sessionId, PositionControlOptions.defaults());
    }

    public PositionControlSession createSession(String sessionId, PositionControlOptions options) {
        PositionControlSession session = buildSession(sessionId, options);
        if (sessions.putIfAbsent(sessionId, session) != null) {
            throw new InvalidInputException("Session already exists: " + sessionId);
        }
        log.info("Control session {} created", sessionId);
        return session;
    }

    public PositionControlSession getSession(String sessionId) {
        PositionControlSession session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    public Optional<PositionControlSession> findSession(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /** Disposes a session. Unknown ids are ignored. */
    public void removeSession(String sessionId) {
        if (sessions.remove(sessionId) != null) {
            log.info("Control session {} removed", sessionId);
        }
    }

    public Set<String> getSessionIds() {
        return Set.copyOf(sessions.keySet());
    }

    public int getActiveSessionCount() {
        return sessions.size();
    }

    // ========================
    // POSITION OPERATIONS
    // ========================

    public RiskDecision openPosition(
            String sessionId, String symbol, PositionSide side, BigDecimal entryPrice, BigDecimal quantity) {
        PositionControlSession session = getSession(sessionId);
        RiskDecision decision;
        synchronized (openLock) {
            Set<String> heldElsewhere = openSymbolsExcept(sessionId);
            synchronized (session) {
                decision = session.openPosition(symbol, heldElsewhere, side, entryPrice, quantity);
            }
        }
        controlMetricsService.recordDecision(decision);
        return decision;
    }

    public TickResult onPrice(String sessionId, BigDecimal price) {
        PositionControlSession session = getSession(sessionId);
        Set<String> heldElsewhere = openSymbolsExcept(sessionId);
        long start = System.nanoTime();
        TickResult result;
        synchronized (session) {
            result = session.tick(price, heldElsewhere);
        }
        controlMetricsService.recordTick(result, System.nanoTime() - start);

        if (result.hasActions()) {
            log.info(
                    "[{}] Tick {}: emergencyClose={}, safetyOrders={}, takeProfit={}, gridTrail={}",
                    sessionId,
                    price,
                    result.isEmergencyClose(),
                    result.getSafetyOrdersToPlace().size(),
                    result.getTakeProfit() != null,
                    result.getGridTrail() != null);
        }
        return result;
    }

    public PositionBook onSafetyOrderFilled(String sessionId, int index, BigDecimal filledPrice) {
        PositionControlSession session = getSession(sessionId);
        synchronized (session) {
            return session.onSafetyOrderFilled(index, filledPrice);
        }
    }

    public PositionBook onPartialClose(String sessionId, BigDecimal quantity) {
        PositionControlSession session = getSession(sessionId);
        synchronized (session) {
            return session.onPartialClose(quantity);
        }
    }

    public List<SafetyOrder> closePosition(String sessionId, BigDecimal pnl) {
        PositionControlSession session = getSession(sessionId);
        synchronized (session) {
            return session.closePosition(pnl);
        }
    }

    // ========================
    // PERSISTENCE
    // ========================

    public String exportSession(String sessionId) {
        PositionControlSession session = getSession(sessionId);
        synchronized (session) {
            return ControlStateCodec.toJson(session.snapshot());
        }
    }

    /**
     * Rebuilds a session from exported JSON. Configuration comes from {@code options}
     * and the defaults, not from the snapshot.
     */
    public PositionControlSession importSession(String json, PositionControlOptions options) {
        PositionControlSnapshot snapshot = ControlStateCodec.fromJson(json);
        PositionControlSession session = buildSession(snapshot.getSessionId(), options);
        session.restore(snapshot);
        sessions.put(snapshot.getSessionId(), session);
        log.info("Control session {} imported", snapshot.getSessionId());
        return session;
    }

    // ========================
    // INTERNALS
    // ========================

    private PositionControlSession buildSession(String sessionId, PositionControlOptions options) {
        PositionControlOptions effective = options != null ? options : PositionControlOptions.defaults();
        return new PositionControlSession(
                sessionId,
                effective.getRiskLimits() != null ? effective.getRiskLimits() : riskGatekeeperConfig.toLimits(),
                effective.getSafetyOrders() != null ? effective.getSafetyOrders() : safetyOrderProperties.toConfig(),
                effective.getTakeProfit() != null ? effective.getTakeProfit() : levelTakeProfitProperties.toConfig(),
                effective.getTrailingGrid() != null
                        ? effective.getTrailingGrid()
                        : trailingGridProperties.toConfig(),
                effective.getInitialBalance() != null
                        ? effective.getInitialBalance()
                        : riskGatekeeperConfig.getInitialBalance(),
                clock);
    }

    private Set<String> openSymbolsExcept(String sessionId) {
        return sessions.entrySet().stream()
                .filter(entry -> !entry.getKey().equals(sessionId))
                .map(entry -> entry.getValue().getPosition())
                .filter(PositionBook::isOpen)
                .map(PositionBook::getSymbol)
                .collect(Collectors.toSet());
    }
}
