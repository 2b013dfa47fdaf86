package com.positionkeeper.simulator;

import com.positionkeeper.domain.enums.GatewayErrorType;
import com.positionkeeper.domain.enums.PositionSide;
import com.positionkeeper.domain.model.AccountSnapshot;
import com.positionkeeper.domain.model.Ack;
import com.positionkeeper.domain.model.Fill;
import com.positionkeeper.domain.model.SymbolConstraints;
import com.positionkeeper.domain.model.VenuePosition;
import com.positionkeeper.exception.VenueGatewayException;
import com.positionkeeper.venue.VenueGateway;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * In-memory venue for paper trading and integration tests.
 *
 * <p>Results are memoized per idempotency token: a replayed token returns the first call's
 * fill, ack or rejection without applying anything again. Prices are pushed in with
 * {@link #setPrice}; unrealized profit is {@code favorableMove × size × contractSize}.
 *
 * <p>Faults can be injected per operation to reproduce timeouts, rejections and silently
 * dropped requests:
 * <ul>
 *   <li>{@link FaultMode#FAIL_BEFORE_APPLY}: throws, nothing changes</li>
 *   <li>{@link FaultMode#FAIL_AFTER_APPLY}: applies, memoizes, then throws (unknown effect)</li>
 *   <li>{@link FaultMode#SILENT_DROP}: acknowledges without applying</li>
 * </ul>
 *
 * <p>Active when {@code positionkeeper.venue.mode=PAPER}, the default.
 */
@Service
@ConditionalOnProperty(name = "positionkeeper.venue.mode", havingValue = "PAPER", matchIfMissing = true)
public class PaperVenueGateway implements VenueGateway {

    private static final Logger log = LoggerFactory.getLogger(PaperVenueGateway.class);

    public enum Operation {
        OPEN,
        MODIFY,
        CLOSE,
        SNAPSHOT,
        ACCOUNT
    }

    public enum FaultMode {
        FAIL_BEFORE_APPLY,
        FAIL_AFTER_APPLY,
        SILENT_DROP
    }

    private record Fault(GatewayErrorType errorType, FaultMode mode) {}

    private final Clock clock;
    private final AtomicLong positionIds = new AtomicLong(1000);

    private final Map<String, VenuePosition> positions = new LinkedHashMap<>();
    private final Map<String, BigDecimal> prices = new HashMap<>();
    private final Map<String, SymbolConstraints> constraints = new HashMap<>();
    private final Map<String, Object> outcomesByToken = new HashMap<>();
    private final Map<Operation, Deque<Fault>> faults = new EnumMap<>(Operation.class);
    private final Map<Operation, Integer> callCounts = new EnumMap<>(Operation.class);

    private BigDecimal balance;
    private BigDecimal dailyRealizedPnl = BigDecimal.ZERO;

    @Autowired
    public PaperVenueGateway(
            Clock clock, @Value("${positionkeeper.venue.paper.initial-balance:10000}") BigDecimal initialBalance) {
        this.clock = clock;
        this.balance = initialBalance;
    }

    // ---- Mutations ----

    @Override
    public synchronized Fill open(
            String symbol, PositionSide side, BigDecimal size, BigDecimal stop, BigDecimal target, String token) {
        count(Operation.OPEN);
        Object memo = outcomesByToken.get(token);
        if (memo != null) {
            return (Fill) replay(memo, token);
        }
        Fault fault = nextFault(Operation.OPEN);
        if (fault != null && fault.mode() == FaultMode.FAIL_BEFORE_APPLY) {
            throw new VenueGatewayException(fault.errorType(), "Injected " + fault.errorType() + " on open");
        }
        if (fault != null && fault.mode() == FaultMode.SILENT_DROP) {
            // An open cannot be acknowledged without a position id; surface it as a timeout.
            throw VenueGatewayException.timeout("Injected dropped open");
        }

        Fill fill;
        try {
            fill = applyOpen(symbol, side, size, stop, target, token);
        } catch (VenueGatewayException e) {
            outcomesByToken.put(token, e);
            throw e;
        }
        outcomesByToken.put(token, fill);
        if (fault != null) {
            throw new VenueGatewayException(fault.errorType(), "Injected " + fault.errorType() + " after open");
        }
        return fill;
    }

    @Override
    public synchronized Ack modify(String positionId, BigDecimal stop, BigDecimal target, String token) {
        count(Operation.MODIFY);
        Object memo = outcomesByToken.get(token);
        if (memo != null) {
            return (Ack) replay(memo, token);
        }
        Fault fault = nextFault(Operation.MODIFY);
        if (fault != null && fault.mode() == FaultMode.FAIL_BEFORE_APPLY) {
            throw new VenueGatewayException(fault.errorType(), "Injected " + fault.errorType() + " on modify");
        }
        if (fault != null && fault.mode() == FaultMode.SILENT_DROP) {
            log.debug("Paper venue dropping modify for {} (token {})", positionId, token);
            return Ack.of(positionId, token);
        }

        Ack ack;
        try {
            ack = applyModify(positionId, stop, target, token);
        } catch (VenueGatewayException e) {
            outcomesByToken.put(token, e);
            throw e;
        }
        outcomesByToken.put(token, ack);
        if (fault != null) {
            throw new VenueGatewayException(fault.errorType(), "Injected " + fault.errorType() + " after modify");
        }
        return ack;
    }

    @Override
    public synchronized Ack close(String positionId, BigDecimal fraction, String token) {
        count(Operation.CLOSE);
        Object memo = outcomesByToken.get(token);
        if (memo != null) {
            return (Ack) replay(memo, token);
        }
        Fault fault = nextFault(Operation.CLOSE);
        if (fault != null && fault.mode() == FaultMode.FAIL_BEFORE_APPLY) {
            throw new VenueGatewayException(fault.errorType(), "Injected " + fault.errorType() + " on close");
        }
        if (fault != null && fault.mode() == FaultMode.SILENT_DROP) {
            log.debug("Paper venue dropping close for {} (token {})", positionId, token);
            return Ack.of(positionId, token);
        }

        Ack ack;
        try {
            ack = applyClose(positionId, fraction, token);
        } catch (VenueGatewayException e) {
            outcomesByToken.put(token, e);
            throw e;
        }
        outcomesByToken.put(token, ack);
        if (fault != null) {
            throw new VenueGatewayException(fault.errorType(), "Injected " + fault.errorType() + " after close");
        }
        return ack;
    }

    // ---- Reads ----

    @Override
    public synchronized List<VenuePosition> snapshot() {
        count(Operation.SNAPSHOT);
        Fault fault = nextFault(Operation.SNAPSHOT);
        if (fault != null) {
            throw new VenueGatewayException(fault.errorType(), "Injected " + fault.errorType() + " on snapshot");
        }
        List<VenuePosition> result = new ArrayList<>(positions.size());
        for (VenuePosition position : positions.values()) {
            result.add(position.toBuilder().build());
        }
        return result;
    }

    @Override
    public synchronized AccountSnapshot account() {
        count(Operation.ACCOUNT);
        Fault fault = nextFault(Operation.ACCOUNT);
        if (fault != null) {
            throw new VenueGatewayException(fault.errorType(), "Injected " + fault.errorType() + " on account");
        }
        BigDecimal unrealized = positions.values().stream()
                .map(VenuePosition::getUnrealizedProfit)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return AccountSnapshot.builder()
                .balance(balance)
                .equity(balance.add(unrealized))
                .dailyRealizedPnl(dailyRealizedPnl)
                .capturedAt(clock.instant())
                .build();
    }

    @Override
    public synchronized SymbolConstraints constraints(String symbol) {
        return constraints.getOrDefault(symbol, SymbolConstraints.unconstrained(symbol));
    }

    // ---- Simulation controls ----

    public synchronized void setPrice(String symbol, BigDecimal price) {
        prices.put(symbol, price);
        for (Map.Entry<String, VenuePosition> entry : positions.entrySet()) {
            VenuePosition position = entry.getValue();
            if (position.getSymbol().equals(symbol)) {
                entry.setValue(reprice(position, price));
            }
        }
    }

    public synchronized void setConstraints(SymbolConstraints symbolConstraints) {
        constraints.put(symbolConstraints.getSymbol(), symbolConstraints);
    }

    /** Places a position as if another system had opened it. */
    public synchronized VenuePosition addExternalPosition(VenuePosition position) {
        String positionId = position.getPositionId() != null
                ? position.getPositionId()
                : String.valueOf(positionIds.incrementAndGet());
        BigDecimal price = position.getCurrentPrice() != null
                ? position.getCurrentPrice()
                : prices.getOrDefault(position.getSymbol(), position.getEntryPrice());
        prices.putIfAbsent(position.getSymbol(), price);
        VenuePosition stored = reprice(
                position.toBuilder()
                        .positionId(positionId)
                        .openedAt(position.getOpenedAt() != null ? position.getOpenedAt() : clock.instant())
                        .build(),
                price);
        positions.put(positionId, stored);
        return stored.toBuilder().build();
    }

    /** Removes a position as if its stop or target had been hit at the venue. */
    public synchronized void removeExternally(String positionId) {
        VenuePosition removed = positions.remove(positionId);
        if (removed != null) {
            realize(removed, removed.getSize());
        }
    }

    public synchronized void injectFault(Operation operation, GatewayErrorType errorType, FaultMode mode, int times) {
        Deque<Fault> queue = faults.computeIfAbsent(operation, op -> new ArrayDeque<>());
        for (int i = 0; i < times; i++) {
            queue.addLast(new Fault(errorType, mode));
        }
    }

    public synchronized int callCount(Operation operation) {
        return callCounts.getOrDefault(operation, 0);
    }

    public synchronized VenuePosition position(String positionId) {
        VenuePosition position = positions.get(positionId);
        return position != null ? position.toBuilder().build() : null;
    }

    public synchronized void setBalance(BigDecimal balance) {
        this.balance = balance;
    }

    // ---- Internals ----

    private Fill applyOpen(
            String symbol, PositionSide side, BigDecimal size, BigDecimal stop, BigDecimal target, String token) {
        BigDecimal price = prices.get(symbol);
        if (price == null) {
            throw VenueGatewayException.rejected("No price for symbol " + symbol);
        }
        SymbolConstraints symbolConstraints = constraints(symbol);
        if (size == null || size.signum() <= 0 || size.compareTo(symbolConstraints.getMinSize()) < 0) {
            throw VenueGatewayException.rejected("Invalid volume " + size + " for " + symbol);
        }
        validateLevels(symbol, side, price, stop, target);

        String positionId = String.valueOf(positionIds.incrementAndGet());
        VenuePosition position = VenuePosition.builder()
                .positionId(positionId)
                .symbol(symbol)
                .side(side)
                .size(size)
                .entryPrice(price)
                .currentPrice(price)
                .stopLevel(stop)
                .targetLevel(target)
                .unrealizedProfit(BigDecimal.ZERO)
                .openedAt(clock.instant())
                .clientTag(token)
                .build();
        positions.put(positionId, position);
        log.info("Paper venue opened {}: {} {} {} @ {}", positionId, side, size, symbol, price);

        return Fill.builder()
                .positionId(positionId)
                .clientTag(token)
                .symbol(symbol)
                .side(side)
                .size(size)
                .price(price)
                .stopLevel(stop)
                .targetLevel(target)
                .filledAt(clock.instant())
                .build();
    }

    private Ack applyModify(String positionId, BigDecimal stop, BigDecimal target, String token) {
        VenuePosition position = positions.get(positionId);
        if (position == null) {
            throw VenueGatewayException.rejected("Unknown position " + positionId);
        }
        validateLevels(position.getSymbol(), position.getSide(), position.getCurrentPrice(), stop, target);
        positions.put(
                positionId,
                position.toBuilder().stopLevel(stop).targetLevel(target).build());
        log.info("Paper venue modified {}: stop={}, target={}", positionId, stop, target);
        return Ack.of(positionId, token);
    }

    private Ack applyClose(String positionId, BigDecimal fraction, String token) {
        VenuePosition position = positions.get(positionId);
        if (position == null) {
            throw VenueGatewayException.rejected("Unknown position " + positionId);
        }
        if (fraction == null || fraction.signum() <= 0) {
            throw VenueGatewayException.rejected("Invalid close fraction " + fraction);
        }
        SymbolConstraints symbolConstraints = constraints(position.getSymbol());
        BigDecimal closeVolume = fraction.compareTo(BigDecimal.ONE) >= 0
                ? position.getSize()
                : roundToStep(position.getSize().multiply(fraction), symbolConstraints.getSizeStep());
        BigDecimal residual = position.getSize().subtract(closeVolume);

        if (residual.signum() <= 0) {
            positions.remove(positionId);
            realize(position, position.getSize());
            log.info("Paper venue closed {} fully", positionId);
        } else {
            realize(position, closeVolume);
            positions.put(
                    positionId,
                    reprice(position.toBuilder().size(residual).build(), position.getCurrentPrice()));
            log.info("Paper venue closed {} of {}, residual {}", closeVolume, positionId, residual);
        }
        return Ack.of(positionId, token);
    }

    private void validateLevels(
            String symbol, PositionSide side, BigDecimal price, BigDecimal stop, BigDecimal target) {
        BigDecimal minDistance = constraints(symbol).getMinStopDistance();
        int sign = side.sign();
        if (stop != null) {
            BigDecimal distance = price.subtract(stop).multiply(BigDecimal.valueOf(sign));
            if (distance.compareTo(minDistance) < 0 || distance.signum() <= 0) {
                throw VenueGatewayException.rejected("Invalid stop " + stop + " at price " + price);
            }
        }
        if (target != null) {
            BigDecimal distance = target.subtract(price).multiply(BigDecimal.valueOf(sign));
            if (distance.compareTo(minDistance) < 0 || distance.signum() <= 0) {
                throw VenueGatewayException.rejected("Invalid target " + target + " at price " + price);
            }
        }
    }

    private VenuePosition reprice(VenuePosition position, BigDecimal price) {
        BigDecimal contractSize = constraints(position.getSymbol()).getContractSize();
        BigDecimal move = price.subtract(position.getEntryPrice()).multiply(BigDecimal.valueOf(position.getSide().sign()));
        return position.toBuilder()
                .currentPrice(price)
                .unrealizedProfit(move.multiply(position.getSize()).multiply(contractSize))
                .build();
    }

    private void realize(VenuePosition position, BigDecimal volume) {
        BigDecimal contractSize = constraints(position.getSymbol()).getContractSize();
        BigDecimal move = position.getCurrentPrice()
                .subtract(position.getEntryPrice())
                .multiply(BigDecimal.valueOf(position.getSide().sign()));
        BigDecimal realized = move.multiply(volume).multiply(contractSize);
        balance = balance.add(realized);
        dailyRealizedPnl = dailyRealizedPnl.add(realized);
    }

    private static BigDecimal roundToStep(BigDecimal value, BigDecimal step) {
        if (step == null || step.signum() <= 0) {
            return value;
        }
        return value.divide(step, 0, RoundingMode.HALF_UP).multiply(step);
    }

    private Object replay(Object memo, String token) {
        log.debug("Paper venue replaying token {}", token);
        if (memo instanceof VenueGatewayException e) {
            throw e;
        }
        return memo;
    }

    private Fault nextFault(Operation operation) {
        Deque<Fault> queue = faults.get(operation);
        return queue != null ? queue.pollFirst() : null;
    }

    private void count(Operation operation) {
        callCounts.merge(operation, 1, Integer::sum);
    }
}
