package com.positionkeeper.risk;

import com.positionkeeper.domain.enums.RiskMode;
import com.positionkeeper.domain.model.AccountSnapshot;
import com.positionkeeper.event.LifecycleEvent;
import com.positionkeeper.event.LifecycleEventType;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Account-level figures the risk components decide on: balance, peak and current equity,
 * drawdown, daily realized P&amp;L and the current losing streak.
 *
 * <p>Updated by the cycle thread from one {@link AccountSnapshot} per cycle and from
 * CLOSED lifecycle events; read by the REST status endpoint from other threads, hence
 * the atomics.
 *
 * <p>Daily realized P&amp;L is taken from the venue when the venue reports it, otherwise
 * accumulated from closed positions. It resets at UTC midnight.
 */
@Component
public class AccountRiskState {

    private static final Logger log = LoggerFactory.getLogger(AccountRiskState.class);

    private final RiskLimits riskLimits;
    private final Clock clock;

    private final AtomicReference<BigDecimal> balance = new AtomicReference<>(BigDecimal.ZERO);
    private final AtomicReference<BigDecimal> equity = new AtomicReference<>(BigDecimal.ZERO);
    private final AtomicReference<BigDecimal> peakEquity = new AtomicReference<>(BigDecimal.ZERO);
    private final AtomicReference<BigDecimal> dailyRealizedPnl = new AtomicReference<>(BigDecimal.ZERO);
    private final AtomicInteger losingStreak = new AtomicInteger();
    private final AtomicReference<RiskMode> currentMode = new AtomicReference<>(RiskMode.BALANCED);

    private volatile LocalDate currentDate;
    private volatile boolean venueReportsDailyPnl;

    public AccountRiskState(RiskLimits riskLimits, Clock clock) {
        this.riskLimits = riskLimits;
        this.clock = clock;
        this.currentDate = LocalDate.now(clock.withZone(ZoneOffset.UTC));
    }

    // ========================
    // UPDATES
    // ========================

    public void observe(AccountSnapshot snapshot) {
        resetDailyCountersIfNeeded();
        if (snapshot.getBalance() != null) {
            balance.set(snapshot.getBalance());
        }
        BigDecimal observedEquity = snapshot.getEquity() != null ? snapshot.getEquity() : snapshot.getBalance();
        if (observedEquity != null) {
            equity.set(observedEquity);
            peakEquity.accumulateAndGet(observedEquity, BigDecimal::max);
        }
        if (snapshot.getDailyRealizedPnl() != null) {
            venueReportsDailyPnl = true;
            dailyRealizedPnl.set(snapshot.getDailyRealizedPnl());
        }
    }

    /**
     * Records the result of a closed trade: a loss extends the losing streak, anything
     * else resets it.
     */
    public void recordTradeResult(BigDecimal pnl) {
        if (pnl == null) {
            return;
        }
        resetDailyCountersIfNeeded();
        if (pnl.signum() < 0) {
            int streak = losingStreak.incrementAndGet();
            log.debug("Losing trade recorded: pnl={}, streak={}", pnl, streak);
        } else {
            losingStreak.set(0);
        }
        if (!venueReportsDailyPnl) {
            dailyRealizedPnl.updateAndGet(current -> current.add(pnl));
        }
    }

    @EventListener
    public void onLifecycleEvent(LifecycleEvent event) {
        if (event.getEventType() == LifecycleEventType.CLOSED) {
            recordTradeResult(event.getPosition().getUnrealizedProfit());
        }
    }

    /** Stores the selected mode and returns the previous one. */
    public RiskMode updateMode(RiskMode mode) {
        return currentMode.getAndSet(mode);
    }

    // ========================
    // QUERIES
    // ========================

    /** Fractional decline of equity from its peak; zero before any observation. */
    public BigDecimal drawdown() {
        BigDecimal peak = peakEquity.get();
        if (peak.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return peak.subtract(equity.get()).max(BigDecimal.ZERO).divide(peak, MathContext.DECIMAL64);
    }

    public boolean isDailyLimitBreached() {
        if (riskLimits.getDailyLossLimit() == null) {
            return false;
        }
        return dailyRealizedPnl.get().compareTo(riskLimits.getDailyLossLimit().negate()) <= 0;
    }

    public BigDecimal getBalance() {
        return balance.get();
    }

    public BigDecimal getEquity() {
        return equity.get();
    }

    public BigDecimal getPeakEquity() {
        return peakEquity.get();
    }

    public BigDecimal getDailyRealizedPnl() {
        return dailyRealizedPnl.get();
    }

    public int getLosingStreak() {
        return losingStreak.get();
    }

    public RiskMode getCurrentMode() {
        return currentMode.get();
    }

    // ========================
    // INTERNALS
    // ========================

    void resetDailyCountersIfNeeded() {
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        if (!today.equals(currentDate)) {
            dailyRealizedPnl.set(BigDecimal.ZERO);
            currentDate = today;
            log.info("Daily risk counters reset for {}", today);
        }
    }
}
