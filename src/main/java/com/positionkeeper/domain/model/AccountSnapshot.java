package com.positionkeeper.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/**
 * Account figures fetched from the venue once per cycle.
 */
@Getter
@Builder
public class AccountSnapshot {

    private final BigDecimal balance;
    private final BigDecimal equity;

    /** Realized P&L since the start of the trading day. Null if the venue does not report it. */
    private final BigDecimal dailyRealizedPnl;

    private final Instant capturedAt;
}
