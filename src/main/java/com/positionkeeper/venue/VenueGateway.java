package com.positionkeeper.venue;

import com.positionkeeper.domain.enums.PositionSide;
import com.positionkeeper.domain.model.AccountSnapshot;
import com.positionkeeper.domain.model.Ack;
import com.positionkeeper.domain.model.Fill;
import com.positionkeeper.domain.model.SymbolConstraints;
import com.positionkeeper.domain.model.VenuePosition;
import java.math.BigDecimal;
import java.util.List;

/**
 * The only path to the execution venue. Every component that mutates or reads venue
 * positions goes through this interface.
 *
 * <p>Any call may time out, be rejected, or return success without taking effect, so
 * callers treat acknowledgements as claims and verify them with {@link #snapshot()}.
 * Mutating calls carry an idempotency token: replaying a token must produce the same
 * observed effect as the first call with that token.
 *
 * <p>Every method throws {@link com.positionkeeper.exception.VenueGatewayException} with a
 * {@link com.positionkeeper.domain.enums.GatewayErrorType} on failure.
 */
public interface VenueGateway {

    // ---- Mutations ----

    /**
     * Opens a position.
     *
     * @param token idempotency token, also attached as the position's client tag
     * @return the fill carrying the venue-assigned position id
     */
    Fill open(String symbol, PositionSide side, BigDecimal size, BigDecimal stop, BigDecimal target, String token);

    /**
     * Replaces the protective levels. A null level clears it at the venue.
     */
    Ack modify(String positionId, BigDecimal stop, BigDecimal target, String token);

    /**
     * Closes {@code fraction} of the position's current size. A fraction of 1 closes it fully.
     */
    Ack close(String positionId, BigDecimal fraction, String token);

    // ---- Reads ----

    List<VenuePosition> snapshot();

    AccountSnapshot account();

    SymbolConstraints constraints(String symbol);
}
