package com.positionkeeper.oms;

import com.positionkeeper.domain.model.PendingMutation;
import com.positionkeeper.domain.model.TradeIntent;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

/**
 * Derives idempotency tokens for venue mutations.
 *
 * <p>A token is a SHA-256 over {@code nonce|positionId|kind|sequence|payload}. The nonce is
 * drawn once per generator instance, so a restarted process never reproduces a token the
 * venue or the Redis ledger still remembers, even though per-position sequences start again
 * at 1. The token is generated once at proposal time and reused on every retry.
 *
 * <p>Opens have no position id yet. Their token hashes the intent together with the nonce, the
 * proposal instant and a process-local counter, and doubles as the client tag the venue stores
 * on the new position.
 */
@Component
public class IdempotencyTokenGenerator {

    static final int TOKEN_LENGTH = 16;

    private final String nonce;
    private final AtomicLong openSequence = new AtomicLong();

    public IdempotencyTokenGenerator() {
        this(UUID.randomUUID().toString());
    }

    IdempotencyTokenGenerator(String nonce) {
        this.nonce = nonce;
    }

    public String generate(PendingMutation mutation) {
        String raw = String.join(
                "|",
                nonce,
                mutation.getPositionId(),
                mutation.getKind().name(),
                String.valueOf(mutation.getSequence()),
                plain(mutation.getStopLevel()),
                plain(mutation.getTargetLevel()),
                plain(mutation.getCloseSize()),
                plain(mutation.getCloseFractionOfOriginal()),
                mutation.getTierIndex() != null ? String.valueOf(mutation.getTierIndex()) : "-");
        return sha256(raw);
    }

    public String generateForOpen(TradeIntent intent, Instant proposedAt) {
        String raw = String.join(
                "|",
                nonce,
                "OPEN",
                intent.getSymbol(),
                intent.getSide().name(),
                plain(intent.getSize()),
                plain(intent.getStopLevel()),
                plain(intent.getTargetLevel()),
                intent.getStrategyTag() != null ? intent.getStrategyTag() : "manual",
                String.valueOf(proposedAt.toEpochMilli()),
                String.valueOf(proposedAt.getNano()),
                String.valueOf(openSequence.incrementAndGet()));
        return sha256(raw);
    }

    private static String plain(BigDecimal value) {
        return value != null ? value.stripTrailingZeros().toPlainString() : "-";
    }

    /** First 16 hex characters of the SHA-256 digest. */
    private static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, TOKEN_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
