package com.positionkeeper.oms;

import com.positionkeeper.config.RedisConfig;
import com.positionkeeper.domain.enums.TokenState;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

/**
 * Records what happened to each idempotency token, so a dispatch after a restart can see that
 * the venue already applied a mutation and go straight to verification.
 *
 * <p>Key schema: {@code pk:mutation:token:{token}} holding the {@link TokenState} name, with a
 * TTL. The ledger is advisory: venue read-back decides success, so a Redis outage is logged
 * and dispatching carries on without it.
 */
@Service
public class MutationTokenLedger {

    private static final Logger log = LoggerFactory.getLogger(MutationTokenLedger.class);

    private final RedisTemplate<String, Object> redisTemplate;
    private final Duration ttl;

    public MutationTokenLedger(
            RedisTemplate<String, Object> redisTemplate,
            @Value("${positionkeeper.ledger.token-ttl:PT24H}") Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.ttl = ttl != null ? ttl : RedisConfig.DEFAULT_TOKEN_TTL;
    }

    public void markDispatched(String token) {
        write(token, TokenState.DISPATCHED);
    }

    public void markApplied(String token) {
        write(token, TokenState.APPLIED);
    }

    public void markFailed(String token) {
        write(token, TokenState.FAILED);
    }

    public Optional<TokenState> state(String token) {
        try {
            Object value = redisTemplate.opsForValue().get(key(token));
            return value != null ? Optional.of(TokenState.valueOf(value.toString())) : Optional.empty();
        } catch (DataAccessException e) {
            log.warn("Token ledger read failed for {}: {}", token, e.getMessage());
            return Optional.empty();
        }
    }

    public boolean isApplied(String token) {
        return state(token).filter(state -> state == TokenState.APPLIED).isPresent();
    }

    private void write(String token, TokenState state) {
        try {
            redisTemplate.opsForValue().set(key(token), state.name(), ttl);
            log.debug("Token {} -> {}", token, state);
        } catch (DataAccessException e) {
            log.warn("Token ledger write failed for {} ({}): {}", token, state, e.getMessage());
        }
    }

    private static String key(String token) {
        return RedisConfig.KEY_PREFIX_MUTATION_TOKEN + token;
    }
}
