package com.positionkeeper.domain.model;

import lombok.Builder;
import lombok.Getter;

/**
 * Venue acknowledgement of a modify or close. An ack is a claim, not proof: the
 * dispatcher always verifies it against a fresh snapshot.
 */
@Getter
@Builder
public class Ack {

    private final String positionId;
    private final String idempotencyToken;
    private final String message;

    public static Ack of(String positionId, String idempotencyToken) {
        return Ack.builder()
                .positionId(positionId)
                .idempotencyToken(idempotencyToken)
                .build();
    }
}
