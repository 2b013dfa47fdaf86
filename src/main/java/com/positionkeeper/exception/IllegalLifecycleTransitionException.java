package com.positionkeeper.exception;

import com.positionkeeper.domain.enums.LifecycleState;
import java.util.Map;
import lombok.Getter;

@Getter
public class IllegalLifecycleTransitionException extends BaseException {

    private final String positionId;
    private final LifecycleState from;
    private final LifecycleState to;

    public IllegalLifecycleTransitionException(String positionId, LifecycleState from, LifecycleState to) {
        super(
                ErrorCode.ILLEGAL_TRANSITION,
                String.format("Position %s cannot transition %s -> %s", positionId, from, to),
                Map.of("positionId", positionId, "from", String.valueOf(from), "to", String.valueOf(to)));
        this.positionId = positionId;
        this.from = from;
        this.to = to;
    }
}
