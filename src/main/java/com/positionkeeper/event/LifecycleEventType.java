package com.positionkeeper.event;

/**
 * Classifies a {@link LifecycleEvent}.
 */
public enum LifecycleEventType {

    /** A mutation was handed to the venue; the position entered a transitional state. */
    DISPATCHED,

    /** A dispatch failed and will be retried; the position is back in its stable state meanwhile. */
    RETRY_SCHEDULED,

    /** A new position was confirmed open by the venue. */
    OPENED,

    /** Protective levels or size changed, by a confirmed modification or by venue drift. */
    MODIFIED,

    /** A partial close was confirmed and residual size remains. */
    PARTIAL_CLOSED,

    /** The position reached CLOSED, by confirmed close or inferred from the venue snapshot. */
    CLOSED,

    /** An externally opened position was taken under management. */
    ADOPTED,

    /** A mutation failed terminally; the position stays in or returns to its stable state. */
    MUTATION_FAILED,

    /** An open failed terminally or a modification failed verification repeatedly. */
    FAILED
}
