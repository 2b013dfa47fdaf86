package com.positionkeeper.domain.enums;

/**
 * ACTIVE adopts and applies protective levels; LOG_ONLY records the position for
 * tracking without sending anything to the venue.
 */
public enum AdoptionMode {
    ACTIVE,
    LOG_ONLY
}
