package io.harvestcore.model;

public enum CompletionState {
    /** Every item is terminal. */
    COMPLETE,
    /** Near completion but the remainder has not moved for too long; run recovery. */
    STUCK,
    /** A claim would likely succeed now. */
    HAS_WORK,
    /** Items remain but none is claimable yet; sleep one poll interval. */
    EMPTY_RETRYABLE
}
