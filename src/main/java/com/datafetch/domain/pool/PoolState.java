package com.datafetch.domain.pool;

/**
 * Lifecycle of an elastic pool. CLOSED is final.
 */
public enum PoolState {
    UNINITIALIZED,
    SCALING,
    ACTIVE,
    CLOSED
}
