package com.fastalert.model.enums;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;

/**
 * 渠道熔断状态
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN;

    public static CircuitState from(CircuitBreaker.State state) {
        return switch (state) {
            case OPEN, FORCED_OPEN -> OPEN;
            case HALF_OPEN -> HALF_OPEN;
            default -> CLOSED;
        };
    }
}
