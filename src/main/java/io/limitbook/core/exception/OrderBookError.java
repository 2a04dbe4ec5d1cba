package io.limitbook.core.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Failure kinds reported by book operations.
 */
@Getter
@RequiredArgsConstructor
public enum OrderBookError {
    INVALID_ORDER("Invalid order's values"),
    INVALID_MODIFICATION("Invalid modification parameters"),
    ORDER_NOT_FOUND("Order not found"),
    NO_ORDERS("No orders available");

    private final String defaultMessage;
}
