package io.limitbook.core.exception;

import lombok.Getter;

@Getter
public class OrderBookException extends RuntimeException {

    private final OrderBookError error;

    public OrderBookException(OrderBookError error) {
        this(error, error.getDefaultMessage());
    }

    public OrderBookException(OrderBookError error, String message) {
        super(message);
        this.error = error;
    }

    public static OrderBookException invalidOrder(String message) {
        return new OrderBookException(OrderBookError.INVALID_ORDER, message);
    }

    public static OrderBookException orderNotFound(String orderId) {
        return new OrderBookException(OrderBookError.ORDER_NOT_FOUND, "Order not found: " + orderId);
    }
}
