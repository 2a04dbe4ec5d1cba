package io.limitbook.web.dto;

import io.limitbook.core.exception.OrderBookError;

public record ErrorResponse(OrderBookError error, String message) {
}
