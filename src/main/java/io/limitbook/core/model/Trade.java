package io.limitbook.core.model;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
public class Trade {
    private final String buyOrderId;
    private final String sellOrderId;
    private final BigDecimal price; // resting order's price
    private final BigDecimal amount;
}
