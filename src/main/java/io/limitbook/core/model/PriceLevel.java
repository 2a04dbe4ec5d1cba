package io.limitbook.core.model;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
public class PriceLevel {
    private final BigDecimal price;
    private final BigDecimal totalAmount;
    private final int orderCount;
}
