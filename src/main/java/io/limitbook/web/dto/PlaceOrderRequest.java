package io.limitbook.web.dto;

import io.limitbook.core.model.Side;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlaceOrderRequest {
    private String id; // Optional, generated if missing
    private Side side;
    private BigDecimal price;
    private BigDecimal amount;
}
