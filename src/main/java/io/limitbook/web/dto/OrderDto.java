package io.limitbook.web.dto;

import io.limitbook.core.model.Side;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
public class OrderDto {
    private String id;
    private Side side;
    private BigDecimal price;
    private BigDecimal amount;
}
