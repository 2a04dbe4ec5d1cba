package io.limitbook.web.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Data
@Builder
public class OrderBookDto {
    private String tag;
    private String bookId;
    private List<PriceLevelDto> asks;
    private List<PriceLevelDto> bids;
    private Instant timestamp;

    @Data
    @Builder
    public static class PriceLevelDto {
        private BigDecimal price;
        private BigDecimal totalAmount;
        private int orderCount;
    }
}
