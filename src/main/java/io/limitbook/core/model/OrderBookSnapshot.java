package io.limitbook.core.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Aggregated view of the book. Asks ascending, bids descending.
 */
@Data
@Builder
public class OrderBookSnapshot {
    private final String tag;
    private final String bookId;
    private final List<PriceLevel> asks;
    private final List<PriceLevel> bids;
    private final Instant timestamp;
}
