package io.limitbook.core.model;

import lombok.Getter;

import java.util.UUID;

/**
 * Both sides of the book for one instrument tag. Guarded as a unit by the owning manager.
 */
@Getter
public class OrderBook {
    private final String tag;
    private final String id = UUID.randomUUID().toString();
    private final OrderBookSide bids = new OrderBookSide(Side.BUY);
    private final OrderBookSide asks = new OrderBookSide(Side.SELL);

    public OrderBook(String tag) {
        this.tag = tag;
    }

    public OrderBookSide side(Side side) {
        return switch (side) {
            case BUY -> bids;
            case SELL -> asks;
        };
    }
}
