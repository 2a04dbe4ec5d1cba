package io.limitbook.core.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class OrderBookSideTest {

    private Order order(String id, Side side, String price, String amount) {
        return Order.create(id, new BigDecimal(price), new BigDecimal(amount), side);
    }

    private List<String> ids(OrderBookSide side) {
        return side.orders().stream().map(Order::getId).collect(Collectors.toList());
    }

    @Test
    void testAsksSortedAscending() {
        OrderBookSide asks = new OrderBookSide(Side.SELL);
        asks.insert(order("a102", Side.SELL, "102", "1"));
        asks.insert(order("a100", Side.SELL, "100", "1"));
        asks.insert(order("a101", Side.SELL, "101", "1"));

        assertEquals(List.of("a100", "a101", "a102"), ids(asks));
    }

    @Test
    void testBidsSortedDescending() {
        OrderBookSide bids = new OrderBookSide(Side.BUY);
        bids.insert(order("b100", Side.BUY, "100", "1"));
        bids.insert(order("b102", Side.BUY, "102", "1"));
        bids.insert(order("b101", Side.BUY, "101", "1"));

        assertEquals(List.of("b102", "b101", "b100"), ids(bids));
    }

    @Test
    void testEqualPriceKeepsArrivalOrder() {
        OrderBookSide bids = new OrderBookSide(Side.BUY);
        bids.insert(order("first", Side.BUY, "100", "1"));
        bids.insert(order("better", Side.BUY, "101", "1"));
        bids.insert(order("second", Side.BUY, "100.00", "1"));
        bids.insert(order("worse", Side.BUY, "99", "1"));
        bids.insert(order("third", Side.BUY, "100", "1"));

        assertEquals(List.of("better", "first", "second", "third", "worse"), ids(bids));
    }

    @Test
    void testInsertRejectsOrderFromOtherSide() {
        OrderBookSide asks = new OrderBookSide(Side.SELL);
        assertThrows(IllegalArgumentException.class, () -> asks.insert(order("b1", Side.BUY, "100", "1")));
        assertTrue(asks.isEmpty());
    }

    @Test
    void testRemoveKeepsOrderOfOthers() {
        OrderBookSide asks = new OrderBookSide(Side.SELL);
        asks.insert(order("a1", Side.SELL, "100", "1"));
        asks.insert(order("a2", Side.SELL, "100", "2"));
        asks.insert(order("a3", Side.SELL, "101", "3"));

        assertTrue(asks.remove("a2").isPresent());
        assertFalse(asks.remove("a2").isPresent());
        assertEquals(List.of("a1", "a3"), ids(asks));
    }

    @Test
    void testRepositionSamePriceKeepsPosition() {
        OrderBookSide bids = new OrderBookSide(Side.BUY);
        bids.insert(order("b1", Side.BUY, "100", "1"));
        bids.insert(order("b2", Side.BUY, "100", "1"));

        assertTrue(bids.reposition("b1", new BigDecimal("100.0"), new BigDecimal("5")));

        assertEquals(List.of("b1", "b2"), ids(bids));
        assertEquals(0, new BigDecimal("5").compareTo(bids.peekFirst().getAmount()));
    }

    @Test
    void testRepositionNewPriceGoesToBackOfLevel() {
        OrderBookSide bids = new OrderBookSide(Side.BUY);
        bids.insert(order("bid1", Side.BUY, "100", "1"));
        bids.insert(order("bid2", Side.BUY, "101", "1"));

        assertTrue(bids.reposition("bid1", new BigDecimal("101"), new BigDecimal("1")));

        assertEquals(List.of("bid2", "bid1"), ids(bids));
    }

    @Test
    void testRepositionUnknownId() {
        OrderBookSide asks = new OrderBookSide(Side.SELL);
        asks.insert(order("a1", Side.SELL, "100", "1"));

        assertFalse(asks.reposition("missing", new BigDecimal("101"), new BigDecimal("1")));
        assertEquals(List.of("a1"), ids(asks));
    }

    @Test
    void testLevelsAggregateByPrice() {
        OrderBookSide asks = new OrderBookSide(Side.SELL);
        asks.insert(order("a1", Side.SELL, "100", "1.0"));
        asks.insert(order("a2", Side.SELL, "101", "4"));
        asks.insert(order("a3", Side.SELL, "100", "2.0"));

        List<PriceLevel> levels = asks.levels();

        assertEquals(2, levels.size());
        assertEquals(0, new BigDecimal("100").compareTo(levels.get(0).getPrice()));
        assertEquals(0, new BigDecimal("3.0").compareTo(levels.get(0).getTotalAmount()));
        assertEquals(2, levels.get(0).getOrderCount());
        assertEquals(0, new BigDecimal("101").compareTo(levels.get(1).getPrice()));
        assertEquals(1, levels.get(1).getOrderCount());
    }

    @Test
    void testOrdersReturnsCopies() {
        OrderBookSide asks = new OrderBookSide(Side.SELL);
        asks.insert(order("a1", Side.SELL, "100", "1"));

        asks.orders().get(0).fill(new BigDecimal("1"));

        assertEquals(0, BigDecimal.ONE.compareTo(asks.peekFirst().getAmount()));
    }
}
