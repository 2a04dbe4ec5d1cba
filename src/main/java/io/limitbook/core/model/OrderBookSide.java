package io.limitbook.core.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * One side of the book kept as a single price-ordered sequence.
 * Bids: highest price first. Asks: lowest price first.
 * Orders at the same price keep arrival order.
 * Not thread-safe, callers hold the book lock.
 */
public class OrderBookSide {
    private final Side side;
    private final List<Order> orders = new ArrayList<>();

    public OrderBookSide(Side side) {
        this.side = Objects.requireNonNull(side, "side");
    }

    /**
     * Inserts before the first order with a strictly worse price, i.e. at the back
     * of the order's price level.
     */
    public void insert(Order order) {
        if (order.getSide() != side) {
            throw new IllegalArgumentException("Order " + order.getId() + " is " + order.getSide()
                    + " but this side holds " + side);
        }
        orders.add(insertionPoint(order.getPrice()), order);
    }

    public Optional<Order> remove(String orderId) {
        Iterator<Order> it = orders.iterator();
        while (it.hasNext()) {
            Order order = it.next();
            if (order.getId().equals(orderId)) {
                it.remove();
                return Optional.of(order);
            }
        }
        return Optional.empty();
    }

    /**
     * Same price: amount changes in place and the order keeps its queue position.
     * New price: the order moves to the back of the new price level.
     *
     * @return false if no order with this id rests on this side
     */
    public boolean reposition(String orderId, BigDecimal newPrice, BigDecimal newAmount) {
        int index = indexOf(orderId);
        if (index < 0) {
            return false;
        }
        Order order = orders.get(index);
        if (order.hasPrice(newPrice)) {
            order.amend(order.getPrice(), newAmount);
            return true;
        }
        orders.remove(index);
        order.amend(newPrice, newAmount);
        insert(order);
        return true;
    }

    public Order peekFirst() {
        return orders.isEmpty() ? null : orders.get(0);
    }

    public Order pollFirst() {
        return orders.isEmpty() ? null : orders.remove(0);
    }

    public boolean isEmpty() {
        return orders.isEmpty();
    }

    public int size() {
        return orders.size();
    }

    public void clear() {
        orders.clear();
    }

    /**
     * Detached copies in book order.
     */
    public List<Order> orders() {
        return orders.stream()
                .map(Order::copy)
                .collect(Collectors.toList());
    }

    /**
     * Aggregates resting orders into one level per distinct price, best price first.
     */
    public List<PriceLevel> levels() {
        Comparator<BigDecimal> byRank = side == Side.BUY ? Comparator.reverseOrder() : Comparator.naturalOrder();
        Map<BigDecimal, List<Order>> byPrice = new TreeMap<>(byRank);
        for (Order order : orders) {
            byPrice.computeIfAbsent(order.getPrice(), p -> new ArrayList<>()).add(order);
        }
        List<PriceLevel> levels = new ArrayList<>(byPrice.size());
        byPrice.forEach((price, atPrice) -> levels.add(PriceLevel.builder()
                .price(price)
                .totalAmount(atPrice.stream().map(Order::getAmount).reduce(BigDecimal.ZERO, BigDecimal::add))
                .orderCount(atPrice.size())
                .build()));
        return Collections.unmodifiableList(levels);
    }

    private int indexOf(String orderId) {
        for (int i = 0; i < orders.size(); i++) {
            if (orders.get(i).getId().equals(orderId)) {
                return i;
            }
        }
        return -1;
    }

    private int insertionPoint(BigDecimal price) {
        int low = 0;
        int high = orders.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (isWorse(orders.get(mid).getPrice(), price)) {
                high = mid;
            } else {
                low = mid + 1;
            }
        }
        return low;
    }

    private boolean isWorse(BigDecimal candidate, BigDecimal reference) {
        return switch (side) {
            case BUY -> candidate.compareTo(reference) < 0;
            case SELL -> candidate.compareTo(reference) > 0;
        };
    }
}
