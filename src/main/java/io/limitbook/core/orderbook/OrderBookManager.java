package io.limitbook.core.orderbook;

import io.limitbook.config.OrderBookProperties;
import io.limitbook.core.exception.OrderBookError;
import io.limitbook.core.exception.OrderBookException;
import io.limitbook.core.model.Order;
import io.limitbook.core.model.OrderBook;
import io.limitbook.core.model.OrderBookSide;
import io.limitbook.core.model.OrderBookSnapshot;
import io.limitbook.core.model.Side;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owns one order book. A single read-write lock guards bids and asks together:
 * mutations take the write lock, queries the read lock.
 */
@Slf4j
@Service
public class OrderBookManager {
    private final OrderBook orderBook;
    private final Map<String, Order> orderIndex = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final OrderBookProperties properties;
    private final OrderIdGenerator idGenerator;
    private final Clock clock;

    public OrderBookManager(OrderBookProperties properties, OrderIdGenerator idGenerator, Clock clock) {
        this.orderBook = new OrderBook(properties.getTag());
        this.properties = properties;
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        if (properties.getSeed().isEmpty()) {
            log.info("OrderBook {} started empty, id={}", orderBook.getTag(), orderBook.getId());
            return;
        }
        for (OrderBookProperties.SeedOrder seed : properties.getSeed()) {
            String id = seed.getId() == null || seed.getId().isBlank() ? idGenerator.nextId() : seed.getId();
            placeOrder(Order.create(id, seed.getPrice(), seed.getAmount(), seed.getSide()));
        }
        log.info("OrderBook {} seeded with {} orders, id={}",
                orderBook.getTag(), properties.getSeed().size(), orderBook.getId());
    }

    /**
     * Rests a copy of the order without matching. The caller's instance stays detached
     * from the book.
     *
     * @throws OrderBookException INVALID_ORDER for non-positive values or an id already in the book
     */
    public void placeOrder(Order order) {
        order.validate();
        lock.writeLock().lock();
        try {
            if (orderIndex.containsKey(order.getId())) {
                throw OrderBookException.invalidOrder("Order " + order.getId() + " already exists in order book");
            }
            Order stored = order.copy();
            orderBook.side(stored.getSide()).insert(stored);
            orderIndex.put(stored.getId(), stored);
            log.debug("Placed order {} {} {} @ {}", order.getId(), order.getSide(), order.getAmount(), order.getPrice());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void cancelOrder(String orderId) {
        lock.writeLock().lock();
        try {
            Order order = orderIndex.remove(orderId);
            if (order == null || orderBook.side(order.getSide()).remove(orderId).isEmpty()) {
                throw OrderBookException.orderNotFound(orderId);
            }
            log.debug("Cancelled order {}", orderId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Changes price and amount of a resting order. A price change sends the order
     * to the back of its new price level.
     *
     * @return copy of the order after modification
     */
    public Order modifyOrder(String orderId, BigDecimal newPrice, BigDecimal newAmount) {
        if (!Order.isPositive(newPrice) || !Order.isPositive(newAmount)) {
            throw new OrderBookException(OrderBookError.INVALID_MODIFICATION);
        }
        lock.writeLock().lock();
        try {
            Order order = orderIndex.get(orderId);
            if (order == null || !orderBook.side(order.getSide()).reposition(orderId, newPrice, newAmount)) {
                throw OrderBookException.orderNotFound(orderId);
            }
            log.debug("Modified order {} -> {} @ {}", orderId, newAmount, newPrice);
            return order.copy();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Order getBestBid() {
        return best(orderBook.getBids());
    }

    public Order getBestAsk() {
        return best(orderBook.getAsks());
    }

    private Order best(OrderBookSide side) {
        lock.readLock().lock();
        try {
            Order head = side.peekFirst();
            if (head == null) {
                throw new OrderBookException(OrderBookError.NO_ORDERS);
            }
            return head.copy();
        } finally {
            lock.readLock().unlock();
        }
    }

    public OrderBookSnapshot getSnapshot() {
        lock.readLock().lock();
        try {
            return OrderBookSnapshot.builder()
                    .tag(orderBook.getTag())
                    .bookId(orderBook.getId())
                    .asks(orderBook.getAsks().levels())
                    .bids(orderBook.getBids().levels())
                    .timestamp(Instant.now(clock))
                    .build();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Order> getOrder(String orderId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(orderIndex.get(orderId)).map(Order::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            orderBook.getBids().clear();
            orderBook.getAsks().clear();
            orderIndex.clear();
            log.info("OrderBook {} cleared", orderBook.getTag());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean containsOrder(String orderId) {
        lock.readLock().lock();
        try {
            return orderIndex.containsKey(orderId);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Drops a fully filled order from the id index. The matcher has already taken
     * it off its side.
     */
    public void removeOrderIndex(String orderId) {
        lock.writeLock().lock();
        try {
            orderIndex.remove(orderId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Live side storage. Callers must hold the write lock.
     */
    public OrderBookSide getSide(Side side) {
        return orderBook.side(side);
    }

    public String getTag() {
        return orderBook.getTag();
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
