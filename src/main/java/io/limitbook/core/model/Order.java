package io.limitbook.core.model;

import io.limitbook.core.exception.OrderBookException;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Resting limit order. Identity and side never change; price and amount are
 * only changed by the book that owns the order.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class Order {
    private final String id;
    private final Side side;
    private BigDecimal price;
    private BigDecimal amount;

    public static Order create(String id, BigDecimal price, BigDecimal amount, Side side) {
        Order order = Order.builder()
                .id(id)
                .side(side)
                .price(price)
                .amount(amount)
                .build();
        order.validate();
        return order;
    }

    public void validate() {
        if (id == null || id.isBlank()) {
            throw OrderBookException.invalidOrder("Order id is required");
        }
        if (side == null) {
            throw OrderBookException.invalidOrder("Order side is required");
        }
        if (!isPositive(price)) {
            throw OrderBookException.invalidOrder("Price must be greater than 0");
        }
        if (!isPositive(amount)) {
            throw OrderBookException.invalidOrder("Amount must be greater than 0");
        }
    }

    public void fill(BigDecimal executed) {
        if (!isPositive(executed) || executed.compareTo(amount) > 0) {
            throw new IllegalArgumentException("Fill amount " + executed + " outside (0, " + amount + "]");
        }
        amount = amount.subtract(executed);
    }

    public boolean isFilled() {
        return amount.signum() == 0;
    }

    public boolean hasPrice(BigDecimal other) {
        return price.compareTo(other) == 0;
    }

    void amend(BigDecimal newPrice, BigDecimal newAmount) {
        this.price = newPrice;
        this.amount = newAmount;
    }

    public Order copy() {
        return toBuilder().build();
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
