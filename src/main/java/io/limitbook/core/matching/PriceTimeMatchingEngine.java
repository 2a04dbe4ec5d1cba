package io.limitbook.core.matching;

import io.limitbook.core.event.TradeExecutedEvent;
import io.limitbook.core.exception.OrderBookException;
import io.limitbook.core.model.Order;
import io.limitbook.core.model.OrderBookSide;
import io.limitbook.core.model.Side;
import io.limitbook.core.model.Trade;
import io.limitbook.core.orderbook.OrderBookManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Matches incoming limit orders against the opposite side in price-time priority.
 * Trades execute at the resting order's price; an unmatched remainder rests in the
 * book under the same write lock as the match.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PriceTimeMatchingEngine {
    private final OrderBookManager orderBookManager;
    private final ApplicationEventPublisher eventPublisher;

    public List<Trade> processOrder(Order incoming) {
        incoming.validate();
        log.info("MATCHING: Processing order {} {} {} @ {}",
                incoming.getId(), incoming.getSide(), incoming.getAmount(), incoming.getPrice());

        List<Trade> trades = new ArrayList<>();
        BigDecimal remaining = incoming.getAmount();

        orderBookManager.getLock().writeLock().lock();
        try {
            if (orderBookManager.containsOrder(incoming.getId())) {
                throw OrderBookException.invalidOrder("Order " + incoming.getId() + " already exists in order book");
            }

            OrderBookSide opposite = orderBookManager.getSide(incoming.getSide().opposite());
            log.debug("MATCHING: Opposite side has {} resting orders", opposite.size());

            while (!opposite.isEmpty() && remaining.signum() > 0) {
                Order resting = opposite.peekFirst();
                if (!isPriceMatching(incoming, resting)) {
                    log.debug("MATCHING: Best opposite price {} does not cross {}, stopping",
                            resting.getPrice(), incoming.getPrice());
                    break;
                }

                BigDecimal executed = remaining.min(resting.getAmount());
                Trade trade = createTrade(incoming, resting, executed);
                trades.add(trade);

                remaining = remaining.subtract(executed);
                resting.fill(executed);
                log.info("TRADE: buy={} sell={} | {} @ {}",
                        trade.getBuyOrderId(), trade.getSellOrderId(), executed, trade.getPrice());

                if (resting.isFilled()) {
                    log.debug("MATCHING: Resting order {} fully filled, removing from book", resting.getId());
                    opposite.pollFirst();
                    orderBookManager.removeOrderIndex(resting.getId());
                }
            }

            if (remaining.signum() > 0) {
                log.debug("MATCHING: Resting remainder {} of order {} at {}", remaining, incoming.getId(), incoming.getPrice());
                orderBookManager.placeOrder(Order.create(incoming.getId(), incoming.getPrice(), remaining, incoming.getSide()));
            }
        } finally {
            orderBookManager.getLock().writeLock().unlock();
        }

        log.info("MATCHING: Order {} completed: {} trades, remaining={}", incoming.getId(), trades.size(), remaining);
        for (Trade trade : trades) {
            eventPublisher.publishEvent(new TradeExecutedEvent(this, orderBookManager.getTag(), trade));
        }
        return trades;
    }

    private static boolean isPriceMatching(Order incoming, Order resting) {
        return switch (incoming.getSide()) {
            case BUY -> resting.getPrice().compareTo(incoming.getPrice()) <= 0;
            case SELL -> resting.getPrice().compareTo(incoming.getPrice()) >= 0;
        };
    }

    private static Trade createTrade(Order incoming, Order resting, BigDecimal executed) {
        boolean incomingBuys = incoming.getSide() == Side.BUY;
        return Trade.builder()
                .buyOrderId(incomingBuys ? incoming.getId() : resting.getId())
                .sellOrderId(incomingBuys ? resting.getId() : incoming.getId())
                .price(resting.getPrice())
                .amount(executed)
                .build();
    }
}
