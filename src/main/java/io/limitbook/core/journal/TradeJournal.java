package io.limitbook.core.journal;

import io.limitbook.config.OrderBookProperties;
import io.limitbook.core.event.TradeExecutedEvent;
import io.limitbook.core.model.Trade;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Keeps the most recent executed trades in memory, oldest first.
 * Not part of book state: the book itself never stores trades.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradeJournal {
    private final OrderBookProperties properties;
    private final Deque<Trade> trades = new ArrayDeque<>();

    @EventListener
    public void onTradeExecuted(TradeExecutedEvent event) {
        record(event.getTrade());
    }

    public synchronized void record(Trade trade) {
        int capacity = Math.max(properties.getTradeJournalSize(), 0);
        if (capacity == 0) {
            return;
        }
        while (trades.size() >= capacity) {
            trades.pollFirst();
        }
        trades.addLast(trade);
        log.trace("Journal recorded trade buy={} sell={}, size={}", trade.getBuyOrderId(), trade.getSellOrderId(), trades.size());
    }

    /**
     * Up to {@code limit} most recent trades, oldest first.
     */
    public synchronized List<Trade> recent(int limit) {
        List<Trade> all = new ArrayList<>(trades);
        int from = Math.max(0, all.size() - Math.max(limit, 0));
        return new ArrayList<>(all.subList(from, all.size()));
    }

    public synchronized void clear() {
        trades.clear();
    }
}
