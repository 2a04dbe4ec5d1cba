package io.limitbook.core.journal;

import io.limitbook.config.OrderBookProperties;
import io.limitbook.core.event.TradeExecutedEvent;
import io.limitbook.core.model.Trade;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TradeJournalTest {

    @Mock
    private OrderBookProperties properties;

    private TradeJournal journal;

    @BeforeEach
    void setUp() {
        journal = new TradeJournal(properties);
    }

    private Trade trade(String buyId) {
        return Trade.builder()
                .buyOrderId(buyId)
                .sellOrderId("s")
                .price(new BigDecimal("100"))
                .amount(BigDecimal.ONE)
                .build();
    }

    @Test
    void testKeepsMostRecentTrades() {
        when(properties.getTradeJournalSize()).thenReturn(3);

        for (int i = 1; i <= 5; i++) {
            journal.onTradeExecuted(new TradeExecutedEvent(this, "TEST", trade("b" + i)));
        }

        List<String> ids = journal.recent(10).stream().map(Trade::getBuyOrderId).collect(Collectors.toList());
        assertEquals(List.of("b3", "b4", "b5"), ids);
    }

    @Test
    void testRecentRespectsLimit() {
        when(properties.getTradeJournalSize()).thenReturn(10);
        journal.record(trade("b1"));
        journal.record(trade("b2"));
        journal.record(trade("b3"));

        List<String> ids = journal.recent(2).stream().map(Trade::getBuyOrderId).collect(Collectors.toList());

        assertEquals(List.of("b2", "b3"), ids);
        assertTrue(journal.recent(0).isEmpty());
    }

    @Test
    void testZeroCapacityDisablesJournal() {
        when(properties.getTradeJournalSize()).thenReturn(0);

        journal.record(trade("b1"));

        assertTrue(journal.recent(10).isEmpty());
    }
}
