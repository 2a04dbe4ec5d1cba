package io.limitbook.core.event;

import io.limitbook.core.model.Trade;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

@Getter
public class TradeExecutedEvent extends ApplicationEvent {
    private final String bookTag;
    private final Trade trade;

    public TradeExecutedEvent(Object source, String bookTag, Trade trade) {
        super(source);
        this.bookTag = bookTag;
        this.trade = trade;
    }
}
