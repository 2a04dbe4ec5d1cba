package io.limitbook.config;

import io.limitbook.core.model.Side;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "orderbook")
public class OrderBookProperties {
    private String tag = "MAIN";
    private int tradeJournalSize = 1000;
    // Orders rested on startup
    private List<SeedOrder> seed = new ArrayList<>();

    @Data
    public static class SeedOrder {
        private String id;
        private Side side;
        private BigDecimal price;
        private BigDecimal amount;
    }
}
