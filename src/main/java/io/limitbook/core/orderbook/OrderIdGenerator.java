package io.limitbook.core.orderbook;

import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Source of order ids for callers that do not supply one.
 */
@Component
public class OrderIdGenerator {

    public String nextId() {
        return UUID.randomUUID().toString();
    }
}
