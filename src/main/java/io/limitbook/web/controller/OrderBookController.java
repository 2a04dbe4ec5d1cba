package io.limitbook.web.controller;

import io.limitbook.core.exception.OrderBookException;
import io.limitbook.core.journal.TradeJournal;
import io.limitbook.core.matching.PriceTimeMatchingEngine;
import io.limitbook.core.model.Order;
import io.limitbook.core.model.OrderBookSnapshot;
import io.limitbook.core.model.PriceLevel;
import io.limitbook.core.model.Trade;
import io.limitbook.core.orderbook.OrderBookManager;
import io.limitbook.core.orderbook.OrderIdGenerator;
import io.limitbook.web.dto.ErrorResponse;
import io.limitbook.web.dto.OrderBookDto;
import io.limitbook.web.dto.OrderDto;
import io.limitbook.web.dto.PlaceOrderRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@RestController
@RequiredArgsConstructor
public class OrderBookController {

    private final OrderBookManager orderBookManager;
    private final PriceTimeMatchingEngine matchingEngine;
    private final TradeJournal tradeJournal;
    private final OrderIdGenerator idGenerator;

    @PostMapping("/orders/place")
    @ResponseStatus(HttpStatus.CREATED)
    public OrderDto placeOrder(@RequestBody PlaceOrderRequest request) {
        Order order = toOrder(request);
        log.info("REST PlaceOrder: {} {} @ {} id={}", order.getSide(), order.getAmount(), order.getPrice(), order.getId());
        OrderDto placed = mapOrder(order);
        orderBookManager.placeOrder(order);
        return placed;
    }

    @PostMapping("/orders/process")
    public List<Trade> processOrder(@RequestBody PlaceOrderRequest request) {
        Order order = toOrder(request);
        log.info("REST ProcessOrder: {} {} @ {} id={}", order.getSide(), order.getAmount(), order.getPrice(), order.getId());
        return matchingEngine.processOrder(order);
    }

    @DeleteMapping("/orders/cancel")
    public ResponseEntity<Void> cancelOrder(@RequestParam String id) {
        log.info("REST CancelOrder: id={}", id);
        requireId(id);
        orderBookManager.cancelOrder(id);
        return ResponseEntity.ok().build();
    }

    @PatchMapping("/orders/modify")
    public OrderDto modifyOrder(@RequestParam String id,
                                @RequestParam BigDecimal price,
                                @RequestParam BigDecimal amount) {
        log.info("REST ModifyOrder: id={} price={} amount={}", id, price, amount);
        requireId(id);
        return mapOrder(orderBookManager.modifyOrder(id, price, amount));
    }

    @GetMapping("/orders/{id}")
    public OrderDto getOrder(@PathVariable String id) {
        return orderBookManager.getOrder(id)
                .map(this::mapOrder)
                .orElseThrow(() -> OrderBookException.orderNotFound(id));
    }

    @GetMapping("/orderbook/best-bid")
    public OrderDto getBestBid() {
        return mapOrder(orderBookManager.getBestBid());
    }

    @GetMapping("/orderbook/best-ask")
    public OrderDto getBestAsk() {
        return mapOrder(orderBookManager.getBestAsk());
    }

    @GetMapping("/orderbook/snapshot")
    public OrderBookDto getSnapshot() {
        OrderBookSnapshot snapshot = orderBookManager.getSnapshot();
        log.debug("REST GetSnapshot: bids={} levels, asks={} levels", snapshot.getBids().size(), snapshot.getAsks().size());
        return OrderBookDto.builder()
                .tag(snapshot.getTag())
                .bookId(snapshot.getBookId())
                .timestamp(snapshot.getTimestamp())
                .asks(mapLevels(snapshot.getAsks()))
                .bids(mapLevels(snapshot.getBids()))
                .build();
    }

    @GetMapping("/orderbook/trades")
    public List<Trade> getRecentTrades(@RequestParam(defaultValue = "100") int limit) {
        return tradeJournal.recent(limit);
    }

    @ExceptionHandler(OrderBookException.class)
    public ResponseEntity<ErrorResponse> handleOrderBookException(OrderBookException ex) {
        HttpStatus status = switch (ex.getError()) {
            case INVALID_ORDER, INVALID_MODIFICATION -> HttpStatus.BAD_REQUEST;
            case ORDER_NOT_FOUND, NO_ORDERS -> HttpStatus.NOT_FOUND;
        };
        log.warn("REST request rejected: {} - {}", ex.getError(), ex.getMessage());
        return ResponseEntity.status(status).body(new ErrorResponse(ex.getError(), ex.getMessage()));
    }

    private static void requireId(String id) {
        if (id.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Order ID is required");
        }
    }

    private Order toOrder(PlaceOrderRequest request) {
        String id = request.getId() == null || request.getId().isBlank() ? idGenerator.nextId() : request.getId();
        return Order.create(id, request.getPrice(), request.getAmount(), request.getSide());
    }

    private List<OrderBookDto.PriceLevelDto> mapLevels(List<PriceLevel> levels) {
        return levels.stream()
                .map(level -> OrderBookDto.PriceLevelDto.builder()
                        .price(level.getPrice())
                        .totalAmount(level.getTotalAmount())
                        .orderCount(level.getOrderCount())
                        .build())
                .collect(Collectors.toList());
    }

    private OrderDto mapOrder(Order order) {
        return OrderDto.builder()
                .id(order.getId())
                .side(order.getSide())
                .price(order.getPrice())
                .amount(order.getAmount())
                .build();
    }
}
