package com.ordermatcher.disruptor;

import com.ordermatcher.domain.Order;

/**
 * Copies caller data into a claimed EngineCommand slot. No allocation: the
 * order's fields are copied, the Order instance itself is not retained.
 */
public final class EngineCommandTranslator {

    private EngineCommandTranslator() {
    }

    public static void translateAdd(EngineCommand command, CommandType type, Order order,
                                    long publishedNanos) {
        command.publishedNanos = publishedNanos;
        command.type = type;
        command.productId = order.getProductId();
        command.orderId = order.getId();
        command.kind = order.getKind();
        command.price = order.getPrice();
        command.amount = order.getAmount();
        command.priority = order.getPriority();
        command.createdAt = order.getCreatedAt();
    }

    public static void translateCancel(EngineCommand command, CommandType type,
                                       int productId, int orderId, long publishedNanos) {
        command.publishedNanos = publishedNanos;
        command.type = type;
        command.productId = productId;
        command.orderId = orderId;
    }

    public static void translateMatch(EngineCommand command, int productId, long publishedNanos) {
        command.publishedNanos = publishedNanos;
        command.type = CommandType.MATCH;
        command.productId = productId;
    }

    public static void translatePriceUpdate(EngineCommand command, int productId, double newPrice,
                                            long publishedNanos) {
        command.publishedNanos = publishedNanos;
        command.type = CommandType.UPDATE_PRICE;
        command.productId = productId;
        command.price = newPrice;
    }
}
