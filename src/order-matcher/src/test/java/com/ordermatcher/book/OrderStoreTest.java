package com.ordermatcher.book;

import com.ordermatcher.domain.Order;
import com.ordermatcher.domain.Side;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrderStoreTest {

    private OrderStore store;

    @BeforeEach
    void setUp() {
        store = new OrderStore();
    }

    @Test
    @DisplayName("Should append orders in insertion order per product and side")
    void shouldAppendInInsertionOrder() {
        store.addBuy(Order.limit(3, 1, 9.0, 1.0));
        store.addBuy(Order.limit(1, 1, 10.0, 1.0));
        store.addSell(Order.limit(2, 1, 11.0, 1.0));
        store.addBuy(Order.limit(5, 2, 20.0, 1.0));

        assertThat(store.buyOrders(1)).extracting(Order::getId).containsExactly(3, 1);
        assertThat(store.sellOrders(1)).extracting(Order::getId).containsExactly(2);
        assertThat(store.buyOrders(2)).extracting(Order::getId).containsExactly(5);
        assertThat(store.productIds()).containsExactly(1, 2);
    }

    @Test
    @DisplayName("Cancel removes the order and keeps the remainder in order")
    void cancelPreservesRelativeOrder() {
        store.addBuy(Order.limit(1, 1, 10.0, 1.0));
        store.addBuy(Order.limit(2, 1, 10.0, 1.0));
        store.addBuy(Order.limit(3, 1, 10.0, 1.0));

        boolean removed = store.cancelBuy(1, 2);

        assertThat(removed).isTrue();
        assertThat(store.buyOrders(1)).extracting(Order::getId).containsExactly(1, 3);
    }

    @Test
    @DisplayName("Cancelling an absent order is a silent no-op")
    void cancelMissingIsNoOp() {
        store.addSell(Order.limit(1, 1, 10.0, 1.0));

        assertThat(store.cancelSell(1, 99)).isFalse();
        assertThat(store.cancelSell(42, 1)).isFalse();
        assertThat(store.cancelBuy(1, 1)).isFalse();
        assertThat(store.sellOrders(1)).hasSize(1);
    }

    @Test
    @DisplayName("Same id on opposite sides is independent")
    void sidesAreIndependent() {
        store.addBuy(Order.limit(1, 1, 10.0, 1.0));
        store.addSell(Order.limit(1, 1, 11.0, 2.0));

        store.cancelBuy(1, 1);

        assertThat(store.buyOrders(1)).isEmpty();
        assertThat(store.lookupById(Side.SELL, 1, 1)).isNotNull();
    }

    @Test
    @DisplayName("Duplicate ids are accepted and cancel removes only the first")
    void duplicateIdsAreNotChecked() {
        store.addBuy(Order.limit(1, 1, 10.0, 1.0));
        store.addBuy(Order.limit(1, 1, 12.0, 2.0));

        assertThat(store.lookupById(Side.BUY, 1, 1).getPrice()).isEqualTo(10.0);

        store.cancelBuy(1, 1);

        assertThat(store.buyOrders(1)).extracting(Order::getPrice).containsExactly(12.0);
    }

    @Test
    @DisplayName("Lookup returns null for unknown products and orders")
    void lookupReturnsNullWhenAbsent() {
        store.addBuy(Order.limit(1, 1, 10.0, 1.0));

        assertThat(store.lookupById(Side.BUY, 1, 1)).isNotNull();
        assertThat(store.lookupById(Side.BUY, 1, 2)).isNull();
        assertThat(store.lookupById(Side.BUY, 7, 1)).isNull();
    }

    @Test
    @DisplayName("Critical sections on unknown products do not register a book")
    void withBookOnUnknownProduct() {
        int depth = store.withBook(5, b -> b.orders(Side.BUY).size());

        assertThat(depth).isZero();
        assertThat(store.productIds()).isEmpty();
    }

    @Test
    @DisplayName("Snapshots are copies of the resting orders")
    void snapshotsAreCopies() {
        store.addBuy(Order.limit(1, 1, 10.0, 5.0));

        List<Order> snapshot = store.buyOrders(1);
        snapshot.get(0).fill(5.0);

        assertThat(store.buyOrders(1).get(0).getAmount()).isEqualTo(5.0);
    }

    @Test
    @DisplayName("Live sequences require the product lock")
    void liveAccessRequiresLock() {
        ProductBook book = store.getOrCreateBook(1);

        assertThatThrownBy(() -> book.orders(Side.BUY))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("without holding its lock");

        List<Order> orders = store.withBook(1, b -> b.orders(Side.BUY));
        assertThat(orders).isEmpty();
    }

    @Test
    @DisplayName("Concurrent adds and cancels across products keep every book consistent")
    void concurrentAddsAreSafe() throws InterruptedException {
        int threads = 8;
        int perThread = 500;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch done = new CountDownLatch(threads);

        for (int t = 0; t < threads; t++) {
            final int product = t % 2;
            final int base = t * perThread;
            executor.submit(() -> {
                try {
                    for (int i = 0; i < perThread; i++) {
                        store.addBuy(Order.limit(base + i, product, 10.0, 1.0));
                    }
                    for (int i = 0; i < perThread; i += 2) {
                        store.cancelBuy(product, base + i);
                    }
                } finally {
                    done.countDown();
                }
            });
        }

        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(store.buyOrders(0)).hasSize(threads / 2 * perThread / 2);
        assertThat(store.buyOrders(1)).hasSize(threads / 2 * perThread / 2);
        assertThat(store.depth(Side.BUY)).isEqualTo(threads * perThread / 2);
    }
}
