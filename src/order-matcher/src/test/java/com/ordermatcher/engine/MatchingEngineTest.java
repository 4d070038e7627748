package com.ordermatcher.engine;

import com.ordermatcher.codec.EncodingException;
import com.ordermatcher.codec.GsonOrderCodec;
import com.ordermatcher.codec.OrderCodec;
import com.ordermatcher.domain.BookSnapshot;
import com.ordermatcher.domain.Order;
import com.ordermatcher.domain.TradeReport;
import com.ordermatcher.matching.MatchPass;
import com.ordermatcher.pricing.RepriceResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MatchingEngineTest {

    private List<TradeReport> trades;
    private MatchingEngine engine;

    @BeforeEach
    void setUp() {
        trades = new ArrayList<>();
        engine = new MatchingEngine(0.05, new GsonOrderCodec(), trades::add);
    }

    @Test
    @DisplayName("Add, match and cancel through the caller surface")
    void callerSurface() {
        engine.addBuy(Order.limit(1, 1, 10.0, 5.0));
        engine.addBuy(Order.limit(2, 1, 8.0, 1.0));
        engine.addSell(Order.limit(4, 1, 9.5, 10.0));

        MatchPass pass = engine.match(1);

        assertThat(pass.getTradeCount()).isEqualTo(1);
        assertThat(trades).hasSize(1);
        assertThat(engine.cancelBuy(1, 1)).isFalse();
        assertThat(engine.cancelBuy(1, 2)).isTrue();
        assertThat(engine.cancelSell(1, 4)).isTrue();
        assertThat(engine.buyOrders(1)).isEmpty();
        assertThat(engine.sellOrders(1)).isEmpty();

        assertThat(engine.getStats().buyOrdersAdded.get()).isEqualTo(2);
        assertThat(engine.getStats().sellOrdersAdded.get()).isEqualTo(1);
        assertThat(engine.getStats().ordersCancelled.get()).isEqualTo(2);
        assertThat(engine.getStats().tradesExecuted.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Price update drops out-of-tolerance orders and reprices the rest")
    void priceUpdate() {
        engine.addBuy(Order.limit(1, 1, 10.0, 5.0));
        engine.addBuy(Order.limit(2, 1, 9.0, 3.0));
        engine.addBuy(Order.limit(3, 1, 9.73, 4.0));
        engine.addSell(Order.limit(4, 1, 9.5, 6.0));

        assertThat(engine.estimateMarketPrice(1)).isEqualTo(9.75);

        RepriceResult result = engine.updatePrice(1, 9.76);

        assertThat(result.getDroppedCount()).isEqualTo(3);
        assertThat(engine.buyOrders(1)).extracting(Order::getId).containsExactly(3);
        assertThat(engine.buyOrders(1)).allSatisfy(o -> assertThat(o.getPrice()).isEqualTo(9.76));
        assertThat(engine.getStats().ordersDropped.get()).isEqualTo(3);
        assertThat(engine.getStats().priceUpdates.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Every registered listener receives each trade once")
    void fansOutToListeners() {
        List<TradeReport> second = new ArrayList<>();
        engine.addTradeListener(second::add);
        engine.addBuy(Order.limit(1, 1, 10.0, 1.0));
        engine.addSell(Order.limit(2, 1, 10.0, 1.0));

        engine.match(1);

        assertThat(trades).hasSize(1);
        assertThat(second).containsExactlyElementsOf(trades);
    }

    @Test
    @DisplayName("A throwing listener does not corrupt the book or starve other listeners")
    void throwingListenerIsIsolated() {
        // Given
        engine.addTradeListener(report -> {
            throw new IllegalStateException("sink down");
        });
        List<TradeReport> after = new ArrayList<>();
        engine.addTradeListener(after::add);
        engine.addBuy(Order.limit(1, 1, 10.0, 5.0));
        engine.addSell(Order.limit(4, 1, 9.5, 5.0));

        // When
        MatchPass first = engine.match(1);
        MatchPass second = engine.match(1);

        // Then
        assertThat(first.getTradeCount()).isEqualTo(1);
        assertThat(trades).hasSize(1);
        assertThat(after).hasSize(1);
        assertThat(engine.buyOrders(1)).isEmpty();
        assertThat(engine.sellOrders(1)).isEmpty();
        assertThat(second.hasTrades()).isFalse();
    }

    @Test
    @DisplayName("Reads and passes on unknown products leave the product set unchanged")
    void unknownProductReadsDoNotRegister() {
        engine.addBuy(Order.limit(1, 1, 10.0, 1.0));

        assertThat(engine.estimateMarketPrice(42)).isZero();
        assertThat(engine.match(42).hasTrades()).isFalse();
        assertThat(engine.updatePrice(42, 5.0).getDroppedCount()).isZero();
        assertThat(engine.snapshot(42).getBuyOrders()).isEmpty();

        assertThat(engine.getStore().productIds()).containsExactly(1);
    }

    @Test
    @DisplayName("Decoded snapshots are not validated")
    void decodedOrdersAreNotValidated() throws Exception {
        String json = "{\"productId\":1,\"tolerance\":0.05,"
                + "\"buyOrders\":[{\"id\":-3,\"kind\":\"LIMIT\",\"price\":10.0,\"amount\":0.0,"
                + "\"priority\":0,\"createdAt\":0,\"productId\":1}],\"sellOrders\":[]}";

        BookSnapshot decoded = engine.decodeBook(json.getBytes(StandardCharsets.UTF_8));

        assertThat(decoded.getBuyOrders()).extracting(Order::getId, Order::getAmount)
                .containsExactly(tuple(-3, 0.0));
    }

    @Test
    @DisplayName("Encoded book decodes to the same resting orders")
    void encodesBook() throws Exception {
        engine.addBuy(Order.limit(1, 3, 10.0, 5.0));
        engine.addSell(Order.market(2, 3, 4.0));

        BookSnapshot decoded = engine.decodeBook(engine.encodeBook(3));

        assertThat(decoded.getProductId()).isEqualTo(3);
        assertThat(decoded.getTolerance()).isEqualTo(0.05);
        assertThat(decoded.getBuyOrders()).extracting(Order::getId).containsExactly(1);
        assertThat(decoded.getSellOrders()).extracting(Order::getAmount).containsExactly(4.0);
    }

    @Test
    @DisplayName("Encoding failure propagates and leaves the book untouched")
    void encodingFailureLeavesBookIntact() {
        engine.addBuy(Order.limit(1, 1, Double.NaN, 5.0));
        engine.addSell(Order.limit(2, 1, 9.0, 5.0));

        assertThatThrownBy(() -> engine.encodeBook(1)).isInstanceOf(EncodingException.class);

        assertThat(engine.buyOrders(1)).hasSize(1);
        assertThat(engine.sellOrders(1)).extracting(Order::getAmount).containsExactly(5.0);
    }

    @Test
    @DisplayName("Codec failures from a pluggable codec propagate unchanged")
    void pluggableCodecFailure() throws Exception {
        OrderCodec codec = mock(OrderCodec.class);
        EncodingException failure = new EncodingException("unsupported", null);
        when(codec.encode(any())).thenThrow(failure);
        MatchingEngine failing = new MatchingEngine(0.05, codec);
        failing.addBuy(Order.limit(1, 1, 10.0, 1.0));

        assertThatThrownBy(() -> failing.encodeBook(1)).isSameAs(failure);
        assertThat(failing.buyOrders(1)).hasSize(1);
    }

    @Test
    @DisplayName("Constructor rejects a missing codec and a negative tolerance")
    void rejectsInvalidConstruction() {
        assertThatThrownBy(() -> new MatchingEngine(0.05, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MatchingEngine(-1, new GsonOrderCodec()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Concurrent callers on several products conserve traded amounts")
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    void concurrentCallersConserveAmounts() throws InterruptedException {
        Queue<TradeReport> reports = new ConcurrentLinkedQueue<>();
        MatchingEngine shared = new MatchingEngine(1000, new GsonOrderCodec(), reports::add);
        int products = 4;
        int threadsPerProduct = 3;
        int ordersPerThread = 200;
        ExecutorService executor = Executors.newFixedThreadPool(products * threadsPerProduct);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(products * threadsPerProduct);

        for (int p = 0; p < products; p++) {
            for (int t = 0; t < threadsPerProduct; t++) {
                final int product = p;
                final int base = t * ordersPerThread;
                executor.submit(() -> {
                    try {
                        start.await();
                        for (int i = 0; i < ordersPerThread; i++) {
                            int id = base + i;
                            if (i % 2 == 0) {
                                shared.addBuy(Order.limit(id, product, 100 + (i % 7), 1 + (i % 3)));
                            } else {
                                shared.addSell(Order.limit(id, product, 100 + (i % 5), 1 + (i % 4)));
                            }
                            if (i % 10 == 0) {
                                shared.match(product);
                            }
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }
        }

        start.countDown();
        assertThat(done.await(20, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        double added = 0;
        for (int i = 0; i < ordersPerThread; i++) {
            added += i % 2 == 0 ? 1 + (i % 3) : 1 + (i % 4);
        }
        added *= products * threadsPerProduct;

        double remaining = 0;
        for (int p = 0; p < products; p++) {
            shared.match(p);
            for (Order order : shared.buyOrders(p)) {
                assertThat(order.getAmount()).isPositive();
                remaining += order.getAmount();
            }
            for (Order order : shared.sellOrders(p)) {
                assertThat(order.getAmount()).isPositive();
                remaining += order.getAmount();
            }
        }
        double traded = reports.stream().mapToDouble(TradeReport::getAmount).sum();

        assertThat(remaining).isEqualTo(added - 2 * traded);
        assertThat(shared.getStats().tradesExecuted.get()).isEqualTo(reports.size());
    }
}
