package com.ordermatcher;

import com.ordermatcher.config.EngineConfig;
import com.ordermatcher.domain.Order;
import io.prometheus.metrics.model.registry.PrometheusRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class EngineRuntimeTest {

    @Test
    @DisplayName("Runtime wires the sequencer to the engine and drains on close")
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void startsAndDrains() {
        EngineConfig config = new EngineConfig(0.05, 64, "", 0, 60);
        EngineRuntime runtime = EngineRuntime.start(config, new PrometheusRegistry());

        runtime.getSequencer().tryAddBuy(Order.limit(1, 1, 10.0, 5.0));
        runtime.getSequencer().tryAddSell(Order.limit(2, 1, 9.5, 2.0));
        runtime.getSequencer().tryMatch(1);
        runtime.close();

        assertThat(runtime.getEngine().getStats().tradesExecuted.get()).isEqualTo(1);
        assertThat(runtime.getEngine().buyOrders(1))
                .extracting(Order::getAmount).containsExactly(3.0);
        assertThat(runtime.getEngine().sellOrders(1)).isEmpty();
    }

    @Test
    @DisplayName("Close is idempotent")
    void closeTwice() {
        EngineRuntime runtime = EngineRuntime.start(new EngineConfig(0.05, 64, "", 0, 60),
                new PrometheusRegistry());

        runtime.close();
        runtime.close();

        assertThat(runtime.getConfig().getRingBufferSize()).isEqualTo(64);
    }
}
