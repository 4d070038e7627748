package com.ordermatcher.publishing;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.ordermatcher.domain.Order;
import com.ordermatcher.domain.Side;
import com.ordermatcher.domain.TradeReport;
import com.ordermatcher.matching.TradeListener;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Properties;

/**
 * Async Kafka producer wrapper for trade reports and accepted orders.
 *
 * Trade reports arrive while a product's lock is held, so the producer must
 * never block: max.block.ms=1 makes send() return (or throw) immediately when
 * the broker is unreachable or the buffer is full. Errors are logged and
 * never propagated to the matching logic.
 */
public class TradeEventPublisher implements TradeListener {

    private static final Logger logger = LoggerFactory.getLogger(TradeEventPublisher.class);
    static final String TRADES_TOPIC = "trades";
    static final String ORDERS_TOPIC = "orders";

    private final Producer<String, String> producer;
    private final Gson gson;

    public TradeEventPublisher(String kafkaBootstrap) {
        this(createProducer(kafkaBootstrap));
    }

    public TradeEventPublisher(Producer<String, String> producer) {
        this.producer = producer;
        this.gson = new Gson();
    }

    private static Producer<String, String> createProducer(String kafkaBootstrap) {
        Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, kafkaBootstrap);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.ACKS_CONFIG, "0");                  // fire-and-forget
        props.put(ProducerConfig.LINGER_MS_CONFIG, "5");             // batch for 5ms
        props.put(ProducerConfig.BATCH_SIZE_CONFIG, "16384");        // 16 KB batch
        props.put(ProducerConfig.BUFFER_MEMORY_CONFIG, "33554432");  // 32 MB buffer
        props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, "1");          // never block a book lock holder

        try {
            KafkaProducer<String, String> p = new KafkaProducer<>(props);
            logger.info("Kafka producer initialized. Bootstrap: {}", kafkaBootstrap);
            return p;
        } catch (Exception e) {
            logger.error("Failed to initialize Kafka producer: {}. "
                    + "Events will not be published.", e.getMessage());
            return null;
        }
    }

    /**
     * Publish a trade report to the "trades" topic, keyed by product id.
     */
    @Override
    public void onTrade(TradeReport trade) {
        if (producer == null) {
            return;
        }
        try {
            JsonObject json = new JsonObject();
            json.addProperty("type", "TRADE_EXECUTED");
            json.addProperty("tradeId", trade.getTradeId());
            json.addProperty("buyOrderId", trade.getBuyOrderId());
            json.addProperty("sellOrderId", trade.getSellOrderId());
            json.addProperty("productId", trade.getProductId());
            json.addProperty("price", trade.getPrice());
            json.addProperty("amount", trade.getAmount());
            json.addProperty("timestamp", trade.getTimestamp());

            send(TRADES_TOPIC, String.valueOf(trade.getProductId()), gson.toJson(json));
        } catch (Exception e) {
            logger.warn("Error publishing trade event: {}", e.getMessage());
        }
    }

    /**
     * Publish an order-accepted event to the "orders" topic.
     */
    public void publishOrderAccepted(Order order, Side side) {
        if (producer == null) {
            return;
        }
        try {
            JsonObject json = new JsonObject();
            json.addProperty("type", "ORDER_ACCEPTED");
            json.addProperty("orderId", order.getId());
            json.addProperty("productId", order.getProductId());
            json.addProperty("side", side.name());
            json.addProperty("kind", order.getKind().name());
            json.addProperty("price", order.getPrice());
            json.addProperty("amount", order.getAmount());
            json.addProperty("timestamp", System.currentTimeMillis());

            send(ORDERS_TOPIC, String.valueOf(order.getProductId()), gson.toJson(json));
        } catch (Exception e) {
            logger.warn("Error publishing order event: {}", e.getMessage());
        }
    }

    public boolean isEnabled() {
        return producer != null;
    }

    /**
     * Flush and close the Kafka producer.
     */
    public void close() {
        if (producer != null) {
            try {
                producer.flush();
                producer.close();
                logger.info("Kafka producer closed.");
            } catch (Exception e) {
                logger.warn("Error closing Kafka producer: {}", e.getMessage());
            }
        }
    }

    private void send(String topic, String key, String value) {
        ProducerRecord<String, String> record = new ProducerRecord<>(topic, key, value);
        producer.send(record, (metadata, exception) -> {
            if (exception != null) {
                logger.warn("Failed to publish to {}: {}", topic, exception.getMessage());
            }
        });
    }
}
