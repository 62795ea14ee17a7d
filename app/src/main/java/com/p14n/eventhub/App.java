package com.p14n.eventhub;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;

import com.p14n.eventhub.data.ConfigData;
import com.p14n.eventhub.data.FanOutMode;
import com.p14n.eventhub.data.HubMode;
import com.p14n.eventhub.db.DatabaseSetup;
import com.p14n.eventhub.storage.InMemoryStorage;
import com.p14n.eventhub.storage.JdbcStorage;

import io.opentelemetry.instrumentation.jdbc.datasource.JdbcTelemetry;
import io.opentelemetry.sdk.OpenTelemetrySdk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an event hub server for {@link Notification} events.
 *
 * <p>
 * Settings come from the environment: {@code EVENTHUB_PORT},
 * {@code EVENTHUB_FAN_OUT} ({@code BROADCAST} or {@code ROUND_ROBIN}),
 * {@code EVENTHUB_MODE} ({@code EVENT_PUBLISHER} or {@code EVENT_BROKER}) and
 * {@code EVENTHUB_STORAGE} ({@code memory} or {@code postgres}). PostgreSQL
 * storage reads {@code EVENTHUB_DB_HOST}, {@code EVENTHUB_DB_PORT},
 * {@code EVENTHUB_DB_USER}, {@code EVENTHUB_DB_PASSWORD} and
 * {@code EVENTHUB_DB_NAME}. Spans and metrics are exported when
 * {@code EVENTHUB_OTLP_ENDPOINT} is set.
 * </p>
 */
public class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    /**
     * Example event type.
     */
    public record Notification(String id, String message, Instant time) {
    }

    private static String envVal(String name, String defaultValue) {
        var e = System.getenv(name);
        if (e != null && !e.isBlank()) {
            return e.trim();
        }
        return defaultValue;
    }

    static ConfigData configFromEnv() {
        return new ConfigData(
                FanOutMode.valueOf(envVal("EVENTHUB_FAN_OUT", "BROADCAST")),
                HubMode.valueOf(envVal("EVENTHUB_MODE", "EVENT_BROKER")),
                envVal("EVENTHUB_DB_HOST", "localhost"),
                Integer.parseInt(envVal("EVENTHUB_DB_PORT", "5432")),
                envVal("EVENTHUB_DB_USER", "postgres"),
                envVal("EVENTHUB_DB_PASSWORD", "postgres"),
                envVal("EVENTHUB_DB_NAME", "postgres"));
    }

    public static void main(String[] args) throws Exception {
        var cfg = configFromEnv();
        int port = Integer.parseInt(envVal("EVENTHUB_PORT", "50051"));
        boolean durable = "postgres".equalsIgnoreCase(envVal("EVENTHUB_STORAGE", "memory"));

        var ot = Opentelemetry.fromEndpoint("event-hub", envVal("EVENTHUB_OTLP_ENDPOINT", null));

        var server = new EventHubServer(cfg, ot);
        if (durable) {
            new DatabaseSetup(cfg).setupAll();
            var ds = JdbcTelemetry.create(ot).wrap(DatabaseSetup.createPool(cfg));
            server.addHub(Notification.class, new JdbcStorage(ds));
        } else {
            server.addHub(Notification.class, new InMemoryStorage(cfg));
        }

        var stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.atInfo().log("Shutting down event hub server since JVM is shutting down");
            server.stop();
            if (ot instanceof OpenTelemetrySdk sdk) {
                sdk.close();
            }
            stopped.countDown();
        }));

        server.start(port);
        logger.atInfo().log("Listening on port {} with {} storage", port, durable ? "postgres" : "in-memory");

        if (args.length > 0 && "--announce".equals(args[0])) {
            server.publish(new Notification(UUID.randomUUID().toString(), "event hub started", Instant.now()));
        }
        stopped.await();
    }
}
