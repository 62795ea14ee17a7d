package com.p14n.eventhub;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import com.p14n.eventhub.broker.AsyncExecutor;
import com.p14n.eventhub.broker.CancellationSignal;
import com.p14n.eventhub.broker.DefaultExecutor;
import com.p14n.eventhub.broker.EventHub;
import com.p14n.eventhub.broker.EventHubErrorObserver;
import com.p14n.eventhub.broker.HubRegistry;
import com.p14n.eventhub.data.EventRecord;
import com.p14n.eventhub.data.HubConfig;
import com.p14n.eventhub.data.StorageRecord;
import com.p14n.eventhub.storage.StorageProvider;
import com.p14n.eventhub.transport.grpc.EventHubGrpcService;

import io.grpc.BindableService;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.opentelemetry.api.OpenTelemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hosts event hubs behind a gRPC server.
 *
 * <p>
 * Hubs are added before {@link #start(int)}. Starting restores the subscribers
 * of durable hubs first and fails if that is not possible, so the server never
 * accepts traffic with subscribers missing. Once running, stale records are
 * purged on the configured interval.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * var config = new ConfigData(FanOutMode.BROADCAST, HubMode.EVENT_BROKER);
 * var server = new EventHubServer(config, OpenTelemetry.noop());
 * server.addHub(OrderPlaced.class, new InMemoryStorage(config));
 * server.start(8080);
 * server.publish(new OrderPlaced("o-1"));
 * }</pre>
 */
public class EventHubServer implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(EventHubServer.class);

    private final HubConfig cfg;
    private final AsyncExecutor asyncExecutor;
    private final OpenTelemetry ot;
    private final HubRegistry registry;
    private final CancellationSignal appStopping = CancellationSignal.none();
    private final List<BindableService> services = new ArrayList<>();
    private EventHubErrorObserver errors = EventHubErrorObserver.NONE;
    private Server server;
    private ScheduledFuture<?> purgeTask;

    /**
     * Creates a new EventHubServer with the default executor.
     *
     * @param cfg default configuration of the hubs
     * @param ot  The OpenTelemetry instance for monitoring and tracing
     */
    public EventHubServer(HubConfig cfg, OpenTelemetry ot) {
        this(cfg, new DefaultExecutor(2), ot);
    }

    public EventHubServer(HubConfig cfg, AsyncExecutor asyncExecutor, OpenTelemetry ot) {
        this.cfg = cfg;
        this.asyncExecutor = asyncExecutor;
        this.ot = ot;
        this.registry = new HubRegistry(asyncExecutor);
    }

    public EventHubServer errorObserver(EventHubErrorObserver errors) {
        this.errors = errors;
        return this;
    }

    /**
     * Adds a hub for an event type using the server configuration.
     *
     * @param eventClass the event type
     * @param storage    where the hub keeps its records
     * @return the registered hub
     */
    public <E> EventHub<E, EventRecord> addHub(Class<E> eventClass, StorageProvider<EventRecord> storage) {
        return addHub(eventClass, cfg, storage, EventRecord::new);
    }

    public <E, R extends StorageRecord> EventHub<E, R> addHub(Class<E> eventClass, HubConfig hubCfg,
            StorageProvider<R> storage, Supplier<R> recordFactory) {
        EventHub<E, R> hub = EventHub.builder(eventClass)
                .config(hubCfg)
                .storage(storage, recordFactory)
                .registry(registry)
                .appStopping(appStopping)
                .asyncExecutor(asyncExecutor)
                .errorObserver(errors)
                .openTelemetry(ot)
                .build();
        services.add(new EventHubGrpcService<>(hub, registry, asyncExecutor, appStopping));
        logger.atInfo().log("Added {} event hub for {}", hub.fanOutMode(), hub.eventType());
        return hub;
    }

    public HubRegistry registry() {
        return registry;
    }

    /**
     * Publishes an event in-process to the hub of its type.
     *
     * @param event the event
     * @throws IllegalStateException if no hub was added for the event type
     */
    public void publish(Object event) {
        registry.routeEvent(event, appStopping);
    }

    /**
     * Starts the server on the specified port.
     *
     * @param port The port number to listen on
     * @throws IOException If the server fails to start
     */
    public void start(int port) throws IOException {
        start(ServerBuilder.forPort(port)
                .permitKeepAliveTime(1, TimeUnit.HOURS)
                .permitKeepAliveWithoutCalls(true));
    }

    /**
     * Restores durable hubs, then starts the server with a custom server builder.
     *
     * @param sb The server builder to use for configuration
     * @throws IOException If the server fails to start
     * @throws com.p14n.eventhub.broker.HubInitializationException if subscribers
     *                                                             could not be
     *                                                             restored
     */
    public void start(ServerBuilder<?> sb) throws IOException {
        logger.atInfo().log("Starting event hub server");

        try {
            registry.initializeAll();
            for (var service : services) {
                sb.addService(service);
            }
            server = sb.build().start();
        } catch (IOException | RuntimeException e) {
            logger.atError()
                    .setCause(e)
                    .log("Failed to start event hub server");
            throw e;
        }

        long interval = cfg.purgeInterval().toMillis();
        purgeTask = asyncExecutor.scheduleAtFixedRate(registry::purgeStaleRecords, interval, interval,
                TimeUnit.MILLISECONDS);

        logger.atInfo().log("Event hub server started with {} hubs", services.size());
    }

    /**
     * Cancels every streaming loop and stops the server.
     */
    public void stop() {
        logger.atInfo().log("Stopping event hub server");

        appStopping.cancel();
        if (purgeTask != null) {
            purgeTask.cancel(false);
        }
        if (server != null) {
            server.shutdown();
            try {
                server.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.atWarn().setCause(e).log("Interrupted while stopping the server");
            }
        }
        try {
            asyncExecutor.close();
        } catch (Exception e) {
            logger.atWarn()
                    .setCause(e)
                    .addArgument(asyncExecutor.getClass().getSimpleName())
                    .log("Error closing {}");
        }

        logger.atInfo().log("Event hub server stopped");
    }

    @Override
    public void close() {
        stop();
    }
}
