package com.p14n.eventhub.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongUpDownCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * Manages OpenTelemetry metrics for event hub operations.
 *
 * <p>
 * Every instrument carries the event type as the {@code event_type} attribute:
 * </p>
 * <ul>
 * <li>events_published: events accepted for fan-out</li>
 * <li>events_delivered: events written to a subscriber channel</li>
 * <li>queue_overflows: records refused because the subscriber queue was stale
 * or full</li>
 * <li>storage_errors: failed storage calls, before retry</li>
 * <li>connected_subscribers: streaming loops currently attached</li>
 * </ul>
 */
public class HubMetrics {
        private static final AttributeKey<String> EVENT_TYPE = AttributeKey.stringKey("event_type");

        private final LongCounter publishedEvents;
        private final LongCounter deliveredEvents;
        private final LongCounter queueOverflows;
        private final LongCounter storageErrors;
        private final LongUpDownCounter connectedSubscribers;

        /**
         * Creates a new HubMetrics instance with the provided OpenTelemetry meter.
         *
         * @param meter OpenTelemetry meter used to create the metric instruments
         */
        public HubMetrics(Meter meter) {
                publishedEvents = meter.counterBuilder("events_published")
                                .setDescription("Number of events published to the hub")
                                .build();

                deliveredEvents = meter.counterBuilder("events_delivered")
                                .setDescription("Number of events written to subscribers")
                                .build();

                queueOverflows = meter.counterBuilder("queue_overflows")
                                .setDescription("Number of records refused by a stale or full queue")
                                .build();

                storageErrors = meter.counterBuilder("storage_errors")
                                .setDescription("Number of failed storage operations")
                                .build();

                connectedSubscribers = meter.upDownCounterBuilder("connected_subscribers")
                                .setDescription("Number of connected subscribers")
                                .build();
        }

        public void recordPublished(String eventType) {
                publishedEvents.add(1, Attributes.of(EVENT_TYPE, eventType));
        }

        public void recordDelivered(String eventType) {
                deliveredEvents.add(1, Attributes.of(EVENT_TYPE, eventType));
        }

        public void recordOverflow(String eventType) {
                queueOverflows.add(1, Attributes.of(EVENT_TYPE, eventType));
        }

        public void recordStorageError(String eventType) {
                storageErrors.add(1, Attributes.of(EVENT_TYPE, eventType));
        }

        public void recordSubscriberConnected(String eventType) {
                connectedSubscribers.add(1, Attributes.of(EVENT_TYPE, eventType));
        }

        public void recordSubscriberDisconnected(String eventType) {
                connectedSubscribers.add(-1, Attributes.of(EVENT_TYPE, eventType));
        }
}
