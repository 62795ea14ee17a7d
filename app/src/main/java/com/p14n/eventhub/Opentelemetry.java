package com.p14n.eventhub;

import java.time.Duration;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;

/**
 * Exports hub spans and metrics to an OTLP collector.
 */
public class Opentelemetry {
        private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");

        public static OpenTelemetrySdk create(String serviceName, String endpoint) {
                Resource resource = Resource.getDefault()
                                .merge(Resource.create(Attributes.of(SERVICE_NAME, serviceName)));

                SdkMeterProvider meterProvider = SdkMeterProvider.builder()
                                .setResource(resource)
                                .registerMetricReader(PeriodicMetricReader.builder(
                                                OtlpGrpcMetricExporter.builder().setEndpoint(endpoint).build())
                                                .setInterval(Duration.ofSeconds(30))
                                                .build())
                                .build();

                SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                                .addSpanProcessor(BatchSpanProcessor.builder(
                                                OtlpGrpcSpanExporter.builder().setEndpoint(endpoint).build()).build())
                                .setResource(resource)
                                .build();

                return OpenTelemetrySdk.builder()
                                .setMeterProvider(meterProvider)
                                .setTracerProvider(tracerProvider)
                                .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                                .build();
        }

        /**
         * The SDK when an endpoint is configured, otherwise a no-op instance.
         */
        public static OpenTelemetry fromEndpoint(String serviceName, String endpoint) {
                if (endpoint == null || endpoint.isBlank()) {
                        return OpenTelemetry.noop();
                }
                return create(serviceName, endpoint);
        }
}
