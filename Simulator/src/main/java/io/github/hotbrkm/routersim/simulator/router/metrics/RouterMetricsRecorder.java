package io.github.hotbrkm.routersim.simulator.router.metrics;

import io.github.hotbrkm.routersim.simulator.router.model.ForwardResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class RouterMetricsRecorder {

    public static final String ROUTE_ADDED = "router.route.added";
    public static final String ROUTE_REMOVED = "router.route.removed";
    public static final String PACKET_FORWARDED = "router.packet.forwarded";
    public static final String PACKET_DROPPED = "router.packet.dropped";
    public static final String COMMAND_REJECTED = "router.command.rejected";

    private final MeterRegistry registry;

    public RouterMetricsRecorder(MeterRegistry registry) {
        this.registry = registry == null ? new SimpleMeterRegistry() : registry;
    }

    public void recordRouteAdded() {
        registry.counter(ROUTE_ADDED).increment();
    }

    public void recordRoutesRemoved(int count) {
        if (count <= 0) {
            return;
        }
        registry.counter(ROUTE_REMOVED).increment(count);
    }

    public void recordForwardResult(ForwardResult result) {
        if (result == null) {
            return;
        }

        if (result.isForwarded()) {
            registry.counter(PACKET_FORWARDED,
                    "protocol", safe(result.packet().protocol()))
                    .increment();
        } else {
            registry.counter(PACKET_DROPPED,
                    "protocol", safe(result.packet().protocol()))
                    .increment();
        }
    }

    public void recordRejected(String operation, RuntimeException error) {
        registry.counter(COMMAND_REJECTED,
                "operation", safe(operation),
                "error", error == null ? "none" : error.getClass().getSimpleName())
                .increment();
    }

    private String safe(String value) {
        return value == null || value.isBlank() ? "none" : value;
    }
}
