package io.github.hotbrkm.routersim.simulator.router.model;

import java.util.Objects;

/**
 * Static route: destination network, next-hop gateway and a cost metric.
 * <p>
 * The metric only orders the table for display; it never affects route selection.
 *
 * @param network destination network
 * @param gateway next-hop address, conventionally a /32 host address
 * @param metric  non-negative cost
 */
public record RouteEntry(Ipv4Prefix network, Ipv4Prefix gateway, int metric) {

    public RouteEntry {
        Objects.requireNonNull(network, "network must not be null");
        Objects.requireNonNull(gateway, "gateway must not be null");
        if (metric < 0) {
            throw new IllegalArgumentException("Metric must not be negative: " + metric);
        }
    }

    public boolean matches(Ipv4Prefix destination) {
        return network.contains(destination);
    }

    public int prefixLength() {
        return network.prefixLength();
    }

    @Override
    public String toString() {
        return "Network: " + network + ", Gateway: " + gateway + ", Metric: " + metric;
    }
}
