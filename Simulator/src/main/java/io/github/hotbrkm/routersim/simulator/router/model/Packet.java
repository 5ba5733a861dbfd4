package io.github.hotbrkm.routersim.simulator.router.model;

import java.util.Objects;

/**
 * Simulated packet, built per send request and never retained.
 */
public record Packet(Ipv4Prefix source, Ipv4Prefix destination, String protocol) {

    public Packet {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(destination, "destination must not be null");
        if (protocol == null || protocol.isBlank()) {
            throw new IllegalArgumentException("Protocol must not be empty");
        }
    }

    @Override
    public String toString() {
        return "Packet from " + source + " to " + destination + " [" + protocol + "]";
    }
}
