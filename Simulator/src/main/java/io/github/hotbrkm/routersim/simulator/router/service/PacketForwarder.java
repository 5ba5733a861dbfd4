package io.github.hotbrkm.routersim.simulator.router.service;

import io.github.hotbrkm.routersim.simulator.router.model.ForwardingDecision;
import io.github.hotbrkm.routersim.simulator.router.model.Ipv4Prefix;
import io.github.hotbrkm.routersim.simulator.router.model.RouteEntry;
import io.github.hotbrkm.routersim.simulator.router.table.RoutingTable;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether a packet for a destination is forwarded, and through which gateway.
 * Reads the routing table only.
 */
@Slf4j
public class PacketForwarder {

    private final RoutingTable routingTable;

    public PacketForwarder(RoutingTable routingTable) {
        this.routingTable = Objects.requireNonNull(routingTable, "routingTable must not be null");
    }

    public ForwardingDecision decide(Ipv4Prefix destination) {
        Optional<RouteEntry> route = routingTable.findBestMatch(destination);
        log.debug("Lookup {} -> {}", destination, route.map(RouteEntry::network).orElse(null));
        return route.map(ForwardingDecision::forward)
                .orElseGet(ForwardingDecision::drop);
    }
}
