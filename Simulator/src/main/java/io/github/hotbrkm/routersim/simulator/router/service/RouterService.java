package io.github.hotbrkm.routersim.simulator.router.service;

import io.github.hotbrkm.routersim.simulator.router.log.ActivityLog;
import io.github.hotbrkm.routersim.simulator.router.log.ActivityRecord;
import io.github.hotbrkm.routersim.simulator.router.metrics.RouterMetricsRecorder;
import io.github.hotbrkm.routersim.simulator.router.model.ForwardResult;
import io.github.hotbrkm.routersim.simulator.router.model.ForwardingDecision;
import io.github.hotbrkm.routersim.simulator.router.model.Ipv4Prefix;
import io.github.hotbrkm.routersim.simulator.router.model.Packet;
import io.github.hotbrkm.routersim.simulator.router.model.RouteEntry;
import io.github.hotbrkm.routersim.simulator.router.table.RoutingTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.Supplier;

/**
 * Router operations used by the command shell.
 * <p>
 * Every argument is parsed before the table is touched, so rejected input leaves the table
 * unchanged and writes no activity record. Each successful operation except listing writes
 * exactly one record.
 */
@Slf4j
@RequiredArgsConstructor
public class RouterService {

    private final RoutingTable routingTable;
    private final PacketForwarder packetForwarder;
    private final ActivityLog activityLog;
    private final RouterMetricsRecorder metricsRecorder;

    /**
     * Adds a static route.
     *
     * @param networkText destination network, e.g. "192.168.1.0/24"
     * @param gatewayText next hop, e.g. "192.168.1.1"
     * @param metric      non-negative cost
     * @return the stored route (network already masked)
     * @throws io.github.hotbrkm.routersim.simulator.router.exception.RouteInputException if an address is invalid
     * @throws IllegalArgumentException if the metric is negative
     */
    public RouteEntry addRoute(String networkText, String gatewayText, int metric) {
        RouteEntry route = validated("add",
                () -> new RouteEntry(Ipv4Prefix.parse(networkText), Ipv4Prefix.parse(gatewayText), metric));

        routingTable.insert(route);
        activityLog.append(ActivityRecord.added(route));
        metricsRecorder.recordRouteAdded();

        log.info("Route added - network: {}, gateway: {}, metric: {}", route.network(), route.gateway(), route.metric());
        return route;
    }

    /**
     * Removes every route whose network exactly matches the given network and prefix length.
     *
     * @param networkText network to remove
     * @return number of removed routes, 0 if none matched
     */
    public int deleteRoute(String networkText) {
        Ipv4Prefix network = validated("del", () -> Ipv4Prefix.parse(networkText));

        int removed = routingTable.remove(network);
        activityLog.append(ActivityRecord.deleted(network, removed));
        metricsRecorder.recordRoutesRemoved(removed);

        if (removed > 0) {
            log.info("Route removed - network: {}, count: {}", network, removed);
        } else {
            log.info("Route not found - network: {}", network);
        }
        return removed;
    }

    /**
     * Returns the routes ordered by ascending metric for display.
     *
     * @return sorted snapshot, empty when the table has no routes
     */
    public List<RouteEntry> listRoutes() {
        return routingTable.sortedByMetric();
    }

    /**
     * Simulates sending a packet and decides whether it would be forwarded.
     *
     * @param sourceText      source address
     * @param destinationText destination address
     * @param protocol        protocol label, e.g. "ICMP"
     * @return the packet and the forwarding decision
     */
    public ForwardResult forward(String sourceText, String destinationText, String protocol) {
        Packet packet = validated("send",
                () -> new Packet(Ipv4Prefix.parse(sourceText), Ipv4Prefix.parse(destinationText), protocol));

        ForwardingDecision decision = packetForwarder.decide(packet.destination());
        ForwardResult result = new ForwardResult(packet, decision);

        activityLog.append(ActivityRecord.forwarded(result));
        metricsRecorder.recordForwardResult(result);

        if (decision.isForwarded()) {
            log.info("Packet forwarded - {}, route: {}", packet, decision.route().network());
        } else {
            log.info("Packet dropped - {}, no matching route", packet);
        }
        return result;
    }

    private <T> T validated(String operation, Supplier<T> parser) {
        try {
            return parser.get();
        } catch (IllegalArgumentException e) {
            metricsRecorder.recordRejected(operation, e);
            log.debug("Rejected {} request: {}", operation, e.getMessage());
            throw e;
        }
    }
}
