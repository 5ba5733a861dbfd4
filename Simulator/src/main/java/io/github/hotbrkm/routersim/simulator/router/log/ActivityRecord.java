package io.github.hotbrkm.routersim.simulator.router.log;

import io.github.hotbrkm.routersim.simulator.router.model.ForwardResult;
import io.github.hotbrkm.routersim.simulator.router.model.Ipv4Prefix;
import io.github.hotbrkm.routersim.simulator.router.model.RouteEntry;

/**
 * One activity log line, rendered as {@code <EVENT> <detail>}.
 */
public record ActivityRecord(ActivityEvent event, String detail) {

    public static ActivityRecord added(RouteEntry route) {
        return new ActivityRecord(ActivityEvent.ADD,
                route.network() + " via " + route.gateway() + " metric " + route.metric());
    }

    public static ActivityRecord deleted(Ipv4Prefix network, int removedCount) {
        return new ActivityRecord(ActivityEvent.DEL, network + " removed " + removedCount);
    }

    public static ActivityRecord forwarded(ForwardResult result) {
        if (result.isForwarded()) {
            return new ActivityRecord(ActivityEvent.FWD, result.packet() + " via " + result.decision().gateway());
        }
        return new ActivityRecord(ActivityEvent.DROP, result.packet().toString());
    }

    public String toLine() {
        return event.name() + " " + detail;
    }
}
