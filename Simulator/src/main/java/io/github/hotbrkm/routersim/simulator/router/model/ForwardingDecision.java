package io.github.hotbrkm.routersim.simulator.router.model;

/**
 * Verdict for a destination address: forward through the gateway of the selected route, or drop.
 *
 * @param action forward or drop
 * @param route  selected route, null when dropped
 */
public record ForwardingDecision(ForwardAction action, RouteEntry route) {

    private static final ForwardingDecision DROP = new ForwardingDecision(ForwardAction.DROP, null);

    /**
     * Creates a forward decision through the given route.
     * @param route winning route
     * @return forward decision
     */
    public static ForwardingDecision forward(RouteEntry route) {
        if (route == null) {
            throw new IllegalArgumentException("route must not be null for a forward decision");
        }
        return new ForwardingDecision(ForwardAction.FORWARD, route);
    }

    /**
     * Creates a drop decision.
     * @return drop decision
     */
    public static ForwardingDecision drop() {
        return DROP;
    }

    public boolean isForwarded() {
        return action == ForwardAction.FORWARD;
    }

    /**
     * Returns the next hop of the selected route.
     * @return gateway, or null if the packet is dropped
     */
    public Ipv4Prefix gateway() {
        return route == null ? null : route.gateway();
    }
}
