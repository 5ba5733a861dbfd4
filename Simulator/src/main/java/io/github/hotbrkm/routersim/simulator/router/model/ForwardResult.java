package io.github.hotbrkm.routersim.simulator.router.model;

/**
 * Outcome of a send request: the packet that was built and the decision taken for it.
 */
public record ForwardResult(Packet packet, ForwardingDecision decision) {

    public boolean isForwarded() {
        return decision.isForwarded();
    }
}
