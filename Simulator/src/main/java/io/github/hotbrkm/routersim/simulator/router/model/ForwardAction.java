package io.github.hotbrkm.routersim.simulator.router.model;

public enum ForwardAction {
    FORWARD, DROP
}
