package io.github.hotbrkm.routersim.simulator.router.log;

/**
 * Kinds of records written to the activity log.
 */
public enum ActivityEvent {
    ADD, DEL, FWD, DROP
}
