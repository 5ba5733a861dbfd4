package io.github.hotbrkm.routersim.simulator.router.log;

final class NoOpActivityLog implements ActivityLog {

    static final NoOpActivityLog INSTANCE = new NoOpActivityLog();

    private NoOpActivityLog() {
    }

    @Override
    public void append(ActivityRecord record) {
        // discard
    }

    @Override
    public void close() {
        // nothing to release
    }
}
