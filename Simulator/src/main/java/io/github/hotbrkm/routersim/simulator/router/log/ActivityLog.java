package io.github.hotbrkm.routersim.simulator.router.log;

/**
 * Append-only sink for router activity records.
 */
public interface ActivityLog {

    /**
     * Appends one record.
     *
     * @param record record to append
     * @throws ActivityLogException if the record cannot be written
     */
    void append(ActivityRecord record);

    /**
     * Closes resources.
     */
    void close();

    static ActivityLog noOp() {
        return NoOpActivityLog.INSTANCE;
    }
}
