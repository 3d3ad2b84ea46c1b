package io.harvestcore.model;

import java.io.IOException;

/**
 * Failure taxonomy shared by the queue, the workers and the pipeline driver.
 */
public enum ErrorKind {
    /** Store timeout or disconnect, or an upstream outage; retry the whole operation. */
    TRANSIENT,
    /** Processing of one item failed; goes through retry backoff. */
    BUSINESS,
    /** Misconfiguration or unreachable store; propagate immediately. */
    FATAL;

    /** Kind of a thrown failure: tagged exceptions keep their kind, I/O is transient, anything else is business. */
    public static ErrorKind of(Throwable t) {
        if (t instanceof CoordinationException ce) {
            return ce.kind();
        }
        if (t instanceof StoreException se) {
            return se.kind();
        }
        if (t instanceof IOException) {
            return TRANSIENT;
        }
        return BUSINESS;
    }
}
