package io.harvestcore.model;

import java.sql.SQLException;

/**
 * Store failure tagged with how the caller should react to it.
 */
public final class StoreException extends RuntimeException {
    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;
    private static final int SQLITE_IOERR = 10;
    private static final int SQLITE_PROTOCOL = 15;

    private final ErrorKind kind;

    public StoreException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static StoreException from(String message, SQLException cause) {
        return new StoreException(classify(cause), message, cause);
    }

    public ErrorKind kind() {
        return kind;
    }

    public boolean isTransient() {
        return kind == ErrorKind.TRANSIENT;
    }

    static ErrorKind classify(SQLException e) {
        // Extended result codes keep the primary code in the low byte.
        int primary = e.getErrorCode() & 0xff;
        if (primary == SQLITE_BUSY || primary == SQLITE_LOCKED
                || primary == SQLITE_IOERR || primary == SQLITE_PROTOCOL) {
            return ErrorKind.TRANSIENT;
        }
        String state = e.getSQLState();
        if (state != null && state.startsWith("08")) {
            return ErrorKind.TRANSIENT;
        }
        return ErrorKind.FATAL;
    }
}
