package io.harvestcore.model;

public final class CoordinationException extends RuntimeException {
    private final ErrorKind kind;

    public CoordinationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CoordinationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
