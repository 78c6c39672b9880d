package org.rtmvideo.remote.core;

/**
 * A tagged failure with diagnostic text. Two conditions are equal when their
 * tags are equal, the message is never compared.
 */
public final class ErrorCondition {

    private final ClientError error;
    private final String message;

    public ErrorCondition(ClientError error, String message) {
        if (error == null) {
            throw new IllegalArgumentException("error tag is required");
        }
        this.error = error;
        this.message = message != null ? message : error.getDefaultMessage();
    }

    public ClientError getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    public boolean is(ClientError tag) {
        return error == tag;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ErrorCondition)) return false;
        return error == ((ErrorCondition) o).error;
    }

    @Override
    public int hashCode() {
        return error.hashCode();
    }

    @Override
    public String toString() {
        return error + "(" + error.getCode() + "): " + message;
    }
}
