package org.rtmvideo.remote.core;

/**
 * Failure kinds reported by rtm clients. Codes are stable, 0 is never used.
 */
public enum ClientError {
    UNKNOWN(1, "unknown error"),
    NOT_CONNECTED(2, "client is not connected"),
    RESPONSE_PARSING_ERROR(3, "failed to parse response"),
    INVALID_RESPONSE(4, "invalid response"),
    SUBSCRIPTION_ERROR(5, "subscription error"),
    SUBSCRIBE_ERROR(6, "subscribe error"),
    UNSUBSCRIBE_ERROR(7, "unsubscribe error"),
    TRANSPORT_ERROR(8, "transport error"),
    INVALID_MESSAGE(9, "invalid message"),
    PUBLISH_ERROR(10, "publish error");

    private final int code;
    private final String defaultMessage;

    ClientError(int code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public int getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public ErrorCondition condition() {
        return new ErrorCondition(this, defaultMessage);
    }

    public ErrorCondition condition(String message) {
        return new ErrorCondition(this, message);
    }

    public static ClientError fromCode(int code) {
        for (ClientError error : values()) {
            if (error.code == code) {
                return error;
            }
        }
        return UNKNOWN;
    }
}
