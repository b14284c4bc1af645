package com.myorg.replybus.contracts.exception;

/**
 * A failure that retrying the publish cannot fix. {@link #getReason()} is a stable code callers
 * can branch on, e.g. {@link MissingDestinationException#REASON}.
 */
public class ReplyBusNonRetryableException extends RuntimeException {

    private final String reason;

    public ReplyBusNonRetryableException(String reason, String message) {
        this(reason, message, null);
    }

    public ReplyBusNonRetryableException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
