package dev.careercrawler.notify;

/**
 * Failure talking to the alert channel.
 */
public class AlertChannelException extends RuntimeException {

    public AlertChannelException(String message) {
        super(message);
    }

    public AlertChannelException(String message, Throwable cause) {
        super(message, cause);
    }
}
