package dev.careercrawler.notify;

/**
 * A single message could not be delivered; later messages may still succeed.
 */
public class AlertDeliveryException extends AlertChannelException {

    public AlertDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
