package dev.careercrawler.notify;

/**
 * The channel rejected our credentials or permissions. Retrying another message will not help.
 */
public class AlertPermissionException extends AlertChannelException {

    public AlertPermissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
