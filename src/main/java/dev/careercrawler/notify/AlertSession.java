package dev.careercrawler.notify;

/**
 * An open connection to an alert channel.
 */
public interface AlertSession extends AutoCloseable {

    /**
     * Send one message and wait for the channel to confirm it.
     *
     * @throws AlertPermissionException if the channel refuses the message for lack of permission
     * @throws AlertDeliveryException   on any other delivery failure
     */
    void send(String message);

    @Override
    void close();
}
