package dev.careercrawler.notify;

/**
 * External channel alerts are delivered to.
 */
public interface AlertChannel {

    /**
     * Open a session on the channel. The caller must close it.
     *
     * @return an open session
     * @throws AlertPermissionException if the credentials or channel permissions are rejected
     * @throws AlertChannelException    if the channel cannot be reached or does not exist
     */
    AlertSession open();
}
