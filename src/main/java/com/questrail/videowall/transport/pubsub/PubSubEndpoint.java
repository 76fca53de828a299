package com.questrail.videowall.transport.pubsub;

/**
 * PubSubEndpoint
 * -----------------------------------------------------------------------------
 * Port for a topic-based publish/subscribe client.
 *
 * <p>The endpoint owns the connection (including reconnects) and nothing
 * else. Subscriptions do not survive a reconnect; the listener re-issues them
 * from {@link PubSubListener#onConnected()}.</p>
 */
public interface PubSubEndpoint
{
    /**
     * Begin connecting. Returns immediately; the listener learns of the
     * connection through {@link PubSubListener#onConnected()}.
     */
    void start();

    /**
     * Disconnect and release all transport resources. No reconnect follows.
     */
    void stop();

    /**
     * Subscribe to a topic at most-once delivery. Ignored while disconnected.
     */
    void subscribe(String topic);

    /**
     * Publish at most once. Dropped while disconnected.
     */
    void publish(String topic, byte[] payload);

    /**
     * Register the listener. Must be called before {@link #start()}.
     */
    void setListener(PubSubListener listener);
}
