package com.questrail.videowall.transport.pubsub;

/**
 * Callback sink for {@link PubSubEndpoint}.
 */
public interface PubSubListener
{
    /** Severity of a client diagnostic passed to {@link #onLog}. */
    enum LogLevel
    {
        DEBUG, INFO, NOTICE, ERROR
    }

    /** The broker accepted the session. */
    void onConnected();

    /**
     * The session ended.
     *
     * @param cause diagnostic cause; {@code null} for orderly shutdown
     */
    void onDisconnected(Throwable cause);

    void onMessage(String topic, byte[] payload);

    /**
     * Client diagnostics (connect attempts, acknowledgements, keep-alive).
     */
    void onLog(LogLevel level, String message);
}
