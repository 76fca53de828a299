package com.questrail.videowall.engine;

/**
 * Indicates that a render engine could not be launched or driven.
 */
public final class EngineException extends RuntimeException
{
    public EngineException(String message) {
        super(message);
    }

    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
