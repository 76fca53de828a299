package com.questrail.videowall.config;

/**
 * Configuration could not be read or is invalid. Fatal at start-up.
 */
public final class ConfigException extends Exception
{
    public ConfigException(String message)
    {
        super(message);
    }

    public ConfigException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
