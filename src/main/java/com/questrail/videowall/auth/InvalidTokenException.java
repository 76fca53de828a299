package com.questrail.videowall.auth;

/**
 * Indicates that a shared-secret token could not be decoded.
 *
 * This typically reflects:
 * <ul>
 *   <li>Text too short or carrying the wrong prefix</li>
 *   <li>A body that is not valid base64</li>
 *   <li>A checksum suffix that does not match the decoded secret</li>
 * </ul>
 */
public final class InvalidTokenException extends RuntimeException
{
    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
