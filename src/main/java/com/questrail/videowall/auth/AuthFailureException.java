package com.questrail.videowall.auth;

/**
 * Indicates that a message signature did not verify against any accepted
 * secret.
 */
public final class AuthFailureException extends RuntimeException
{
    public AuthFailureException(String message) {
        super(message);
    }
}
