package com.questrail.videowall.auth;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.Objects;

/**
 * MessageSigner
 * -----------------------------------------------------------------------------
 * HMAC-SHA256 signatures over command text, rendered as unpadded base64.
 *
 * <p>Verification accepts a signature produced by <em>any</em> secret in the
 * supplied {@link SecretSet}, so a secret can be rotated in without
 * invalidating senders that still hold the previous one.</p>
 */
public final class MessageSigner
{
    private static final String ALGORITHM = "HmacSHA256";
    private static final Base64.Encoder ENCODER = Base64.getEncoder().withoutPadding();

    private MessageSigner() {}

    public static String sign(String message, byte[] secret)
    {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(secret, "secret");
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret, ALGORITHM));
            byte[] digest = mac.doFinal(message.getBytes(StandardCharsets.UTF_8));
            return ENCODER.encodeToString(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    /**
     * Verifies {@code signature} over {@code message}.
     *
     * @throws AuthFailureException if no secret in {@code secrets} produces
     *                              the same signature
     */
    public static void verify(String message, String signature, SecretSet secrets)
    {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(secrets, "secrets");

        byte[] presented = signature.getBytes(StandardCharsets.US_ASCII);
        for (byte[] secret : secrets) {
            byte[] expected = sign(message, secret).getBytes(StandardCharsets.US_ASCII);
            if (MessageDigest.isEqual(expected, presented)) {
                return;
            }
        }
        throw new AuthFailureException("signature does not match any accepted secret");
    }
}
