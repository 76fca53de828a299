package com.questrail.videowall.auth;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Base64;
import java.util.Locale;
import java.util.Objects;
import java.util.zip.CRC32;

/**
 * TokenCodec
 * -----------------------------------------------------------------------------
 * Self-checking text format for shared secrets handed out to operators.
 *
 * <pre>
 *   magld_ + base64(secret, unpadded) + base64(crc32le(secret), unpadded)
 * </pre>
 *
 * <p>The trailing six characters are the unpadded base64 form of the CRC-32 of
 * the secret bytes, encoded little-endian. A token can therefore be validated
 * locally before it is ever used to sign a command.</p>
 */
public final class TokenCodec
{
    public static final String PREFIX = "magld_";

    /** Minimum length of the base64 secret body. */
    static final int MIN_BODY_LENGTH = 2;

    /** Length of the unpadded base64 encoding of a 4-byte checksum. */
    static final int CHECKSUM_LENGTH = 6;

    private static final Base64.Encoder ENCODER = Base64.getEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getDecoder();

    private TokenCodec() {}

    /**
     * Decodes and validates a token.
     *
     * @param token token text; trailing whitespace is ignored
     * @return the raw secret bytes
     * @throws InvalidTokenException if the token is malformed or its checksum
     *                               does not match
     */
    public static byte[] decode(String token)
    {
        Objects.requireNonNull(token, "token");
        String text = token.stripTrailing();

        if (text.length() < PREFIX.length() + MIN_BODY_LENGTH + CHECKSUM_LENGTH) {
            throw new InvalidTokenException("token too short");
        }
        String prefix = text.substring(0, PREFIX.length());
        if (!prefix.toLowerCase(Locale.ROOT).equals(PREFIX)) {
            throw new InvalidTokenException("token prefix mismatch");
        }

        String body = text.substring(PREFIX.length(), text.length() - CHECKSUM_LENGTH);
        String checksum = text.substring(text.length() - CHECKSUM_LENGTH);

        final byte[] secret;
        try {
            secret = DECODER.decode(pad(body));
        } catch (IllegalArgumentException e) {
            throw new InvalidTokenException("token body is not valid base64", e);
        }

        if (!checksumOf(secret).equals(checksum)) {
            throw new InvalidTokenException("token checksum mismatch");
        }
        return secret;
    }

    /**
     * Encodes a secret as a token. {@link #decode(String)} is its inverse.
     */
    public static String encode(byte[] secret)
    {
        Objects.requireNonNull(secret, "secret");
        return PREFIX + ENCODER.encodeToString(secret) + checksumOf(secret);
    }

    static String checksumOf(byte[] secret)
    {
        CRC32 crc = new CRC32();
        crc.update(secret);
        byte[] le = ByteBuffer.allocate(Integer.BYTES)
                .order(ByteOrder.LITTLE_ENDIAN)
                .putInt((int) crc.getValue())
                .array();
        return ENCODER.encodeToString(le);
    }

    private static String pad(String body)
    {
        int missing = (4 - body.length() % 4) % 4;
        return body + "=".repeat(missing);
    }
}
