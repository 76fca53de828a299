package com.questrail.videowall.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * SecretSet
 * -----------------------------------------------------------------------------
 * Ordered, read-only collection of decoded shared secrets.
 *
 * <p>Built once at start-up. Tokens that fail to decode are logged and left
 * out; they never abort start-up. An empty set is legal but rejects every
 * signature.</p>
 */
public final class SecretSet implements Iterable<byte[]>
{
    private static final Logger log = LoggerFactory.getLogger(SecretSet.class);

    private final List<byte[]> secrets;

    private SecretSet(List<byte[]> secrets) {
        this.secrets = List.copyOf(secrets);
    }

    public static SecretSet fromTokens(List<String> tokens)
    {
        Objects.requireNonNull(tokens, "tokens");

        List<byte[]> decoded = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            try {
                decoded.add(TokenCodec.decode(tokens.get(i)));
            } catch (InvalidTokenException e) {
                log.error("Token #{} not accepted: {}", i, e.getMessage());
            }
        }

        if (decoded.isEmpty()) {
            log.error("No tokens accepted; every remote command will be rejected");
        } else {
            log.debug("Decoded {} of {} tokens", decoded.size(), tokens.size());
        }
        return new SecretSet(decoded);
    }

    public static SecretSet of(byte[]... secrets)
    {
        List<byte[]> list = new ArrayList<>();
        for (byte[] secret : secrets) {
            list.add(secret.clone());
        }
        return new SecretSet(list);
    }

    public int size()
    {
        return secrets.size();
    }

    public boolean isEmpty()
    {
        return secrets.isEmpty();
    }

    @Override
    public Iterator<byte[]> iterator()
    {
        Iterator<byte[]> delegate = secrets.iterator();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return delegate.hasNext();
            }

            @Override
            public byte[] next() {
                return delegate.next().clone();
            }
        };
    }
}
