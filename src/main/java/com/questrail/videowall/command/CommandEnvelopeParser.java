package com.questrail.videowall.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectReader;
import com.questrail.videowall.auth.AuthFailureException;
import com.questrail.videowall.auth.MessageSigner;
import com.questrail.videowall.auth.SecretSet;
import com.questrail.videowall.time.WallClock;
import com.questrail.videowall.util.Jsons;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * CommandEnvelopeParser
 * -----------------------------------------------------------------------------
 * Extracts, freshness-checks and authenticates remote commands.
 *
 * <h2>Wire format</h2>
 * <pre>
 *   ( {json object} , signature )
 *   "(" + json + ", " + signature + ")"
 * </pre>
 *
 * <p>The JSON body is not escaped. The wrapper is matched greedily, so the
 * split falls on the last {@code "}, "} in the line; a payload that itself
 * contains that sequence at the end of a nested object is ambiguous and is
 * split there. This mirrors what senders already produce and is kept as a
 * known limitation.</p>
 *
 * <h2>Validation order</h2>
 * <ol>
 *   <li>wrapper match (otherwise "not a command", {@link Optional#empty()})</li>
 *   <li>a single JSON object with a numeric {@code time}</li>
 *   <li>{@code |now - time| <= maxSkew}</li>
 *   <li>signature over the raw JSON substring</li>
 * </ol>
 */
public final class CommandEnvelopeParser
{
    private static final Pattern WIRE = Pattern.compile("\\((\\{.+\\}), (.+)\\)");

    // A second JSON value after the object makes the payload malformed.
    private static final ObjectReader PAYLOAD_READER = Jsons.mapper().reader()
            .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private final SecretSet secrets;
    private final WallClock clock;
    private final long maxSkewSeconds;

    public CommandEnvelopeParser(SecretSet secrets, WallClock clock, Duration maxSkew)
    {
        this.secrets = Objects.requireNonNull(secrets, "secrets");
        this.clock = Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(maxSkew, "maxSkew");
        if (maxSkew.isNegative()) {
            throw new IllegalArgumentException("maxSkew must be non-negative");
        }
        this.maxSkewSeconds = maxSkew.toSeconds();
    }

    /**
     * Parses one wire line.
     *
     * @return the validated envelope, or empty if the text is not framed as a
     *         command at all
     * @throws CommandRejectedException if the text is framed as a command but
     *                                  is malformed, stale or unauthenticated
     */
    public Optional<CommandEnvelope> parse(String text)
    {
        Objects.requireNonNull(text, "text");

        Matcher m = WIRE.matcher(text);
        if (!m.matches()) {
            return Optional.empty();
        }
        String rawJson = m.group(1);
        String signature = m.group(2);

        JsonNode payload;
        try {
            payload = PAYLOAD_READER.readTree(rawJson);
        } catch (JsonProcessingException e) {
            throw new MalformedCommandException("payload is not valid JSON", e);
        }
        if (payload == null || !payload.isObject()) {
            throw new MalformedCommandException("payload is not a JSON object");
        }
        JsonNode time = payload.get("time");
        if (time == null || !time.isNumber()) {
            throw new MalformedCommandException("payload lacks a numeric time field");
        }

        double sentTime = time.doubleValue();
        double now = clock.now().toEpochMilli() / 1000.0;
        double skew = Math.abs(now - sentTime);
        if (skew > maxSkewSeconds) {
            throw new StaleCommandException(skew, maxSkewSeconds);
        }

        try {
            MessageSigner.verify(rawJson, signature, secrets);
        } catch (AuthFailureException e) {
            throw new CommandRejectedException(
                    CommandRejectedException.Reason.UNAUTHENTICATED, e.getMessage(), e);
        }

        return Optional.of(new CommandEnvelope(rawJson, payload, signature, sentTime));
    }
}
