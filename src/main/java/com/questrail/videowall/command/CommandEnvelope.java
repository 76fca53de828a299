package com.questrail.videowall.command;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.videowall.util.Jsons;

import java.util.Objects;

/**
 * CommandEnvelope
 * -----------------------------------------------------------------------------
 * A command payload together with its detached signature.
 *
 * @param rawJson   the JSON text exactly as received; signatures cover these
 *                  bytes, never a re-serialization of {@link #payload()}
 * @param payload   the parsed JSON object
 * @param signature base64 HMAC presented by the sender
 * @param sentTime  the payload's {@code time} field, epoch seconds
 */
public record CommandEnvelope(String rawJson, JsonNode payload, String signature, double sentTime)
{
    public CommandEnvelope {
        Objects.requireNonNull(rawJson, "rawJson");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(signature, "signature");
    }

    /**
     * Interprets the payload.
     */
    public RemoteCommand command()
    {
        if (payload.has("restart")) {
            return Jsons.truthy(payload.get("restart"))
                    ? new RemoteCommand.Restart()
                    : new RemoteCommand.NoOp();
        }
        if (payload.has("auto") && isTrue(payload.get("auto"))) {
            return new RemoteCommand.EnableAutomatic();
        }
        if (payload.has("force")) {
            return new RemoteCommand.ForceDisplay(Jsons.truthy(payload.get("force")));
        }
        return new RemoteCommand.NoOp();
    }

    private static boolean isTrue(JsonNode node)
    {
        return (node.isBoolean() && node.booleanValue())
                || (node.isNumber() && node.doubleValue() == 1.0);
    }
}
