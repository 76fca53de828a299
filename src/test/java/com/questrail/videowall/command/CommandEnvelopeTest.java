package com.questrail.videowall.command;

import com.questrail.videowall.util.Jsons;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CommandEnvelopeTest {

    private static RemoteCommand commandOf(String json) throws Exception {
        return new CommandEnvelope(json, Jsons.mapper().readTree(json), "sig", 0).command();
    }

    @Test
    void restartTakesPrecedence() throws Exception {
        assertEquals(new RemoteCommand.Restart(), commandOf("{\"time\": 0, \"restart\": 1, \"auto\": 1, \"force\": 0}"));
    }

    @Test
    void falsyRestartIsNoOpEvenWithOtherFields() throws Exception {
        assertEquals(new RemoteCommand.NoOp(), commandOf("{\"time\": 0, \"restart\": 0, \"force\": 1}"));
    }

    @Test
    void autoBeforeForce() throws Exception {
        assertEquals(new RemoteCommand.EnableAutomatic(), commandOf("{\"time\": 0, \"auto\": true, \"force\": 0}"));
        assertEquals(new RemoteCommand.EnableAutomatic(), commandOf("{\"time\": 0, \"auto\": 1}"));
    }

    @Test
    void autoOtherThanTrueFallsThroughToForce() throws Exception {
        assertEquals(new RemoteCommand.ForceDisplay(false), commandOf("{\"time\": 0, \"auto\": 0, \"force\": 0}"));
        assertEquals(new RemoteCommand.NoOp(), commandOf("{\"time\": 0, \"auto\": 2}"));
    }

    @Test
    void forceUsesTruthiness() throws Exception {
        assertEquals(new RemoteCommand.ForceDisplay(true), commandOf("{\"time\": 0, \"force\": \"yes\"}"));
        assertEquals(new RemoteCommand.ForceDisplay(false), commandOf("{\"time\": 0, \"force\": null}"));
    }

    @Test
    void emptyPayloadIsNoOp() throws Exception {
        assertEquals(new RemoteCommand.NoOp(), commandOf("{\"time\": 0}"));
    }
}
